/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.chatbridge.status;

import io.chatbridge.log.LogContext;
import io.chatbridge.page.ControlEndpoint;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically probes the control endpoint so status reads can report
 * reachability without making a network call themselves.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    private final ControlEndpoint endpoint;
    private final Duration interval;
    private ScheduledExecutorService scheduler;
    private volatile Boolean lastResult;
    private volatile Instant lastCheckedAt;

    public HealthMonitor(ControlEndpoint endpoint, Duration interval) {
        this.endpoint = endpoint;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chatbridge-health");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safeCheck, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.debug("health monitor started, interval {} ms", interval.toMillis());
    }

    private void safeCheck() {
        try {
            check();
        } catch (RuntimeException e) {
            // an exception escaping here cancels the schedule
            logger.warn("health check failed: {}", e.getMessage());
            lastResult = false;
            lastCheckedAt = Instant.now();
        }
    }

    public boolean check() {
        boolean reachable = endpoint.isReachable();
        Boolean previous = lastResult;
        lastResult = reachable;
        lastCheckedAt = Instant.now();
        if (previous != null && previous != reachable) {
            if (reachable) {
                logger.info("control endpoint {} is reachable again", endpoint.getAddress());
            } else {
                logger.warn("control endpoint {} became unreachable", endpoint.getAddress());
            }
        }
        return reachable;
    }

    /**
     * Null until the first check completes.
     */
    public Boolean getLastResult() {
        return lastResult;
    }

    public Instant getLastCheckedAt() {
        return lastCheckedAt;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

}
