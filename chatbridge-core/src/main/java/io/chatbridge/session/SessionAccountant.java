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
package io.chatbridge.session;

import io.chatbridge.log.LogContext;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of per-provider running statistics. Only completed, successful
 * interactions are recorded; {@link #reset(String)} starts a fresh session.
 *
 * <p>Averages are arithmetic means over every recorded turn. The response-time
 * average is rounded half-up to whole milliseconds.</p>
 */
public class SessionAccountant {

    private static final Logger logger = LogContext.INTERACTION_LOGGER;

    /**
     * Below this, elapsed time is too small to derive a meaningful velocity.
     */
    public static final long MIN_ELAPSED_MS = 10;

    private final TokenEstimator estimator;
    private final Clock clock;
    private final Map<String, Accumulator> accumulators = new ConcurrentHashMap<>();
    private final Map<String, Integer> contextWindows = new ConcurrentHashMap<>();

    public SessionAccountant() {
        this(new CharLengthTokenEstimator(), Clock.systemUTC());
    }

    public SessionAccountant(TokenEstimator estimator, Clock clock) {
        this.estimator = estimator;
        this.clock = clock;
    }

    public TokenEstimator getEstimator() {
        return estimator;
    }

    public void setContextWindow(String provider, int tokens) {
        contextWindows.put(provider, tokens);
        accumulator(provider);
    }

    public SessionStats record(String provider, String sentText, String responseText, long elapsedMs) {
        int sent = estimator.estimate(sentText);
        int received = estimator.estimate(responseText);
        double velocity = elapsedMs < MIN_ELAPSED_MS ? 0 : received / (elapsedMs / 1000.0);
        SessionStats stats = accumulator(provider).add(sent, received, elapsedMs, velocity, clock.instant());
        logger.debug("turn {} for {}: sent={} received={} tokens, {} ms, {} tok/s",
                stats.turnCount(), provider, sent, received, elapsedMs, String.format("%.1f", velocity));
        return stats;
    }

    public void reset(String provider) {
        accumulator(provider).reset(clock.instant());
        logger.info("session counters reset for {}", provider);
    }

    /**
     * Read-only: a provider with no accumulated session yet gets empty stats
     * and is not registered.
     */
    public SessionStats snapshot(String provider) {
        Accumulator accumulator = accumulators.get(provider);
        if (accumulator == null) {
            return SessionStats.empty(provider, contextWindows.getOrDefault(provider, 0), clock.instant());
        }
        return accumulator.snapshot();
    }

    boolean isTracked(String provider) {
        return accumulators.containsKey(provider);
    }

    private Accumulator accumulator(String provider) {
        return accumulators.computeIfAbsent(provider, p -> new Accumulator(p, clock.instant()));
    }

    private class Accumulator {

        private final String provider;
        private int turns;
        private long sentTokens;
        private long responseTokens;
        private long lastElapsedMs;
        private double lastVelocity;
        private long totalElapsedMs;
        private double totalVelocity;
        private Instant startedAt;
        private Instant lastAt;

        Accumulator(String provider, Instant startedAt) {
            this.provider = provider;
            this.startedAt = startedAt;
        }

        synchronized SessionStats add(int sent, int received, long elapsedMs, double velocity, Instant at) {
            turns++;
            sentTokens += sent;
            responseTokens += received;
            lastElapsedMs = elapsedMs;
            lastVelocity = velocity;
            totalElapsedMs += elapsedMs;
            totalVelocity += velocity;
            lastAt = at;
            return snapshot();
        }

        synchronized void reset(Instant at) {
            turns = 0;
            sentTokens = 0;
            responseTokens = 0;
            lastElapsedMs = 0;
            lastVelocity = 0;
            totalElapsedMs = 0;
            totalVelocity = 0;
            startedAt = at;
            lastAt = null;
        }

        synchronized SessionStats snapshot() {
            int window = contextWindows.getOrDefault(provider, 0);
            if (turns == 0) {
                return SessionStats.empty(provider, window, startedAt);
            }
            return new SessionStats(provider, turns, turns, sentTokens, responseTokens,
                    lastElapsedMs, lastVelocity,
                    Math.round((double) totalElapsedMs / turns), totalVelocity / turns,
                    window, startedAt, lastAt);
        }

    }

}
