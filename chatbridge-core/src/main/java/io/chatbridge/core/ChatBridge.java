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
package io.chatbridge.core;

import io.chatbridge.adapter.Adapter;
import io.chatbridge.browser.BrowserHandle;
import io.chatbridge.browser.BrowserProcessSupervisor;
import io.chatbridge.browser.ChromeLauncher;
import io.chatbridge.browser.HandleRecordStore;
import io.chatbridge.cdp.HttpControlEndpoint;
import io.chatbridge.common.BridgeException;
import io.chatbridge.log.LogContext;
import io.chatbridge.page.ControlEndpoint;
import io.chatbridge.pool.ConnectionPool;
import io.chatbridge.session.SessionAccountant;
import io.chatbridge.status.HealthMonitor;
import io.chatbridge.status.StatusAggregator;
import io.chatbridge.status.StatusSnapshot;
import io.chatbridge.transport.InteractionResult;
import io.chatbridge.transport.Transport;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point that wires the browser supervisor, the page pool, one
 * transport per provider, session accounting and status reporting.
 *
 * <pre>
 * try (ChatBridge bridge = new ChatBridge(BridgeConfig.load(Path.of("chatbridge.yaml")))) {
 *     bridge.start();
 *     InteractionResult result = bridge.send("claude", "hello", true, 0);
 * }
 * </pre>
 *
 * {@link #close()} releases connections but leaves the browser running so
 * that logins survive; {@link #stop()} also shuts the browser down.
 */
public class ChatBridge implements AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final BridgeConfig config;
    private final ControlEndpoint endpoint;
    private final BrowserProcessSupervisor supervisor;
    private final ConnectionPool pool;
    private final SessionAccountant accountant;
    private final Map<String, Transport> transports;
    private final HealthMonitor health;
    private final StatusAggregator status;
    private final ExecutorService executor;

    public ChatBridge(BridgeConfig config) {
        this(config, new HttpControlEndpoint(config.getHost(), config.getPort(),
                Duration.ofMillis(config.getCommandTimeoutMs())), defaultSupervisor(config));
    }

    ChatBridge(BridgeConfig config, ControlEndpoint endpoint, BrowserProcessSupervisor supervisor) {
        this.config = config;
        this.endpoint = endpoint;
        this.supervisor = supervisor;
        List<Adapter> adapters = config.resolveAdapters();
        this.pool = new ConnectionPool(endpoint, adapters);
        this.accountant = new SessionAccountant();
        Map<String, Transport> map = new LinkedHashMap<>();
        for (Adapter adapter : adapters) {
            map.put(adapter.getName(), new Transport(adapter, pool, accountant));
        }
        this.transports = Collections.unmodifiableMap(map);
        this.health = config.getHealthCheckIntervalMs() > 0
                ? new HealthMonitor(endpoint, Duration.ofMillis(config.getHealthCheckIntervalMs())) : null;
        this.status = new StatusAggregator(supervisor, pool, transports, accountant, health);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "chatbridge-send-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static BrowserProcessSupervisor defaultSupervisor(BridgeConfig config) {
        Duration commandTimeout = Duration.ofMillis(config.getCommandTimeoutMs());
        return BrowserProcessSupervisor.builder()
                .host(config.getHost())
                .probe((host, port) -> new HttpControlEndpoint(host, port, commandTimeout).isReachable())
                .launcher(new ChromeLauncher(config.getExecutable(), config.isHeadless(),
                        config.getAddOptions(), config.startUrls()))
                .recordStore(new HandleRecordStore(config.getRecordFile()))
                .pollInterval(Duration.ofMillis(config.getLaunchPollIntervalMs()))
                .maxAttempts(config.getLaunchMaxAttempts())
                .forceKillWindow(Duration.ofMillis(config.getForceKillWindowMs()))
                .build();
    }

    /**
     * Ensures the browser runs, associates open pages with providers, opens
     * pages for providers without one when configured to, and starts the
     * health monitor.
     *
     * @return provider to tab id for every associated provider
     */
    public Map<String, String> start() {
        BrowserHandle handle = supervisor.ensureRunning(config.getProfileDir(), config.getPort());
        logger.info("browser {} on {} (pid {}, owned={})", handle.getState(), endpoint.getAddress(),
                handle.getPid(), handle.isOwned());
        Map<String, String> associations = pool.discoverPages();
        if (config.isOpenMissingPages() && !pool.openMissingPages().isEmpty()) {
            associations = pool.discoverPages();
        }
        for (String provider : transports.keySet()) {
            if (!associations.containsKey(provider)) {
                logger.warn("no page open for provider: {}", provider);
            }
        }
        if (health != null) {
            health.start();
        }
        return associations;
    }

    /**
     * Sends a prompt to one provider. Never throws for interaction failures,
     * inspect the result instead.
     *
     * @param timeoutSeconds zero or less means the adapter default
     */
    public InteractionResult send(String provider, String prompt, boolean waitForResponse, double timeoutSeconds) {
        Transport transport = transports.get(provider);
        if (transport == null) {
            logger.warn("send to unknown provider: {}", provider);
            return InteractionResult.notAttached(provider, endpoint.getAddress());
        }
        if (!pool.peek(provider).associated()) {
            rediscover(provider);
        }
        Duration timeout = timeoutSeconds > 0 ? Duration.ofMillis(Math.round(timeoutSeconds * 1000)) : null;
        return transport.send(prompt, waitForResponse, timeout);
    }

    public CompletableFuture<InteractionResult> sendAsync(String provider, String prompt,
                                                          boolean waitForResponse, double timeoutSeconds) {
        return CompletableFuture.supplyAsync(() -> send(provider, prompt, waitForResponse, timeoutSeconds), executor);
    }

    /**
     * Prompts several providers concurrently, one interaction each.
     */
    public Map<String, InteractionResult> broadcast(Collection<String> providers, String prompt,
                                                    boolean waitForResponse, double timeoutSeconds) {
        Map<String, CompletableFuture<InteractionResult>> futures = new LinkedHashMap<>();
        for (String provider : providers) {
            futures.put(provider, sendAsync(provider, prompt, waitForResponse, timeoutSeconds));
        }
        Map<String, InteractionResult> results = new LinkedHashMap<>();
        futures.forEach((provider, future) -> results.put(provider, future.join()));
        return results;
    }

    public InteractionResult startNewSession(String provider) {
        Transport transport = transports.get(provider);
        if (transport == null) {
            return InteractionResult.notAttached(provider, endpoint.getAddress());
        }
        if (!pool.peek(provider).associated()) {
            rediscover(provider);
        }
        return transport.startNewSession();
    }

    private void rediscover(String provider) {
        try {
            pool.discoverPages();
        } catch (BridgeException e) {
            // the lease attempt that follows reports the failure
            logger.debug("page discovery for {} failed: {}", provider, e.getMessage());
        }
    }

    public StatusSnapshot status(String provider) {
        return status.snapshot(provider);
    }

    public Map<String, StatusSnapshot> status() {
        return status.snapshotAll();
    }

    public Set<String> getProviders() {
        return transports.keySet();
    }

    public Transport getTransport(String provider) {
        return transports.get(provider);
    }

    public SessionAccountant getAccountant() {
        return accountant;
    }

    public BrowserProcessSupervisor getSupervisor() {
        return supervisor;
    }

    public BridgeConfig getConfig() {
        return config;
    }

    /**
     * Releases everything and shuts the browser down.
     */
    public void stop() {
        close();
        supervisor.stop(Duration.ofMillis(config.getStopGraceMs()));
    }

    @Override
    public void close() {
        if (health != null) {
            health.close();
        }
        pool.close();
        executor.shutdownNow();
    }

}
