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
package io.chatbridge.browser;

import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import io.chatbridge.log.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single automated browser process. Start and stop are serialized
 * by a lock; state reads never take it.
 *
 * <p>The handle record on disk is only a recovery hint: it is checked against
 * actual process liveness before use and removed once the process is gone.</p>
 */
public class BrowserProcessSupervisor {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    /**
     * Largest gap between a recorded start time and the live process's own.
     */
    static final Duration START_TOLERANCE = Duration.ofSeconds(5);

    private final String host;
    private final EndpointProbe probe;
    private final BrowserLauncher launcher;
    private final ProcessLookup lookup;
    private final HandleRecordStore recordStore;
    private final Duration pollInterval;
    private final int maxAttempts;
    private final Duration forceKillWindow;
    private final Duration exitPollInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile BrowserHandle handle;

    private BrowserProcessSupervisor(Builder builder) {
        this.host = builder.host;
        this.probe = builder.probe;
        this.launcher = builder.launcher;
        this.lookup = builder.lookup;
        this.recordStore = builder.recordStore;
        this.pollInterval = builder.pollInterval;
        this.maxAttempts = builder.maxAttempts;
        this.forceKillWindow = builder.forceKillWindow;
        this.exitPollInterval = builder.exitPollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Makes sure a browser serves the control endpoint on {@code port}. Adopts a
     * browser that is already reachable; otherwise launches one and polls the
     * endpoint until it answers. A supervised browser that is still alive is
     * never replaced: if its endpoint stops answering it is polled again, and
     * the handle is kept when it does not recover.
     */
    public BrowserHandle ensureRunning(Path profileDir, int port) {
        lock.lock();
        try {
            discardStale();
            BrowserHandle current = handle;
            if (current != null && current.getPort() == port && current.getState() == BrowserState.RUNNING) {
                if (probe.isReachable(host, port)) {
                    logger.debug("browser already running: {}", current);
                    return current;
                }
                if (current.isOwned() && current.isProcessAlive()) {
                    return awaitEndpoint(current);
                }
            }
            if (probe.isReachable(host, port)) {
                return adopt(profileDir, port);
            }
            return launch(profileDir, port);
        } finally {
            lock.unlock();
        }
    }

    private BrowserHandle awaitEndpoint(BrowserHandle current) {
        int port = current.getPort();
        logger.warn("browser pid {} is alive but port {} did not answer, polling again", current.getPid(), port);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!sleep(pollInterval)) {
                throw new BridgeException(ErrorKind.BROWSER_LAUNCH_FAILED,
                        "interrupted while waiting for browser pid " + current.getPid());
            }
            if (!current.isProcessAlive()) {
                logger.warn("browser pid {} exited while its endpoint was down", current.getPid());
                current.setState(BrowserState.STOPPED);
                handle = null;
                return launch(current.getProfileDir(), port);
            }
            if (probe.isReachable(host, port)) {
                logger.info("browser pid {} answered again after {} attempt(s)", current.getPid(), attempt);
                return current;
            }
        }
        throw new BridgeException(ErrorKind.BROWSER_LAUNCH_FAILED, "browser pid " + current.getPid()
                + " is running but control endpoint on port " + port + " not reachable after " + maxAttempts + " attempts");
    }

    private Optional<BrowserProcess> recordedProcess(HandleRecord record) {
        Optional<BrowserProcess> found = lookup.find(record.pid()).filter(BrowserProcess::isAlive);
        if (found.isPresent() && !record.matches(found.get(), START_TOLERANCE)) {
            logger.warn("pid {} is alive but is not the recorded browser, ignoring it", record.pid());
            return Optional.empty();
        }
        return found;
    }

    private BrowserHandle adopt(Path profileDir, int port) {
        Optional<BrowserProcess> recorded = recordStore.read()
                .filter(r -> r.port() == port)
                .flatMap(this::recordedProcess);
        BrowserHandle adopted = new BrowserHandle(recorded.orElse(null), profileDir, host, port,
                recorded.isPresent(), BrowserState.RUNNING);
        handle = adopted;
        if (recorded.isPresent()) {
            logger.info("adopted recorded browser pid {} on port {}", adopted.getPid(), port);
        } else {
            logger.info("control endpoint on port {} is served by an external browser, it will not be stopped", port);
        }
        return adopted;
    }

    private BrowserHandle launch(Path profileDir, int port) {
        Instant launchedAt = Instant.now();
        BrowserProcess process = launcher.launch(profileDir, port);
        BrowserHandle starting = new BrowserHandle(process, profileDir, host, port, true, BrowserState.STARTING);
        handle = starting;
        String failure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!process.isAlive()) {
                failure = "browser process exited during startup";
                break;
            }
            if (probe.isReachable(host, port)) {
                starting.setState(BrowserState.RUNNING);
                recordStore.write(new HandleRecord(process.pid(), port,
                        profileDir == null ? null : profileDir.toString(), process.startInstant().orElse(launchedAt)));
                logger.info("browser pid {} ready on port {} after {} attempt(s)", process.pid(), port, attempt);
                return starting;
            }
            logger.trace("control endpoint not yet reachable (attempt {})", attempt);
            if (!sleep(pollInterval)) {
                failure = "interrupted while waiting for browser";
                break;
            }
        }
        if (failure == null) {
            failure = "control endpoint on port " + port + " not reachable after " + maxAttempts + " attempts";
        }
        if (process instanceof LocalBrowserProcess local && !local.getOutputTail().isEmpty()) {
            failure = failure + ", browser output:\n" + local.getOutputTail();
        }
        if (process.isAlive()) {
            process.kill();
        }
        starting.setState(BrowserState.STOPPED);
        handle = null;
        logger.error("browser launch failed: {}", failure);
        throw new BridgeException(ErrorKind.BROWSER_LAUNCH_FAILED, failure);
    }

    /**
     * Terminates the browser, escalating to a forced kill after {@code gracePeriod}.
     * The handle and its record are cleared once exit is confirmed.
     */
    public void stop(Duration gracePeriod) {
        lock.lock();
        try {
            discardStale();
            if (handle == null) {
                recoverFromRecord();
            }
            BrowserHandle current = handle;
            if (current == null) {
                logger.debug("stop requested but no browser is supervised");
                return;
            }
            if (!current.isOwned()) {
                logger.info("leaving external browser on port {} running", current.getPort());
                handle = null;
                return;
            }
            BrowserProcess process = current.getProcess();
            current.setState(BrowserState.STOPPING);
            logger.info("stopping browser pid {}", process.pid());
            process.terminate();
            if (awaitExit(process, gracePeriod)) {
                clear(current);
                return;
            }
            logger.warn("browser pid {} ignored termination after {} ms, killing", process.pid(), gracePeriod.toMillis());
            process.kill();
            if (awaitExit(process, forceKillWindow)) {
                clear(current);
                return;
            }
            current.setState(BrowserState.RUNNING);
            throw new BridgeException(ErrorKind.STOP_FAILED, "browser pid " + process.pid() + " survived forced kill");
        } finally {
            lock.unlock();
        }
    }

    private void recoverFromRecord() {
        recordStore.read()
                .flatMap(r -> recordedProcess(r)
                        .map(p -> new BrowserHandle(p, r.profileDir() == null ? null : Path.of(r.profileDir()),
                                host, r.port(), true, BrowserState.RUNNING)))
                .ifPresent(recovered -> {
                    logger.info("recovered browser pid {} from handle record", recovered.getPid());
                    handle = recovered;
                });
    }

    private void clear(BrowserHandle stopped) {
        stopped.setState(BrowserState.STOPPED);
        handle = null;
        recordStore.delete();
        logger.info("browser pid {} stopped", stopped.getPid());
    }

    private void discardStale() {
        BrowserHandle current = handle;
        if (current != null) {
            boolean stale = current.getProcess() != null
                    ? !current.getProcess().isAlive()
                    : !probe.isReachable(host, current.getPort());
            if (stale) {
                logger.warn("discarding stale browser handle: {}", current);
                current.setState(BrowserState.STOPPED);
                handle = null;
            }
        }
        recordStore.read().ifPresent(record -> {
            if (recordedProcess(record).isEmpty()) {
                logger.info("removing stale handle record for pid {}", record.pid());
                recordStore.delete();
            }
        });
    }

    private boolean awaitExit(BrowserProcess process, Duration window) {
        long deadline = System.nanoTime() + window.toNanos();
        while (process.isAlive()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            if (!sleep(Duration.ofNanos(Math.min(remaining, exitPollInterval.toNanos())))) {
                return !process.isAlive();
            }
        }
        return true;
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Current handle, or null when no browser is supervised.
     */
    public BrowserHandle getHandle() {
        return handle;
    }

    public BrowserState getState() {
        BrowserHandle current = handle;
        return current == null ? BrowserState.STOPPED : current.getState();
    }

    /**
     * Cheap liveness check for status reporting: never touches the network.
     */
    public boolean isAlive() {
        BrowserHandle current = handle;
        return current != null && current.getState() == BrowserState.RUNNING && current.isProcessAlive();
    }

    public static class Builder {

        private String host = "127.0.0.1";
        private EndpointProbe probe;
        private BrowserLauncher launcher;
        private ProcessLookup lookup = ProcessLookup.system();
        private HandleRecordStore recordStore = HandleRecordStore.none();
        private Duration pollInterval = Duration.ofMillis(250);
        private int maxAttempts = 60;
        private Duration forceKillWindow = Duration.ofSeconds(3);
        private Duration exitPollInterval = Duration.ofMillis(100);

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder probe(EndpointProbe probe) {
            this.probe = probe;
            return this;
        }

        public Builder launcher(BrowserLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder lookup(ProcessLookup lookup) {
            this.lookup = lookup;
            return this;
        }

        public Builder recordStore(HandleRecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder forceKillWindow(Duration forceKillWindow) {
            this.forceKillWindow = forceKillWindow;
            return this;
        }

        public Builder exitPollInterval(Duration exitPollInterval) {
            this.exitPollInterval = exitPollInterval;
            return this;
        }

        public BrowserProcessSupervisor build() {
            if (probe == null || launcher == null) {
                throw new IllegalStateException("probe and launcher are required");
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
            }
            return new BrowserProcessSupervisor(this);
        }

    }

}
