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
package io.chatbridge.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Child process wrapper that drains output streams on background threads and
 * exposes exit as a future. Keeps the last few output lines for diagnostics.
 */
public class ProcessHandle {

    private static final Logger logger = LoggerFactory.getLogger(ProcessHandle.class);

    private static final int TAIL_LINES = 20;

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "process-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    });

    private final ProcessConfig config;
    private final Process process;
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
    private final Deque<String> tail = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ProcessHandle(ProcessConfig config, Process process) {
        this.config = config;
        this.process = process;
    }

    public static ProcessHandle start(ProcessConfig config) {
        java.lang.ProcessBuilder pb = new java.lang.ProcessBuilder(config.args());
        if (config.workingDir() != null) {
            pb.directory(config.workingDir().toFile());
        }
        pb.environment().putAll(config.env());
        pb.redirectErrorStream(config.redirectErrorStream());
        logger.debug("starting process: {}", config.args());
        Process process;
        try {
            process = pb.start();
        } catch (Exception e) {
            throw new ProcessException("failed to start process: " + e.getMessage(), e);
        }
        ProcessHandle handle = new ProcessHandle(config, process);
        handle.startReader(ProcessEvent.Type.STDOUT);
        if (!config.redirectErrorStream()) {
            handle.startReader(ProcessEvent.Type.STDERR);
        }
        handle.startExitWaiter();
        return handle;
    }

    private void startReader(ProcessEvent.Type type) {
        EXECUTOR.execute(() -> {
            var stream = type == ProcessEvent.Type.STDOUT ? process.getInputStream() : process.getErrorStream();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    remember(line);
                    dispatch(type == ProcessEvent.Type.STDOUT ? ProcessEvent.stdout(line) : ProcessEvent.stderr(line));
                }
            } catch (Exception e) {
                if (!closed.get()) {
                    logger.warn("{} reader error: {}", type, e.getMessage());
                }
            }
        });
    }

    private void startExitWaiter() {
        EXECUTOR.execute(() -> {
            try {
                int code = process.waitFor();
                dispatch(ProcessEvent.exit(code));
                exitFuture.complete(code);
                logger.debug("process {} exited with code: {}", process.pid(), code);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exitFuture.completeExceptionally(e);
            }
        });
    }

    private void remember(String line) {
        synchronized (tail) {
            if (tail.size() == TAIL_LINES) {
                tail.removeFirst();
            }
            tail.addLast(line);
        }
    }

    private void dispatch(ProcessEvent event) {
        if (config.listener() == null) {
            return;
        }
        try {
            config.listener().accept(event);
        } catch (Exception e) {
            logger.warn("listener error: {}", e.getMessage());
        }
    }

    /**
     * @return true if the process exited within the timeout
     */
    public boolean waitFor(Duration timeout) {
        try {
            exitFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        } catch (ExecutionException e) {
            throw new ProcessException("error waiting for process", e.getCause());
        }
    }

    public String getOutputTail() {
        synchronized (tail) {
            return String.join("\n", tail);
        }
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public long getPid() {
        return process.pid();
    }

    public Optional<Instant> getStartInstant() {
        return process.info().startInstant();
    }

    public CompletableFuture<Integer> getExitFuture() {
        return exitFuture;
    }

    public void close(boolean force) {
        closed.set(true);
        if (force) {
            process.destroyForcibly();
        } else {
            process.destroy();
        }
        logger.debug("process {} signalled (force={})", process.pid(), force);
    }

}
