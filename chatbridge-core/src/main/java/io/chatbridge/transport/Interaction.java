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
package io.chatbridge.transport;

import io.chatbridge.log.LogContext;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One send/wait/extract cycle. Confined to the thread running it; status
 * readers only ever see {@link #getState()}.
 */
public class Interaction {

    private static final Logger logger = LogContext.INTERACTION_LOGGER;

    private final String provider;
    private final String requestId;
    private final String prompt;
    private final boolean waitForResponse;
    private final Duration timeout;
    private final Clock clock;
    private final long startNanos = System.nanoTime();
    private final List<StageEntry> stageLog = new ArrayList<>();
    private final Set<Warning> warnings = new LinkedHashSet<>();
    private volatile InteractionState state = InteractionState.IDLE;
    private long waitStartNanos;
    private long responseTimeMs = -1;

    Interaction(String provider, String requestId, String prompt, boolean waitForResponse, Duration timeout, Clock clock) {
        this.provider = provider;
        this.requestId = requestId;
        this.prompt = prompt;
        this.waitForResponse = waitForResponse;
        this.timeout = timeout;
        this.clock = clock;
        stageLog.add(new StageEntry(InteractionState.IDLE.getStage(), clock.instant()));
    }

    void transition(InteractionState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("interaction " + requestId + " already " + state);
        }
        if (next == InteractionState.WAITING) {
            waitStartNanos = System.nanoTime();
        } else if (state == InteractionState.EXTRACTING) {
            responseTimeMs = (System.nanoTime() - waitStartNanos) / 1_000_000;
        }
        state = next;
        mark(next.getStage());
    }

    /**
     * Appends a stage that is not a state of the send cycle, such as {@code new_session}.
     */
    void mark(String stage) {
        stageLog.add(new StageEntry(stage, clock.instant()));
        logger.debug("[{}] {} {}", provider, stage, elapsedMs());
    }

    void warn(Warning warning) {
        if (warnings.add(warning)) {
            logger.warn("[{}] {}", provider, warning);
        }
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /**
     * Time spent waiting for and extracting the reply, or -1 if the
     * interaction never finished extracting.
     */
    public long getResponseTimeMs() {
        return responseTimeMs;
    }

    public String getProvider() {
        return provider;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getPrompt() {
        return prompt;
    }

    public boolean isWaitForResponse() {
        return waitForResponse;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public InteractionState getState() {
        return state;
    }

    /**
     * Name of the last logged stage.
     */
    public String getStage() {
        return stageLog.get(stageLog.size() - 1).stage();
    }

    public List<StageEntry> getStageLog() {
        return Collections.unmodifiableList(stageLog);
    }

    public Set<Warning> getWarnings() {
        return Collections.unmodifiableSet(warnings);
    }

}
