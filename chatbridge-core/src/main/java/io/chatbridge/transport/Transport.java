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

import io.chatbridge.adapter.Adapter;
import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import io.chatbridge.log.LogContext;
import io.chatbridge.page.Page;
import io.chatbridge.page.PageContent;
import io.chatbridge.pool.ConnectionPool;
import io.chatbridge.pool.PageLease;
import io.chatbridge.session.SessionAccountant;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one provider's chat page through ensure-ready, send, wait and
 * extract. All per-provider variation comes from the {@link Adapter}.
 *
 * <p>Each role's candidate locators are tried in order and the first that
 * resolves is used; there is no other retry. Waiting is bounded polling: the
 * reply is complete once exactly one new response container exists and no
 * stop indicator is present.</p>
 */
public class Transport {

    private static final Logger logger = LogContext.INTERACTION_LOGGER;

    public static final String STAGE_NEW_SESSION = "new_session";

    private final Adapter adapter;
    private final ConnectionPool pool;
    private final SessionAccountant accountant;
    private final MarkdownFormatter formatter;
    private final Clock clock;
    private final ReentrantLock inFlight = new ReentrantLock();
    private volatile Interaction current;
    private volatile InteractionResult lastResult;

    public Transport(Adapter adapter, ConnectionPool pool, SessionAccountant accountant) {
        this(adapter, pool, accountant, new MarkdownFormatter(), Clock.systemUTC());
    }

    public Transport(Adapter adapter, ConnectionPool pool, SessionAccountant accountant,
                     MarkdownFormatter formatter, Clock clock) {
        if (adapter == null) {
            throw new BridgeException(ErrorKind.ADAPTER_INCOMPLETE, "transport requires an adapter");
        }
        adapter.validate();
        this.adapter = adapter;
        this.pool = pool;
        this.accountant = accountant;
        this.formatter = formatter;
        this.clock = clock;
        accountant.setContextWindow(adapter.getName(), adapter.getMaxContextTokens());
    }

    public String getName() {
        return adapter.getName();
    }

    public TransportKind getKind() {
        return TransportKind.WEB;
    }

    public Adapter getAdapter() {
        return adapter;
    }

    /**
     * State of the interaction in flight, or {@code IDLE}.
     */
    public InteractionState getState() {
        Interaction it = current;
        return it == null ? InteractionState.IDLE : it.getState();
    }

    public InteractionResult getLastResult() {
        return lastResult;
    }

    /**
     * Sends a prompt and, when {@code waitForResponse} is set, waits for and
     * extracts the reply. A null or non-positive timeout means the adapter default.
     */
    public InteractionResult send(String prompt, boolean waitForResponse, Duration timeout) {
        Duration effective = timeout == null || timeout.isZero() || timeout.isNegative()
                ? adapter.getDefaultTimeout() : timeout;
        Interaction it = new Interaction(adapter.getName(), UUID.randomUUID().toString(),
                prompt == null ? "" : prompt, waitForResponse, effective, clock);
        LogContext.enter(adapter.getName(), it.getRequestId());
        try {
            InteractionResult result = run(it);
            lastResult = result;
            return result;
        } finally {
            LogContext.clear();
        }
    }

    private InteractionResult run(Interaction it) {
        PageLease lease;
        try {
            lease = pool.lease(adapter.getName());
        } catch (BridgeException e) {
            return failure(it, e, pool.peek(adapter.getName()).url());
        }
        Page page = lease.getPage();
        if (!inFlight.tryLock()) {
            pool.release(adapter.getName());
            return failure(it, new BridgeException(ErrorKind.PROVIDER_BUSY,
                    "transport " + adapter.getName() + " is already running an interaction"), page.getUrl());
        }
        current = it;
        try {
            logger.info("send to {} ({} chars, wait={}, timeout={}s)", adapter.getName(), it.getPrompt().length(),
                    it.isWaitForResponse(), it.getTimeout().toSeconds());
            PageContent extracted = interact(it, page);
            it.transition(InteractionState.DONE);
            ResponseContent content = null;
            String snippet = null;
            if (extracted != null) {
                String text = extracted.text().trim();
                content = new ResponseContent(text, formatter.format(extracted.html(), text));
                snippet = text.length() > adapter.getSnippetLength() ? text.substring(0, adapter.getSnippetLength()) : text;
                if (!text.isEmpty()) {
                    accountant.record(adapter.getName(), it.getPrompt(), text, it.getResponseTimeMs());
                }
            }
            InteractionResult result = new InteractionResult(true, snippet, content, null, it.getStageLog(),
                    metadata(it, page.getUrl(), null));
            logger.info("{} done in {} ms", adapter.getName(), it.elapsedMs());
            return result;
        } catch (BridgeException e) {
            if (e.getKind() == ErrorKind.TRANSPORT_UNREACHABLE) {
                pool.invalidate(adapter.getName());
            }
            return failure(it, e, page.getUrl());
        } catch (RuntimeException e) {
            logger.error("unexpected failure talking to {}", adapter.getName(), e);
            return failure(it, new BridgeException(ErrorKind.UNEXPECTED, null, e.toString(), e), page.getUrl());
        } finally {
            current = null;
            inFlight.unlock();
            pool.release(adapter.getName());
        }
    }

    /**
     * @return the extracted reply, or null when not waiting for one
     */
    private PageContent interact(Interaction it, Page page) {
        it.transition(InteractionState.ENSURE_READY);
        String input = firstInteractable(page, adapter.getInput());
        if (input == null) {
            throw new BridgeException(ErrorKind.SELECTOR_MISSING, InteractionState.ENSURE_READY.getStage(),
                    "no input candidate is interactable: " + adapter.getInput());
        }
        for (String alert : adapter.getAlerts()) {
            if (page.exists(alert)) {
                logger.debug("alert locator present: {}", alert);
                it.warn(Warning.SUSPICIOUS_PAGE_STATE);
                break;
            }
        }
        Map<String, Integer> baseline = new LinkedHashMap<>();
        for (String container : adapter.getResponseContainer()) {
            baseline.put(container, page.count(container));
        }

        it.transition(InteractionState.SENDING);
        if (!page.input(input, it.getPrompt())) {
            throw new BridgeException(ErrorKind.SELECTOR_MISSING, InteractionState.SENDING.getStage(),
                    "input element disappeared: " + input);
        }
        if (!submit(page, input)) {
            throw new BridgeException(ErrorKind.SELECTOR_MISSING, InteractionState.SENDING.getStage(),
                    "no send candidate worked and enter was not accepted: " + adapter.getSend());
        }
        if (!it.isWaitForResponse()) {
            return null;
        }

        it.transition(InteractionState.WAITING);
        String container = awaitCompletion(it, page, baseline);

        it.transition(InteractionState.EXTRACTING);
        PageContent content = extract(page, container);
        if (content.isBlank()) {
            it.warn(Warning.EMPTY_RESPONSE);
        }
        return content;
    }

    private static String firstInteractable(Page page, List<String> candidates) {
        for (String candidate : candidates) {
            if (page.isInteractable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private boolean submit(Page page, String input) {
        for (String candidate : adapter.getSend()) {
            if (page.click(candidate)) {
                logger.debug("sent via {}", candidate);
                return true;
            }
        }
        logger.debug("no send control clicked, pressing enter on {}", input);
        return page.pressEnter(input);
    }

    /**
     * Polls until the completion condition holds. Every page call is bounded by
     * what is left of the interaction timeout.
     *
     * @return the container candidate whose count moved
     */
    private String awaitCompletion(Interaction it, Page page, Map<String, Integer> baseline) {
        long deadline = System.nanoTime() + it.getTimeout().toNanos();
        long intervalNanos = adapter.getPollInterval().toNanos();
        int polls = 0;
        while (true) {
            polls++;
            String moved = null;
            int delta = 0;
            try {
                for (Map.Entry<String, Integer> entry : baseline.entrySet()) {
                    int count = page.count(entry.getKey(), remaining(it, deadline, polls));
                    if (count != entry.getValue()) {
                        moved = entry.getKey();
                        delta = count - entry.getValue();
                        break;
                    }
                }
                if (moved != null && delta == 1 && !anyPresent(page, adapter.getStop(), it, deadline, polls)) {
                    logger.debug("reply complete after {} poll(s) in {}", polls, moved);
                    return moved;
                }
            } catch (BridgeException e) {
                if (e.getKind() == ErrorKind.RESPONSE_TIMEOUT && e.getStage() == null) {
                    throw timeout(it, polls, "tab did not answer before the deadline");
                }
                throw e;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw timeout(it, polls, moved == null ? "no new response container" : "container delta " + delta);
            }
            try {
                Thread.sleep(Math.max(1, Math.min(intervalNanos, remaining) / 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BridgeException(ErrorKind.RESPONSE_TIMEOUT, InteractionState.WAITING.getStage(),
                        "interrupted while waiting for reply");
            }
        }
    }

    private Duration remaining(Interaction it, long deadline, int polls) {
        long nanos = deadline - System.nanoTime();
        if (nanos <= 0) {
            throw timeout(it, polls, "deadline passed during poll");
        }
        return Duration.ofMillis(Math.max(1, nanos / 1_000_000));
    }

    private static BridgeException timeout(Interaction it, int polls, String detail) {
        return new BridgeException(ErrorKind.RESPONSE_TIMEOUT, InteractionState.WAITING.getStage(),
                "reply not complete after " + it.getTimeout().toMillis() + " ms (" + polls + " polls, " + detail + ")");
    }

    private boolean anyPresent(Page page, List<String> candidates, Interaction it, long deadline, int polls) {
        for (String candidate : candidates) {
            if (page.exists(candidate, remaining(it, deadline, polls))) {
                return true;
            }
        }
        return false;
    }

    private PageContent extract(Page page, String container) {
        for (String candidate : adapter.getResponseContent()) {
            PageContent content = page.content(container, candidate);
            if (content != null && !content.isBlank()) {
                return content;
            }
        }
        logger.debug("no content candidate matched, using container text");
        PageContent whole = page.content(container, null);
        return whole != null ? whole : new PageContent("", "");
    }

    /**
     * Opens a fresh conversation and resets this provider's counters. The
     * new-chat control is clicked when one resolves, otherwise the page
     * navigates to the adapter's new-chat address.
     */
    public InteractionResult startNewSession() {
        Interaction it = new Interaction(adapter.getName(), UUID.randomUUID().toString(), "", false,
                adapter.getDefaultTimeout(), clock);
        LogContext.enter(adapter.getName(), it.getRequestId());
        try {
            PageLease lease;
            try {
                lease = pool.lease(adapter.getName());
            } catch (BridgeException e) {
                return failure(it, e, pool.peek(adapter.getName()).url());
            }
            Page page = lease.getPage();
            try {
                it.mark(STAGE_NEW_SESSION);
                openNewChat(page);
                awaitInput(page, it.getTimeout());
                accountant.reset(adapter.getName());
                it.transition(InteractionState.DONE);
                logger.info("new session started for {}", adapter.getName());
                return new InteractionResult(true, null, null, null, it.getStageLog(),
                        metadata(it, page.getUrl(), null));
            } catch (BridgeException e) {
                if (e.getKind() == ErrorKind.TRANSPORT_UNREACHABLE) {
                    pool.invalidate(adapter.getName());
                }
                return failure(it, e, page.getUrl());
            } finally {
                pool.release(adapter.getName());
            }
        } finally {
            LogContext.clear();
        }
    }

    private void openNewChat(Page page) {
        for (String candidate : adapter.getNewChat()) {
            if (page.click(candidate)) {
                logger.debug("new chat via {}", candidate);
                return;
            }
        }
        String url = adapter.getNewChatUrl();
        if (url == null) {
            throw new BridgeException(ErrorKind.SELECTOR_MISSING, STAGE_NEW_SESSION,
                    "no new chat control resolved and no new chat url configured");
        }
        logger.debug("new chat via navigation to {}", url);
        page.navigate(url);
    }

    private void awaitInput(Page page, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (firstInteractable(page, adapter.getInput()) == null) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new BridgeException(ErrorKind.SELECTOR_MISSING, STAGE_NEW_SESSION,
                        "input never became interactable after opening a new chat");
            }
            try {
                Thread.sleep(Math.max(1, Math.min(adapter.getPollInterval().toNanos(), remaining) / 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BridgeException(ErrorKind.SELECTOR_MISSING, STAGE_NEW_SESSION, "interrupted");
            }
        }
    }

    private InteractionResult failure(Interaction it, BridgeException e, String pageUrl) {
        InteractionError error = InteractionError.of(e, it.getStage());
        if (!it.getState().isTerminal()) {
            it.transition(InteractionState.FAILED);
        }
        logger.warn("{} failed at {}: {} {}", adapter.getName(), error.stage(), error.kind().getCode(), error.detail());
        return new InteractionResult(false, null, null, error, it.getStageLog(), metadata(it, pageUrl, error));
    }

    private Map<String, Object> metadata(Interaction it, String pageUrl, InteractionError error) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("transportType", getKind().getName());
        map.put("transportName", adapter.getName());
        map.put("controlEndpoint", pool.getEndpoint().getAddress());
        map.put("pageUrl", pageUrl);
        map.put("requestId", it.getRequestId());
        map.put("elapsedMs", it.elapsedMs());
        if (it.getResponseTimeMs() >= 0) {
            map.put("responseTimeMs", it.getResponseTimeMs());
        }
        map.put("waited", it.isWaitForResponse());
        map.put("timeoutS", it.getTimeout().toMillis() / 1000.0);
        map.put("stageLog", it.getStageLog().stream().map(StageEntry::toMap).toList());
        map.put("warnings", it.getWarnings().stream().map(Enum::name).toList());
        if (error != null) {
            map.put("error", error.toMap());
        }
        map.put("timestamp", clock.instant().toString());
        return map;
    }

}
