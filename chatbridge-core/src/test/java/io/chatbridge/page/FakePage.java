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
package io.chatbridge.page;

import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable in-memory page. Counts can be given as a sequence that is
 * consumed one value per {@link #count(String, Duration)} call, the last value sticks.
 */
public class FakePage implements Page {

    private final String targetId;
    private volatile String url;
    private volatile boolean connected = true;
    private volatile boolean enterAccepted = true;
    private volatile RuntimeException failure;
    private final Map<String, Deque<Integer>> counts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> countCalls = new ConcurrentHashMap<>();
    private volatile Duration countDelay;
    private final Set<String> interactable = ConcurrentHashMap.newKeySet();
    private final Set<String> clickable = ConcurrentHashMap.newKeySet();
    private final Map<String, PageContent> contents = new ConcurrentHashMap<>();
    private final Map<String, Consumer<FakePage>> onClick = new ConcurrentHashMap<>();
    private volatile Consumer<FakePage> onSubmit;
    private final List<String> actions = new CopyOnWriteArrayList<>();
    private volatile int closeCount;

    public FakePage(String targetId, String url) {
        this.targetId = targetId;
        this.url = url;
    }

    public FakePage counts(String locator, Integer... values) {
        counts.put(locator, new ArrayDeque<>(List.of(values)));
        return this;
    }

    /**
     * Makes every count call take {@code delay}. A call given a shorter timeout
     * waits out the timeout and fails with {@code RESPONSE_TIMEOUT}.
     */
    public FakePage countDelay(Duration delay) {
        this.countDelay = delay;
        return this;
    }

    public FakePage interactable(String... locators) {
        interactable.addAll(List.of(locators));
        return this;
    }

    public FakePage clickable(String... locators) {
        clickable.addAll(List.of(locators));
        return this;
    }

    public FakePage content(String container, String content, String text, String html) {
        contents.put(key(container, content), new PageContent(text, html));
        return this;
    }

    public FakePage onClick(String locator, Consumer<FakePage> action) {
        onClick.put(locator, action);
        return this;
    }

    /**
     * Runs after a send click or an accepted enter press.
     */
    public FakePage onSubmit(Consumer<FakePage> action) {
        this.onSubmit = action;
        return this;
    }

    public FakePage enterAccepted(boolean accepted) {
        this.enterAccepted = accepted;
        return this;
    }

    public FakePage failWith(RuntimeException e) {
        this.failure = e;
        return this;
    }

    public void disconnect() {
        connected = false;
    }

    void reconnect() {
        connected = true;
    }

    public List<String> getActions() {
        return actions;
    }

    /**
     * How many times {@code locator} has been counted so far.
     */
    public int getCountCalls(String locator) {
        AtomicInteger calls = countCalls.get(locator);
        return calls == null ? 0 : calls.get();
    }

    public int getCloseCount() {
        return closeCount;
    }

    private static String key(String container, String content) {
        return container + "|" + content;
    }

    private static void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void check() {
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String getTargetId() {
        return targetId;
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public int count(String locator, Duration timeout) {
        check();
        countCalls.computeIfAbsent(locator, k -> new AtomicInteger()).incrementAndGet();
        Duration delay = countDelay;
        if (delay != null) {
            if (timeout != null && timeout.compareTo(delay) < 0) {
                pause(timeout);
                throw new BridgeException(ErrorKind.RESPONSE_TIMEOUT, null,
                        "tab " + targetId + " did not answer within " + timeout.toMillis() + " ms");
            }
            pause(delay);
        }
        Deque<Integer> values = counts.get(locator);
        if (values == null || values.isEmpty()) {
            return 0;
        }
        synchronized (values) {
            return values.size() > 1 ? values.pollFirst() : values.peekFirst();
        }
    }

    @Override
    public boolean isInteractable(String locator) {
        check();
        return interactable.contains(locator);
    }

    @Override
    public boolean input(String locator, String text) {
        check();
        actions.add("input:" + locator + ":" + text);
        return interactable.contains(locator);
    }

    @Override
    public boolean click(String locator) {
        check();
        if (!clickable.contains(locator)) {
            return false;
        }
        actions.add("click:" + locator);
        Consumer<FakePage> action = onClick.get(locator);
        if (action != null) {
            action.accept(this);
        } else if (onSubmit != null) {
            onSubmit.accept(this);
        }
        return true;
    }

    @Override
    public boolean pressEnter(String locator) {
        check();
        actions.add("enter:" + locator);
        if (enterAccepted && onSubmit != null) {
            onSubmit.accept(this);
        }
        return enterAccepted;
    }

    @Override
    public PageContent content(String containerLocator, String contentLocator) {
        check();
        return contents.get(key(containerLocator, contentLocator));
    }

    @Override
    public void navigate(String url) {
        check();
        actions.add("navigate:" + url);
        this.url = url;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void close() {
        closeCount++;
        connected = false;
    }

}
