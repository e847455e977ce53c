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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory control endpoint. Tabs added with {@link #tab} are attached to
 * the supplied {@link FakePage}, or to a fresh one for opened tabs.
 */
public class FakeEndpoint implements ControlEndpoint {

    private final List<PageTarget> targets = new CopyOnWriteArrayList<>();
    private final Map<String, FakePage> pages = new ConcurrentHashMap<>();
    private final List<String> opened = new CopyOnWriteArrayList<>();
    private final AtomicInteger attachCount = new AtomicInteger();
    private final AtomicInteger nextId = new AtomicInteger(100);
    private volatile boolean reachable = true;

    public FakeEndpoint tab(String id, String url, FakePage page) {
        targets.add(new PageTarget(id, "page", url, null, "ws://fake/devtools/page/" + id));
        pages.put(id, page);
        return this;
    }

    public FakeEndpoint tab(String id, String url) {
        return tab(id, url, new FakePage(id, url));
    }

    public void navigate(String id, String url) {
        targets.replaceAll(t -> t.id().equals(id)
                ? new PageTarget(id, t.type(), url, t.title(), t.webSocketDebuggerUrl()) : t);
    }

    public void removeTab(String id) {
        targets.removeIf(t -> t.id().equals(id));
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public FakePage page(String id) {
        return pages.get(id);
    }

    public List<String> getOpened() {
        return opened;
    }

    public int getAttachCount() {
        return attachCount.get();
    }

    @Override
    public String getAddress() {
        return "http://127.0.0.1:9223";
    }

    @Override
    public boolean isReachable() {
        return reachable;
    }

    @Override
    public List<PageTarget> listPages() {
        if (!reachable) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, "endpoint down");
        }
        return List.copyOf(targets);
    }

    @Override
    public PageTarget openPage(String url) {
        if (!reachable) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, "endpoint down");
        }
        String id = "T" + nextId.incrementAndGet();
        tab(id, url);
        opened.add(url);
        return new PageTarget(id, "page", url, null, "ws://fake/devtools/page/" + id);
    }

    @Override
    public Page attach(PageTarget target) {
        if (!reachable) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, "endpoint down");
        }
        attachCount.incrementAndGet();
        FakePage page = pages.get(target.id());
        // a re-attach after close gets a live page with the same script
        if (page != null && !page.isConnected()) {
            page.reconnect();
        }
        return page;
    }

}
