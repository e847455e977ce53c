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
package io.chatbridge.pool;

import io.chatbridge.page.Page;
import io.chatbridge.page.PageTarget;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A provider's claim on one browser tab. The association is rewritten by
 * discovery only while the lease is not busy.
 */
public class PageLease {

    private final String provider;
    private final AtomicBoolean busy = new AtomicBoolean();
    private volatile PageTarget target;
    private volatile Page page;

    PageLease(String provider) {
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }

    public String getTabId() {
        PageTarget t = target;
        return t == null ? null : t.id();
    }

    /**
     * Address of the tab: live from the attached page when there is one.
     */
    public String getUrl() {
        Page p = page;
        if (p != null && p.isConnected()) {
            return p.getUrl();
        }
        PageTarget t = target;
        return t == null ? null : t.url();
    }

    public boolean isBusy() {
        return busy.get();
    }

    public boolean isAssociated() {
        return target != null;
    }

    /**
     * The attached page; only meaningful to the holder of a busy lease.
     */
    public Page getPage() {
        return page;
    }

    boolean tryAcquire() {
        return busy.compareAndSet(false, true);
    }

    void free() {
        busy.set(false);
    }

    PageTarget target() {
        return target;
    }

    void target(PageTarget target) {
        this.target = target;
    }

    void page(Page page) {
        this.page = page;
    }

    LeaseState state() {
        PageTarget t = target;
        return new LeaseState(provider, t != null, busy.get(), t == null ? null : t.id(), t == null ? null : t.url());
    }

    @Override
    public String toString() {
        return "PageLease[" + provider + " tab=" + getTabId() + (isBusy() ? " busy" : "") + "]";
    }

}
