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

import io.chatbridge.adapter.Adapter;
import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import io.chatbridge.log.LogContext;
import io.chatbridge.page.ControlEndpoint;
import io.chatbridge.page.Page;
import io.chatbridge.page.PageTarget;
import org.slf4j.Logger;

import java.util.*;

/**
 * One browser tab per provider, found by url hint and leased exclusively for
 * the duration of one interaction. A second lease request for a busy provider
 * is rejected, never queued.
 */
public class ConnectionPool {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    private final ControlEndpoint endpoint;
    private final Map<String, Adapter> adapters;
    private final Map<String, PageLease> leases;

    public ConnectionPool(ControlEndpoint endpoint, Collection<Adapter> adapters) {
        this.endpoint = endpoint;
        this.adapters = new LinkedHashMap<>();
        Map<String, PageLease> map = new LinkedHashMap<>();
        for (Adapter adapter : adapters) {
            this.adapters.put(adapter.getName(), adapter);
            map.put(adapter.getName(), new PageLease(adapter.getName()));
        }
        this.leases = Collections.unmodifiableMap(map);
    }

    public ControlEndpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Matches open tabs to providers. A provider keeps its current tab while
     * that tab still matches; otherwise it takes the first unclaimed match.
     * Busy leases are left untouched.
     *
     * @return provider name to tab id, for every associated provider
     */
    public synchronized Map<String, String> discoverPages() {
        List<PageTarget> pages = endpoint.listPages();
        Set<String> claimed = new HashSet<>();
        Map<String, String> result = new LinkedHashMap<>();
        // pass 1: keep still-valid associations so they are not stolen
        for (PageLease lease : leases.values()) {
            synchronized (lease) {
                PageTarget current = lease.target();
                if (current == null) {
                    continue;
                }
                Optional<PageTarget> refreshed = pages.stream()
                        .filter(p -> p.id().equals(current.id()))
                        .filter(p -> lease.isBusy() || adapters.get(lease.getProvider()).matchesUrl(p.url()))
                        .findFirst();
                if (refreshed.isPresent()) {
                    lease.target(refreshed.get());
                    claimed.add(current.id());
                } else if (lease.isBusy()) {
                    claimed.add(current.id());
                } else {
                    logger.info("provider {} lost tab {}", lease.getProvider(), current.id());
                    detach(lease);
                }
            }
        }
        // pass 2: associate the rest
        for (PageLease lease : leases.values()) {
            synchronized (lease) {
                if (lease.target() == null && !lease.isBusy()) {
                    Adapter adapter = adapters.get(lease.getProvider());
                    for (PageTarget page : pages) {
                        if (!claimed.contains(page.id()) && adapter.matchesUrl(page.url())) {
                            lease.target(page);
                            claimed.add(page.id());
                            logger.info("provider {} associated with tab {} ({})", lease.getProvider(), page.id(), page.url());
                            break;
                        }
                    }
                }
                if (lease.target() != null) {
                    result.put(lease.getProvider(), lease.getTabId());
                }
            }
        }
        logger.debug("discovered {} page(s), {} provider(s) associated", pages.size(), result.size());
        return result;
    }

    /**
     * Opens a tab at the base url of every provider without one.
     *
     * @return providers for which a tab was opened
     */
    public List<String> openMissingPages() {
        List<String> opened = new ArrayList<>();
        for (PageLease lease : leases.values()) {
            Adapter adapter = adapters.get(lease.getProvider());
            if (!lease.isAssociated() && adapter.getBaseUrl() != null) {
                endpoint.openPage(adapter.getBaseUrl());
                opened.add(lease.getProvider());
            }
        }
        return opened;
    }

    /**
     * Marks the provider's lease busy and returns it with an attached page.
     *
     * @throws BridgeException {@code PROVIDER_BUSY}, {@code PROVIDER_UNAVAILABLE}
     *                         or {@code TRANSPORT_UNREACHABLE} when the tab cannot be attached
     */
    public PageLease lease(String provider) {
        PageLease lease = leases.get(provider);
        if (lease == null) {
            throw new BridgeException(ErrorKind.PROVIDER_UNAVAILABLE, "no page configured for provider: " + provider);
        }
        if (!lease.tryAcquire()) {
            throw new BridgeException(ErrorKind.PROVIDER_BUSY, "provider " + provider + " has an interaction in flight");
        }
        try {
            synchronized (lease) {
                PageTarget target = lease.target();
                if (target == null) {
                    throw new BridgeException(ErrorKind.PROVIDER_UNAVAILABLE, "no browser tab is open for provider: " + provider);
                }
                Page page = lease.getPage();
                if (page == null || !page.isConnected()) {
                    if (page != null) {
                        closeQuietly(page);
                    }
                    lease.page(endpoint.attach(target));
                    logger.debug("attached to tab {} for {}", target.id(), provider);
                }
            }
            return lease;
        } catch (RuntimeException e) {
            lease.free();
            throw e;
        }
    }

    /**
     * Clears the busy flag. Safe to call on every exit path.
     */
    public void release(String provider) {
        PageLease lease = leases.get(provider);
        if (lease != null) {
            lease.free();
        }
    }

    /**
     * Drops the provider's tab association after a control-channel failure.
     * The next discovery may restore it.
     */
    public void invalidate(String provider) {
        PageLease lease = leases.get(provider);
        if (lease != null) {
            synchronized (lease) {
                logger.warn("invalidating tab {} of provider {}", lease.getTabId(), provider);
                detach(lease);
            }
        }
    }

    public LeaseState peek(String provider) {
        PageLease lease = leases.get(provider);
        return lease == null ? new LeaseState(provider, false, false, null, null) : lease.state();
    }

    public Set<String> getProviders() {
        return leases.keySet();
    }

    public void close() {
        for (PageLease lease : leases.values()) {
            synchronized (lease) {
                detach(lease);
            }
        }
    }

    private void detach(PageLease lease) {
        Page page = lease.getPage();
        if (page != null) {
            closeQuietly(page);
        }
        lease.page(null);
        lease.target(null);
    }

    private static void closeQuietly(Page page) {
        try {
            page.close();
        } catch (RuntimeException e) {
            logger.debug("error closing page {}: {}", page.getTargetId(), e.getMessage());
        }
    }

}
