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
package io.chatbridge.status;

import io.chatbridge.adapter.Adapter;
import io.chatbridge.browser.BrowserHandle;
import io.chatbridge.browser.BrowserProcessSupervisor;
import io.chatbridge.pool.ConnectionPool;
import io.chatbridge.pool.LeaseState;
import io.chatbridge.session.SessionAccountant;
import io.chatbridge.session.SessionStats;
import io.chatbridge.transport.Transport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Composes browser, lease, transport and session state into snapshots. Only
 * reads volatile state, so it never waits on an interaction in flight.
 */
public class StatusAggregator {

    private final BrowserProcessSupervisor supervisor;
    private final ConnectionPool pool;
    private final Map<String, Transport> transports;
    private final SessionAccountant accountant;
    private final HealthMonitor health;

    /**
     * @param health may be null when no monitor runs
     */
    public StatusAggregator(BrowserProcessSupervisor supervisor, ConnectionPool pool,
                            Map<String, Transport> transports, SessionAccountant accountant, HealthMonitor health) {
        this.supervisor = supervisor;
        this.pool = pool;
        this.transports = transports;
        this.accountant = accountant;
        this.health = health;
    }

    public StatusSnapshot snapshot(String provider) {
        Transport transport = transports.get(provider);
        Adapter adapter = transport == null ? null : transport.getAdapter();
        BrowserHandle handle = supervisor.getHandle();
        LeaseState lease = pool.peek(provider);
        SessionStats stats = accountant.snapshot(provider);
        return new StatusSnapshot(
                provider,
                adapter == null ? provider : adapter.getDisplayName(),
                transport != null,
                transport == null ? null : transport.getName(),
                transport == null ? null : transport.getKind().getName(),
                transport == null ? null : transport.getState().getStage(),
                supervisor.isAlive(),
                supervisor.getState().name().toLowerCase(),
                handle == null ? -1 : handle.getPid(),
                pool.getEndpoint().getAddress(),
                health == null ? null : health.getLastResult(),
                health == null ? null : health.getLastCheckedAt(),
                lease.associated(),
                lease.busy(),
                lease.tabId(),
                lease.url(),
                stats,
                adapter == null ? null : adapter.getContextThresholds().levelFor(stats.contextUsagePercent()));
    }

    /**
     * Snapshots of every configured provider, in configuration order.
     */
    public Map<String, StatusSnapshot> snapshotAll() {
        Map<String, StatusSnapshot> map = new LinkedHashMap<>();
        for (String provider : transports.keySet()) {
            map.put(provider, snapshot(provider));
        }
        return map;
    }

}
