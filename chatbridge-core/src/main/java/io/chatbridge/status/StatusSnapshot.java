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

import io.chatbridge.session.SessionStats;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of one provider, assembled on demand.
 */
public record StatusSnapshot(
        String provider,
        String displayName,
        boolean transportAttached,
        String transportName,
        String transportKind,
        String transportState,
        boolean browserAlive,
        String browserState,
        long browserPid,
        String controlEndpoint,
        Boolean endpointHealthy,
        Instant lastHealthCheckAt,
        boolean pageAssociated,
        boolean pageBusy,
        String tabId,
        String pageUrl,
        SessionStats stats,
        String contextWarning
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("provider", provider);
        map.put("displayName", displayName);
        Map<String, Object> transport = new LinkedHashMap<>();
        transport.put("attached", transportAttached);
        transport.put("name", transportName);
        transport.put("kind", transportKind);
        transport.put("state", transportState);
        map.put("transport", transport);
        Map<String, Object> browser = new LinkedHashMap<>();
        browser.put("alive", browserAlive);
        browser.put("state", browserState);
        browser.put("pid", browserPid);
        browser.put("controlEndpoint", controlEndpoint);
        browser.put("healthy", endpointHealthy);
        browser.put("lastHealthCheckAt", lastHealthCheckAt == null ? null : lastHealthCheckAt.toString());
        map.put("browser", browser);
        Map<String, Object> page = new LinkedHashMap<>();
        page.put("associated", pageAssociated);
        page.put("busy", pageBusy);
        page.put("tabId", tabId);
        page.put("url", pageUrl);
        map.put("page", page);
        Map<String, Object> session = stats == null ? new LinkedHashMap<>() : stats.toMap();
        session.put("contextWarning", contextWarning);
        map.put("session", session);
        return map;
    }

}
