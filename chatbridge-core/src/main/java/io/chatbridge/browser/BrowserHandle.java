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

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The supervised browser. Owned by {@link BrowserProcessSupervisor}; only the
 * state changes after construction.
 */
public class BrowserHandle {

    private final BrowserProcess process;
    private final Path profileDir;
    private final String host;
    private final int port;
    private final boolean owned;
    private final Instant startedAt;
    private volatile BrowserState state;

    BrowserHandle(BrowserProcess process, Path profileDir, String host, int port, boolean owned, BrowserState state) {
        this.process = process;
        this.profileDir = profileDir;
        this.host = host;
        this.port = port;
        this.owned = owned;
        this.startedAt = Instant.now();
        this.state = state;
    }

    /**
     * Null for a browser this engine found running but did not start.
     */
    public BrowserProcess getProcess() {
        return process;
    }

    public long getPid() {
        return process == null ? -1 : process.pid();
    }

    public Path getProfileDir() {
        return profileDir;
    }

    public String getControlEndpoint() {
        return "http://" + host + ":" + port;
    }

    public int getPort() {
        return port;
    }

    /**
     * False for an externally started browser, which {@code stop} leaves running.
     */
    public boolean isOwned() {
        return owned;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public BrowserState getState() {
        return state;
    }

    void setState(BrowserState state) {
        this.state = state;
    }

    public boolean isProcessAlive() {
        return process == null || process.isAlive();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("pid", getPid());
        map.put("profileDir", profileDir == null ? null : profileDir.toString());
        map.put("controlEndpoint", getControlEndpoint());
        map.put("state", state.name().toLowerCase());
        map.put("owned", owned);
        return map;
    }

    @Override
    public String toString() {
        return "BrowserHandle[pid=" + getPid() + ", port=" + port + ", " + state + "]";
    }

}
