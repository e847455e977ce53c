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

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * On-disk hint describing the last browser this engine launched. Never trusted
 * until the pid is confirmed alive and {@link #matches} the live process.
 */
public record HandleRecord(long pid, int port, String profileDir, Instant startedAt) {

    /**
     * Whether {@code process} is the browser this record was written for and not
     * an unrelated process that was given the same pid later. Facts the
     * operating system does not report are not held against the process.
     */
    public boolean matches(BrowserProcess process, Duration startTolerance) {
        if (process.pid() != pid) {
            return false;
        }
        Optional<Instant> started = process.startInstant();
        if (started.isPresent() && !Instant.EPOCH.equals(startedAt)
                && Duration.between(startedAt, started.get()).abs().compareTo(startTolerance) > 0) {
            return false;
        }
        Optional<String> command = process.commandLine();
        return command.isEmpty() || profileDir == null || command.get().contains(profileDir);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("pid", pid);
        map.put("port", port);
        map.put("profileDir", profileDir);
        map.put("startedAt", startedAt.toString());
        return map;
    }

    public static HandleRecord fromMap(Map<String, Object> map) {
        Object pid = map.get("pid");
        Object port = map.get("port");
        Object startedAt = map.get("startedAt");
        if (!(pid instanceof Number) || !(port instanceof Number)) {
            throw new IllegalArgumentException("handle record needs numeric pid and port: " + map);
        }
        return new HandleRecord(
                ((Number) pid).longValue(),
                ((Number) port).intValue(),
                (String) map.get("profileDir"),
                startedAt == null ? Instant.EPOCH : Instant.parse(startedAt.toString()));
    }

}
