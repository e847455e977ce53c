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
package io.chatbridge.session;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of one provider's cumulative counters.
 */
public record SessionStats(
        String provider,
        int turnCount,
        int messageCount,
        long sentTokens,
        long responseTokens,
        long lastResponseTimeMs,
        double lastTokensPerSec,
        long avgResponseTimeMs,
        double avgTokensPerSec,
        int contextWindowTokens,
        Instant sessionStartedAt,
        Instant lastInteractionAt
) {

    public static SessionStats empty(String provider, int contextWindowTokens, Instant startedAt) {
        return new SessionStats(provider, 0, 0, 0, 0, 0, 0, 0, 0, contextWindowTokens, startedAt, null);
    }

    public long tokenCount() {
        return sentTokens + responseTokens;
    }

    /**
     * Zero when the context window is unknown.
     */
    public double contextUsagePercent() {
        if (contextWindowTokens <= 0) {
            return 0;
        }
        return tokenCount() * 100.0 / contextWindowTokens;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("turnCount", turnCount);
        map.put("messageCount", messageCount);
        map.put("tokenCount", tokenCount());
        map.put("sentTokens", sentTokens);
        map.put("responseTokens", responseTokens);
        map.put("lastResponseTimeMs", lastResponseTimeMs);
        map.put("lastTokensPerSec", round(lastTokensPerSec, 1));
        map.put("avgResponseTimeMs", avgResponseTimeMs);
        map.put("avgTokensPerSec", round(avgTokensPerSec, 1));
        map.put("contextWindowTokens", contextWindowTokens);
        map.put("contextUsagePercent", round(contextUsagePercent(), 2));
        map.put("sessionStartedAt", sessionStartedAt == null ? null : sessionStartedAt.toString());
        map.put("lastInteractionAt", lastInteractionAt == null ? null : lastInteractionAt.toString());
        return map;
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

}
