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

import io.chatbridge.common.ErrorKind;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of an interaction. Failures are values, never exceptions: check
 * {@link #isSuccess()} and {@link #getError()}.
 */
public class InteractionResult {

    private final boolean success;
    private final String snippet;
    private final ResponseContent content;
    private final InteractionError error;
    private final List<StageEntry> stageLog;
    private final Map<String, Object> metadata;

    InteractionResult(boolean success, String snippet, ResponseContent content, InteractionError error,
                      List<StageEntry> stageLog, Map<String, Object> metadata) {
        this.success = success;
        this.snippet = snippet;
        this.content = content;
        this.error = error;
        this.stageLog = List.copyOf(stageLog);
        this.metadata = metadata;
    }

    /**
     * Failure for a provider that has no transport, produced before any
     * interaction starts.
     */
    public static InteractionResult notAttached(String provider, String controlEndpoint) {
        InteractionError error = new InteractionError(ErrorKind.TRANSPORT_NOT_ATTACHED,
                InteractionState.IDLE.getStage(), "no transport attached for provider: " + provider);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("transportType", null);
        metadata.put("transportName", provider);
        metadata.put("controlEndpoint", controlEndpoint);
        metadata.put("pageUrl", null);
        metadata.put("requestId", UUID.randomUUID().toString());
        metadata.put("elapsedMs", 0L);
        metadata.put("stageLog", List.of());
        metadata.put("warnings", List.of());
        metadata.put("error", error.toMap());
        metadata.put("timestamp", Instant.now().toString());
        return new InteractionResult(false, null, null, error, List.of(), metadata);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Leading characters of the reply text, or null when nothing was extracted.
     */
    public String getSnippet() {
        return snippet;
    }

    public ResponseContent getContent() {
        return content;
    }

    public InteractionError getError() {
        return error;
    }

    public List<StageEntry> getStageLog() {
        return stageLog;
    }

    public List<String> getStages() {
        return stageLog.stream().map(StageEntry::stage).toList();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        map.put("snippet", snippet);
        map.put("markdown", content == null ? null : content.markdown());
        map.put("metadata", metadata);
        return map;
    }

    @Override
    public String toString() {
        return success
                ? "InteractionResult[ok " + getStages() + "]"
                : "InteractionResult[" + error.kind().getCode() + "@" + error.stage() + ": " + error.detail() + "]";
    }

}
