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
package io.chatbridge.cdp;

import java.util.Map;

/**
 * Reply to a DevTools command, either a {@code result} object or an {@code error}.
 */
public class CdpResponse {

    private final int id;
    private final Map<String, Object> result;
    private final Map<String, Object> error;

    @SuppressWarnings("unchecked")
    public CdpResponse(Map<String, Object> raw) {
        this.id = raw.get("id") instanceof Number n ? n.intValue() : -1;
        this.result = (Map<String, Object>) raw.get("result");
        this.error = (Map<String, Object>) raw.get("error");
    }

    public int getId() {
        return id;
    }

    public boolean isError() {
        return error != null;
    }

    public String getErrorMessage() {
        return JsonPaths.readString(error, "message");
    }

    public Integer getErrorCode() {
        return JsonPaths.readInt(error, "code");
    }

    public Map<String, Object> getResult() {
        return result;
    }

    /**
     * Path is relative to {@code result}, e.g. {@code "result.value"} for Runtime.evaluate.
     */
    public <T> T getResult(String path) {
        return JsonPaths.read(result, path);
    }

    public String getResultAsString(String path) {
        return JsonPaths.readString(result, path);
    }

    public Integer getResultAsInt(String path) {
        return JsonPaths.readInt(result, path);
    }

    public Boolean getResultAsBoolean(String path) {
        return JsonPaths.readBoolean(result, path);
    }

    @Override
    public String toString() {
        if (isError()) {
            return "CdpResponse[" + id + " ERROR: " + getErrorMessage() + "]";
        }
        return "CdpResponse[" + id + "]";
    }

}
