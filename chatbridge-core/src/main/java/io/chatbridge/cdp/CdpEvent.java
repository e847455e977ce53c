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
 * Unsolicited DevTools notification such as {@code Inspector.detached}.
 */
public class CdpEvent {

    private final String method;
    private final Map<String, Object> params;

    @SuppressWarnings("unchecked")
    public CdpEvent(Map<String, Object> raw) {
        this.method = (String) raw.get("method");
        this.params = (Map<String, Object>) raw.get("params");
    }

    public String getMethod() {
        return method;
    }

    public <T> T get(String path) {
        return JsonPaths.read(params, path);
    }

    public String getAsString(String path) {
        return JsonPaths.readString(params, path);
    }

    @Override
    public String toString() {
        return "CdpEvent[" + method + "]";
    }

}
