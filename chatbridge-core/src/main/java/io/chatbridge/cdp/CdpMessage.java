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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One DevTools command under construction. Parameters keep insertion order;
 * {@link #timeout(Duration)} overrides the client's reply deadline for this
 * command only.
 *
 * <pre>
 * client.method("Runtime.evaluate")
 *         .param("expression", js)
 *         .param("returnByValue", true)
 *         .send();
 * </pre>
 */
public class CdpMessage {

    // slashes in urls stay unescaped
    private static final JSONStyle WIRE_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private final CdpClient client;
    private final int id;
    private final String method;
    private final Map<String, Object> params = new LinkedHashMap<>();
    private Duration replyDeadline;

    CdpMessage(CdpClient client, int id, String method) {
        this.client = client;
        this.id = id;
        this.method = method;
    }

    public CdpMessage param(String key, Object value) {
        params.put(key, value);
        return this;
    }

    /**
     * @param deadline how long to wait for the reply, null for the client default
     */
    public CdpMessage timeout(Duration deadline) {
        this.replyDeadline = deadline;
        return this;
    }

    public CdpResponse send() {
        return client.send(this);
    }

    int getId() {
        return id;
    }

    String getMethod() {
        return method;
    }

    Duration getTimeout() {
        return replyDeadline;
    }

    Map<String, Object> toMap() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("id", id);
        wire.put("method", method);
        if (!params.isEmpty()) {
            wire.put("params", params);
        }
        return wire;
    }

    String toJson() {
        return JSONValue.toJSONString(toMap(), WIRE_STYLE);
    }

    @Override
    public String toString() {
        return "CdpMessage[" + id + ": " + method + "]";
    }

}
