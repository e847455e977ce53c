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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CdpResponseTest {

    @Test
    void testSuccessResponse() {
        CdpResponse response = new CdpResponse(Map.of(
                "id", 7,
                "result", Map.of("result", Map.of("type", "number", "value", 3))));
        assertEquals(7, response.getId());
        assertFalse(response.isError());
        assertEquals("number", response.getResultAsString("result.type"));
        assertEquals(3, response.getResultAsInt("result.value"));
    }

    @Test
    void testErrorResponse() {
        CdpResponse response = new CdpResponse(Map.of(
                "id", 2,
                "error", Map.of("code", -32000, "message", "No node with given id found")));
        assertTrue(response.isError());
        assertEquals(-32000, response.getErrorCode());
        assertEquals("No node with given id found", response.getErrorMessage());
        assertNull(response.getResult());
    }

    @Test
    void testMissingPathIsNull() {
        CdpResponse response = new CdpResponse(Map.of("id", 1, "result", Map.of()));
        assertNull(response.getResult("result.value"));
        assertNull(response.getResultAsBoolean("result.value"));
    }

    @Test
    void testJsonPathExpression() {
        CdpResponse response = new CdpResponse(Map.of(
                "id", 4,
                "result", Map.of("frameTree", Map.of("childFrames", List.of(Map.of("frame", Map.of("id", "F1")))))));
        assertEquals("F1", response.getResultAsString("frameTree.childFrames[0].frame.id"));
    }

    @Test
    void testBooleanFromString() {
        CdpResponse response = new CdpResponse(Map.of("id", 5, "result", Map.of("result", Map.of("value", "true"))));
        assertTrue(response.getResultAsBoolean("result.value"));
    }

    @Test
    void testEvent() {
        CdpEvent event = new CdpEvent(Map.of(
                "method", "Page.frameNavigated",
                "params", Map.of("frame", Map.of("url", "https://claude.ai/chat/1"))));
        assertEquals("Page.frameNavigated", event.getMethod());
        assertEquals("https://claude.ai/chat/1", event.getAsString("frame.url"));
        assertNull(event.get("frame.parentId"));
    }

}
