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

import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import io.chatbridge.page.PageContent;
import io.chatbridge.page.PageTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class CdpPageTest {

    FakeCdpServer server;
    CdpPage page;

    @SuppressWarnings("unchecked")
    static Map<String, Object> respond(Map<String, Object> command) {
        String method = (String) command.get("method");
        Map<String, Object> params = (Map<String, Object>) command.get("params");
        switch (method) {
            case "Runtime.evaluate": {
                String expression = (String) params.get("expression");
                if (expression.contains("div.slow")) {
                    return null;
                }
                if (expression.contains("boom")) {
                    return FakeCdpServer.result(Map.of(
                            "result", Map.of("type", "object"),
                            "exceptionDetails", Map.of("text", "Uncaught",
                                    "exception", Map.of("description", "ReferenceError: boom is not defined"))));
                }
                if (expression.equals("1")) {
                    return FakeCdpServer.value(1);
                }
                if (expression.equals("location.href")) {
                    return FakeCdpServer.value("https://claude.ai/chat/9");
                }
                if (expression.contains("innerText")) {
                    return FakeCdpServer.value(Map.of("text", "hi there", "html", "<p>hi there</p>"));
                }
                if (expression.endsWith(".length")) {
                    return FakeCdpServer.value(3);
                }
                if (expression.contains("button.missing")) {
                    return FakeCdpServer.value(false);
                }
                return FakeCdpServer.value(true);
            }
            case "Page.navigate":
                return FakeCdpServer.result(((String) params.get("url")).contains("bad")
                        ? Map.of("frameId", "F1", "errorText", "net::ERR_NAME_NOT_RESOLVED")
                        : Map.of("frameId", "F1"));
            default:
                return FakeCdpServer.result(Map.of());
        }
    }

    @BeforeEach
    void beforeEach() {
        server = FakeCdpServer.start(CdpPageTest::respond);
        PageTarget target = new PageTarget("T1", "page", "https://claude.ai/new", "Claude", server.wsUrl("T1"));
        page = CdpPage.connect(target, Duration.ofMillis(500));
    }

    @AfterEach
    void afterEach() {
        page.close();
        server.stop();
    }

    static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean());
    }

    @Test
    void testConnectEnablesPage() {
        assertTrue(page.isConnected());
        assertEquals("T1", page.getTargetId());
        assertEquals(1, server.received("Page.enable").size());
        Map<String, Object> first = server.getReceived().get(0);
        assertEquals("Runtime.evaluate", first.get("method"));
    }

    @Test
    void testCountAndInteractable() {
        assertEquals(3, page.count("div.reply"));
        assertTrue(page.exists("div.reply"));
        assertTrue(page.isInteractable("textarea"));
    }

    @Test
    void testClick() {
        assertTrue(page.click("button.send"));
        assertFalse(page.click("button.missing"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testInputInsertsText() {
        assertTrue(page.input("textarea", "hello \"world\""));
        List<Map<String, Object>> inserts = server.received("Input.insertText");
        assertEquals(1, inserts.size());
        assertEquals("hello \"world\"", ((Map<String, Object>) inserts.get(0).get("params")).get("text"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testPressEnter() {
        assertTrue(page.pressEnter("textarea"));
        List<String> types = server.received("Input.dispatchKeyEvent").stream()
                .map(m -> (String) ((Map<String, Object>) m.get("params")).get("type"))
                .toList();
        assertEquals(List.of("rawKeyDown", "char", "keyUp"), types);
    }

    @Test
    void testContent() {
        PageContent content = page.content("div.reply", ".markdown");
        assertEquals("hi there", content.text());
        assertEquals("<p>hi there</p>", content.html());
    }

    @Test
    void testUrlFromLocation() {
        assertEquals("https://claude.ai/chat/9", page.getUrl());
    }

    @Test
    void testNavigate() {
        page.navigate("https://claude.ai/new");
        BridgeException e = assertThrows(BridgeException.class, () -> page.navigate("https://bad.example"));
        assertEquals(ErrorKind.UNEXPECTED, e.getKind());
        assertTrue(e.getMessage().contains("ERR_NAME_NOT_RESOLVED"));
    }

    @Test
    void testScriptError() {
        BridgeException e = assertThrows(BridgeException.class, () -> page.eval("boom()"));
        assertEquals(ErrorKind.UNEXPECTED, e.getKind());
        assertTrue(e.getMessage().contains("ReferenceError"));
    }

    @Test
    void testCommandTimeout() {
        BridgeException e = assertThrows(BridgeException.class, () -> page.count("div.slow"));
        assertEquals(ErrorKind.TRANSPORT_UNREACHABLE, e.getKind());
        assertTrue(page.isConnected());
    }

    @Test
    void testBoundedCountTimesOutAsResponseTimeout() {
        long start = System.nanoTime();
        BridgeException e = assertThrows(BridgeException.class, () -> page.count("div.slow", Duration.ofMillis(100)));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertEquals(ErrorKind.RESPONSE_TIMEOUT, e.getKind());
        assertTrue(elapsedMs < 450, "elapsed " + elapsedMs);
        assertTrue(page.isConnected());
        assertEquals(3, page.count("div.reply"));
    }

    @Test
    void testDetachedEvent() throws Exception {
        server.emit("Inspector.detached", Map.of("reason", "replaced_with_devtools"));
        await(() -> !page.isConnected());
    }

    @Test
    void testFrameNavigatedUpdatesUrl() throws Exception {
        server.emit("Page.frameNavigated", Map.of("frame", Map.of("id", "F1", "url", "https://claude.ai/chat/42")));
        server.disconnectClient();
        await(() -> !page.isConnected());
        await(() -> "https://claude.ai/chat/42".equals(page.getUrl()));
    }

    @Test
    void testConnectionLoss() throws Exception {
        server.disconnectClient();
        await(() -> !page.isConnected());
        BridgeException e = assertThrows(BridgeException.class, () -> page.count("div.reply"));
        assertEquals(ErrorKind.TRANSPORT_UNREACHABLE, e.getKind());
    }

    @Test
    void testConnectToClosedPortFails() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        PageTarget target = new PageTarget("T2", "page", "about:blank", null,
                "ws://127.0.0.1:" + port + "/devtools/page/T2");
        BridgeException e = assertThrows(BridgeException.class, () -> CdpPage.connect(target, Duration.ofMillis(500)));
        assertEquals(ErrorKind.TRANSPORT_UNREACHABLE, e.getKind());
    }

}
