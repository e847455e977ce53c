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

import io.chatbridge.adapter.Adapter;
import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import io.chatbridge.log.LogContext;
import io.chatbridge.page.FakeEndpoint;
import io.chatbridge.page.FakePage;
import io.chatbridge.pool.ConnectionPool;
import io.chatbridge.session.SessionAccountant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TransportTest {

    static final String URL = "https://claude.ai/chat/1";
    static final String REPLY = "Hello there, this is a reply";

    static Adapter adapter(String... containers) {
        return Adapter.builder("claude")
                .baseUrl("https://claude.ai")
                .urlHint("claude.ai")
                .newChatUrl("https://claude.ai/new")
                .input("textarea.a", "textarea.b")
                .send("button.send")
                .stop("button.stop")
                .responseContainer(containers.length == 0 ? new String[]{"div.reply"} : containers)
                .responseContent(".markdown", ".prose")
                .newChat("a.new")
                .alerts("div.captcha")
                .defaultTimeout(Duration.ofMillis(500))
                .pollInterval(Duration.ofMillis(20))
                .snippetLength(10)
                .maxContextTokens(1000)
                .build();
    }

    FakePage page;
    ConnectionPool pool;
    SessionAccountant accountant;
    Transport transport;

    @BeforeEach
    void beforeEach() {
        page = new FakePage("A", URL)
                .interactable("textarea.a")
                .clickable("button.send")
                .counts("div.reply", 2)
                .onSubmit(p -> p.counts("div.reply", 3))
                .content("div.reply", ".markdown", REPLY, "<p>" + REPLY + "</p>");
        init(adapter());
    }

    void init(Adapter adapter) {
        FakeEndpoint endpoint = new FakeEndpoint().tab("A", URL, page);
        pool = new ConnectionPool(endpoint, List.of(adapter));
        pool.discoverPages();
        accountant = new SessionAccountant();
        transport = new Transport(adapter, pool, accountant);
    }

    @Test
    void testSendAndExtract() {
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(List.of("idle", "ensure_ready", "sending", "waiting", "extracting", "done"), result.getStages());
        assertEquals("Hello ther", result.getSnippet());
        assertEquals(REPLY, result.getContent().text());
        assertEquals(REPLY, result.getContent().markdown());
        assertNull(result.getError());
        assertEquals(List.of("input:textarea.a:hi", "click:button.send"), page.getActions());
        assertFalse(pool.peek("claude").busy());
        assertEquals(InteractionState.IDLE, transport.getState());
        assertSame(result, transport.getLastResult());
        assertEquals(1, accountant.snapshot("claude").turnCount());
        assertEquals(7, accountant.snapshot("claude").responseTokens());
    }

    @Test
    void testMetadata() {
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        Map<String, Object> metadata = result.getMetadata();
        assertEquals("web", metadata.get("transportType"));
        assertEquals("claude", metadata.get("transportName"));
        assertEquals("http://127.0.0.1:9223", metadata.get("controlEndpoint"));
        assertEquals(URL, metadata.get("pageUrl"));
        assertNotNull(metadata.get("requestId"));
        assertEquals(true, metadata.get("waited"));
        assertEquals(1.0, metadata.get("timeoutS"));
        assertTrue(metadata.containsKey("responseTimeMs"));
        assertEquals(6, ((List<?>) metadata.get("stageLog")).size());
        assertEquals(List.of(), metadata.get("warnings"));
        assertFalse(metadata.containsKey("error"));
        Map<String, Object> map = result.toMap();
        assertEquals(true, map.get("success"));
        assertEquals(REPLY, map.get("markdown"));
    }

    @Test
    void testLogContextClearedAfterSend() {
        transport.send("hi", false, null);
        assertNull(MDC.get(LogContext.PROVIDER_KEY));
        assertNull(MDC.get(LogContext.REQUEST_ID_KEY));
    }

    @Test
    void testInputCandidateFallback() {
        page = new FakePage("A", URL)
                .interactable("textarea.b")
                .clickable("button.send");
        init(adapter());
        InteractionResult result = transport.send("second", false, null);
        assertTrue(result.isSuccess());
        assertEquals("input:textarea.b:second", page.getActions().get(0));
    }

    @Test
    void testNoInteractableInput() {
        page = new FakePage("A", URL).clickable("button.send");
        init(adapter());
        InteractionResult result = transport.send("hi", true, null);
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.SELECTOR_MISSING, result.getError().kind());
        assertEquals("ensure_ready", result.getError().stage());
        assertEquals(List.of("idle", "ensure_ready", "failed"), result.getStages());
        assertTrue(page.getActions().isEmpty());
        assertFalse(pool.peek("claude").busy());
        Map<?, ?> error = (Map<?, ?>) result.getMetadata().get("error");
        assertEquals("SELECTOR_MISSING", error.get("kind"));
    }

    @Test
    void testEnterWhenNoSendControl() {
        page = new FakePage("A", URL).interactable("textarea.a");
        init(adapter());
        InteractionResult result = transport.send("hi", false, null);
        assertTrue(result.isSuccess());
        assertEquals(List.of("idle", "ensure_ready", "sending", "done"), result.getStages());
        assertEquals(List.of("input:textarea.a:hi", "enter:textarea.a"), page.getActions());
        assertNull(result.getSnippet());
        assertEquals(0, accountant.snapshot("claude").turnCount());
    }

    @Test
    void testSendFailsWhenEnterRejected() {
        page = new FakePage("A", URL).interactable("textarea.a").enterAccepted(false);
        init(adapter());
        InteractionResult result = transport.send("hi", false, null);
        assertEquals(ErrorKind.SELECTOR_MISSING, result.getError().kind());
        assertEquals("sending", result.getError().stage());
    }

    @Test
    void testWaitsWhileStopIndicatorPresent() {
        page.onSubmit(p -> p.counts("div.reply", 3).counts("button.stop", 1, 1, 1, 0));
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess(), result.toString());
        long responseTime = (Long) result.getMetadata().get("responseTimeMs");
        assertTrue(responseTime >= 50, "response time " + responseTime);
    }

    @Test
    void testWaitsForContainerToAppear() {
        page.onSubmit(p -> { })
                .counts("div.reply", 2, 2, 2, 3);
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(REPLY, result.getContent().text());
    }

    @Test
    void testContainerDeltaMustBeExactlyOne() {
        page.onSubmit(p -> p.counts("div.reply", 4));
        InteractionResult result = transport.send("hi", true, Duration.ofMillis(200));
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.RESPONSE_TIMEOUT, result.getError().kind());
        assertTrue(result.getError().detail().contains("delta 2"), result.getError().detail());
    }

    @Test
    void testResponseTimeout() {
        page.onSubmit(p -> { });
        long start = System.nanoTime();
        InteractionResult result = transport.send("hi", true, Duration.ofMillis(300));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.RESPONSE_TIMEOUT, result.getError().kind());
        assertEquals("waiting", result.getError().stage());
        assertTrue(result.getError().kind().isRecoverable());
        assertEquals(List.of("idle", "ensure_ready", "sending", "waiting", "failed"), result.getStages());
        assertTrue(elapsedMs >= 300 && elapsedMs < 1500, "elapsed " + elapsedMs);
        assertFalse(pool.peek("claude").busy());
        assertEquals(0, accountant.snapshot("claude").turnCount());
        page.onSubmit(p -> p.counts("div.reply", 3));
        InteractionResult next = transport.send("again", true, Duration.ofSeconds(1));
        assertTrue(next.isSuccess(), next.toString());
        assertEquals(1, accountant.snapshot("claude").turnCount());
    }

    @Test
    void testCompletesOnFirstPollWhereReplyIsStable() {
        // poll 1: no new container, poll 2 and 3: stop shown, poll 4: stable
        page.onSubmit(p -> p.counts("div.reply", 2, 3).counts("button.stop", 1, 1, 0));
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(5, page.getCountCalls("div.reply"));
        assertEquals(3, page.getCountCalls("button.stop"));
        assertEquals(REPLY, result.getContent().text());
    }

    @Test
    void testStalledTabCannotOutlastTimeout() {
        page.onSubmit(p -> p.countDelay(Duration.ofSeconds(3)));
        long start = System.nanoTime();
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.RESPONSE_TIMEOUT, result.getError().kind());
        assertEquals("waiting", result.getError().stage());
        assertTrue(elapsedMs < 1500, "elapsed " + elapsedMs);
        assertTrue(pool.peek("claude").associated());
        assertFalse(pool.peek("claude").busy());
    }

    @Test
    void testContainerCandidateFallback() {
        page = new FakePage("A", URL)
                .interactable("textarea.a")
                .clickable("button.send")
                .counts("div.a", 1)
                .counts("div.b", 0)
                .onSubmit(p -> p.counts("div.b", 1))
                .content("div.b", ".prose", "from b", "<p>from b</p>");
        init(adapter("div.a", "div.b"));
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess(), result.toString());
        assertEquals("from b", result.getContent().text());
    }

    @Test
    void testExtractionFallsBackToContainer() {
        page = new FakePage("A", URL)
                .interactable("textarea.a")
                .clickable("button.send")
                .onSubmit(p -> p.counts("div.reply", 1))
                .content("div.reply", null, "  raw text  ", "raw text");
        init(adapter());
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess(), result.toString());
        assertEquals("raw text", result.getContent().text());
        assertEquals("raw text", result.getSnippet());
    }

    @Test
    void testEmptyResponseWarning() {
        page = new FakePage("A", URL)
                .interactable("textarea.a")
                .clickable("button.send")
                .onSubmit(p -> p.counts("div.reply", 1));
        init(adapter());
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess());
        assertEquals("", result.getSnippet());
        assertEquals(List.of("EMPTY_RESPONSE"), result.getMetadata().get("warnings"));
        assertEquals(0, accountant.snapshot("claude").turnCount());
    }

    @Test
    void testAlertWarningDoesNotStopInteraction() {
        page.counts("div.captcha", 1);
        InteractionResult result = transport.send("hi", true, Duration.ofSeconds(1));
        assertTrue(result.isSuccess());
        assertEquals(List.of("SUSPICIOUS_PAGE_STATE"), result.getMetadata().get("warnings"));
    }

    @Test
    void testProviderBusy() {
        pool.lease("claude");
        InteractionResult result = transport.send("hi", true, null);
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.PROVIDER_BUSY, result.getError().kind());
        assertEquals(List.of("idle", "failed"), result.getStages());
        assertTrue(page.getActions().isEmpty());
        assertTrue(pool.peek("claude").busy());
    }

    @Test
    void testConcurrentSendIsRejected() throws Exception {
        page.onSubmit(p -> { });
        CompletableFuture<InteractionResult> first = CompletableFuture.supplyAsync(
                () -> transport.send("slow", true, Duration.ofMillis(500)));
        long deadline = System.currentTimeMillis() + 2000;
        while (transport.getState() != InteractionState.WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(InteractionState.WAITING, transport.getState());
        InteractionResult second = transport.send("fast", true, null);
        assertEquals(ErrorKind.PROVIDER_BUSY, second.getError().kind());
        assertEquals(ErrorKind.RESPONSE_TIMEOUT, first.get(5, TimeUnit.SECONDS).getError().kind());
        assertFalse(pool.peek("claude").busy());
    }

    @Test
    void testProviderUnavailable() {
        FakeEndpoint endpoint = new FakeEndpoint();
        pool = new ConnectionPool(endpoint, List.of(adapter()));
        transport = new Transport(adapter(), pool, new SessionAccountant());
        InteractionResult result = transport.send("hi", true, null);
        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE, result.getError().kind());
        assertNull(result.getMetadata().get("pageUrl"));
    }

    @Test
    void testUnreachableInvalidatesAssociation() {
        page.failWith(new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, "socket closed"));
        InteractionResult result = transport.send("hi", true, null);
        assertEquals(ErrorKind.TRANSPORT_UNREACHABLE, result.getError().kind());
        assertEquals("ensure_ready", result.getError().stage());
        assertFalse(pool.peek("claude").associated());
        assertFalse(pool.peek("claude").busy());
    }

    @Test
    void testUnexpectedFailureIsWrapped() {
        page.failWith(new IllegalStateException("boom"));
        InteractionResult result = transport.send("hi", true, null);
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.UNEXPECTED, result.getError().kind());
        assertTrue(result.getError().detail().contains("boom"));
    }

    @Test
    void testDefaultTimeoutFromAdapter() {
        InteractionResult result = transport.send("hi", false, Duration.ZERO);
        assertEquals(0.5, result.getMetadata().get("timeoutS"));
    }

    @Test
    void testIncompleteAdapterRejected() {
        Adapter incomplete = Adapter.builder("partial").urlHint("partial.ai").input("textarea").build();
        BridgeException e = assertThrows(BridgeException.class,
                () -> new Transport(incomplete, pool, accountant));
        assertEquals(ErrorKind.ADAPTER_INCOMPLETE, e.getKind());
        assertTrue(e.getMessage().contains("responseContainer"));
        assertFalse(e.getKind().isRecoverable());
        assertThrows(BridgeException.class, () -> new Transport(null, pool, accountant));
    }

    @Test
    void testNewSessionViaControl() {
        transport.send("hi", true, Duration.ofSeconds(1));
        assertEquals(1, accountant.snapshot("claude").turnCount());
        page.clickable("a.new");
        InteractionResult result = transport.startNewSession();
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(List.of("idle", "new_session", "done"), result.getStages());
        assertTrue(page.getActions().contains("click:a.new"));
        assertEquals(0, accountant.snapshot("claude").turnCount());
        assertFalse(pool.peek("claude").busy());
    }

    @Test
    void testNewSessionViaNavigation() {
        InteractionResult result = transport.startNewSession();
        assertTrue(result.isSuccess(), result.toString());
        assertEquals(List.of("navigate:https://claude.ai/new"), page.getActions());
        assertEquals("https://claude.ai/new", result.getMetadata().get("pageUrl"));
    }

    @Test
    void testNewSessionFailsWhenInputNeverReady() {
        page = new FakePage("A", URL).clickable("a.new");
        init(adapter());
        accountant.record("claude", "q", "answer", 100);
        InteractionResult result = transport.startNewSession();
        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.SELECTOR_MISSING, result.getError().kind());
        assertEquals("new_session", result.getError().stage());
        assertEquals(1, accountant.snapshot("claude").turnCount());
    }

}
