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

import io.chatbridge.http.WsClient;
import io.chatbridge.http.WsClientOptions;
import io.chatbridge.http.WsException;
import io.chatbridge.log.LogContext;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * DevTools protocol session over one page's WebSocket. Correlates replies to
 * commands by id and fans events out to subscribers by method name.
 */
public class CdpClient {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    private final WsClient ws;
    private final AtomicInteger idGenerator = new AtomicInteger();
    private final ConcurrentHashMap<Integer, CompletableFuture<CdpResponse>> pending = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Consumer<CdpEvent>>> eventHandlers = new ConcurrentHashMap<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final Duration defaultTimeout;

    public static CdpClient connect(String webSocketUrl, Duration defaultTimeout) {
        WsClientOptions options = WsClientOptions.builder(webSocketUrl)
                .connectTimeout(defaultTimeout)
                .maxPayloadSize(WsClientOptions.MEGABYTE * 16)
                .build();
        CdpClient client = new CdpClient(WsClient.connect(options), defaultTimeout);
        try {
            client.waitForReady();
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        return client;
    }

    private CdpClient(WsClient ws, Duration defaultTimeout) {
        this.ws = ws;
        this.defaultTimeout = defaultTimeout;
        ws.onText(this::handleMessage);
        ws.onClose(() -> {
            for (CompletableFuture<CdpResponse> future : pending.values()) {
                future.completeExceptionally(new WsException(WsException.Type.CONNECTION_CLOSED, "websocket closed"));
            }
            pending.clear();
            closeListeners.forEach(Runnable::run);
        });
        ws.onError(error -> logger.warn("devtools connection error: {}", error.getMessage()));
    }

    private void waitForReady() {
        CdpResponse response = method("Runtime.evaluate")
                .param("expression", "1")
                .param("returnByValue", true)
                .send();
        if (response.isError()) {
            logger.warn("devtools readiness check returned error: {}", response.getErrorMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private void handleMessage(String json) {
        Map<String, Object> map;
        try {
            map = (Map<String, Object>) JSONValue.parseWithException(json);
        } catch (Exception e) {
            logger.error("failed to parse devtools message: {}", e.getMessage());
            return;
        }
        if (map.containsKey("id")) {
            int id = ((Number) map.get("id")).intValue();
            CompletableFuture<CdpResponse> future = pending.remove(id);
            if (future != null) {
                future.complete(new CdpResponse(map));
            } else {
                logger.debug("reply for unknown or expired request id: {}", id);
            }
        } else if (map.containsKey("method")) {
            CdpEvent event = new CdpEvent(map);
            List<Consumer<CdpEvent>> handlers = eventHandlers.get(event.getMethod());
            if (handlers != null) {
                for (Consumer<CdpEvent> handler : handlers) {
                    try {
                        handler.accept(event);
                    } catch (Exception e) {
                        logger.error("event handler error for {}: {}", event.getMethod(), e.getMessage());
                    }
                }
            }
        }
    }

    public CdpMessage method(String method) {
        return new CdpMessage(this, idGenerator.incrementAndGet(), method);
    }

    /**
     * Blocking send. A reply that does not arrive within the message or default
     * timeout fails with {@link TimeoutException} as the cause.
     */
    CdpResponse send(CdpMessage message) {
        try {
            return sendAsync(message).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                throw new CdpTimeoutException(message.getMethod());
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new WsException(WsException.Type.SEND_FAILED, "devtools error: " + cause.getMessage(), cause);
        }
    }

    CompletableFuture<CdpResponse> sendAsync(CdpMessage message) {
        if (!ws.isOpen()) {
            return CompletableFuture.failedFuture(
                    new WsException(WsException.Type.CONNECTION_CLOSED, "websocket not open"));
        }
        CompletableFuture<CdpResponse> future = new CompletableFuture<>();
        int messageId = message.getId();
        pending.put(messageId, future);
        String json = message.toJson();
        logger.trace(">>> {}", json);
        ws.sendText(json).whenComplete((v, ex) -> {
            if (ex != null) {
                pending.remove(messageId);
                future.completeExceptionally(ex);
            }
        });
        Duration timeout = message.getTimeout() != null ? message.getTimeout() : defaultTimeout;
        return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> {
                    if (ex instanceof TimeoutException) {
                        pending.remove(messageId);
                        logger.debug("devtools request {} ({}) timed out", messageId, message.getMethod());
                    }
                });
    }

    public void on(String eventName, Consumer<CdpEvent> handler) {
        eventHandlers.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void onClose(Runnable listener) {
        closeListeners.add(listener);
    }

    public boolean isOpen() {
        return ws.isOpen();
    }

    public void close() {
        ws.close();
    }

}
