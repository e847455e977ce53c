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
package io.chatbridge.http;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Text-frame WebSocket client for the browser's per-tab DevTools sockets.
 * <p>
 * All sockets share one daemon event loop. Each socket delivers its callbacks
 * on its own dispatch thread, in arrival order, so a listener must never block
 * waiting for another frame from the same socket.
 */
public class WsClient {

    private static final Logger logger = LoggerFactory.getLogger(WsClient.class);

    private static final EventLoopGroup EVENT_LOOP =
            new MultiThreadIoEventLoopGroup(1, daemonThreadFactory("devtools-io-"), NioIoHandler.newFactory());

    private static final ThreadFactory DISPATCH_THREADS = daemonThreadFactory("devtools-dispatch-");

    static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static WsClient connect(WsClientOptions options) {
        WsClient client = new WsClient(options);
        client.open();
        return client;
    }

    private final WsClientOptions options;
    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(DISPATCH_THREADS);
    private final List<Consumer<String>> textListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Channel channel;
    private volatile boolean handshakeDone;

    private WsClient(WsClientOptions options) {
        this.options = options;
    }

    private void open() {
        URI uri = options.getUri();
        long timeoutMillis = options.getConnectTimeout().toMillis();
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), options.getMaxPayloadSize());
        WsClientHandler handler = new WsClientHandler(this, handshaker);
        Bootstrap bootstrap = new Bootstrap()
                .group(EVENT_LOOP)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMillis)
                .handler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ch.pipeline().addLast(
                                new HttpClientCodec(),
                                new HttpObjectAggregator(options.getMaxPayloadSize()),
                                handler);
                    }
                });
        try {
            channel = bootstrap.connect(options.getHost(), options.getPort()).sync().channel();
            ChannelFuture handshake = handler.getHandshakeFuture();
            if (!handshake.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new WsException(WsException.Type.CONNECT_FAILED,
                        "websocket handshake timed out after " + timeoutMillis + " ms: " + uri);
            }
            if (!handshake.isSuccess()) {
                throw new WsException(WsException.Type.CONNECT_FAILED,
                        "websocket handshake failed: " + handshake.cause().getMessage(), handshake.cause());
            }
            handshakeDone = true;
            logger.debug("websocket connected: {}", uri);
        } catch (WsException e) {
            abort();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            throw new WsException(WsException.Type.CONNECT_FAILED, "connection interrupted: " + uri, e);
        } catch (Exception e) {
            abort();
            throw new WsException(WsException.Type.CONNECT_FAILED, "connection failed: " + e.getMessage(), e);
        }
    }

    private void abort() {
        closed.set(true);
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        dispatcher.shutdown();
    }

    public boolean isOpen() {
        Channel ch = channel;
        return handshakeDone && !closed.get() && ch != null && ch.isActive();
    }

    public URI getUri() {
        return options.getUri();
    }

    /**
     * Completes when the frame has been flushed to the socket.
     */
    public CompletableFuture<Void> sendText(String text) {
        if (!isOpen()) {
            return CompletableFuture.failedFuture(
                    new WsException(WsException.Type.CONNECTION_CLOSED, "websocket is not open: " + getUri()));
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) cf -> {
            if (cf.isSuccess()) {
                future.complete(null);
            } else {
                future.completeExceptionally(new WsException(WsException.Type.SEND_FAILED, "send failed", cf.cause()));
            }
        });
        return future;
    }

    public void onText(Consumer<String> listener) {
        textListeners.add(listener);
    }

    /**
     * Runs once, after the socket is gone, whichever side closed it.
     */
    public void onClose(Runnable listener) {
        closeListeners.add(listener);
    }

    public void onError(Consumer<Throwable> listener) {
        errorListeners.add(listener);
    }

    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            // the dispatcher is shut down by handleDisconnect once the channel goes inactive
            ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            dispatcher.shutdown();
        }
    }

    void handleText(String text) {
        dispatch(() -> {
            for (Consumer<String> listener : textListeners) {
                try {
                    listener.accept(text);
                } catch (Exception e) {
                    logger.error("text listener error: {}", e.getMessage());
                }
            }
        });
    }

    void handleDisconnect() {
        closed.set(true);
        dispatch(() -> {
            for (Runnable listener : closeListeners) {
                try {
                    listener.run();
                } catch (Exception e) {
                    logger.error("close listener error: {}", e.getMessage());
                }
            }
        });
        dispatcher.shutdown();
    }

    void handleError(Throwable cause) {
        dispatch(() -> {
            for (Consumer<Throwable> listener : errorListeners) {
                try {
                    listener.accept(cause);
                } catch (Exception e) {
                    logger.error("error listener error: {}", e.getMessage());
                }
            }
        });
    }

    private void dispatch(Runnable task) {
        try {
            dispatcher.execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("socket {} already shut down, dropping callback", getUri());
        }
    }

}
