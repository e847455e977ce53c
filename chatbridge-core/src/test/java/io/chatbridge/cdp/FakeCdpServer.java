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

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import net.minidev.json.JSONValue;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Minimal DevTools endpoint: replies to each command with whatever the
 * responder returns (dropping the command when it returns null) and can push
 * events to the connected client.
 */
class FakeCdpServer {

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final Channel channel;
    private final int port;
    private final Function<Map<String, Object>, Map<String, Object>> responder;
    private final List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
    private volatile Channel client;

    static Map<String, Object> result(Map<String, Object> result) {
        return Map.of("result", result);
    }

    static Map<String, Object> value(Object value) {
        Map<String, Object> remote = new LinkedHashMap<>();
        remote.put("type", value == null ? "undefined" : "object");
        remote.put("value", value);
        return result(Map.of("result", remote));
    }

    static FakeCdpServer start(Function<Map<String, Object>, Map<String, Object>> responder) {
        return new FakeCdpServer(responder);
    }

    private FakeCdpServer(Function<Map<String, Object>, Map<String, Object>> responder) {
        this.responder = responder;
        bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        workerGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        WebSocketServerProtocolConfig config = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath("/devtools")
                .checkStartsWith(true)
                .maxFramePayloadLength(16 * 1024 * 1024)
                .build();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<>() {
                        @Override
                        protected void initChannel(Channel c) {
                            ChannelPipeline p = c.pipeline();
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(1024 * 1024));
                            p.addLast(new WebSocketServerProtocolHandler(config));
                            p.addLast(new CommandHandler());
                        }
                    });
            channel = bootstrap.bind("127.0.0.1", 0).sync().channel();
            port = ((InetSocketAddress) channel.localAddress()).getPort();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    private class CommandHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
                client = ctx.channel();
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        @SuppressWarnings("unchecked")
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
            Map<String, Object> command = (Map<String, Object>) JSONValue.parse(frame.text());
            received.add(command);
            Map<String, Object> reply = responder.apply(command);
            if (reply == null) {
                return;
            }
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("id", command.get("id"));
            message.putAll(reply);
            ctx.writeAndFlush(new TextWebSocketFrame(JSONValue.toJSONString(message)));
        }

    }

    String wsUrl(String targetId) {
        return "ws://127.0.0.1:" + port + "/devtools/page/" + targetId;
    }

    List<Map<String, Object>> getReceived() {
        return received;
    }

    List<Map<String, Object>> received(String method) {
        return received.stream().filter(m -> method.equals(m.get("method"))).toList();
    }

    void emit(String method, Map<String, Object> params) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("method", method);
        event.put("params", params);
        client.writeAndFlush(new TextWebSocketFrame(JSONValue.toJSONString(event)));
    }

    void disconnectClient() {
        Channel c = client;
        if (c != null) {
            c.close().syncUninterruptibly();
        }
    }

    void stop() {
        channel.close();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

}
