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

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for one {@link WsClient} socket.
 */
public class WsClientOptions {

    public static final int MEGABYTE = 1024 * 1024;

    private final URI uri;
    private final int maxPayloadSize;
    private final Duration connectTimeout;

    private WsClientOptions(Builder builder) {
        this.uri = builder.uri;
        this.maxPayloadSize = builder.maxPayloadSize;
        this.connectTimeout = builder.connectTimeout;
    }

    public static Builder builder(String uri) {
        return new Builder(uri == null ? null : URI.create(uri));
    }

    public static Builder builder(URI uri) {
        return new Builder(uri);
    }

    public URI getUri() {
        return uri;
    }

    public String getHost() {
        return uri.getHost();
    }

    public int getPort() {
        return uri.getPort() != -1 ? uri.getPort() : 80;
    }

    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    /**
     * Bounds both the TCP connect and the upgrade handshake.
     */
    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public static class Builder {

        private final URI uri;
        private int maxPayloadSize = MEGABYTE;
        private Duration connectTimeout = Duration.ofSeconds(10);

        private Builder(URI uri) {
            if (uri == null) {
                throw new IllegalArgumentException("URI cannot be null");
            }
            // devtools only listens on plain sockets
            if (!"ws".equalsIgnoreCase(uri.getScheme())) {
                throw new IllegalArgumentException("only ws:// endpoints are supported: " + uri);
            }
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("websocket URI has no host: " + uri);
            }
            this.uri = uri;
        }

        public Builder maxPayloadSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("max payload size must be positive: " + size);
            }
            this.maxPayloadSize = size;
            return this;
        }

        public Builder connectTimeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("connect timeout must be positive: " + timeout);
            }
            this.connectTimeout = timeout;
            return this;
        }

        public WsClientOptions build() {
            return new WsClientOptions(this);
        }

    }

}
