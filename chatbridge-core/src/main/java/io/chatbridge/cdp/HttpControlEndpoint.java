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
import io.chatbridge.log.LogContext;
import io.chatbridge.page.ControlEndpoint;
import io.chatbridge.page.Page;
import io.chatbridge.page.PageTarget;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Control endpoint backed by the browser's DevTools HTTP interface
 * ({@code /json/version}, {@code /json/list}, {@code /json/new}).
 */
public class HttpControlEndpoint implements ControlEndpoint {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    private final String host;
    private final int port;
    private final Duration commandTimeout;
    private final HttpClient client;

    public HttpControlEndpoint(String host, int port, Duration commandTimeout) {
        this.host = host;
        this.port = port;
        this.commandTimeout = commandTimeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public String getAddress() {
        return "http://" + host + ":" + port;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean isReachable() {
        try {
            HttpResponse<String> response = request("GET", "/json/version", Duration.ofSeconds(2));
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (Exception e) {
            logger.trace("control endpoint {} not reachable: {}", getAddress(), e.getMessage());
            return false;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<PageTarget> listPages() {
        HttpResponse<String> response = call("GET", "/json/list");
        Object parsed = JSONValue.parse(response.body());
        List<PageTarget> pages = new ArrayList<>();
        if (parsed instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map) {
                    PageTarget target = PageTarget.fromMap((Map<String, Object>) item);
                    if (target.isPage()) {
                        pages.add(target);
                    }
                }
            }
        }
        return pages;
    }

    @Override
    @SuppressWarnings("unchecked")
    public PageTarget openPage(String url) {
        // chrome 111+ rejects GET on /json/new
        HttpResponse<String> response = call("PUT", "/json/new?" + URLEncoder.encode(url, StandardCharsets.UTF_8));
        Object parsed = JSONValue.parse(response.body());
        if (!(parsed instanceof Map)) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, "unexpected /json/new reply: " + response.body());
        }
        PageTarget target = PageTarget.fromMap((Map<String, Object>) parsed);
        logger.info("opened tab {} at {}", target.id(), url);
        return target;
    }

    @Override
    public Page attach(PageTarget target) {
        if (target.webSocketDebuggerUrl() == null) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE,
                    "tab " + target.id() + " is already attached to another devtools client");
        }
        return CdpPage.connect(target, commandTimeout);
    }

    private HttpResponse<String> call(String method, String path) {
        try {
            HttpResponse<String> response = request(method, path, commandTimeout);
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE,
                        method + " " + path + " returned " + response.statusCode());
            }
            return response;
        } catch (BridgeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, null, "interrupted: " + path, e);
        } catch (Exception e) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, null,
                    "control endpoint " + getAddress() + " failed: " + e.getMessage(), e);
        }
    }

    private HttpResponse<String> request(String method, String path, Duration timeout) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(getAddress() + path))
                .timeout(timeout)
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Override
    public String toString() {
        return getAddress();
    }

}
