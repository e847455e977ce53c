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
package io.chatbridge.adapter;

import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of one chat provider's UI: ordered locator candidates
 * per role plus timing defaults. Holds no behavior; the shared
 * {@link io.chatbridge.transport.Transport} interprets it.
 *
 * <p>Candidate lists are tried in order and the first one that resolves wins,
 * so put the most specific locator first.</p>
 */
public final class Adapter {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(300);
    public static final int DEFAULT_SNIPPET_LENGTH = 280;

    private final String name;
    private final String displayName;
    private final String baseUrl;
    private final String urlHint;
    private final String newChatUrl;
    private final List<String> input;
    private final List<String> send;
    private final List<String> stop;
    private final List<String> responseContainer;
    private final List<String> responseContent;
    private final List<String> newChat;
    private final List<String> alerts;
    private final Duration defaultTimeout;
    private final Duration pollInterval;
    private final int snippetLength;
    private final int maxContextTokens;
    private final ContextThresholds contextThresholds;

    private Adapter(Builder builder) {
        this.name = builder.name;
        this.displayName = builder.displayName != null ? builder.displayName : builder.name;
        this.baseUrl = builder.baseUrl;
        this.urlHint = builder.urlHint;
        this.newChatUrl = builder.newChatUrl;
        this.input = List.copyOf(builder.input);
        this.send = List.copyOf(builder.send);
        this.stop = List.copyOf(builder.stop);
        this.responseContainer = List.copyOf(builder.responseContainer);
        this.responseContent = List.copyOf(builder.responseContent);
        this.newChat = List.copyOf(builder.newChat);
        this.alerts = List.copyOf(builder.alerts);
        this.defaultTimeout = builder.defaultTimeout;
        this.pollInterval = builder.pollInterval;
        this.snippetLength = builder.snippetLength;
        this.maxContextTokens = builder.maxContextTokens;
        this.contextThresholds = builder.contextThresholds;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder pre-filled with this adapter's values, for per-deployment overrides.
     */
    public Builder toBuilder() {
        Builder b = new Builder(name)
                .displayName(displayName)
                .baseUrl(baseUrl)
                .urlHint(urlHint)
                .newChatUrl(newChatUrl)
                .defaultTimeout(defaultTimeout)
                .pollInterval(pollInterval)
                .snippetLength(snippetLength)
                .maxContextTokens(maxContextTokens)
                .contextThresholds(contextThresholds);
        b.input.addAll(input);
        b.send.addAll(send);
        b.stop.addAll(stop);
        b.responseContainer.addAll(responseContainer);
        b.responseContent.addAll(responseContent);
        b.newChat.addAll(newChat);
        b.alerts.addAll(alerts);
        return b;
    }

    /**
     * Fails with {@code ADAPTER_INCOMPLETE} naming every missing field.
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(urlHint)) {
            missing.add("urlHint");
        }
        if (input.isEmpty()) {
            missing.add("input");
        }
        if (send.isEmpty()) {
            missing.add("send");
        }
        if (stop.isEmpty()) {
            missing.add("stop");
        }
        if (responseContainer.isEmpty()) {
            missing.add("responseContainer");
        }
        if (responseContent.isEmpty()) {
            missing.add("responseContent");
        }
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            missing.add("defaultTimeout");
        }
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            missing.add("pollInterval");
        }
        if (!missing.isEmpty()) {
            throw new BridgeException(ErrorKind.ADAPTER_INCOMPLETE,
                    "adapter '" + name + "' is missing: " + String.join(", ", missing));
        }
    }

    /**
     * Case-insensitive substring match of the url hint against a tab address.
     */
    public boolean matchesUrl(String url) {
        return url != null && !isBlank(urlHint) && url.toLowerCase().contains(urlHint.toLowerCase());
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getUrlHint() {
        return urlHint;
    }

    /**
     * Address of a fresh conversation, falling back to the base url.
     */
    public String getNewChatUrl() {
        return newChatUrl != null ? newChatUrl : baseUrl;
    }

    public List<String> getInput() {
        return input;
    }

    public List<String> getSend() {
        return send;
    }

    public List<String> getStop() {
        return stop;
    }

    public List<String> getResponseContainer() {
        return responseContainer;
    }

    public List<String> getResponseContent() {
        return responseContent;
    }

    public List<String> getNewChat() {
        return newChat;
    }

    public List<String> getAlerts() {
        return alerts;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getSnippetLength() {
        return snippetLength;
    }

    public int getMaxContextTokens() {
        return maxContextTokens;
    }

    public ContextThresholds getContextThresholds() {
        return contextThresholds;
    }

    @Override
    public String toString() {
        return "Adapter[" + name + " " + urlHint + "]";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Builds an adapter from configuration. Keys mirror the builder methods;
     * locator roles accept either a single string or a list. Timeouts are in
     * seconds ({@code timeout}) and milliseconds ({@code pollIntervalMs}).
     * When {@code base} is not null, only keys present in the map override it.
     */
    public static Adapter fromMap(String name, Map<String, Object> map, Adapter base) {
        Builder b = base != null ? base.toBuilder() : builder(name);
        if (map == null) {
            return b.build();
        }
        if (map.containsKey("displayName")) {
            b.displayName((String) map.get("displayName"));
        }
        if (map.containsKey("baseUrl")) {
            b.baseUrl((String) map.get("baseUrl"));
        }
        if (map.containsKey("urlHint")) {
            b.urlHint((String) map.get("urlHint"));
        }
        if (map.containsKey("newChatUrl")) {
            b.newChatUrl((String) map.get("newChatUrl"));
        }
        if (map.containsKey("input")) {
            b.input = toList(map.get("input"));
        }
        if (map.containsKey("send")) {
            b.send = toList(map.get("send"));
        }
        if (map.containsKey("stop")) {
            b.stop = toList(map.get("stop"));
        }
        if (map.containsKey("responseContainer")) {
            b.responseContainer = toList(map.get("responseContainer"));
        }
        if (map.containsKey("responseContent")) {
            b.responseContent = toList(map.get("responseContent"));
        }
        if (map.containsKey("newChat")) {
            b.newChat = toList(map.get("newChat"));
        }
        if (map.containsKey("alerts")) {
            b.alerts = toList(map.get("alerts"));
        }
        if (map.containsKey("timeout")) {
            b.defaultTimeout(Duration.ofMillis(Math.round(((Number) map.get("timeout")).doubleValue() * 1000)));
        }
        if (map.containsKey("pollIntervalMs")) {
            b.pollInterval(Duration.ofMillis(((Number) map.get("pollIntervalMs")).longValue()));
        }
        if (map.containsKey("snippetLength")) {
            b.snippetLength(((Number) map.get("snippetLength")).intValue());
        }
        if (map.containsKey("maxContextTokens")) {
            b.maxContextTokens(((Number) map.get("maxContextTokens")).intValue());
        }
        if (map.get("contextWarning") instanceof Map<?, ?> warning) {
            ContextThresholds current = b.contextThresholds;
            b.contextThresholds(new ContextThresholds(
                    number(warning.get("yellow"), current.yellow()),
                    number(warning.get("orange"), current.orange()),
                    number(warning.get("red"), current.red())));
        }
        return b.build();
    }

    private static double number(Object value, double fallback) {
        return value instanceof Number n ? n.doubleValue() : fallback;
    }

    private static List<String> toList(Object value) {
        List<String> list = new ArrayList<>();
        if (value instanceof List<?> items) {
            for (Object item : items) {
                if (item != null) {
                    list.add(item.toString());
                }
            }
        } else if (value != null) {
            list.add(value.toString());
        }
        return list;
    }

    public static class Builder {

        private final String name;
        private String displayName;
        private String baseUrl;
        private String urlHint;
        private String newChatUrl;
        private List<String> input = new ArrayList<>();
        private List<String> send = new ArrayList<>();
        private List<String> stop = new ArrayList<>();
        private List<String> responseContainer = new ArrayList<>();
        private List<String> responseContent = new ArrayList<>();
        private List<String> newChat = new ArrayList<>();
        private List<String> alerts = new ArrayList<>();
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int snippetLength = DEFAULT_SNIPPET_LENGTH;
        private int maxContextTokens;
        private ContextThresholds contextThresholds = ContextThresholds.DEFAULT;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new BridgeException(ErrorKind.ADAPTER_INCOMPLETE, "adapter name cannot be empty");
            }
            this.name = name;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder urlHint(String urlHint) {
            this.urlHint = urlHint;
            return this;
        }

        public Builder newChatUrl(String newChatUrl) {
            this.newChatUrl = newChatUrl;
            return this;
        }

        public Builder input(String... locators) {
            input.addAll(List.of(locators));
            return this;
        }

        public Builder send(String... locators) {
            send.addAll(List.of(locators));
            return this;
        }

        public Builder stop(String... locators) {
            stop.addAll(List.of(locators));
            return this;
        }

        public Builder responseContainer(String... locators) {
            responseContainer.addAll(List.of(locators));
            return this;
        }

        public Builder responseContent(String... locators) {
            responseContent.addAll(List.of(locators));
            return this;
        }

        public Builder newChat(String... locators) {
            newChat.addAll(List.of(locators));
            return this;
        }

        public Builder alerts(String... locators) {
            alerts.addAll(List.of(locators));
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder snippetLength(int snippetLength) {
            this.snippetLength = snippetLength;
            return this;
        }

        public Builder maxContextTokens(int maxContextTokens) {
            this.maxContextTokens = maxContextTokens;
            return this;
        }

        public Builder contextThresholds(ContextThresholds contextThresholds) {
            this.contextThresholds = contextThresholds;
            return this;
        }

        public Adapter build() {
            return new Adapter(this);
        }

    }

}
