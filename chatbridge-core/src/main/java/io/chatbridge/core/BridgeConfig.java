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
package io.chatbridge.core;

import io.chatbridge.adapter.Adapter;
import io.chatbridge.adapter.Adapters;
import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Engine configuration. Built in code with {@link #builder()}, or from YAML
 * with {@link #load(Path)}:
 *
 * <pre>
 * port: 9223
 * profileDir: /home/me/.chatbridge/profile
 * headless: false
 * providers: [claude, gemini]
 * adapters:
 *   claude:
 *     timeout: 90
 *     input: ["div[contenteditable='true']"]
 * </pre>
 */
public class BridgeConfig {

    public static final int DEFAULT_PORT = 9223;

    private static final Path DEFAULT_HOME = Path.of(System.getProperty("user.home"), ".chatbridge");

    private final String host;
    private final int port;
    private final String executable;
    private final Path profileDir;
    private final Path recordFile;
    private final boolean headless;
    private final List<String> addOptions;
    private final int launchPollIntervalMs;
    private final int launchMaxAttempts;
    private final int stopGraceMs;
    private final int forceKillWindowMs;
    private final boolean openMissingPages;
    private final int healthCheckIntervalMs;
    private final int commandTimeoutMs;
    private final List<String> providers;
    private final Map<String, Map<String, Object>> adapters;

    private BridgeConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.executable = builder.executable;
        this.profileDir = builder.profileDir;
        this.recordFile = builder.recordFile;
        this.headless = builder.headless;
        this.addOptions = List.copyOf(builder.addOptions);
        this.launchPollIntervalMs = builder.launchPollIntervalMs;
        this.launchMaxAttempts = builder.launchMaxAttempts;
        this.stopGraceMs = builder.stopGraceMs;
        this.forceKillWindowMs = builder.forceKillWindowMs;
        this.openMissingPages = builder.openMissingPages;
        this.healthCheckIntervalMs = builder.healthCheckIntervalMs;
        this.commandTimeoutMs = builder.commandTimeoutMs;
        this.providers = builder.providers == null ? null : List.copyOf(builder.providers);
        this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.adapters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BridgeConfig defaults() {
        return builder().build();
    }

    public static BridgeConfig load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Object parsed = new Yaml().load(reader);
            if (parsed != null && !(parsed instanceof Map)) {
                throw new IllegalArgumentException("config root must be a mapping: " + file);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) parsed;
            return fromMap(map);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read config " + file, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static BridgeConfig fromMap(Map<String, Object> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        if (map.containsKey("host")) {
            builder.host((String) map.get("host"));
        }
        if (map.containsKey("port")) {
            builder.port(toInt(map.get("port")));
        }
        if (map.containsKey("executable")) {
            builder.executable((String) map.get("executable"));
        }
        if (map.containsKey("profileDir")) {
            builder.profileDir(Path.of(map.get("profileDir").toString()));
        }
        if (map.containsKey("recordFile")) {
            builder.recordFile(Path.of(map.get("recordFile").toString()));
        }
        if (map.containsKey("headless")) {
            builder.headless(toBoolean(map.get("headless")));
        }
        if (map.containsKey("addOptions")) {
            builder.addOptions((List<String>) map.get("addOptions"));
        }
        if (map.containsKey("launchPollIntervalMs")) {
            builder.launchPollIntervalMs(toInt(map.get("launchPollIntervalMs")));
        }
        if (map.containsKey("launchMaxAttempts")) {
            builder.launchMaxAttempts(toInt(map.get("launchMaxAttempts")));
        }
        if (map.containsKey("stopGraceMs")) {
            builder.stopGraceMs(toInt(map.get("stopGraceMs")));
        }
        if (map.containsKey("forceKillWindowMs")) {
            builder.forceKillWindowMs(toInt(map.get("forceKillWindowMs")));
        }
        if (map.containsKey("openMissingPages")) {
            builder.openMissingPages(toBoolean(map.get("openMissingPages")));
        }
        if (map.containsKey("healthCheckIntervalMs")) {
            builder.healthCheckIntervalMs(toInt(map.get("healthCheckIntervalMs")));
        }
        if (map.containsKey("commandTimeoutMs")) {
            builder.commandTimeoutMs(toInt(map.get("commandTimeoutMs")));
        }
        if (map.containsKey("providers")) {
            builder.providers((List<String>) map.get("providers"));
        }
        if (map.get("adapters") instanceof Map<?, ?> adapterMap) {
            for (Map.Entry<?, ?> entry : adapterMap.entrySet()) {
                builder.adapter(entry.getKey().toString(), (Map<String, Object>) entry.getValue());
            }
        }
        return builder.build();
    }

    private static int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Adapters for the enabled providers: built-ins with any configured
     * overrides applied, plus fully configured custom providers. Enabled
     * providers default to the built-ins and every custom adapter entry.
     */
    public List<Adapter> resolveAdapters() {
        Map<String, Adapter> builtIns = Adapters.builtIns();
        List<String> enabled;
        if (providers != null) {
            enabled = providers;
        } else {
            Set<String> names = new LinkedHashSet<>(builtIns.keySet());
            names.addAll(adapters.keySet());
            enabled = new ArrayList<>(names);
        }
        List<Adapter> result = new ArrayList<>();
        for (String name : enabled) {
            Adapter base = builtIns.get(name);
            Map<String, Object> overrides = adapters.get(name);
            if (base == null && overrides == null) {
                throw new BridgeException(ErrorKind.ADAPTER_INCOMPLETE, "no adapter configured for provider: " + name);
            }
            result.add(overrides == null ? base : Adapter.fromMap(name, overrides, base));
        }
        return result;
    }

    /**
     * Start urls of the enabled providers, passed to the browser at launch.
     */
    public List<String> startUrls() {
        List<String> urls = new ArrayList<>();
        for (Adapter adapter : resolveAdapters()) {
            if (adapter.getBaseUrl() != null) {
                urls.add(adapter.getBaseUrl());
            }
        }
        return urls;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getExecutable() {
        return executable;
    }

    public Path getProfileDir() {
        return profileDir;
    }

    public Path getRecordFile() {
        return recordFile;
    }

    public boolean isHeadless() {
        return headless;
    }

    public List<String> getAddOptions() {
        return addOptions;
    }

    public int getLaunchPollIntervalMs() {
        return launchPollIntervalMs;
    }

    public int getLaunchMaxAttempts() {
        return launchMaxAttempts;
    }

    public int getStopGraceMs() {
        return stopGraceMs;
    }

    public int getForceKillWindowMs() {
        return forceKillWindowMs;
    }

    public boolean isOpenMissingPages() {
        return openMissingPages;
    }

    public int getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public int getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    /**
     * Null when not configured, meaning every known provider.
     */
    public List<String> getProviders() {
        return providers;
    }

    public Map<String, Map<String, Object>> getAdapters() {
        return adapters;
    }

    public static class Builder {

        private String host = "127.0.0.1";
        private int port = DEFAULT_PORT;
        private String executable;
        private Path profileDir = DEFAULT_HOME.resolve("profile");
        private Path recordFile = DEFAULT_HOME.resolve("browser.json");
        private boolean headless;
        private List<String> addOptions = new ArrayList<>();
        private int launchPollIntervalMs = 250;
        private int launchMaxAttempts = 60;
        private int stopGraceMs = 5000;
        private int forceKillWindowMs = 3000;
        private boolean openMissingPages = true;
        private int healthCheckIntervalMs = 30000;
        private int commandTimeoutMs = 10000;
        private List<String> providers;
        private final Map<String, Map<String, Object>> adapters = new LinkedHashMap<>();

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder executable(String executable) {
            this.executable = executable;
            return this;
        }

        public Builder profileDir(Path profileDir) {
            this.profileDir = profileDir;
            return this;
        }

        public Builder recordFile(Path recordFile) {
            this.recordFile = recordFile;
            return this;
        }

        public Builder headless(boolean headless) {
            this.headless = headless;
            return this;
        }

        public Builder addOptions(List<String> addOptions) {
            this.addOptions = addOptions == null ? new ArrayList<>() : new ArrayList<>(addOptions);
            return this;
        }

        public Builder launchPollIntervalMs(int millis) {
            this.launchPollIntervalMs = millis;
            return this;
        }

        public Builder launchMaxAttempts(int attempts) {
            this.launchMaxAttempts = attempts;
            return this;
        }

        public Builder stopGraceMs(int millis) {
            this.stopGraceMs = millis;
            return this;
        }

        public Builder forceKillWindowMs(int millis) {
            this.forceKillWindowMs = millis;
            return this;
        }

        public Builder openMissingPages(boolean open) {
            this.openMissingPages = open;
            return this;
        }

        /**
         * Zero disables the background health monitor.
         */
        public Builder healthCheckIntervalMs(int millis) {
            this.healthCheckIntervalMs = millis;
            return this;
        }

        public Builder commandTimeoutMs(int millis) {
            this.commandTimeoutMs = millis;
            return this;
        }

        public Builder providers(List<String> providers) {
            this.providers = providers;
            return this;
        }

        public Builder adapter(String name, Map<String, Object> overrides) {
            this.adapters.put(name, overrides == null ? Map.of() : overrides);
            return this;
        }

        public BridgeConfig build() {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("invalid port: " + port);
            }
            return new BridgeConfig(this);
        }

    }

}
