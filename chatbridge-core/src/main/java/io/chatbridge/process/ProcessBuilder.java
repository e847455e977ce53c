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
package io.chatbridge.process;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fluent builder for {@link ProcessConfig}.
 */
public class ProcessBuilder {

    private final List<String> args = new ArrayList<>();
    private final Map<String, String> env = new HashMap<>();
    private Path workingDir;
    private boolean redirectErrorStream = true;
    private Consumer<ProcessEvent> listener;

    private ProcessBuilder() {
    }

    public static ProcessBuilder create() {
        return new ProcessBuilder();
    }

    public ProcessBuilder args(String... args) {
        this.args.addAll(List.of(args));
        return this;
    }

    public ProcessBuilder args(List<String> args) {
        this.args.addAll(args);
        return this;
    }

    public ProcessBuilder workingDir(Path dir) {
        this.workingDir = dir;
        return this;
    }

    public ProcessBuilder env(String key, String value) {
        this.env.put(key, value);
        return this;
    }

    public ProcessBuilder redirectErrorStream(boolean redirect) {
        this.redirectErrorStream = redirect;
        return this;
    }

    public ProcessBuilder listener(Consumer<ProcessEvent> listener) {
        this.listener = listener;
        return this;
    }

    public ProcessConfig build() {
        return new ProcessConfig(args, workingDir, env, redirectErrorStream, listener);
    }

}
