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
package io.chatbridge.browser;

import java.time.Instant;
import java.util.Optional;

/**
 * The operating system process behind a browser handle, either one this
 * engine launched or one recovered from the handle record.
 */
public interface BrowserProcess {

    long pid();

    boolean isAlive();

    /**
     * When the operating system started the process, if it reports it.
     */
    default Optional<Instant> startInstant() {
        return Optional.empty();
    }

    /**
     * Full command line, if the operating system exposes it.
     */
    default Optional<String> commandLine() {
        return Optional.empty();
    }

    /**
     * Graceful termination request (SIGTERM on POSIX).
     */
    void terminate();

    /**
     * Forced kill (SIGKILL on POSIX).
     */
    void kill();

}
