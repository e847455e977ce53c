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

import io.chatbridge.process.ProcessHandle;

import java.time.Instant;
import java.util.Optional;

/**
 * A browser started by this process, with its output streams drained.
 */
public class LocalBrowserProcess implements BrowserProcess {

    private final ProcessHandle handle;

    public LocalBrowserProcess(ProcessHandle handle) {
        this.handle = handle;
    }

    @Override
    public long pid() {
        return handle.getPid();
    }

    @Override
    public boolean isAlive() {
        return handle.isAlive();
    }

    @Override
    public Optional<Instant> startInstant() {
        return handle.getStartInstant();
    }

    @Override
    public void terminate() {
        handle.close(false);
    }

    @Override
    public void kill() {
        handle.close(true);
    }

    /**
     * Last lines written by the browser, for launch diagnostics.
     */
    public String getOutputTail() {
        return handle.getOutputTail();
    }

}
