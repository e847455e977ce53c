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
import java.util.function.Consumer;

class FakeBrowserProcess implements BrowserProcess {

    final long pid;
    volatile boolean alive = true;
    volatile boolean ignoresTerminate;
    volatile boolean ignoresKill;
    volatile int terminateCount;
    volatile int killCount;
    Consumer<FakeBrowserProcess> beforeKill = p -> { };
    Instant startedAt;
    String commandLine;

    FakeBrowserProcess(long pid) {
        this.pid = pid;
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public Optional<Instant> startInstant() {
        return Optional.ofNullable(startedAt);
    }

    @Override
    public Optional<String> commandLine() {
        return Optional.ofNullable(commandLine);
    }

    @Override
    public void terminate() {
        terminateCount++;
        if (!ignoresTerminate) {
            alive = false;
        }
    }

    @Override
    public void kill() {
        killCount++;
        beforeKill.accept(this);
        if (!ignoresKill) {
            alive = false;
        }
    }

}
