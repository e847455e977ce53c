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
package io.chatbridge.common;

/**
 * Error taxonomy reported by the engine.
 * Every failure surfaced to a caller carries exactly one of these kinds.
 */
public enum ErrorKind {

    SELECTOR_MISSING("SELECTOR_MISSING", true),
    RESPONSE_TIMEOUT("RESPONSE_TIMEOUT", true),
    PROVIDER_BUSY("PROVIDER_BUSY", true),
    PROVIDER_UNAVAILABLE("PROVIDER_UNAVAILABLE", true),
    TRANSPORT_UNREACHABLE("TRANSPORT_UNREACHABLE", true),
    TRANSPORT_NOT_ATTACHED("TRANSPORT_NOT_ATTACHED", false),
    BROWSER_LAUNCH_FAILED("BROWSER_LAUNCH_FAILED", true),
    STOP_FAILED("STOP_FAILED", true),
    ADAPTER_INCOMPLETE("ADAPTER_INCOMPLETE", false),
    UNEXPECTED("UNEXPECTED", true);

    private final String code;
    private final boolean recoverable;

    ErrorKind(String code, boolean recoverable) {
        this.code = code;
        this.recoverable = recoverable;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether retrying the same operation later may succeed without
     * changing configuration.
     */
    public boolean isRecoverable() {
        return recoverable;
    }

}
