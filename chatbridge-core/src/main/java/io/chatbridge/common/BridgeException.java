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
 * Structured failure raised by engine infrastructure.
 * Interaction code converts it into an {@code InteractionError} before it
 * reaches a caller; lifecycle operations (browser start/stop) let it propagate.
 */
public class BridgeException extends RuntimeException {

    private final ErrorKind kind;
    private final String stage;

    public BridgeException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public BridgeException(ErrorKind kind, String stage, String message) {
        this(kind, stage, message, null);
    }

    public BridgeException(ErrorKind kind, String stage, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Stage in which the failure happened, or null when not stage-scoped.
     */
    public String getStage() {
        return stage;
    }

    @Override
    public String toString() {
        return "BridgeException[" + kind.getCode() + (stage != null ? "@" + stage : "") + ": " + getMessage() + "]";
    }

}
