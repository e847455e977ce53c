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
package io.chatbridge.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Category loggers and per-interaction diagnostic context.
 * <p>
 * Interactions run with the MDC keys {@value #PROVIDER_KEY} and {@value #REQUEST_ID_KEY}
 * set so that every log line emitted on that thread can be correlated with the
 * request that caused it.
 */
public final class LogContext {

    // ========== Category Loggers ==========

    /** Logger for engine lifecycle (start, stop, discovery, configuration) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("chatbridge.runtime");

    /** Logger for the browser process and its control endpoint */
    public static final Logger BROWSER_LOGGER = LoggerFactory.getLogger("chatbridge.browser");

    /** Logger for interaction stage transitions */
    public static final Logger INTERACTION_LOGGER = LoggerFactory.getLogger("chatbridge.interaction");

    public static final String PROVIDER_KEY = "provider";
    public static final String REQUEST_ID_KEY = "requestId";

    private LogContext() {
    }

    /**
     * Bind the interaction identity to the current thread.
     * Callers must pair this with {@link #clear()} in a finally block.
     */
    public static void enter(String provider, String requestId) {
        MDC.put(PROVIDER_KEY, provider);
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    public static void clear() {
        MDC.remove(PROVIDER_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }

}
