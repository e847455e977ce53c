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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdapterTest {

    @Test
    void testBuiltInsAreComplete() {
        Map<String, Adapter> builtIns = Adapters.builtIns();
        assertEquals(List.of("claude", "chatgpt", "gemini"), List.copyOf(builtIns.keySet()));
        for (Adapter adapter : builtIns.values()) {
            adapter.validate();
            assertTrue(adapter.getMaxContextTokens() > 0, adapter.getName());
            assertTrue(adapter.matchesUrl(adapter.getBaseUrl()), adapter.getName());
        }
    }

    @Test
    void testMatchesUrlIgnoresCase() {
        Adapter claude = Adapters.claude();
        assertTrue(claude.matchesUrl("https://Claude.AI/chat/abc"));
        assertFalse(claude.matchesUrl("https://chatgpt.com/"));
        assertFalse(claude.matchesUrl(null));
    }

    @Test
    void testValidateNamesEveryMissingField() {
        Adapter adapter = Adapter.builder("partial").input("textarea").build();
        BridgeException e = assertThrows(BridgeException.class, adapter::validate);
        assertEquals(ErrorKind.ADAPTER_INCOMPLETE, e.getKind());
        assertEquals("adapter 'partial' is missing: urlHint, send, stop, responseContainer, responseContent",
                e.getMessage());
    }

    @Test
    void testBlankNameRejected() {
        assertThrows(BridgeException.class, () -> Adapter.builder(" "));
    }

    @Test
    void testNewChatUrlFallsBackToBaseUrl() {
        Adapter adapter = Adapter.builder("x").baseUrl("https://x.ai").build();
        assertEquals("https://x.ai", adapter.getNewChatUrl());
        assertEquals("x", adapter.getDisplayName());
    }

    @Test
    void testFromMapOverridesBase() {
        Map<String, Object> overrides = Map.of(
                "timeout", 90,
                "pollIntervalMs", 150,
                "input", "div.editor",
                "stop", List.of("button.stop", "//button[.='Stop']"),
                "contextWarning", Map.of("red", 99));
        Adapter adapter = Adapter.fromMap("claude", overrides, Adapters.claude());
        assertEquals(Duration.ofSeconds(90), adapter.getDefaultTimeout());
        assertEquals(Duration.ofMillis(150), adapter.getPollInterval());
        assertEquals(List.of("div.editor"), adapter.getInput());
        assertEquals(List.of("button.stop", "//button[.='Stop']"), adapter.getStop());
        assertEquals(Adapters.claude().getSend(), adapter.getSend());
        assertEquals("claude.ai", adapter.getUrlHint());
        assertEquals(new ContextThresholds(70, 85, 99), adapter.getContextThresholds());
    }

    @Test
    void testFromMapCustomProvider() {
        Map<String, Object> map = Map.of(
                "displayName", "Le Chat",
                "baseUrl", "https://chat.mistral.ai",
                "urlHint", "chat.mistral.ai",
                "input", "textarea",
                "send", "button[type='submit']",
                "stop", "button[aria-label='Stop']",
                "responseContainer", "div.answer",
                "responseContent", "div.prose",
                "timeout", 1.5);
        Adapter adapter = Adapter.fromMap("mistral", map, null);
        adapter.validate();
        assertEquals("Le Chat", adapter.getDisplayName());
        assertEquals(Duration.ofMillis(1500), adapter.getDefaultTimeout());
        assertEquals(Adapter.DEFAULT_POLL_INTERVAL, adapter.getPollInterval());
        assertEquals(0, adapter.getMaxContextTokens());
    }

    @Test
    void testContextThresholds() {
        ContextThresholds thresholds = new ContextThresholds(70, 85, 95);
        assertEquals("green", thresholds.levelFor(0));
        assertEquals("yellow", thresholds.levelFor(70));
        assertEquals("orange", thresholds.levelFor(90));
        assertEquals("red", thresholds.levelFor(120));
        assertThrows(IllegalArgumentException.class, () -> new ContextThresholds(90, 80, 95));
    }

}
