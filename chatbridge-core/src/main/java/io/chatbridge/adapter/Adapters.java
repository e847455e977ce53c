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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in provider descriptors. Selectors drift with the providers' UI
 * releases; override them through configuration rather than editing here.
 */
public final class Adapters {

    public static final String CLAUDE = "claude";
    public static final String CHATGPT = "chatgpt";
    public static final String GEMINI = "gemini";

    // login walls, captchas and rate-limit banners shared by all providers
    private static final String[] COMMON_ALERTS = {
            "input[type='password']",
            "iframe[src*='captcha']",
            "iframe[title*='challenge']",
            "div[role='alert']"
    };

    private Adapters() {
    }

    public static Adapter claude() {
        return Adapter.builder(CLAUDE)
                .displayName("Claude")
                .baseUrl("https://claude.ai")
                .urlHint("claude.ai")
                .newChatUrl("https://claude.ai/new")
                .input("div[contenteditable='true'].ProseMirror", "div[contenteditable='true']")
                .send("button[aria-label='Send Message']", "button[aria-label='Send message']")
                .stop("button[aria-label='Stop response']")
                .responseContainer("div.font-claude-response", "div[data-is-streaming]")
                .responseContent(".standard-markdown", ".progressive-markdown")
                .newChat("button[aria-label*='New chat']", "a[href='/new']")
                .alerts(COMMON_ALERTS)
                .maxContextTokens(200_000)
                .contextThresholds(new ContextThresholds(70, 85, 95))
                .build();
    }

    public static Adapter chatgpt() {
        return Adapter.builder(CHATGPT)
                .displayName("ChatGPT")
                .baseUrl("https://chatgpt.com")
                .urlHint("chatgpt.com")
                .newChatUrl("https://chatgpt.com/")
                .input("div#prompt-textarea[contenteditable='true']", "#prompt-textarea", "textarea")
                .send("button[data-testid='send-button']", "button[aria-label='Send prompt']")
                .stop("button[data-testid='stop-button']")
                .responseContainer("div[data-message-author-role='assistant']")
                .responseContent("div.markdown.prose", "div.markdown")
                .newChat("a[data-testid='create-new-chat-button']", "//button[contains(., 'New chat')]",
                        "//a[contains(., 'New chat')]")
                .alerts(COMMON_ALERTS)
                .maxContextTokens(128_000)
                .contextThresholds(new ContextThresholds(65, 80, 90))
                .build();
    }

    public static Adapter gemini() {
        return Adapter.builder(GEMINI)
                .displayName("Gemini")
                .baseUrl("https://gemini.google.com")
                .urlHint("gemini.google.com")
                .newChatUrl("https://gemini.google.com/app")
                .input("div.ql-editor[contenteditable='true'][aria-label*='prompt']", "rich-textarea div.ql-editor")
                .send("button[aria-label='Send message']", "button.send-button")
                .stop("mat-icon[fonticon='stop']", "button[aria-label='Stop response']")
                .responseContainer("message-content")
                .responseContent("div.markdown.markdown-main-panel", "div.markdown")
                .newChat("//button[contains(., 'New chat')]", "//a[contains(., 'New chat')]")
                .alerts(COMMON_ALERTS)
                .maxContextTokens(2_000_000)
                .contextThresholds(new ContextThresholds(80, 90, 95))
                .build();
    }

    /**
     * All built-ins keyed by provider name, in a stable order.
     */
    public static Map<String, Adapter> builtIns() {
        Map<String, Adapter> map = new LinkedHashMap<>();
        map.put(CLAUDE, claude());
        map.put(CHATGPT, chatgpt());
        map.put(GEMINI, gemini());
        return map;
    }

}
