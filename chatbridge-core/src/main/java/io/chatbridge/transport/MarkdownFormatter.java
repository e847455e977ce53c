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
package io.chatbridge.transport;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Best-effort conversion of a rendered reply back into markdown. Unknown
 * elements contribute their text; the result is never worse than plain text.
 */
public class MarkdownFormatter {

    public String format(String html, String fallbackText) {
        if (html == null || html.isBlank()) {
            return fallbackText == null ? "" : fallbackText.trim();
        }
        Element body = Jsoup.parseBodyFragment(html).body();
        body.select("script, style, svg, button, noscript").remove();
        StringBuilder sb = new StringBuilder();
        renderChildren(body, sb, 0);
        String markdown = sb.toString().replaceAll("\n{3,}", "\n\n").trim();
        return markdown.isEmpty() && fallbackText != null ? fallbackText.trim() : markdown;
    }

    private void renderChildren(Element parent, StringBuilder sb, int listDepth) {
        for (Node child : parent.childNodes()) {
            render(child, sb, listDepth);
        }
    }

    private void render(Node node, StringBuilder sb, int listDepth) {
        if (node instanceof TextNode text) {
            sb.append(text.text());
            return;
        }
        if (!(node instanceof Element e)) {
            return;
        }
        String tag = e.normalName();
        switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                block(sb);
                sb.append("#".repeat(tag.charAt(1) - '0')).append(' ').append(e.text().trim());
                block(sb);
            }
            case "p", "div", "section", "article" -> {
                block(sb);
                renderChildren(e, sb, listDepth);
                block(sb);
            }
            case "br" -> sb.append('\n');
            case "hr" -> {
                block(sb);
                sb.append("---");
                block(sb);
            }
            case "strong", "b" -> sb.append("**").append(e.text()).append("**");
            case "em", "i" -> sb.append('*').append(e.text()).append('*');
            case "code" -> sb.append('`').append(e.text()).append('`');
            case "pre" -> {
                block(sb);
                Element code = e.selectFirst("code");
                String language = code == null ? "" : languageOf(code);
                sb.append("```").append(language).append('\n')
                        .append((code != null ? code : e).wholeText().replaceAll("\n+$", ""))
                        .append("\n```");
                block(sb);
            }
            case "a" -> {
                String href = e.attr("href");
                if (href.isEmpty()) {
                    sb.append(e.text());
                } else {
                    sb.append('[').append(e.text()).append("](").append(href).append(')');
                }
            }
            case "ul", "ol" -> {
                block(sb);
                int index = 1;
                for (Element li : e.children()) {
                    if (!li.normalName().equals("li")) {
                        continue;
                    }
                    sb.append("  ".repeat(listDepth))
                            .append(tag.equals("ol") ? (index++) + ". " : "- ");
                    StringBuilder item = new StringBuilder();
                    renderChildren(li, item, listDepth + 1);
                    sb.append(item.toString().trim().replaceAll("\n{2,}", "\n")).append('\n');
                }
                block(sb);
            }
            case "blockquote" -> {
                block(sb);
                StringBuilder quote = new StringBuilder();
                renderChildren(e, quote, listDepth);
                for (String line : quote.toString().trim().split("\n")) {
                    sb.append("> ").append(line).append('\n');
                }
                block(sb);
            }
            default -> renderChildren(e, sb, listDepth);
        }
    }

    private static String languageOf(Element code) {
        for (String cls : code.classNames()) {
            if (cls.startsWith("language-")) {
                return cls.substring("language-".length());
            }
        }
        return "";
    }

    private static void block(StringBuilder sb) {
        if (sb.length() == 0) {
            return;
        }
        int newlines = 0;
        for (int i = sb.length() - 1; i >= 0 && sb.charAt(i) == '\n'; i--) {
            newlines++;
        }
        sb.append("\n".repeat(Math.max(0, 2 - newlines)));
    }

}
