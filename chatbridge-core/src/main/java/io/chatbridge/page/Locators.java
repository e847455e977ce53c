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
package io.chatbridge.page;

import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;

import java.util.Set;

/**
 * Turns adapter locators into JavaScript evaluated inside the page.
 *
 * <p>Locator types:</p>
 * <ul>
 *   <li>CSS selector: "div[contenteditable='true']", "button.send"</li>
 *   <li>XPath: "//button[contains(., 'New chat')]", "(//div)[2]"</li>
 *   <li>Pure JS: "(expression)" - passed through unchanged</li>
 * </ul>
 *
 * Every generated script is an expression so it can be sent as-is to
 * {@code Runtime.evaluate} with {@code returnByValue}.
 */
public final class Locators {

    private static final String DOCUMENT = "document";

    private static final Set<String> XPATH_PREFIXES = Set.of("/", "./", "../", "(//");

    private static final String VISIBLE_FUNCTION =
            "function(e){ if (!e) return false; var s = window.getComputedStyle(e);" +
                    " if (s.display == 'none' || s.visibility == 'hidden') return false;" +
                    " return e.getClientRects().length > 0 }";

    private Locators() {
    }

    public static boolean isXpath(String locator) {
        for (String prefix : XPATH_PREFIXES) {
            if (locator.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isJs(String locator) {
        return locator.startsWith("(") && !locator.startsWith("(//");
    }

    /**
     * Expression resolving to the first matching element or null.
     */
    public static String selector(String locator) {
        return selector(locator, DOCUMENT);
    }

    public static String selector(String locator, String contextNode) {
        validate(locator);
        if (isJs(locator)) {
            return locator;
        }
        if (isXpath(locator)) {
            // XPathResult.FIRST_ORDERED_NODE_TYPE = 9
            return "document.evaluate(\"" + escapeForJs(relativeXpath(locator, contextNode)) + "\", "
                    + contextNode + ", null, 9, null).singleNodeValue";
        }
        return contextNode + ".querySelector(\"" + escapeForJs(locator) + "\")";
    }

    /**
     * Expression resolving to a JS array of all matching elements, in document order.
     */
    public static String selectorAll(String locator) {
        return selectorAll(locator, DOCUMENT);
    }

    public static String selectorAll(String locator, String contextNode) {
        validate(locator);
        if (isJs(locator)) {
            return wrapInFunctionInvoke("var e = " + locator + "; return e ? [e] : []");
        }
        if (isXpath(locator)) {
            // XPathResult.ORDERED_NODE_SNAPSHOT_TYPE = 7
            String js = "var r = document.evaluate(\"" + escapeForJs(relativeXpath(locator, contextNode)) + "\", "
                    + contextNode + ", null, 7, null); var a = [];"
                    + " for (var i = 0; i < r.snapshotLength; i++) a.push(r.snapshotItem(i)); return a";
            return wrapInFunctionInvoke(js);
        }
        return "Array.from(" + contextNode + ".querySelectorAll(\"" + escapeForJs(locator) + "\"))";
    }

    public static String countJs(String locator) {
        return selectorAll(locator) + ".length";
    }

    /**
     * True when the element exists, is rendered and is not disabled.
     */
    public static String interactableJs(String locator) {
        String js = "var e = " + selector(locator) + "; var visible = " + VISIBLE_FUNCTION + ";"
                + " return !!e && visible(e) && !e.disabled && e.getAttribute('aria-disabled') !== 'true'";
        return wrapInFunctionInvoke(js);
    }

    /**
     * Focuses the element and empties it, for both form fields and contenteditable hosts.
     * Evaluates to false when the element is missing.
     */
    public static String focusAndClearJs(String locator) {
        String js = "var e = " + selector(locator) + "; if (!e) return false; e.focus();"
                + " if ('value' in e && !e.isContentEditable) { e.value = '' }"
                + " else { var r = document.createRange(); r.selectNodeContents(e);"
                + " var s = window.getSelection(); s.removeAllRanges(); s.addRange(r);"
                + " document.execCommand('delete', false) }"
                + " return true";
        return wrapInFunctionInvoke(js);
    }

    /**
     * Clicks the element if present and enabled; evaluates to whether the click happened.
     */
    public static String clickJs(String locator) {
        String js = "var e = " + selector(locator) + "; if (!e || e.disabled) return false;"
                + " e.click(); return true";
        return wrapInFunctionInvoke(js);
    }

    /**
     * Reads text and html of the newest (last) container, or of the first
     * {@code contentLocator} match inside it. Evaluates to null when nothing matches.
     */
    public static String lastContentJs(String containerLocator, String contentLocator) {
        String target = contentLocator == null ? "c" : selector(contentLocator, "c");
        String js = "var cs = " + selectorAll(containerLocator) + "; if (!cs.length) return null;"
                + " var c = cs[cs.length - 1]; var e = " + target + "; if (!e) return null;"
                + " return { text: (e.innerText || e.textContent || ''), html: e.innerHTML }";
        return wrapInFunctionInvoke(js);
    }

    public static String wrapInFunctionInvoke(String js) {
        return "(function(){ " + js + " })()";
    }

    /**
     * Escape a string for embedding in a JavaScript double-quoted string.
     */
    public static String escapeForJs(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    private static String relativeXpath(String xpath, String contextNode) {
        if (DOCUMENT.equals(contextNode) || xpath.startsWith(".")) {
            return xpath;
        }
        if (xpath.startsWith("(//")) {
            return "(.//" + xpath.substring(3);
        }
        return "." + xpath;
    }

    private static void validate(String locator) {
        if (locator == null || locator.isEmpty()) {
            throw new BridgeException(ErrorKind.ADAPTER_INCOMPLETE, "locator cannot be null or empty");
        }
    }

}
