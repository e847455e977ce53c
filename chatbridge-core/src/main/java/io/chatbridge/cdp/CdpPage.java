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
package io.chatbridge.cdp;

import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import io.chatbridge.http.WsException;
import io.chatbridge.log.LogContext;
import io.chatbridge.page.Locators;
import io.chatbridge.page.Page;
import io.chatbridge.page.PageContent;
import io.chatbridge.page.PageTarget;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link Page} over a DevTools socket attached to a single tab.
 */
public class CdpPage implements Page {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    private final PageTarget target;
    private final CdpClient cdp;
    private volatile String url;
    private volatile boolean connected = true;

    public static CdpPage connect(PageTarget target, Duration commandTimeout) {
        CdpClient cdp;
        try {
            cdp = CdpClient.connect(target.webSocketDebuggerUrl(), commandTimeout);
        } catch (RuntimeException e) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, null,
                    "cannot attach to tab " + target.id() + ": " + e.getMessage(), e);
        }
        try {
            return new CdpPage(target, cdp);
        } catch (BridgeException e) {
            cdp.close();
            throw e;
        }
    }

    CdpPage(PageTarget target, CdpClient cdp) {
        this.target = target;
        this.cdp = cdp;
        this.url = target.url();
        cdp.on("Inspector.detached", event -> {
            logger.warn("tab {} detached: {}", target.id(), event.getAsString("reason"));
            connected = false;
        });
        cdp.on("Page.frameNavigated", event -> {
            if (event.get("frame.parentId") == null) {
                url = event.getAsString("frame.url");
            }
        });
        cdp.onClose(() -> connected = false);
        command(() -> cdp.method("Page.enable").send());
    }

    @Override
    public String getTargetId() {
        return target.id();
    }

    @Override
    public String getUrl() {
        if (connected) {
            try {
                Object href = eval("location.href");
                if (href != null) {
                    url = href.toString();
                }
            } catch (BridgeException e) {
                logger.debug("could not refresh url of tab {}: {}", target.id(), e.getMessage());
            }
        }
        return url;
    }

    @Override
    public int count(String locator, Duration timeout) {
        Object result = eval(Locators.countJs(locator), timeout);
        return result instanceof Number n ? n.intValue() : 0;
    }

    @Override
    public boolean isInteractable(String locator) {
        return Boolean.TRUE.equals(eval(Locators.interactableJs(locator)));
    }

    @Override
    public boolean input(String locator, String text) {
        if (!Boolean.TRUE.equals(eval(Locators.focusAndClearJs(locator)))) {
            return false;
        }
        command(() -> cdp.method("Input.insertText").param("text", text).send());
        return true;
    }

    @Override
    public boolean click(String locator) {
        return Boolean.TRUE.equals(eval(Locators.clickJs(locator)));
    }

    @Override
    public boolean pressEnter(String locator) {
        String focus = Locators.wrapInFunctionInvoke("var e = " + Locators.selector(locator)
                + "; if (!e) return false; e.focus(); return true");
        if (!Boolean.TRUE.equals(eval(focus))) {
            return false;
        }
        dispatchKey("rawKeyDown", "\r");
        dispatchKey("char", "\r");
        dispatchKey("keyUp", null);
        return true;
    }

    private void dispatchKey(String type, String text) {
        CdpMessage message = cdp.method("Input.dispatchKeyEvent")
                .param("type", type)
                .param("key", "Enter")
                .param("code", "Enter")
                .param("windowsVirtualKeyCode", 13)
                .param("nativeVirtualKeyCode", 13);
        if (text != null) {
            message.param("text", text);
        }
        command(message::send);
    }

    @Override
    @SuppressWarnings("unchecked")
    public PageContent content(String containerLocator, String contentLocator) {
        Object result = eval(Locators.lastContentJs(containerLocator, contentLocator));
        if (!(result instanceof Map)) {
            return null;
        }
        Map<String, Object> map = (Map<String, Object>) result;
        Object text = map.get("text");
        Object html = map.get("html");
        return new PageContent(text == null ? "" : text.toString(), html == null ? "" : html.toString());
    }

    @Override
    public void navigate(String url) {
        CdpResponse response = command(() -> cdp.method("Page.navigate").param("url", url).send());
        if (response.isError()) {
            throw new BridgeException(ErrorKind.UNEXPECTED, "navigation failed: " + response.getErrorMessage());
        }
        String errorText = response.getResultAsString("errorText");
        if (errorText != null) {
            throw new BridgeException(ErrorKind.UNEXPECTED, "navigation to " + url + " failed: " + errorText);
        }
        this.url = url;
    }

    @Override
    public boolean isConnected() {
        return connected && cdp.isOpen();
    }

    @Override
    public void close() {
        connected = false;
        cdp.close();
    }

    Object eval(String expression) {
        return eval(expression, null);
    }

    /**
     * Evaluates with a reply deadline of {@code timeout}, or the client default
     * when null. Missing an explicit deadline is a {@code RESPONSE_TIMEOUT}.
     */
    Object eval(String expression, Duration timeout) {
        CdpResponse response;
        try {
            response = command(() -> cdp.method("Runtime.evaluate")
                    .param("expression", expression)
                    .param("returnByValue", true)
                    .timeout(timeout)
                    .send());
        } catch (BridgeException e) {
            if (timeout != null && e.getCause() instanceof CdpTimeoutException) {
                throw new BridgeException(ErrorKind.RESPONSE_TIMEOUT, null,
                        "tab " + target.id() + " did not answer within " + timeout.toMillis() + " ms", e.getCause());
            }
            throw e;
        }
        if (response.isError()) {
            throw new BridgeException(ErrorKind.UNEXPECTED, "evaluate failed: " + response.getErrorMessage());
        }
        if (response.getResult("exceptionDetails") != null) {
            String description = response.getResultAsString("exceptionDetails.exception.description");
            if (description == null) {
                description = response.getResultAsString("exceptionDetails.text");
            }
            throw new BridgeException(ErrorKind.UNEXPECTED, "script error: " + description);
        }
        return response.getResult("result.value");
    }

    private CdpResponse command(Supplier<CdpResponse> action) {
        try {
            return action.get();
        } catch (WsException e) {
            connected = false;
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, null,
                    "tab " + target.id() + " connection lost: " + e.getMessage(), e);
        } catch (CdpTimeoutException e) {
            throw new BridgeException(ErrorKind.TRANSPORT_UNREACHABLE, null,
                    "tab " + target.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "CdpPage[" + target.id() + " " + url + "]";
    }

}
