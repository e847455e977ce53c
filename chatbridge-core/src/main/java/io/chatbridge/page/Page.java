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

import java.time.Duration;

/**
 * One attached browser tab. All element arguments are single locators (see
 * {@link Locators}); walking candidate lists is the caller's job.
 *
 * <p>Implementations throw {@link io.chatbridge.common.BridgeException} with
 * kind {@code TRANSPORT_UNREACHABLE} when the control channel to the tab fails.</p>
 */
public interface Page {

    String getTargetId();

    /**
     * Current address of the tab, as last reported by the browser.
     */
    String getUrl();

    default int count(String locator) {
        return count(locator, null);
    }

    /**
     * Number of elements matching {@code locator}, answered within {@code timeout}.
     * A null timeout means the page's own command timeout.
     *
     * @throws io.chatbridge.common.BridgeException with kind {@code RESPONSE_TIMEOUT}
     * when the tab does not answer within an explicit {@code timeout}
     */
    int count(String locator, Duration timeout);

    default boolean exists(String locator) {
        return exists(locator, null);
    }

    default boolean exists(String locator, Duration timeout) {
        return count(locator, timeout) > 0;
    }

    boolean isInteractable(String locator);

    /**
     * Focuses and clears the element, then types {@code text} into it.
     *
     * @return false if the element could not be found
     */
    boolean input(String locator, String text);

    /**
     * @return false if the element is missing or disabled
     */
    boolean click(String locator);

    /**
     * Sends an Enter key press to the element.
     *
     * @return false if the element could not be found
     */
    boolean pressEnter(String locator);

    /**
     * Content of the newest {@code containerLocator} match, narrowed to the first
     * {@code contentLocator} match inside it when that is not null.
     *
     * @return null if nothing matched
     */
    PageContent content(String containerLocator, String contentLocator);

    void navigate(String url);

    boolean isConnected();

    void close();

}
