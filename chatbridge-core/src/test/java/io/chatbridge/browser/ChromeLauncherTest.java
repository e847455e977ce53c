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

import io.chatbridge.common.BridgeException;
import io.chatbridge.common.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChromeLauncherTest {

    @TempDir
    Path tempDir;

    @Test
    void testBuildArgs() {
        ChromeLauncher launcher = new ChromeLauncher(null, false, List.of("--lang=en"),
                List.of("https://claude.ai", "https://chatgpt.com"));
        Path profile = tempDir.resolve("profile");
        List<String> args = launcher.buildArgs("chrome", profile, 9223);
        assertEquals("chrome", args.get(0));
        assertEquals("--remote-debugging-port=9223", args.get(1));
        assertTrue(args.contains("--remote-allow-origins=*"));
        assertTrue(args.contains("--user-data-dir=" + profile.toAbsolutePath()));
        assertTrue(args.containsAll(ChromeLauncher.STABILITY_FLAGS));
        assertFalse(args.contains("--headless=new"));
        assertEquals(List.of("--lang=en", "https://claude.ai", "https://chatgpt.com"),
                args.subList(args.size() - 3, args.size()));
    }

    @Test
    void testHeadless() {
        ChromeLauncher launcher = new ChromeLauncher(null, true, null, null);
        List<String> args = launcher.buildArgs("chrome", null, 9333);
        assertTrue(args.contains("--headless=new"));
        assertTrue(args.stream().noneMatch(a -> a.startsWith("--user-data-dir")));
    }

    @Test
    void testBareCommandNameIsKept() {
        assertEquals("chromium", ChromeLauncher.resolveExecutable("chromium"));
    }

    @Test
    void testMissingConfiguredExecutable() {
        BridgeException e = assertThrows(BridgeException.class,
                () -> ChromeLauncher.resolveExecutable("/no/such/dir/chrome"));
        assertEquals(ErrorKind.BROWSER_LAUNCH_FAILED, e.getKind());
    }

    @Test
    void testLaunchOfMissingBinaryFails() {
        ChromeLauncher launcher = new ChromeLauncher("no-such-browser-binary", true, null, null);
        BridgeException e = assertThrows(BridgeException.class,
                () -> launcher.launch(tempDir.resolve("profile"), 9555));
        assertEquals(ErrorKind.BROWSER_LAUNCH_FAILED, e.getKind());
        assertTrue(e.getMessage().contains("no-such-browser-binary"));
    }

}
