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
import io.chatbridge.common.OsUtils;
import io.chatbridge.log.LogContext;
import io.chatbridge.process.ProcessBuilder;
import io.chatbridge.process.ProcessException;
import io.chatbridge.process.ProcessHandle;
import org.slf4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches Chrome or Chromium with remote debugging on a fixed port and a
 * persistent profile, so provider logins survive restarts.
 */
public class ChromeLauncher implements BrowserLauncher {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    public static final String DEFAULT_PATH_MAC = "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome";
    public static final String DEFAULT_PATH_WIN64 = "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe";
    public static final String DEFAULT_PATH_WIN32 = "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe";
    public static final List<String> DEFAULT_PATHS_LINUX = List.of(
            "/usr/bin/google-chrome", "/usr/bin/chromium", "/usr/bin/chromium-browser");

    static final List<String> STABILITY_FLAGS = List.of(
            "--no-first-run",
            "--no-default-browser-check",
            "--disable-background-networking",
            "--disable-background-timer-throttling",
            "--disable-backgrounding-occluded-windows",
            "--disable-breakpad",
            "--disable-component-extensions-with-background-pages",
            "--disable-dev-shm-usage",
            "--disable-extensions",
            "--disable-features=TranslateUI",
            "--disable-ipc-flooding-protection",
            "--disable-renderer-backgrounding",
            "--force-color-profile=srgb",
            "--metrics-recording-only");

    private final String executable;
    private final boolean headless;
    private final List<String> addOptions;
    private final List<String> startUrls;

    public ChromeLauncher(String executable, boolean headless, List<String> addOptions, List<String> startUrls) {
        this.executable = executable;
        this.headless = headless;
        this.addOptions = addOptions == null ? List.of() : List.copyOf(addOptions);
        this.startUrls = startUrls == null ? List.of() : List.copyOf(startUrls);
    }

    @Override
    public BrowserProcess launch(Path profileDir, int port) {
        List<String> args = buildArgs(resolveExecutable(executable), profileDir, port);
        logger.info("launching browser on port {} with profile {}", port, profileDir);
        logger.debug("browser command: {}", args);
        try {
            if (profileDir != null) {
                Files.createDirectories(profileDir);
            }
            ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                    .args(args)
                    .listener(event -> {
                        if (!event.isExit()) {
                            logger.trace("[browser] {}", event.data());
                        }
                    })
                    .build());
            return new LocalBrowserProcess(handle);
        } catch (ProcessException | java.io.IOException e) {
            throw new BridgeException(ErrorKind.BROWSER_LAUNCH_FAILED, null,
                    "cannot start " + args.get(0) + ": " + e.getMessage(), e);
        }
    }

    List<String> buildArgs(String resolvedExecutable, Path profileDir, int port) {
        List<String> args = new ArrayList<>();
        args.add(resolvedExecutable);
        args.add("--remote-debugging-port=" + port);
        args.add("--remote-allow-origins=*");
        if (profileDir != null) {
            args.add("--user-data-dir=" + profileDir.toAbsolutePath());
        }
        args.addAll(STABILITY_FLAGS);
        if (headless) {
            args.add("--headless=new");
        }
        args.addAll(addOptions);
        args.addAll(startUrls);
        return args;
    }

    static String resolveExecutable(String configured) {
        if (configured != null && !configured.isEmpty()) {
            if (Files.isExecutable(Path.of(configured))) {
                return configured;
            }
            // may be a bare command name resolved through PATH
            if (!configured.contains("/") && !configured.contains("\\")) {
                return configured;
            }
            throw new BridgeException(ErrorKind.BROWSER_LAUNCH_FAILED, "configured executable not found: " + configured);
        }
        for (String candidate : defaultPaths()) {
            if (Files.isExecutable(Path.of(candidate))) {
                logger.debug("using default browser path: {}", candidate);
                return candidate;
            }
        }
        throw new BridgeException(ErrorKind.BROWSER_LAUNCH_FAILED,
                "browser executable not found, set 'executable' or install Chrome at one of: " + defaultPaths());
    }

    private static List<String> defaultPaths() {
        if (OsUtils.isMac()) {
            return List.of(DEFAULT_PATH_MAC);
        } else if (OsUtils.isWindows()) {
            return List.of(DEFAULT_PATH_WIN64, DEFAULT_PATH_WIN32);
        }
        return DEFAULT_PATHS_LINUX;
    }

}
