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

import io.chatbridge.log.LogContext;
import net.minidev.json.JSONValue;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * JSON file holding the current {@link HandleRecord}. A missing store path
 * disables persistence.
 */
public class HandleRecordStore {

    private static final Logger logger = LogContext.BROWSER_LOGGER;

    private final Path file;

    public HandleRecordStore(Path file) {
        this.file = file;
    }

    public static HandleRecordStore none() {
        return new HandleRecordStore(null);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Empty when there is no record or it cannot be parsed; an unreadable record is deleted.
     */
    @SuppressWarnings("unchecked")
    public Optional<HandleRecord> read() {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            Object parsed = JSONValue.parse(Files.readString(file, StandardCharsets.UTF_8));
            if (parsed instanceof Map) {
                return Optional.of(HandleRecord.fromMap((Map<String, Object>) parsed));
            }
            logger.warn("ignoring malformed handle record: {}", file);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("ignoring unreadable handle record {}: {}", file, e.getMessage());
        }
        delete();
        return Optional.empty();
    }

    public void write(HandleRecord record) {
        if (file == null) {
            return;
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(temp, JSONValue.toJSONString(record.toMap()), StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write handle record " + file, e);
        }
    }

    public void delete() {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to delete handle record " + file, e);
        }
    }

}
