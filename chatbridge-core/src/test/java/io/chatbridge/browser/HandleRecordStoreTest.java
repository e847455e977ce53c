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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HandleRecordStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteAndRead() {
        HandleRecordStore store = new HandleRecordStore(tempDir.resolve("state/browser.json"));
        HandleRecord record = new HandleRecord(1234, 9223, "/tmp/profile", Instant.parse("2025-06-01T10:00:00Z"));
        store.write(record);
        assertEquals(record, store.read().orElseThrow());
        assertFalse(Files.exists(tempDir.resolve("state/browser.json.tmp")));
    }

    @Test
    void testMissingFile() {
        assertTrue(new HandleRecordStore(tempDir.resolve("none.json")).read().isEmpty());
    }

    @Test
    void testMalformedRecordIsDeleted() throws Exception {
        Path file = tempDir.resolve("browser.json");
        Files.writeString(file, "{\"pid\":\"abc\"}");
        HandleRecordStore store = new HandleRecordStore(file);
        assertTrue(store.read().isEmpty());
        assertFalse(Files.exists(file));
    }

    @Test
    void testGarbageIsDeleted() throws Exception {
        Path file = tempDir.resolve("browser.json");
        Files.writeString(file, "not json at all");
        assertTrue(new HandleRecordStore(file).read().isEmpty());
        assertFalse(Files.exists(file));
    }

    @Test
    void testDisabledStore() {
        HandleRecordStore store = HandleRecordStore.none();
        store.write(new HandleRecord(1, 2, null, Instant.now()));
        assertTrue(store.read().isEmpty());
        store.delete();
    }

}
