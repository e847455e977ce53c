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

import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;

import java.util.Map;

/**
 * Value lookup over parsed DevTools payloads. Plain dotted paths are walked
 * directly; anything with brackets or a leading {@code $} goes through JsonPath.
 */
final class JsonPaths {

    private JsonPaths() {
    }

    @SuppressWarnings("unchecked")
    static <T> T read(Map<String, Object> map, String path) {
        if (map == null || path == null) {
            return null;
        }
        if (!path.contains("[") && !path.startsWith("$")) {
            Object current = map;
            for (String part : path.split("\\.")) {
                if (!(current instanceof Map)) {
                    return null;
                }
                current = ((Map<String, Object>) current).get(part);
            }
            return (T) current;
        }
        try {
            return JsonPath.read(map, path.startsWith("$") ? path : "$." + path);
        } catch (PathNotFoundException e) {
            return null;
        }
    }

    static String readString(Map<String, Object> map, String path) {
        Object value = read(map, path);
        return value != null ? value.toString() : null;
    }

    static Integer readInt(Map<String, Object> map, String path) {
        Object value = read(map, path);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        return Integer.parseInt(value.toString());
    }

    static Boolean readBoolean(Map<String, Object> map, String path) {
        Object value = read(map, path);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

}
