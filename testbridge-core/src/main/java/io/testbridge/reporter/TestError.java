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
package io.testbridge.reporter;

import io.testbridge.common.Json;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Error reported by the runner: a failed assertion, a timeout, a config error.
 * Result data, not a host error.
 */
public record TestError(String message, String stack, String value, Location location, String snippet) {

    public static TestError fromMap(Map<String, Object> map, UnaryOperator<String> paths) {
        if (map == null) {
            return null;
        }
        return new TestError(
                Json.getString(map, "message"),
                Json.getString(map, "stack"),
                Json.getString(map, "value"),
                Location.fromMap(Json.getMap(map, "location"), paths),
                Json.getString(map, "snippet"));
    }

    public static List<TestError> listFromMap(Map<String, Object> map, String key, UnaryOperator<String> paths) {
        List<TestError> errors = new ArrayList<>();
        for (Map<String, Object> item : Json.getMapList(map, key)) {
            errors.add(fromMap(item, paths));
        }
        return errors;
    }

    /**
     * Best single line to show for this error.
     */
    public String summary() {
        if (message != null) {
            return message;
        }
        if (value != null) {
            return value;
        }
        return stack != null ? stack : "unknown error";
    }

}
