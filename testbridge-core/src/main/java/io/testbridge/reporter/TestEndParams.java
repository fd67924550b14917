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
 * {@code onTestEnd}. {@code status} is the runner's verdict (passed, failed,
 * timedOut, skipped, interrupted); {@code ok} says whether that was expected.
 */
public record TestEndParams(
        String testId,
        boolean ok,
        long duration,
        String status,
        List<TestError> errors
) {

    public TestEndParams {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TestEndParams fromMap(Map<String, Object> map, UnaryOperator<String> paths) {
        List<TestError> errors = new ArrayList<>(TestError.listFromMap(map, "errors", paths));
        TestError single = TestError.fromMap(Json.getMap(map, "error"), paths);
        if (single != null && errors.isEmpty()) {
            errors.add(single);
        }
        String status = Json.getString(map, "status");
        boolean ok = Json.getBoolean(map, "ok", "passed".equals(status) || "skipped".equals(status));
        return new TestEndParams(
                Json.getString(map, "testId"),
                ok,
                Json.getLong(map, "duration", 0),
                status,
                errors);
    }

    public boolean isSkipped() {
        return "skipped".equals(status);
    }

    public TestError error() {
        return errors.isEmpty() ? null : errors.get(0);
    }

}
