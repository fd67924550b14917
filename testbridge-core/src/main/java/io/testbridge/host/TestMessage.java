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
package io.testbridge.host;

import io.testbridge.reporter.Location;
import io.testbridge.reporter.TestError;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A failure annotation shown on a test: the error text and, when known, the
 * source position in the test's file.
 */
public record TestMessage(String message, String stack, Location location) {

    // "    at fn (/path/file.ts:12:5)" or "    at /path/file.ts:12:5"
    private static final Pattern FRAME = Pattern.compile("^\\s*at (?:.*\\()?(.+?):(\\d+):(\\d+)\\)?\\s*$");

    /**
     * @param testFile file of the failed test, frames in that file win over the error's own location
     */
    public static TestMessage fromError(TestError error, String testFile) {
        String text = error.stack() != null ? error.stack() : error.summary();
        Location location = testFile == null ? null : locationFromStack(error.stack(), testFile);
        if (location == null) {
            location = error.location();
        }
        return new TestMessage(error.message() != null ? error.message() : error.summary(), text, location);
    }

    public static TestMessage fromText(String text) {
        return new TestMessage(text, text, null);
    }

    static Location locationFromStack(String stack, String testFile) {
        if (stack == null) {
            return null;
        }
        for (String line : stack.split("\n")) {
            Matcher matcher = FRAME.matcher(line);
            if (matcher.matches() && matcher.group(1).equals(testFile)) {
                return new Location(testFile, Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(3)));
            }
        }
        return null;
    }

}
