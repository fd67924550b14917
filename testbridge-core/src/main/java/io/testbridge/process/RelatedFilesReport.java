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
package io.testbridge.process;

import io.testbridge.common.Json;
import io.testbridge.common.PathUtils;
import io.testbridge.reporter.TestError;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Output of {@code find-related-test-files}: the test files affected by a set
 * of changed source files.
 */
public record RelatedFilesReport(List<String> testFiles, List<TestError> errors) {

    public RelatedFilesReport {
        testFiles = testFiles == null ? List.of() : List.copyOf(testFiles);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RelatedFilesReport fromMap(Map<String, Object> map) {
        List<String> files = new ArrayList<>();
        for (String file : Json.getStringList(map, "testFiles")) {
            files.add(PathUtils.canonicalize(file));
        }
        return new RelatedFilesReport(files, TestError.listFromMap(map, "errors", PathUtils::canonicalize));
    }

}
