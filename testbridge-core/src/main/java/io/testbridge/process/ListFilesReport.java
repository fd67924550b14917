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
 * Output of {@code list-files}: the projects of a config with their test
 * directories and test files. An error (for example a syntax error in the
 * config) comes with an empty project list.
 */
public record ListFilesReport(List<ProjectFiles> projects, TestError error) {

    public record ProjectFiles(String name, String testDir, List<String> files) {

        public ProjectFiles {
            files = files == null ? List.of() : List.copyOf(files);
        }

    }

    public ListFilesReport {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }

    public static ListFilesReport failed(String message) {
        return new ListFilesReport(List.of(), new TestError(message, null, null, null, null));
    }

    public static ListFilesReport fromMap(Map<String, Object> map) {
        List<ProjectFiles> projects = new ArrayList<>();
        for (Map<String, Object> project : Json.getMapList(map, "projects")) {
            List<String> files = new ArrayList<>();
            for (String file : Json.getStringList(project, "files")) {
                files.add(PathUtils.canonicalize(file));
            }
            String testDir = Json.getString(project, "testDir");
            projects.add(new ProjectFiles(
                    Json.getString(project, "name"),
                    testDir == null ? null : PathUtils.canonicalize(testDir),
                    files));
        }
        return new ListFilesReport(projects, TestError.fromMap(Json.getMap(map, "error"), PathUtils::canonicalize));
    }

}
