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
import io.testbridge.model.Entry;
import io.testbridge.model.TestFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * {@code onBegin}: the suites the runner is about to execute (or, in list
 * mode, everything it found), grouped by project and file.
 */
public record BeginParams(List<ProjectReport> projects) {

    public record ProjectReport(String name, String testDir, List<TestFile> files) {
    }

    public static BeginParams fromMap(Map<String, Object> map, UnaryOperator<String> paths) {
        List<ProjectReport> projects = new ArrayList<>();
        for (Map<String, Object> project : Json.getMapList(map, "projects")) {
            List<TestFile> files = new ArrayList<>();
            for (Map<String, Object> file : Json.getMapList(project, "files")) {
                List<Entry> entries = new ArrayList<>();
                for (Map<String, Object> entry : Json.getMapList(file, "entries")) {
                    entries.add(Entry.fromMap(entry, List.of(), paths));
                }
                files.add(new TestFile(paths.apply(Json.getString(file, "file")), entries));
            }
            String testDir = Json.getString(project, "testDir");
            projects.add(new ProjectReport(Json.getString(project, "name"),
                    testDir == null ? null : paths.apply(testDir), files));
        }
        return new BeginParams(projects);
    }

}
