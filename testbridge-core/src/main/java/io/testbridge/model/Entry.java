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
package io.testbridge.model;

import io.testbridge.common.Json;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A discovered suite or test case.
 *
 * @param titlePath titles of the enclosing suites inside the file, ending with {@code title}
 */
public record Entry(
        Kind kind,
        String file,
        int line,
        int column,
        String title,
        List<String> titlePath,
        List<String> tags,
        List<Entry> children
) {

    public enum Kind {
        SUITE,
        TEST
    }

    public Entry {
        titlePath = List.copyOf(titlePath);
        tags = tags == null ? List.of() : List.copyOf(tags);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Location id used to correlate run events with listed entries.
     */
    public String id() {
        return file + ":" + line;
    }

    public boolean isTest() {
        return kind == Kind.TEST;
    }

    /**
     * Every test beneath this entry, this entry included when it is a test.
     */
    public List<Entry> tests() {
        List<Entry> result = new ArrayList<>();
        collectTests(this, result);
        return result;
    }

    private static void collectTests(Entry entry, List<Entry> result) {
        if (entry.isTest()) {
            result.add(entry);
        }
        for (Entry child : entry.children) {
            collectTests(child, result);
        }
    }

    /**
     * Decode a reported entry: {@code {type, title, location:{file,line,column}, tags, children}}.
     *
     * @param paths applied to every file path
     */
    public static Entry fromMap(Map<String, Object> map, List<String> parentTitlePath, UnaryOperator<String> paths) {
        String title = Json.getString(map, "title");
        if (title == null) {
            title = "";
        }
        List<String> titlePath = new ArrayList<>(parentTitlePath);
        titlePath.add(title);
        Map<String, Object> location = Json.getMap(map, "location");
        String file = paths.apply(Json.getString(location, "file"));
        Kind kind = "suite".equalsIgnoreCase(Json.getString(map, "type")) ? Kind.SUITE : Kind.TEST;
        List<Entry> children = new ArrayList<>();
        for (Map<String, Object> child : Json.getMapList(map, "children")) {
            children.add(fromMap(child, titlePath, paths));
        }
        return new Entry(kind, file,
                Json.getInt(location, "line", 0),
                Json.getInt(location, "column", 0),
                title, titlePath, Json.getStringList(map, "tags"), children);
    }

}
