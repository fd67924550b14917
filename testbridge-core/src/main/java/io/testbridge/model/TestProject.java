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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named variant inside a config (a browser, an environment) with its test
 * directory. Owned by its {@link TestModel}.
 */
public class TestProject {

    private final TestModel model;
    private final String name;
    private String testDir;
    private int ordinal;
    private boolean enabled;
    private final Map<String, TestFile> files = new LinkedHashMap<>();

    TestProject(TestModel model, String name, String testDir, int ordinal) {
        this.model = model;
        this.name = name;
        this.testDir = testDir;
        this.ordinal = ordinal;
    }

    public TestModel getModel() {
        return model;
    }

    public String getName() {
        return name;
    }

    public String getTestDir() {
        return testDir;
    }

    void setTestDir(String testDir) {
        this.testDir = testDir;
    }

    public int getOrdinal() {
        return ordinal;
    }

    void setOrdinal(int ordinal) {
        this.ordinal = ordinal;
    }

    public boolean isDefault() {
        return ordinal == 0;
    }

    public boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Files in discovery order, keyed by canonical path.
     */
    public Map<String, TestFile> getFiles() {
        return Collections.unmodifiableMap(files);
    }

    Map<String, TestFile> files() {
        return files;
    }

    public TestFile getFile(String path) {
        return files.get(path);
    }

    public List<Entry> allTests() {
        List<Entry> result = new ArrayList<>();
        for (TestFile file : files.values()) {
            result.addAll(file.tests());
        }
        return result;
    }

    @Override
    public String toString() {
        return name + (enabled ? "" : " (disabled)");
    }

}
