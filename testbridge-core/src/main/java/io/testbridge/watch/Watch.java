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
package io.testbridge.watch;

import io.testbridge.common.CancellationToken;
import io.testbridge.model.TestProject;
import io.testbridge.tree.TestItem;

import java.util.List;

/**
 * Interest in re-running tests of one project when related files change.
 * The scope is the project's test dir when {@code include} is null, else the
 * included items.
 */
public class Watch {

    private final TestProject project;
    private final List<TestItem> include;
    private final CancellationToken.Registration registration;

    public Watch(TestProject project, List<TestItem> include, CancellationToken.Registration registration) {
        this.project = project;
        this.include = include == null ? null : List.copyOf(include);
        this.registration = registration;
    }

    public TestProject getProject() {
        return project;
    }

    /**
     * @return null when the whole test dir is watched
     */
    public List<TestItem> getInclude() {
        return include;
    }

    public String getTestDir() {
        return project.getTestDir();
    }

    CancellationToken.Registration getRegistration() {
        return registration;
    }

    /**
     * The same project narrowed to the items a change matched.
     */
    Watch narrowTo(List<TestItem> items) {
        return new Watch(project, items, null);
    }

    @Override
    public String toString() {
        return project.getName() + (include == null ? " " + getTestDir() : " " + include);
    }

}
