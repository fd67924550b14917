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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * File system changes collected over one debounce window.
 */
public record WorkspaceChange(Set<String> created, Set<String> changed, Set<String> deleted) {

    public static final WorkspaceChange EMPTY = new WorkspaceChange(Set.of(), Set.of(), Set.of());

    public WorkspaceChange {
        created = Collections.unmodifiableSet(new LinkedHashSet<>(created));
        changed = Collections.unmodifiableSet(new LinkedHashSet<>(changed));
        deleted = Collections.unmodifiableSet(new LinkedHashSet<>(deleted));
    }

    public boolean isEmpty() {
        return created.isEmpty() && changed.isEmpty() && deleted.isEmpty();
    }

    /**
     * Changed and deleted paths, the input of a related-files query.
     */
    public Set<String> changedOrDeleted() {
        Set<String> result = new LinkedHashSet<>(changed);
        result.addAll(deleted);
        return result;
    }

    public Set<String> all() {
        Set<String> result = new LinkedHashSet<>(created);
        result.addAll(changed);
        result.addAll(deleted);
        return result;
    }

}
