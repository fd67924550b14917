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

import io.testbridge.common.PathUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Resolved runners keyed by the folder they were resolved from. Owned by the
 * caller and passed to {@link RunnerLocator}; nothing is cached process-wide.
 */
public class RunnerCache {

    private final Map<String, RunnerInfo> entries = new ConcurrentHashMap<>();

    public RunnerInfo get(String folder) {
        return entries.get(PathUtils.canonicalize(folder));
    }

    public RunnerInfo computeIfAbsent(String folder, Function<String, RunnerInfo> resolver) {
        return entries.computeIfAbsent(PathUtils.canonicalize(folder), resolver);
    }

    public void put(String folder, RunnerInfo info) {
        entries.put(PathUtils.canonicalize(folder), info);
    }

    /**
     * Drop every entry that a change at {@code path} may affect: entries for
     * the path itself, for folders beneath it, and for folders above it (a
     * saved {@code package.json} or a reinstalled {@code node_modules}).
     */
    public void invalidate(String path) {
        String p = PathUtils.canonicalize(path);
        entries.keySet().removeIf(key -> PathUtils.isAncestorOrSelf(key, p) || PathUtils.isAncestorOrSelf(p, key));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

}
