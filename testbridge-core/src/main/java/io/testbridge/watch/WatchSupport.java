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
import io.testbridge.common.PathUtils;
import io.testbridge.model.TestModel;
import io.testbridge.model.TestProject;
import io.testbridge.model.WorkspaceChange;
import io.testbridge.process.RelatedFilesReport;
import io.testbridge.tree.TestItem;
import io.testbridge.tree.TestTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Active watches and the mapping from workspace changes to the watches they
 * trigger.
 */
public class WatchSupport {

    private static final Logger logger = LoggerFactory.getLogger(WatchSupport.class);

    private final TestTree tree;
    private final WatchListener listener;
    private final List<Watch> watches = new CopyOnWriteArrayList<>();

    public WatchSupport(TestTree tree, WatchListener listener) {
        this.tree = tree;
        this.listener = listener;
    }

    public List<Watch> getWatches() {
        return List.copyOf(watches);
    }

    /**
     * Register a watch until the token is cancelled. Within one project only
     * the outermost scope stays: a new watch covered by an existing one is not
     * added, existing watches the new one covers are dropped.
     *
     * @param include items to watch, null for the whole test dir
     * @return the watch, or null when an existing watch already covers it
     */
    public Watch addToWatch(TestProject project, List<TestItem> include, CancellationToken token) {
        Watch candidate = new Watch(project, include, null);
        for (Watch existing : watches) {
            if (existing.getProject() == project && covers(existing, candidate)) {
                logger.debug("watch {} already covered by {}", candidate, existing);
                return null;
            }
        }
        for (Watch existing : watches) {
            if (existing.getProject() == project && covers(candidate, existing)) {
                removeWatch(existing);
            }
        }
        Watch[] holder = new Watch[1];
        CancellationToken.Registration registration = token.onCancellationRequested(() -> {
            if (holder[0] != null) {
                watches.remove(holder[0]);
            }
        });
        if (token.isCancellationRequested()) {
            return null;
        }
        Watch watch = new Watch(project, include, registration);
        holder[0] = watch;
        watches.add(watch);
        return watch;
    }

    public void removeWatch(Watch watch) {
        if (watches.remove(watch) && watch.getRegistration() != null) {
            watch.getRegistration().close();
        }
    }

    public void clear() {
        for (Watch watch : new ArrayList<>(watches)) {
            removeWatch(watch);
        }
    }

    // ========== Scope ==========

    private static boolean covers(Watch outer, Watch inner) {
        if (outer.getInclude() == null) {
            String testDir = outer.getTestDir();
            if (inner.getInclude() == null) {
                return testDir != null && testDir.equals(inner.getTestDir());
            }
            for (TestItem item : inner.getInclude()) {
                if (testDir == null || item.getPath() == null || !PathUtils.isAncestorOrSelf(testDir, item.getPath())) {
                    return false;
                }
            }
            return true;
        }
        if (inner.getInclude() == null) {
            return false;
        }
        for (TestItem item : inner.getInclude()) {
            boolean covered = false;
            for (TestItem candidate : outer.getInclude()) {
                if (isAncestorOrSelf(candidate, item)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAncestorOrSelf(TestItem root, TestItem item) {
        for (TestItem current = item; current != null; current = current.getParent()) {
            if (current == root) {
                return true;
            }
        }
        return false;
    }

    // ========== Changes ==========

    /**
     * Map a change to the watches it triggers and report them in one callback.
     * The runner is asked once per config which test files the changed and
     * deleted files affect.
     *
     * @return the triggered watches, narrowed to the matched items
     */
    public List<Watch> workspaceChanged(WorkspaceChange change) {
        Set<String> files = change.changedOrDeleted();
        if (watches.isEmpty() || files.isEmpty()) {
            return List.of();
        }
        Map<TestModel, List<String>> relatedByModel = new LinkedHashMap<>();
        for (Watch watch : watches) {
            TestModel model = watch.getProject().getModel();
            if (!relatedByModel.containsKey(model)) {
                RelatedFilesReport report = model.findRelatedTestFiles(files);
                if (!report.errors().isEmpty()) {
                    logger.debug("related files query for {} reported: {}", model, report.errors().get(0).summary());
                }
                relatedByModel.put(model, report.testFiles());
            }
        }
        List<Watch> triggered = new ArrayList<>();
        for (Watch watch : watches) {
            List<String> testFiles = relatedByModel.get(watch.getProject().getModel());
            Set<TestItem> matched = new LinkedHashSet<>();
            for (String testFile : testFiles) {
                match(watch, testFile, matched);
            }
            if (!matched.isEmpty()) {
                triggered.add(watch.narrowTo(new ArrayList<>(matched)));
            }
        }
        if (!triggered.isEmpty()) {
            logger.debug("watches triggered: {}", triggered);
            listener.onWatchesTriggered(triggered);
        }
        return triggered;
    }

    private void match(Watch watch, String testFile, Set<TestItem> matched) {
        if (watch.getInclude() == null) {
            String testDir = watch.getTestDir();
            if (testDir != null && PathUtils.isStrictAncestor(testDir, testFile)) {
                addFileItem(testFile, matched);
            }
            return;
        }
        for (TestItem include : watch.getInclude()) {
            if (include.getPath() == null || !tree.contains(include)) {
                continue;
            }
            if (include.isGroup() && include.getKind() != TestItem.Kind.FILE) {
                if (PathUtils.isStrictAncestor(include.getPath(), testFile)) {
                    addFileItem(testFile, matched);
                }
            } else if (include.getPath().equals(testFile)) {
                // a file or a single test, keep the more specific include
                matched.add(include);
            }
        }
    }

    private void addFileItem(String testFile, Set<TestItem> matched) {
        TestItem fileItem = tree.getOrCreateForFileOrFolder(testFile, true);
        if (fileItem != null) {
            matched.add(fileItem);
        }
    }

}
