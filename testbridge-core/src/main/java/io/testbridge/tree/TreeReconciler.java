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
package io.testbridge.tree;

import io.testbridge.model.Entry;
import io.testbridge.model.TestFile;
import io.testbridge.model.TestModel;
import io.testbridge.model.TestProject;
import io.testbridge.process.TestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects models onto a {@link TestTree} with minimal mutation. Items whose
 * file and title path did not change keep their identity; only their range
 * and tags are updated.
 */
public class TreeReconciler {

    private static final Logger logger = LoggerFactory.getLogger(TreeReconciler.class);

    private final TestTree tree;

    public TreeReconciler(TestTree tree) {
        this.tree = tree;
    }

    public TestTree getTree() {
        return tree;
    }

    // ========== File level ==========

    /**
     * Bring the suites and tests beneath a file item in line with the entries
     * and mark the file loaded.
     */
    public List<TreeDelta> reconcile(TestItem fileItem, List<Entry> entries) {
        ReconcilePlan plan = ReconcilePlan.compute(tree, fileItem, entries);
        List<TreeDelta> deltas = new ArrayList<>();
        apply(plan, fileItem, deltas);
        tree.setLoaded(fileItem, true);
        return deltas;
    }

    private void apply(ReconcilePlan plan, TestItem parent, List<TreeDelta> deltas) {
        for (TestItem removed : plan.getRemovals()) {
            tree.delete(removed);
            deltas.add(TreeDelta.removed(removed));
        }
        List<TestItem> ordered = new ArrayList<>();
        for (TestItem child : parent.getChildren()) {
            if (child.isGroup()) {
                ordered.add(child);
            }
        }
        for (ReconcilePlan.Node node : plan.getNodes()) {
            Entry entry = node.entry();
            TestItem item = node.existing();
            if (item == null) {
                TestItem.Kind kind = entry.isTest() ? TestItem.Kind.TEST : TestItem.Kind.SUITE;
                item = tree.createItem(kind, node.key(), entry.title(), entry.file(), parent);
                item.setRange(Range.ofLine(entry.line()));
                item.setTags(new LinkedHashSet<>(entry.tags()));
                tree.setLocation(item, entry.id());
                deltas.add(TreeDelta.added(item));
            } else if (updateItem(item, entry)) {
                deltas.add(TreeDelta.updated(item));
            }
            for (TestConfig config : tree.configs(parent)) {
                tree.attributeToConfig(item, config);
            }
            apply(node.children(), item, deltas);
            ordered.add(item);
        }
        parent.replaceChildren(ordered);
    }

    private boolean updateItem(TestItem item, Entry entry) {
        boolean changed = false;
        Range range = Range.ofLine(entry.line());
        if (!range.equals(item.getRange())) {
            item.setRange(range);
            tree.setLocation(item, entry.id());
            changed = true;
        }
        Set<String> tags = new HashSet<>(entry.tags());
        if (!tags.equals(item.getTags())) {
            item.setTags(tags);
            changed = true;
        }
        return changed;
    }

    // ========== Workspace level ==========

    /**
     * Project the files of every enabled project onto the tree: create the
     * folder and file chains, reconcile listed files, drop files that are gone
     * and prune folders left empty. Files outside every workspace folder are
     * skipped.
     */
    public List<TreeDelta> reconcileWorkspace(Collection<TestModel> models) {
        Map<String, List<List<Entry>>> entriesByFile = new LinkedHashMap<>();
        Map<String, Set<TestConfig>> configsByFile = new HashMap<>();
        for (TestModel model : models) {
            for (TestProject project : model.enabledProjects()) {
                for (TestFile file : project.getFiles().values()) {
                    entriesByFile.computeIfAbsent(file.path(), k -> new ArrayList<>()).add(file.entries());
                    configsByFile.computeIfAbsent(file.path(), k -> new LinkedHashSet<>()).add(model.getConfig());
                }
            }
        }
        List<TreeDelta> deltas = new ArrayList<>();
        for (TestItem item : tree.allItems()) {
            if (tree.isCurrent(item)) {
                tree.clearConfigs(item);
            }
        }
        Set<String> keep = new HashSet<>();
        for (Map.Entry<String, List<List<Entry>>> e : entriesByFile.entrySet()) {
            String path = e.getKey();
            List<TestItem> created = new ArrayList<>();
            TestItem fileItem = tree.getOrCreateForFileOrFolder(path, true, created);
            if (fileItem == null) {
                logger.debug("skipping file outside workspace folders: {}", path);
                continue;
            }
            for (TestItem item : created) {
                deltas.add(TreeDelta.added(item));
            }
            keep.add(fileItem.getId());
            for (TestConfig config : configsByFile.get(path)) {
                for (TestItem item = fileItem; item != null; item = item.getParent()) {
                    tree.attributeToConfig(item, config);
                }
            }
            List<Entry> merged = mergeEntries(e.getValue());
            if (!merged.isEmpty() || tree.isLoaded(fileItem)) {
                deltas.addAll(reconcile(fileItem, merged));
            }
        }
        for (TestItem fileItem : tree.fileItems()) {
            if (!keep.contains(fileItem.getId())) {
                tree.delete(fileItem);
                deltas.add(TreeDelta.removed(fileItem));
            }
        }
        for (TestItem root : tree.getWorkspaceItems()) {
            pruneEmptyFolders(root, deltas);
        }
        return deltas;
    }

    private void pruneEmptyFolders(TestItem item, List<TreeDelta> deltas) {
        for (TestItem child : item.getChildren()) {
            if (child.getKind() == TestItem.Kind.FOLDER) {
                pruneEmptyFolders(child, deltas);
                if (child.getChildCount() == 0) {
                    tree.delete(child);
                    deltas.add(TreeDelta.removed(child));
                }
            }
        }
    }

    /**
     * Merge the entries several projects report for one file. Entries are
     * matched by kind, title path and occurrence, children merged recursively.
     */
    static List<Entry> mergeEntries(List<List<Entry>> lists) {
        if (lists.size() == 1) {
            return lists.get(0);
        }
        Map<String, Entry> merged = new LinkedHashMap<>();
        for (List<Entry> list : lists) {
            Map<String, Integer> seen = new HashMap<>();
            for (Entry entry : list) {
                String key = entry.kind() + ":" + ReconcilePlan.keyOf(null, entry, seen);
                Entry existing = merged.get(key);
                merged.put(key, existing == null ? entry : merge(existing, entry));
            }
        }
        return new ArrayList<>(merged.values());
    }

    private static Entry merge(Entry a, Entry b) {
        Set<String> tags = new LinkedHashSet<>(a.tags());
        tags.addAll(b.tags());
        List<Entry> children = mergeEntries(List.of(a.children(), b.children()));
        return new Entry(a.kind(), a.file(), a.line(), a.column(), a.title(), a.titlePath(),
                new ArrayList<>(tags), children);
    }

}
