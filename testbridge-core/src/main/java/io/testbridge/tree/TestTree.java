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

import io.testbridge.common.PathUtils;
import io.testbridge.process.TestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The persistent test tree plus its side table of reconciliation metadata.
 * <p>
 * Item ids are {@code g<generation>:<key>}, where the key is the path for
 * workspace, folder and file items and the match key for suites and tests.
 * {@link #reset()} starts a new generation; items of older generations stay
 * visible until {@link #pruneStale()} removes them, so an interrupted rebuild
 * never leaves a half-empty tree.
 * <p>
 * Not thread-safe: only the host event loop mutates the tree.
 */
public class TestTree {

    private static final Logger logger = LoggerFactory.getLogger(TestTree.class);

    /**
     * Reconciliation metadata of one item.
     */
    public static class ItemData {

        private String location;
        private boolean loaded;
        private final Set<TestConfig> configs = new LinkedHashSet<>();

        public String getLocation() {
            return location;
        }

        public boolean isLoaded() {
            return loaded;
        }

        public Set<TestConfig> getConfigs() {
            return Collections.unmodifiableSet(configs);
        }

    }

    private final List<String> workspaceFolders = new ArrayList<>();
    private final List<TestItem> roots = new ArrayList<>();
    private final Map<String, TestItem> items = new LinkedHashMap<>();
    private final Map<String, ItemData> data = new LinkedHashMap<>();
    private final Map<String, Set<String>> locationIndex = new LinkedHashMap<>();
    private long generation;
    private String prefix = "g0:";

    public TestTree(Collection<String> workspaceFolders) {
        for (String folder : workspaceFolders) {
            this.workspaceFolders.add(PathUtils.canonicalize(folder));
        }
        createWorkspaceItems();
    }

    public List<String> getWorkspaceFolders() {
        return Collections.unmodifiableList(workspaceFolders);
    }

    public void setWorkspaceFolders(Collection<String> folders) {
        workspaceFolders.clear();
        for (String folder : folders) {
            workspaceFolders.add(PathUtils.canonicalize(folder));
        }
    }

    // ========== Generations ==========

    public long getGeneration() {
        return generation;
    }

    /**
     * Start a new generation with fresh workspace items. Items of the previous
     * generation stay until {@link #pruneStale()}.
     */
    public void reset() {
        generation++;
        prefix = "g" + generation + ":";
        createWorkspaceItems();
        logger.debug("test tree generation: {}", generation);
    }

    /**
     * Remove every item that does not belong to the current generation.
     *
     * @return the removed top-level items
     */
    public List<TestItem> pruneStale() {
        List<TestItem> removed = new ArrayList<>();
        for (TestItem root : new ArrayList<>(roots)) {
            if (!isCurrent(root)) {
                unbind(root);
                roots.remove(root);
                removed.add(root);
            }
        }
        return removed;
    }

    public boolean isCurrent(TestItem item) {
        return item.getId().startsWith(prefix);
    }

    private void createWorkspaceItems() {
        for (String folder : workspaceFolders) {
            TestItem item = createItem(TestItem.Kind.WORKSPACE, folder, PathUtils.fileName(folder), folder, null);
            roots.add(item);
        }
    }

    // ========== Lookup ==========

    public String idFor(String key) {
        return prefix + key;
    }

    public String keyOf(TestItem item) {
        String id = item.getId();
        int pos = id.indexOf(':');
        return id.substring(pos + 1);
    }

    public List<TestItem> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    public List<TestItem> getWorkspaceItems() {
        List<TestItem> result = new ArrayList<>();
        for (TestItem root : roots) {
            if (isCurrent(root)) {
                result.add(root);
            }
        }
        return result;
    }

    public TestItem getById(String id) {
        return items.get(id);
    }

    public TestItem getForKey(String key) {
        return items.get(idFor(key));
    }

    public boolean contains(TestItem item) {
        return items.get(item.getId()) == item;
    }

    public Collection<TestItem> allItems() {
        return Collections.unmodifiableCollection(items.values());
    }

    /**
     * Current generation file items.
     */
    public List<TestItem> fileItems() {
        List<TestItem> result = new ArrayList<>();
        for (TestItem item : items.values()) {
            if (item.getKind() == TestItem.Kind.FILE && isCurrent(item)) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Suite and test items at a {@code file:line} location. Several items
     * share a location when tests are generated on one line.
     */
    public List<TestItem> findForLocation(String location) {
        Set<String> ids = locationIndex.get(location);
        if (ids == null) {
            return List.of();
        }
        List<TestItem> result = new ArrayList<>();
        for (String id : ids) {
            TestItem item = items.get(id);
            if (item != null && isCurrent(item)) {
                result.add(item);
            }
        }
        return result;
    }

    // ========== Side table ==========

    public ItemData data(TestItem item) {
        return data.get(item.getId());
    }

    public String location(TestItem item) {
        ItemData d = data(item);
        return d == null ? null : d.location;
    }

    void setLocation(TestItem item, String location) {
        ItemData d = data.get(item.getId());
        if (d.location != null) {
            Set<String> ids = locationIndex.get(d.location);
            if (ids != null) {
                ids.remove(item.getId());
                if (ids.isEmpty()) {
                    locationIndex.remove(d.location);
                }
            }
        }
        d.location = location;
        if (location != null) {
            locationIndex.computeIfAbsent(location, k -> new LinkedHashSet<>()).add(item.getId());
        }
    }

    public void attributeToConfig(TestItem item, TestConfig config) {
        data.get(item.getId()).configs.add(config);
    }

    public Set<TestConfig> configs(TestItem item) {
        ItemData d = data(item);
        return d == null ? Set.of() : d.getConfigs();
    }

    void clearConfigs(TestItem item) {
        data.get(item.getId()).configs.clear();
    }

    public boolean isLoaded(TestItem item) {
        ItemData d = data(item);
        return d != null && d.loaded;
    }

    public void setLoaded(TestItem item, boolean loaded) {
        data.get(item.getId()).loaded = loaded;
    }

    // ========== Mutation ==========

    TestItem createItem(TestItem.Kind kind, String key, String label, String path, TestItem parent) {
        TestItem item = new TestItem(idFor(key), kind, label, path);
        items.put(item.getId(), item);
        data.put(item.getId(), new ItemData());
        if (kind != TestItem.Kind.SUITE && kind != TestItem.Kind.TEST) {
            setLocation(item, path);
        }
        if (parent != null) {
            parent.addChild(item);
        }
        return item;
    }

    /**
     * Remove an item, its descendants and their metadata.
     */
    public void delete(TestItem item) {
        unbind(item);
        TestItem parent = item.getParent();
        if (parent != null) {
            parent.removeChild(item);
        } else {
            roots.remove(item);
        }
    }

    /**
     * Drop metadata of an item and its subtree without detaching it.
     */
    void unbind(TestItem item) {
        for (TestItem child : item.getChildren()) {
            unbind(child);
        }
        setLocation(item, null);
        items.remove(item.getId());
        data.remove(item.getId());
    }

    /**
     * File or folder item for a path, creating the folder chain up to its
     * workspace item. Returns null for paths outside every workspace folder.
     */
    public TestItem getOrCreateForFileOrFolder(String path, boolean isFile) {
        return getOrCreateForFileOrFolder(path, isFile, new ArrayList<>());
    }

    TestItem getOrCreateForFileOrFolder(String path, boolean isFile, List<TestItem> created) {
        String canonical = PathUtils.canonicalize(path);
        TestItem existing = getForKey(canonical);
        if (existing != null) {
            return existing;
        }
        for (String folder : workspaceFolders) {
            if (PathUtils.isStrictAncestor(folder, canonical)) {
                return getOrCreateInWorkspace(canonical, isFile, created);
            }
        }
        return null;
    }

    private TestItem getOrCreateInWorkspace(String path, boolean isFile, List<TestItem> created) {
        TestItem existing = getForKey(path);
        if (existing != null) {
            return existing;
        }
        TestItem parent = getOrCreateInWorkspace(PathUtils.parent(path), false, created);
        TestItem item = createItem(isFile ? TestItem.Kind.FILE : TestItem.Kind.FOLDER,
                path, PathUtils.fileName(path), path, parent);
        item.setCanResolveChildren(true);
        created.add(item);
        return item;
    }

}
