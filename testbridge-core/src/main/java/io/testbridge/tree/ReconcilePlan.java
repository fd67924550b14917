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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one reconciliation pass will do to the children of an item, computed
 * without touching the tree. Applying it is all-or-nothing from the point of
 * view of the event loop.
 */
public final class ReconcilePlan {

    /**
     * A new entry with the item it maps to, or null when one must be created.
     */
    public record Node(String key, Entry entry, TestItem existing, ReconcilePlan children) {

        public boolean isNew() {
            return existing == null;
        }

    }

    private final TestItem parent;
    private final List<Node> nodes;
    private final List<TestItem> removals;

    private ReconcilePlan(TestItem parent, List<Node> nodes, List<TestItem> removals) {
        this.parent = parent;
        this.nodes = Collections.unmodifiableList(nodes);
        this.removals = Collections.unmodifiableList(removals);
    }

    public TestItem getParent() {
        return parent;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<TestItem> getRemovals() {
        return removals;
    }

    /**
     * True when applying the plan changes the structure of the tree.
     */
    public boolean hasStructuralChanges() {
        if (!removals.isEmpty()) {
            return true;
        }
        for (Node node : nodes) {
            if (node.isNew() || node.children.hasStructuralChanges()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param parent the file or suite item, null when planning beneath a not yet created item
     */
    public static ReconcilePlan compute(TestTree tree, TestItem parent, List<Entry> entries) {
        String parentKey = parent == null || parent.getKind() == TestItem.Kind.FILE ? null : tree.keyOf(parent);
        return compute(tree, parent, parentKey, entries);
    }

    private static ReconcilePlan compute(TestTree tree, TestItem parent, String parentKey, List<Entry> entries) {
        Map<String, TestItem> existingByKey = new LinkedHashMap<>();
        if (parent != null) {
            for (TestItem child : parent.getChildren()) {
                if (!child.isGroup()) {
                    existingByKey.put(tree.keyOf(child), child);
                }
            }
        }
        List<Node> nodes = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (Entry entry : entries) {
            String key = keyOf(parentKey, entry, seen);
            TestItem existing = existingByKey.remove(key);
            if (existing != null && !existing.getKind().name().equals(entry.kind().name())) {
                // a suite became a test or the other way round
                existingByKey.put(key + "\u0000", existing);
                existing = null;
            }
            ReconcilePlan children = compute(tree, existing, key, entry.children());
            nodes.add(new Node(key, entry, existing, children));
        }
        return new ReconcilePlan(parent, nodes, new ArrayList<>(existingByKey.values()));
    }

    /**
     * Match key of an entry: the key of its enclosing suite (or its file at the
     * top level) and its title, with an ordinal suffix for repeats of the same
     * title among siblings, in first-seen order. Children of repeated suites
     * therefore get distinct keys through the suite's suffix.
     *
     * @param parentKey key of the enclosing suite, null at the top level of a file
     */
    static String keyOf(String parentKey, Entry entry, Map<String, Integer> seen) {
        String base = (parentKey != null ? parentKey : entry.file()) + " > " + entry.title();
        int count = seen.merge(base, 1, Integer::sum);
        return count == 1 ? base : base + " #" + count;
    }

}
