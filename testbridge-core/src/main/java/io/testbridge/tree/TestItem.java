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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node of the externally visible test tree: a workspace folder, a folder, a
 * file, a suite or a test. Reconciliation metadata does not live here but in
 * the {@link TestTree} side table.
 * <p>
 * Hold on to an item across a reconciliation pass only after checking
 * {@link TestTree#contains(TestItem)}; the pass may have removed it.
 */
public class TestItem {

    public enum Kind {
        WORKSPACE,
        FOLDER,
        FILE,
        SUITE,
        TEST
    }

    private final String id;
    private final Kind kind;
    private final String path;
    private String label;
    private Range range;
    private Set<String> tags = Set.of();
    private boolean canResolveChildren;
    private TestItem parent;
    private final Map<String, TestItem> children = new LinkedHashMap<>();

    TestItem(String id, Kind kind, String label, String path) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.path = path;
    }

    public String getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isGroup() {
        return kind == Kind.WORKSPACE || kind == Kind.FOLDER || kind == Kind.FILE;
    }

    public String getLabel() {
        return label;
    }

    void setLabel(String label) {
        this.label = label;
    }

    /**
     * File system path: the folder or file itself, or the file an entry lives in.
     */
    public String getPath() {
        return path;
    }

    public Range getRange() {
        return range;
    }

    void setRange(Range range) {
        this.range = range;
    }

    public Set<String> getTags() {
        return tags;
    }

    void setTags(Set<String> tags) {
        this.tags = Set.copyOf(tags);
    }

    public boolean isCanResolveChildren() {
        return canResolveChildren;
    }

    void setCanResolveChildren(boolean canResolveChildren) {
        this.canResolveChildren = canResolveChildren;
    }

    public TestItem getParent() {
        return parent;
    }

    public List<TestItem> getChildren() {
        return Collections.unmodifiableList(new ArrayList<>(children.values()));
    }

    public TestItem getChild(String id) {
        return children.get(id);
    }

    public int getChildCount() {
        return children.size();
    }

    void addChild(TestItem child) {
        child.parent = this;
        children.put(child.id, child);
    }

    void removeChild(TestItem child) {
        if (children.remove(child.id) != null) {
            child.parent = null;
        }
    }

    /**
     * Replace the children at once, in the given order.
     */
    void replaceChildren(List<TestItem> items) {
        for (TestItem child : children.values()) {
            child.parent = null;
        }
        children.clear();
        for (TestItem item : items) {
            addChild(item);
        }
    }

    @Override
    public String toString() {
        return kind + ":" + label;
    }

}
