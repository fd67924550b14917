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

import io.testbridge.process.RunnerInfo;
import io.testbridge.process.TestConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestTreeTest {

    @Test
    void testWorkspaceItems() {
        TestTree tree = new TestTree(List.of("/ws/", "/other"));
        List<TestItem> roots = tree.getWorkspaceItems();
        assertEquals(2, roots.size());
        assertEquals("g0:/ws", roots.get(0).getId());
        assertEquals("ws", roots.get(0).getLabel());
        assertEquals(TestItem.Kind.WORKSPACE, roots.get(0).getKind());
        assertEquals("/ws", tree.location(roots.get(0)));
    }

    @Test
    void testGetOrCreateBuildsFolderChain() {
        TestTree tree = new TestTree(List.of("/ws"));
        List<TestItem> created = new ArrayList<>();
        TestItem file = tree.getOrCreateForFileOrFolder("/ws/tests/auth/login.spec.ts", true, created);
        assertEquals(TestItem.Kind.FILE, file.getKind());
        assertEquals("login.spec.ts", file.getLabel());
        assertTrue(file.isCanResolveChildren());
        assertEquals(List.of("tests", "auth", "login.spec.ts"), created.stream().map(TestItem::getLabel).toList());
        TestItem auth = file.getParent();
        assertEquals(TestItem.Kind.FOLDER, auth.getKind());
        assertEquals("g0:/ws/tests/auth", auth.getId());
        assertSame(tree.getWorkspaceItems().get(0), auth.getParent().getParent());
        assertSame(file, tree.getOrCreateForFileOrFolder("/ws/tests/auth/login.spec.ts", true));
        assertEquals(List.of(file), tree.findForLocation("/ws/tests/auth/login.spec.ts"));
    }

    @Test
    void testOutsideWorkspaceIsNull() {
        TestTree tree = new TestTree(List.of("/ws"));
        assertNull(tree.getOrCreateForFileOrFolder("/elsewhere/a.spec.ts", true));
        assertNull(tree.getOrCreateForFileOrFolder("/wsx/a.spec.ts", true));
    }

    @Test
    void testKeyOfStripsGeneration() {
        TestTree tree = new TestTree(List.of("/ws"));
        TestItem file = tree.getOrCreateForFileOrFolder("/ws/a.spec.ts", true);
        assertEquals("/ws/a.spec.ts", tree.keyOf(file));
        assertSame(file, tree.getForKey("/ws/a.spec.ts"));
        assertSame(file, tree.getById("g0:/ws/a.spec.ts"));
    }

    @Test
    void testDeleteDropsSubtreeAndMetadata() {
        TestTree tree = new TestTree(List.of("/ws"));
        TestItem file = tree.getOrCreateForFileOrFolder("/ws/tests/a.spec.ts", true);
        TestItem folder = file.getParent();
        TestConfig config = new TestConfig("/ws", "/ws/playwright.config.ts", new RunnerInfo(List.of("playwright"), "1.45"));
        tree.attributeToConfig(file, config);
        assertEquals(1, tree.configs(file).size());
        tree.delete(folder);
        assertFalse(tree.contains(folder));
        assertFalse(tree.contains(file));
        assertNull(tree.data(file));
        assertTrue(tree.configs(file).isEmpty());
        assertTrue(tree.findForLocation("/ws/tests/a.spec.ts").isEmpty());
        assertEquals(0, tree.getWorkspaceItems().get(0).getChildCount());
    }

    @Test
    void testResetKeepsOldItemsUntilPruned() {
        TestTree tree = new TestTree(List.of("/ws"));
        TestItem old = tree.getOrCreateForFileOrFolder("/ws/a.spec.ts", true);
        tree.reset();
        assertEquals(1, tree.getGeneration());
        assertTrue(tree.contains(old));
        assertFalse(tree.isCurrent(old));
        assertEquals(2, tree.getRoots().size());
        assertEquals(1, tree.getWorkspaceItems().size());
        assertNull(tree.getForKey("/ws/a.spec.ts"));
        assertTrue(tree.fileItems().isEmpty());
        TestItem fresh = tree.getOrCreateForFileOrFolder("/ws/a.spec.ts", true);
        assertEquals("g1:/ws/a.spec.ts", fresh.getId());
        List<TestItem> removed = tree.pruneStale();
        assertEquals(1, removed.size());
        assertEquals("g0:/ws", removed.get(0).getId());
        assertFalse(tree.contains(old));
        assertEquals(List.of(fresh), tree.findForLocation("/ws/a.spec.ts"));
    }

    @Test
    void testLoadedFlag() {
        TestTree tree = new TestTree(List.of("/ws"));
        TestItem file = tree.getOrCreateForFileOrFolder("/ws/a.spec.ts", true);
        assertFalse(tree.isLoaded(file));
        tree.setLoaded(file, true);
        assertTrue(tree.isLoaded(file));
    }

}
