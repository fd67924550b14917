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
import io.testbridge.model.FakeRunner;
import io.testbridge.model.TestModel;
import io.testbridge.process.RunnerInfo;
import io.testbridge.process.TestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static io.testbridge.model.FakeRunner.suite;
import static io.testbridge.model.FakeRunner.test;
import static org.junit.jupiter.api.Assertions.*;

class TreeReconcilerTest {

    static final String FILE = "/ws/tests/login.spec.ts";

    TestTree tree;
    TreeReconciler reconciler;
    TestItem fileItem;

    @BeforeEach
    void beforeEach() {
        tree = new TestTree(List.of("/ws"));
        reconciler = new TreeReconciler(tree);
        fileItem = tree.getOrCreateForFileOrFolder(FILE, true);
    }

    static Entry testEntry(int line, String... titlePath) {
        return new Entry(Entry.Kind.TEST, FILE, line, 5, titlePath[titlePath.length - 1],
                Arrays.asList(titlePath), List.of(), List.of());
    }

    static Entry suiteEntry(int line, String title, Entry... children) {
        return new Entry(Entry.Kind.SUITE, FILE, line, 1, title, List.of(title), List.of(), List.of(children));
    }

    static List<String> labels(TestItem item) {
        return item.getChildren().stream().map(TestItem::getLabel).toList();
    }

    static List<TreeDelta.Type> types(List<TreeDelta> deltas) {
        return deltas.stream().map(TreeDelta::type).toList();
    }

    @Test
    void testAddsItemsWithRangeAndLocation() {
        List<TreeDelta> deltas = reconciler.reconcile(fileItem, List.of(
                testEntry(3, "logs in"),
                suiteEntry(8, "cart", testEntry(9, "cart", "adds"))));
        assertEquals(3, deltas.size());
        assertTrue(deltas.stream().allMatch(d -> d.type() == TreeDelta.Type.ADDED));
        assertEquals(List.of("logs in", "cart"), labels(fileItem));
        TestItem login = fileItem.getChildren().get(0);
        assertEquals(TestItem.Kind.TEST, login.getKind());
        assertEquals(new Range(2, 0, 3, 0), login.getRange());
        assertEquals("g0:" + FILE + " > logs in", login.getId());
        assertEquals(List.of(login), tree.findForLocation(FILE + ":3"));
        TestItem adds = fileItem.getChildren().get(1).getChildren().get(0);
        assertEquals("g0:" + FILE + " > cart > adds", adds.getId());
        assertTrue(tree.isLoaded(fileItem));
    }

    @Test
    void testReconcileIsIdempotent() {
        List<Entry> entries = List.of(testEntry(3, "logs in"), suiteEntry(8, "cart", testEntry(9, "cart", "adds")));
        reconciler.reconcile(fileItem, entries);
        List<TestItem> before = new ArrayList<>(tree.allItems());
        assertTrue(reconciler.reconcile(fileItem, entries).isEmpty());
        assertEquals(before, new ArrayList<>(tree.allItems()));
        assertFalse(ReconcilePlan.compute(tree, fileItem, entries).hasStructuralChanges());
    }

    @Test
    void testLineShiftKeepsIdentity() {
        reconciler.reconcile(fileItem, List.of(testEntry(3, "logs in"), testEntry(8, "fails")));
        TestItem login = fileItem.getChildren().get(0);
        List<TreeDelta> deltas = reconciler.reconcile(fileItem, List.of(testEntry(5, "logs in"), testEntry(10, "fails")));
        assertEquals(List.of(TreeDelta.Type.UPDATED, TreeDelta.Type.UPDATED), types(deltas));
        assertSame(login, fileItem.getChildren().get(0));
        assertEquals(4, login.getRange().startLine());
        assertTrue(tree.findForLocation(FILE + ":3").isEmpty());
        assertEquals(List.of(login), tree.findForLocation(FILE + ":5"));
    }

    @Test
    void testRemovedEntryOnlyRemovesItsItem() {
        reconciler.reconcile(fileItem, List.of(testEntry(3, "logs in"), testEntry(8, "fails")));
        TestItem login = fileItem.getChildren().get(0);
        TestItem fails = fileItem.getChildren().get(1);
        List<TreeDelta> deltas = reconciler.reconcile(fileItem, List.of(testEntry(3, "logs in")));
        assertEquals(1, deltas.size());
        assertEquals(TreeDelta.Type.REMOVED, deltas.get(0).type());
        assertSame(fails, deltas.get(0).item());
        assertFalse(tree.contains(fails));
        assertTrue(tree.contains(login));
        assertEquals(List.of(login), fileItem.getChildren());
    }

    @Test
    void testRenameIsRemoveAndAdd() {
        reconciler.reconcile(fileItem, List.of(testEntry(3, "logs in")));
        List<TreeDelta> deltas = reconciler.reconcile(fileItem, List.of(testEntry(3, "signs in")));
        assertEquals(List.of(TreeDelta.Type.REMOVED, TreeDelta.Type.ADDED), types(deltas));
        assertEquals(List.of("signs in"), labels(fileItem));
    }

    @Test
    void testDuplicateTitlesGetOrdinals() {
        reconciler.reconcile(fileItem, List.of(testEntry(3, "works"), testEntry(7, "works"), testEntry(11, "works")));
        List<String> ids = fileItem.getChildren().stream().map(TestItem::getId).toList();
        assertEquals(List.of(
                "g0:" + FILE + " > works",
                "g0:" + FILE + " > works #2",
                "g0:" + FILE + " > works #3"), ids);
        TestItem second = fileItem.getChildren().get(1);
        reconciler.reconcile(fileItem, List.of(testEntry(4, "works"), testEntry(8, "works"), testEntry(12, "works")));
        assertSame(second, fileItem.getChildren().get(1));
    }

    @Test
    void testChildrenOfDuplicateSuitesKeepDistinctIds() {
        reconciler.reconcile(fileItem, List.of(
                suiteEntry(1, "cart", testEntry(2, "cart", "adds")),
                suiteEntry(5, "cart", testEntry(6, "cart", "adds"))));
        TestItem first = fileItem.getChildren().get(0).getChildren().get(0);
        TestItem secondSuite = fileItem.getChildren().get(1);
        TestItem second = secondSuite.getChildren().get(0);
        assertEquals("g0:" + FILE + " > cart > adds", first.getId());
        assertEquals("g0:" + FILE + " > cart #2 > adds", second.getId());
        assertTrue(tree.contains(first));
        assertTrue(tree.contains(second));
        assertEquals(List.of(first), tree.findForLocation(FILE + ":2"));
        assertEquals(List.of(second), tree.findForLocation(FILE + ":6"));

        List<TreeDelta> deltas = reconciler.reconcile(fileItem, List.of(
                suiteEntry(1, "cart", testEntry(3, "cart", "adds"))));
        assertEquals(List.of(TreeDelta.removed(secondSuite), TreeDelta.updated(first)), deltas);
        assertSame(first, fileItem.getChildren().get(0).getChildren().get(0));
        assertEquals(2, first.getRange().startLine());
        assertTrue(tree.contains(first));
        assertFalse(tree.contains(second));
        assertEquals(List.of(first), tree.findForLocation(FILE + ":3"));
        assertTrue(tree.findForLocation(FILE + ":6").isEmpty());
    }

    @Test
    void testKindChangeReplacesItem() {
        reconciler.reconcile(fileItem, List.of(testEntry(3, "group")));
        TestItem old = fileItem.getChildren().get(0);
        reconciler.reconcile(fileItem, List.of(suiteEntry(3, "group", testEntry(4, "group", "inner"))));
        TestItem now = fileItem.getChildren().get(0);
        assertNotSame(old, now);
        assertEquals(TestItem.Kind.SUITE, now.getKind());
        assertFalse(tree.contains(old));
        assertEquals(1, now.getChildCount());
    }

    @Test
    void testTagChangeIsUpdate() {
        reconciler.reconcile(fileItem, List.of(testEntry(3, "logs in")));
        Entry tagged = new Entry(Entry.Kind.TEST, FILE, 3, 5, "logs in", List.of("logs in"), List.of("@smoke"), List.of());
        List<TreeDelta> deltas = reconciler.reconcile(fileItem, List.of(tagged));
        assertEquals(List.of(TreeDelta.Type.UPDATED), types(deltas));
        assertEquals(Set.of("@smoke"), fileItem.getChildren().get(0).getTags());
    }

    @Test
    void testChildrenFollowEntryOrder() {
        reconciler.reconcile(fileItem, List.of(testEntry(3, "a"), testEntry(5, "b")));
        reconciler.reconcile(fileItem, List.of(testEntry(3, "b"), testEntry(5, "a")));
        assertEquals(List.of("b", "a"), labels(fileItem));
    }

    // ========== Workspace level ==========

    private TestModel model(FakeRunner runner) {
        TestModel model = new TestModel(new TestConfig("/ws", "/ws/playwright.config.ts",
                new RunnerInfo(List.of("playwright"), "1.45.0")), runner);
        model.listFiles();
        return model;
    }

    @Test
    void testWorkspaceCreatesFilesAndPrunesEmptyFolders() {
        TestTree fresh = new TestTree(List.of("/ws"));
        TreeReconciler r = new TreeReconciler(fresh);
        FakeRunner runner = new FakeRunner().project("chromium", "/ws/tests",
                "/ws/tests/a.spec.ts", "/ws/tests/deep/b.spec.ts", "/outside/c.spec.ts");
        TestModel model = model(runner);
        List<TreeDelta> deltas = r.reconcileWorkspace(List.of(model));
        assertEquals(4, deltas.size());
        assertNotNull(fresh.getForKey("/ws/tests/deep/b.spec.ts"));
        assertNull(fresh.getForKey("/outside/c.spec.ts"));
        TestItem file = fresh.getForKey("/ws/tests/a.spec.ts");
        assertEquals(Set.of(model.getConfig()), fresh.configs(file));
        assertEquals(Set.of(model.getConfig()), fresh.configs(fresh.getWorkspaceItems().get(0)));

        runner.project("chromium", "/ws/tests", "/ws/tests/a.spec.ts");
        model.listFiles();
        deltas = r.reconcileWorkspace(List.of(model));
        assertEquals(List.of(TreeDelta.Type.REMOVED, TreeDelta.Type.REMOVED), types(deltas));
        assertNull(fresh.getForKey("/ws/tests/deep"));
        assertSame(file, fresh.getForKey("/ws/tests/a.spec.ts"));
    }

    @Test
    void testWorkspaceReconcilesListedFiles() {
        TestTree fresh = new TestTree(List.of("/ws"));
        TreeReconciler r = new TreeReconciler(fresh);
        String a = "/ws/tests/a.spec.ts";
        FakeRunner runner = new FakeRunner().project("chromium", "/ws/tests", a);
        runner.file(a, test("one", a, 3), suite("group", a, 6, test("two", a, 7)));
        TestModel model = model(runner);
        model.listTests(List.of(a));
        r.reconcileWorkspace(List.of(model));
        TestItem file = fresh.getForKey(a);
        assertEquals(List.of("one", "group"), labels(file));
        TestItem two = fresh.findForLocation(a + ":7").get(0);
        assertEquals(Set.of(model.getConfig()), fresh.configs(two));
        assertTrue(r.reconcileWorkspace(List.of(model)).isEmpty());
    }

    @Test
    void testMergeEntriesAcrossProjects() {
        Entry chromium = new Entry(Entry.Kind.TEST, FILE, 3, 5, "t", List.of("t"), List.of("@a"), List.of());
        Entry firefox = new Entry(Entry.Kind.TEST, FILE, 3, 5, "t", List.of("t"), List.of("@b"), List.of());
        Entry onlyFirefox = testEntry(9, "ff only");
        List<Entry> merged = TreeReconciler.mergeEntries(List.of(List.of(chromium), List.of(firefox, onlyFirefox)));
        assertEquals(2, merged.size());
        assertEquals(List.of("@a", "@b"), merged.get(0).tags());
        assertEquals("ff only", merged.get(1).title());
    }

}
