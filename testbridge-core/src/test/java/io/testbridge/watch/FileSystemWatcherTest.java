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

import io.testbridge.common.PathUtils;
import io.testbridge.model.WorkspaceChange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class FileSystemWatcherTest {

    @TempDir
    Path root;

    final List<WorkspaceChange> changes = new CopyOnWriteArrayList<>();

    private boolean await(Predicate<WorkspaceChange> condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10000;
        while (System.currentTimeMillis() < deadline) {
            for (WorkspaceChange change : changes) {
                if (condition.test(change)) {
                    return true;
                }
            }
            Thread.sleep(50);
        }
        return false;
    }

    private static boolean mentions(WorkspaceChange change, Path file) {
        String path = PathUtils.canonicalize(file);
        return change.created().contains(path) || change.changed().contains(path);
    }

    @Test
    void testReportsCreateModifyDelete() throws Exception {
        Path tests = Files.createDirectories(root.resolve("tests"));
        Path existing = Files.writeString(tests.resolve("a.spec.ts"), "one");
        WorkspaceObserver observer = new WorkspaceObserver(changes::add, Duration.ofMillis(20), WorkspaceObserver.DEFAULT_IGNORED_SEGMENTS);
        try (FileSystemWatcher watcher = new FileSystemWatcher(observer)) {
            watcher.watch(List.of(root));
            assertEquals(1, watcher.getWatchedRoots().size());

            Path created = Files.writeString(tests.resolve("b.spec.ts"), "two");
            assertTrue(await(c -> c.created().contains(PathUtils.canonicalize(created))));

            Files.writeString(existing, "changed");
            assertTrue(await(c -> c.changed().contains(PathUtils.canonicalize(existing))));

            Files.delete(created);
            assertTrue(await(c -> c.deleted().contains(PathUtils.canonicalize(created))));
        } finally {
            observer.dispose();
        }
    }

    @Test
    void testFilesInNewDirectoryAreReported() throws Exception {
        WorkspaceObserver observer = new WorkspaceObserver(changes::add, Duration.ofMillis(20), List.of());
        try (FileSystemWatcher watcher = new FileSystemWatcher(observer)) {
            watcher.watch(List.of(root));
            Path nested = Files.createDirectories(root.resolve("nested/deeper"));
            Path early = Files.writeString(nested.resolve("c.spec.ts"), "three");
            assertTrue(await(c -> mentions(c, early)));
            Path late = Files.writeString(nested.resolve("d.spec.ts"), "four");
            assertTrue(await(c -> mentions(c, late)));
        } finally {
            observer.dispose();
        }
    }

    @Test
    void testIgnoredPathsAreNotReported() throws Exception {
        Path modules = Files.createDirectories(root.resolve("node_modules/pkg"));
        WorkspaceObserver observer = new WorkspaceObserver(changes::add, Duration.ofMillis(20), WorkspaceObserver.DEFAULT_IGNORED_SEGMENTS);
        try (FileSystemWatcher watcher = new FileSystemWatcher(observer)) {
            watcher.watch(List.of(root));
            Files.writeString(modules.resolve("index.js"), "ignored");
            Path marker = Files.writeString(root.resolve("marker.spec.ts"), "seen");
            assertTrue(await(c -> mentions(c, marker)));
            for (WorkspaceChange change : changes) {
                for (String path : change.all()) {
                    assertFalse(path.contains("node_modules"), path);
                }
            }
        } finally {
            observer.dispose();
        }
    }

    @Test
    void testWatchingTwiceKeepsOneWatcher() throws Exception {
        WorkspaceObserver observer = new WorkspaceObserver(changes::add);
        try (FileSystemWatcher watcher = new FileSystemWatcher(observer)) {
            watcher.watch(List.of(root));
            watcher.watch(List.of(root, root.resolve("missing")));
            assertEquals(1, watcher.getWatchedRoots().size());
        } finally {
            observer.dispose();
        }
    }

}
