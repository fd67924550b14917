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

import io.testbridge.model.WorkspaceChange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceObserverTest {

    final List<WorkspaceChange> changes = new CopyOnWriteArrayList<>();

    @Test
    void testEventsWithinWindowAreBatched() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        try (WorkspaceObserver observer = new WorkspaceObserver(change -> {
            changes.add(change);
            latch.countDown();
        }, Duration.ofMillis(200), WorkspaceObserver.DEFAULT_IGNORED_SEGMENTS)) {
            observer.fileCreated("/ws/tests/new.spec.ts");
            observer.fileChanged("/ws/tests/a.spec.ts");
            observer.fileChanged("/ws/tests/a.spec.ts");
            observer.fileDeleted("/ws/tests/old.spec.ts");
            assertTrue(latch.await(5, TimeUnit.SECONDS));
            Thread.sleep(300);
        }
        assertEquals(1, changes.size());
        WorkspaceChange change = changes.get(0);
        assertEquals(Set.of("/ws/tests/new.spec.ts"), change.created());
        assertEquals(Set.of("/ws/tests/a.spec.ts"), change.changed());
        assertEquals(Set.of("/ws/tests/old.spec.ts"), change.deleted());
    }

    @Test
    void testIgnoredSegments() {
        WorkspaceObserver observer = new WorkspaceObserver(changes::add);
        assertFalse(observer.isRelevant("/ws/node_modules/pkg/index.js"));
        assertFalse(observer.isRelevant("C:\\ws\\test-results\\trace.zip"));
        assertTrue(observer.isRelevant("/ws/tests/node_modules_helper.ts"));
        observer.fileChanged("/ws/node_modules/pkg/index.js");
        observer.flush();
        assertTrue(changes.isEmpty());
        observer.dispose();
    }

    @Test
    void testFlushDeliversOnceAndClears() {
        WorkspaceObserver observer = new WorkspaceObserver(changes::add, Duration.ofSeconds(30), List.of());
        observer.fileChanged("/ws/a.ts/");
        observer.flush();
        observer.flush();
        assertEquals(1, changes.size());
        assertEquals(Set.of("/ws/a.ts"), changes.get(0).changed());
        observer.dispose();
    }

    @Test
    void testSeparateWindowsGiveSeparateChanges() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        try (WorkspaceObserver observer = new WorkspaceObserver(change -> {
            changes.add(change);
            latch.countDown();
        }, Duration.ofMillis(20), List.of())) {
            observer.fileChanged("/ws/a.ts");
            Thread.sleep(300);
            observer.fileChanged("/ws/b.ts");
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        assertEquals(Set.of("/ws/a.ts"), changes.get(0).changed());
        assertEquals(Set.of("/ws/b.ts"), changes.get(1).changed());
    }

    @Test
    void testDisposeDropsPendingChange() throws Exception {
        WorkspaceObserver observer = new WorkspaceObserver(changes::add, Duration.ofMillis(100), List.of());
        observer.fileChanged("/ws/a.ts");
        observer.dispose();
        Thread.sleep(300);
        observer.fileChanged("/ws/b.ts");
        observer.flush();
        assertTrue(changes.isEmpty());
    }

    @Test
    void testHandlerFailureDoesNotStopLaterChanges() {
        WorkspaceObserver observer = new WorkspaceObserver(change -> {
            changes.add(change);
            throw new IllegalStateException("boom");
        }, Duration.ofSeconds(30), List.of());
        observer.fileChanged("/ws/a.ts");
        observer.flush();
        observer.fileChanged("/ws/b.ts");
        observer.flush();
        assertEquals(2, changes.size());
        observer.dispose();
    }

}
