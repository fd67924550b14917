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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Batches file notifications into one {@link WorkspaceChange}. Every event
 * restarts the debounce timer; when it fires the pending change is handed to
 * the handler once and cleared.
 */
public class WorkspaceObserver implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceObserver.class);

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(50);
    public static final List<String> DEFAULT_IGNORED_SEGMENTS = List.of("node_modules", "test-results");

    private final Consumer<WorkspaceChange> handler;
    private final Duration debounce;
    private final Set<String> ignoredSegments;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ReentrantLock lock = new ReentrantLock();

    private final Set<String> created = new LinkedHashSet<>();
    private final Set<String> changed = new LinkedHashSet<>();
    private final Set<String> deleted = new LinkedHashSet<>();
    private ScheduledFuture<?> pendingFlush;
    private volatile boolean disposed;

    public WorkspaceObserver(Consumer<WorkspaceChange> handler) {
        this(handler, DEFAULT_DEBOUNCE, DEFAULT_IGNORED_SEGMENTS);
    }

    public WorkspaceObserver(Consumer<WorkspaceChange> handler, Duration debounce, Collection<String> ignoredSegments) {
        this(handler, debounce, ignoredSegments, null);
    }

    /**
     * @param scheduler runs the flush, null for an own single daemon thread
     */
    public WorkspaceObserver(Consumer<WorkspaceChange> handler, Duration debounce, Collection<String> ignoredSegments,
                             ScheduledExecutorService scheduler) {
        this.handler = handler;
        this.debounce = debounce;
        this.ignoredSegments = new LinkedHashSet<>(ignoredSegments);
        if (scheduler == null) {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "workspace-observer");
                t.setDaemon(true);
                return t;
            });
            this.ownsScheduler = true;
        } else {
            this.scheduler = scheduler;
            this.ownsScheduler = false;
        }
    }

    public void fileCreated(String path) {
        record(path, created);
    }

    public void fileChanged(String path) {
        record(path, changed);
    }

    public void fileDeleted(String path) {
        record(path, deleted);
    }

    public boolean isRelevant(String path) {
        for (String segment : path.split("[/\\\\]")) {
            if (ignoredSegments.contains(segment)) {
                return false;
            }
        }
        return true;
    }

    private void record(String path, Set<String> target) {
        if (disposed || !isRelevant(path)) {
            return;
        }
        String canonical = PathUtils.canonicalize(path);
        lock.lock();
        try {
            target.add(canonical);
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
            }
            pendingFlush = scheduler.schedule(this::flush, debounce.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deliver the pending change now, if any.
     */
    public void flush() {
        WorkspaceChange change;
        lock.lock();
        try {
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
            if (created.isEmpty() && changed.isEmpty() && deleted.isEmpty()) {
                return;
            }
            change = new WorkspaceChange(created, changed, deleted);
            created.clear();
            changed.clear();
            deleted.clear();
        } finally {
            lock.unlock();
        }
        if (disposed) {
            return;
        }
        logger.debug("workspace change: {} created, {} changed, {} deleted",
                change.created().size(), change.changed().size(), change.deleted().size());
        try {
            handler.accept(change);
        } catch (Exception e) {
            logger.error("workspace change handler failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Cancel the pending flush and drop what it would have delivered.
     */
    public void dispose() {
        disposed = true;
        lock.lock();
        try {
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
            created.clear();
            changed.clear();
            deleted.clear();
        } finally {
            lock.unlock();
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    @Override
    public void close() {
        dispose();
    }

}
