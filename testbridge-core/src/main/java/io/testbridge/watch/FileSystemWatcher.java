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

import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Feeds directory-watcher events for a set of directory trees into a
 * {@link WorkspaceObserver}. New subdirectories are watched as they appear
 * and the files already inside them are reported as created.
 */
public class FileSystemWatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemWatcher.class);

    private final WorkspaceObserver observer;
    private final Map<Path, DirectoryWatcher> watchers = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public FileSystemWatcher(WorkspaceObserver observer) {
        this.observer = observer;
    }

    /**
     * Watch directory trees, skipping those already watched. Returns once
     * the trees are registered; events arrive on a daemon thread per root.
     *
     * @throws IOException if a tree cannot be registered
     */
    public void watch(Collection<Path> roots) throws IOException {
        List<Path> added = new ArrayList<>();
        for (Path root : roots) {
            Path dir = root.toAbsolutePath().normalize();
            if (!Files.isDirectory(dir) || watchers.containsKey(dir)) {
                continue;
            }
            DirectoryWatcher watcher = DirectoryWatcher.builder()
                    .path(dir)
                    .listener(this::handleEvent)
                    .fileHashing(false)
                    .build();
            CompletableFuture<Void> loop = watcher.watchAsync(task -> {
                Thread thread = new Thread(task, "file-system-watcher");
                thread.setDaemon(true);
                thread.start();
            });
            if (loop.isCompletedExceptionally()) {
                try {
                    loop.join();
                } catch (CompletionException e) {
                    throw new IOException("failed to watch " + dir, e.getCause());
                }
            }
            loop.whenComplete((v, e) -> {
                if (e != null && running) {
                    logger.error("directory watcher for {} stopped: {}", dir, e.getMessage(), e);
                }
            });
            watchers.put(dir, watcher);
            added.add(dir);
        }
        logger.debug("watching {}", added);
    }

    public Set<Path> getWatchedRoots() {
        return Set.copyOf(watchers.keySet());
    }

    private void handleEvent(DirectoryChangeEvent event) {
        if (!running || event.path() == null) {
            return;
        }
        String path = event.path().toString();
        if (!observer.isRelevant(path)) {
            return;
        }
        switch (event.eventType()) {
            case CREATE -> {
                if (event.isDirectory()) {
                    reportContents(event.path());
                } else {
                    observer.fileCreated(path);
                }
            }
            case MODIFY -> {
                if (!event.isDirectory()) {
                    observer.fileChanged(path);
                }
            }
            case DELETE -> observer.fileDeleted(path);
            default -> logger.debug("watch overflow under {}", event.rootPath());
        }
    }

    /**
     * Files can land in a new directory before it is registered.
     */
    private void reportContents(Path dir) {
        try (Stream<Path> walker = Files.walk(dir)) {
            walker.filter(Files::isRegularFile)
                    .map(Path::toString)
                    .filter(observer::isRelevant)
                    .forEach(observer::fileCreated);
        } catch (IOException | UncheckedIOException e) {
            logger.debug("failed to list new directory {}: {}", dir, e.getMessage());
        }
    }

    @Override
    public void close() {
        running = false;
        for (DirectoryWatcher watcher : watchers.values()) {
            try {
                watcher.close();
            } catch (IOException e) {
                logger.warn("failed to close directory watcher: {}", e.getMessage());
            }
        }
        watchers.clear();
    }

}
