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
package io.testbridge.host;

import io.testbridge.common.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Finds runner config files beneath a workspace folder.
 */
public class ConfigLocator {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLocator.class);

    public static final List<String> DEFAULT_CONFIG_FILE_NAMES = List.of(
            "playwright.config.ts", "playwright.config.js", "playwright.config.mjs", "playwright.config.cjs");

    private final Set<String> fileNames;
    private final Set<String> ignoredSegments;

    public ConfigLocator(Collection<String> fileNames, Collection<String> ignoredSegments) {
        this.fileNames = Set.copyOf(fileNames);
        this.ignoredSegments = Set.copyOf(ignoredSegments);
    }

    /**
     * @return canonical config paths in a stable order
     */
    public List<String> find(Path workspaceFolder) {
        List<String> result = new ArrayList<>();
        if (!Files.isDirectory(workspaceFolder)) {
            return result;
        }
        try {
            Files.walkFileTree(workspaceFolder, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    Path name = dir.getFileName();
                    if (name != null && ignoredSegments.contains(name.toString()) && !dir.equals(workspaceFolder)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (fileNames.contains(file.getFileName().toString())) {
                        result.add(PathUtils.canonicalize(file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    logger.debug("skipping unreadable path: {}", file);
                    return FileVisitResult.CONTINUE;
                }

            });
        } catch (IOException e) {
            throw new RuntimeException("failed to scan for config files in: " + workspaceFolder, e);
        }
        result.sort(null);
        return result;
    }

}
