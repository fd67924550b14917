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
package io.testbridge.process;

import io.testbridge.common.OsUtils;
import io.testbridge.common.PathUtils;
import io.testbridge.common.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds the runner executable for a config and checks its version.
 * <p>
 * Resolution order:
 * <ol>
 *     <li>an explicit runner path or command line, relative paths resolved against the workspace</li>
 *     <li>{@code node_modules/.bin/<runner>} in the config folder and each parent up to the workspace root</li>
 *     <li>{@code <runner>} on the {@code PATH}</li>
 * </ol>
 */
public class RunnerLocator {

    private static final Logger logger = LoggerFactory.getLogger(RunnerLocator.class);

    public static final String DEFAULT_RUNNER_NAME = "playwright";
    public static final String DEFAULT_MINIMUM_VERSION = "1.38";

    private final RunnerCache cache;
    private final VersionCheck versionCheck;
    private final String runnerName;
    private final String minimumVersion;
    private final String pathEnv;

    public RunnerLocator(RunnerCache cache) {
        this(cache, VersionCheck.PROCESS, DEFAULT_RUNNER_NAME, DEFAULT_MINIMUM_VERSION, System.getenv("PATH"));
    }

    public RunnerLocator(RunnerCache cache, VersionCheck versionCheck, String runnerName, String minimumVersion, String pathEnv) {
        this.cache = cache;
        this.versionCheck = versionCheck;
        this.runnerName = runnerName;
        this.minimumVersion = minimumVersion;
        this.pathEnv = pathEnv;
    }

    /**
     * @param explicitRunner configured runner path or command line, may be null
     * @throws RunnerNotFoundException      when no executable is found
     * @throws IncompatibleRunnerException when the version is below the minimum
     */
    public RunnerInfo locate(String workspaceFolder, String configFile, String explicitRunner) {
        String configFolder = PathUtils.parent(PathUtils.canonicalize(configFile));
        RunnerInfo cached = cache.get(configFolder);
        if (cached != null) {
            return cached;
        }
        List<String> command = resolveCommand(workspaceFolder, configFolder, explicitRunner);
        String output;
        try {
            output = versionCheck.readVersion(command, Path.of(configFolder));
        } catch (RuntimeException e) {
            throw new RunnerNotFoundException("failed to run " + String.join(" ", command) + " --version: " + e.getMessage(), e);
        }
        String version = RunnerInfo.parseVersion(output);
        if (version == null) {
            throw new RunnerNotFoundException("could not determine runner version from: "
                    + StringUtils.truncate(StringUtils.trimToEmpty(output), 120, true));
        }
        RunnerInfo info = new RunnerInfo(command, version);
        if (minimumVersion != null && !info.isAtLeast(minimumVersion)) {
            throw new IncompatibleRunnerException(version, minimumVersion);
        }
        logger.debug("resolved runner for {}: {} ({})", configFolder, command, version);
        cache.put(configFolder, info);
        return info;
    }

    List<String> resolveCommand(String workspaceFolder, String configFolder, String explicitRunner) {
        if (!StringUtils.isBlank(explicitRunner)) {
            List<String> tokens = ProcessBuilder.tokenize(explicitRunner.trim());
            String first = tokens.get(0);
            Path path = Path.of(first);
            if (!path.isAbsolute() && (first.contains("/") || first.contains("\\"))) {
                path = Path.of(workspaceFolder).resolve(first).normalize();
            }
            if (path.isAbsolute()) {
                if (!Files.exists(path)) {
                    throw new RunnerNotFoundException("configured runner not found: " + path);
                }
                tokens.set(0, path.toString());
                return tokens;
            }
            String found = findOnPath(first);
            if (found == null) {
                throw new RunnerNotFoundException("configured runner not found on PATH: " + first);
            }
            tokens.set(0, found);
            return tokens;
        }
        String folder = configFolder;
        while (folder != null) {
            Path bin = Path.of(folder, "node_modules", ".bin");
            for (String name : OsUtils.executableNames(runnerName)) {
                Path candidate = bin.resolve(name);
                if (Files.isRegularFile(candidate)) {
                    return new ArrayList<>(List.of(candidate.toString()));
                }
            }
            if (!PathUtils.isStrictAncestor(workspaceFolder, folder)) {
                break;
            }
            folder = PathUtils.parent(folder);
        }
        String found = findOnPath(runnerName);
        if (found == null) {
            throw new RunnerNotFoundException("unable to find '" + runnerName + "' in node_modules or on the PATH for " + configFolder);
        }
        return new ArrayList<>(List.of(found));
    }

    private String findOnPath(String name) {
        if (StringUtils.isBlank(pathEnv)) {
            return null;
        }
        for (String dir : pathEnv.split(OsUtils.pathListSeparator())) {
            if (dir.isEmpty()) {
                continue;
            }
            for (String candidate : OsUtils.executableNames(name)) {
                Path path = Path.of(dir, candidate);
                if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                    return path.toString();
                }
            }
        }
        return null;
    }

}
