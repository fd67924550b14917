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

import io.testbridge.common.CancellationToken;
import io.testbridge.common.CancellationTokenSource;
import io.testbridge.common.PathUtils;
import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives a shell script standing in for the runner. The script answers the
 * queries and never connects back, so streaming runs end as terminated.
 */
@DisabledOnOs(OS.WINDOWS)
class RunnerBridgeTest {

    private static final String SCRIPT = """
            #!/bin/sh
            case "$1" in
              list-files)
                echo '{"projects":[{"name":"chromium","testDir":"'"$PWD"'/tests","files":["'"$PWD"'/tests/login.spec.ts"]}]}'
                ;;
              find-related-test-files)
                echo '{"testFiles":["'"$PWD"'/tests/login.spec.ts"]}'
                ;;
              broken)
                exit 1
                ;;
              test)
                echo "endpoint=$TESTBRIDGE_REPORTER_ENDPOINT node_options=$NODE_OPTIONS"
                exit 3
                ;;
            esac
            """;

    @TempDir
    Path workspace;

    TestConfig config;

    @BeforeEach
    void beforeEach() throws Exception {
        Path web = Files.createDirectories(workspace.resolve("web"));
        Path script = web.resolve("fake-runner.sh");
        Files.writeString(script, SCRIPT);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        Path configFile = web.resolve("playwright.config.ts");
        Files.writeString(configFile, "export default {}");
        config = new TestConfig(workspace.toString(), configFile.toString(), new RunnerInfo(List.of(script.toString()), "1.45.0"));
    }

    private RunnerBridge bridge(SideChannel sideChannel) {
        return new RunnerBridge(new RunnerBridge.BridgeOptions("reporter.js", sideChannel,
                Map.of("NODE_OPTIONS", "--inspect"), Duration.ofSeconds(1), null, null, null));
    }

    @Test
    void testListFiles() {
        RunnerBridge bridge = bridge(SideChannel.PIPE);
        ListFilesReport report = bridge.listFiles(config);
        assertNull(report.error());
        assertEquals(1, report.projects().size());
        ListFilesReport.ProjectFiles project = report.projects().get(0);
        assertEquals("chromium", project.name());
        String folder = PathUtils.canonicalize(workspace.resolve("web"));
        assertEquals(folder + "/tests", project.testDir());
        assertEquals(List.of(folder + "/tests/login.spec.ts"), project.files());
        assertEquals(List.of("web> playwright list-files -c playwright.config.ts"), bridge.testLog());
    }

    @Test
    void testListFilesFailureBecomesError() {
        TestConfig broken = new TestConfig(config.workspaceFolder(), config.configFile(),
                new RunnerInfo(List.of(config.runner().command().get(0), "broken"), "1.45.0"));
        ListFilesReport report = bridge(SideChannel.PIPE).listFiles(broken);
        assertNotNull(report.error());
        assertTrue(report.projects().isEmpty());
    }

    @Test
    void testFindRelatedTestFiles() {
        String changed = workspace.resolve("web/src/login.ts").toString();
        RelatedFilesReport report = bridge(SideChannel.PIPE).findRelatedTestFiles(config, List.of(changed));
        assertTrue(report.errors().isEmpty());
        assertEquals(List.of(PathUtils.canonicalize(workspace.resolve("web/tests/login.spec.ts"))), report.testFiles());
    }

    @Test
    void testFindRelatedFallsBackToInputs() {
        TestConfig broken = new TestConfig(config.workspaceFolder(), config.configFile(),
                new RunnerInfo(List.of(config.runner().command().get(0), "broken"), "1.45.0"));
        List<String> changed = List.of(workspace.resolve("web/tests/a.spec.ts").toString());
        RelatedFilesReport report = bridge(SideChannel.PIPE).findRelatedTestFiles(broken, changed);
        assertEquals(changed, report.testFiles());
        assertEquals(1, report.errors().size());
    }

    @Test
    void testChildExitingWithoutConnectingTerminates() throws Exception {
        for (SideChannel sideChannel : SideChannel.values()) {
            AtomicInteger terminated = new AtomicInteger();
            StringBuilder out = new StringBuilder();
            TestListener listener = new TestListener() {
                @Override
                public void onTerminated() {
                    terminated.incrementAndGet();
                }

                @Override
                public void onStdOut(String text) {
                    synchronized (out) {
                        out.append(text);
                    }
                }
            };
            RunnerBridge bridge = bridge(sideChannel);
            String location = workspace.resolve("web/tests/login.spec.ts").toString() + ":3";
            RunOutcome outcome = bridge.runTests(config, List.of(location), RunOptions.forProjects(List.of("chromium")),
                    listener, CancellationToken.NONE).get(10, TimeUnit.SECONDS);
            assertEquals(RunOutcome.TERMINATED, outcome);
            assertEquals(1, terminated.get());
            String printed;
            synchronized (out) {
                printed = out.toString();
            }
            assertTrue(printed.contains("endpoint="), printed);
            assertTrue(printed.contains("node_options=--inspect"), printed);
            assertEquals("web> playwright test -c playwright.config.ts --project=chromium tests/login\\.spec\\.ts:3",
                    bridge.testLog().get(0));
        }
    }

    @Test
    void testCancelledBeforeSpawnDoesNotSpawn() throws Exception {
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel();
        RunnerBridge bridge = bridge(SideChannel.PIPE);
        AtomicInteger terminated = new AtomicInteger();
        RunOutcome outcome = bridge.runTests(config, List.of(), RunOptions.DEFAULT, new TestListener() {
            @Override
            public void onTerminated() {
                terminated.incrementAndGet();
            }
        }, source.getToken()).get(5, TimeUnit.SECONDS);
        assertEquals(RunOutcome.CANCELED, outcome);
        assertTrue(bridge.testLog().isEmpty());
        assertEquals(1, terminated.get());
    }

    @Test
    void testCancelWhileWaitingForConnection() throws Exception {
        TestConfig slow = new TestConfig(config.workspaceFolder(), config.configFile(),
                new RunnerInfo(List.of("sh", "-c", "sleep 30"), "1.45.0"));
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger terminated = new AtomicInteger();
        var future = bridge(SideChannel.SOCKET).runTests(slow, List.of(), RunOptions.DEFAULT, new TestListener() {
            @Override
            public void onTerminated() {
                terminated.incrementAndGet();
            }
        }, source.getToken());
        assertFalse(future.isDone());
        source.cancel();
        assertEquals(RunOutcome.CANCELED, future.get(5, TimeUnit.SECONDS));
        assertEquals(1, terminated.get());
    }

}
