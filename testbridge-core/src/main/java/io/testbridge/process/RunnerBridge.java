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
import io.testbridge.common.Json;
import io.testbridge.common.PathUtils;
import io.testbridge.common.StringUtils;
import io.testbridge.output.LogCategories;
import io.testbridge.reporter.Location;
import io.testbridge.reporter.PipeReporterEndpoint;
import io.testbridge.reporter.ReporterEndpoint;
import io.testbridge.reporter.ReporterProtocol;
import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestError;
import io.testbridge.reporter.TestListener;
import io.testbridge.reporter.WebSocketReporterEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the runner command line: {@code <runner> test -c <config> ...} for
 * list, run and debug, plus the {@code list-files} and
 * {@code find-related-test-files} queries. Every spawned child gets a side
 * channel endpoint in its environment and reports through it.
 */
public class RunnerBridge implements TestRunner {

    private static final Logger logger = LoggerFactory.getLogger(RunnerBridge.class);

    /**
     * Inherited variables that would instrument or debug the child a second time.
     */
    public static final List<String> STRIPPED_ENV = List.of(
            "NODE_OPTIONS", "ELECTRON_RUN_AS_NODE", "JAVA_TOOL_OPTIONS", "JDK_JAVA_OPTIONS");

    static final long QUERY_TIMEOUT_MILLIS = 120000;

    // a connection made just before the child exited may still sit in the accept queue
    static final long ABANDON_DELAY_MILLIS = 500;

    private final BridgeOptions options;
    private final List<String> testLog = new CopyOnWriteArrayList<>();

    public RunnerBridge(BridgeOptions options) {
        this.options = options;
    }

    /**
     * @param reporterModule reporter the runner loads to talk back, passed in the environment
     * @param env            extra environment for every child
     * @param runnerName     name shown in command log lines
     */
    public record BridgeOptions(
            String reporterModule,
            SideChannel sideChannel,
            Map<String, String> env,
            Duration stopGracePeriod,
            ScheduledExecutorService scheduler,
            DebugLauncher debugLauncher,
            String runnerName
    ) {

        public BridgeOptions {
            env = env == null ? Map.of() : Map.copyOf(env);
            if (sideChannel == null) {
                sideChannel = SideChannel.SOCKET;
            }
            if (stopGracePeriod == null) {
                stopGracePeriod = ReporterProtocol.DEFAULT_GRACE_PERIOD;
            }
            if (scheduler == null) {
                scheduler = ReporterProtocol.defaultScheduler();
            }
            if (debugLauncher == null) {
                debugLauncher = new ProcessDebugLauncher();
            }
            if (runnerName == null) {
                runnerName = RunnerLocator.DEFAULT_RUNNER_NAME;
            }
        }

        public static BridgeOptions defaults(String reporterModule) {
            return new BridgeOptions(reporterModule, null, null, null, null, null, null);
        }

    }

    /**
     * Command lines as the user would type them, relative to the workspace.
     */
    public List<String> testLog() {
        return Collections.unmodifiableList(testLog);
    }

    // ========== Queries ==========

    @Override
    public ListFilesReport listFiles(TestConfig config) {
        log(config, "list-files -c " + config.configFileName());
        List<String> args = new ArrayList<>(config.runner().command());
        args.addAll(List.of("list-files", "-c", config.configFileName()));
        String output;
        try {
            output = runQuery(config, args);
        } catch (ProcessException e) {
            return ListFilesReport.failed(e.getMessage());
        }
        try {
            return ListFilesReport.fromMap(Json.parseObject(output));
        } catch (RuntimeException e) {
            logger.warn("unexpected list-files output for {}: {}", config.configFile(),
                    StringUtils.truncate(output.trim(), 200, true));
            return ListFilesReport.failed("failed to list files: " + e.getMessage());
        }
    }

    @Override
    public RelatedFilesReport findRelatedTestFiles(TestConfig config, List<String> files) {
        log(config, "find-related-test-files -c " + config.configFileName());
        List<String> args = new ArrayList<>(config.runner().command());
        args.addAll(List.of("find-related-test-files", "-c", config.configFileName()));
        args.addAll(files);
        try {
            return RelatedFilesReport.fromMap(Json.parseObject(runQuery(config, args)));
        } catch (RuntimeException e) {
            TestError error = new TestError(e.getMessage(), null, null,
                    new Location(config.configFileName(), 0, 0), null);
            return new RelatedFilesReport(files, List.of(error));
        }
    }

    private String runQuery(TestConfig config, List<String> args) {
        ProcessConfig pc = ProcessBuilder.create()
                .args(args)
                .workingDir(config.configFolderPath())
                .removeEnv(STRIPPED_ENV)
                .env(childEnv(Map.of()))
                .timeoutMillis(QUERY_TIMEOUT_MILLIS)
                .build();
        ProcessHandle handle = ProcessHandle.start(pc);
        int code = handle.waitForOutput(QUERY_TIMEOUT_MILLIS);
        String out = handle.getSysOut();
        if (out.isBlank()) {
            throw new ProcessException("runner exited with code " + code + ": "
                    + StringUtils.truncate(handle.getSysErr().trim(), 300, true));
        }
        return out;
    }

    // ========== Streaming ==========

    @Override
    public CompletableFuture<RunOutcome> listTests(TestConfig config, List<String> locations,
                                                   TestListener listener, CancellationToken token) {
        List<String> args = List.of("--list", "--reporter=null");
        return spawn(config, locations, args, args, listener, token, false);
    }

    @Override
    public CompletableFuture<RunOutcome> runTests(TestConfig config, List<String> locations, RunOptions runOptions,
                                                  TestListener listener, CancellationToken token) {
        List<String> args = new ArrayList<>();
        for (String project : runOptions.projects()) {
            args.add("--project=" + project);
        }
        if (runOptions.grep() != null) {
            args.add("--grep=" + StringUtils.escapeRegex(runOptions.grep()));
        }
        List<String> printed = new ArrayList<>(args);
        args.add("--repeat-each=1");
        args.add("--retries=0");
        if (runOptions.headed()) {
            args.add("--headed");
            printed.add("--headed");
        }
        if (runOptions.workers() != null) {
            args.add("--workers=" + runOptions.workers());
        }
        if (runOptions.trace() != null) {
            args.add("--trace=" + runOptions.trace());
        }
        return spawn(config, locations, args, printed, listener, token, false);
    }

    @Override
    public CompletableFuture<RunOutcome> debugTests(TestConfig config, List<String> locations, RunOptions runOptions,
                                                    TestListener listener, CancellationToken token) {
        List<String> args = new ArrayList<>();
        args.add("--headed");
        for (String project : runOptions.projects()) {
            args.add("--project=" + project);
        }
        args.addAll(List.of("--repeat-each=1", "--retries=0", "--timeout=0", "--workers=1"));
        if (runOptions.grep() != null) {
            args.add("--grep=" + StringUtils.escapeRegex(runOptions.grep()));
        }
        return spawn(config, locations, args, List.of("--debug"), listener, token, true);
    }

    private CompletableFuture<RunOutcome> spawn(TestConfig config, List<String> locations, List<String> extraArgs,
                                                List<String> printedArgs, TestListener listener,
                                                CancellationToken token, boolean debug) {
        if (token.isCancellationRequested()) {
            listener.onTerminated();
            return CompletableFuture.completedFuture(RunOutcome.CANCELED);
        }
        List<String> escaped = new ArrayList<>();
        List<String> relative = new ArrayList<>();
        for (String location : locations) {
            escaped.add(StringUtils.escapeRegex(location));
            relative.add(StringUtils.escapeRegex(PathUtils.relativize(config.configFolder(), location)));
        }
        Collections.sort(escaped);
        Collections.sort(relative);
        StringBuilder line = new StringBuilder("test -c ").append(config.configFileName());
        for (String arg : printedArgs) {
            line.append(' ').append(arg);
        }
        for (String location : relative) {
            line.append(' ').append(location);
        }
        log(config, line.toString());

        ReporterEndpoint endpoint = debug || options.sideChannel() == SideChannel.SOCKET
                ? new WebSocketReporterEndpoint(options.reporterModule())
                : new PipeReporterEndpoint(options.reporterModule());
        List<String> args = new ArrayList<>(config.runner().command());
        args.add("test");
        args.add("-c");
        args.add(config.configFileName());
        args.addAll(extraArgs);
        args.addAll(escaped);
        ProcessConfig pc = ProcessBuilder.create()
                .args(args)
                .workingDir(config.configFolderPath())
                .removeEnv(STRIPPED_ENV)
                .env(childEnv(endpoint.env()))
                .listener(event -> {
                    if (event.isStdout()) {
                        listener.onStdOut(event.data() + "\n");
                    } else if (event.isStderr()) {
                        listener.onStdErr(event.data() + "\n");
                    }
                })
                .build();
        ProcessHandle handle;
        try {
            handle = debug ? options.debugLauncher().launch(pc) : ProcessHandle.start(pc);
        } catch (RuntimeException e) {
            endpoint.close();
            throw e;
        }
        return wire(endpoint, handle, listener, token);
    }

    private CompletableFuture<RunOutcome> wire(ReporterEndpoint endpoint, ProcessHandle handle,
                                               TestListener listener, CancellationToken token) {
        CompletableFuture<RunOutcome> result = new CompletableFuture<>();
        handle.getExitFuture().whenComplete((code, e) -> {
            if (!endpoint.transport().isDone()) {
                logger.debug("runner exited ({}) before connecting, abandoning side channel", code);
                options.scheduler().schedule(endpoint::abandon, ABANDON_DELAY_MILLIS, TimeUnit.MILLISECONDS);
            }
        });
        CancellationToken.Registration beforeConnect = token.onCancellationRequested(() -> {
            if (!endpoint.transport().isDone()) {
                endpoint.abandon();
                handle.close();
            }
        });
        endpoint.transport().whenComplete((transport, error) -> {
            beforeConnect.close();
            if (error != null) {
                // no reporter ever connected, so nothing else will end the run
                listener.onTerminated();
                endpoint.close();
                handle.close();
                result.complete(token.isCancellationRequested() ? RunOutcome.CANCELED : RunOutcome.TERMINATED);
                return;
            }
            ReporterProtocol protocol = new ReporterProtocol(transport, listener, token,
                    options.stopGracePeriod(), options.scheduler());
            protocol.start().whenComplete((outcome, e) -> {
                endpoint.close();
                if (outcome != RunOutcome.COMPLETED && handle.isAlive()) {
                    handle.close();
                }
                result.complete(outcome != null ? outcome : RunOutcome.TERMINATED);
            });
        });
        return result;
    }

    private Map<String, String> childEnv(Map<String, String> endpointEnv) {
        Map<String, String> env = new LinkedHashMap<>(options.env());
        env.putAll(endpointEnv);
        env.put("FORCE_COLOR", "1");
        env.put("PW_TEST_HTML_REPORT_OPEN", "never");
        return env;
    }

    private void log(TestConfig config, String command) {
        String line = StringUtils.escapeRegex(config.relativeConfigFolder()) + "> " + options.runnerName() + " " + command;
        testLog.add(line);
        LogCategories.RUNTIME_LOGGER.debug(line);
    }

}
