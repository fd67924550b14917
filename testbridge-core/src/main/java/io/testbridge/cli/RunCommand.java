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
package io.testbridge.cli;

import io.testbridge.common.CancellationTokenSource;
import io.testbridge.common.PathUtils;
import io.testbridge.host.TestHost;
import io.testbridge.model.TestModel;
import io.testbridge.model.TestProject;
import io.testbridge.output.Console;
import io.testbridge.reporter.RunOutcome;
import io.testbridge.tree.TestItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The 'run' subcommand: run tests once, or keep re-running them as files
 * change.
 * <p>
 * Usage examples:
 * <pre>
 * # Run every test of the default projects
 * testbridge run
 *
 * # Run one file and one test by line
 * testbridge run tests/login.spec.ts tests/cart.spec.ts:12
 *
 * # Re-run a folder whenever related files change
 * testbridge run tests/checkout --watch
 * </pre>
 */
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        description = "Run tests"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    private static final Pattern LINE_SUFFIX = Pattern.compile("^(.+):(\\d+)$");

    @Mixin
    HostOptions hostOptions;

    @Parameters(
            arity = "0..*",
            description = "Test files, folders or file:line locations (default: everything)"
    )
    List<String> locations;

    @Option(
            names = {"-p", "--project"},
            description = "Projects to run (default: the default project of each config)"
    )
    List<String> projects;

    @Option(
            names = {"--debug"},
            description = "Run headed with a single worker and no timeout, for an attached debugger"
    )
    boolean debug;

    @Option(
            names = {"--watch"},
            description = "Keep running and re-run the selected tests when related files change"
    )
    boolean watch;

    @Option(
            names = {"--output"},
            description = "Show the runner's own output"
    )
    boolean showOutput;

    @Override
    public Integer call() {
        TestHost host = hostOptions.startHost();
        try {
            if (host.getModels().isEmpty()) {
                Console.warn("no test configs found in " + hostOptions.workspaceFolder());
                return 1;
            }
            if (projects != null && !projects.isEmpty()) {
                selectProjects(host);
            }
            List<TestItem> include = resolveItems(host);
            if (include != null && include.isEmpty()) {
                Console.warn("no tests match " + locations);
                return 1;
            }
            ConsoleRunView view = new ConsoleRunView(showOutput);
            CancellationTokenSource cancellation = new CancellationTokenSource();
            Runtime.getRuntime().addShutdownHook(new Thread(cancellation::cancel, "testbridge-cancel"));
            RunOutcome outcome = (debug
                    ? host.debugTests(include, view, cancellation.getToken())
                    : host.runTests(include, view, cancellation.getToken())).join();
            if (!watch) {
                return outcome == RunOutcome.COMPLETED && view.isSuccess() ? 0 : 1;
            }
            return watch(host, include);
        } finally {
            host.close();
        }
    }

    private void selectProjects(TestHost host) {
        for (TestModel model : host.getModels()) {
            for (TestProject project : model.allProjects()) {
                host.setProjectEnabled(project, projects.contains(project.getName()));
            }
        }
    }

    /**
     * @return null to run everything
     */
    private List<TestItem> resolveItems(TestHost host) {
        if (locations == null || locations.isEmpty()) {
            return null;
        }
        Path root = hostOptions.workspaceFolder();
        List<TestItem> items = new ArrayList<>();
        for (String location : locations) {
            String path = location;
            String line = null;
            Matcher matcher = LINE_SUFFIX.matcher(location);
            if (matcher.matches() && !Files.exists(root.resolve(location))) {
                path = matcher.group(1);
                line = matcher.group(2);
            }
            String canonical = PathUtils.canonicalize(root.resolve(path));
            if (line != null) {
                host.listTests(List.of(canonical));
                List<TestItem> found = host.getTree().findForLocation(canonical + ":" + line);
                if (found.isEmpty()) {
                    Console.warn("no test at " + location);
                }
                items.addAll(found);
                continue;
            }
            TestItem item = host.getTree().getForKey(canonical);
            if (item == null) {
                Console.warn("not a known test file or folder: " + location);
            } else {
                items.add(item);
            }
        }
        return items;
    }

    private int watch(TestHost host, List<TestItem> include) {
        try {
            host.watchFileSystem();
        } catch (IOException e) {
            Console.println(Console.fail("cannot watch files: " + e.getMessage()));
            return 1;
        }
        host.setWatchRunView(new ConsoleRunView(showOutput));
        CancellationTokenSource watches = new CancellationTokenSource();
        for (TestModel model : host.getModels()) {
            for (TestProject project : model.enabledProjects()) {
                host.addWatch(project, include, watches.getToken());
            }
        }
        Console.println(Console.grey("watching for changes, press Ctrl+C to stop"));
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            watches.cancel();
            stopped.countDown();
        }, "testbridge-watch-stop"));
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("watch interrupted");
        }
        return 0;
    }

}
