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

import io.testbridge.common.PathUtils;
import io.testbridge.host.TestHost;
import io.testbridge.model.TestModel;
import io.testbridge.model.TestProject;
import io.testbridge.output.Console;
import io.testbridge.reporter.TestError;
import io.testbridge.tree.TestItem;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * The 'list' subcommand: discover configs, projects and tests and print the
 * test tree.
 * <p>
 * Usage examples:
 * <pre>
 * # List test files of the default projects
 * testbridge list --files-only
 *
 * # List every test of every project
 * testbridge list --all-projects -w /path/to/workspace
 * </pre>
 */
@Command(
        name = "list",
        mixinStandardHelpOptions = true,
        description = "List discovered tests"
)
public class ListCommand implements Callable<Integer> {

    @Mixin
    HostOptions hostOptions;

    @Option(
            names = {"--files-only"},
            description = "List test files without listing the tests inside them"
    )
    boolean filesOnly;

    @Option(
            names = {"--all-projects"},
            description = "Enable every project, not only the default one"
    )
    boolean allProjects;

    @Override
    public Integer call() {
        try (TestHost host = hostOptions.startHost()) {
            if (allProjects) {
                for (TestModel model : host.getModels()) {
                    for (TestProject project : model.allProjects()) {
                        host.setProjectEnabled(project, true);
                    }
                }
            }
            for (TestModel model : host.getModels()) {
                Console.println(Console.bold(model.getConfig().configFile()) + " "
                        + Console.grey(String.join(", ", projectNames(model))));
            }
            int errors = 0;
            if (!filesOnly) {
                Set<String> files = new LinkedHashSet<>();
                for (TestModel model : host.getModels()) {
                    files.addAll(model.enabledFiles());
                }
                if (!files.isEmpty()) {
                    for (TestError error : host.listTests(files)) {
                        errors++;
                        Console.println(Console.fail("error: ") + error.summary());
                    }
                }
            }
            String root = hostOptions.workspaceFolder().toString();
            for (TestItem item : host.getTree().getWorkspaceItems()) {
                for (TestItem child : item.getChildren()) {
                    print(child, root, 0);
                }
            }
            return errors == 0 && host.getWarnings().isEmpty() ? 0 : 1;
        }
    }

    private static Set<String> projectNames(TestModel model) {
        Set<String> names = new LinkedHashSet<>();
        for (TestProject project : model.allProjects()) {
            names.add(project.isEnabled() ? project.getName() : project.getName() + " (disabled)");
        }
        return names;
    }

    private static void print(TestItem item, String root, int depth) {
        String indent = "  ".repeat(depth);
        String text = switch (item.getKind()) {
            case FOLDER, FILE -> depth == 0 ? PathUtils.relativize(root, item.getPath()) : item.getLabel();
            case SUITE -> Console.bold(item.getLabel());
            default -> item.getLabel() + Console.grey(" :" + (item.getRange().startLine() + 1));
        };
        Console.println(indent + text);
        for (TestItem child : item.getChildren()) {
            print(child, root, depth + 1);
        }
    }

}
