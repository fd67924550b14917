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

import io.testbridge.host.TestMessage;
import io.testbridge.host.TestRunView;
import io.testbridge.output.Console;
import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestError;
import io.testbridge.tree.TestItem;

import java.util.List;

/**
 * Prints run results to the console, one line per finished test.
 */
class ConsoleRunView implements TestRunView {

    private final boolean showOutput;
    private int passed;
    private int failed;
    private int skipped;
    private int errors;

    ConsoleRunView(boolean showOutput) {
        this.showOutput = showOutput;
    }

    @Override
    public void passed(TestItem item, long duration) {
        passed++;
        Console.println(Console.pass("  ok ") + title(item) + Console.grey(" (" + duration + "ms)"));
    }

    @Override
    public void failed(TestItem item, List<TestMessage> messages, long duration) {
        failed++;
        Console.println(Console.fail("  x  ") + title(item) + Console.grey(" (" + duration + "ms)"));
        for (TestMessage message : messages) {
            String where = message.location() == null ? ""
                    : Console.grey(" at " + message.location().file() + ":" + message.location().line());
            Console.println("       " + Console.stripAnsi(firstLine(message.message())) + where);
        }
    }

    @Override
    public void skipped(TestItem item) {
        skipped++;
        Console.println(Console.yellow("  -  ") + title(item));
    }

    @Override
    public void appendOutput(String text) {
        if (showOutput) {
            Console.println(text.endsWith("\n") ? text.substring(0, text.length() - 1) : text);
        }
    }

    @Override
    public void appendError(TestError error) {
        errors++;
        Console.println(Console.fail("error: ") + error.summary());
    }

    @Override
    public void end(RunOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append(Console.pass(passed + " passed"));
        if (failed > 0) {
            sb.append(", ").append(Console.fail(failed + " failed"));
        }
        if (skipped > 0) {
            sb.append(", ").append(Console.yellow(skipped + " skipped"));
        }
        if (outcome != RunOutcome.COMPLETED) {
            sb.append(" ").append(Console.yellow("(" + outcome.name().toLowerCase() + ")"));
        }
        Console.println(sb.toString());
    }

    boolean isSuccess() {
        return failed == 0 && errors == 0;
    }

    private static String title(TestItem item) {
        StringBuilder sb = new StringBuilder(item.getLabel());
        for (TestItem parent = item.getParent(); parent != null && !parent.isGroup(); parent = parent.getParent()) {
            sb.insert(0, parent.getLabel() + " > ");
        }
        return sb.toString();
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int pos = text.indexOf('\n');
        return pos == -1 ? text : text.substring(0, pos);
    }

}
