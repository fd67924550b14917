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

import io.testbridge.output.Console;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    ByteArrayOutputStream console;

    @BeforeEach
    void beforeEach() {
        console = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(console, true, StandardCharsets.UTF_8));
        Console.setColorsEnabled(false);
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(System.out);
    }

    private String consoleText() {
        return console.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testVersion() {
        CommandLine cmd = Main.createCommandLine();
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        assertEquals(0, cmd.execute("--version"));
        assertTrue(out.toString().contains("testbridge " + Main.VERSION));
    }

    @Test
    void testSubcommands() {
        CommandLine cmd = Main.createCommandLine();
        assertNotNull(cmd.getSubcommands().get("list"));
        assertNotNull(cmd.getSubcommands().get("run"));
    }

    @Test
    void testUnknownOption() {
        CommandLine cmd = Main.createCommandLine();
        cmd.setErr(new PrintWriter(new StringWriter()));
        assertNotEquals(0, cmd.execute("list", "--bogus"));
    }

    @Test
    void testListEmptyWorkspace(@TempDir Path dir) {
        int code = Main.createCommandLine().execute("list", "-w", dir.toString());
        assertEquals(0, code);
    }

    @Test
    void testRunWithoutConfigs(@TempDir Path dir) {
        int code = Main.createCommandLine().execute("run", "-w", dir.toString());
        assertEquals(1, code);
        assertTrue(consoleText().contains("warning: no test configs found"), consoleText());
    }

    @Test
    void testBrokenSettingsFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("testbridge.json"), "{ nope");
        CommandLine cmd = Main.createCommandLine();
        cmd.setErr(new PrintWriter(new StringWriter()));
        assertNotEquals(0, cmd.execute("list", "-w", dir.toString()));
    }

}
