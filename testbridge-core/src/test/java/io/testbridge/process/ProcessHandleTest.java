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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessHandleTest {

    @Test
    void testSimpleCommand() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create().args("echo", "hello").build());
        assertEquals(0, handle.waitForOutput(5000));
        assertEquals("hello\n", handle.getSysOut());
        assertEquals("", handle.getSysErr());
    }

    @Test
    void testStderrCapture() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sh", "-c", "echo oops >&2")
                .build());
        handle.waitForOutput(5000);
        assertEquals("oops\n", handle.getSysErr());
    }

    @Test
    void testRedirectErrorStream() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sh", "-c", "echo out; echo err >&2")
                .redirectErrorStream(true)
                .build());
        handle.waitForOutput(5000);
        assertTrue(handle.getSysOut().contains("out"));
        assertTrue(handle.getSysOut().contains("err"));
        assertEquals("", handle.getSysErr());
    }

    @Test
    void testExitCode() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create().args("sh", "-c", "exit 42").build());
        assertEquals(42, handle.waitSync(5000));
        assertEquals(42, handle.getExitCode());
    }

    @Test
    void testWorkingDir() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("pwd")
                .workingDir("/tmp")
                .build());
        handle.waitForOutput(5000);
        assertTrue(handle.getSysOut().trim().endsWith("tmp"));
    }

    @Test
    void testEnv() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sh", "-c", "echo $REPORTER_PORT")
                .env("REPORTER_PORT", "4711")
                .build());
        handle.waitForOutput(5000);
        assertEquals("4711", handle.getSysOut().trim());
    }

    @Test
    void testRemoveEnvDropsInheritedVariable() {
        String inherited = System.getenv().containsKey("HOME") ? "HOME" : "PATH";
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("/bin/sh", "-c", "echo \"[${" + inherited + ":-}]\"")
                .removeEnv(List.of(inherited))
                .build());
        handle.waitForOutput(5000);
        assertEquals("[]", handle.getSysOut().trim());
    }

    @Test
    void testExplicitEnvWinsOverRemoveEnv() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sh", "-c", "echo $NODE_OPTIONS")
                .removeEnv(List.of("NODE_OPTIONS"))
                .env("NODE_OPTIONS", "--trace-warnings")
                .build());
        handle.waitForOutput(5000);
        assertEquals("--trace-warnings", handle.getSysOut().trim());
    }

    @Test
    void testListener() {
        List<ProcessEvent> events = new CopyOnWriteArrayList<>();
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sh", "-c", "echo one; echo two; echo three >&2")
                .listener(events::add)
                .build());
        handle.waitForOutput(5000);
        assertEquals(List.of("one", "two"), events.stream().filter(ProcessEvent::isStdout).map(ProcessEvent::data).toList());
        assertEquals(List.of("three"), events.stream().filter(ProcessEvent::isStderr).map(ProcessEvent::data).toList());
        assertTrue(events.stream().anyMatch(ProcessEvent::isExit));
    }

    @Test
    void testOnEventBeforeStart() {
        List<String> lines = new CopyOnWriteArrayList<>();
        ProcessHandle handle = ProcessHandle.create(ProcessBuilder.create().args("echo", "deferred").build());
        handle.onEvent(event -> {
            if (event.isStdout()) {
                lines.add(event.data());
            }
        });
        assertFalse(handle.isAlive());
        handle.start();
        handle.waitForOutput(5000);
        assertEquals(List.of("deferred"), lines);
    }

    @Test
    void testStartTwiceFails() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create().args("true").build());
        assertThrows(IllegalStateException.class, handle::start);
        handle.waitSync(5000);
    }

    @Test
    void testListenerErrorDoesNotBreakOutput() {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("echo", "still here")
                .listener(event -> {
                    throw new RuntimeException("boom");
                })
                .build());
        handle.waitForOutput(5000);
        assertEquals("still here\n", handle.getSysOut());
    }

    @Test
    void testClose() throws Exception {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create().args("sleep", "60").build());
        assertTrue(handle.isAlive());
        assertTrue(handle.getPid() > 0);
        handle.close();
        handle.getExitFuture().get(5, TimeUnit.SECONDS);
        assertFalse(handle.isAlive());
    }

    @Test
    void testTimeoutDestroysProcess() throws Exception {
        ProcessHandle handle = ProcessHandle.start(ProcessBuilder.create()
                .args("sleep", "60")
                .timeoutMillis(200)
                .build());
        int code = handle.getExitFuture().get(10, TimeUnit.SECONDS);
        assertNotEquals(0, code);
    }

    @Test
    void testMissingExecutable() {
        ProcessConfig config = ProcessBuilder.create().args("/definitely/not/here/playwright").build();
        ProcessException e = assertThrows(ProcessException.class, () -> ProcessHandle.start(config));
        assertTrue(e.getMessage().contains("failed to start process"));
    }

}
