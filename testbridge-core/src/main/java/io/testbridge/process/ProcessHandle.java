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

import io.testbridge.output.LogCategories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Child process wrapper: starts the process, reads stdout and stderr line by
 * line on daemon threads and dispatches {@link ProcessEvent}s.
 * <p>
 * Supports two creation modes:
 * 1. Immediate start: ProcessHandle.start(config) - starts process immediately
 * 2. Deferred start: ProcessHandle.create(config) then handle.start() - allows setup before start
 */
public class ProcessHandle {

    private static final Logger logger = LoggerFactory.getLogger(ProcessHandle.class);

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final ProcessConfig config;
    private Process process;
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
    private final StringBuilder stdoutBuffer = new StringBuilder();
    private final StringBuilder stderrBuffer = new StringBuilder();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Consumer<ProcessEvent>> eventListeners = new CopyOnWriteArrayList<>();

    private ExecutorService executor;
    private volatile int exitCode = -1;

    private ProcessHandle(ProcessConfig config) {
        this.config = config;
    }

    public static ProcessHandle create(ProcessConfig config) {
        return new ProcessHandle(config);
    }

    public static ProcessHandle start(ProcessConfig config) {
        ProcessHandle handle = new ProcessHandle(config);
        handle.start();
        return handle;
    }

    /**
     * Start the process. Can only be called once.
     *
     * @throws ProcessException if the executable cannot be started
     */
    public ProcessHandle start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("process already started");
        }
        java.lang.ProcessBuilder pb = new java.lang.ProcessBuilder(config.args());
        if (config.workingDir() != null) {
            pb.directory(config.workingDir().toFile());
        }
        Map<String, String> environment = pb.environment();
        for (String name : config.removeEnv()) {
            environment.remove(name);
        }
        environment.putAll(config.env());
        pb.redirectErrorStream(config.redirectErrorStream());
        logger.debug("starting process: {}", config.args());
        try {
            this.process = pb.start();
        } catch (IOException e) {
            throw new ProcessException("failed to start process: " + config.commandLine() + " - " + e.getMessage(), e);
        }
        int id = COUNTER.incrementAndGet();
        this.executor = Executors.newCachedThreadPool(daemonThreadFactory("process-" + id + "-"));
        startStreamReaders();
        startExitWaiter();
        return this;
    }

    /**
     * Add an event listener. Can be called before or after start().
     */
    public ProcessHandle onEvent(Consumer<ProcessEvent> listener) {
        eventListeners.add(listener);
        return this;
    }

    private void startStreamReaders() {
        executor.submit(() -> readLines(process.getInputStream(), ProcessEvent.Type.STDOUT));
        if (!config.redirectErrorStream()) {
            executor.submit(() -> readLines(process.getErrorStream(), ProcessEvent.Type.STDERR));
        }
    }

    private void readLines(InputStream stream, ProcessEvent.Type type) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(type, line);
            }
        } catch (Exception e) {
            if (!closed.get()) {
                logger.warn("{} reader error: {}", type.name().toLowerCase(), e.getMessage());
            }
        }
    }

    private void startExitWaiter() {
        executor.submit(() -> {
            try {
                int code;
                if (config.timeout() != null) {
                    if (!process.waitFor(config.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                        logger.warn("process timed out after {}ms, destroying: {}", config.timeout().toMillis(), config.commandLine());
                        process.destroyForcibly();
                    }
                }
                code = process.waitFor();
                exitCode = code;
                dispatchEvent(ProcessEvent.exit(code));
                exitFuture.complete(code);
                logger.debug("process exited with code: {}", code);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exitFuture.completeExceptionally(e);
            } catch (Exception e) {
                exitFuture.completeExceptionally(e);
            } finally {
                executor.shutdown();
            }
        });
    }

    private void handleLine(ProcessEvent.Type type, String line) {
        StringBuilder buffer = (type == ProcessEvent.Type.STDOUT) ? stdoutBuffer : stderrBuffer;
        synchronized (buffer) {
            buffer.append(line).append('\n');
        }
        if (config.logOutput()) {
            LogCategories.RUNNER_LOGGER.debug(line);
        }
        ProcessEvent event = (type == ProcessEvent.Type.STDOUT)
                ? ProcessEvent.stdout(line)
                : ProcessEvent.stderr(line);
        dispatchEvent(event);
    }

    private void dispatchEvent(ProcessEvent event) {
        if (config.listener() != null) {
            try {
                config.listener().accept(event);
            } catch (Exception e) {
                logger.warn("listener error: {}", e.getMessage());
            }
        }
        for (Consumer<ProcessEvent> listener : eventListeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                logger.warn("event listener error: {}", e.getMessage());
            }
        }
    }

    // ========== Public API ==========

    public int waitSync() {
        try {
            return exitFuture.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessException("interrupted waiting for process", e);
        } catch (Exception e) {
            throw new ProcessException("error waiting for process", e);
        }
    }

    public int waitSync(long timeoutMillis) {
        try {
            return exitFuture.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ProcessException("process timed out after " + timeoutMillis + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessException("interrupted waiting for process", e);
        } catch (Exception e) {
            throw new ProcessException("error waiting for process", e);
        }
    }

    /**
     * Waits for exit and for both stream readers to drain, so that
     * {@link #getSysOut()} holds the complete output.
     */
    public int waitForOutput(long timeoutMillis) {
        int code = waitSync(timeoutMillis);
        try {
            executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return code;
    }

    public String getSysOut() {
        synchronized (stdoutBuffer) {
            return stdoutBuffer.toString();
        }
    }

    public String getSysErr() {
        synchronized (stderrBuffer) {
            return stderrBuffer.toString();
        }
    }

    public OutputStream getStdin() {
        return process.getOutputStream();
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    public void close() {
        close(false);
    }

    public void close(boolean force) {
        if (closed.compareAndSet(false, true) && process != null) {
            if (force) {
                process.destroyForcibly();
            } else {
                process.destroy();
            }
            logger.debug("process closed (force={})", force);
        }
    }

    public long getPid() {
        return process.pid();
    }

    public CompletableFuture<Integer> getExitFuture() {
        return exitFuture;
    }

    public ProcessConfig getConfig() {
        return config;
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

}
