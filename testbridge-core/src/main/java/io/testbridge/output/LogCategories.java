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
package io.testbridge.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category loggers shared across packages. Configure them in logback.xml by
 * name, e.g. {@code <logger name="testbridge.protocol" level="TRACE"/>}.
 */
public final class LogCategories {

    /** Logger for host lifecycle: discovery, rebuilds, runs, watches */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("testbridge.runtime");

    /** Logger for stdout/stderr lines of runner child processes */
    public static final Logger RUNNER_LOGGER = LoggerFactory.getLogger("testbridge.runner");

    /** Logger for raw reporter frames, useful at TRACE when diagnosing a runner */
    public static final Logger PROTOCOL_LOGGER = LoggerFactory.getLogger("testbridge.protocol");

    /** Logger for console output (CLI summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("testbridge.console");

    private LogCategories() {
    }

    /**
     * Set the level of the "testbridge" category loggers and the "io.testbridge" class loggers.
     * Uses reflection to avoid a compile-time dependency on Logback.
     *
     * @param level trace, debug, info, warn or error
     * @return true if the level was set, false if Logback is not the SLF4J binding
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("runtime log level not supported: not using Logback");
                return false;
            }
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            for (String name : new String[]{"testbridge", "io.testbridge"}) {
                Object logger = factory.getClass()
                        .getMethod("getLogger", String.class)
                        .invoke(factory, name);
                logger.getClass()
                        .getMethod("setLevel", levelClass)
                        .invoke(logger, levelValue);
            }
            RUNTIME_LOGGER.debug("set runtime log level to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

}
