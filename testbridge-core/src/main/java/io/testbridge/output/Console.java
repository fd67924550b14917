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

import java.io.PrintStream;
import java.util.regex.Pattern;

/**
 * Console output utilities with ANSI color support.
 * Also sends a copy (stripped of ANSI codes) to the testbridge.console logger at TRACE level.
 */
public final class Console {

    private static final Logger logger = LogCategories.CONSOLE_LOGGER;

    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[;\\d]*m");

    public static final String RESET = "\u001B[0m";
    public static final String BOLD = "\u001B[1m";
    public static final String RED = "\u001B[31m";
    public static final String GREEN = "\u001B[32m";
    public static final String YELLOW = "\u001B[33m";
    public static final String CYAN = "\u001B[36m";
    public static final String GREY = "\u001B[90m";

    private static boolean colorsEnabled = detectColorSupport();
    private static PrintStream out = System.out;

    private Console() {
    }

    public static String stripAnsi(String text) {
        return text == null ? null : ANSI_PATTERN.matcher(text).replaceAll("");
    }

    private static boolean detectColorSupport() {
        if (System.getenv("NO_COLOR") != null) {
            return false;
        }
        String forceColor = System.getenv("FORCE_COLOR");
        if (forceColor != null && !forceColor.equals("0")) {
            return true;
        }
        String term = System.getenv("TERM");
        if (term != null && (term.contains("color") || term.contains("xterm") || term.contains("256"))) {
            return true;
        }
        if (System.getenv("COLORTERM") != null) {
            return true;
        }
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            return System.getenv("WT_SESSION") != null;
        }
        return System.console() != null;
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    public static boolean isColorsEnabled() {
        return colorsEnabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    // ========== Formatting helpers ==========

    public static String color(String text, String... codes) {
        if (!colorsEnabled || codes.length == 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        for (String code : codes) {
            sb.append(code);
        }
        sb.append(text);
        sb.append(RESET);
        return sb.toString();
    }

    public static String bold(String text) {
        return color(text, BOLD);
    }

    public static String pass(String text) {
        return color(text, GREEN);
    }

    public static String fail(String text) {
        return color(text, RED);
    }

    public static String yellow(String text) {
        return color(text, YELLOW);
    }

    public static String grey(String text) {
        return color(text, GREY);
    }

    // ========== Output ==========

    public static void println() {
        out.println();
    }

    public static void println(String text) {
        out.println(text);
        if (logger.isTraceEnabled()) {
            logger.trace(stripAnsi(text));
        }
    }

    /**
     * One-line warning, the way environment errors reach the user.
     */
    public static void warn(String text) {
        println(yellow("warning: ") + text);
    }

}
