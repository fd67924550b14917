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
package io.testbridge.common;

import java.util.List;

/**
 * Operating system detection utilities.
 */
public class OsUtils {

    public static final String OS_NAME = System.getProperty("os.name").toLowerCase();
    public static final String USER_HOME = System.getProperty("user.home");

    private OsUtils() {
        // only static methods
    }

    public static boolean isWindows() {
        return OS_NAME.contains("win");
    }

    public static boolean isMac() {
        return OS_NAME.contains("mac");
    }

    public static boolean isLinux() {
        return OS_NAME.contains("nix") || OS_NAME.contains("nux");
    }

    /**
     * Default file systems on Windows and macOS ignore case, which is why
     * paths coming from different producers need canonical drive letters.
     */
    public static boolean isCaseInsensitiveFileSystem() {
        return isWindows() || isMac();
    }

    /**
     * Separator used in PATH-like environment variables.
     */
    public static String pathListSeparator() {
        return isWindows() ? ";" : ":";
    }

    /**
     * Candidate file names for an executable, e.g. "playwright" becomes
     * "playwright.cmd", "playwright.exe", "playwright" on Windows.
     */
    public static List<String> executableNames(String name) {
        if (isWindows()) {
            return List.of(name + ".cmd", name + ".exe", name + ".bat", name);
        }
        return List.of(name);
    }

}
