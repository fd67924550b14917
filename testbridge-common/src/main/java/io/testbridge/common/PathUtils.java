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

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * String-level path helpers. Paths travel through the reporter protocol and the
 * test tree as strings, so identity lookups depend on every producer emitting
 * the same spelling for the same file.
 */
public final class PathUtils {

    private static final Pattern DRIVE_LETTER = Pattern.compile("^[a-zA-Z]:[\\\\/].*");

    private PathUtils() {
    }

    /**
     * Canonical spelling of a file system path: upper-case drive letter, no
     * trailing separator (except for a root).
     */
    public static String canonicalize(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String result = path;
        if (DRIVE_LETTER.matcher(result).matches() && Character.isLowerCase(result.charAt(0))) {
            result = Character.toUpperCase(result.charAt(0)) + result.substring(1);
        }
        while (result.length() > 1 && isSeparator(result.charAt(result.length() - 1)) && !isRoot(result)) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    public static String canonicalize(Path path) {
        return canonicalize(path.toAbsolutePath().normalize().toString());
    }

    /**
     * True when {@code child} equals {@code parent} or lives beneath it.
     */
    public static boolean isAncestorOrSelf(String parent, String child) {
        if (parent == null || child == null) {
            return false;
        }
        String p = canonicalize(parent);
        String c = canonicalize(child);
        return c.equals(p) || isStrictAncestor(p, c);
    }

    /**
     * True when {@code child} lives beneath {@code parent}, not equal to it.
     */
    public static boolean isStrictAncestor(String parent, String child) {
        if (parent == null || child == null) {
            return false;
        }
        String p = canonicalize(parent);
        String c = canonicalize(child);
        if (c.length() <= p.length() || !c.startsWith(p)) {
            return false;
        }
        return isSeparator(p.charAt(p.length() - 1)) || isSeparator(c.charAt(p.length()));
    }

    /**
     * Parent directory, or null for a root or a bare name.
     */
    public static String parent(String path) {
        String p = canonicalize(path);
        int pos = lastSeparator(p);
        if (pos < 0 || isRoot(p)) {
            return null;
        }
        if (pos == 0) {
            return p.length() > 1 ? p.substring(0, 1) : null;
        }
        String parent = p.substring(0, pos);
        if (DRIVE_LETTER.matcher(parent + "/").matches() && parent.length() == 2) {
            return parent + p.charAt(pos);
        }
        return parent;
    }

    public static String fileName(String path) {
        String p = canonicalize(path);
        int pos = lastSeparator(p);
        return pos < 0 ? p : p.substring(pos + 1);
    }

    /**
     * Relative spelling of {@code path} from {@code base}, using forward slashes.
     * Returns the path unchanged when it is not beneath base.
     */
    public static String relativize(String base, String path) {
        if (!isAncestorOrSelf(base, path)) {
            return path;
        }
        String b = canonicalize(base);
        String p = canonicalize(path);
        if (p.equals(b)) {
            return "";
        }
        int start = isSeparator(b.charAt(b.length() - 1)) ? b.length() : b.length() + 1;
        return p.substring(start).replace('\\', '/');
    }

    private static int lastSeparator(String p) {
        return Math.max(p.lastIndexOf('/'), p.lastIndexOf('\\'));
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }

    private static boolean isRoot(String p) {
        return p.equals("/") || p.equals("\\") || (p.length() == 3 && DRIVE_LETTER.matcher(p).matches());
    }

}
