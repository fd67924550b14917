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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringUtilsTest {

    @Test
    void testEscapeRegex() {
        assertEquals("should work \\(1\\)", StringUtils.escapeRegex("should work (1)"));
        assertEquals("a\\.b\\*c\\?", StringUtils.escapeRegex("a.b*c?"));
        assertEquals("\\[x\\]\\{y\\}\\|\\^\\$\\\\", StringUtils.escapeRegex("[x]{y}|^$\\"));
        assertEquals("plain", StringUtils.escapeRegex("plain"));
        assertNull(StringUtils.escapeRegex(null));
    }

    @Test
    void testGuid() {
        String a = StringUtils.createGuid();
        String b = StringUtils.createGuid();
        assertEquals(32, a.length());
        assertTrue(a.matches("[0-9a-f]+"));
        assertNotEquals(a, b);
    }

    @Test
    void testTrimAndJoin() {
        assertNull(StringUtils.trimToNull("   "));
        assertEquals("x", StringUtils.trimToNull(" x "));
        assertEquals("", StringUtils.trimToEmpty(null));
        assertEquals("a, b", StringUtils.join(List.of("a", "b"), ", "));
        assertEquals("abc ...", StringUtils.truncate("abcdef", 3, true));
    }

}
