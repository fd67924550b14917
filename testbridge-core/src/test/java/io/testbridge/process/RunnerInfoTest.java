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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunnerInfoTest {

    @Test
    void testParseVersion() {
        assertEquals("1.45.0", RunnerInfo.parseVersion("Version 1.45.0\n"));
        assertEquals("1.38", RunnerInfo.parseVersion("1.38"));
        assertEquals("1.50.1", RunnerInfo.parseVersion("Version 1.50.1-beta-1712345"));
        assertNull(RunnerInfo.parseVersion("command not found"));
        assertNull(RunnerInfo.parseVersion(null));
    }

    @Test
    void testCompareVersions() {
        assertEquals(0, RunnerInfo.compareVersions("1.38", "1.38.0"));
        assertTrue(RunnerInfo.compareVersions("1.9", "1.38") < 0);
        assertTrue(RunnerInfo.compareVersions("1.100.0", "1.38") > 0);
        assertTrue(RunnerInfo.compareVersions("2.0", "1.99.99") > 0);
    }

    @Test
    void testIsAtLeast() {
        assertTrue(new RunnerInfo(List.of("playwright"), "1.38.0").isAtLeast("1.38"));
        assertFalse(new RunnerInfo(List.of("playwright"), "1.37.1").isAtLeast("1.38"));
        assertFalse(new RunnerInfo(List.of("playwright"), null).isAtLeast("1.38"));
    }

}
