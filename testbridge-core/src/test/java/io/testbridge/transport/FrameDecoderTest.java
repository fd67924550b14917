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
package io.testbridge.transport;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameDecoderTest {

    @Test
    void testSingleFrame() {
        FrameDecoder decoder = new FrameDecoder();
        List<String> frames = decoder.feed(FrameDecoder.encode("{\"id\":1}"));
        assertEquals(List.of("{\"id\":1}"), frames);
        assertEquals(0, decoder.getPendingLength());
    }

    @Test
    void testPartialFrameIsBuffered() {
        FrameDecoder decoder = new FrameDecoder();
        byte[] bytes = "{\"a\":".getBytes(StandardCharsets.UTF_8);
        assertTrue(decoder.feed(bytes).isEmpty());
        assertEquals(bytes.length, decoder.getPendingLength());
        List<String> frames = decoder.feed(new byte[]{'1', '}', 0});
        assertEquals(List.of("{\"a\":1}"), frames);
    }

    @Test
    void testSeveralFramesInOneChunk() {
        FrameDecoder decoder = new FrameDecoder();
        byte[] bytes = "a\0b\0c".getBytes(StandardCharsets.UTF_8);
        assertEquals(List.of("a", "b"), decoder.feed(bytes));
        assertEquals(List.of("cd"), decoder.feed("d\0".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testEmptyFrame() {
        FrameDecoder decoder = new FrameDecoder();
        assertEquals(List.of(""), decoder.feed(new byte[]{0}));
    }

    @Test
    void testEverySplitPointYieldsSameFrames() {
        String first = "{\"method\":\"onBegin\",\"params\":{\"title\":\"café ✓\"}}";
        String second = "{\"method\":\"onEnd\",\"params\":{}}";
        byte[] a = FrameDecoder.encode(first);
        byte[] b = FrameDecoder.encode(second);
        byte[] all = new byte[a.length + b.length];
        System.arraycopy(a, 0, all, 0, a.length);
        System.arraycopy(b, 0, all, a.length, b.length);
        for (int split = 0; split <= all.length; split++) {
            FrameDecoder decoder = new FrameDecoder();
            List<String> frames = new ArrayList<>(decoder.feed(all, 0, split));
            frames.addAll(decoder.feed(all, split, all.length - split));
            assertEquals(List.of(first, second), frames, "split at " + split);
        }
    }

    @Test
    void testLargeFrameGrowsBuffer() {
        String big = "x".repeat(100_000);
        FrameDecoder decoder = new FrameDecoder();
        assertEquals(List.of(big), decoder.feed(FrameDecoder.encode(big)));
    }

}
