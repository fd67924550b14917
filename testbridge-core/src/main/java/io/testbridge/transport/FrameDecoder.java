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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Splits a byte stream into NUL-terminated UTF-8 frames. Bytes are buffered
 * until the terminator arrives, so a multi-byte character split across two
 * reads is decoded intact.
 * <p>
 * Not thread-safe: one decoder per reading thread.
 */
public class FrameDecoder {

    public static final byte TERMINATOR = 0;

    private byte[] pending = new byte[1024];
    private int pendingLength;

    /**
     * Append a chunk and return every frame it completes, in order. A trailing
     * partial frame stays buffered for the next call.
     */
    public List<String> feed(byte[] bytes, int offset, int length) {
        List<String> frames = null;
        int start = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (bytes[i] != TERMINATOR) {
                continue;
            }
            append(bytes, start, i - start);
            if (frames == null) {
                frames = new ArrayList<>();
            }
            frames.add(new String(pending, 0, pendingLength, StandardCharsets.UTF_8));
            pendingLength = 0;
            start = i + 1;
        }
        append(bytes, start, end - start);
        return frames == null ? Collections.emptyList() : frames;
    }

    public List<String> feed(byte[] bytes) {
        return feed(bytes, 0, bytes.length);
    }

    public int getPendingLength() {
        return pendingLength;
    }

    public static byte[] encode(String frame) {
        byte[] text = frame.getBytes(StandardCharsets.UTF_8);
        byte[] result = Arrays.copyOf(text, text.length + 1);
        result[text.length] = TERMINATOR;
        return result;
    }

    private void append(byte[] bytes, int offset, int length) {
        if (length <= 0) {
            return;
        }
        int required = pendingLength + length;
        if (required > pending.length) {
            pending = Arrays.copyOf(pending, Math.max(required, pending.length * 2));
        }
        System.arraycopy(bytes, offset, pending, pendingLength, length);
        pendingLength = required;
    }

}
