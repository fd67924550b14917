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
package io.testbridge.host;

import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestError;
import io.testbridge.tree.TestItem;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

class RecordingView implements TestRunView {

    final List<String> events = new CopyOnWriteArrayList<>();
    final List<TestMessage> messages = new CopyOnWriteArrayList<>();
    final StringBuffer output = new StringBuffer();
    final CountDownLatch ended = new CountDownLatch(1);
    volatile RunOutcome outcome;

    @Override
    public void enqueued(TestItem item) {
        events.add("enqueued:" + item.getLabel());
    }

    @Override
    public void started(TestItem item) {
        events.add("started:" + item.getLabel());
    }

    @Override
    public void passed(TestItem item, long duration) {
        events.add("passed:" + item.getLabel());
    }

    @Override
    public void failed(TestItem item, List<TestMessage> messages, long duration) {
        events.add("failed:" + item.getLabel());
        this.messages.addAll(messages);
    }

    @Override
    public void skipped(TestItem item) {
        events.add("skipped:" + item.getLabel());
    }

    @Override
    public void appendOutput(String text) {
        output.append(text);
    }

    @Override
    public void appendError(TestError error) {
        events.add("error:" + error.summary());
    }

    @Override
    public void end(RunOutcome outcome) {
        this.outcome = outcome;
        events.add("end:" + outcome);
        ended.countDown();
    }

}
