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

import io.testbridge.model.Entry;
import io.testbridge.model.TestFile;
import io.testbridge.reporter.BeginParams;
import io.testbridge.reporter.ErrorParams;
import io.testbridge.reporter.Location;
import io.testbridge.reporter.StepBeginParams;
import io.testbridge.reporter.StepEndParams;
import io.testbridge.reporter.TestBeginParams;
import io.testbridge.reporter.TestEndParams;
import io.testbridge.reporter.TestError;
import io.testbridge.reporter.TestListener;
import io.testbridge.tree.TestItem;
import io.testbridge.tree.TestTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Turns the run events of one run into {@link TestRunView} updates. Events
 * arrive on transport threads and are handed to the host event loop, which is
 * the only thread that reads the tree. Test and step state is keyed by id
 * because tests running in parallel interleave.
 */
public class TestRunRecorder implements TestListener {

    private static final Logger logger = LoggerFactory.getLogger(TestRunRecorder.class);

    /**
     * A step that is running, with the number of its active instances.
     */
    public static class StepState {

        private final Location location;
        private int activeCount;
        private long duration;

        StepState(Location location) {
            this.location = location;
        }

        public Location getLocation() {
            return location;
        }

        public int getActiveCount() {
            return activeCount;
        }

        public long getDuration() {
            return duration;
        }

    }

    private final TestTree tree;
    private final TestRunView view;
    private final Executor loop;
    private final Consumer<BeginParams> beginHandler;

    private final Map<String, TestItem> testItems = new HashMap<>();
    private final Set<TestItem> failures = new HashSet<>();
    private final Map<String, StepState> activeSteps = new LinkedHashMap<>();
    private final Map<String, StepState> completedSteps = new LinkedHashMap<>();
    private int passed;
    private int failed;
    private int skipped;

    /**
     * @param beginHandler merges what a run reports into the models and tree, runs on the loop
     */
    public TestRunRecorder(TestTree tree, TestRunView view, Executor loop, Consumer<BeginParams> beginHandler) {
        this.tree = tree;
        this.view = view;
        this.loop = loop;
        this.beginHandler = beginHandler;
    }

    @Override
    public void onBegin(BeginParams params) {
        loop.execute(() -> {
            beginHandler.accept(params);
            for (BeginParams.ProjectReport project : params.projects()) {
                for (TestFile file : project.files()) {
                    for (Entry test : file.tests()) {
                        TestItem item = itemFor(test.id(), test.title());
                        if (item != null) {
                            view.enqueued(item);
                        }
                    }
                }
            }
        });
    }

    @Override
    public void onTestBegin(TestBeginParams params) {
        loop.execute(() -> {
            TestItem item = itemFor(params.location(), params.title());
            if (item == null) {
                logger.debug("no tree item for test: {} {}", params.testId(), params.location());
                return;
            }
            testItems.put(params.testId(), item);
            view.started(item);
        });
    }

    @Override
    public void onTestEnd(TestEndParams params) {
        loop.execute(() -> {
            activeSteps.keySet().removeIf(key -> key.startsWith(params.testId() + "/"));
            TestItem item = testItems.remove(params.testId());
            if (item == null) {
                return;
            }
            if (params.ok()) {
                if (failures.contains(item)) {
                    return;
                }
                if (params.isSkipped()) {
                    skipped++;
                    view.skipped(item);
                } else {
                    passed++;
                    view.passed(item, params.duration());
                }
                return;
            }
            failed++;
            failures.add(item);
            List<TestMessage> messages = new ArrayList<>();
            for (TestError error : params.errors()) {
                messages.add(TestMessage.fromError(error, item.getPath()));
            }
            if (messages.isEmpty()) {
                messages.add(TestMessage.fromText("test " + params.status()));
            }
            view.failed(item, messages, params.duration());
        });
    }

    @Override
    public void onStepBegin(StepBeginParams params) {
        loop.execute(() -> {
            StepState step = activeSteps.computeIfAbsent(stepKey(params.testId(), params.stepId()),
                    k -> new StepState(params.location()));
            step.activeCount++;
        });
    }

    @Override
    public void onStepEnd(StepEndParams params) {
        loop.execute(() -> {
            String key = stepKey(params.testId(), params.stepId());
            StepState step = activeSteps.get(key);
            if (step == null) {
                return;
            }
            step.activeCount--;
            step.duration = params.duration();
            completedSteps.put(key, step);
            if (step.activeCount == 0) {
                activeSteps.remove(key);
            }
        });
    }

    @Override
    public void onError(ErrorParams params) {
        if (params.error() != null) {
            loop.execute(() -> view.appendError(params.error()));
        }
    }

    @Override
    public void onStdOut(String text) {
        loop.execute(() -> view.appendOutput(text));
    }

    @Override
    public void onStdErr(String text) {
        loop.execute(() -> view.appendOutput(text));
    }

    // ========== Lookup ==========

    private TestItem itemFor(Location location, String title) {
        return location == null ? null : itemFor(location.id(), title);
    }

    /**
     * The test item at a location. Tests generated on one line share it and
     * are told apart by title.
     */
    private TestItem itemFor(String location, String title) {
        TestItem fallback = null;
        for (TestItem item : tree.findForLocation(location)) {
            if (item.getKind() != TestItem.Kind.TEST) {
                continue;
            }
            if (title == null || title.equals(item.getLabel())) {
                return item;
            }
            if (fallback == null) {
                fallback = item;
            }
        }
        return fallback;
    }

    private static String stepKey(String testId, String stepId) {
        return testId + "/" + stepId;
    }

    // ========== State ==========

    public Map<String, StepState> getActiveSteps() {
        return Collections.unmodifiableMap(activeSteps);
    }

    public Map<String, StepState> getCompletedSteps() {
        return Collections.unmodifiableMap(completedSteps);
    }

    public int getPassed() {
        return passed;
    }

    public int getFailed() {
        return failed;
    }

    public int getSkipped() {
        return skipped;
    }

}
