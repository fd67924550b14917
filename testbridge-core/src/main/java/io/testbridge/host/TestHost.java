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

import io.testbridge.common.CancellationToken;
import io.testbridge.common.PathUtils;
import io.testbridge.model.TestModel;
import io.testbridge.model.TestProject;
import io.testbridge.model.WorkspaceChange;
import io.testbridge.process.EnvironmentException;
import io.testbridge.process.RunOptions;
import io.testbridge.process.RunnerCache;
import io.testbridge.process.RunnerInfo;
import io.testbridge.process.RunnerLocator;
import io.testbridge.process.TestConfig;
import io.testbridge.process.TestRunner;
import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestError;
import io.testbridge.tree.TestItem;
import io.testbridge.tree.TestTree;
import io.testbridge.tree.TreeDelta;
import io.testbridge.tree.TreeReconciler;
import io.testbridge.watch.FileSystemWatcher;
import io.testbridge.watch.Watch;
import io.testbridge.watch.WatchSupport;
import io.testbridge.watch.WorkspaceObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Composition root: discovers configs, keeps one {@link TestModel} per config,
 * projects them onto the {@link TestTree} and runs tests one run at a time.
 * <p>
 * All model and tree mutation happens on a single event loop thread. The
 * blocking operations below hop onto the loop and wait; run operations
 * return at once with a future.
 */
public class TestHost implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TestHost.class);

    private final List<String> workspaceFolders = new ArrayList<>();
    private final BridgeSettings settings;
    private final RunnerCache cache;
    private final RunnerLocator locator;
    private final TestRunner runner;
    private final ConfigLocator configLocator;
    private final ExecutorService loop;
    private volatile Thread loopThread;

    private final TestTree tree;
    private final TreeReconciler reconciler;
    private final WatchSupport watchSupport;
    private final WorkspaceObserver observer;
    private final List<TestModel> models = new ArrayList<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<TreeDelta>>> treeListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean runActive = new AtomicBoolean(false);
    private volatile TestRunView watchRunView = new TestRunView() {
    };
    private FileSystemWatcher fileSystemWatcher;

    public TestHost(List<String> workspaceFolders, BridgeSettings settings) {
        this(workspaceFolders, settings, new RunnerCache(), null, settings.createBridge());
    }

    /**
     * @param locator null for one built from the settings
     */
    public TestHost(List<String> workspaceFolders, BridgeSettings settings, RunnerCache cache,
                    RunnerLocator locator, TestRunner runner) {
        for (String folder : workspaceFolders) {
            this.workspaceFolders.add(PathUtils.canonicalize(folder));
        }
        this.settings = settings;
        this.cache = cache;
        this.locator = locator != null ? locator : settings.createLocator(cache);
        this.runner = runner;
        this.configLocator = new ConfigLocator(settings.getConfigFileNames(), settings.getIgnoredSegments());
        this.loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "testbridge-host");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        this.tree = new TestTree(this.workspaceFolders);
        this.reconciler = new TreeReconciler(tree);
        this.watchSupport = new WatchSupport(tree, this::onWatchesTriggered);
        this.observer = new WorkspaceObserver(change -> loop.execute(() -> workspaceChangedOnLoop(change)),
                settings.debounce(), settings.getIgnoredSegments());
    }

    // ========== Accessors ==========

    public TestTree getTree() {
        return tree;
    }

    public List<TestModel> getModels() {
        return onLoop(() -> List.copyOf(models));
    }

    public BridgeSettings getSettings() {
        return settings;
    }

    public RunnerCache getCache() {
        return cache;
    }

    /**
     * One-line warnings of the last rebuild: missing or incompatible runners,
     * configs the runner could not load.
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Feed file system events here; they reach the host batched.
     */
    public WorkspaceObserver getObserver() {
        return observer;
    }

    public WatchSupport getWatchSupport() {
        return watchSupport;
    }

    public void addTreeListener(Consumer<List<TreeDelta>> listener) {
        treeListeners.add(listener);
    }

    /**
     * View that receives the results of watch-triggered runs.
     */
    public void setWatchRunView(TestRunView view) {
        this.watchRunView = view;
    }

    public boolean isRunActive() {
        return runActive.get();
    }

    // ========== Discovery ==========

    /**
     * Start a new tree generation, rediscover configs, resolve their runners
     * and list their files. Items of the previous generation are pruned at
     * the end.
     *
     * @return the warnings raised along the way
     */
    public List<String> rebuild() {
        return onLoop(this::rebuildOnLoop);
    }

    private List<String> rebuildOnLoop() {
        warnings.clear();
        watchSupport.clear();
        tree.reset();
        models.clear();
        for (String folder : workspaceFolders) {
            for (String configFile : configLocator.find(Path.of(folder))) {
                RunnerInfo info;
                try {
                    info = locator.locate(folder, configFile, settings.getRunnerPath());
                } catch (EnvironmentException e) {
                    warn(configFile + ": " + e.getMessage());
                    continue;
                }
                TestModel model = new TestModel(new TestConfig(folder, configFile, info), runner);
                TestError error = model.listFiles();
                if (error != null) {
                    warn(configFile + ": " + error.summary());
                }
                models.add(model);
            }
        }
        List<TreeDelta> deltas = new ArrayList<>(reconciler.reconcileWorkspace(models));
        for (TestItem removed : tree.pruneStale()) {
            deltas.add(TreeDelta.removed(removed));
        }
        logger.debug("rebuilt {} config(s), {} tree change(s)", models.size(), deltas.size());
        fireTreeChanged(deltas);
        return List.copyOf(warnings);
    }

    private void warn(String message) {
        logger.warn(message);
        warnings.add(message);
    }

    /**
     * List the tests in the given files, in every model.
     *
     * @return errors the runner reported while listing
     */
    public List<TestError> listTests(Collection<String> files) {
        return onLoop(() -> listTestsOnLoop(files));
    }

    private List<TestError> listTestsOnLoop(Collection<String> files) {
        List<String> canonical = new ArrayList<>();
        for (String file : files) {
            canonical.add(PathUtils.canonicalize(file));
        }
        List<TestError> errors = new ArrayList<>();
        for (TestModel model : models) {
            errors.addAll(model.listTests(canonical));
        }
        fireTreeChanged(reconciler.reconcileWorkspace(models));
        return errors;
    }

    /**
     * Load the children of a lazily resolved item: the tests of a file, or of
     * every not yet loaded file beneath a folder.
     */
    public List<TestError> resolveChildren(TestItem item) {
        return onLoop(() -> {
            if (!tree.contains(item)) {
                return List.of();
            }
            if (item.getKind() == TestItem.Kind.FILE) {
                return listTestsOnLoop(List.of(item.getPath()));
            }
            Set<String> files = new LinkedHashSet<>();
            for (TestModel model : models) {
                for (String file : model.enabledFiles()) {
                    TestItem fileItem = tree.getForKey(file);
                    if (PathUtils.isStrictAncestor(item.getPath(), file) && (fileItem == null || !tree.isLoaded(fileItem))) {
                        files.add(file);
                    }
                }
            }
            return files.isEmpty() ? List.of() : listTestsOnLoop(files);
        });
    }

    public void setProjectEnabled(TestProject project, boolean enabled) {
        onLoop(() -> {
            project.getModel().setProjectEnabled(project, enabled);
            fireTreeChanged(reconciler.reconcileWorkspace(models));
            return null;
        });
    }

    // ========== Runs ==========

    /**
     * Run tests of the enabled projects.
     *
     * @param include items to run, null for everything
     * @throws RunInProgressException when another run is active
     */
    public CompletableFuture<RunOutcome> runTests(List<TestItem> include, TestRunView view, CancellationToken token) {
        return startRun(null, include, view, token, false);
    }

    public CompletableFuture<RunOutcome> runTests(List<TestProject> projects, List<TestItem> include,
                                                  TestRunView view, CancellationToken token) {
        return startRun(projects, include, view, token, false);
    }

    /**
     * @throws RunInProgressException when another run is active
     */
    public CompletableFuture<RunOutcome> debugTests(List<TestItem> include, TestRunView view, CancellationToken token) {
        return startRun(null, include, view, token, true);
    }

    private CompletableFuture<RunOutcome> startRun(List<TestProject> projects, List<TestItem> include,
                                                   TestRunView view, CancellationToken token, boolean debug) {
        if (!runActive.compareAndSet(false, true)) {
            throw new RunInProgressException();
        }
        CompletableFuture<RunOutcome> result = CompletableFuture
                .supplyAsync(() -> groupByModel(projects), loop)
                .thenCompose(byModel -> runModels(byModel, include, view, token, debug));
        return result.handleAsync((outcome, error) -> {
            runActive.set(false);
            if (error != null) {
                logger.error("test run failed: {}", error.getMessage(), error);
                outcome = RunOutcome.TERMINATED;
            }
            view.end(outcome);
            return outcome;
        }, loop);
    }

    private Map<TestModel, List<TestProject>> groupByModel(List<TestProject> projects) {
        Map<TestModel, List<TestProject>> result = new LinkedHashMap<>();
        if (projects == null) {
            for (TestModel model : models) {
                List<TestProject> enabled = model.enabledProjects();
                if (!enabled.isEmpty()) {
                    result.put(model, enabled);
                }
            }
            return result;
        }
        for (TestProject project : projects) {
            result.computeIfAbsent(project.getModel(), k -> new ArrayList<>()).add(project);
        }
        return result;
    }

    /**
     * Configs run one after the other.
     */
    private CompletableFuture<RunOutcome> runModels(Map<TestModel, List<TestProject>> byModel, List<TestItem> include,
                                                    TestRunView view, CancellationToken token, boolean debug) {
        CompletableFuture<RunOutcome> chain = CompletableFuture.completedFuture(RunOutcome.COMPLETED);
        for (Map.Entry<TestModel, List<TestProject>> entry : byModel.entrySet()) {
            chain = chain.thenComposeAsync(previous -> {
                if (token.isCancellationRequested()) {
                    return CompletableFuture.completedFuture(RunOutcome.CANCELED);
                }
                return runModel(entry.getKey(), entry.getValue(), include, view, token, debug)
                        .thenApply(outcome -> worst(previous, outcome));
            }, loop);
        }
        return chain;
    }

    private CompletableFuture<RunOutcome> runModel(TestModel model, List<TestProject> projects, List<TestItem> include,
                                                   TestRunView view, CancellationToken token, boolean debug) {
        RunTarget target = RunTarget.narrowDown(projects, include);
        if (target.locations() != null && target.locations().isEmpty()) {
            logger.debug("nothing selected in {}", model);
            return CompletableFuture.completedFuture(RunOutcome.COMPLETED);
        }
        TestRunRecorder recorder = new TestRunRecorder(tree, view, loop, begin -> {
            model.updateFromRunningProjects(begin.projects());
            fireTreeChanged(reconciler.reconcileWorkspace(models));
        });
        List<String> locations = target.locations() == null ? List.of() : target.locations();
        RunOptions options = settings.runOptions().withGrep(target.grep());
        return debug
                ? model.debugTests(target.projects(), locations, options, recorder, token)
                : model.runTests(target.projects(), locations, options, recorder, token);
    }

    private static RunOutcome worst(RunOutcome a, RunOutcome b) {
        if (a == RunOutcome.CANCELED || b == RunOutcome.CANCELED) {
            return RunOutcome.CANCELED;
        }
        if (a == RunOutcome.TERMINATED || b == RunOutcome.TERMINATED) {
            return RunOutcome.TERMINATED;
        }
        return RunOutcome.COMPLETED;
    }

    /**
     * Projects and command line locations selected by a set of items.
     *
     * @param locations null to run everything
     * @param grep      title of a single parametrized test, null otherwise
     */
    record RunTarget(List<TestProject> projects, List<String> locations, String grep) {

        static RunTarget narrowDown(List<TestProject> projects, List<TestItem> items) {
            if (items == null) {
                return new RunTarget(projects, null, null);
            }
            String grep = null;
            if (items.size() == 1) {
                TestItem test = items.get(0);
                if (test.getRange() != null && test.getParent() != null) {
                    int count = 0;
                    for (TestItem sibling : test.getParent().getChildren()) {
                        if (test.getRange().equals(sibling.getRange())) {
                            count++;
                        }
                    }
                    if (count > 1) {
                        grep = test.getLabel();
                    }
                }
            }
            Set<String> locations = new LinkedHashSet<>();
            Set<TestProject> selected = new LinkedHashSet<>();
            for (TestItem item : items) {
                String path = item.getPath();
                if (path == null) {
                    continue;
                }
                boolean found = false;
                for (TestProject project : projects) {
                    for (String file : project.getFiles().keySet()) {
                        if (PathUtils.isAncestorOrSelf(path, file)) {
                            selected.add(project);
                            found = true;
                            break;
                        }
                    }
                }
                if (found) {
                    String line = item.getRange() != null ? ":" + (item.getRange().startLine() + 1) : "";
                    locations.add(path + line);
                }
            }
            return new RunTarget(new ArrayList<>(selected), new ArrayList<>(locations), grep);
        }

    }

    // ========== Watches ==========

    /**
     * @param include items to watch, null for the project's whole test dir
     * @return the watch, or null when an existing one already covers it
     */
    public Watch addWatch(TestProject project, List<TestItem> include, CancellationToken token) {
        return onLoop(() -> watchSupport.addToWatch(project, include, token));
    }

    private void onWatchesTriggered(List<Watch> watches) {
        if (runActive.get()) {
            logger.debug("run in progress, ignoring {} triggered watch(es)", watches.size());
            return;
        }
        Set<TestProject> projects = new LinkedHashSet<>();
        Set<TestItem> include = new LinkedHashSet<>();
        for (Watch watch : watches) {
            projects.add(watch.getProject());
            include.addAll(watch.getInclude());
        }
        try {
            runTests(new ArrayList<>(projects), new ArrayList<>(include), watchRunView, CancellationToken.NONE);
        } catch (RunInProgressException e) {
            logger.debug("run in progress, ignoring triggered watches");
        }
    }

    /**
     * Watch the workspace folders with the platform file watcher and feed the
     * events to {@link #getObserver()}.
     */
    public void watchFileSystem() throws IOException {
        synchronized (this) {
            if (fileSystemWatcher == null) {
                fileSystemWatcher = new FileSystemWatcher(observer);
            }
        }
        List<Path> roots = new ArrayList<>();
        for (String folder : workspaceFolders) {
            roots.add(Path.of(folder));
        }
        fileSystemWatcher.watch(roots);
    }

    // ========== Changes ==========

    /**
     * Apply a batched change: config edits rebuild everything, other changes
     * update the models and the tree, then watches fire.
     */
    public void workspaceChanged(WorkspaceChange change) {
        onLoop(() -> {
            workspaceChangedOnLoop(change);
            return null;
        });
    }

    private void workspaceChangedOnLoop(WorkspaceChange change) {
        if (touchesConfig(change)) {
            for (String path : change.all()) {
                cache.invalidate(path);
            }
            rebuildOnLoop();
            return;
        }
        boolean updated = false;
        for (TestModel model : models) {
            updated |= model.workspaceChanged(change);
        }
        if (updated) {
            fireTreeChanged(reconciler.reconcileWorkspace(models));
        }
        watchSupport.workspaceChanged(change);
    }

    private boolean touchesConfig(WorkspaceChange change) {
        Set<String> names = new LinkedHashSet<>(settings.getConfigFileNames());
        for (String path : change.all()) {
            if (names.contains(PathUtils.fileName(path))) {
                return true;
            }
        }
        return false;
    }

    // ========== Loop ==========

    private void fireTreeChanged(List<TreeDelta> deltas) {
        if (deltas.isEmpty()) {
            return;
        }
        for (Consumer<List<TreeDelta>> listener : treeListeners) {
            try {
                listener.accept(deltas);
            } catch (Exception e) {
                logger.error("tree listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private <T> T onLoop(Callable<T> task) {
        if (Thread.currentThread() == loopThread) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new RuntimeException(e);
            }
        }
        try {
            return loop.submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException(e.getCause());
        }
    }

    @Override
    public void close() {
        observer.dispose();
        if (fileSystemWatcher != null) {
            fileSystemWatcher.close();
        }
        loop.shutdownNow();
    }

}
