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
package io.testbridge.model;

import io.testbridge.common.CancellationToken;
import io.testbridge.common.PathUtils;
import io.testbridge.process.ListFilesReport;
import io.testbridge.process.RelatedFilesReport;
import io.testbridge.process.RunOptions;
import io.testbridge.process.TestConfig;
import io.testbridge.process.TestRunner;
import io.testbridge.reporter.BeginParams;
import io.testbridge.reporter.ErrorParams;
import io.testbridge.reporter.RunOutcome;
import io.testbridge.reporter.TestError;
import io.testbridge.reporter.TestListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Projects, files and entries of one config, as last reported by the runner.
 * <p>
 * Not thread-safe: the host confines every call to its event loop. Listing
 * calls block until the runner is done; run and debug calls return at once.
 */
public class TestModel {

    private static final Logger logger = LoggerFactory.getLogger(TestModel.class);

    private final TestConfig config;
    private final TestRunner runner;
    private final Map<String, TestProject> projects = new LinkedHashMap<>();

    public TestModel(TestConfig config, TestRunner runner) {
        this.config = config;
        this.runner = runner;
    }

    public TestConfig getConfig() {
        return config;
    }

    public Collection<TestProject> allProjects() {
        return Collections.unmodifiableCollection(projects.values());
    }

    public TestProject getProject(String name) {
        return projects.get(name);
    }

    public List<TestProject> enabledProjects() {
        List<TestProject> result = new ArrayList<>();
        for (TestProject project : projects.values()) {
            if (project.isEnabled()) {
                result.add(project);
            }
        }
        return result;
    }

    public void setProjectEnabled(TestProject project, boolean enabled) {
        project.setEnabled(enabled);
    }

    /**
     * Files of the enabled projects, each once.
     */
    public Set<String> enabledFiles() {
        Set<String> result = new LinkedHashSet<>();
        for (TestProject project : enabledProjects()) {
            result.addAll(project.files().keySet());
        }
        return result;
    }

    public Set<String> narrowDownFilesToEnabledProjects(Collection<String> files) {
        Set<String> result = new LinkedHashSet<>();
        for (TestProject project : enabledProjects()) {
            for (String file : files) {
                if (project.files().containsKey(file)) {
                    result.add(file);
                }
            }
        }
        return result;
    }

    public Set<String> testDirs() {
        Set<String> result = new LinkedHashSet<>();
        for (TestProject project : projects.values()) {
            if (project.getTestDir() != null) {
                result.add(project.getTestDir());
            }
        }
        return result;
    }

    // ========== Listing ==========

    /**
     * Refresh projects and their file lists. New files start unlisted, known
     * files keep their entries, vanished files and projects are dropped.
     *
     * @return the runner's error, or null
     */
    public TestError listFiles() {
        ListFilesReport report = runner.listFiles(config);
        if (report.error() != null) {
            logger.debug("list-files failed for {}: {}", config.configFile(), report.error().summary());
            return report.error();
        }
        Set<String> projectsToKeep = new LinkedHashSet<>();
        int ordinal = 0;
        for (ListFilesReport.ProjectFiles projectReport : report.projects()) {
            projectsToKeep.add(projectReport.name());
            TestProject project = projects.get(projectReport.name());
            if (project == null) {
                project = new TestProject(this, projectReport.name(), projectReport.testDir(), ordinal);
                projects.put(project.getName(), project);
            }
            project.setTestDir(projectReport.testDir());
            project.setOrdinal(ordinal++);
            updateProjectFiles(project, projectReport.files());
        }
        projects.keySet().removeIf(name -> !projectsToKeep.contains(name));
        if (!projects.isEmpty() && enabledProjects().isEmpty()) {
            projects.values().iterator().next().setEnabled(true);
        }
        return null;
    }

    private static void updateProjectFiles(TestProject project, List<String> reported) {
        Map<String, TestFile> files = project.files();
        Map<String, TestFile> ordered = new LinkedHashMap<>();
        for (String file : reported) {
            TestFile existing = files.get(file);
            ordered.put(file, existing != null ? existing : TestFile.unlisted(file));
        }
        files.clear();
        files.putAll(ordered);
    }

    /**
     * List the tests in the given files. Requested files the runner did not
     * return (they no longer contain tests, or failed to load) are cleared.
     *
     * @return errors reported while listing
     */
    public List<TestError> listTests(Collection<String> files) {
        ListCollector collector = new ListCollector();
        RunOutcome outcome = runner.listTests(config, new ArrayList<>(files), collector, CancellationToken.NONE).join();
        if (outcome != RunOutcome.COMPLETED) {
            logger.debug("listing {} ended with {}", files, outcome);
        }
        BeginParams begin = collector.begin;
        applyListing(begin == null ? List.of() : begin.projects(), files);
        return collector.errors;
    }

    private void applyListing(List<BeginParams.ProjectReport> reports, Collection<String> requestedFiles) {
        for (TestProject project : projects.values()) {
            Set<String> filesToClear = new LinkedHashSet<>(requestedFiles);
            for (BeginParams.ProjectReport report : reports) {
                if (!project.getName().equals(report.name())) {
                    continue;
                }
                for (TestFile file : report.files()) {
                    filesToClear.remove(file.path());
                    project.files().put(file.path(), file);
                }
            }
            for (String file : filesToClear) {
                if (project.files().containsKey(file)) {
                    project.files().put(file, TestFile.unlisted(file));
                }
            }
        }
    }

    /**
     * Merge what a run reported. Never removes anything: a run may cover only
     * part of a file. A file is replaced only while it has no listed tests.
     */
    public void updateFromRunningProjects(List<BeginParams.ProjectReport> reports) {
        for (BeginParams.ProjectReport report : reports) {
            TestProject project = projects.get(report.name());
            if (project == null) {
                continue;
            }
            for (TestFile file : report.files()) {
                if (file.tests().isEmpty()) {
                    continue;
                }
                TestFile existing = project.files().get(file.path());
                if (existing == null || existing.tests().isEmpty()) {
                    project.files().put(file.path(), file);
                }
            }
        }
    }

    /**
     * Created or deleted test files re-list the file set, changed ones re-list
     * their tests. Paths outside every test dir are ignored.
     *
     * @return true when anything was re-listed
     */
    public boolean workspaceChanged(WorkspaceChange change) {
        Set<String> testDirs = testDirs();
        List<String> created = filterToTestDirs(testDirs, change.created());
        List<String> changed = filterToTestDirs(testDirs, change.changed());
        List<String> deleted = filterToTestDirs(testDirs, change.deleted());
        boolean updated = false;
        if (!created.isEmpty() || !deleted.isEmpty()) {
            listFiles();
            updated = true;
        }
        if (!changed.isEmpty()) {
            listTests(changed);
            updated = true;
        }
        return updated;
    }

    private static List<String> filterToTestDirs(Set<String> testDirs, Set<String> files) {
        List<String> result = new ArrayList<>();
        for (String file : files) {
            for (String testDir : testDirs) {
                if (PathUtils.isStrictAncestor(testDir, file)) {
                    result.add(file);
                    break;
                }
            }
        }
        return result;
    }

    /**
     * Test files affected by changes to arbitrary source files.
     */
    public RelatedFilesReport findRelatedTestFiles(Collection<String> files) {
        return runner.findRelatedTestFiles(config, new ArrayList<>(files));
    }

    // ========== Runs ==========

    /**
     * @param locations files or {@code file:line}; empty runs everything in the projects
     */
    public CompletableFuture<RunOutcome> runTests(List<TestProject> projects, List<String> locations, RunOptions options,
                                                  TestListener listener, CancellationToken token) {
        return runner.runTests(config, locations, withProjects(projects, options), listener, token);
    }

    public CompletableFuture<RunOutcome> debugTests(List<TestProject> projects, List<String> locations, RunOptions options,
                                                    TestListener listener, CancellationToken token) {
        return runner.debugTests(config, locations, withProjects(projects, options), listener, token);
    }

    private static RunOptions withProjects(List<TestProject> projects, RunOptions options) {
        List<String> names = new ArrayList<>();
        for (TestProject project : projects) {
            names.add(project.getName());
        }
        return new RunOptions(names, options.grep(), options.headed(), options.workers(), options.trace());
    }

    @Override
    public String toString() {
        return config.configFile();
    }

    private static class ListCollector implements TestListener {

        volatile BeginParams begin;
        final List<TestError> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onBegin(BeginParams params) {
            begin = params;
        }

        @Override
        public void onError(ErrorParams params) {
            if (params.error() != null) {
                errors.add(params.error());
            }
        }

    }

}
