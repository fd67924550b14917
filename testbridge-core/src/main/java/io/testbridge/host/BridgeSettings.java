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

import io.testbridge.common.Json;
import io.testbridge.process.ProcessDebugLauncher;
import io.testbridge.process.RunOptions;
import io.testbridge.process.RunnerBridge;
import io.testbridge.process.RunnerCache;
import io.testbridge.process.RunnerLocator;
import io.testbridge.process.SideChannel;
import io.testbridge.process.VersionCheck;
import io.testbridge.watch.WorkspaceObserver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Host settings loaded from {@code testbridge.json} in the workspace root.
 * Every key is optional.
 * <p>
 * Example testbridge.json:
 * <pre>
 * {
 *   "runnerPath": "node_modules/.bin/playwright",
 *   "runnerName": "playwright",
 *   "reporterModule": "/opt/testbridge/reporter.js",
 *   "env": { "DEBUG": "pw:api" },
 *   "configFileNames": ["playwright.config.ts"],
 *   "ignoredSegments": ["node_modules", "test-results"],
 *   "debounceMillis": 50,
 *   "stopGracePeriodMillis": 30000,
 *   "sideChannel": "socket",
 *   "minimumRunnerVersion": "1.38",
 *   "workers": 2,
 *   "headed": false,
 *   "trace": "on",
 *   "logLevel": "debug"
 * }
 * </pre>
 */
public class BridgeSettings {

    public static final String FILE_NAME = "testbridge.json";

    private String runnerPath;
    private String runnerName = RunnerLocator.DEFAULT_RUNNER_NAME;
    private String reporterModule;
    private Map<String, String> env = new LinkedHashMap<>();
    private List<String> configFileNames = new ArrayList<>(ConfigLocator.DEFAULT_CONFIG_FILE_NAMES);
    private List<String> ignoredSegments = new ArrayList<>(WorkspaceObserver.DEFAULT_IGNORED_SEGMENTS);
    private long debounceMillis = WorkspaceObserver.DEFAULT_DEBOUNCE.toMillis();
    private long stopGracePeriodMillis = 30000;
    private SideChannel sideChannel = SideChannel.SOCKET;
    private String minimumRunnerVersion = RunnerLocator.DEFAULT_MINIMUM_VERSION;
    private Integer workers;
    private boolean headed;
    private String trace;
    private String logLevel;

    /**
     * Settings of a workspace folder: its {@code testbridge.json} when present,
     * defaults otherwise.
     *
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static BridgeSettings forWorkspace(Path workspaceFolder) {
        Path file = workspaceFolder.resolve(FILE_NAME);
        return Files.isRegularFile(file) ? load(file) : new BridgeSettings();
    }

    /**
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static BridgeSettings load(Path path) {
        try {
            String content = Files.readString(path);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load settings from: " + path, e);
        }
    }

    /**
     * @throws RuntimeException if the JSON is invalid
     */
    public static BridgeSettings parse(String json) {
        Map<String, Object> map = Json.parseObject(json);
        BridgeSettings settings = new BridgeSettings();
        if (map.containsKey("runnerPath")) {
            settings.setRunnerPath(Json.getString(map, "runnerPath"));
        }
        if (map.containsKey("runnerName")) {
            settings.setRunnerName(Json.getString(map, "runnerName"));
        }
        if (map.containsKey("reporterModule")) {
            settings.setReporterModule(Json.getString(map, "reporterModule"));
        }
        Map<String, Object> env = Json.getMap(map, "env");
        if (env != null) {
            Map<String, String> values = new LinkedHashMap<>();
            env.forEach((k, v) -> values.put(k, v == null ? null : v.toString()));
            settings.setEnv(values);
        }
        if (map.containsKey("configFileNames")) {
            settings.setConfigFileNames(Json.getStringList(map, "configFileNames"));
        }
        if (map.containsKey("ignoredSegments")) {
            settings.setIgnoredSegments(Json.getStringList(map, "ignoredSegments"));
        }
        settings.setDebounceMillis(Json.getLong(map, "debounceMillis", settings.debounceMillis));
        settings.setStopGracePeriodMillis(Json.getLong(map, "stopGracePeriodMillis", settings.stopGracePeriodMillis));
        if (map.containsKey("sideChannel")) {
            settings.setSideChannel(SideChannel.fromString(Json.getString(map, "sideChannel")));
        }
        if (map.containsKey("minimumRunnerVersion")) {
            settings.setMinimumRunnerVersion(Json.getString(map, "minimumRunnerVersion"));
        }
        if (map.get("workers") instanceof Number n) {
            settings.setWorkers(n.intValue());
        }
        settings.setHeaded(Json.getBoolean(map, "headed", false));
        if (map.containsKey("trace")) {
            settings.setTrace(Json.getString(map, "trace"));
        }
        if (map.containsKey("logLevel")) {
            settings.setLogLevel(Json.getString(map, "logLevel"));
        }
        return settings;
    }

    // ========== Factories ==========

    public RunnerLocator createLocator(RunnerCache cache) {
        return new RunnerLocator(cache, VersionCheck.PROCESS, runnerName, minimumRunnerVersion, System.getenv("PATH"));
    }

    public RunnerBridge createBridge() {
        return new RunnerBridge(new RunnerBridge.BridgeOptions(reporterModule, sideChannel, env,
                Duration.ofMillis(stopGracePeriodMillis), null, new ProcessDebugLauncher(), runnerName));
    }

    public RunOptions runOptions() {
        return new RunOptions(List.of(), null, headed, workers, trace);
    }

    public Duration debounce() {
        return Duration.ofMillis(debounceMillis);
    }

    // ========== Getters and setters ==========

    public String getRunnerPath() {
        return runnerPath;
    }

    public void setRunnerPath(String runnerPath) {
        this.runnerPath = runnerPath;
    }

    public String getRunnerName() {
        return runnerName;
    }

    public void setRunnerName(String runnerName) {
        this.runnerName = runnerName;
    }

    public String getReporterModule() {
        return reporterModule;
    }

    public void setReporterModule(String reporterModule) {
        this.reporterModule = reporterModule;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public void setEnv(Map<String, String> env) {
        this.env = env;
    }

    public List<String> getConfigFileNames() {
        return configFileNames;
    }

    public void setConfigFileNames(List<String> configFileNames) {
        this.configFileNames = configFileNames;
    }

    public List<String> getIgnoredSegments() {
        return ignoredSegments;
    }

    public void setIgnoredSegments(List<String> ignoredSegments) {
        this.ignoredSegments = ignoredSegments;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public void setDebounceMillis(long debounceMillis) {
        this.debounceMillis = debounceMillis;
    }

    public long getStopGracePeriodMillis() {
        return stopGracePeriodMillis;
    }

    public void setStopGracePeriodMillis(long stopGracePeriodMillis) {
        this.stopGracePeriodMillis = stopGracePeriodMillis;
    }

    public SideChannel getSideChannel() {
        return sideChannel;
    }

    public void setSideChannel(SideChannel sideChannel) {
        this.sideChannel = sideChannel;
    }

    public String getMinimumRunnerVersion() {
        return minimumRunnerVersion;
    }

    public void setMinimumRunnerVersion(String minimumRunnerVersion) {
        this.minimumRunnerVersion = minimumRunnerVersion;
    }

    public Integer getWorkers() {
        return workers;
    }

    public void setWorkers(Integer workers) {
        this.workers = workers;
    }

    public boolean isHeaded() {
        return headed;
    }

    public void setHeaded(boolean headed) {
        this.headed = headed;
    }

    public String getTrace() {
        return trace;
    }

    public void setTrace(String trace) {
        this.trace = trace;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

}
