/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.blueprint.core;

import ru.nts.tools.blueprint.core.materialize.ConflictPolicy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Неизменяемая конфигурация движка.
 *
 * Значения по умолчанию подходят для большинства запусков; {@link #fromEnvironment()}
 * переопределяет их из переменных окружения (PROJECT_ROOT, BLUEPRINT_WORKERS,
 * BLUEPRINT_SECONDARY_STORE, BLUEPRINT_DRY_RUN). Каждый with-метод возвращает копию.
 */
public final class EngineConfig {

    public static final String DEFAULT_CHRONICLE_FILE = "scaffold.lock";
    public static final String DEFAULT_STATE_DIR = ".scaffold";
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final int DEFAULT_RECURSION_LIMIT = 100;
    public static final long DEFAULT_MAX_SNAPSHOT_TEXT = 64 * 1024;

    private final Path projectRoot;
    private final String chronicleFileName;
    private final String stateDirName;
    private final boolean secondaryStoreEnabled;
    private final int workers;
    private final int tabWidth;
    private final int recursionLimit;
    private final long maxSnapshotTextBytes;
    private final Severity commitThreshold;
    private final ConflictPolicy conflictPolicy;
    private final boolean dryRun;
    private final String virtualRoot;
    private final Map<String, String> variableOverrides;

    private EngineConfig(Path projectRoot, String chronicleFileName, String stateDirName,
                         boolean secondaryStoreEnabled, int workers, int tabWidth, int recursionLimit,
                         long maxSnapshotTextBytes, Severity commitThreshold, ConflictPolicy conflictPolicy,
                         boolean dryRun, String virtualRoot, Map<String, String> variableOverrides) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.chronicleFileName = chronicleFileName;
        this.stateDirName = stateDirName;
        this.secondaryStoreEnabled = secondaryStoreEnabled;
        this.workers = Math.max(1, workers);
        this.tabWidth = Math.max(1, tabWidth);
        this.recursionLimit = recursionLimit;
        this.maxSnapshotTextBytes = maxSnapshotTextBytes;
        this.commitThreshold = commitThreshold;
        this.conflictPolicy = conflictPolicy;
        this.dryRun = dryRun;
        this.virtualRoot = normalizeVirtualRoot(virtualRoot);
        this.variableOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(variableOverrides));
    }

    /**
     * Конфигурация по умолчанию для указанного корня проекта.
     */
    public static EngineConfig forRoot(Path projectRoot) {
        return new EngineConfig(projectRoot, DEFAULT_CHRONICLE_FILE, DEFAULT_STATE_DIR, true,
                Math.max(2, Runtime.getRuntime().availableProcessors()), DEFAULT_TAB_WIDTH,
                DEFAULT_RECURSION_LIMIT, DEFAULT_MAX_SNAPSHOT_TEXT, Severity.ERROR, ConflictPolicy.ABORT,
                false, null, Map.of());
    }

    /**
     * Читает конфигурацию из окружения. Корень берется из PROJECT_ROOT, иначе текущая директория.
     */
    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static EngineConfig fromEnvironment(Map<String, String> env) {
        String root = env.get("PROJECT_ROOT");
        EngineConfig config = forRoot(root != null && !root.isBlank() ? Paths.get(root) : Paths.get("."));

        String workers = env.get("BLUEPRINT_WORKERS");
        if (workers != null && !workers.isBlank()) {
            try {
                config = config.withWorkers(Integer.parseInt(workers.trim()));
            } catch (NumberFormatException e) {
                EngineLog.warn("Ignoring BLUEPRINT_WORKERS='" + workers + "': not a number");
            }
        }
        String secondary = env.get("BLUEPRINT_SECONDARY_STORE");
        if (secondary != null && !secondary.isBlank()) {
            config = config.withSecondaryStore(Boolean.parseBoolean(secondary.trim()));
        }
        String dryRun = env.get("BLUEPRINT_DRY_RUN");
        if (dryRun != null && !dryRun.isBlank()) {
            config = config.withDryRun(Boolean.parseBoolean(dryRun.trim()));
        }
        return config;
    }

    private static String normalizeVirtualRoot(String prefix) {
        if (prefix == null) return null;
        String clean = prefix.replace('\\', '/').trim();
        while (clean.startsWith("./")) clean = clean.substring(2);
        while (clean.endsWith("/")) clean = clean.substring(0, clean.length() - 1);
        return clean.isEmpty() ? null : clean;
    }

    // ==================== Accessors ====================

    public Path getProjectRoot() {
        return projectRoot;
    }

    public String getChronicleFileName() {
        return chronicleFileName;
    }

    public Path getChroniclePath() {
        return projectRoot.resolve(chronicleFileName);
    }

    public String getStateDirName() {
        return stateDirName;
    }

    public Path getStateDir() {
        return projectRoot.resolve(stateDirName);
    }

    public boolean isSecondaryStoreEnabled() {
        return secondaryStoreEnabled;
    }

    public int getWorkers() {
        return workers;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    public int getRecursionLimit() {
        return recursionLimit;
    }

    public long getMaxSnapshotTextBytes() {
        return maxSnapshotTextBytes;
    }

    public Severity getCommitThreshold() {
        return commitThreshold;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Виртуальный префикс корня ("app" для blueprint, начинающегося с "app/") или null.
     */
    public String getVirtualRoot() {
        return virtualRoot;
    }

    public Map<String, String> getVariableOverrides() {
        return variableOverrides;
    }

    // ==================== Copies ====================

    public EngineConfig withProjectRoot(Path root) {
        return new EngineConfig(root, chronicleFileName, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, dryRun, virtualRoot, variableOverrides);
    }

    public EngineConfig withChronicleFileName(String name) {
        return new EngineConfig(projectRoot, name, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, dryRun, virtualRoot, variableOverrides);
    }

    public EngineConfig withSecondaryStore(boolean enabled) {
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, enabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, dryRun, virtualRoot, variableOverrides);
    }

    public EngineConfig withWorkers(int count) {
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, secondaryStoreEnabled, count, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, dryRun, virtualRoot, variableOverrides);
    }

    public EngineConfig withRecursionLimit(int limit) {
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                limit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, dryRun, virtualRoot, variableOverrides);
    }

    public EngineConfig withCommitThreshold(Severity threshold) {
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, threshold, conflictPolicy, dryRun, virtualRoot, variableOverrides);
    }

    public EngineConfig withConflictPolicy(ConflictPolicy policy) {
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, policy, dryRun, virtualRoot, variableOverrides);
    }

    public EngineConfig withDryRun(boolean simulate) {
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, simulate, virtualRoot, variableOverrides);
    }

    public EngineConfig withVirtualRoot(String prefix) {
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, dryRun, prefix, variableOverrides);
    }

    public EngineConfig withVariable(String name, String value) {
        Map<String, String> vars = new LinkedHashMap<>(variableOverrides);
        vars.put(name, value);
        return new EngineConfig(projectRoot, chronicleFileName, stateDirName, secondaryStoreEnabled, workers, tabWidth,
                recursionLimit, maxSnapshotTextBytes, commitThreshold, conflictPolicy, dryRun, virtualRoot, vars);
    }
}
