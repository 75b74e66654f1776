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
package ru.nts.tools.blueprint.core.materialize;

import ru.nts.tools.blueprint.core.*;
import ru.nts.tools.blueprint.core.reconcile.ChangeKind;
import ru.nts.tools.blueprint.core.reconcile.DiskScanner;
import ru.nts.tools.blueprint.core.reconcile.DiskSnapshot;
import ru.nts.tools.blueprint.core.reconcile.PlannedChange;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationPlan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Транзакционный материализатор: применяет план сверки к диску.
 *
 * Порядок не зависит от порядка плана: сначала перемещения, затем создания и обновления,
 * затем удаления (директории в последнюю очередь, от глубоких к мелким и только пустые).
 * Каждый файл пишется через временный соседний файл с атомарной заменой.
 * Сбой одного пути записывается в результат и не прерывает остальные записи;
 * откат всей транзакции не выполняется.
 */
public class TransactionalMaterializer {

    private final EngineConfig config;
    private final PathSanitizer sanitizer;
    private final DiskScanner probe;

    public TransactionalMaterializer(EngineConfig config) {
        this.config = config;
        this.sanitizer = PathSanitizer.forConfig(config);
        this.probe = new DiskScanner(config.getProjectRoot(), 0);
    }

    /**
     * @throws BlueprintException CONFLICTS_PRESENT при политике ABORT и наличии конфликтов (до любой записи)
     */
    public MaterializationReport apply(ReconciliationPlan plan) {
        ConflictPolicy policy = config.getConflictPolicy();
        List<PlannedChange> conflicts = plan.ofKind(ChangeKind.CONFLICT);
        if (!conflicts.isEmpty() && policy == ConflictPolicy.ABORT) {
            String paths = conflicts.stream().map(PlannedChange::path).limit(10).collect(Collectors.joining(", "));
            throw new BlueprintException(BlueprintErrorCode.CONFLICTS_PRESENT, Map.of("count", conflicts.size(), "paths", paths));
        }

        boolean dryRun = config.isDryRun();
        Predicate<Path> keep = plannedDirectories(plan);
        List<WriteResult> results = new ArrayList<>();
        List<PlannedChange> writes = new ArrayList<>();
        List<PlannedChange> deletes = new ArrayList<>();

        for (PlannedChange change : plan.changes()) {
            switch (change.kind()) {
                case CREATE, UPDATE -> writes.add(change);
                case DELETE -> deletes.add(change);
                case CONFLICT -> {
                    if (policy == ConflictPolicy.FORCE) {
                        if (change.entry() != null) writes.add(change);
                        else deletes.add(change);
                    } else {
                        results.add(WriteResult.skipped(change.path(), change.directory(), "Conflict left untouched: " + change.reason(), dryRun));
                    }
                }
                default -> {
                }
            }
        }

        // 1. Перемещения
        for (PlannedChange move : plan.ofKind(ChangeKind.MOVE)) {
            results.add(dryRun ? simulated(move, WriteAction.MOVED) : move(move, keep));
        }

        // 2. Создания и обновления: директории от мелких к глубоким, затем файлы
        writes.sort(Comparator.comparing((PlannedChange c) -> !c.directory())
                .thenComparingInt(c -> depth(c.path()))
                .thenComparing(PlannedChange::path));
        List<PlannedChange> deferredDirectoryPermissions = new ArrayList<>();
        Map<String, Integer> directoryResults = new HashMap<>();
        for (PlannedChange change : writes) {
            WriteAction action = change.kind() == ChangeKind.CREATE || !change.present().exists() ? WriteAction.CREATED : WriteAction.UPDATED;
            if (dryRun) {
                results.add(simulated(change, action));
            } else if (change.directory()) {
                results.add(createDirectory(change, action));
                if (change.permission() != null) {
                    deferredDirectoryPermissions.add(change);
                    directoryResults.put(change.path(), results.size() - 1);
                }
            } else {
                results.add(write(change, action));
            }
        }
        // Права директорий применяются после записи содержимого (readonly-директория не должна мешать записи детей)
        for (PlannedChange dir : deferredDirectoryPermissions) {
            int index = directoryResults.get(dir.path());
            WriteResult r = results.get(index);
            if (r.success()) {
                results.set(index, applyPermission(r, sanitizer.getRoot().resolve(dir.path()), dir.permission()));
            }
        }

        // 3. Удаления: файлы, затем директории от глубоких к мелким
        deletes.sort(Comparator.comparing(PlannedChange::directory)
                .thenComparing(Comparator.comparingInt((PlannedChange c) -> depth(c.path())).reversed())
                .thenComparing(PlannedChange::path));
        for (PlannedChange change : deletes) {
            results.add(dryRun ? simulated(change, WriteAction.DELETED) : delete(change, keep));
        }

        MaterializationReport report = new MaterializationReport(results, dryRun);
        for (WriteResult failure : report.failures()) {
            EngineLog.error("Materialization failed for " + failure.path() + ": " + failure.message());
        }
        return report;
    }

    // ==================== Operations ====================

    private WriteResult move(PlannedChange move, Predicate<Path> keep) {
        Path origin = sanitizer.getRoot().resolve(move.origin());
        Path target;
        try {
            target = sanitizer.resolve(move.path());
        } catch (BlueprintException e) {
            return WriteResult.failed(move.path(), WriteAction.MOVED, move.origin(), false, e.getMessage());
        }
        String drift = verify(move.origin(), move.present());
        if (drift == null) drift = verify(move.path(), DiskSnapshot.absent(move.path()));
        if (drift != null) {
            return WriteResult.failed(move.path(), WriteAction.MOVED, move.origin(), false, drift);
        }
        try {
            FileUtils.safeMove(origin, target);
            FileUtils.deleteEmptyParents(origin, sanitizer.getRoot(), keep);
        } catch (IOException e) {
            return WriteResult.failed(move.path(), WriteAction.MOVED, move.origin(), false, "Move failed: " + e.getMessage());
        }
        WriteResult result = WriteResult.ok(move.path(), WriteAction.MOVED, move.origin(), false, move.intendedHash(),
                move.intended().size(), null, false);
        return move.permission() == null ? result : applyPermission(result, target, move.permission());
    }

    private WriteResult write(PlannedChange change, WriteAction action) {
        Path target;
        try {
            target = sanitizer.resolve(change.path());
        } catch (BlueprintException e) {
            return WriteResult.failed(change.path(), action, null, false, e.getMessage());
        }
        String drift = verify(change.path(), change.present());
        if (drift != null) {
            return WriteResult.failed(change.path(), action, null, false, drift);
        }
        if (change.intended() == null || change.intended().bytes() == null) {
            String reason = change.intended() == null ? "No content" : change.intended().failure();
            return WriteResult.failed(change.path(), action, null, false, reason);
        }
        try {
            FileUtils.safeWrite(target, change.intended().bytes());
        } catch (IOException e) {
            return WriteResult.failed(change.path(), action, null, false, "Write failed: " + e.getMessage());
        }
        WriteResult result = WriteResult.ok(change.path(), action, null, false, change.intendedHash(),
                change.intended().size(), null, false);
        return change.permission() == null ? result : applyPermission(result, target, change.permission());
    }

    private WriteResult createDirectory(PlannedChange change, WriteAction action) {
        try {
            Path target = sanitizer.resolve(change.path());
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(target)) {
                return WriteResult.failed(change.path(), action, null, true, "A file is in the way of the directory");
            }
            FileUtils.executeWithRetry(() -> Files.createDirectories(target));
        } catch (BlueprintException e) {
            return WriteResult.failed(change.path(), action, null, true, e.getMessage());
        } catch (IOException e) {
            return WriteResult.failed(change.path(), action, null, true, "Cannot create directory: " + e.getMessage());
        }
        return WriteResult.ok(change.path(), action, null, true, null, 0, null, false);
    }

    private WriteResult delete(PlannedChange change, Predicate<Path> keep) {
        Path target = sanitizer.getRoot().resolve(change.path()).normalize();
        if (!target.startsWith(sanitizer.getRoot()) || sanitizer.isProtected(change.path())) {
            return WriteResult.failed(change.path(), WriteAction.DELETED, null, change.directory(), "Refusing to delete outside of the project");
        }
        if (change.directory()) {
            try {
                if (!FileUtils.deleteDirectoryIfEmpty(target)) {
                    return WriteResult.ok(change.path(), WriteAction.DELETED, null, true, null, 0, null, false)
                            .withNote("Directory kept on disk: not empty");
                }
                FileUtils.deleteEmptyParents(target, sanitizer.getRoot(), keep);
            } catch (IOException e) {
                return WriteResult.failed(change.path(), WriteAction.DELETED, null, true, "Delete failed: " + e.getMessage());
            }
            return WriteResult.ok(change.path(), WriteAction.DELETED, null, true, null, 0, null, false);
        }

        if (!change.present().exists()) {
            return WriteResult.ok(change.path(), WriteAction.DELETED, null, false, null, 0, null, false)
                    .withNote("Already absent on disk");
        }
        String drift = verify(change.path(), change.present());
        if (drift != null) {
            return WriteResult.failed(change.path(), WriteAction.DELETED, null, false, drift);
        }
        try {
            FileUtils.safeDelete(target);
            FileUtils.deleteEmptyParents(target, sanitizer.getRoot(), keep);
        } catch (IOException e) {
            return WriteResult.failed(change.path(), WriteAction.DELETED, null, false, "Delete failed: " + e.getMessage());
        }
        return WriteResult.ok(change.path(), WriteAction.DELETED, null, false, null, 0, null, false);
    }

    private WriteResult simulated(PlannedChange change, WriteAction action) {
        return WriteResult.ok(change.path(), action, change.origin(), change.directory(),
                action == WriteAction.DELETED ? null : change.intendedHash(),
                action == WriteAction.DELETED || change.intended() == null ? 0 : change.intended().size(),
                change.permission(), true);
    }

    // ==================== Safety ====================

    /**
     * Сравнивает текущее состояние пути со снимком, снятым при планировании.
     *
     * @return описание расхождения или null
     */
    private String verify(String path, DiskSnapshot expected) {
        DiskSnapshot actual = probe.snapshot(path);
        if (expected == null || !expected.exists()) {
            return actual.exists()
                    ? BlueprintErrorCode.DISK_CHANGED.format(Map.of("expected", "absent", "actual", describe(actual), "path", path))
                    : null;
        }
        if (expected.directory()) {
            return null;
        }
        if (!actual.exists() || !Objects.equals(expected.hash(), actual.hash())) {
            return BlueprintErrorCode.DISK_CHANGED.format(Map.of("expected", describe(expected), "actual", describe(actual), "path", path));
        }
        return null;
    }

    private static String describe(DiskSnapshot s) {
        if (!s.exists()) return "absent";
        if (s.directory()) return "directory";
        return s.hash() == null ? "unreadable" : s.hash();
    }

    /**
     * Сбой применения прав понижается до предупреждения: содержимое уже записано.
     */
    private WriteResult applyPermission(WriteResult result, Path target, String octal) {
        try {
            Files.setPosixFilePermissions(target, PosixFilePermissions.fromString(toSymbolic(octal)));
            return new WriteResult(result.path(), result.action(), result.origin(), result.directory(), result.hash(),
                    result.bytesWritten(), octal, result.success(), result.severity(), result.message(), result.simulated());
        } catch (UnsupportedOperationException | IOException | IllegalArgumentException e) {
            EngineLog.warn("Cannot apply permission " + octal + " to " + result.path() + ": " + e.getMessage());
            return result.withWarning("Permission " + octal + " not applied: " + e.getMessage());
        }
    }

    static String toSymbolic(String octal) {
        StringBuilder sb = new StringBuilder(9);
        for (char c : octal.toCharArray()) {
            int v = c - '0';
            sb.append((v & 4) != 0 ? 'r' : '-').append((v & 2) != 0 ? 'w' : '-').append((v & 1) != 0 ? 'x' : '-');
        }
        return sb.toString();
    }

    /**
     * Директории, которые остаются в чертеже: подчистка пустых родителей на них останавливается.
     */
    private Predicate<Path> plannedDirectories(ReconciliationPlan plan) {
        Set<Path> planned = new HashSet<>();
        for (PlannedChange change : plan.changes()) {
            if (change.directory() && change.entry() != null) {
                planned.add(sanitizer.getRoot().resolve(change.path()).normalize());
            }
        }
        return planned::contains;
    }

    private static int depth(String path) {
        int depth = 1;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '/') depth++;
        }
        return depth;
    }
}
