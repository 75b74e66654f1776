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
package ru.nts.tools.blueprint.core.reconcile;

import ru.nts.tools.blueprint.core.*;
import ru.nts.tools.blueprint.core.chronicle.ChronicleManifest;
import ru.nts.tools.blueprint.core.chronicle.ManifestEntry;
import ru.nts.tools.blueprint.core.logic.LogicValues;
import ru.nts.tools.blueprint.core.logic.PlannedEntry;
import ru.nts.tools.blueprint.core.logic.ResolutionResult;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Оракул сверки: трехсторонне сравнивает Будущее (запланированные записи), Прошлое (манифест хроники)
 * и Настоящее (живой диск) и строит {@link ReconciliationPlan}.
 *
 * Снимок диска и вычисление итогового содержимого выполняются параллельно на ограниченном пуле.
 * Классификация и поиск перемещений однопоточные: им нужно знание обо всех путях сразу.
 * Планирование только читает диск и может быть прервано до материализации без очистки.
 */
public class ReconciliationOracle {

    /** Переменная чертежа, объявляющая префикс виртуального корня. */
    public static final String VIRTUAL_ROOT_VARIABLE = "virtual_root";

    private final EngineConfig config;
    private final PathSanitizer sanitizer;
    private final DiskScanner scanner;
    private final ContentResolver contentResolver;

    public ReconciliationOracle(EngineConfig config) {
        this.config = config;
        this.sanitizer = PathSanitizer.forConfig(config);
        this.scanner = new DiskScanner(config.getProjectRoot(), config.getMaxSnapshotTextBytes());
        this.contentResolver = new ContentResolver(sanitizer);
    }

    public ReconciliationPlan plan(ResolutionResult resolution, ChronicleManifest history) {
        String virtualRoot = virtualRoot(resolution);
        List<PlannedEntry> entries = stripVirtualRoot(resolution.entries(), virtualRoot);
        ChronicleManifest past = virtualRoot == null ? history : history.rekey(p -> strip(p, virtualRoot));

        Map<String, PlannedEntry> future = new LinkedHashMap<>();
        for (PlannedEntry entry : entries) future.put(entry.path(), entry);

        Set<String> universe = new TreeSet<>(future.keySet());
        universe.addAll(past.paths());

        Map<String, DiskSnapshot> snapshots;
        Map<String, IntendedContent> intended;
        ExecutorService pool = Executors.newFixedThreadPool(config.getWorkers());
        try {
            snapshots = scanner.scan(universe, pool);
            intended = contentResolver.resolveAll(entries, pool);
        } finally {
            pool.shutdownNow();
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<PlannedChange> changes = new ArrayList<>();
        for (String path : universe) {
            DiskSnapshot present = snapshots.getOrDefault(path, DiskSnapshot.absent(path));
            changes.add(classify(path, future.get(path), past.get(path), present, intended.get(path)));
        }

        changes = translocate(changes);
        changes = attachDiffs(changes);

        for (PlannedChange change : changes) {
            int line = change.entry() == null ? 0 : change.entry().line();
            if (change.kind() == ChangeKind.CONFLICT) {
                diagnostics.add(Diagnostic.warning(line, "CONFLICT", change.path() + ": " + change.reason(), ""));
            }
            if (change.intended() != null && change.intended().note() != null) {
                diagnostics.add(Diagnostic.warning(line, "TRANSCODED", change.intended().note(), ""));
            }
            if (change.present() != null && change.present().symlink()) {
                diagnostics.add(new Diagnostic(line, Severity.INFO, "SYMLINK", change.path() + " is a symbolic link; its target content is compared", ""));
            }
        }
        diagnostics.sort(Diagnostic.BY_LINE);

        ReconciliationPlan plan = new ReconciliationPlan(changes, snapshots, past, diagnostics);
        EngineLog.debug("Reconciliation: " + plan.counts());
        return plan;
    }

    // ==================== Classification ====================

    /**
     * Классификация одного пути. Директории сравниваются только по существованию.
     */
    PlannedChange classify(String path, PlannedEntry future, ManifestEntry past, DiskSnapshot present, IntendedContent intended) {
        if (present.exists() && !present.isReadable()) {
            return change(path, ChangeKind.CONFLICT, future, past, present, intended, "Unreadable on disk: " + present.error());
        }

        if (future != null && future.directory()) {
            if (!present.exists()) return change(path, ChangeKind.CREATE, future, past, present, intended, null);
            if (present.directory()) return permissionAware(path, future, past, present, intended);
            return change(path, ChangeKind.CONFLICT, future, past, present, intended, "A file is in the way of a planned directory");
        }

        if (future == null) {
            if (past == null) {
                return change(path, ChangeKind.UNCHANGED, null, null, present, null, null);
            }
            if (!present.exists()) {
                // Уже исчез с диска: удаление только убирает запись из хроники
                return change(path, ChangeKind.DELETE, null, past, present, null, "Already absent on disk");
            }
            if (past.directory()) {
                return present.directory()
                        ? change(path, ChangeKind.DELETE, null, past, present, null, null)
                        : change(path, ChangeKind.CONFLICT, null, past, present, null, "A tracked directory was replaced by a file");
            }
            if (present.directory()) {
                return change(path, ChangeKind.CONFLICT, null, past, present, null, "A tracked file was replaced by a directory");
            }
            return Objects.equals(present.hash(), past.hash())
                    ? change(path, ChangeKind.DELETE, null, past, present, null, null)
                    : change(path, ChangeKind.CONFLICT, null, past, present, null,
                    "Edited on disk after the last run and no longer in the blueprint");
        }

        // Запланированный файл
        if (intended == null || intended.isFailed()) {
            String reason = intended == null ? "Content could not be resolved" : intended.failure();
            return change(path, ChangeKind.CONFLICT, future, past, present, intended, reason);
        }
        if (present.exists() && present.directory()) {
            return change(path, ChangeKind.CONFLICT, future, past, present, intended, "A directory is in the way of a planned file");
        }
        if (!present.exists()) {
            return change(path, ChangeKind.CREATE, future, past, present, intended, null);
        }
        if (past == null || past.directory()) {
            // Неотслеживаемый файл уже на диске
            return intended.hash().equals(present.hash())
                    ? permissionAware(path, future, past, present, intended)
                    : change(path, ChangeKind.UPDATE, future, past, present, intended, "Untracked file will be overwritten");
        }
        if (Objects.equals(present.hash(), past.hash())) {
            return intended.hash().equals(past.hash())
                    ? permissionAware(path, future, past, present, intended)
                    : change(path, ChangeKind.UPDATE, future, past, present, intended, null);
        }
        if (intended.hash().equals(present.hash())) {
            // Диск и история разошлись, но чертеж уже совпадает с диском
            return change(path, ChangeKind.UNCHANGED, future, past, present, intended, "History refreshed from disk");
        }
        return change(path, ChangeKind.CONFLICT, future, past, present, intended,
                "Modified on disk since the last run (expected " + shortHash(past.hash()) + ", found " + shortHash(present.hash()) + ")");
    }

    /**
     * Содержимое совпадает; различие только в правах дает обновление.
     */
    private PlannedChange permissionAware(String path, PlannedEntry future, ManifestEntry past, DiskSnapshot present,
                                          IntendedContent intended) {
        String wanted = future.effectivePermission();
        if (wanted != null && present.permission() != null && !wanted.equals(present.permission())) {
            return change(path, ChangeKind.UPDATE, future, past, present, intended,
                    "Permission " + present.permission() + " -> " + wanted);
        }
        return change(path, ChangeKind.UNCHANGED, future, past, present, intended, null);
    }

    private static PlannedChange change(String path, ChangeKind kind, PlannedEntry future, ManifestEntry past,
                                        DiskSnapshot present, IntendedContent intended, String reason) {
        boolean directory = future != null ? future.directory() : past != null && past.directory();
        return new PlannedChange(path, kind, directory, null, future, intended, present, past, null, reason);
    }

    // ==================== Translocation ====================

    /**
     * Пары удаление + создание с одинаковым хешом содержимого превращаются в перемещение.
     * При нескольких кандидатах: явное семя, затем то же имя файла, затем самый длинный общий
     * родитель, затем лексикографический порядок. Каждое удаление участвует не более чем в одной паре.
     */
    List<PlannedChange> translocate(List<PlannedChange> changes) {
        Map<String, List<PlannedChange>> deletesByHash = new HashMap<>();
        for (PlannedChange c : changes) {
            if (c.kind() == ChangeKind.DELETE && !c.directory() && c.present().exists() && c.present().hash() != null) {
                deletesByHash.computeIfAbsent(c.present().hash(), h -> new ArrayList<>()).add(c);
            }
        }
        if (deletesByHash.isEmpty()) return changes;

        Map<String, PlannedChange> replaced = new LinkedHashMap<>();
        Set<String> consumed = new HashSet<>();
        for (PlannedChange create : changes) {
            if (create.kind() != ChangeKind.CREATE || create.directory()) continue;
            List<PlannedChange> candidates = new ArrayList<>();
            for (PlannedChange d : deletesByHash.getOrDefault(create.intendedHash(), List.of())) {
                if (!consumed.contains(d.path())) candidates.add(d);
            }
            if (candidates.isEmpty()) continue;

            PlannedChange origin = pickOrigin(create, candidates);
            consumed.add(origin.path());
            replaced.put(create.path(), new PlannedChange(create.path(), ChangeKind.MOVE, false, origin.path(),
                    create.entry(), create.intended(), origin.present(), origin.past(), null,
                    "Content identical to " + origin.path()));
        }

        List<PlannedChange> result = new ArrayList<>();
        for (PlannedChange c : changes) {
            if (consumed.contains(c.path()) && c.kind() == ChangeKind.DELETE) continue;
            result.add(replaced.getOrDefault(c.path(), c));
        }
        return result;
    }

    static PlannedChange pickOrigin(PlannedChange create, List<PlannedChange> candidates) {
        String seed = create.entry() == null ? null : create.entry().seed();
        if (seed != null) {
            for (PlannedChange c : candidates) {
                if (c.path().equals(seed)) return c;
            }
        }
        String name = fileName(create.path());
        Comparator<PlannedChange> order = Comparator
                .comparing((PlannedChange c) -> !fileName(c.path()).equals(name))
                .thenComparing(c -> -commonParentDepth(c.path(), create.path()))
                .thenComparing(PlannedChange::path);
        return candidates.stream().min(order).orElseThrow();
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    static int commonParentDepth(String a, String b) {
        String[] pa = a.split("/");
        String[] pb = b.split("/");
        int depth = 0;
        // Последний сегмент - имя файла, в общем родителе не учитывается
        while (depth < pa.length - 1 && depth < pb.length - 1 && pa[depth].equals(pb[depth])) depth++;
        return depth;
    }

    // ==================== Diffs ====================

    private List<PlannedChange> attachDiffs(List<PlannedChange> changes) {
        List<PlannedChange> result = new ArrayList<>(changes.size());
        for (PlannedChange c : changes) {
            boolean textual = (c.kind() == ChangeKind.UPDATE || c.kind() == ChangeKind.CONFLICT)
                    && c.beforeText() != null && c.afterText() != null;
            result.add(textual ? c.withDiff(DiffUtils.getUnifiedDiff(c.path(), c.beforeText(), c.afterText())) : c);
        }
        return result;
    }

    // ==================== Virtual root ====================

    private String virtualRoot(ResolutionResult resolution) {
        if (config.getVirtualRoot() != null) return config.getVirtualRoot();
        Object declared = resolution.variables().get(VIRTUAL_ROOT_VARIABLE);
        if (declared == null) return null;
        String normalized = PathSanitizer.normalize(LogicValues.asString(declared));
        return normalized.isEmpty() ? null : normalized;
    }

    private static List<PlannedEntry> stripVirtualRoot(List<PlannedEntry> entries, String virtualRoot) {
        if (virtualRoot == null) return entries;
        List<PlannedEntry> result = new ArrayList<>();
        for (PlannedEntry entry : entries) {
            String stripped = strip(entry.path(), virtualRoot);
            if (stripped == null) continue; // сама директория корня
            PlannedEntry rewritten = entry.withPath(stripped);
            if (entry.seed() != null && strip(entry.seed(), virtualRoot) != null) {
                rewritten = new PlannedEntry(rewritten.path(), rewritten.directory(), rewritten.content(),
                        strip(entry.seed(), virtualRoot), rewritten.permission(), rewritten.line(),
                        rewritten.mutation(), rewritten.replacement(), rewritten.base());
            }
            result.add(rewritten);
        }
        return result;
    }

    static String strip(String path, String virtualRoot) {
        if (path.equals(virtualRoot)) return null;
        return path.startsWith(virtualRoot + "/") ? path.substring(virtualRoot.length() + 1) : path;
    }

    private static String shortHash(String hash) {
        return hash == null ? "none" : hash.substring(0, Math.min(12, hash.length()));
    }
}
