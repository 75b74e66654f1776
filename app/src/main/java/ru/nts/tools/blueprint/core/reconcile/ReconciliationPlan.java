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

import ru.nts.tools.blueprint.core.Diagnostic;
import ru.nts.tools.blueprint.core.chronicle.ChronicleManifest;

import java.util.*;
import java.util.stream.Collectors;

/**
 * План сверки: каждый путь из объединения Будущего и Прошлого ровно в одном множестве
 * (create, update, delete, move, conflict, unchanged). Перемещение покрывает оба своих пути.
 * План только для чтения и передается внешним потребителям без изменений.
 */
public final class ReconciliationPlan {

    private final List<PlannedChange> changes;
    private final Map<String, PlannedChange> byPath = new HashMap<>();
    private final Map<String, DiskSnapshot> snapshots;
    private final ChronicleManifest past;
    private final List<Diagnostic> diagnostics;

    public ReconciliationPlan(List<PlannedChange> changes, Map<String, DiskSnapshot> snapshots,
                              ChronicleManifest past, List<Diagnostic> diagnostics) {
        List<PlannedChange> sorted = new ArrayList<>(changes);
        sorted.sort(Comparator.comparing(PlannedChange::path));
        this.changes = List.copyOf(sorted);
        for (PlannedChange change : this.changes) {
            byPath.put(change.path(), change);
            if (change.origin() != null) byPath.put(change.origin(), change);
        }
        this.snapshots = Collections.unmodifiableMap(new TreeMap<>(snapshots));
        this.past = past;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<PlannedChange> changes() {
        return changes;
    }

    public List<PlannedChange> ofKind(ChangeKind kind) {
        return changes.stream().filter(c -> c.kind() == kind).collect(Collectors.toList());
    }

    public Set<String> paths(ChangeKind kind) {
        Set<String> paths = new TreeSet<>();
        for (PlannedChange c : changes) {
            if (c.kind() == kind) paths.add(c.path());
        }
        return paths;
    }

    /**
     * Количество изменений каждого вида (перемещение считается одним изменением).
     */
    public Map<ChangeKind, Integer> counts() {
        Map<ChangeKind, Integer> counts = new EnumMap<>(ChangeKind.class);
        for (ChangeKind kind : ChangeKind.values()) counts.put(kind, 0);
        for (PlannedChange c : changes) counts.merge(c.kind(), 1, Integer::sum);
        return counts;
    }

    public int count(ChangeKind kind) {
        return counts().get(kind);
    }

    /**
     * Решение для пути; для исходного пути перемещения возвращается само перемещение.
     */
    public Optional<PlannedChange> lookup(String path) {
        return Optional.ofNullable(byPath.get(path));
    }

    public boolean hasChanges() {
        return changes.stream().anyMatch(c -> c.kind() != ChangeKind.UNCHANGED);
    }

    public boolean hasConflicts() {
        return changes.stream().anyMatch(c -> c.kind() == ChangeKind.CONFLICT);
    }

    public DiskSnapshot snapshot(String path) {
        DiskSnapshot s = snapshots.get(path);
        return s == null ? DiskSnapshot.absent(path) : s;
    }

    public ChronicleManifest past() {
        return past;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "ReconciliationPlan" + counts();
    }
}
