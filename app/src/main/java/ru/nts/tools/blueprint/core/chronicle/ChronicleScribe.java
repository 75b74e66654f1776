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
package ru.nts.tools.blueprint.core.chronicle;

import ru.nts.tools.blueprint.core.EngineConfig;
import ru.nts.tools.blueprint.core.EngineLog;
import ru.nts.tools.blueprint.core.materialize.MaterializationReport;
import ru.nts.tools.blueprint.core.materialize.WriteAction;
import ru.nts.tools.blueprint.core.materialize.WriteResult;
import ru.nts.tools.blueprint.core.reconcile.ChangeKind;
import ru.nts.tools.blueprint.core.reconcile.PlannedChange;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationPlan;

import java.util.*;

/**
 * Летописец: сводит прежнюю историю, план и результаты записи в новую хронику и фиксирует ее.
 *
 * Правила сведения:
 * <ul>
 *   <li>исторические пути, которых не касался прогон, сохраняют запись;</li>
 *   <li>неизменные запланированные пути обновляются по плану;</li>
 *   <li>успешные создания, обновления и перемещения получают свежую запись;</li>
 *   <li>удаления и исходные пути перемещений убираются;</li>
 *   <li>сбойные и пропущенные пути сохраняют прежнюю запись.</li>
 * </ul>
 */
public class ChronicleScribe {

    private final EngineConfig config;
    private final ChronicleStore store;
    private final ChronicleSink sink;

    public ChronicleScribe(EngineConfig config, ChronicleStore store, ChronicleSink sink) {
        this.config = config;
        this.store = store;
        this.sink = sink == null ? ChronicleSink.NONE : sink;
    }

    /**
     * Фиксирует хронику, если ни один результат не достиг порога серьезности.
     */
    public CommitOutcome commit(ReconciliationPlan plan, MaterializationReport report, Chronicle previous, String blueprint) {
        if (report.simulated()) {
            return CommitOutcome.skipped(previous, List.of(), "Dry run: chronicle not committed");
        }
        List<WriteResult> blockers = report.blocking(config.getCommitThreshold());
        if (!blockers.isEmpty()) {
            String reason = blockers.size() + " result(s) at or above " + config.getCommitThreshold()
                    + ": chronicle not committed";
            EngineLog.warn(reason);
            return CommitOutcome.skipped(previous, blockers, reason);
        }

        ChronicleManifest manifest = federate(plan, report);
        Chronicle chronicle = Chronicle.sealed(Provenance.newRun(blueprint, countsOf(plan, report)), manifest);
        store.save(config.getChroniclePath(), chronicle);
        EngineLog.debug("Chronicle committed: " + manifest.size() + " path(s), run " + chronicle.provenance().runId());

        try {
            sink.record(chronicle, touched(report));
        } catch (Exception e) {
            EngineLog.warn("Secondary chronicle store failed: " + e.getMessage());
        }
        return CommitOutcome.committed(chronicle);
    }

    /**
     * Новый манифест по правилам сведения.
     */
    public ChronicleManifest federate(ReconciliationPlan plan, MaterializationReport report) {
        ChronicleManifest.Builder builder = plan.past().toBuilder();
        for (PlannedChange change : plan.changes()) {
            Optional<WriteResult> result = report.result(change.path());
            switch (change.kind()) {
                case UNCHANGED -> builder.put(change.path(), recordOf(change, change.permission()));
                case CREATE, UPDATE, CONFLICT -> result
                        .filter(r -> r.success() && r.action() != WriteAction.SKIPPED)
                        .ifPresent(r -> {
                            if (r.action() == WriteAction.DELETED) builder.remove(change.path());
                            else builder.put(change.path(), recordOf(change, r.permission()));
                        });
                case MOVE -> result
                        .filter(WriteResult::success)
                        .ifPresent(r -> {
                            builder.remove(change.origin());
                            builder.put(change.path(), recordOf(change, r.permission()));
                        });
                case DELETE -> result
                        .filter(WriteResult::success)
                        .ifPresent(r -> builder.remove(change.path()));
            }
        }
        return builder.build();
    }

    private static ManifestEntry recordOf(PlannedChange change, String appliedPermission) {
        if (change.directory()) {
            return ManifestEntry.directory(appliedPermission);
        }
        return ManifestEntry.file(change.intendedHash(), change.intended().size(), appliedPermission);
    }

    /**
     * Счетчики провенанса: по каждому виду действия записи (с нулями), конфликты и
     * неизмененные пути по плану, плюс число сбоев.
     */
    static Map<String, Integer> countsOf(ReconciliationPlan plan, MaterializationReport report) {
        Map<String, Integer> counts = new TreeMap<>();
        Map<WriteAction, Integer> written = report.counts();
        for (WriteAction action : WriteAction.values()) {
            counts.put(action.name().toLowerCase(Locale.ROOT), written.getOrDefault(action, 0));
        }
        counts.put("conflict", plan.count(ChangeKind.CONFLICT));
        counts.put("unchanged", plan.count(ChangeKind.UNCHANGED));
        counts.put("failed", report.failures().size());
        return counts;
    }

    private static List<String> touched(MaterializationReport report) {
        List<String> paths = new ArrayList<>();
        for (WriteResult r : report.results()) {
            if (r.success() && r.action() != WriteAction.SKIPPED) paths.add(r.path());
        }
        return paths;
    }
}
