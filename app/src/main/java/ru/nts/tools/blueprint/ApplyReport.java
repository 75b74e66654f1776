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
package ru.nts.tools.blueprint;

import ru.nts.tools.blueprint.core.Diagnostic;
import ru.nts.tools.blueprint.core.chronicle.Chronicle;
import ru.nts.tools.blueprint.core.logic.ResolvedCommand;
import ru.nts.tools.blueprint.core.materialize.MaterializationReport;
import ru.nts.tools.blueprint.core.materialize.WriteAction;
import ru.nts.tools.blueprint.core.materialize.WriteResult;
import ru.nts.tools.blueprint.core.reconcile.ChangeKind;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationPlan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итог прогона для вызывающего инструментария.
 *
 * @param plan        план сверки
 * @param results     результаты записи по путям
 * @param summary     счетчики created/updated/deleted/moved/conflict/unchanged/failed
 * @param success     прогон завершен без сбоев и неразрешенных конфликтов
 * @param committed   хроника зафиксирована
 * @param simulated   пробный прогон
 * @param aborted     причина отказа до записи (конфликты при политике ABORT) или null
 * @param chronicle   зафиксированная хроника (или прежняя, если фиксации не было)
 * @param diagnostics диагностики всех стадий
 * @param commands    оркестрационные команды для внешнего исполнителя
 */
public record ApplyReport(ReconciliationPlan plan,
                          List<WriteResult> results,
                          Map<String, Integer> summary,
                          boolean success,
                          boolean committed,
                          boolean simulated,
                          String aborted,
                          Chronicle chronicle,
                          List<Diagnostic> diagnostics,
                          List<ResolvedCommand> commands) {

    public ApplyReport {
        results = List.copyOf(results);
        summary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
        diagnostics = List.copyOf(diagnostics);
        commands = List.copyOf(commands);
    }

    /**
     * Сводка по плану и результатам записи.
     * Конфликты и неизмененные пути считаются по плану, остальное по фактическим результатам.
     */
    static Map<String, Integer> summarize(ReconciliationPlan plan, MaterializationReport report) {
        Map<WriteAction, Integer> written = report == null ? Map.of() : report.counts();
        Map<String, Integer> summary = new LinkedHashMap<>();
        summary.put("created", written.getOrDefault(WriteAction.CREATED, 0));
        summary.put("updated", written.getOrDefault(WriteAction.UPDATED, 0));
        summary.put("deleted", written.getOrDefault(WriteAction.DELETED, 0));
        summary.put("moved", written.getOrDefault(WriteAction.MOVED, 0));
        summary.put("conflict", plan.count(ChangeKind.CONFLICT));
        summary.put("unchanged", plan.count(ChangeKind.UNCHANGED));
        summary.put("failed", report == null ? 0 : report.failures().size());
        return summary;
    }

    public int exitCode() {
        return success ? 0 : 1;
    }
}
