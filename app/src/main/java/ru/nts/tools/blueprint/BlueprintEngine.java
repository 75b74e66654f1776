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

import ru.nts.tools.blueprint.core.*;
import ru.nts.tools.blueprint.core.chronicle.*;
import ru.nts.tools.blueprint.core.logic.LogicResolver;
import ru.nts.tools.blueprint.core.logic.ResolutionResult;
import ru.nts.tools.blueprint.core.materialize.ConflictPolicy;
import ru.nts.tools.blueprint.core.materialize.MaterializationReport;
import ru.nts.tools.blueprint.core.materialize.TransactionalMaterializer;
import ru.nts.tools.blueprint.core.parser.CompileResult;
import ru.nts.tools.blueprint.core.parser.StructuralCompiler;
import ru.nts.tools.blueprint.core.reconcile.ChangeKind;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationOracle;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationPlan;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Фасад движка: compile → plan → apply.
 *
 * Планирование только читает диск. Применение выполняется под блокировкой проекта
 * (кроме пробного прогона) и завершается фиксацией хроники.
 */
public class BlueprintEngine {

    private final EngineConfig config;
    private final ChronicleStore store = new ChronicleStore();

    public BlueprintEngine(EngineConfig config) {
        this.config = config;
    }

    // ==================== Compile ====================

    /**
     * Читает и компилирует blueprint-файл.
     *
     * @throws BlueprintException BLUEPRINT_NOT_FOUND, BLUEPRINT_NOT_READABLE, COMPILE_FAILED
     */
    public CompileResult compile(Path blueprint) {
        return compileText(read(blueprint));
    }

    /**
     * @throws BlueprintException COMPILE_FAILED при фатальной диагностике
     */
    public CompileResult compileText(String text) {
        CompileResult compiled = new StructuralCompiler(config.getTabWidth()).compile(text);
        compiled.firstFatal().ifPresent(d -> {
            throw new BlueprintException(BlueprintErrorCode.COMPILE_FAILED, Map.of("line", d.line(), "detail", d.message()));
        });
        return compiled;
    }

    private static String read(Path blueprint) {
        if (!Files.isRegularFile(blueprint)) {
            throw new BlueprintException(BlueprintErrorCode.BLUEPRINT_NOT_FOUND, "path", blueprint);
        }
        try {
            byte[] bytes = FileUtils.safeReadAllBytes(blueprint);
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BlueprintException(BlueprintErrorCode.BLUEPRINT_NOT_READABLE, Map.of("path", blueprint), e);
        } catch (IOException e) {
            throw new BlueprintException(BlueprintErrorCode.BLUEPRINT_NOT_READABLE, Map.of("path", blueprint), e);
        }
    }

    // ==================== Plan ====================

    public PlanningResult plan(Path blueprint) {
        return planText(read(blueprint));
    }

    /**
     * Полное планирование без записи на диск.
     */
    public PlanningResult planText(String text) {
        return plan(compileText(text), false);
    }

    private PlanningResult plan(CompileResult compiled, boolean quarantineCorrupted) {
        ResolutionResult resolution = new LogicResolver(config).resolve(compiled);
        ChronicleStore.LoadResult loaded = store.load(config.getChroniclePath(), quarantineCorrupted);
        ReconciliationPlan plan = new ReconciliationOracle(config).plan(resolution, loaded.chronicle().manifest());

        List<Diagnostic> diagnostics = new ArrayList<>(resolution.diagnostics());
        if (loaded.warning() != null) diagnostics.add(loaded.warning());
        for (Diagnostic d : plan.diagnostics()) {
            if (!diagnostics.contains(d)) diagnostics.add(d);
        }
        diagnostics.sort(Diagnostic.BY_LINE);
        for (Diagnostic d : diagnostics) {
            EngineLog.debug(d.toString());
        }
        return new PlanningResult(compiled, resolution, plan, loaded.chronicle(), diagnostics);
    }

    // ==================== Apply ====================

    public ApplyReport apply(Path blueprint) {
        return applyText(read(blueprint), blueprint.toString());
    }

    /**
     * Планирует и применяет blueprint.
     *
     * @param text      текст blueprint
     * @param blueprint имя blueprint для происхождения хроники (может быть null)
     * @throws BlueprintException PROJECT_LOCKED, если параллельный прогон держит блокировку
     */
    public ApplyReport applyText(String text, String blueprint) {
        CompileResult compiled = compileText(text);
        if (config.isDryRun()) {
            return execute(compiled, blueprint);
        }
        try (ProjectLock ignored = ProjectLock.acquire(config.getStateDir())) {
            return execute(compiled, blueprint);
        } catch (IOException e) {
            throw new BlueprintException(BlueprintErrorCode.IO_ERROR, Map.of("path", config.getStateDir()), e);
        }
    }

    private ApplyReport execute(CompileResult compiled, String blueprint) {
        PlanningResult planning = plan(compiled, !config.isDryRun());
        ReconciliationPlan plan = planning.plan();

        if (plan.hasConflicts() && config.getConflictPolicy() == ConflictPolicy.ABORT) {
            String reason = plan.count(ChangeKind.CONFLICT) + " conflict(s): nothing written";
            EngineLog.warn(reason);
            return new ApplyReport(plan, List.of(), ApplyReport.summarize(plan, null), false, false,
                    config.isDryRun(), reason, planning.previous(), planning.diagnostics(), planning.resolution().commands());
        }

        MaterializationReport report = new TransactionalMaterializer(config).apply(plan);
        CommitOutcome outcome;
        try (ChronicleSink sink = openSink()) {
            outcome = new ChronicleScribe(config, store, sink).commit(plan, report, planning.previous(), blueprint);
        }

        boolean unresolved = plan.hasConflicts() && config.getConflictPolicy() == ConflictPolicy.SKIP;
        boolean success = !report.hasFailures() && !unresolved && (outcome.committed() || report.simulated());
        return new ApplyReport(plan, report.results(), ApplyReport.summarize(plan, report), success,
                outcome.committed(), report.simulated(), null, outcome.chronicle(), planning.diagnostics(),
                planning.resolution().commands());
    }

    private ChronicleSink openSink() {
        if (!config.isSecondaryStoreEnabled() || config.isDryRun()) {
            return ChronicleSink.NONE;
        }
        return new H2ChronicleSink(new ChronicleDatabase(config.getStateDir()));
    }
}
