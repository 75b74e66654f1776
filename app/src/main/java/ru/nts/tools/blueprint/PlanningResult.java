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
import ru.nts.tools.blueprint.core.logic.ResolutionResult;
import ru.nts.tools.blueprint.core.parser.CompileResult;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationPlan;

import java.util.List;

/**
 * Результат планирования: все стадии до материализации. Диск не менялся.
 *
 * @param compiled    результат структурной компиляции
 * @param resolution  результат логического разрешения
 * @param plan        план сверки
 * @param previous    хроника, с которой сравнивался план
 * @param diagnostics все диагностики стадий, по номеру строки
 */
public record PlanningResult(CompileResult compiled, ResolutionResult resolution, ReconciliationPlan plan,
                             Chronicle previous, List<Diagnostic> diagnostics) {

    public PlanningResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
