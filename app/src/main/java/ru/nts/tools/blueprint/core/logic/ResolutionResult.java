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
package ru.nts.tools.blueprint.core.logic;

import ru.nts.tools.blueprint.core.Diagnostic;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Результат логического разрешения: запланированные записи и команды в порядке документа,
 * итоговые переменные, карта видимости строк и диагностики.
 */
public record ResolutionResult(List<PlannedEntry> entries,
                               List<ResolvedCommand> commands,
                               Map<String, Object> variables,
                               Map<Integer, Boolean> visibility,
                               List<Diagnostic> diagnostics) {

    public ResolutionResult {
        entries = List.copyOf(entries);
        commands = List.copyOf(commands);
        variables = Collections.unmodifiableMap(variables);
        visibility = Collections.unmodifiableMap(visibility);
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<PlannedEntry> entry(String path) {
        return entries.stream().filter(e -> e.path().equals(path)).findFirst();
    }

    /**
     * @return видимость строки; null, если строка не является структурной
     */
    public Boolean isVisible(int line) {
        return visibility.get(line);
    }
}
