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
package ru.nts.tools.blueprint.core.parser;

import ru.nts.tools.blueprint.core.Diagnostic;
import ru.nts.tools.blueprint.core.Severity;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Результат структурной компиляции: AST, переменные, реестр команд и диагностики.
 */
public record CompileResult(BlueprintAst ast,
                            List<VariableDefinition> variables,
                            Map<Integer, CommandLine> commands,
                            List<Diagnostic> diagnostics,
                            int lineCount) {

    public CompileResult {
        variables = List.copyOf(variables);
        commands = Collections.unmodifiableMap(commands);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity().atLeast(Severity.ERROR));
    }

    public Optional<Diagnostic> firstFatal() {
        return diagnostics.stream().filter(Diagnostic::isFatal).findFirst();
    }
}
