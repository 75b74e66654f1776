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

import java.util.Comparator;

/**
 * Диагностическое сообщение, привязанное к строке blueprint.
 * Структурные и логические сбои не бросаются как исключения, а копятся в виде диагностик.
 *
 * @param line       номер строки (1-based), 0 если привязки к строке нет
 * @param severity   серьезность
 * @param code       машинный код (PATH_COLLISION, ORPHAN_ELIF, ...)
 * @param message    человекочитаемое описание
 * @param sourceText исходный текст строки (может быть null)
 */
public record Diagnostic(int line, Severity severity, String code, String message, String sourceText) {

    public static final Comparator<Diagnostic> BY_LINE = Comparator.comparingInt(Diagnostic::line);

    public static Diagnostic warning(int line, String code, String message, String sourceText) {
        return new Diagnostic(line, Severity.WARNING, code, message, sourceText);
    }

    public static Diagnostic error(int line, String code, String message, String sourceText) {
        return new Diagnostic(line, Severity.ERROR, code, message, sourceText);
    }

    public static Diagnostic fatal(int line, String code, String message, String sourceText) {
        return new Diagnostic(line, Severity.FATAL, code, message, sourceText);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    @Override
    public String toString() {
        return String.format("L%03d %s [%s] %s", line, severity, code, message);
    }
}
