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
import ru.nts.tools.blueprint.core.EngineLog;
import ru.nts.tools.blueprint.core.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Структурный компилятор: прогоняет классификатор и стек блоков по всему чертежу и строит AST.
 *
 * Ошибки разбора собираются как диагностики с номерами строк и не останавливают
 * компиляцию остальных участков. Переменные в AST не попадают: они глобальны и
 * возвращаются отдельным списком в порядке документа.
 */
public class StructuralCompiler {

    private final LineClassifier classifier;

    public StructuralCompiler(int tabWidth) {
        this.classifier = new LineClassifier(tabWidth);
    }

    public CompileResult compile(String text) {
        return new Session(text).run();
    }

    /**
     * Состояние одного прогона компиляции.
     */
    private final class Session {
        private final String[] lines;
        private final BlueprintAst ast = new BlueprintAst();
        private final BlockStack stack = new BlockStack();
        private final List<VariableDefinition> variables = new ArrayList<>();
        private final Map<Integer, CommandLine> commands = new LinkedHashMap<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        // Последняя строка-файл и ее родитель: строки глубже файла к нему не привязываются
        private ClassifiedLine lastFile;
        private int lastFileParent = -1;

        Session(String text) {
            String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
            if (normalized.endsWith("\n")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            this.lines = normalized.isEmpty() ? new String[0] : normalized.split("\n", -1);
        }

        CompileResult run() {
            for (int n = 0; n < lines.length; n++) {
                if (lines[n].indexOf('\0') >= 0) {
                    // NUL в тексте: передан бинарный файл, строки дальше не разбираются
                    report(n + 1, Severity.FATAL, "BINARY_BLUEPRINT", "Blueprint contains NUL characters; not a text file", "");
                    return new CompileResult(ast, variables, commands, diagnostics, lines.length);
                }
            }
            int i = 0;
            while (i < lines.length) {
                ClassifiedLine line = classifier.classify(i + 1, lines[i]);
                if (line.fault() != null) {
                    report(line.lineNumber(), line.fault().severity(), line.fault().code(), line.fault().message(), line.raw());
                }
                i = switch (line.kind()) {
                    case BLANK, COMMENT -> i + 1;
                    case VARIABLE -> {
                        variables.add(new VariableDefinition(line.lineNumber(), line.variable().name(),
                                line.variable().typeHint(), line.variable().value()));
                        yield i + 1;
                    }
                    case COMMAND -> handleCommand(line, i);
                    case LOGIC -> handleLogic(line, i);
                    case FORM -> handleForm(line, i);
                };
            }
            diagnostics.sort(Diagnostic.BY_LINE);
            if (EngineLog.isDebug()) {
                diagnostics.forEach(d -> EngineLog.debug("compile: " + d));
            }
            return new CompileResult(ast, variables, commands, diagnostics, lines.length);
        }

        // ==================== Commands ====================

        private int handleCommand(ClassifiedLine line, int index) {
            ClassifiedLine.CommandSpec spec = line.command();
            if (!LineClassifier.POST_RUN.equals(spec.directive())) {
                return index + 1;
            }
            int parent = align(line);
            List<Integer> anchored = new ArrayList<>();
            int next = index + 1;
            if (!spec.isBlockHeader()) {
                commands.put(line.lineNumber(), new CommandLine(line.lineNumber(), spec.text()));
                anchored.add(line.lineNumber());
            } else {
                next = blockEnd(index, line.indent());
                for (int j = index + 1; j < next; j++) {
                    String text = LineClassifier.clean(lines[j]).strip();
                    if (text.isEmpty() || text.startsWith("#") || text.startsWith("//")) continue;
                    commands.put(j + 1, new CommandLine(j + 1, LineClassifier.stripCommandPrefix(text)));
                    anchored.add(j + 1);
                }
                if (anchored.isEmpty()) {
                    report(line.lineNumber(), Severity.WARNING, "EMPTY_COMMAND_BLOCK", "'%% post-run' has no commands", line.raw());
                }
            }
            ast.add(parent, AstNode.Kind.COMMAND_ANCHOR, line, null, anchored);
            return next;
        }

        // ==================== Logic ====================

        private int handleLogic(ClassifiedLine line, int index) {
            LogicKeyword keyword = line.logic().keyword();
            if (keyword != null && keyword.isPureCloser()) {
                int parent = stack.closeBlock(keyword);
                if (parent < 0) {
                    report(line.lineNumber(), Severity.WARNING, "ORPHAN_CLOSER",
                            "'@" + line.logic().word() + "' has no open block and is ignored", line.raw());
                } else {
                    // Закрывающий узел остается в AST: он обрывает цепочку условий
                    ast.add(parent, AstNode.Kind.LOGIC, line, null, null);
                }
                lastFile = null;
                return index + 1;
            }

            int parent = align(line);
            if (keyword != null && keyword.isChainContinuation()) {
                AstNode previous = ast.lastChild(parent);
                boolean chained = previous != null && (previous.isLogic(LogicKeyword.IF) || previous.isLogic(LogicKeyword.ELIF));
                if (!chained) {
                    report(line.lineNumber(), Severity.ERROR, "ORPHAN_BRANCH",
                            "'@" + line.logic().word() + "' does not follow '@if' or '@elif'; the branch is ignored", line.raw());
                }
            }
            AstNode node = ast.add(parent, AstNode.Kind.LOGIC, line, null, null);
            stack.pushLogic(node.getId(), line.indent(), keyword);
            return index + 1;
        }

        // ==================== Forms ====================

        private int handleForm(ClassifiedLine line, int index) {
            ClassifiedLine.FormSpec form = line.form();
            if (form.path().isEmpty()) {
                return index + 1;
            }
            int parent = align(line);

            String content = form.payload();
            int next = index + 1;
            if (form.operator() == FormOperator.SEED || form.operator() == FormOperator.REWRITE) {
                content = null;
            } else if (form.blockQuote() != null) {
                next = quotedBlock(line, index);
                content = lastBlock;
            } else if (form.awaitsImplicitBlock()) {
                int end = blockEnd(index, line.indent());
                content = end > index + 1 ? dedent(index + 1, end) : "";
                next = end;
            }

            AstNode node = ast.add(parent, AstNode.Kind.FORM, line, content, null);
            if (form.directory()) {
                stack.pushDirectory(node.getId(), line.indent());
                lastFile = null;
            } else {
                lastFile = line;
                lastFileParent = parent;
            }
            return next;
        }

        private String lastBlock;

        /**
         * Блок в тройных кавычках: заканчивается строкой из тех же кавычек на отступе строки-формы или левее.
         */
        private int quotedBlock(ClassifiedLine line, int index) {
            String quote = line.form().blockQuote();
            int j = index + 1;
            while (j < lines.length) {
                String text = LineClassifier.clean(lines[j]).strip();
                if (text.equals(quote) && classifier.measureIndent(lines[j]) <= line.indent()) {
                    lastBlock = j > index + 1 ? dedent(index + 1, j) : "";
                    return j + 1;
                }
                j++;
            }
            report(line.lineNumber(), Severity.WARNING, "UNCLOSED_BLOCK",
                    "Block opened with " + quote + " is not closed; it runs to the end of the blueprint", line.raw());
            int end = lines.length;
            while (end > index + 1 && lines[end - 1].isBlank()) end--;
            lastBlock = end > index + 1 ? dedent(index + 1, end) : "";
            return lines.length;
        }

        /**
         * Конец неявного блока: строки глубже заголовка и пустые строки между ними.
         * Хвостовые пустые строки в блок не входят.
         */
        private int blockEnd(int headerIndex, int headerIndent) {
            int j = headerIndex + 1;
            int lastContent = headerIndex;
            while (j < lines.length) {
                if (lines[j].isBlank()) {
                    j++;
                    continue;
                }
                if (classifier.measureIndent(lines[j]) <= headerIndent) break;
                lastContent = j;
                j++;
            }
            return lastContent + 1;
        }

        /**
         * Снимает общий отступ со строк [from, to) и завершает текст переводом строки.
         */
        private String dedent(int from, int to) {
            int common = Integer.MAX_VALUE;
            for (int j = from; j < to; j++) {
                if (lines[j].isBlank()) continue;
                common = Math.min(common, classifier.measureIndent(lines[j]));
            }
            if (common == Integer.MAX_VALUE) common = 0;

            StringBuilder sb = new StringBuilder();
            for (int j = from; j < to; j++) {
                if (!lines[j].isBlank()) {
                    sb.append(stripVisualIndent(lines[j], common));
                }
                sb.append('\n');
            }
            return sb.toString();
        }

        private String stripVisualIndent(String raw, int width) {
            String line = LineClassifier.clean(raw);
            int consumed = 0;
            int i = 0;
            while (i < line.length() && consumed < width) {
                char c = line.charAt(i);
                if (c == ' ') {
                    consumed++;
                } else if (c == '\t') {
                    consumed = classifier.measureIndent(line.substring(0, i + 1));
                } else {
                    break;
                }
                i++;
            }
            // Таб, перескочивший границу общего отступа, оставляет остаток пробелами
            return " ".repeat(Math.max(0, consumed - width)) + line.substring(i);
        }

        // ==================== Helpers ====================

        private int align(ClassifiedLine line) {
            int parent = stack.alignFor(line);
            if (lastFile != null && line.indent() > lastFile.indent() && parent == lastFileParent) {
                report(line.lineNumber(), Severity.WARNING, "INDENT_UNDER_FILE",
                        "Line is indented under file '" + lastFile.form().path() + "'; files cannot contain entries, attached to its parent",
                        line.raw());
            }
            lastFile = null;
            return parent;
        }

        private void report(int line, Severity severity, String code, String message, String source) {
            diagnostics.add(new Diagnostic(line, severity, code, message, source));
        }
    }
}
