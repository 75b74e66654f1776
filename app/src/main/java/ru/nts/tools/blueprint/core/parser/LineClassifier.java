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

import ru.nts.tools.blueprint.core.Severity;
import ru.nts.tools.blueprint.core.parser.ClassifiedLine.CommandSpec;
import ru.nts.tools.blueprint.core.parser.ClassifiedLine.Fault;
import ru.nts.tools.blueprint.core.parser.ClassifiedLine.FormSpec;
import ru.nts.tools.blueprint.core.parser.ClassifiedLine.LogicSpec;
import ru.nts.tools.blueprint.core.parser.ClassifiedLine.VariableSpec;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Лексический классификатор: определяет вид одной строки чертежа и извлекает ее поля.
 *
 * Порядок распознавания (первое совпадение побеждает):
 * пустая строка, комментарий ({@code #}, {@code //}), команда ({@code %%}),
 * объявленная переменная ({@code $$}, let, def, const), логика ({@code @}),
 * голое присваивание {@code name = value}, иначе строка формы.
 *
 * Классификатор не хранит состояния между строками: многострочные блоки собирает
 * {@link StructuralCompiler}.
 */
public class LineClassifier {

    private static final Pattern DECLARED_VARIABLE = Pattern.compile(
            "^(?:\\$\\$\\s*|(?:let|def|const)\\s+)([A-Za-z_][A-Za-z0-9_]*)\\s*(?::\\s*([A-Za-z_][\\w\\[\\], ]*?))?\\s*=(?!=)\\s*(.*)$");

    private static final Pattern BARE_VARIABLE = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)\\s*(?::\\s*([A-Za-z_][\\w\\[\\]]*))?\\s*=(?!=)\\s*(.*)$");

    private static final Pattern LOGIC = Pattern.compile("^@\\s*([A-Za-z_]\\w*)\\s*(.*)$");

    private static final Pattern FOR_HEADER = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s+in\\s+(.+)$");

    private static final Pattern COMMAND = Pattern.compile("^%%\\s*([A-Za-z][\\w-]*)\\s*:?\\s*(.*)$");

    private static final Pattern OCTAL = Pattern.compile("^0?([0-7]{3})$");

    public static final String POST_RUN = "post-run";

    private final int tabWidth;

    public LineClassifier(int tabWidth) {
        this.tabWidth = Math.max(1, tabWidth);
    }

    /**
     * Классифицирует строку.
     *
     * @param lineNumber номер строки (с 1)
     * @param raw        исходный текст без перевода строки
     */
    public ClassifiedLine classify(int lineNumber, String raw) {
        int indent = measureIndent(raw);
        String text = clean(raw).strip();

        if (text.isEmpty()) {
            return new ClassifiedLine(lineNumber, raw, indent, LineKind.BLANK, null, null, null, null, null);
        }
        if (text.startsWith("#") || text.startsWith("//")) {
            return new ClassifiedLine(lineNumber, raw, indent, LineKind.COMMENT, null, null, null, null, null);
        }
        if (text.startsWith("%%")) {
            return classifyCommand(lineNumber, raw, indent, text);
        }
        Matcher declared = DECLARED_VARIABLE.matcher(text);
        if (declared.matches()) {
            return variable(lineNumber, raw, indent, declared);
        }
        if (text.startsWith("@")) {
            return classifyLogic(lineNumber, raw, indent, text);
        }
        Matcher bare = BARE_VARIABLE.matcher(text);
        if (bare.matches()) {
            return variable(lineNumber, raw, indent, bare);
        }
        return classifyForm(lineNumber, raw, indent, text);
    }

    /**
     * Визуальный отступ: пробел = 1, таб выравнивает до следующего кратного ширине табуляции.
     * BOM и символы нулевой ширины не учитываются.
     */
    public int measureIndent(String raw) {
        int width = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / tabWidth + 1) * tabWidth;
            } else if (isInvisible(c)) {
                continue;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Удаляет BOM и символы нулевой ширины.
     */
    public static String clean(String raw) {
        StringBuilder sb = null;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (isInvisible(c)) {
                if (sb == null) {
                    sb = new StringBuilder(raw.length());
                    sb.append(raw, 0, i);
                }
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? raw : sb.toString();
    }

    private static boolean isInvisible(char c) {
        return c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060';
    }

    // ==================== Commands ====================

    private ClassifiedLine classifyCommand(int lineNumber, String raw, int indent, String text) {
        Matcher m = COMMAND.matcher(text);
        if (!m.matches()) {
            return new ClassifiedLine(lineNumber, raw, indent, LineKind.COMMAND, null, null, null,
                    new CommandSpec("", null),
                    new Fault(Severity.WARNING, "UNKNOWN_DIRECTIVE", "Directive without a name is ignored"));
        }
        String directive = m.group(1).toLowerCase(Locale.ROOT);
        String body = m.group(2).strip();
        Fault fault = POST_RUN.equals(directive) ? null
                : new Fault(Severity.WARNING, "UNKNOWN_DIRECTIVE", "Directive '%%" + directive + "' is not supported and is ignored");
        return new ClassifiedLine(lineNumber, raw, indent, LineKind.COMMAND, null, null, null,
                new CommandSpec(directive, body.isEmpty() ? null : stripCommandPrefix(body)), fault);
    }

    /**
     * Убирает ведущий {@code >>} у строки команды.
     */
    public static String stripCommandPrefix(String command) {
        String c = command.strip();
        return c.startsWith(">>") ? c.substring(2).strip() : c;
    }

    // ==================== Variables ====================

    private ClassifiedLine variable(int lineNumber, String raw, int indent, Matcher m) {
        String hint = m.group(2) == null ? null : m.group(2).strip();
        return new ClassifiedLine(lineNumber, raw, indent, LineKind.VARIABLE, null, null,
                new VariableSpec(m.group(1), hint, m.group(3).strip()), null, null);
    }

    // ==================== Logic ====================

    private ClassifiedLine classifyLogic(int lineNumber, String raw, int indent, String text) {
        Matcher m = LOGIC.matcher(text);
        if (!m.matches()) {
            return new ClassifiedLine(lineNumber, raw, indent, LineKind.LOGIC, null,
                    new LogicSpec(null, "", null, null),
                    null, null, new Fault(Severity.ERROR, "UNKNOWN_DIRECTIVE", "Malformed logic directive"));
        }
        String word = m.group(1);
        LogicKeyword keyword = LogicKeyword.parse(word);
        String expression = m.group(2).strip();
        if (expression.endsWith(":")) {
            expression = expression.substring(0, expression.length() - 1).strip();
        }

        if (keyword == null) {
            return new ClassifiedLine(lineNumber, raw, indent, LineKind.LOGIC, null,
                    new LogicSpec(null, word, expression, null), null, null,
                    new Fault(Severity.ERROR, "UNKNOWN_DIRECTIVE", "Unknown logic directive '@" + word + "'"));
        }

        Fault fault = null;
        String loopVariable = null;
        if (keyword.requiresExpression() && expression.isEmpty()) {
            fault = new Fault(Severity.ERROR, "MISSING_EXPRESSION", "'@" + word + "' requires an expression");
            expression = null;
        } else if (keyword == LogicKeyword.FOR) {
            Matcher header = FOR_HEADER.matcher(expression);
            if (header.matches()) {
                loopVariable = header.group(1);
                expression = header.group(2).strip();
            } else {
                fault = new Fault(Severity.ERROR, "MISSING_EXPRESSION", "Expected '@for <name> in <expression>'");
                expression = null;
            }
        } else if (!keyword.requiresExpression()) {
            expression = null;
        }
        return new ClassifiedLine(lineNumber, raw, indent, LineKind.LOGIC, null,
                new LogicSpec(keyword, word, expression, loopVariable), null, null, fault);
    }

    // ==================== Forms ====================

    private ClassifiedLine classifyForm(int lineNumber, String raw, int indent, String text) {
        FormParse p = new FormParse(text);
        FormSpec spec = p.parse();
        return new ClassifiedLine(lineNumber, raw, indent, LineKind.FORM, spec, null, null, null, p.fault);
    }

    /**
     * Разбор права доступа: три восьмеричные цифры или имя ({@code executable}, {@code readonly}, {@code secret}).
     *
     * @return права в виде "755" или null, если значение некорректно
     */
    public static String parsePermission(String token) {
        String t = token.strip().toLowerCase(Locale.ROOT);
        switch (t) {
            case "executable", "exec", "+x":
                return "755";
            case "readonly":
                return "444";
            case "secret":
                return "600";
            default:
                Matcher m = OCTAL.matcher(t);
                return m.matches() ? m.group(1) : null;
        }
    }

    /**
     * Разбор строки в кавычках начиная с позиции открывающей кавычки.
     * Двойные кавычки поддерживают экранирование, одинарные берутся буквально.
     *
     * @return пара {значение, индекс после закрывающей кавычки} или null, если кавычка не закрыта
     */
    public static Object[] readQuoted(String text, int start) {
        char quote = text.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == quote) {
                return new Object[]{value.toString(), i + 1};
            }
            if (c == '\\' && quote == '"' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    default -> value.append(c).append(next);
                }
                i += 2;
                continue;
            }
            value.append(c);
            i++;
        }
        return null;
    }

    /**
     * Пошаговый разбор одной строки формы.
     */
    private static final class FormParse {
        private final String text;
        private Fault fault;

        FormParse(String text) {
            this.text = text;
        }

        FormSpec parse() {
            int i;
            String path;
            char first = text.charAt(0);
            if (first == '"' || first == '\'') {
                Object[] quoted = readQuoted(text, 0);
                if (quoted == null) {
                    fail(Severity.ERROR, "UNCLOSED_QUOTE", "Unclosed quote in path");
                    path = text.substring(1);
                    i = text.length();
                } else {
                    path = (String) quoted[0];
                    i = (int) quoted[1];
                }
            } else {
                i = 0;
                while (i < text.length() && !Character.isWhitespace(text.charAt(i))
                        && FormOperator.startingAt(text, i) == null
                        && !text.startsWith("%%", i)) {
                    // Плейсхолдер шаблона может содержать пробелы: {{ name | lower }}
                    int close = text.startsWith("{{", i) ? text.indexOf("}}", i + 2) : -1;
                    i = close >= 0 ? close + 2 : i + 1;
                }
                path = text.substring(0, i);
            }

            path = path.replace('\\', '/').strip();
            boolean directory = path.endsWith("/");
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            while (path.startsWith("./")) {
                path = path.substring(2);
            }
            if (path.isEmpty()) {
                fail(Severity.ERROR, "EMPTY_PATH", "Form line has no path");
            }

            String rest = text.substring(i).strip();
            FormOperator op = FormOperator.startingAt(rest, 0);
            if (op == null) {
                String permission = parseTail(rest);
                return new FormSpec(path, directory, FormOperator.NONE, null, null, null, permission);
            }
            if (directory) {
                fail(Severity.WARNING, "DIRECTORY_CONTENT", "Directories cannot carry content; operator '" + op.getSymbol() + "' is ignored");
                return new FormSpec(path, true, FormOperator.NONE, null, null, null, null);
            }

            String payloadText = rest.substring(op.getSymbol().length()).strip();
            return switch (op) {
                case REWRITE -> parseRewrite(path, payloadText);
                case SEED -> parseSeed(path, payloadText);
                default -> parseContent(path, op, payloadText);
            };
        }

        private FormSpec parseContent(String path, FormOperator op, String payloadText) {
            if (payloadText.startsWith("\"\"\"") || payloadText.startsWith("'''")) {
                String quote = payloadText.substring(0, 3);
                String after = payloadText.substring(3);
                int close = after.indexOf(quote);
                if (close >= 0) {
                    String permission = parseTail(after.substring(close + 3).strip());
                    return new FormSpec(path, false, op, after.substring(0, close), null, null, permission);
                }
                String permission = parseTail(after.strip());
                return new FormSpec(path, false, op, null, null, quote, permission);
            }
            if (payloadText.startsWith("\"") || payloadText.startsWith("'")) {
                Object[] quoted = readQuoted(payloadText, 0);
                if (quoted == null) {
                    fail(Severity.WARNING, "UNCLOSED_QUOTE", "Unclosed quote; the rest of the line is taken literally");
                    return new FormSpec(path, false, op, payloadText.substring(1), null, null, null);
                }
                String permission = parseTail(payloadText.substring((int) quoted[1]).strip());
                return new FormSpec(path, false, op, (String) quoted[0], null, null, permission);
            }
            // Без кавычек содержимое берется до конца строки; отрезается только хвостовой %% права
            String[] split = splitTrailingPermission(payloadText);
            return new FormSpec(path, false, op, split[0], null, null, split[1]);
        }

        private FormSpec parseSeed(String path, String payloadText) {
            if (payloadText.isEmpty()) {
                fail(Severity.ERROR, "MISSING_SEED", "'<<' requires a seed path");
                return new FormSpec(path, false, FormOperator.SEED, null, null, null, null);
            }
            String seed;
            String tail;
            if (payloadText.startsWith("\"") || payloadText.startsWith("'")) {
                Object[] quoted = readQuoted(payloadText, 0);
                if (quoted == null) {
                    fail(Severity.ERROR, "UNCLOSED_QUOTE", "Unclosed quote in seed path");
                    return new FormSpec(path, false, FormOperator.SEED, payloadText.substring(1), null, null, null);
                }
                seed = (String) quoted[0];
                tail = payloadText.substring((int) quoted[1]);
            } else {
                int end = 0;
                while (end < payloadText.length() && !Character.isWhitespace(payloadText.charAt(end))) end++;
                seed = payloadText.substring(0, end);
                tail = payloadText.substring(end);
            }
            String permission = parseTail(tail.strip());
            return new FormSpec(path, false, FormOperator.SEED, seed.replace('\\', '/'), null, null, permission);
        }

        private FormSpec parseRewrite(String path, String payloadText) {
            String find;
            String afterFind;
            if (payloadText.startsWith("\"") || payloadText.startsWith("'")) {
                Object[] quoted = readQuoted(payloadText, 0);
                if (quoted == null) {
                    return badRewrite(path);
                }
                find = (String) quoted[0];
                afterFind = payloadText.substring((int) quoted[1]).strip();
            } else {
                int arrow = payloadText.indexOf("->");
                if (arrow < 0) {
                    return badRewrite(path);
                }
                find = payloadText.substring(0, arrow).strip();
                afterFind = payloadText.substring(arrow).strip();
            }
            if (!afterFind.startsWith("->")) {
                return badRewrite(path);
            }
            String replacementText = afterFind.substring(2).strip();
            String replacement;
            String permission;
            if (replacementText.startsWith("\"") || replacementText.startsWith("'")) {
                Object[] quoted = readQuoted(replacementText, 0);
                if (quoted == null) {
                    return badRewrite(path);
                }
                replacement = (String) quoted[0];
                permission = parseTail(replacementText.substring((int) quoted[1]).strip());
            } else {
                String[] split = splitTrailingPermission(replacementText);
                replacement = split[0];
                permission = split[1];
            }
            return new FormSpec(path, false, FormOperator.REWRITE, find, replacement, null, permission);
        }

        private FormSpec badRewrite(String path) {
            fail(Severity.ERROR, "MALFORMED_REWRITE", "Expected ~= 'find' -> 'replace'");
            return new FormSpec(path, false, FormOperator.REWRITE, null, null, null, null);
        }

        /**
         * Хвост строки после пути или содержимого: {@code %% права} и/или комментарий.
         */
        private String parseTail(String tail) {
            if (tail.isEmpty() || tail.startsWith("#") || tail.startsWith("//")) {
                return null;
            }
            if (tail.startsWith("%%")) {
                String body = tail.substring(2).strip();
                int end = 0;
                while (end < body.length() && !Character.isWhitespace(body.charAt(end))) end++;
                String token = body.substring(0, end);
                String after = body.substring(end).strip();
                if (!after.isEmpty() && !after.startsWith("#") && !after.startsWith("//")) {
                    fail(Severity.WARNING, "TRAILING_TEXT", "Unexpected text after permission: '" + after + "'");
                }
                return permission(token);
            }
            fail(Severity.WARNING, "TRAILING_TEXT", "Unexpected text ignored: '" + tail + "'");
            return null;
        }

        private String[] splitTrailingPermission(String payload) {
            int idx = payload.lastIndexOf("%%");
            if (idx > 0 && Character.isWhitespace(payload.charAt(idx - 1))) {
                String token = payload.substring(idx + 2).strip();
                if (!token.isEmpty() && token.indexOf(' ') < 0) {
                    return new String[]{payload.substring(0, idx).strip(), permission(token)};
                }
            }
            return new String[]{payload, null};
        }

        private String permission(String token) {
            String parsed = parsePermission(token);
            if (parsed == null) {
                fail(Severity.ERROR, "INVALID_PERMISSION", "Invalid permission '" + token + "' is ignored");
            }
            return parsed;
        }

        private void fail(Severity severity, String code, String message) {
            // Сохраняем самую серьезную ошибку строки
            if (fault == null || severity.atLeast(fault.severity()) && severity != fault.severity()) {
                fault = new Fault(severity, code, message);
            }
        }
    }
}
