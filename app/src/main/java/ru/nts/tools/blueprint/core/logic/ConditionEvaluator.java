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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Вычислитель условий {@code @if}/{@code @elif} и выражений {@code @for}.
 *
 * Грамматика (рекурсивный спуск):
 * <pre>
 * or         := and (('or' | '||') and)*
 * and        := not (('and' | '&&') not)*
 * not        := ('not' | '!') not | comparison
 * comparison := primary (('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=' | 'in' | 'not in') primary)?
 * primary    := string | number | true | false | list | '(' or ')' | name '(' args ')' | name
 * </pre>
 * Функции: {@code exists(path)} и {@code defined(name)}.
 */
public class ConditionEvaluator {

    private final VariableContext context;
    private final VirtualManifest manifest;

    public ConditionEvaluator(VariableContext context, VirtualManifest manifest) {
        this.context = context;
        this.manifest = manifest;
    }

    /**
     * Вычисляет условие и возвращает его истинность.
     */
    public boolean test(String expression) throws EvaluationException {
        return LogicValues.truthy(evaluate(expression));
    }

    /**
     * Вычисляет выражение и возвращает значение.
     */
    public Object evaluate(String expression) throws EvaluationException {
        if (expression == null || expression.isBlank()) {
            throw new EvaluationException("Empty expression");
        }
        Parser parser = new Parser(tokenize(expression));
        Object value = parser.or();
        if (!parser.atEnd()) {
            throw new EvaluationException("Unexpected token '" + parser.peek().text + "'");
        }
        return value;
    }

    // ==================== Tokenizer ====================

    private enum T {STRING, NUMBER, NAME, OP}

    private record Token(T type, String text) {
    }

    private static List<Token> tokenize(String s) throws EvaluationException {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '"' || c == '\'') {
                int end = s.indexOf(c, i + 1);
                if (end < 0) throw new EvaluationException("Unclosed string literal");
                tokens.add(new Token(T.STRING, s.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
                int start = i++;
                while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
                tokens.add(new Token(T.NUMBER, s.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
                tokens.add(new Token(T.NAME, s.substring(start, i)));
            } else {
                String two = i + 1 < s.length() ? s.substring(i, i + 2) : "";
                if (List.of("==", "!=", "<=", ">=", "&&", "||").contains(two)) {
                    tokens.add(new Token(T.OP, two));
                    i += 2;
                } else if ("<>!()[],".indexOf(c) >= 0) {
                    tokens.add(new Token(T.OP, String.valueOf(c)));
                    i++;
                } else {
                    throw new EvaluationException("Unexpected character '" + c + "'");
                }
            }
        }
        return tokens;
    }

    // ==================== Parser ====================

    private final class Parser {
        private final List<Token> tokens;
        private int pos;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return atEnd() ? null : tokens.get(pos);
        }

        private boolean accept(String... texts) {
            Token t = peek();
            if (t == null || t.type == T.STRING) return false;
            for (String text : texts) {
                if (t.text.toLowerCase(Locale.ROOT).equals(text)) {
                    pos++;
                    return true;
                }
            }
            return false;
        }

        private void expect(String text) throws EvaluationException {
            if (!accept(text)) {
                throw new EvaluationException("Expected '" + text + "'" + (atEnd() ? " at end" : " before '" + peek().text + "'"));
            }
        }

        Object or() throws EvaluationException {
            Object left = and();
            while (accept("or", "||")) {
                Object right = and();
                left = LogicValues.truthy(left) || LogicValues.truthy(right);
            }
            return left;
        }

        Object and() throws EvaluationException {
            Object left = not();
            while (accept("and", "&&")) {
                Object right = not();
                left = LogicValues.truthy(left) && LogicValues.truthy(right);
            }
            return left;
        }

        Object not() throws EvaluationException {
            // "not in" разбирается в comparison, здесь только унарное отрицание
            if (accept("not", "!")) {
                return !LogicValues.truthy(not());
            }
            return comparison();
        }

        Object comparison() throws EvaluationException {
            Object left = primary();
            Token t = peek();
            if (t == null || t.type == T.STRING || t.type == T.NUMBER) return left;
            String op = t.text.toLowerCase(Locale.ROOT);
            switch (op) {
                case "==", "!=", "<", "<=", ">", ">=", "in" -> pos++;
                case "not" -> {
                    if (pos + 1 < tokens.size() && tokens.get(pos + 1).text.equalsIgnoreCase("in")) {
                        pos += 2;
                        return !LogicValues.contains(primary(), left);
                    }
                    return left;
                }
                default -> {
                    return left;
                }
            }
            Object right = primary();
            return switch (op) {
                case "==" -> LogicValues.looselyEquals(left, right);
                case "!=" -> !LogicValues.looselyEquals(left, right);
                case "<" -> LogicValues.compare(left, right) < 0;
                case "<=" -> LogicValues.compare(left, right) <= 0;
                case ">" -> LogicValues.compare(left, right) > 0;
                case ">=" -> LogicValues.compare(left, right) >= 0;
                default -> LogicValues.contains(right, left);
            };
        }

        Object primary() throws EvaluationException {
            Token t = peek();
            if (t == null) throw new EvaluationException("Unexpected end of expression");
            pos++;
            switch (t.type) {
                case STRING:
                    return t.text;
                case NUMBER:
                    return Long.parseLong(t.text);
                case OP:
                    if (t.text.equals("(")) {
                        Object inner = or();
                        expect(")");
                        return inner;
                    }
                    if (t.text.equals("[")) {
                        List<Object> items = new ArrayList<>();
                        if (!accept("]")) {
                            do {
                                items.add(primary());
                            } while (accept(","));
                            expect("]");
                        }
                        return items;
                    }
                    throw new EvaluationException("Unexpected token '" + t.text + "'");
                default:
                    break;
            }

            String name = t.text;
            if (name.equalsIgnoreCase("true")) return Boolean.TRUE;
            if (name.equalsIgnoreCase("false")) return Boolean.FALSE;
            if (accept("(")) {
                return call(name);
            }
            if (!context.isDefined(name)) {
                throw new EvaluationException("Undefined variable '" + name + "'");
            }
            return context.lookup(name);
        }

        private Object call(String function) throws EvaluationException {
            switch (function.toLowerCase(Locale.ROOT)) {
                case "exists" -> {
                    Object path = primaryArgument();
                    expect(")");
                    return manifest.exists(LogicValues.asString(path));
                }
                case "defined" -> {
                    // Аргумент - имя переменной, а не ее значение
                    Token arg = peek();
                    if (arg == null || (arg.type != T.NAME && arg.type != T.STRING)) {
                        throw new EvaluationException("defined() expects a variable name");
                    }
                    pos++;
                    expect(")");
                    return context.isDefined(arg.text);
                }
                default -> throw new EvaluationException("Unknown function '" + function + "'");
            }
        }

        private Object primaryArgument() throws EvaluationException {
            return or();
        }
    }
}
