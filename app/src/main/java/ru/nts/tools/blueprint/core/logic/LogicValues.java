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

import ru.nts.tools.blueprint.core.parser.LineClassifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Значения переменных и выражений: {@link String}, {@link Boolean}, {@link Long} и {@link List}.
 * Правила истинности, сравнения и разбора литералов собраны здесь.
 */
public final class LogicValues {

    private static final Pattern INTEGER = Pattern.compile("^-?\\d{1,18}$");

    private LogicValues() {
    }

    /**
     * Истинность: булево как есть, число не ноль, строка непустая и не "false"/"no"/"0", список непустой.
     */
    public static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Long n) return n != 0;
        if (value instanceof List<?> list) return !list.isEmpty();
        String s = value.toString().strip().toLowerCase(Locale.ROOT);
        return !s.isEmpty() && !s.equals("false") && !s.equals("no") && !s.equals("0");
    }

    /**
     * Строковое представление для подстановки в шаблоны. Список склеивается через ", ".
     */
    public static String asString(Object value) {
        if (value == null) return "";
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) parts.add(asString(item));
            return String.join(", ", parts);
        }
        return value.toString();
    }

    /**
     * Разбор литерала значения переменной: строка в кавычках, true/false, целое, список {@code [a, b, 'c']}.
     * Все остальное считается строкой без кавычек.
     */
    public static Object parseLiteral(String raw) {
        String text = raw.strip();
        if (text.isEmpty()) return "";
        char first = text.charAt(0);
        if ((first == '"' || first == '\'') && text.length() > 1) {
            Object[] quoted = LineClassifier.readQuoted(text, 0);
            if (quoted != null && (int) quoted[1] == text.length()) {
                return quoted[0];
            }
        }
        if (text.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (text.equalsIgnoreCase("false")) return Boolean.FALSE;
        if (INTEGER.matcher(text).matches()) return Long.parseLong(text);
        if (first == '[' && text.endsWith("]")) {
            List<Object> items = new ArrayList<>();
            for (String item : splitTopLevel(text.substring(1, text.length() - 1))) {
                if (!item.isBlank()) items.add(parseLiteral(item));
            }
            return items;
        }
        return text;
    }

    /**
     * Делит строку по запятым вне кавычек.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
            } else if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (c == ',') {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    /**
     * Приводит значение к списку для {@code @for}: список как есть, строка делится по запятым.
     */
    public static List<Object> asIterable(Object value) {
        if (value instanceof List<?> list) return new ArrayList<>(list);
        if (value instanceof String s) {
            List<Object> items = new ArrayList<>();
            for (String part : s.split(",")) {
                if (!part.isBlank()) items.add(part.strip());
            }
            return items;
        }
        return List.of(value);
    }

    static Long asNumber(Object value) {
        if (value instanceof Long n) return n;
        if (value instanceof String s && INTEGER.matcher(s.strip()).matches()) return Long.parseLong(s.strip());
        return null;
    }

    /**
     * Равенство с приведением: булево сравнивается с булевой трактовкой второй стороны,
     * числа сравниваются численно, остальное как строки.
     */
    public static boolean looselyEquals(Object a, Object b) {
        if (a instanceof Boolean || b instanceof Boolean) {
            Boolean left = asBoolean(a);
            Boolean right = asBoolean(b);
            return left != null && left.equals(right);
        }
        Long na = asNumber(a);
        Long nb = asNumber(b);
        if (na != null && nb != null) return na.equals(nb);
        if (a instanceof List<?> || b instanceof List<?>) return Objects.equals(a, b);
        return asString(a).equals(asString(b));
    }

    private static Boolean asBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        String s = asString(value).strip().toLowerCase(Locale.ROOT);
        if (s.equals("true")) return true;
        if (s.equals("false")) return false;
        return null;
    }

    static int compare(Object a, Object b) {
        Long na = asNumber(a);
        Long nb = asNumber(b);
        if (na != null && nb != null) return Long.compare(na, nb);
        return asString(a).compareTo(asString(b));
    }

    static boolean contains(Object container, Object item) {
        if (container instanceof List<?> list) {
            for (Object element : list) {
                if (looselyEquals(element, item)) return true;
            }
            return false;
        }
        return asString(container).contains(asString(item));
    }
}
