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
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Подстановка шаблонов {@code {{ name }}} и {@code {{ name | filter | ... }}}.
 * Неопределенная переменная оставляет плейсхолдер как есть и сообщается через обработчик предупреждений.
 */
public class TemplateAlchemist {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.*?)\\s*}}");
    private static final Pattern WORD_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|[^A-Za-z0-9]+");

    private final VariableContext context;

    public TemplateAlchemist(VariableContext context) {
        this.context = context;
    }

    /**
     * @param template текст с плейсхолдерами (null возвращается как null)
     * @param warnings получатель предупреждений (код, сообщение)
     */
    public String expand(String template, BiConsumer<String, String> warnings) {
        if (template == null || !template.contains("{{")) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String[] parts = m.group(1).split("\\|");
            String name = parts[0].strip();
            String replacement;
            if (name.isEmpty() || !context.isDefined(name)) {
                warnings.accept("UNDEFINED_VARIABLE", "Variable '" + name + "' is not defined; placeholder kept");
                replacement = m.group();
            } else {
                replacement = LogicValues.asString(context.lookup(name));
                for (int i = 1; i < parts.length; i++) {
                    String filter = parts[i].strip();
                    String applied = applyFilter(filter, replacement);
                    if (applied == null) {
                        warnings.accept("UNKNOWN_FILTER", "Filter '" + filter + "' is not known and is skipped");
                    } else {
                        replacement = applied;
                    }
                }
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * @return результат фильтра или null для неизвестного фильтра
     */
    public static String applyFilter(String filter, String value) {
        return switch (filter.toLowerCase(Locale.ROOT)) {
            case "lower" -> value.toLowerCase(Locale.ROOT);
            case "upper" -> value.toUpperCase(Locale.ROOT);
            case "trim" -> value.strip();
            case "title" -> title(value);
            case "snake" -> String.join("_", words(value)).toLowerCase(Locale.ROOT);
            case "kebab", "slug" -> String.join("-", words(value)).toLowerCase(Locale.ROOT);
            case "camel" -> {
                String pascal = pascal(value);
                yield pascal.isEmpty() ? pascal : Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
            }
            case "pascal" -> pascal(value);
            default -> null;
        };
    }

    private static List<String> words(String value) {
        List<String> words = new ArrayList<>();
        for (String w : WORD_BOUNDARY.split(value.strip())) {
            if (!w.isEmpty()) words.add(w);
        }
        return words;
    }

    private static String pascal(String value) {
        StringBuilder sb = new StringBuilder();
        for (String w : words(value)) {
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String title(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean start = true;
        for (char c : value.toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(start ? Character.toUpperCase(c) : Character.toLowerCase(c));
                start = false;
            } else {
                sb.append(c);
                start = true;
            }
        }
        return sb.toString();
    }
}
