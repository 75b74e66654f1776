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
package ru.nts.tools.blueprint.core.reconcile;

import ru.nts.tools.blueprint.core.EngineLog;
import ru.nts.tools.blueprint.core.logic.MutationKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Применение мутаций {@code += ^= -= ~=} к базовому тексту.
 * Для базы, взятой с диска, используется {@link #applyOnce}: повторный прогон по уже измененному файлу
 * не дублирует добавленный текст.
 */
public final class TextMutator {

    private TextMutator() {
    }

    public static String apply(MutationKind kind, String base, String payload, String replacement) {
        return switch (kind) {
            case APPEND -> append(base, payload);
            case PREPEND -> prepend(base, payload);
            case SUBTRACT -> compile(payload).matcher(base).replaceAll("");
            case REWRITE -> rewrite(base, payload, replacement == null ? "" : replacement);
            case NONE -> payload;
        };
    }

    /**
     * Как {@link #apply}, но добавление и вставка в начало пропускаются, если текст уже на месте.
     */
    public static String applyOnce(MutationKind kind, String base, String payload, String replacement) {
        if (kind == MutationKind.APPEND && !payload.isEmpty()
                && stripTrailingNewline(base).endsWith(stripTrailingNewline(payload))) {
            return base;
        }
        if (kind == MutationKind.PREPEND && !payload.isEmpty()) {
            String block = payload.endsWith("\n") ? payload : payload + "\n";
            String body = base;
            if (base.startsWith("#!")) {
                int eol = base.indexOf('\n');
                body = eol < 0 ? "" : base.substring(eol + 1);
            }
            if (body.startsWith(block)) return base;
        }
        return apply(kind, base, payload, replacement);
    }

    private static String append(String base, String payload) {
        if (base.isEmpty() || base.endsWith("\n")) {
            return base + payload;
        }
        return base + "\n" + payload;
    }

    /**
     * Вставка в начало; строка shebang ({@code #!}) остается первой.
     */
    private static String prepend(String base, String payload) {
        String block = payload.isEmpty() || payload.endsWith("\n") ? payload : payload + "\n";
        if (base.startsWith("#!")) {
            int eol = base.indexOf('\n');
            if (eol < 0) {
                return base + "\n" + block;
            }
            return base.substring(0, eol + 1) + block + base.substring(eol + 1);
        }
        return block + base;
    }

    private static String stripTrailingNewline(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    /**
     * Замена с группами {@code $1}. Если строка замены некорректна для регулярного выражения, она вставляется буквально.
     */
    private static String rewrite(String base, String find, String replacement) {
        Pattern pattern = compile(find);
        try {
            return pattern.matcher(base).replaceAll(replacement);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            EngineLog.debug("Invalid replacement '" + replacement + "', inserting literally: " + e.getMessage());
            return pattern.matcher(base).replaceAll(Matcher.quoteReplacement(replacement));
        }
    }

    /**
     * Некорректное регулярное выражение трактуется как буквальный текст.
     */
    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex, Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            EngineLog.debug("Invalid pattern '" + regex + "', matching literally: " + e.getDescription());
            return Pattern.compile(Pattern.quote(regex));
        }
    }
}
