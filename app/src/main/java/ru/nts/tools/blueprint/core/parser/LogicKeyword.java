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

import java.util.Locale;

/**
 * Ключевые слова логических директив.
 */
public enum LogicKeyword {
    IF, ELIF, ELSE, ENDIF, FOR, ENDFOR;

    public static LogicKeyword parse(String word) {
        return switch (word.toLowerCase(Locale.ROOT)) {
            case "if" -> IF;
            case "elif" -> ELIF;
            case "else" -> ELSE;
            case "endif" -> ENDIF;
            case "for" -> FOR;
            case "endfor" -> ENDFOR;
            default -> null;
        };
    }

    /**
     * Директивы, которые только закрывают блок и не открывают кадр стека.
     */
    public boolean isPureCloser() {
        return this == ENDIF || this == ENDFOR;
    }

    /**
     * Ветви, продолжающие цепочку предыдущего {@code @if}.
     */
    public boolean isChainContinuation() {
        return this == ELIF || this == ELSE;
    }

    public boolean requiresExpression() {
        return this == IF || this == ELIF || this == FOR;
    }
}
