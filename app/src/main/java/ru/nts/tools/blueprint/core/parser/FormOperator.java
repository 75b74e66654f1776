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

/**
 * Оператор строки формы. {@link #NONE} означает пустой файл или директорию.
 */
public enum FormOperator {
    NONE(""),
    LITERAL("::"),
    SEED("<<"),
    APPEND("+="),
    PREPEND("^="),
    SUBTRACT("-="),
    REWRITE("~=");

    private final String symbol;

    FormOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Мутация изменяет уже существующее содержимое вместо полной материализации.
     */
    public boolean isMutation() {
        return this == APPEND || this == PREPEND || this == SUBTRACT || this == REWRITE;
    }

    /**
     * Ищет оператор, с которого начинается строка.
     */
    public static FormOperator startingAt(String text, int index) {
        for (FormOperator op : values()) {
            if (op != NONE && text.startsWith(op.symbol, index)) {
                return op;
            }
        }
        return null;
    }
}
