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

import ru.nts.tools.blueprint.core.parser.FormOperator;

/**
 * Вид мутации запланированной записи. {@link #NONE} означает полную материализацию.
 */
public enum MutationKind {
    NONE, APPEND, PREPEND, SUBTRACT, REWRITE;

    public static MutationKind of(FormOperator operator) {
        return switch (operator) {
            case APPEND -> APPEND;
            case PREPEND -> PREPEND;
            case SUBTRACT -> SUBTRACT;
            case REWRITE -> REWRITE;
            default -> NONE;
        };
    }
}
