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
 * Определение переменной в порядке документа.
 *
 * @param line     номер строки
 * @param name     имя
 * @param typeHint подсказка типа или null
 * @param rawValue значение как оно написано
 */
public record VariableDefinition(int line, String name, String typeHint, String rawValue) {
}
