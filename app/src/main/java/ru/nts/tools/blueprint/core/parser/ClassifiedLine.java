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

/**
 * Результат классификации одной строки чертежа.
 * В зависимости от {@link #kind()} заполнена ровно одна из частей: form, logic, variable или command.
 *
 * @param lineNumber номер строки (с 1)
 * @param raw        исходный текст строки
 * @param indent     визуальный отступ (табы выровнены по ширине табуляции)
 * @param kind       вид строки
 * @param form       разбор строки формы
 * @param logic      разбор логической директивы
 * @param variable   разбор определения переменной
 * @param command    разбор оркестрационной команды
 * @param fault      некритичная ошибка разбора (или null)
 */
public record ClassifiedLine(int lineNumber, String raw, int indent, LineKind kind,
                             FormSpec form, LogicSpec logic, VariableSpec variable, CommandSpec command,
                             Fault fault) {

    /**
     * Ошибка разбора строки. Классификатор не бросает исключений: строка все равно получает вид,
     * а компилятор превращает ошибку в диагностику.
     */
    public record Fault(Severity severity, String code, String message) {
    }

    /**
     * Строка формы: {@code path[/] [оператор полезная_нагрузка] [%% права] [# комментарий]}.
     *
     * @param path         путь (шаблон, без кавычек и хвостового '/')
     * @param directory    признак директории
     * @param operator     оператор
     * @param payload      содержимое, путь семени или шаблон поиска; null если не указано
     * @param replacement  замена для {@code ~=}
     * @param blockQuote   открывающие тройные кавычки блока, если содержимое идет следующими строками
     * @param permission   права в восьмеричном виде ("755") или null
     */
    public record FormSpec(String path, boolean directory, FormOperator operator, String payload,
                           String replacement, String blockQuote, String permission) {

        public boolean awaitsImplicitBlock() {
            return operator != FormOperator.NONE && operator != FormOperator.SEED
                    && blockQuote == null && (payload == null || payload.isEmpty());
        }
    }

    /**
     * @param keyword    ключевое слово или null, если оно не распознано
     * @param word       ключевое слово как оно написано
     * @param expression условие или выражение цикла (без хвостового ':')
     * @param loopVariable имя переменной цикла для {@code @for}
     */
    public record LogicSpec(LogicKeyword keyword, String word, String expression, String loopVariable) {
    }

    /**
     * @param name     имя переменной
     * @param typeHint необязательная подсказка типа после ':'
     * @param value    исходный текст значения
     */
    public record VariableSpec(String name, String typeHint, String value) {
    }

    /**
     * @param directive имя директивы после {@code %%} (например, "post-run")
     * @param text      команда в той же строке или null для заголовка блока
     */
    public record CommandSpec(String directive, String text) {

        public boolean isBlockHeader() {
            return text == null || text.isEmpty();
        }
    }

    public boolean isLogic(LogicKeyword keyword) {
        return kind == LineKind.LOGIC && logic.keyword() == keyword;
    }

}
