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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Узел AST в арене {@link BlueprintAst}. Дети хранятся как целочисленные идентификаторы.
 *
 * Логический узел несет {@link ClassifiedLine.LogicSpec}, узел формы несет
 * {@link ClassifiedLine.FormSpec} и собранное содержимое блока, якорь команд несет
 * номера строк зарегистрированных команд.
 */
public final class AstNode {

    public enum Kind {ROOT, LOGIC, FORM, COMMAND_ANCHOR}

    private final int id;
    private final int parent;
    private final Kind kind;
    private final int line;
    private final int indent;
    private final ClassifiedLine source;
    private final String content;
    private final List<Integer> commandLines;
    private final List<Integer> children = new ArrayList<>();

    AstNode(int id, int parent, Kind kind, int line, int indent, ClassifiedLine source,
            String content, List<Integer> commandLines) {
        this.id = id;
        this.parent = parent;
        this.kind = kind;
        this.line = line;
        this.indent = indent;
        this.source = source;
        this.content = content;
        this.commandLines = commandLines == null ? List.of() : List.copyOf(commandLines);
    }

    public int getId() {
        return id;
    }

    /**
     * @return идентификатор родителя или -1 для корня
     */
    public int getParent() {
        return parent;
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getIndent() {
        return indent;
    }

    public ClassifiedLine getSource() {
        return source;
    }

    public ClassifiedLine.FormSpec getForm() {
        return source == null ? null : source.form();
    }

    public ClassifiedLine.LogicSpec getLogic() {
        return source == null ? null : source.logic();
    }

    /**
     * Содержимое формы с учетом многострочного блока; для прочих узлов null.
     */
    public String getContent() {
        return content;
    }

    public List<Integer> getCommandLines() {
        return commandLines;
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(int childId) {
        children.add(childId);
    }

    public boolean isLogic(LogicKeyword keyword) {
        return kind == Kind.LOGIC && source.logic().keyword() == keyword;
    }

    public boolean isDirectory() {
        return kind == Kind.FORM && source.form().directory();
    }

    @Override
    public String toString() {
        return "AstNode{" + id + ", " + kind + ", line=" + line + ", children=" + children + "}";
    }
}
