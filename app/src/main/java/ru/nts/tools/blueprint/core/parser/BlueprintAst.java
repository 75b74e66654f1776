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
 * Арена узлов AST: узлы лежат в списке, корень имеет идентификатор 0.
 * Ссылки между узлами целочисленные, поэтому дерево не содержит циклических ссылок объектов,
 * а глубина обхода легко ограничивается.
 */
public final class BlueprintAst {

    public static final int ROOT = 0;

    private final List<AstNode> nodes = new ArrayList<>();

    public BlueprintAst() {
        nodes.add(new AstNode(ROOT, -1, AstNode.Kind.ROOT, 0, -1, null, null, null));
    }

    AstNode add(int parent, AstNode.Kind kind, ClassifiedLine source, String content, List<Integer> commandLines) {
        int id = nodes.size();
        AstNode node = new AstNode(id, parent, kind, source.lineNumber(), source.indent(), source, content, commandLines);
        nodes.add(node);
        nodes.get(parent).addChild(id);
        return node;
    }

    public AstNode root() {
        return nodes.get(ROOT);
    }

    public AstNode node(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public List<AstNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Последний ребенок узла или null.
     */
    public AstNode lastChild(int parentId) {
        List<Integer> children = nodes.get(parentId).getChildren();
        return children.isEmpty() ? null : nodes.get(children.get(children.size() - 1));
    }

    /**
     * Текстовое дерево для отладки.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(ROOT, 0, sb);
        return sb.toString();
    }

    private void dump(int id, int depth, StringBuilder sb) {
        AstNode node = nodes.get(id);
        if (id != ROOT) {
            sb.append("  ".repeat(depth - 1)).append(describe(node)).append('\n');
        }
        for (int child : node.getChildren()) {
            dump(child, depth + 1, sb);
        }
    }

    private static String describe(AstNode node) {
        return switch (node.getKind()) {
            case ROOT -> "<root>";
            case LOGIC -> "@" + node.getLogic().word() + (node.getLogic().expression() == null ? "" : " " + node.getLogic().expression());
            case FORM -> node.getForm().path() + (node.getForm().directory() ? "/" : "");
            case COMMAND_ANCHOR -> "%% commands " + node.getCommandLines();
        };
    }
}
