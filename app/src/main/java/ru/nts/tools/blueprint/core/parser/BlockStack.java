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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Стек открытых структурных контекстов, упорядоченный по отступу.
 *
 * Директории и открывающие логические директивы открывают кадр; файлы кадр не открывают.
 * Тело логического блока бывает двух видов: с отступом (закрывается возвратом на уровень директивы)
 * и плоское, на том же отступе, что и директива (закрывается только {@code @endif}/{@code @endfor}
 * или сестринской ветвью). Вид тела фиксируется по первой строке внутри блока.
 */
public final class BlockStack {

    private static final int UNSET = Integer.MIN_VALUE;

    private static final class Frame {
        final int nodeId;
        final int indent;
        final LogicKeyword keyword; // null для директории и корня
        int bodyIndent = UNSET;

        Frame(int nodeId, int indent, LogicKeyword keyword) {
            this.nodeId = nodeId;
            this.indent = indent;
            this.keyword = keyword;
        }

        boolean isLogic() {
            return keyword != null;
        }
    }

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Frame root;

    public BlockStack() {
        // Отступ корня ниже любого допустимого отступа
        root = new Frame(BlueprintAst.ROOT, -1, null);
        frames.push(root);
    }

    /**
     * Снимает кадры, в которые строка больше не входит, и возвращает идентификатор родителя для строки.
     * Ветви {@code @elif}/{@code @else} на уровне открытой ветви закрывают ее (ровно один кадр).
     */
    public int alignFor(ClassifiedLine line) {
        boolean sibling = line.kind() == LineKind.LOGIC && line.logic().keyword() != null
                && line.logic().keyword().isChainContinuation();
        int indent = line.indent();

        while (frames.peek() != root) {
            Frame top = frames.peek();
            if (indent < top.indent) {
                frames.pop();
                continue;
            }
            if (indent == top.indent) {
                if (!top.isLogic()) {
                    frames.pop();
                    continue;
                }
                if (sibling && top.keyword != LogicKeyword.FOR) {
                    frames.pop();
                    break;
                }
                if (top.bodyIndent != UNSET && top.bodyIndent > top.indent) {
                    frames.pop();
                    continue;
                }
                break;
            }
            // Строка глубже директивы, но мельче уже начатого тела с отступом
            if (top.isLogic() && top.bodyIndent != UNSET && top.bodyIndent > top.indent && indent < top.bodyIndent) {
                frames.pop();
                continue;
            }
            break;
        }

        Frame parent = frames.peek();
        if (parent.isLogic() && parent.bodyIndent == UNSET) {
            parent.bodyIndent = indent;
        }
        return parent.nodeId;
    }

    /**
     * Закрывает ближайший открытый блок, подходящий к закрывающей директиве, вместе со всем, что открыто внутри.
     *
     * @return идентификатор родителя закрытого блока или -1, если подходящего блока нет
     */
    public int closeBlock(LogicKeyword closer) {
        Frame match = null;
        for (Iterator<Frame> it = frames.iterator(); it.hasNext(); ) {
            Frame f = it.next();
            if (f == root) break;
            if (matches(closer, f.keyword)) {
                match = f;
                break;
            }
        }
        if (match == null) return -1;
        while (frames.peek() != match) {
            frames.pop();
        }
        frames.pop();
        return frames.peek().nodeId;
    }

    private static boolean matches(LogicKeyword closer, LogicKeyword opener) {
        if (opener == null) return false;
        if (closer == LogicKeyword.ENDIF) {
            return opener == LogicKeyword.IF || opener == LogicKeyword.ELIF || opener == LogicKeyword.ELSE;
        }
        return closer == LogicKeyword.ENDFOR && opener == LogicKeyword.FOR;
    }

    public void pushDirectory(int nodeId, int indent) {
        frames.push(new Frame(nodeId, indent, null));
    }

    /**
     * Открывает логический кадр. Неизвестная директива передается как IF:
     * ее тело должно быть поглощено так же, как тело условия.
     */
    public void pushLogic(int nodeId, int indent, LogicKeyword keyword) {
        frames.push(new Frame(nodeId, indent, keyword == null ? LogicKeyword.IF : keyword));
    }

    public int depth() {
        return frames.size() - 1;
    }

}
