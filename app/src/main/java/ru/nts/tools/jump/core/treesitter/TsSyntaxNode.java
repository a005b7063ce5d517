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
package ru.nts.tools.jump.core.treesitter;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import ru.nts.tools.jump.engine.SyntaxNode;
import ru.nts.tools.jump.engine.SyntaxTree;

import java.util.List;

/**
 * Узел движка навигации поверх нативного {@link TSNode}.
 * <p>
 * tree-sitter считает колонки в байтах UTF-8, движок в символах строки:
 * пересчет идет по строкам исходника. Каждая обертка держит ссылку на {@link TSTree},
 * чтобы нативное дерево жило, пока живут узлы.
 */
public final class TsSyntaxNode implements SyntaxNode {

    private final TSNode node;
    private final Document document;

    private TsSyntaxNode(TSNode node, Document document) {
        this.node = node;
        this.document = document;
    }

    /**
     * Строит дерево движка из результата tree-sitter.
     */
    public static SyntaxTree treeOf(TSTree tree, String content, String langId) {
        List<String> lines = SyntaxTree.splitLines(content);
        Document document = new Document(tree, lines);
        return new SyntaxTree(new TsSyntaxNode(tree.getRootNode(), document), lines, langId);
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public int startRow() {
        return node.getStartPoint().getRow();
    }

    @Override
    public int startCol() {
        TSPoint point = node.getStartPoint();
        return document.charColumn(point.getRow(), point.getColumn());
    }

    @Override
    public int endRow() {
        return node.getEndPoint().getRow();
    }

    @Override
    public int endCol() {
        TSPoint point = node.getEndPoint();
        return document.charColumn(point.getRow(), point.getColumn());
    }

    @Override
    public SyntaxNode parent() {
        return wrap(node.getParent());
    }

    @Override
    public int childCount() {
        return node.getChildCount();
    }

    @Override
    public SyntaxNode child(int index) {
        if (index < 0 || index >= node.getChildCount()) {
            return null;
        }
        return wrap(node.getChild(index));
    }

    @Override
    public SyntaxNode field(String name) {
        return wrap(node.getChildByFieldName(name));
    }

    @Override
    public String toString() {
        return kind() + "[" + startRow() + ":" + startCol() + "-" + endRow() + ":" + endCol() + "]";
    }

    private SyntaxNode wrap(TSNode raw) {
        if (raw == null || raw.isNull()) {
            return null;
        }
        return new TsSyntaxNode(raw, document);
    }

    /**
     * Общие для всех узлов дерева данные: нативное дерево и строки исходника.
     */
    private record Document(TSTree tree, List<String> lines) {

        int charColumn(int row, int byteColumn) {
            if (row < 0 || row >= lines.size() || byteColumn <= 0) {
                return Math.max(byteColumn, 0);
            }
            String line = lines.get(row);
            int bytes = 0;
            int index = 0;
            while (index < line.length() && bytes < byteColumn) {
                int codePoint = line.codePointAt(index);
                bytes += utf8Length(codePoint);
                index += Character.charCount(codePoint);
            }
            // За концом строки (например, на '\r') остаток считается по байту на символ
            return index + Math.max(byteColumn - bytes, 0);
        }

        private static int utf8Length(int codePoint) {
            if (codePoint < 0x80) return 1;
            if (codePoint < 0x800) return 2;
            if (codePoint < 0x10000) return 3;
            return 4;
        }
    }
}
