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
package ru.nts.tools.jump.engine;

/**
 * Поиск узла под курсором.
 */
public final class NodeLocator {

    /**
     * Защита от патологически глубоких деревьев.
     */
    private static final int MAX_DESCENT = 512;

    private NodeLocator() {}

    /**
     * Находит наименьший узел (включая анонимные токены), диапазон которого содержит точку.
     * Правило совпадает с descendant_for_point_range в tree-sitter: начало включительно, конец исключительно.
     *
     * @return найденный узел или сам корень, если ни один потомок не содержит точку
     */
    public static SyntaxNode smallestAt(SyntaxNode root, int row, int col) {
        SyntaxNode current = root;
        for (int depth = 0; depth < MAX_DESCENT; depth++) {
            SyntaxNode next = null;
            int count = current.childCount();
            for (int i = 0; i < count; i++) {
                SyntaxNode child = current.child(i);
                if (child == null) {
                    continue;
                }
                if (child.startRow() > row || (child.startRow() == row && child.startCol() > col)) {
                    break;
                }
                if (child.contains(row, col)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
        return current;
    }

    /**
     * Колонка первого непробельного символа строки или -1 для пустой строки.
     */
    public static int firstNonWhitespace(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (!Character.isWhitespace(line.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Колонка последнего непробельного символа строки или -1 для пустой строки.
     */
    public static int lastNonWhitespace(String line) {
        for (int i = line.length() - 1; i >= 0; i--) {
            if (!Character.isWhitespace(line.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Если курсор стоит в ведущих пробелах строки, переносит колонку на первый значащий символ.
     * Так курсор перед оператором попадает в сам оператор, а не в его контейнер.
     */
    public static int snapColumn(SyntaxTree tree, int row, int col) {
        int first = firstNonWhitespace(tree.line(row));
        if (first >= 0 && col < first) {
            return first;
        }
        return col;
    }

    /**
     * Узел под курсором с учетом переноса колонки из ведущих пробелов.
     */
    public static SyntaxNode locate(SyntaxTree tree, CursorPosition cursor) {
        int col = snapColumn(tree, cursor.row(), cursor.col());
        return smallestAt(tree.root(), cursor.row(), col);
    }
}
