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

import java.util.ArrayList;
import java.util.List;

/**
 * Узел синтаксического дерева, доступный движку навигации только для чтения.
 * <p>
 * Координаты 0-based, конец диапазона исключающий (как в tree-sitter).
 * Колонки считаются в символах строки, а не в байтах.
 * Узлы создаются заново на каждый вызов навигации и не кэшируются движком.
 */
public interface SyntaxNode {

    /**
     * Тип узла грамматики (например, "if_statement", "identifier", "{").
     */
    String kind();

    int startRow();

    int startCol();

    int endRow();

    int endCol();

    /**
     * @return родительский узел или null для корня
     */
    SyntaxNode parent();

    int childCount();

    /**
     * @return дочерний узел по индексу или null, если индекс вне диапазона
     */
    SyntaxNode child(int index);

    /**
     * Дочерний узел по имени поля грамматики ("function", "value", "object"...).
     *
     * @return узел или null, если поле отсутствует
     */
    SyntaxNode field(String name);

    /**
     * Поле грамматики с откатом на ребенка по индексу (для грамматик без имен полей).
     */
    default SyntaxNode fieldOrChild(String name, int index) {
        SyntaxNode byField = field(name);
        return byField != null ? byField : child(index);
    }

    default List<SyntaxNode> children() {
        int count = childCount();
        List<SyntaxNode> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            SyntaxNode child = child(i);
            if (child != null) {
                result.add(child);
            }
        }
        return result;
    }

    default boolean is(String expectedKind) {
        return kind().equals(expectedKind);
    }

    /**
     * Сравнение узлов по типу и диапазону.
     * Обертки над нативными узлами создаются на каждый запрос, поэтому ссылочное сравнение не годится.
     */
    default boolean sameNode(SyntaxNode other) {
        return other != null
                && kind().equals(other.kind())
                && startRow() == other.startRow() && startCol() == other.startCol()
                && endRow() == other.endRow() && endCol() == other.endCol();
    }

    default boolean isEmptyRange() {
        return startRow() == endRow() && startCol() == endCol();
    }

    /**
     * Проверяет, попадает ли точка в диапазон узла: начало включительно, конец исключительно.
     */
    default boolean contains(int row, int col) {
        boolean afterStart = row > startRow() || (row == startRow() && col >= startCol());
        boolean beforeEnd = row < endRow() || (row == endRow() && col < endCol());
        return afterStart && beforeEnd;
    }

    /**
     * Проверяет, лежит ли строка в диапазоне строк узла (включая последнюю строку).
     */
    default boolean spansRow(int row) {
        return row >= startRow() && row <= endRow();
    }
}
