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
package ru.nts.tools.jump.engine.boundary;

import ru.nts.tools.jump.engine.CursorPosition;
import ru.nts.tools.jump.engine.SyntaxNode;

/**
 * Граничная позиция конструкции (0-based).
 */
public record BoundaryPosition(int row, int col, BoundaryKind kind) {

    /**
     * Начало узла.
     */
    public static BoundaryPosition startOf(SyntaxNode node, BoundaryKind kind) {
        return new BoundaryPosition(node.startRow(), node.startCol(), kind);
    }

    /**
     * Конец узла (исключительная граница): позиция сразу за последним символом.
     */
    public static BoundaryPosition endOf(SyntaxNode node, BoundaryKind kind) {
        return new BoundaryPosition(node.endRow(), node.endCol(), kind);
    }

    /**
     * Последний символ узла: курсор встает на закрывающую скобку вызова, а не на терминатор за ней.
     */
    public static BoundaryPosition closingOf(SyntaxNode node, BoundaryKind kind) {
        return new BoundaryPosition(node.endRow(), Math.max(0, node.endCol() - 1), kind);
    }

    public CursorPosition position() {
        return new CursorPosition(row, col);
    }
}
