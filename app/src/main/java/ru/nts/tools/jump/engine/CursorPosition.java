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
 * Позиция курсора внутри движка (0-based строка и колонка).
 */
public record CursorPosition(int row, int col) {

    public static CursorPosition startOf(SyntaxNode node) {
        return new CursorPosition(node.startRow(), node.startCol());
    }

    /**
     * Формат для пользователя: 1-based строка и колонка.
     */
    public String format() {
        return (row + 1) + ":" + (col + 1);
    }
}
