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

import ru.nts.tools.jump.engine.SyntaxNode;

import java.util.List;

/**
 * Конструкция и ее граничные позиции в порядке обхода.
 */
public record BoundaryContext(SyntaxNode construct, List<BoundaryPosition> positions) {

    public BoundaryContext {
        positions = List.copyOf(positions);
    }

    /**
     * Есть ли позиция на строке курсора. Обработчик распознает конструкцию только в этом случае.
     */
    public boolean hasRow(int row) {
        for (BoundaryPosition position : positions) {
            if (position.row() == row) {
                return true;
            }
        }
        return false;
    }

    public BoundaryPosition first() {
        return positions.get(0);
    }

    public BoundaryPosition last() {
        return positions.get(positions.size() - 1);
    }
}
