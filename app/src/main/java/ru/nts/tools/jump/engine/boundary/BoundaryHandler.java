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

import java.util.Optional;
import java.util.Set;

/**
 * Обработчик одного вида конструкций для циклического обхода границ.
 */
public interface BoundaryHandler {

    int MAX_ASCENT = 20;

    String name();

    /**
     * Строит контекст конструкции, если курсор стоит на одной из ее граничных строк.
     *
     * @param node   наименьший узел под курсором
     * @param cursor позиция курсора (0-based, колонка без переноса из отступа)
     */
    Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor);

    /**
     * Ближайший предок (включая сам узел) одного из типов.
     */
    static SyntaxNode findAncestor(SyntaxNode node, Set<String> kinds) {
        SyntaxNode current = node;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (kinds.contains(current.kind())) {
                return current;
            }
            current = current.parent();
        }
        return null;
    }

    static SyntaxNode findChild(SyntaxNode node, Set<String> kinds) {
        for (SyntaxNode child : node.children()) {
            if (kinds.contains(child.kind())) {
                return child;
            }
        }
        return null;
    }
}
