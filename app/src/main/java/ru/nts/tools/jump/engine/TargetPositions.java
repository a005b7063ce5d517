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

import java.util.Set;

/**
 * Точка, куда ставится курсор при переходе на узел.
 */
public final class TargetPositions {

    private TargetPositions() {}

    /**
     * Начало узла; JSX-элементы ставят курсор на имя тега, а не на '&lt;'.
     */
    public static CursorPosition of(SyntaxNode node) {
        if (node.is("jsx_self_closing_element")) {
            SyntaxNode name = node.child(1);
            if (name != null && name.is("identifier")) {
                return CursorPosition.startOf(name);
            }
        } else if (node.is("jsx_element")) {
            SyntaxNode opening = node.child(0);
            if (opening != null && opening.is("jsx_opening_element")) {
                SyntaxNode name = opening.child(1);
                if (name != null && name.is("identifier")) {
                    return CursorPosition.startOf(name);
                }
            }
        }
        return CursorPosition.startOf(node);
    }

    /**
     * Позиция ключевого слова ветки (else, elif, except, case...) с откатом на начало ветки.
     */
    public static CursorPosition keyword(SyntaxNode clause, Set<String> keywordKinds) {
        for (SyntaxNode child : clause.children()) {
            if (keywordKinds.contains(child.kind())) {
                return CursorPosition.startOf(child);
            }
        }
        return CursorPosition.startOf(clause);
    }
}
