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
import java.util.Optional;

/**
 * Упорядоченный список соседей внутри области навигации и переход к следующему/предыдущему.
 * На краях списка переход не выполняется (никакого зацикливания).
 */
public class SiblingLocator {

    /**
     * Дети области в порядке исходника без пропускаемых узлов.
     * Для union_type возвращает развернутые члены объединения,
     * для JSX-элементов отбрасывает идентификатор имени тега.
     */
    public List<SyntaxNode> siblings(SyntaxNode scope) {
        if (scope == null) {
            return List.of();
        }
        if (scope.is(NodeKinds.UNION_TYPE)) {
            return UnionMembers.flatten(scope, NodeKinds.UNION_TYPE, NodeKinds.UNION_MEMBERS);
        }
        boolean tagLike = NodeKinds.JSX_ELEMENTS.contains(scope.kind());
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : scope.children()) {
            if (NodeClassifier.isSkippable(child)) {
                continue;
            }
            if (tagLike && child.is("identifier")) {
                continue;
            }
            result.add(child);
        }
        return result;
    }

    /**
     * Индекс узла в списке по позиции начала или -1.
     */
    public static int indexOf(SyntaxNode unit, List<SyntaxNode> siblings) {
        for (int i = 0; i < siblings.size(); i++) {
            SyntaxNode candidate = siblings.get(i);
            if (candidate.startRow() == unit.startRow() && candidate.startCol() == unit.startCol()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Следующий (forward) или предыдущий сосед единицы в области.
     *
     * @return соседний узел или empty на границе списка и когда единица не найдена в области
     */
    public Optional<SyntaxNode> next(SyntaxNode unit, SyntaxNode scope, boolean forward) {
        if (unit == null || scope == null) {
            return Optional.empty();
        }
        List<SyntaxNode> siblings = siblings(scope);
        int index = indexOf(unit, siblings);
        if (index < 0) {
            return Optional.empty();
        }
        int target = forward ? index + 1 : index - 1;
        if (target < 0 || target >= siblings.size()) {
            return Optional.empty();
        }
        return Optional.of(siblings.get(target));
    }
}
