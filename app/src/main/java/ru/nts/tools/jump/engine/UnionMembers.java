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
import java.util.Set;

/**
 * Развертывание вложенных бинарных конструкций вида {@code A | B | C},
 * которые парсер представляет как цепочку вложенных узлов одного типа.
 */
public final class UnionMembers {

    private static final int MAX_DEPTH = 256;

    private UnionMembers() {}

    /**
     * Поднимается к самому внешнему узлу того же типа.
     */
    public static SyntaxNode outermost(SyntaxNode node, String operatorKind) {
        SyntaxNode current = node;
        for (int depth = 0; depth < MAX_DEPTH; depth++) {
            SyntaxNode parent = current.parent();
            if (parent == null || !parent.is(operatorKind)) {
                break;
            }
            current = parent;
        }
        return current;
    }

    /**
     * Собирает члены в порядке исходника, рекурсивно заходя во вложенные узлы типа operatorKind.
     * Операторы и прочие токены пропускаются.
     */
    public static List<SyntaxNode> flatten(SyntaxNode node, String operatorKind, Set<String> memberKinds) {
        List<SyntaxNode> members = new ArrayList<>();
        collect(node, operatorKind, memberKinds, members, 0);
        return members;
    }

    private static void collect(SyntaxNode node, String operatorKind, Set<String> memberKinds,
                                List<SyntaxNode> out, int depth) {
        if (depth >= MAX_DEPTH) {
            return;
        }
        for (SyntaxNode child : node.children()) {
            if (child.is(operatorKind)) {
                collect(child, operatorKind, memberKinds, out, depth + 1);
            } else if (memberKinds.contains(child.kind())) {
                out.add(child);
            }
        }
    }
}
