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
package ru.nts.tools.jump.engine.detect;

import ru.nts.tools.jump.engine.CursorPosition;
import ru.nts.tools.jump.engine.JumpTarget;
import ru.nts.tools.jump.engine.SiblingLocator;
import ru.nts.tools.jump.engine.SyntaxNode;
import ru.nts.tools.jump.engine.TargetPositions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Лестница try / except (catch) / else / finally.
 * Позиция 0 = тело try, 1..N = ветки; на краях шаг уходит к соседу всей конструкции.
 */
public class TryLadderDetector implements ConstructDetector<TryLadderDetector.TryLadder> {

    private static final int MAX_ASCENT = 20;

    private static final Set<String> CLAUSE_KINDS = Set.of("except_clause", "catch_clause", "finally_clause");
    private static final Set<String> CLAUSE_KEYWORDS = Set.of("except", "catch", "else", "finally");
    private static final Set<String> STOP_KINDS = Set.of("block", "module", "statement_block");

    /**
     * @param tryNode  узел try_statement
     * @param clauses  ветки в порядке исходника
     * @param position 0 = try, 1..N = ветка
     */
    public record TryLadder(SyntaxNode tryNode, List<SyntaxNode> clauses, int position) {}

    private final SiblingLocator locator;

    public TryLadderDetector(SiblingLocator locator) {
        this.locator = locator;
    }

    @Override
    public String name() {
        return "try-ladder";
    }

    @Override
    public Optional<TryLadder> detect(SyntaxNode node, CursorPosition cursor) {
        SyntaxNode tryNode = null;
        SyntaxNode current = node;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (current.is("try_statement")) {
                tryNode = current;
                break;
            }
            if (isClause(current)) {
                tryNode = current.parent();
                break;
            }
            // Курсор внутри тела ветки: это обычный оператор, а не заголовок
            if (STOP_KINDS.contains(current.kind())) {
                break;
            }
            current = current.parent();
        }
        if (tryNode == null || !tryNode.is("try_statement")) {
            return Optional.empty();
        }

        List<SyntaxNode> clauses = collectClauses(tryNode);
        if (clauses.isEmpty()) {
            return Optional.empty();
        }

        int row = cursor.row();

        // На строке "} finally {" заканчивается catch и начинается finally: побеждает начинающаяся ветка
        int matched = -1;
        for (int i = 0; i < clauses.size(); i++) {
            SyntaxNode clause = clauses.get(i);
            if (clause.startRow() == row) {
                matched = i + 1;
                break;
            }
            if (clause.spansRow(row)) {
                matched = i + 1;
            }
        }
        if (matched > 0) {
            return Optional.of(new TryLadder(tryNode, clauses, matched));
        }
        if (row >= tryNode.startRow() && row < clauses.get(0).startRow()) {
            return Optional.of(new TryLadder(tryNode, clauses, 0));
        }
        return Optional.empty();
    }

    @Override
    public Optional<JumpTarget> step(TryLadder ladder, boolean forward) {
        List<SyntaxNode> clauses = ladder.clauses();
        int position = ladder.position();

        if (forward) {
            if (position < clauses.size()) {
                return Optional.of(clauseTarget(clauses.get(position)));
            }
            return locator.next(ladder.tryNode(), ladder.tryNode().parent(), true)
                    .map(n -> IfLadderDetector.entryTarget(n, true));
        }

        if (position == 0) {
            return locator.next(ladder.tryNode(), ladder.tryNode().parent(), false)
                    .map(n -> IfLadderDetector.entryTarget(n, false));
        }
        if (position == 1) {
            return Optional.of(new JumpTarget(ladder.tryNode(), CursorPosition.startOf(ladder.tryNode())));
        }
        return Optional.of(clauseTarget(clauses.get(position - 2)));
    }

    @Override
    public BoundaryPolicy boundaryPolicy() {
        return BoundaryPolicy.FALLTHROUGH;
    }

    public static List<SyntaxNode> collectClauses(SyntaxNode tryNode) {
        List<SyntaxNode> clauses = new ArrayList<>();
        for (SyntaxNode child : tryNode.children()) {
            if (isClause(child)) {
                clauses.add(child);
            }
        }
        return clauses;
    }

    /**
     * Ветка try: except/catch/finally, а также else, если он принадлежит именно try.
     */
    private static boolean isClause(SyntaxNode node) {
        if (CLAUSE_KINDS.contains(node.kind())) {
            return true;
        }
        SyntaxNode parent = node.parent();
        return node.is("else_clause") && parent != null && parent.is("try_statement");
    }

    private static JumpTarget clauseTarget(SyntaxNode clause) {
        return new JumpTarget(clause, TargetPositions.keyword(clause, CLAUSE_KEYWORDS));
    }
}
