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
import ru.nts.tools.jump.engine.NodeClassifier;
import ru.nts.tools.jump.engine.SiblingLocator;
import ru.nts.tools.jump.engine.SyntaxNode;
import ru.nts.tools.jump.engine.TargetPositions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Лестница if / else if / else.
 * <p>
 * Поддерживаются два представления веток:
 * <ul>
 *   <li>JS/TS: {@code else_clause} с вложенным {@code if_statement} (рекурсивная цепочка);</li>
 *   <li>Python: {@code elif_clause} и {@code else_clause} как прямые дети {@code if_statement}.</li>
 * </ul>
 * Позиция 0 = голова, 1..N = ветки, N+1 = закрывающий токен (только для диалектов с явным терминатором).
 * На краях лестницы шаг уходит к соседу всей конструкции.
 */
public class IfLadderDetector implements ConstructDetector<IfLadderDetector.IfLadder> {

    private static final int MAX_ASCENT = 20;
    private static final int MAX_CHAIN = 256;

    static final Set<String> BRANCH_KINDS = Set.of("else_clause", "elif_clause");
    static final Set<String> BRANCH_KEYWORDS = Set.of("else", "elif");

    private static final Set<String> LADDER_KINDS = Set.of("if_statement", "else_clause", "elif_clause");

    private static final Set<String> STOP_KINDS = Set.of("statement_block", "block", "program", "module");

    /**
     * @param ifNode   самый внешний if лестницы
     * @param branches ветки в порядке исходника
     * @param position текущая позиция: 0 голова, 1..N ветка, N+1 закрывающий токен
     */
    public record IfLadder(SyntaxNode ifNode, List<SyntaxNode> branches, int position) {}

    private final SiblingLocator locator;
    private final DialectProfile dialect;

    public IfLadderDetector(SiblingLocator locator, DialectProfile dialect) {
        this.locator = locator;
        this.dialect = dialect;
    }

    @Override
    public String name() {
        return "if-ladder";
    }

    @Override
    public Optional<IfLadder> detect(SyntaxNode node, CursorPosition cursor) {
        if (node == null) {
            return Optional.empty();
        }

        // Курсор на обычном операторе внутри тела if не должен запускать лестницу
        SyntaxNode meaningful = node;
        for (int depth = 0; meaningful != null && !NodeClassifier.isMeaningful(meaningful) && depth < MAX_CHAIN; depth++) {
            meaningful = meaningful.parent();
        }
        if (meaningful != null && !LADDER_KINDS.contains(meaningful.kind())) {
            return Optional.empty();
        }

        SyntaxNode ifNode = null;
        SyntaxNode current = node;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (ifNode == null && current.is("if_statement")) {
                ifNode = current;
            }
            current = current.parent();
            if (current != null && STOP_KINDS.contains(current.kind())) {
                break;
            }
        }
        if (ifNode == null) {
            return Optional.empty();
        }
        ifNode = outermost(ifNode);

        List<SyntaxNode> branches = collectBranches(ifNode);
        if (branches.isEmpty()) {
            return Optional.empty();
        }

        int row = cursor.row();

        // Вложенные ветки перекрываются: берем самую внутреннюю
        int matched = -1;
        for (int i = 0; i < branches.size(); i++) {
            if (branches.get(i).spansRow(row)) {
                matched = i + 1;
            }
        }
        if (matched > 0) {
            return Optional.of(new IfLadder(ifNode, branches, matched));
        }

        if (row >= ifNode.startRow() && row < branches.get(0).startRow()) {
            if (insideHeadBody(ifNode, row)) {
                return Optional.empty();
            }
            return Optional.of(new IfLadder(ifNode, branches, 0));
        }

        if (dialect.explicitTerminator() && row == ifNode.endRow()) {
            return Optional.of(new IfLadder(ifNode, branches, branches.size() + 1));
        }
        return Optional.empty();
    }

    @Override
    public Optional<JumpTarget> step(IfLadder ladder, boolean forward) {
        List<SyntaxNode> branches = ladder.branches();
        int position = ladder.position();

        if (forward) {
            if (position < branches.size()) {
                return Optional.of(branchTarget(branches.get(position)));
            }
            return locator.next(ladder.ifNode(), ladder.ifNode().parent(), true).map(n -> entryTarget(n, true));
        }

        if (position == 0) {
            return locator.next(ladder.ifNode(), ladder.ifNode().parent(), false).map(n -> entryTarget(n, false));
        }
        if (position == 1) {
            return Optional.of(new JumpTarget(ladder.ifNode(), CursorPosition.startOf(ladder.ifNode())));
        }
        return Optional.of(branchTarget(branches.get(position - 2)));
    }

    @Override
    public BoundaryPolicy boundaryPolicy() {
        return BoundaryPolicy.FALLTHROUGH;
    }

    /**
     * Цель перехода на узел снаружи лестницы. При движении назад на if с ветками
     * курсор попадает на последнюю ветку, чтобы обратный обход зеркалил прямой.
     */
    public static JumpTarget entryTarget(SyntaxNode node, boolean forward) {
        if (!forward && node.is("if_statement")) {
            List<SyntaxNode> branches = collectBranches(node);
            if (!branches.isEmpty()) {
                return branchTarget(branches.get(branches.size() - 1));
            }
        }
        return JumpTarget.at(node);
    }

    /**
     * Ветки лестницы в порядке исходника, включая ветки вложенных else-if.
     */
    public static List<SyntaxNode> collectBranches(SyntaxNode ifNode) {
        List<SyntaxNode> branches = new ArrayList<>();
        SyntaxNode current = ifNode;
        for (int depth = 0; current != null && current.is("if_statement") && depth < MAX_CHAIN; depth++) {
            SyntaxNode nested = null;
            for (SyntaxNode child : current.children()) {
                if (!BRANCH_KINDS.contains(child.kind())) {
                    continue;
                }
                branches.add(child);
                if (child.is("else_clause")) {
                    nested = nestedIf(child);
                    break;
                }
            }
            current = nested;
        }
        return branches;
    }

    private static JumpTarget branchTarget(SyntaxNode branch) {
        return new JumpTarget(branch, TargetPositions.keyword(branch, BRANCH_KEYWORDS));
    }

    private static SyntaxNode nestedIf(SyntaxNode elseClause) {
        for (SyntaxNode child : elseClause.children()) {
            if (child.is("if_statement")) {
                return child;
            }
        }
        return null;
    }

    /**
     * Поднимается через else_clause к самому внешнему if цепочки.
     */
    private static SyntaxNode outermost(SyntaxNode ifNode) {
        SyntaxNode result = ifNode;
        for (int depth = 0; depth < MAX_CHAIN; depth++) {
            SyntaxNode parent = result.parent();
            if (parent == null || !parent.is("else_clause")) {
                break;
            }
            SyntaxNode outer = parent.parent();
            if (outer == null || !outer.is("if_statement")) {
                break;
            }
            result = outer;
        }
        return result;
    }

    /**
     * Курсор внутри тела головной ветки, начинающегося на следующей строке (Python).
     */
    private static boolean insideHeadBody(SyntaxNode ifNode, int row) {
        if (row == ifNode.startRow()) {
            return false;
        }
        for (SyntaxNode child : ifNode.children()) {
            if (child.is("block") && child.spansRow(row)) {
                return true;
            }
        }
        return false;
    }
}
