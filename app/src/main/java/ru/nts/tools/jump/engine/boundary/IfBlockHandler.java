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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Лестница if: {@code if}, каждая ветка else if / elif / else, конец последнего блока.
 * <p>
 * Ветки собираются для трех представлений: else_clause с вложенным if (JS/TS),
 * плоские elif_clause/else_clause (Python)
 * и голый токен {@code else} с альтернативой в том же if_statement (Java).
 */
public class IfBlockHandler implements BoundaryHandler {

    private static final int MAX_CHAIN = 256;

    private static final Set<String> IF_KINDS = Set.of("if_statement");
    private static final Set<String> BLOCK_KINDS = Set.of("statement_block", "block");

    @Override
    public String name() {
        return "if-block";
    }

    @Override
    public Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor) {
        SyntaxNode ifNode = BoundaryHandler.findAncestor(node, IF_KINDS);
        if (ifNode == null) {
            return Optional.empty();
        }
        SyntaxNode outermost = outermost(ifNode);
        BoundaryContext context = build(outermost);
        return context.hasRow(cursor.row()) ? Optional.of(context) : Optional.empty();
    }

    static BoundaryContext build(SyntaxNode ifNode) {
        List<BoundaryPosition> positions = new ArrayList<>();
        positions.add(BoundaryPosition.startOf(ifNode, BoundaryKind.IF_KEYWORD));
        collectBranches(ifNode, positions, 0);
        positions.add(closing(ifNode));
        return new BoundaryContext(ifNode, positions);
    }

    private static void collectBranches(SyntaxNode ifNode, List<BoundaryPosition> positions, int depth) {
        if (depth >= MAX_CHAIN) {
            return;
        }
        List<SyntaxNode> children = ifNode.children();
        for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            switch (child.kind()) {
                case "else_clause" -> {
                    SyntaxNode nested = BoundaryHandler.findChild(child, IF_KINDS);
                    positions.add(BoundaryPosition.startOf(child,
                            nested != null ? BoundaryKind.ELSE_IF_KEYWORD : BoundaryKind.ELSE_KEYWORD));
                    if (nested != null) {
                        collectBranches(nested, positions, depth + 1);
                    }
                }
                case "else" -> {
                    // Java: else и альтернатива лежат прямо в if_statement
                    SyntaxNode alternative = i + 1 < children.size() ? children.get(i + 1) : null;
                    boolean elseIf = alternative != null && alternative.is("if_statement");
                    positions.add(BoundaryPosition.startOf(child,
                            elseIf ? BoundaryKind.ELSE_IF_KEYWORD : BoundaryKind.ELSE_KEYWORD));
                    if (elseIf) {
                        collectBranches(alternative, positions, depth + 1);
                    }
                }
                case "elif_clause" -> positions.add(BoundaryPosition.startOf(child, BoundaryKind.ELIF_KEYWORD));
                default -> {
                }
            }
        }
    }

    /**
     * Конец последнего блока лестницы с учетом вложенных else if.
     */
    private static BoundaryPosition closing(SyntaxNode ifNode) {
        SyntaxNode current = ifNode;
        for (int depth = 0; depth < MAX_CHAIN; depth++) {
            SyntaxNode last = null;
            for (SyntaxNode child : current.children()) {
                if (BLOCK_KINDS.contains(child.kind()) || child.is("else_clause") || child.is("elif_clause")
                        || (child.is("if_statement") && isElseAlternative(current, child))) {
                    last = child;
                }
            }
            if (last == null) {
                return BoundaryPosition.endOf(current, BoundaryKind.CLOSING_BRACKET);
            }
            if (last.is("if_statement")) {
                current = last;
                continue;
            }
            if (last.is("else_clause") || last.is("elif_clause")) {
                SyntaxNode nested = BoundaryHandler.findChild(last, IF_KINDS);
                if (nested != null) {
                    current = nested;
                    continue;
                }
                SyntaxNode block = BoundaryHandler.findChild(last, BLOCK_KINDS);
                return BoundaryPosition.endOf(block != null ? block : last, BoundaryKind.CLOSING_BRACKET);
            }
            return BoundaryPosition.endOf(last, BoundaryKind.CLOSING_BRACKET);
        }
        return BoundaryPosition.endOf(ifNode, BoundaryKind.CLOSING_BRACKET);
    }

    private static SyntaxNode outermost(SyntaxNode ifNode) {
        SyntaxNode current = ifNode;
        for (int depth = 0; depth < MAX_ASCENT; depth++) {
            SyntaxNode parent = current.parent();
            if (parent == null) {
                break;
            }
            if (parent.is("else_clause")) {
                SyntaxNode outer = parent.parent();
                if (outer == null || !outer.is("if_statement")) {
                    break;
                }
                current = outer;
            } else if (parent.is("if_statement") && isElseAlternative(parent, current)) {
                // Java: else if вложен прямо в альтернативу внешнего if
                current = parent;
            } else {
                break;
            }
        }
        return current;
    }

    private static boolean isElseAlternative(SyntaxNode ifNode, SyntaxNode candidate) {
        List<SyntaxNode> children = ifNode.children();
        for (int i = 1; i < children.size(); i++) {
            if (children.get(i).sameNode(candidate)) {
                return children.get(i - 1).is("else");
            }
        }
        return false;
    }
}
