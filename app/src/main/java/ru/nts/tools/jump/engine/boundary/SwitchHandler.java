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
import ru.nts.tools.jump.engine.detect.SwitchCaseDetector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * switch: ключевое слово, каждая ветка case/default, закрывающая скобка тела.
 */
public class SwitchHandler implements BoundaryHandler {

    private static final Set<String> SWITCH_KINDS = Set.of("switch_statement");

    @Override
    public String name() {
        return "switch";
    }

    @Override
    public Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor) {
        SyntaxNode switchNode = BoundaryHandler.findAncestor(node, SWITCH_KINDS);
        if (switchNode == null) {
            return Optional.empty();
        }
        BoundaryContext context = build(switchNode);
        return context.hasRow(cursor.row()) ? Optional.of(context) : Optional.empty();
    }

    static BoundaryContext build(SyntaxNode switchNode) {
        List<BoundaryPosition> positions = new ArrayList<>();
        positions.add(BoundaryPosition.startOf(switchNode, BoundaryKind.SWITCH_KEYWORD));

        SyntaxNode body = SwitchCaseDetector.switchBody(switchNode);
        if (body == null) {
            positions.add(BoundaryPosition.endOf(switchNode, BoundaryKind.CLOSING_BRACKET));
            return new BoundaryContext(switchNode, positions);
        }
        for (SyntaxNode clause : SwitchCaseDetector.collectCases(switchNode)) {
            BoundaryKind kind = clause.is("switch_default") ? BoundaryKind.DEFAULT_KEYWORD : BoundaryKind.CASE_KEYWORD;
            positions.add(BoundaryPosition.startOf(clause, kind));
        }
        positions.add(BoundaryPosition.endOf(body, BoundaryKind.CLOSING_BRACKET));
        return new BoundaryContext(switchNode, positions);
    }
}
