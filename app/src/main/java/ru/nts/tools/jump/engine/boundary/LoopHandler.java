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

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Циклы for/while: ключевое слово и конец тела.
 */
public class LoopHandler implements BoundaryHandler {

    private static final Set<String> LOOP_KINDS = Set.of(
            // JS/TS, Python, Java
            "for_statement", "while_statement", "for_in_statement",
            "enhanced_for_statement", "do_statement"
    );

    private static final Set<String> BODY_KINDS = Set.of("statement_block", "block");

    @Override
    public String name() {
        return "loop";
    }

    @Override
    public Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor) {
        SyntaxNode loop = BoundaryHandler.findAncestor(node, LOOP_KINDS);
        if (loop == null) {
            return Optional.empty();
        }
        BoundaryContext context = new BoundaryContext(loop, List.of(
                BoundaryPosition.startOf(loop, BoundaryKind.LOOP_KEYWORD),
                closing(loop)
        ));
        return context.hasRow(cursor.row()) ? Optional.of(context) : Optional.empty();
    }

    private static BoundaryPosition closing(SyntaxNode loop) {
        SyntaxNode body = BoundaryHandler.findChild(loop, BODY_KINDS);
        return BoundaryPosition.endOf(body != null ? body : loop, BoundaryKind.CLOSING_BRACKET);
    }
}
