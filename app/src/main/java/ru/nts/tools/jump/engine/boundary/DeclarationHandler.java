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
 * Объявления со значением: {@code const x = ...}, {@code type T = ...}, функции и методы.
 * Цикл между началом объявления и концом значения (тела).
 * <p>
 * Если значение является цепочкой вызовов, конец берется от всей цепочки:
 * значением декларатора является самый внешний вызов.
 */
public class DeclarationHandler implements BoundaryHandler {

    private static final Set<String> VARIABLE_KINDS = Set.of(
            "lexical_declaration", "variable_declaration",
            // Java
            "local_variable_declaration", "field_declaration"
    );

    private static final Set<String> TYPE_KINDS = Set.of("type_alias_declaration");

    private static final Set<String> FUNCTION_KINDS = Set.of(
            "function_declaration", "method_definition",
            "function_definition", "method_declaration", "constructor_declaration"
    );

    private static final Set<String> BODY_KINDS = Set.of("statement_block", "block", "constructor_body");

    /**
     * Служебные дети декларатора, которые не могут быть значением.
     */
    private static final Set<String> NOT_A_VALUE = Set.of(";", "=", "identifier", "type_annotation");

    @Override
    public String name() {
        return "declaration";
    }

    @Override
    public Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor) {
        int row = cursor.row();

        if (node.is("export")) {
            SyntaxNode export = node.parent();
            if (export != null && export.is("export_statement")) {
                for (SyntaxNode child : export.children()) {
                    if (VARIABLE_KINDS.contains(child.kind())) {
                        Optional<BoundaryContext> context = variableContext(child).filter(c -> c.hasRow(row));
                        if (context.isPresent()) {
                            return context;
                        }
                    }
                }
            }
        }

        SyntaxNode declaration = BoundaryHandler.findAncestor(node, VARIABLE_KINDS);
        if (declaration != null) {
            Optional<BoundaryContext> context = variableContext(declaration).filter(c -> c.hasRow(row));
            if (context.isPresent()) {
                return context;
            }
        }

        SyntaxNode typeAlias = BoundaryHandler.findAncestor(node, TYPE_KINDS);
        if (typeAlias != null) {
            SyntaxNode value = typeValue(typeAlias);
            if (value != null) {
                BoundaryContext context = new BoundaryContext(typeAlias, List.of(
                        BoundaryPosition.startOf(typeAlias, BoundaryKind.TYPE_KEYWORD),
                        BoundaryPosition.endOf(value, BoundaryKind.CLOSING_BRACKET)
                ));
                if (context.hasRow(row)) {
                    return Optional.of(context);
                }
            }
        }

        SyntaxNode function = BoundaryHandler.findAncestor(node, FUNCTION_KINDS);
        if (function != null) {
            SyntaxNode body = BoundaryHandler.findChild(function, BODY_KINDS);
            BoundaryContext context = new BoundaryContext(function, List.of(
                    BoundaryPosition.startOf(function, BoundaryKind.FUNCTION_KEYWORD),
                    BoundaryPosition.endOf(body != null ? body : function, BoundaryKind.CLOSING_BRACKET)
            ));
            if (context.hasRow(row)) {
                return Optional.of(context);
            }
        }
        return Optional.empty();
    }

    private static Optional<BoundaryContext> variableContext(SyntaxNode declaration) {
        SyntaxNode value = variableValue(declaration);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(new BoundaryContext(declaration, List.of(
                BoundaryPosition.startOf(declaration, BoundaryKind.DECLARATION_KEYWORD),
                BoundaryPosition.endOf(value, BoundaryKind.CLOSING_BRACKET)
        )));
    }

    /**
     * Значение первого декларатора: поле value, а для грамматик без полей последний содержательный ребенок.
     */
    static SyntaxNode variableValue(SyntaxNode declaration) {
        SyntaxNode declarator = BoundaryHandler.findChild(declaration, Set.of("variable_declarator"));
        if (declarator == null) {
            return null;
        }
        SyntaxNode value = declarator.field("value");
        if (value != null) {
            return value;
        }
        for (int i = declarator.childCount() - 1; i >= 0; i--) {
            SyntaxNode child = declarator.child(i);
            if (child != null && !NOT_A_VALUE.contains(child.kind())) {
                return child;
            }
        }
        return null;
    }

    static SyntaxNode typeValue(SyntaxNode typeAlias) {
        SyntaxNode value = typeAlias.field("value");
        if (value == null) {
            value = typeAlias.child(3);
        }
        return value != null && !value.is(";") ? value : null;
    }
}
