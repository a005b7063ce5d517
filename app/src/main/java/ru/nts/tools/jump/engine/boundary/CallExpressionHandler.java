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
 * Вызов функции или метода: цикл между именем (или {@code await}) и закрывающей скобкой.
 * <p>
 * Распознается в трех случаях:
 * <ol>
 *   <li>курсор на {@code await}, за которым следует вызов;</li>
 *   <li>курсор на имени вызываемой функции или на части пути к методу ({@code analytics.foo.capture()});</li>
 *   <li>курсор на последней строке объемлющего вызова (возврат с закрывающей скобки).</li>
 * </ol>
 * Если вызов обернут в await, обе границы берутся от обертки.
 */
public class CallExpressionHandler implements BoundaryHandler {

    private static final int MAX_CALL_ASCENT = 256;

    /**
     * Вызов и обертка await (может быть null).
     */
    record CallSite(SyntaxNode call, SyntaxNode awaitExpression) {}

    @Override
    public String name() {
        return "call-expression";
    }

    @Override
    public Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor) {
        int row = cursor.row();

        if (node.is("await")) {
            SyntaxNode awaitExpression = node.parent();
            if (awaitExpression != null && awaitExpression.is("await_expression") && node.startRow() == row) {
                SyntaxNode call = BoundaryHandler.findChild(awaitExpression, Set.of("call_expression"));
                if (call != null) {
                    return Optional.of(context(new CallSite(call, awaitExpression), node));
                }
            }
        }

        if (node.is("property_identifier") || node.is("identifier")) {
            CallSite site = findCallSite(node);
            if (site != null && node.startRow() == row) {
                return Optional.of(context(site, node));
            }
        }

        SyntaxNode current = node.parent();
        for (int depth = 0; current != null && depth < MAX_CALL_ASCENT; depth++) {
            if (current.is("call_expression") && current.endRow() == row) {
                CallSite site = new CallSite(current, awaitOf(current));
                SyntaxNode name = nameNode(site);
                if (name != null) {
                    return Optional.of(context(site, name));
                }
            }
            current = current.parent();
        }
        return Optional.empty();
    }

    private static BoundaryContext context(CallSite site, SyntaxNode nameNode) {
        SyntaxNode end = site.awaitExpression() != null ? site.awaitExpression() : site.call();
        BoundaryKind startKind = nameNode.is("await") ? BoundaryKind.AWAIT_KEYWORD : BoundaryKind.CALL_NAME;
        return new BoundaryContext(site.call(), List.of(
                BoundaryPosition.startOf(nameNode, startKind),
                BoundaryPosition.closingOf(end, BoundaryKind.CLOSING_PAREN)
        ));
    }

    /**
     * Поднимается от имени через цепочку member_expression к вызову,
     * в котором этот путь является вызываемой функцией, а не аргументом.
     */
    static CallSite findCallSite(SyntaxNode node) {
        SyntaxNode current = node;
        for (int depth = 0; depth < MAX_ASCENT; depth++) {
            SyntaxNode parent = current.parent();
            if (parent == null) {
                return null;
            }
            if (current.is("member_expression")) {
                if (parent.is("call_expression")) {
                    return current.sameNode(callee(parent)) ? new CallSite(parent, awaitOf(parent)) : null;
                }
                if (!parent.is("member_expression")) {
                    return null;
                }
                current = parent;
            } else if (current.is("identifier") && parent.is("call_expression")) {
                return current.sameNode(callee(parent)) ? new CallSite(parent, awaitOf(parent)) : null;
            } else if (current.is("identifier") && parent.is("member_expression")) {
                if (!current.sameNode(parent.fieldOrChild("object", 0))) {
                    return null;
                }
                current = parent;
            } else if (current.is("property_identifier") && parent.is("member_expression")) {
                current = parent;
            } else {
                return null;
            }
        }
        return null;
    }

    /**
     * Узел начальной позиции: await, имя метода или имя функции.
     */
    static SyntaxNode nameNode(CallSite site) {
        if (site.awaitExpression() != null) {
            SyntaxNode keyword = BoundaryHandler.findChild(site.awaitExpression(), Set.of("await"));
            if (keyword != null) {
                return keyword;
            }
        }
        SyntaxNode function = callee(site.call());
        if (function == null) {
            return null;
        }
        if (function.is("member_expression")) {
            return function.fieldOrChild("property", 2);
        }
        return function.is("identifier") ? function : null;
    }

    private static SyntaxNode callee(SyntaxNode call) {
        return call.fieldOrChild("function", 0);
    }

    private static SyntaxNode awaitOf(SyntaxNode call) {
        SyntaxNode parent = call.parent();
        return parent != null && parent.is("await_expression") ? parent : null;
    }
}
