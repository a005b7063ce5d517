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

/**
 * Свойство объекта, значение которого является вызовом: {@code propName: value.method().chain()}.
 * Цикл между именем свойства и закрывающей скобкой значения.
 * <p>
 * Срабатывает на строке ключа, на закрывающей скобке значения и на первом идентификаторе значения.
 * Середину цепочки оставляет обработчику вызовов.
 */
public class PropertyValueHandler implements BoundaryHandler {

    private static final int CLOSING_TOLERANCE = 2;

    @Override
    public String name() {
        return "property-value";
    }

    @Override
    public Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor) {
        SyntaxNode pair = findPair(node);
        if (pair == null) {
            return Optional.empty();
        }
        SyntaxNode key = pair.fieldOrChild("key", 0);
        SyntaxNode value = pair.fieldOrChild("value", 2);
        if (key == null || value == null || !value.is("call_expression")) {
            return Optional.empty();
        }

        int row = cursor.row();
        int col = cursor.col();
        boolean onKey = row == key.startRow();
        boolean onClosing = row == value.endRow() && Math.abs(col - (value.endCol() - 1)) <= CLOSING_TOLERANCE;
        SyntaxNode first = firstIdentifier(value);
        boolean onValueStart = first != null && row == first.startRow()
                && col >= first.startCol() && col <= first.endCol();

        if (!onKey && !onClosing && !onValueStart) {
            return Optional.empty();
        }
        return Optional.of(new BoundaryContext(value, List.of(
                BoundaryPosition.startOf(key, BoundaryKind.PROPERTY_NAME),
                BoundaryPosition.closingOf(value, BoundaryKind.CLOSING_PAREN)
        )));
    }

    /**
     * Ближайшая пара key: value. Объект, который сам является значением внешней пары,
     * ограничивает подъем: вложенное свойство не должно захватываться внешним.
     */
    private static SyntaxNode findPair(SyntaxNode node) {
        SyntaxNode current = node;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (current.is("pair")) {
                return current;
            }
            if (current.is("object")) {
                SyntaxNode owner = current.parent();
                if (owner != null && owner.is("pair") && current.sameNode(owner.fieldOrChild("value", 2))) {
                    return null;
                }
            }
            current = current.parent();
        }
        return null;
    }

    /**
     * Самый левый идентификатор выражения: {@code api} в {@code api.get().then()}.
     */
    private static SyntaxNode firstIdentifier(SyntaxNode expression) {
        SyntaxNode current = expression;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (current.is("identifier")) {
                return current;
            }
            if (current.is("member_expression")) {
                current = current.fieldOrChild("object", 0);
            } else if (current.is("call_expression")) {
                current = current.fieldOrChild("function", 0);
            } else {
                current = current.child(0);
            }
        }
        return null;
    }
}
