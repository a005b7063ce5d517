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
import ru.nts.tools.jump.engine.NodeLocator;
import ru.nts.tools.jump.engine.SyntaxNode;
import ru.nts.tools.jump.engine.SyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Циклический обход границ конструкции под курсором.
 * <p>
 * Обработчики опрашиваются от самого специфичного к самому общему; первый распознавший
 * строит список позиций, и курсор переходит на следующую позицию по кругу.
 * В отличие от навигации по соседям, обход границ всегда замыкается.
 */
public class BoundaryCycler {

    /**
     * Результат одного шага: обработчик, его контекст, текущий и следующий индексы.
     * Текущий индекс -1 означает курсор внутри конструкции вне граничных позиций.
     */
    public record Cycle(String handler, BoundaryContext context, int current, int next) {

        public BoundaryPosition target() {
            return context.positions().get(next);
        }
    }

    private final List<BoundaryHandler> handlers;
    private final boolean debug;

    public BoundaryCycler(List<BoundaryHandler> handlers, boolean debug) {
        this.handlers = List.copyOf(handlers);
        this.debug = debug;
    }

    /**
     * Обработчики в порядке приоритета: свойство со значением-вызовом, вызов, switch, цикл, if, объявление.
     */
    public static BoundaryCycler standard(boolean debug) {
        return new BoundaryCycler(List.of(
                new PropertyValueHandler(),
                new CallExpressionHandler(),
                new SwitchHandler(),
                new LoopHandler(),
                new IfBlockHandler(),
                new DeclarationHandler()
        ), debug);
    }

    /**
     * Опрашивает обработчики по приоритету. Контекст, одна из позиций которого совпадает с курсором точно,
     * важнее более приоритетного контекста, распознавшего только строку: так конец объявления,
     * стоящий сразу за вызовом, не перехватывается обработчиком вызова.
     * Обработчик, который не может сдвинуть курсор, уступает следующему.
     */
    public Optional<Cycle> cycle(SyntaxTree tree, CursorPosition cursor) {
        SyntaxNode node = NodeLocator.smallestAt(tree.root(), cursor.row(), locateColumn(tree, cursor));

        Cycle fallback = null;
        for (BoundaryHandler handler : handlers) {
            Optional<BoundaryContext> detected = handler.detect(node, cursor);
            if (detected.isEmpty() || detected.get().positions().isEmpty()) {
                continue;
            }
            BoundaryContext context = detected.get();
            int current = currentIndex(context, cursor);
            int next = (current + 1) % context.positions().size();
            Cycle cycle = new Cycle(handler.name(), context, current, next);
            if (cycle.target().position().equals(cursor)) {
                debug("Handler " + handler.name() + " cannot move from " + cursor.format());
                continue;
            }
            if (indexOf(context, cursor) >= 0) {
                return found(cycle, cursor);
            }
            if (fallback == null) {
                fallback = cycle;
            }
        }
        if (fallback != null) {
            return found(fallback, cursor);
        }
        debug("No construct boundary at " + cursor.format());
        return Optional.empty();
    }

    private Optional<Cycle> found(Cycle cycle, CursorPosition cursor) {
        debug("Handler " + cycle.handler() + " at " + cursor.format() + ": position " + cycle.current()
                + " -> " + cycle.next() + " of " + cycle.context().positions().size());
        return Optional.of(cycle);
    }

    /**
     * Колонка для поиска узла: из ведущих пробелов курсор переносится на первый символ строки,
     * из-за конца строки на последний значащий символ. Закрывающие позиции стоят сразу за скобкой,
     * и курсор на них должен попасть в саму конструкцию.
     */
    static int locateColumn(SyntaxTree tree, CursorPosition cursor) {
        String line = tree.line(cursor.row());
        int col = NodeLocator.snapColumn(tree, cursor.row(), cursor.col());
        int last = NodeLocator.lastNonWhitespace(line);
        if (last >= 0 && col > last) {
            return last;
        }
        return col;
    }

    private static int indexOf(BoundaryContext context, CursorPosition cursor) {
        List<BoundaryPosition> positions = context.positions();
        for (int i = 0; i < positions.size(); i++) {
            if (positions.get(i).position().equals(cursor)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Индекс позиции курсора:
     * <ol>
     *   <li>позиция на той же строке с ближайшей колонкой;</li>
     *   <li>курсор внутри конструкции вне граничных строк: -1, следующей будет голова;</li>
     *   <li>иначе позиция с ближайшей строкой.</li>
     * </ol>
     * При равенстве расстояний побеждает более ранняя позиция.
     */
    public static int currentIndex(BoundaryContext context, CursorPosition cursor) {
        List<BoundaryPosition> positions = context.positions();

        int best = -1;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < positions.size(); i++) {
            BoundaryPosition position = positions.get(i);
            if (position.row() == cursor.row()) {
                int distance = Math.abs(position.col() - cursor.col());
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = i;
                }
            }
        }
        if (best >= 0) {
            return best;
        }

        if (context.construct() != null && context.construct().spansRow(cursor.row())) {
            return -1;
        }

        bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < positions.size(); i++) {
            int distance = Math.abs(positions.get(i).row() - cursor.row());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    private void debug(String message) {
        if (debug) {
            System.err.println("[BOUNDARY] " + message);
        }
    }
}
