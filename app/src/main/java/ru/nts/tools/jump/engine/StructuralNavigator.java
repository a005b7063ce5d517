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

import ru.nts.tools.jump.engine.boundary.BoundaryCycler;
import ru.nts.tools.jump.engine.boundary.BoundaryPosition;
import ru.nts.tools.jump.engine.boundary.BoundaryResult;
import ru.nts.tools.jump.engine.boundary.CycleMode;
import ru.nts.tools.jump.engine.detect.BoundaryPolicy;
import ru.nts.tools.jump.engine.detect.ConstructDetector;
import ru.nts.tools.jump.engine.detect.DetectorChain;
import ru.nts.tools.jump.engine.detect.DialectProfile;
import ru.nts.tools.jump.engine.detect.IfLadderDetector;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Точка входа движка структурной навигации.
 * <p>
 * Два режима:
 * <ul>
 *   <li>{@link #navigateSibling}: переход к соседу того же синтаксического уровня.
 *       Сначала опрашиваются детекторы конструкций, затем обычный поиск соседей.
 *       На границах переход не выполняется;</li>
 *   <li>{@link #cycleBoundary}: обход граничных позиций одной конструкции по кругу.</li>
 * </ul>
 * Исключения наружу не выходят: результат либо позиция, либо no-op ({@code Optional.empty()}).
 * Узлы дерева не кэшируются между вызовами, каждый шаг заново разрешает позицию курсора.
 */
public class StructuralNavigator {

    /**
     * Итог одного шага. terminal: после перехода повтор прекращается (маркеры пробелов и комментариев).
     */
    private record Step(CursorPosition target, boolean terminal) {

        static final Step NONE = new Step(null, true);

        static Step move(CursorPosition target) {
            return new Step(target, false);
        }

        static Step last(CursorPosition target) {
            return new Step(target, true);
        }
    }

    private final UnitResolver resolver;
    private final SiblingLocator locator;
    private final Function<DialectProfile, List<ConstructDetector<?>>> detectorBank;
    private final BoundaryCycler boundaryCycler;
    private final boolean debug;

    public StructuralNavigator(UnitResolver resolver, SiblingLocator locator,
                               Function<DialectProfile, List<ConstructDetector<?>>> detectorBank,
                               BoundaryCycler boundaryCycler, boolean debug) {
        this.resolver = resolver;
        this.locator = locator;
        this.detectorBank = detectorBank;
        this.boundaryCycler = boundaryCycler;
        this.debug = debug;
    }

    /**
     * Навигатор со стандартным порядком детекторов и обработчиков границ.
     */
    public static StructuralNavigator standard(boolean debug) {
        SiblingLocator locator = new SiblingLocator();
        return new StructuralNavigator(new UnitResolver(), locator,
                dialect -> DetectorChain.standard(locator, dialect),
                BoundaryCycler.standard(debug), debug);
    }

    /**
     * Переход к соседу, повторенный count раз. Повтор прекращается на первом шаге без цели.
     *
     * @return позиция после последнего выполненного перехода или empty, если курсор не сдвинулся
     */
    public Optional<CursorPosition> navigateSibling(EditorHost host, boolean forward, int count) {
        if (!host.navigationActive()) {
            debug("Navigation disabled for document");
            return Optional.empty();
        }

        CursorPosition last = null;
        int repeats = Math.max(1, count);
        for (int i = 0; i < repeats; i++) {
            Optional<SyntaxTree> tree = host.tree();
            if (tree.isEmpty()) {
                debug("No syntax tree available");
                break;
            }
            Step step = step(tree.get(), host.cursor(), forward);
            if (step.target() == null) {
                break;
            }
            host.pushJumpHistory();
            host.moveCursor(step.target());
            last = step.target();
            if (step.terminal()) {
                break;
            }
        }
        return Optional.ofNullable(last);
    }

    /**
     * Один шаг обхода границ конструкции под курсором.
     * В режиме выделения выделяет всю конструкцию, если у нее хотя бы две границы.
     */
    public Optional<BoundaryResult> cycleBoundary(EditorHost host, CycleMode mode) {
        if (!host.navigationActive()) {
            debug("Navigation disabled for document");
            return Optional.empty();
        }
        Optional<SyntaxTree> tree = host.tree();
        if (tree.isEmpty()) {
            debug("No syntax tree available");
            return Optional.empty();
        }

        Optional<BoundaryCycler.Cycle> cycle = boundaryCycler.cycle(tree.get(), host.cursor());
        if (cycle.isEmpty()) {
            return Optional.empty();
        }
        BoundaryCycler.Cycle found = cycle.get();

        if (mode == CycleMode.SELECT_RANGE && found.context().positions().size() >= 2) {
            BoundaryPosition first = found.context().first();
            BoundaryPosition last = found.context().last();
            host.select(first.position(), last.position());
            return Optional.of(BoundaryResult.selected(found.handler(), first, last));
        }

        BoundaryPosition target = found.target();
        host.pushJumpHistory();
        host.moveCursor(target.position());
        return Optional.of(BoundaryResult.moved(found.handler(), target));
    }

    private Step step(SyntaxTree tree, CursorPosition cursor, boolean forward) {
        SyntaxNode node = NodeLocator.locate(tree, cursor);

        for (ConstructDetector<?> detector : detectorBank.apply(DialectProfile.of(tree.langId()))) {
            Optional<Step> decided = runDetector(detector, node, cursor, forward);
            if (decided.isPresent()) {
                return decided.get();
            }
        }

        Resolution resolution = resolver.resolve(tree, cursor.row(), cursor.col());
        if (!resolution.isFound()) {
            debug("No unit at " + cursor.format() + ": " + resolution.reason());
            return Step.NONE;
        }

        NavigationUnit unit = resolution.unit();
        if (unit.isMarker()) {
            return unit.markerTarget(forward)
                    .map(target -> Step.last(TargetPositions.of(target)))
                    .orElse(Step.NONE);
        }
        if (resolution.scope() == null) {
            return Step.NONE;
        }

        return locator.next(unit.node(), resolution.scope(), forward)
                .map(sibling -> Step.move(IfLadderDetector.entryTarget(sibling, forward).position()))
                .orElse(Step.NONE);
    }

    /**
     * @return решение детектора или empty, если детектор не распознал курсор либо уступил обычной навигации
     */
    private <C> Optional<Step> runDetector(ConstructDetector<C> detector, SyntaxNode node,
                                           CursorPosition cursor, boolean forward) {
        Optional<C> context = detector.detect(node, cursor);
        if (context.isEmpty()) {
            return Optional.empty();
        }
        Optional<JumpTarget> target = detector.step(context.get(), forward);
        if (target.isPresent()) {
            debug(detector.name() + " -> " + target.get().position().format());
            return Optional.of(Step.move(target.get().position()));
        }
        if (detector.boundaryPolicy() == BoundaryPolicy.NO_OP) {
            debug(detector.name() + " boundary, no-op");
            return Optional.of(Step.NONE);
        }
        return Optional.empty();
    }

    private void debug(String message) {
        if (debug) {
            System.err.println("[JUMP] " + message);
        }
    }
}
