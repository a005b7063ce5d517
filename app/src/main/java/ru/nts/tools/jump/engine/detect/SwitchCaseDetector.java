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
import ru.nts.tools.jump.engine.NodeKinds;
import ru.nts.tools.jump.engine.SyntaxNode;
import ru.nts.tools.jump.engine.TargetPositions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Навигация между ветками case/default одного switch.
 * <p>
 * Уступает более приоритетным контекстам: литералам объектов и массивов, спискам аргументов
 * и параметров, а также блокам и веткам с несколькими операторами.
 * Между ветками шаг строго внутри switch, выход наружу выполняет обычная навигация
 * по соседям, когда курсор стоит на самом switch.
 */
public class SwitchCaseDetector implements ConstructDetector<SwitchCaseDetector.CaseLadder> {

    private static final int MAX_ASCENT = 20;
    private static final int MAX_DEFERRAL_WALK = 256;

    private static final Set<String> PRIORITY_CONTEXTS = Set.of(
            "object", "object_type", "array", "arguments", "formal_parameters");

    private static final Set<String> CASE_KEYWORDS = Set.of("case", "default");

    /**
     * @param switchNode узел switch_statement
     * @param cases      ветки case/default в порядке исходника
     * @param index      индекс ветки под курсором (0-based)
     */
    public record CaseLadder(SyntaxNode switchNode, List<SyntaxNode> cases, int index) {}

    @Override
    public String name() {
        return "switch-case";
    }

    @Override
    public Optional<CaseLadder> detect(SyntaxNode node, CursorPosition cursor) {
        if (node == null || defersToInnerContext(node)) {
            return Optional.empty();
        }

        SyntaxNode foundCase = null;
        SyntaxNode foundSwitch = null;
        SyntaxNode current = node;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (current.is("switch_statement")) {
                foundSwitch = current;
                break;
            }
            if (NodeKinds.CASE_CLAUSES.contains(current.kind())) {
                foundCase = current;
            }
            current = current.parent();
            if (current != null && (current.is("statement_block") || current.is("program"))) {
                break;
            }
        }
        if (foundSwitch == null || foundCase == null) {
            return Optional.empty();
        }

        List<SyntaxNode> cases = collectCases(foundSwitch);
        for (int i = 0; i < cases.size(); i++) {
            if (cases.get(i).spansRow(cursor.row())) {
                return Optional.of(new CaseLadder(foundSwitch, cases, i));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<JumpTarget> step(CaseLadder ladder, boolean forward) {
        int target = forward ? ladder.index() + 1 : ladder.index() - 1;
        if (target < 0 || target >= ladder.cases().size()) {
            return Optional.empty();
        }
        SyntaxNode clause = ladder.cases().get(target);
        return Optional.of(new JumpTarget(clause, TargetPositions.keyword(clause, CASE_KEYWORDS)));
    }

    @Override
    public BoundaryPolicy boundaryPolicy() {
        return BoundaryPolicy.FALLTHROUGH;
    }

    /**
     * Ветки case/default из тела switch.
     */
    public static List<SyntaxNode> collectCases(SyntaxNode switchNode) {
        List<SyntaxNode> cases = new ArrayList<>();
        SyntaxNode body = switchBody(switchNode);
        if (body == null) {
            return cases;
        }
        for (SyntaxNode child : body.children()) {
            if (NodeKinds.CASE_CLAUSES.contains(child.kind())) {
                cases.add(child);
            }
        }
        return cases;
    }

    public static SyntaxNode switchBody(SyntaxNode switchNode) {
        for (SyntaxNode child : switchNode.children()) {
            if (child.is("switch_body")) {
                return child;
            }
        }
        return null;
    }

    /**
     * Проверяет, есть ли между курсором и веткой case более приоритетный контекст навигации.
     * Оператор, лежащий прямо в ветке case, тоже уступает: по веткам ходим только с заголовка case.
     */
    private static boolean defersToInnerContext(SyntaxNode node) {
        SyntaxNode test = node;
        for (int depth = 0; test != null && depth < MAX_DEFERRAL_WALK; depth++) {
            if (PRIORITY_CONTEXTS.contains(test.kind())) {
                return true;
            }
            if (NodeClassifier.isMeaningful(test)) {
                SyntaxNode owner = test.parent();
                if (owner != null && owner.is("statement_block") && NodeClassifier.countMeaningfulChildren(owner) > 1) {
                    return true;
                }
                if (owner != null && NodeKinds.CASE_CLAUSES.contains(owner.kind())) {
                    return true;
                }
            }
            test = test.parent();
            if (test != null && NodeKinds.CASE_CLAUSES.contains(test.kind())) {
                break;
            }
        }
        return false;
    }
}
