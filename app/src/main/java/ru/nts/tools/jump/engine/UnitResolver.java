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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет единицу навигации под курсором и ее область.
 * <p>
 * Алгоритм:
 * <ol>
 *   <li>Находит наименьший узел под курсором (колонка из ведущих пробелов переносится на текст).</li>
 *   <li>Половинка JSX-тега заменяется целым элементом.</li>
 *   <li>Курсор на пробелах контейнера дает маркер ON_GAP с ближайшими значимыми детьми.</li>
 *   <li>Подъем к корню с таблицей правил переписывания: правила по типу узла, затем общие правила.</li>
 *   <li>Запасной вариант: первый непропускаемый предок; для комментария или пустой строки маркер ON_COMMENT.</li>
 * </ol>
 * Правила "единственного элемента" возвращают {@link Resolution#notFound(String)}:
 * навигация внутри контекста из одного элемента никогда не выходит во внешнюю область.
 */
public class UnitResolver {

    private static final int MAX_ASCENT = 256;

    /**
     * Правило подъема: для текущего предка либо дает окончательный ответ, либо empty (правило не применимо).
     */
    @FunctionalInterface
    interface AscentRule {
        Optional<Resolution> apply(SyntaxNode current);
    }

    /**
     * Правила, привязанные к типу текущего узла. Проверяются первыми.
     */
    private final Map<String, AscentRule> kindRules = Map.of(
            "type_identifier", UnitResolver::typeDeclarationName,
            "identifier", UnitResolver::jsxTagName,
            "jsx_opening_element", UnitResolver::jsxTagHalf,
            "jsx_closing_element", UnitResolver::jsxTagHalf,
            "property_identifier", UnitResolver::propertyKey,
            "shorthand_property_identifier", UnitResolver::shorthandProperty
    );

    /**
     * Правила для любого узла, в порядке приоритета.
     */
    private final List<AscentRule> generalRules = List.of(
            UnitResolver::listElement,
            UnitResolver::fragmentChild,
            UnitResolver::meaningfulUnit
    );

    /**
     * Разрешает единицу навигации в точке (row, col), 0-based.
     */
    public Resolution resolve(SyntaxTree tree, int row, int col) {
        int snapped = NodeLocator.snapColumn(tree, row, col);
        SyntaxNode located = NodeLocator.smallestAt(tree.root(), row, snapped);

        if (NodeKinds.JSX_TAG_HALVES.contains(located.kind())) {
            Optional<Resolution> element = jsxTagHalf(located);
            if (element.isPresent()) {
                return element.get();
            }
        }

        if (NodeClassifier.isContainer(located.kind())) {
            Optional<Resolution> gap = gapInContainer(located, row);
            if (gap.isPresent()) {
                return gap.get();
            }
        }

        // Комментарий или пустая строка верхнего уровня: ищем ближайший код, а не значимого предка
        boolean escaping = NodeClassifier.isComment(located) || isRootLike(located);

        SyntaxNode current = located;
        for (int depth = 0; current != null && depth < MAX_ASCENT; depth++) {
            if (escaping && (NodeKinds.ESCAPE_CONTAINERS.contains(current.kind()) || isRootLike(current))) {
                break;
            }
            AscentRule kindRule = kindRules.get(current.kind());
            if (kindRule != null) {
                Optional<Resolution> result = kindRule.apply(current);
                if (result.isPresent()) {
                    return result.get();
                }
            }
            for (AscentRule rule : generalRules) {
                Optional<Resolution> result = rule.apply(current);
                if (result.isPresent()) {
                    return result.get();
                }
            }
            current = current.parent();
        }

        return fallback(located, row, escaping);
    }

    private static boolean isRootLike(SyntaxNode node) {
        return node.parent() == null;
    }

    /**
     * Курсор внутри контейнера, но не на его значимом ребенке.
     * Ребенок на той же строке возвращается напрямую, иначе маркер с ближайшими соседями.
     */
    private static Optional<Resolution> gapInContainer(SyntaxNode container, int row) {
        SyntaxNode before = null;
        SyntaxNode after = null;
        int minBefore = Integer.MAX_VALUE;
        int minAfter = Integer.MAX_VALUE;

        for (SyntaxNode child : container.children()) {
            if (!NodeClassifier.isMeaningful(child)) {
                continue;
            }
            int childRow = child.startRow();
            if (childRow < row) {
                if (row - childRow < minBefore) {
                    minBefore = row - childRow;
                    before = child;
                }
            } else if (childRow > row) {
                if (childRow - row < minAfter) {
                    minAfter = childRow - row;
                    after = child;
                }
            } else {
                return Optional.of(Resolution.found(child, container));
            }
        }

        if (before != null || after != null) {
            return Optional.of(Resolution.marker(NavigationUnit.onGap(before, after), container));
        }
        return Optional.empty();
    }

    private static Resolution fallback(SyntaxNode located, int row, boolean escaping) {
        SyntaxNode current = located;
        for (int depth = 0; current != null && NodeClassifier.isSkippable(current) && depth < MAX_ASCENT; depth++) {
            current = current.parent();
        }
        if (current == null) {
            return Resolution.notFound("No valid node found at cursor");
        }

        if (escaping || isRootLike(current)) {
            SyntaxNode before = null;
            SyntaxNode after = null;
            boolean anyMeaningful = false;
            for (SyntaxNode child : current.children()) {
                if (!NodeClassifier.isMeaningful(child)) {
                    continue;
                }
                anyMeaningful = true;
                if (child.startRow() < row) {
                    before = child;
                } else if (child.startRow() > row && after == null) {
                    after = child;
                }
            }
            if (anyMeaningful) {
                return Resolution.marker(NavigationUnit.onComment(before, after), current);
            }
        }

        return Resolution.found(current, current.parent());
    }

    // ==================== Правила по типу узла ====================

    /**
     * Имя типа в объявлении type/interface заменяется самим объявлением.
     */
    static Optional<Resolution> typeDeclarationName(SyntaxNode current) {
        SyntaxNode parent = current.parent();
        if (parent != null && (parent.is("type_alias_declaration") || parent.is("interface_declaration"))) {
            return Optional.of(Resolution.found(parent, parent.parent()));
        }
        return Optional.empty();
    }

    /**
     * Имя JSX-тега внутри фрагмента: навигация между детьми фрагмента.
     */
    static Optional<Resolution> jsxTagName(SyntaxNode current) {
        SyntaxNode parent = current.parent();
        if (parent == null) {
            return Optional.empty();
        }
        if (parent.is("jsx_opening_element")) {
            SyntaxNode element = parent.parent();
            if (element != null && element.is("jsx_element")) {
                SyntaxNode fragment = element.parent();
                if (fragment != null && fragment.is("jsx_element")) {
                    return Optional.of(Resolution.found(element, fragment));
                }
            }
        } else if (parent.is("jsx_self_closing_element")) {
            SyntaxNode fragment = parent.parent();
            if (fragment != null && fragment.is("jsx_element")) {
                return Optional.of(Resolution.found(parent, fragment));
            }
        }
        return Optional.empty();
    }

    static Optional<Resolution> jsxTagHalf(SyntaxNode current) {
        SyntaxNode parent = current.parent();
        if (parent != null && parent.is("jsx_element")) {
            return Optional.of(Resolution.found(parent, parent.parent()));
        }
        return Optional.empty();
    }

    /**
     * Ключ пары в объекте или свойства в object_type заменяется всей парой,
     * если свойств больше одного; единственное свойство дает отказ.
     */
    static Optional<Resolution> propertyKey(SyntaxNode current) {
        SyntaxNode parent = current.parent();
        if (parent == null) {
            return Optional.empty();
        }
        SyntaxNode owner = parent.parent();
        if (parent.is("pair") && owner != null && owner.is("object")) {
            int properties = countKinds(owner, "pair", "shorthand_property_identifier");
            return Optional.of(properties > 1
                    ? Resolution.found(parent, owner)
                    : Resolution.notFound("Single property in object - would exit context"));
        }
        if (parent.is("property_signature") && owner != null && owner.is("object_type")) {
            int properties = countKinds(owner, "property_signature", "property_signature");
            return Optional.of(properties > 1
                    ? Resolution.found(parent, owner)
                    : Resolution.notFound("Single property in object_type - would exit context"));
        }
        return Optional.empty();
    }

    static Optional<Resolution> shorthandProperty(SyntaxNode current) {
        SyntaxNode parent = current.parent();
        if (parent != null && parent.is("object")) {
            int properties = countKinds(parent, "pair", "shorthand_property_identifier");
            return Optional.of(properties > 1
                    ? Resolution.found(current, parent)
                    : Resolution.notFound("Single property in object - would exit context"));
        }
        return Optional.empty();
    }

    private static int countKinds(SyntaxNode node, String first, String second) {
        int count = 0;
        for (SyntaxNode child : node.children()) {
            if (child.is(first) || child.is(second)) {
                count++;
            }
        }
        return count;
    }

    // ==================== Общие правила ====================

    /**
     * Элемент однородного списка (массив, аргументы, параметры, union...).
     * <p>
     * Если между узлом и списком есть значимый оператор внутри блока или ветки case,
     * навигация по операторам важнее навигации по элементам списка.
     */
    static Optional<Resolution> listElement(SyntaxNode current) {
        SyntaxNode check = current;
        for (int depth = 0; check != null && depth < MAX_ASCENT; depth++) {
            SyntaxNode list = check.parent();
            if (list != null && NodeClassifier.isListContainer(list.kind())) {
                if (list.is(NodeKinds.UNION_TYPE)) {
                    list = UnionMembers.outermost(list, NodeKinds.UNION_TYPE);
                }

                Optional<Resolution> statement = enclosingStatement(current, check);
                if (statement.isPresent()) {
                    return statement;
                }

                return Optional.of(NodeClassifier.countNonSkippableChildren(list) > 1
                        ? Resolution.found(check, list)
                        : Resolution.notFound("Single element in list - would exit context"));
            }
            check = list;
        }
        return Optional.empty();
    }

    /**
     * Ищет значимый узел от current до элемента списка (не включая его),
     * лежащий прямо в блоке операторов или в ветке case.
     */
    private static Optional<Resolution> enclosingStatement(SyntaxNode current, SyntaxNode listElement) {
        SyntaxNode test = current;
        for (int depth = 0; test != null && !test.sameNode(listElement) && depth < MAX_ASCENT; depth++) {
            if (NodeClassifier.isMeaningful(test)) {
                SyntaxNode owner = test.parent();
                if (owner != null && NodeKinds.STATEMENT_BLOCKS.contains(owner.kind())) {
                    return Optional.of(NodeClassifier.countMeaningfulChildren(owner) > 1
                            ? Resolution.found(test, owner)
                            : Resolution.notFound("Single statement in block - would exit context"));
                }
                if (owner != null && NodeKinds.CASE_CLAUSES.contains(owner.kind())) {
                    return Optional.of(NodeClassifier.countMeaningfulChildren(owner) > 1
                            ? Resolution.found(test, owner)
                            : Resolution.notFound("Single statement in case - would exit context"));
                }
            }
            test = test.parent();
        }
        return Optional.empty();
    }

    /**
     * JSX-элемент внутри другого jsx_element (фрагмент): навигация между детьми.
     */
    static Optional<Resolution> fragmentChild(SyntaxNode current) {
        if (current.is("jsx_self_closing_element") || current.is("jsx_element")) {
            SyntaxNode parent = current.parent();
            if (parent != null && parent.is("jsx_element")) {
                return Optional.of(Resolution.found(current, parent));
            }
        }
        return Optional.empty();
    }

    static Optional<Resolution> meaningfulUnit(SyntaxNode current) {
        if (!NodeClassifier.isMeaningful(current)) {
            return Optional.empty();
        }
        SyntaxNode parent = current.parent();
        if (parent != null && NodeKinds.CASE_CLAUSES.contains(parent.kind())
                && NodeClassifier.countMeaningfulChildren(parent) == 1) {
            return Optional.of(Resolution.notFound("Single statement in case - would exit context"));
        }
        return Optional.of(Resolution.found(current, parent));
    }
}
