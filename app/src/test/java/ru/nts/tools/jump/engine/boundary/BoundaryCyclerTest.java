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

import org.junit.jupiter.api.Test;
import ru.nts.tools.jump.engine.CursorPosition;
import ru.nts.tools.jump.engine.SyntaxNode;
import ru.nts.tools.jump.engine.SyntaxTree;
import ru.nts.tools.jump.engine.TestTrees;
import ru.nts.tools.jump.engine.TestTrees.TestNode;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static ru.nts.tools.jump.engine.TestTrees.field;

class BoundaryCyclerTest {

    private final BoundaryCycler cycler = BoundaryCycler.standard(false);

    @Test
    void propertyWithCallValueCyclesBetweenKeyAndClosingParen() {
        TestTrees t = TestTrees.source("o = {\n  load: api.get().then(),\n  n: 1\n};");
        TestNode target = t.leaf("identifier", "o");
        TestNode equals = t.token("=");
        TestNode open = t.token("{");
        TestNode load = t.node("pair",
                field("key", t.leaf("property_identifier", "load")),
                t.token(":"),
                field("value", chain(t, t.leaf("identifier", "api"), "get", "then")));
        TestNode comma = t.token(",");
        TestNode other = t.node("pair",
                field("key", t.leaf("property_identifier", "n")), t.token(":"), field("value", t.leaf("number", "1")));
        TestNode object = t.node("object", open, load, comma, other, t.token("}"));
        SyntaxTree tree = t.tree("program", "javascript", t.node("expression_statement",
                t.node("assignment_expression", field("left", target), equals, field("right", object)),
                t.token(";")));

        BoundaryCycler.Cycle onKey = cycler.cycle(tree, new CursorPosition(1, 2)).orElseThrow();
        assertEquals("property-value", onKey.handler());
        assertEquals(new BoundaryPosition(1, 23, BoundaryKind.CLOSING_PAREN), onKey.target());

        BoundaryCycler.Cycle onClosing = cycler.cycle(tree, new CursorPosition(1, 23)).orElseThrow();
        assertEquals(new BoundaryPosition(1, 2, BoundaryKind.PROPERTY_NAME), onClosing.target());
    }

    @Test
    void awaitedCallUsesAwaitKeywordAndOuterClosing() {
        TestTrees t = TestTrees.source("await fetch(url);");
        SyntaxTree tree = t.tree("program", "javascript", t.node("expression_statement",
                t.node("await_expression",
                        t.token("await"),
                        t.node("call_expression",
                                field("function", t.leaf("identifier", "fetch")),
                                field("arguments", t.node("arguments",
                                        t.token("("), t.leaf("identifier", "url"), t.token(")"))))),
                t.token(";")));

        BoundaryCycler.Cycle onAwait = cycler.cycle(tree, new CursorPosition(0, 0)).orElseThrow();
        assertEquals("call-expression", onAwait.handler());
        assertEquals(new BoundaryPosition(0, 15, BoundaryKind.CLOSING_PAREN), onAwait.target());

        BoundaryCycler.Cycle onClosing = cycler.cycle(tree, new CursorPosition(0, 15)).orElseThrow();
        assertEquals(new BoundaryPosition(0, 0, BoundaryKind.AWAIT_KEYWORD), onClosing.target());

        BoundaryCycler.Cycle onName = cycler.cycle(tree, new CursorPosition(0, 7)).orElseThrow();
        assertEquals(BoundaryKind.CALL_NAME, onName.context().first().kind());
        assertEquals(6, onName.context().first().col());
    }

    @Test
    void javaElseIfChainListsEveryBranch() {
        TestTrees t = TestTrees.source("if (a) {\n  x();\n} else if (b) {\n  y();\n} else {\n  z();\n}");
        TestNode ifStatement = t.node("if_statement",
                t.token("if"),
                field("condition", condition(t, "a")),
                field("consequence", javaBlock(t, "x")),
                t.token("else"),
                field("alternative", t.node("if_statement",
                        t.token("if"),
                        field("condition", condition(t, "b")),
                        field("consequence", javaBlock(t, "y")),
                        t.token("else"),
                        field("alternative", javaBlock(t, "z")))));
        SyntaxTree tree = t.tree("program", "java", ifStatement);

        BoundaryCycler.Cycle onIf = cycler.cycle(tree, new CursorPosition(0, 0)).orElseThrow();
        assertEquals("if-block", onIf.handler());
        assertEquals(List.of(
                new BoundaryPosition(0, 0, BoundaryKind.IF_KEYWORD),
                new BoundaryPosition(2, 2, BoundaryKind.ELSE_IF_KEYWORD),
                new BoundaryPosition(4, 2, BoundaryKind.ELSE_KEYWORD),
                new BoundaryPosition(6, 1, BoundaryKind.CLOSING_BRACKET)
        ), onIf.context().positions());
        assertEquals(1, onIf.next());

        assertEquals(new BoundaryPosition(6, 1, BoundaryKind.CLOSING_BRACKET),
                cycler.cycle(tree, new CursorPosition(4, 2)).orElseThrow().target());
        assertEquals(new BoundaryPosition(0, 0, BoundaryKind.IF_KEYWORD),
                cycler.cycle(tree, new CursorPosition(6, 0)).orElseThrow().target());
        // Позиция за последней скобкой строки тоже находит конструкцию
        assertEquals(new BoundaryPosition(0, 0, BoundaryKind.IF_KEYWORD),
                cycler.cycle(tree, new CursorPosition(6, 1)).orElseThrow().target());
    }

    @Test
    void switchCyclesThroughCasesAndClosingBrace() {
        TestTrees t = TestTrees.source("switch (k) {\n  case 1:\n    a();\n  default:\n    b();\n}");
        SyntaxTree tree = t.tree("program", "javascript", t.node("switch_statement",
                t.token("switch"),
                field("value", condition(t, "k")),
                field("body", t.node("switch_body",
                        t.token("{"),
                        t.node("switch_case", t.token("case"), field("value", t.leaf("number", "1")), t.token(":"),
                                t.callStatement("a")),
                        t.node("switch_default", t.token("default"), t.token(":"), t.callStatement("b")),
                        t.token("}")))));

        BoundaryCycler.Cycle onDefault = cycler.cycle(tree, new CursorPosition(3, 2)).orElseThrow();
        assertEquals("switch", onDefault.handler());
        assertEquals(4, onDefault.context().positions().size());
        assertEquals(new BoundaryPosition(5, 1, BoundaryKind.CLOSING_BRACKET), onDefault.target());

        assertEquals(new BoundaryPosition(0, 0, BoundaryKind.SWITCH_KEYWORD),
                cycler.cycle(tree, new CursorPosition(5, 0)).orElseThrow().target());
    }

    @Test
    void loopCyclesBetweenKeywordAndBodyEnd() {
        TestTrees t = TestTrees.source("for (;;) {\n  a();\n}");
        SyntaxTree tree = t.tree("program", "javascript", t.node("for_statement",
                t.token("for"), t.token("("), t.token(";"), t.token(";"), t.token(")"),
                field("body", t.block("a"))));

        BoundaryCycler.Cycle onFor = cycler.cycle(tree, new CursorPosition(0, 0)).orElseThrow();
        assertEquals("loop", onFor.handler());
        assertEquals(new BoundaryPosition(2, 1, BoundaryKind.CLOSING_BRACKET), onFor.target());
    }

    @Test
    void declarationEndsAtOutermostCallOfChain() {
        TestTrees t = TestTrees.source("const total = items.map(f).filter(g);");
        TestNode keyword = t.token("const");
        TestNode name = t.leaf("identifier", "total");
        TestNode equals = t.token("=");
        TestNode map = t.node("call_expression",
                field("function", member(t, t.leaf("identifier", "items"), "map")),
                field("arguments", t.node("arguments", t.token("("), t.leaf("identifier", "f"), t.token(")"))));
        TestNode filter = t.node("call_expression",
                field("function", member(t, map, "filter")),
                field("arguments", t.node("arguments", t.token("("), t.leaf("identifier", "g"), t.token(")"))));
        SyntaxTree tree = t.tree("program", "javascript", t.node("lexical_declaration",
                keyword,
                t.node("variable_declarator", field("name", name), equals, field("value", filter)),
                t.token(";")));

        BoundaryCycler.Cycle onConst = cycler.cycle(tree, new CursorPosition(0, 0)).orElseThrow();
        assertEquals("declaration", onConst.handler());
        assertEquals(new BoundaryPosition(0, 36, BoundaryKind.CLOSING_BRACKET), onConst.target());
    }

    @Test
    void typeAliasAndFunctionDeclarations() {
        TestTrees t = TestTrees.source("type Id = string | number;\nfunction f() {\n  return 1;\n}");
        TestNode alias = t.node("type_alias_declaration",
                t.token("type"),
                field("name", t.leaf("type_identifier", "Id")),
                t.token("="),
                field("value", t.node("union_type",
                        t.leaf("predefined_type", "string"), t.token("|"), t.leaf("predefined_type", "number"))),
                t.token(";"));
        TestNode function = t.node("function_declaration",
                t.token("function"),
                field("name", t.leaf("identifier", "f")),
                field("parameters", t.node("formal_parameters", t.token("("), t.token(")"))),
                field("body", t.node("statement_block",
                        t.token("{"),
                        t.node("return_statement", t.token("return"), t.leaf("number", "1"), t.token(";")),
                        t.token("}"))));
        SyntaxTree tree = t.tree("program", "typescript", alias, function);

        assertEquals(new BoundaryPosition(0, 25, BoundaryKind.CLOSING_BRACKET),
                cycler.cycle(tree, new CursorPosition(0, 0)).orElseThrow().target());
        assertEquals(new BoundaryPosition(3, 1, BoundaryKind.CLOSING_BRACKET),
                cycler.cycle(tree, new CursorPosition(1, 9)).orElseThrow().target());
        assertEquals(new BoundaryPosition(1, 0, BoundaryKind.FUNCTION_KEYWORD),
                cycler.cycle(tree, new CursorPosition(3, 0)).orElseThrow().target());
    }

    @Test
    void exactPositionWinsOverHigherPriorityHandler() {
        TestTrees t = TestTrees.source("const v = f(x)");
        SyntaxTree tree = t.tree("program", "javascript", t.node("lexical_declaration",
                t.token("const"),
                t.node("variable_declarator",
                        field("name", t.leaf("identifier", "v")),
                        t.token("="),
                        field("value", t.node("call_expression",
                                field("function", t.leaf("identifier", "f")),
                                field("arguments", t.node("arguments",
                                        t.token("("), t.leaf("identifier", "x"), t.token(")"))))))));

        BoundaryCycler.Cycle onConst = cycler.cycle(tree, new CursorPosition(0, 0)).orElseThrow();
        assertEquals(new BoundaryPosition(0, 14, BoundaryKind.CLOSING_BRACKET), onConst.target());

        // За концом строки стоит и ')' вызова, но точное совпадение есть только у объявления
        BoundaryCycler.Cycle onEnd = cycler.cycle(tree, new CursorPosition(0, 14)).orElseThrow();
        assertEquals("declaration", onEnd.handler());
        assertEquals(new BoundaryPosition(0, 0, BoundaryKind.DECLARATION_KEYWORD), onEnd.target());

        BoundaryCycler.Cycle onParen = cycler.cycle(tree, new CursorPosition(0, 13)).orElseThrow();
        assertEquals("call-expression", onParen.handler());
    }

    @Test
    void handlerThatCannotMoveYieldsToNext() {
        TestTrees t = TestTrees.source("for (;;) {\n  a();\n}");
        SyntaxTree tree = t.tree("program", "javascript", t.node("for_statement",
                t.token("for"), t.token("("), t.token(";"), t.token(";"), t.token(")"),
                field("body", t.block("a"))));
        BoundaryHandler stuck = new BoundaryHandler() {
            @Override
            public String name() {
                return "stuck";
            }

            @Override
            public Optional<BoundaryContext> detect(SyntaxNode node, CursorPosition cursor) {
                return Optional.of(new BoundaryContext(node, List.of(
                        new BoundaryPosition(cursor.row(), cursor.col(), BoundaryKind.LOOP_KEYWORD))));
            }
        };

        BoundaryCycler.Cycle cycle = new BoundaryCycler(List.of(stuck, new LoopHandler()), false)
                .cycle(tree, new CursorPosition(0, 0)).orElseThrow();

        assertEquals("loop", cycle.handler());
        assertEquals(new BoundaryPosition(2, 1, BoundaryKind.CLOSING_BRACKET), cycle.target());
    }

    @Test
    void nothingToCycleOnPlainExpression() {
        TestTrees t = TestTrees.source("x = 1;");
        SyntaxTree tree = t.tree("program", "javascript", t.node("expression_statement",
                t.node("assignment_expression", field("left", t.leaf("identifier", "x")), t.token("="),
                        field("right", t.leaf("number", "1"))),
                t.token(";")));

        assertTrue(cycler.cycle(tree, new CursorPosition(0, 0)).isEmpty());
    }

    @Test
    void currentIndexRules() {
        TestTrees t = TestTrees.source("a\nb\nc\nd\ne");
        TestNode construct = t.node("block",
                t.leaf("identifier", "a"), t.leaf("identifier", "b"), t.leaf("identifier", "c"));
        BoundaryContext context = new BoundaryContext(construct, List.of(
                new BoundaryPosition(0, 0, BoundaryKind.LOOP_KEYWORD),
                new BoundaryPosition(0, 6, BoundaryKind.CALL_NAME),
                new BoundaryPosition(2, 0, BoundaryKind.CLOSING_BRACKET)));

        // Та же строка: ближайшая колонка, при равенстве более ранняя позиция
        assertEquals(0, BoundaryCycler.currentIndex(context, new CursorPosition(0, 1)));
        assertEquals(1, BoundaryCycler.currentIndex(context, new CursorPosition(0, 5)));
        assertEquals(0, BoundaryCycler.currentIndex(context, new CursorPosition(0, 3)));
        // Внутри конструкции вне граничных строк
        assertEquals(-1, BoundaryCycler.currentIndex(context, new CursorPosition(1, 0)));
        // Снаружи: ближайшая строка
        assertEquals(2, BoundaryCycler.currentIndex(context, new CursorPosition(4, 0)));
    }

    private static TestNode chain(TestTrees t, TestNode object, String... methods) {
        TestNode current = object;
        for (String method : methods) {
            current = t.node("call_expression",
                    field("function", member(t, current, method)),
                    field("arguments", t.node("arguments", t.token("("), t.token(")"))));
        }
        return current;
    }

    private static TestNode member(TestTrees t, TestNode object, String property) {
        return t.node("member_expression",
                field("object", object), t.token("."), field("property", t.leaf("property_identifier", property)));
    }

    private static TestNode condition(TestTrees t, String name) {
        return t.node("parenthesized_expression", t.token("("), t.leaf("identifier", name), t.token(")"));
    }

    private static TestNode javaBlock(TestTrees t, String call) {
        return t.node("block", t.token("{"), t.callStatement(call), t.token("}"));
    }
}
