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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static ru.nts.tools.jump.engine.TestTrees.field;

class UnitResolverTest {

    private final UnitResolver resolver = new UnitResolver();

    @Test
    void statementInProgramResolvesToStatement() {
        TestTrees t = TestTrees.source("a();\nb();");
        SyntaxTree tree = t.tree("program", "javascript", t.callStatement("a"), t.callStatement("b"));

        Resolution resolution = resolver.resolve(tree, 1, 0);

        assertTrue(resolution.isFound());
        assertEquals("expression_statement", resolution.unit().node().kind());
        assertEquals(1, resolution.unit().node().startRow());
        assertEquals("program", resolution.scope().kind());
    }

    @Test
    void leadingWhitespaceSnapsToStatement() {
        TestTrees t = TestTrees.source("{\n    a();\n    b();\n}");
        SyntaxTree tree = t.tree("program", "javascript", t.block("a", "b"));

        Resolution resolution = resolver.resolve(tree, 2, 1);

        assertTrue(resolution.isFound());
        assertFalse(resolution.unit().isMarker());
        assertEquals(2, resolution.unit().node().startRow());
        assertEquals("statement_block", resolution.scope().kind());
    }

    @Test
    void blankLineInsideBlockGivesGapMarker() {
        TestTrees t = TestTrees.source("{\n  a();\n\n  b();\n}");
        SyntaxTree tree = t.tree("program", "javascript", t.block("a", "b"));

        Resolution resolution = resolver.resolve(tree, 2, 0);

        assertTrue(resolution.isFound());
        assertEquals(NavigationUnit.Marker.ON_GAP, resolution.unit().marker());
        assertEquals(1, resolution.unit().closestBefore().startRow());
        assertEquals(3, resolution.unit().closestAfter().startRow());
    }

    @Test
    void topLevelCommentGivesCommentMarker() {
        TestTrees t = TestTrees.source("a();\n// note\nb();");
        SyntaxTree tree = t.tree("program", "javascript",
                t.callStatement("a"), t.leaf("comment", "// note"), t.callStatement("b"));

        Resolution resolution = resolver.resolve(tree, 1, 3);

        assertEquals(NavigationUnit.Marker.ON_COMMENT, resolution.unit().marker());
        assertEquals(0, resolution.unit().closestBefore().startRow());
        assertEquals(2, resolution.unit().closestAfter().startRow());
    }

    @Test
    void singlePropertyObjectRefusesToResolve() {
        TestTrees t = TestTrees.source("o = {x: 1};");
        SyntaxTree tree = t.tree("program", "javascript", t.node("expression_statement",
                t.node("assignment_expression",
                        field("left", t.leaf("identifier", "o")),
                        t.token("="),
                        field("right", t.node("object",
                                t.token("{"),
                                t.node("pair",
                                        field("key", t.leaf("property_identifier", "x")),
                                        t.token(":"),
                                        field("value", t.leaf("number", "1"))),
                                t.token("}")))),
                t.token(";")));

        Resolution resolution = resolver.resolve(tree, 0, 5);

        assertFalse(resolution.isFound());
        assertNull(resolution.scope());
    }

    @Test
    void argumentResolvesToListElement() {
        TestTrees t = TestTrees.source("f(a, b, c);");
        SyntaxTree tree = t.tree("program", "javascript", t.node("expression_statement",
                t.node("call_expression",
                        field("function", t.leaf("identifier", "f")),
                        field("arguments", t.node("arguments",
                                t.token("("),
                                t.leaf("identifier", "a"), t.token(","),
                                t.leaf("identifier", "b"), t.token(","),
                                t.leaf("identifier", "c"),
                                t.token(")")))),
                t.token(";")));

        Resolution resolution = resolver.resolve(tree, 0, 5);

        assertTrue(resolution.isFound());
        assertEquals("identifier", resolution.unit().node().kind());
        assertEquals(5, resolution.unit().node().startCol());
        assertEquals("arguments", resolution.scope().kind());
    }

    @Test
    void singleStatementInCaseRefusesToResolve() {
        TestTrees t = TestTrees.source("switch (k) {\n  case 1:\n    a();\n}");
        SyntaxTree tree = t.tree("program", "javascript", t.node("switch_statement",
                t.token("switch"),
                field("value", t.node("parenthesized_expression", t.token("("), t.leaf("identifier", "k"), t.token(")"))),
                field("body", t.node("switch_body",
                        t.token("{"),
                        t.node("switch_case", t.token("case"), field("value", t.leaf("number", "1")), t.token(":"),
                                t.callStatement("a")),
                        t.token("}")))));

        Resolution resolution = resolver.resolve(tree, 2, 4);

        assertFalse(resolution.isFound());
    }
}
