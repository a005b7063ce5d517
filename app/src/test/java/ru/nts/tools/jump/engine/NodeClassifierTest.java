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
import ru.nts.tools.jump.engine.TestTrees.TestNode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static ru.nts.tools.jump.engine.TestTrees.field;

class NodeClassifierTest {

    @Test
    void commentsAndDelimitersAreComments() {
        TestTrees t = TestTrees.source("// hi\n/* block */");
        TestNode comment = t.leaf("comment", "// hi");
        TestNode delimiter = t.leaf("/*", "/*");

        assertTrue(NodeClassifier.isComment(comment));
        assertTrue(NodeClassifier.isComment(delimiter));
        assertFalse(NodeClassifier.isComment(null));
    }

    @Test
    void punctuationKeywordsAndEmptyRangesAreSkippable() {
        TestTrees t = TestTrees.source("{ case default x }");
        TestNode brace = t.token("{");
        TestNode caseKeyword = t.token("case");
        TestNode defaultKeyword = t.token("default");
        TestNode identifier = t.leaf("identifier", "x");

        assertTrue(NodeClassifier.isSkippable(brace));
        assertTrue(NodeClassifier.isSkippable(caseKeyword));
        assertTrue(NodeClassifier.isSkippable(defaultKeyword));
        assertTrue(NodeClassifier.isSkippable(null));
        assertFalse(NodeClassifier.isSkippable(identifier));

        TestNode empty = TestTrees.source("").leaf("missing", "");
        assertTrue(NodeClassifier.isSkippable(empty));
    }

    @Test
    void identifierIsMeaningfulOnlyInsideArrayPattern() {
        TestTrees t = TestTrees.source("[a, b] c");
        TestNode pattern = t.node("array_pattern",
                t.token("["), t.leaf("identifier", "a"), t.token(","), t.leaf("identifier", "b"), t.token("]"));
        TestNode loose = t.leaf("identifier", "c");
        t.node("program", pattern, loose);

        assertTrue(NodeClassifier.isMeaningful(pattern.child(1)));
        assertFalse(NodeClassifier.isMeaningful(loose));
        assertFalse(NodeClassifier.isMeaningful(pattern));
    }

    @Test
    void typeIdentifierIsNotMeaningfulAsDirectUnionMember() {
        TestTrees t = TestTrees.source("type T = A | B");
        TestNode name = t.leaf("type_identifier", "T");
        TestNode union = t.node("union_type", t.leaf("type_identifier", "A"), t.token("|"), t.leaf("type_identifier", "B"));
        t.node("type_alias_declaration", field("name", name), field("value", union));

        assertTrue(NodeClassifier.isMeaningful(name));
        assertFalse(NodeClassifier.isMeaningful(union.child(0)));
    }

    @Test
    void countsMeaningfulAndNonSkippableChildren() {
        TestTrees t = TestTrees.source("{ a(); // c\n b(); }");
        TestNode block = t.node("statement_block",
                t.token("{"), t.callStatement("a"), t.leaf("comment", "// c"), t.callStatement("b"), t.token("}"));

        assertEquals(2, NodeClassifier.countMeaningfulChildren(block));
        assertEquals(2, NodeClassifier.countNonSkippableChildren(block));
    }

    @Test
    void unknownKindsAreNeitherMeaningfulNorContainers() {
        TestNode unknown = TestTrees.source("zz").leaf("no_such_kind", "zz");

        assertFalse(NodeClassifier.isMeaningful(unknown));
        assertFalse(NodeClassifier.isContainer(unknown.kind()));
        assertFalse(NodeClassifier.isListContainer(unknown.kind()));
    }
}
