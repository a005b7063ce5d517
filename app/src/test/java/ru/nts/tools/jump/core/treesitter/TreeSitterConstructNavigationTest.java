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
package ru.nts.tools.jump.core.treesitter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.nts.tools.jump.engine.CursorPosition;
import ru.nts.tools.jump.engine.StructuralNavigator;
import ru.nts.tools.jump.engine.SyntaxTree;
import ru.nts.tools.jump.engine.VirtualCursorHost;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Детекторы конструкций и правила соседства на деревьях настоящей грамматики JavaScript.
 */
class TreeSitterConstructNavigationTest {

    private static final String IF_LADDER = """
            start();
            if (a) {
              x();
            } else if (b) {
              y();
            } else {
              z();
            }
            done();
            """;

    private static final String TRY_LADDER = """
            start();
            try {
              a();
            } catch (e) {
              b();
            } finally {
              c();
            }
            done();
            """;

    private final TreeSitterManager manager = TreeSitterManager.getInstance();
    private final StructuralNavigator navigator = StructuralNavigator.standard(false);

    @BeforeEach
    void setUp() {
        manager.clearCache();
    }

    private SyntaxTree parse(String content) {
        return manager.getCachedOrParse(Path.of("doc.js"), content, "javascript").toSyntaxTree();
    }

    private Optional<CursorPosition> jump(SyntaxTree tree, int row, int col, boolean forward) {
        VirtualCursorHost host = new VirtualCursorHost(tree, new CursorPosition(row, col));
        return navigator.navigateSibling(host, forward, 1);
    }

    private static Optional<CursorPosition> at(int row, int col) {
        return Optional.of(new CursorPosition(row, col));
    }

    @Test
    void ifLadderStepsThroughBranchesAndLeavesAtBothEnds() {
        SyntaxTree tree = parse(IF_LADDER);

        assertEquals(at(3, 2), jump(tree, 1, 0, true));
        assertEquals(at(5, 2), jump(tree, 3, 2, true));
        assertEquals(at(8, 0), jump(tree, 5, 2, true));

        assertEquals(at(3, 2), jump(tree, 5, 2, false));
        assertEquals(at(1, 0), jump(tree, 3, 2, false));
        assertEquals(at(0, 0), jump(tree, 1, 0, false));
        // Обратный вход в лестницу попадает на последнюю ветку
        assertEquals(at(5, 2), jump(tree, 8, 0, false));
    }

    @Test
    void closingBraceBeforeElseMovesPastWholeLadder() {
        SyntaxTree tree = parse(IF_LADDER);

        // "}" принадлежит телу головной ветки: единицей становится весь if
        assertEquals(at(8, 0), jump(tree, 3, 0, true));
        assertEquals(at(0, 0), jump(tree, 3, 0, false));
    }

    @Test
    void tryLadderStepsThroughCatchAndFinally() {
        SyntaxTree tree = parse(TRY_LADDER);

        assertEquals(at(3, 2), jump(tree, 1, 0, true));
        assertEquals(at(5, 2), jump(tree, 3, 2, true));
        assertEquals(at(8, 0), jump(tree, 5, 2, true));

        assertEquals(at(3, 2), jump(tree, 5, 2, false));
        assertEquals(at(1, 0), jump(tree, 3, 2, false));
        assertEquals(at(0, 0), jump(tree, 1, 0, false));
    }

    @Test
    void methodChainIsClosedAtBothEnds() {
        SyntaxTree tree = parse("api.get().then(f).catch(g);\n");

        assertEquals(at(0, 10), jump(tree, 0, 4, true));
        assertEquals(at(0, 18), jump(tree, 0, 10, true));
        assertEquals(Optional.empty(), jump(tree, 0, 18, true));

        assertEquals(at(0, 10), jump(tree, 0, 18, false));
        assertEquals(at(0, 4), jump(tree, 0, 10, false));
        assertEquals(Optional.empty(), jump(tree, 0, 4, false));
    }

    @Test
    void switchCasesStopAtFirstAndLastClause() {
        SyntaxTree tree = parse("""
                switch (k) {
                  case 1:
                    a();
                  case 2:
                    b();
                  default:
                    c();
                }
                """);

        assertEquals(at(3, 2), jump(tree, 1, 2, true));
        assertEquals(at(5, 2), jump(tree, 3, 2, true));
        assertEquals(Optional.empty(), jump(tree, 5, 2, true));

        assertEquals(at(1, 2), jump(tree, 3, 2, false));
        assertEquals(Optional.empty(), jump(tree, 1, 2, false));
    }

    @Test
    void objectPropertiesAreSiblings() {
        SyntaxTree tree = parse("""
                const o = {
                  a: 1,
                  b: 2,
                  c,
                };
                """);

        assertEquals(at(2, 2), jump(tree, 1, 2, true));
        assertEquals(at(3, 2), jump(tree, 2, 2, true));
        assertEquals(Optional.empty(), jump(tree, 3, 2, true));

        assertEquals(at(1, 2), jump(tree, 2, 2, false));
        assertEquals(Optional.empty(), jump(tree, 1, 2, false));
    }

    @Test
    void jsxChildrenLandOnTagNames() {
        SyntaxTree tree = parse("""
                const v = (
                  <div>
                    <A />
                    <B />
                  </div>
                );
                """);

        assertEquals(at(3, 5), jump(tree, 2, 5, true));
        assertEquals(Optional.empty(), jump(tree, 3, 5, true));

        assertEquals(at(2, 5), jump(tree, 3, 5, false));
        assertEquals(Optional.empty(), jump(tree, 2, 5, false));
    }
}
