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
import ru.nts.tools.jump.engine.SyntaxNode;
import ru.nts.tools.jump.engine.SyntaxTree;
import ru.nts.tools.jump.engine.VirtualCursorHost;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Навигация поверх настоящих грамматик tree-sitter.
 */
class TreeSitterNavigationTest {

    private final TreeSitterManager manager = TreeSitterManager.getInstance();
    private final StructuralNavigator navigator = StructuralNavigator.standard(false);

    @BeforeEach
    void setUp() {
        manager.clearCache();
    }

    private SyntaxTree parse(String content, String langId) {
        return manager.getCachedOrParse(Path.of("doc." + langId), content, langId).toSyntaxTree();
    }

    private Optional<CursorPosition> jump(SyntaxTree tree, int row, int col, boolean forward, int count) {
        VirtualCursorHost host = new VirtualCursorHost(tree, new CursorPosition(row, col));
        return navigator.navigateSibling(host, forward, count);
    }

    @Test
    void javascriptStatementsAreSiblings() {
        SyntaxTree tree = parse("const a = 1;\nconst b = 2;\nfoo();\n", "javascript");

        assertEquals("program", tree.root().kind());
        assertEquals(Optional.of(new CursorPosition(1, 0)), jump(tree, 0, 0, true, 1));
        assertEquals(Optional.of(new CursorPosition(2, 0)), jump(tree, 0, 0, true, 2));
        assertEquals(Optional.of(new CursorPosition(0, 0)), jump(tree, 1, 0, false, 1));
    }

    @Test
    void columnsAreCountedInCharacters() {
        SyntaxTree tree = parse("const s = 'привет'; const t = 1;", "javascript");

        SyntaxNode second = tree.root().child(1);
        assertEquals("lexical_declaration", second.kind());
        assertEquals(20, second.startCol());
        assertEquals(Optional.of(new CursorPosition(0, 20)), jump(tree, 0, 0, true, 1));
    }

    @Test
    void pythonElifLadder() {
        String source = """
                if a:
                    x()
                elif b:
                    y()
                else:
                    z()
                done()
                """;
        SyntaxTree tree = parse(source, "python");

        assertEquals(Optional.of(new CursorPosition(2, 0)), jump(tree, 0, 0, true, 1));
        assertEquals(Optional.of(new CursorPosition(4, 0)), jump(tree, 2, 0, true, 1));
        assertEquals(Optional.of(new CursorPosition(6, 0)), jump(tree, 4, 0, true, 1));
    }

    @Test
    void javaStatementsInsideMethodBody() {
        String source = """
                class A {
                  void f() {
                    a();
                    b();
                  }
                }
                """;
        SyntaxTree tree = parse(source, "java");

        assertEquals(Optional.of(new CursorPosition(3, 4)), jump(tree, 2, 4, true, 1));
        assertEquals(Optional.of(new CursorPosition(2, 4)), jump(tree, 3, 4, false, 1));
    }

    @Test
    void typescriptAndTsxShareGrammar() {
        assertNotNull(manager.getLanguage("typescript"));
        assertNotNull(manager.getLanguage("tsx"));
        SyntaxTree tree = parse("type Id = string;\nlet x: Id = 'a';\n", "typescript");
        assertEquals(Optional.of(new CursorPosition(1, 0)), jump(tree, 0, 0, true, 1));
    }

    @Test
    void cacheReusesTreeUntilContentChanges() {
        Path path = Path.of("cached.js");
        TreeSitterManager.ParseResult first = manager.getCachedOrParse(path, "a();", "javascript");
        TreeSitterManager.ParseResult same = manager.getCachedOrParse(path, "a();", "javascript");
        TreeSitterManager.ParseResult changed = manager.getCachedOrParse(path, "b();", "javascript");

        assertSame(first.tree(), same.tree());
        assertNotSame(first.tree(), changed.tree());
        assertEquals(1, manager.getCacheSize());

        manager.invalidateCache(path);
        assertEquals(0, manager.getCacheSize());
    }

    @Test
    void unsupportedLanguageIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> manager.parse("x", "cobol"));
    }
}
