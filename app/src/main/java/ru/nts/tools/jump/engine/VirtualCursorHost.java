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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Хост в памяти: курсор, история переходов и последнее выделение без реального редактора.
 * Используется инструментами сервера и тестами.
 */
public class VirtualCursorHost implements EditorHost {

    /**
     * Выделенный диапазон.
     */
    public record Selection(CursorPosition start, CursorPosition end) {}

    private final SyntaxTree tree;
    private final boolean active;
    private final Deque<CursorPosition> history = new ArrayDeque<>();
    private CursorPosition cursor;
    private Selection selection;

    /**
     * @param tree   дерево документа или null, если документ не разобран
     * @param cursor начальная позиция курсора
     * @param active включена ли навигация для документа
     */
    public VirtualCursorHost(SyntaxTree tree, CursorPosition cursor, boolean active) {
        this.tree = tree;
        this.cursor = cursor;
        this.active = active;
    }

    public VirtualCursorHost(SyntaxTree tree, CursorPosition cursor) {
        this(tree, cursor, true);
    }

    @Override
    public Optional<SyntaxTree> tree() {
        return Optional.ofNullable(tree);
    }

    @Override
    public CursorPosition cursor() {
        return cursor;
    }

    @Override
    public void moveCursor(CursorPosition position) {
        this.cursor = position;
    }

    @Override
    public void pushJumpHistory() {
        history.push(cursor);
    }

    @Override
    public void select(CursorPosition from, CursorPosition to) {
        this.selection = new Selection(from, to);
        this.cursor = to;
    }

    @Override
    public boolean navigationActive() {
        return active;
    }

    /**
     * История переходов, от самого старого к самому новому.
     */
    public List<CursorPosition> jumpHistory() {
        List<CursorPosition> result = new ArrayList<>(history);
        Collections.reverse(result);
        return result;
    }

    public Optional<Selection> lastSelection() {
        return Optional.ofNullable(selection);
    }
}
