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

import java.util.Optional;

/**
 * Примитивы редактора, которыми пользуется навигатор.
 * Все координаты 0-based; перевод в 1-based выполняет слой инструментов.
 */
public interface EditorHost {

    /**
     * Свежее дерево документа.
     *
     * @return empty, если для языка нет парсера или текст не разобрался (навигация становится no-op)
     */
    Optional<SyntaxTree> tree();

    CursorPosition cursor();

    void moveCursor(CursorPosition position);

    /**
     * Запоминает текущую позицию в истории переходов. Вызывается один раз перед каждым переходом.
     */
    void pushJumpHistory();

    /**
     * Выделяет диапазон от начала до конца включительно.
     */
    void select(CursorPosition from, CursorPosition to);

    /**
     * Флаг включения навигации для документа. Хранится на стороне хоста.
     */
    boolean navigationActive();
}
