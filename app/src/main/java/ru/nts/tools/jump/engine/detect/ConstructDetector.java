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
import ru.nts.tools.jump.engine.SyntaxNode;

import java.util.Optional;

/**
 * Детектор специальной конструкции (цепочка вызовов, лестница if, case, try).
 * <p>
 * Детекторы опрашиваются навигатором в фиксированном порядке до обычного поиска соседей.
 * Первый детектор, распознавший курсор, решает судьбу шага.
 *
 * @param <C> контекст конструкции, вычисленный при распознавании
 */
public interface ConstructDetector<C> {

    /**
     * Имя для диагностики.
     */
    String name();

    /**
     * Распознает конструкцию под курсором.
     *
     * @param node   наименьший узел под курсором
     * @param cursor позиция курсора (0-based)
     * @return контекст или empty, если курсор не относится к конструкции
     */
    Optional<C> detect(SyntaxNode node, CursorPosition cursor);

    /**
     * Шаг вперед или назад внутри конструкции.
     *
     * @return цель или empty на границе конструкции
     */
    Optional<JumpTarget> step(C context, boolean forward);

    /**
     * Что делать, когда {@link #step} вернул empty.
     */
    BoundaryPolicy boundaryPolicy();
}
