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

/**
 * Итог обхода границ: переход на позицию либо выделение диапазона.
 *
 * @param handler      имя сработавшего обработчика
 * @param target       новая позиция курсора (начало выделения в режиме выделения)
 * @param selectionEnd конец выделения или null при обычном переходе
 */
public record BoundaryResult(String handler, BoundaryPosition target, BoundaryPosition selectionEnd) {

    public static BoundaryResult moved(String handler, BoundaryPosition target) {
        return new BoundaryResult(handler, target, null);
    }

    public static BoundaryResult selected(String handler, BoundaryPosition first, BoundaryPosition last) {
        return new BoundaryResult(handler, first, last);
    }

    public boolean isSelection() {
        return selectionEnd != null;
    }
}
