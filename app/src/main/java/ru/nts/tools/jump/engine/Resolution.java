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

/**
 * Результат разрешения единицы навигации: единица и ее область либо причина отказа.
 * Отказ никогда не показывается пользователю, вызывающий код превращает его в no-op.
 *
 * @param unit   единица или null при отказе
 * @param scope  область, дети которой являются кандидатами в соседи (может быть null у корня)
 * @param reason причина отказа или null
 */
public record Resolution(NavigationUnit unit, SyntaxNode scope, String reason) {

    public static Resolution found(SyntaxNode node, SyntaxNode scope) {
        return new Resolution(NavigationUnit.of(node), scope, null);
    }

    public static Resolution marker(NavigationUnit marker, SyntaxNode scope) {
        return new Resolution(marker, scope, null);
    }

    public static Resolution notFound(String reason) {
        return new Resolution(null, null, reason);
    }

    public boolean isFound() {
        return unit != null;
    }
}
