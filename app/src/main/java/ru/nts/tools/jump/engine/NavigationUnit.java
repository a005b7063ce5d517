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
 * То, что считается "единицей под курсором": конкретный узел
 * либо маркер, если курсор стоит на пробелах между детьми контейнера или на комментарии.
 * <p>
 * Маркер всегда терминален: он сразу превращается в цель перехода или no-op
 * и никогда не передается в поиск соседей.
 *
 * @param node          узел-единица (null для маркера)
 * @param marker        тип маркера (null для узла)
 * @param closestBefore ближайший значимый узел выше курсора (только для маркера)
 * @param closestAfter  ближайший значимый узел ниже курсора (только для маркера)
 */
public record NavigationUnit(SyntaxNode node, Marker marker, SyntaxNode closestBefore, SyntaxNode closestAfter) {

    public enum Marker {
        /** Курсор на пробелах между значимыми детьми контейнера. */
        ON_GAP,
        /** Курсор на комментарии или пустой строке. */
        ON_COMMENT
    }

    public static NavigationUnit of(SyntaxNode node) {
        return new NavigationUnit(node, null, null, null);
    }

    public static NavigationUnit onGap(SyntaxNode before, SyntaxNode after) {
        return new NavigationUnit(null, Marker.ON_GAP, before, after);
    }

    public static NavigationUnit onComment(SyntaxNode before, SyntaxNode after) {
        return new NavigationUnit(null, Marker.ON_COMMENT, before, after);
    }

    public boolean isMarker() {
        return marker != null;
    }

    /**
     * Цель перехода для маркера: следующий узел вперед или предыдущий назад.
     */
    public Optional<SyntaxNode> markerTarget(boolean forward) {
        return Optional.ofNullable(forward ? closestAfter : closestBefore);
    }
}
