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
 * Чистые предикаты над типами узлов.
 * Ни один предикат не бросает исключений: неизвестный тип просто дает false.
 */
public final class NodeClassifier {

    private NodeClassifier() {}

    /**
     * Комментарий или разделитель комментария.
     */
    public static boolean isComment(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        String kind = node.kind();
        return kind.contains("comment") || NodeKinds.COMMENT_DELIMITERS.contains(kind);
    }

    /**
     * Узлы, которые никогда не являются соседями: комментарии, пунктуация,
     * половинки JSX-тегов, ключевые слова case/default и узлы с пустым диапазоном.
     */
    public static boolean isSkippable(SyntaxNode node) {
        if (node == null) {
            return true;
        }
        String kind = node.kind();
        if (isComment(node) || NodeKinds.PUNCTUATION.contains(kind)) {
            return true;
        }
        if (NodeKinds.JSX_TAG_HALVES.contains(kind)) {
            return true;
        }
        if (kind.equals("case") || kind.equals("default")) {
            return true;
        }
        return node.isEmptyRange();
    }

    /**
     * Является ли узел полноценной единицей навигации.
     * <p>
     * Исключения из списка типов:
     * identifier значим только как элемент деструктуризации кортежа (array_pattern);
     * type_identifier значим везде, кроме прямого членства в union_type.
     */
    public static boolean isMeaningful(SyntaxNode node) {
        if (node == null) {
            return false;
        }
        String kind = node.kind();
        if (kind.equals("identifier")) {
            SyntaxNode parent = node.parent();
            return parent != null && parent.is("array_pattern");
        }
        if (kind.equals("type_identifier")) {
            SyntaxNode parent = node.parent();
            return parent != null && !parent.is(NodeKinds.UNION_TYPE);
        }
        return NodeKinds.MEANINGFUL.contains(kind);
    }

    public static boolean isContainer(String kind) {
        return NodeKinds.CONTAINERS.contains(kind);
    }

    public static boolean isListContainer(String kind) {
        return NodeKinds.LIST_CONTAINERS.contains(kind);
    }

    /**
     * Количество значимых прямых детей узла.
     */
    public static int countMeaningfulChildren(SyntaxNode node) {
        int count = 0;
        for (SyntaxNode child : node.children()) {
            if (isMeaningful(child)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Количество прямых детей, не являющихся пунктуацией или комментариями.
     */
    public static int countNonSkippableChildren(SyntaxNode node) {
        int count = 0;
        for (SyntaxNode child : node.children()) {
            if (!isSkippable(child)) {
                count++;
            }
        }
        return count;
    }
}
