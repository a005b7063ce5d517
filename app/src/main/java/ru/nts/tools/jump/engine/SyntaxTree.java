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

import java.util.List;

/**
 * Разобранный документ: корень дерева, строки исходника и идентификатор языка.
 *
 * @param root   корневой узел
 * @param lines  строки исходного текста без символов перевода строки
 * @param langId идентификатор языка (java, javascript, typescript, python...)
 */
public record SyntaxTree(SyntaxNode root, List<String> lines, String langId) {

    public SyntaxTree {
        lines = List.copyOf(lines);
    }

    /**
     * Создает дерево, разбивая исходный текст на строки по '\n' (завершающий '\r' отбрасывается).
     */
    public static SyntaxTree of(SyntaxNode root, String source, String langId) {
        return new SyntaxTree(root, splitLines(source), langId);
    }

    public static List<String> splitLines(String source) {
        String[] raw = source.split("\n", -1);
        String[] lines = new String[raw.length];
        for (int i = 0; i < raw.length; i++) {
            String line = raw[i];
            lines[i] = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        }
        return List.of(lines);
    }

    /**
     * @return строка по номеру (0-based) или пустая строка за пределами документа
     */
    public String line(int row) {
        if (row < 0 || row >= lines.size()) {
            return "";
        }
        return lines.get(row);
    }
}
