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
package ru.nts.tools.jump.tools;

import com.fasterxml.jackson.databind.JsonNode;
import ru.nts.tools.jump.core.NtsErrorCode;
import ru.nts.tools.jump.core.NtsException;
import ru.nts.tools.jump.core.NtsParamException;
import ru.nts.tools.jump.core.PathSanitizer;
import ru.nts.tools.jump.core.treesitter.LanguageDetector;
import ru.nts.tools.jump.core.treesitter.TreeSitterManager;
import ru.nts.tools.jump.engine.CursorPosition;
import ru.nts.tools.jump.engine.SyntaxTree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Документ, открытый инструментом навигации: путь в песочнице, текст и дерево разбора.
 * <p>
 * Неподдерживаемый язык и неудачный разбор не считаются ошибкой: дерево отсутствует,
 * а {@link #unavailableReason()} объясняет, почему переход не выполняется.
 *
 * @param path              нормализованный путь
 * @param tree              дерево разбора или null
 * @param lineCount         число строк документа
 * @param unavailableReason причина отсутствия дерева или null
 */
record NavigationDocument(Path path, SyntaxTree tree, int lineCount, String unavailableReason) {

    /**
     * Открывает документ по параметру path.
     *
     * @throws NtsParamException если параметр отсутствует
     * @throws NtsException      если файл не найден, не читается или слишком большой
     * @throws SecurityException если путь вне корня проекта
     */
    static NavigationDocument open(JsonNode params) throws IOException {
        String pathStr = params.path("path").asText("");
        if (pathStr.isEmpty()) {
            throw NtsParamException.missing("path");
        }

        Path path = PathSanitizer.sanitize(pathStr);
        if (!Files.exists(path)) {
            throw new NtsException(NtsErrorCode.FILE_NOT_FOUND, "path", pathStr);
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new NtsException(NtsErrorCode.FILE_NOT_READABLE, "path", pathStr);
        }
        PathSanitizer.checkFileSize(path);

        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("path", pathStr);
            context.put("error", e.getMessage());
            throw new NtsException(NtsErrorCode.IO_ERROR, context, e);
        }
        int lineCount = SyntaxTree.splitLines(content).size();

        Optional<String> langId = LanguageDetector.detect(path, content);
        if (langId.isEmpty()) {
            return new NavigationDocument(path, null, lineCount,
                    "unsupported language for " + path.getFileName()
                            + " (supported: " + String.join(", ", LanguageDetector.getSupportedLanguages()) + ")");
        }

        try {
            SyntaxTree tree = TreeSitterManager.getInstance()
                    .getCachedOrParse(path, content, langId.get())
                    .toSyntaxTree();
            return new NavigationDocument(path, tree, lineCount, null);
        } catch (IllegalStateException e) {
            return new NavigationDocument(path, null, lineCount, "file could not be parsed: " + e.getMessage());
        }
    }

    boolean parsed() {
        return tree != null;
    }

    /**
     * Позиция курсора из 1-based параметров line и column (по умолчанию 1:1).
     * Колонка за концом строки прижимается к концу строки.
     */
    CursorPosition cursor(JsonNode params) {
        int line = params.path("line").asInt(1);
        int column = params.path("column").asInt(1);
        if (line < 1) {
            throw NtsParamException.outOfRange("line", line, 1, lineCount);
        }
        if (line > lineCount) {
            throw NtsParamException.lineExceeds(line, lineCount, path.toString());
        }
        if (column < 1) {
            throw NtsParamException.outOfRange("column", column, 1, "end of line");
        }
        int row = line - 1;
        int col = column - 1;
        if (tree != null) {
            col = Math.min(col, tree.line(row).length());
        }
        return new CursorPosition(row, col);
    }
}
