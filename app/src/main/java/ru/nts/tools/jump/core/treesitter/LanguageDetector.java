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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет язык документа по расширению файла или shebang.
 * Поддерживаемые языки: java, javascript, typescript, tsx, python.
 */
public final class LanguageDetector {

    private LanguageDetector() {}

    private static final Map<String, String> EXTENSION_MAP = Map.ofEntries(
            // Java
            Map.entry("java", "java"),

            // JavaScript
            Map.entry("js", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("jsx", "javascript"),

            // TypeScript
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "tsx"),
            Map.entry("mts", "typescript"),
            Map.entry("cts", "typescript"),

            // Python
            Map.entry("py", "python"),
            Map.entry("pyi", "python"),
            Map.entry("pyw", "python")
    );

    private static final List<String> SUPPORTED_LANGUAGES = List.of(
            "java", "javascript", "typescript", "tsx", "python"
    );

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return идентификатор языка или empty, если язык не поддерживается
     */
    public static Optional<String> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }

        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return Optional.empty();
        }

        String extension = fileName.substring(dotIndex + 1).toLowerCase();
        return Optional.ofNullable(EXTENSION_MAP.get(extension));
    }

    /**
     * Определяет язык по пути и содержимому: файлы без расширения распознаются по shebang.
     */
    public static Optional<String> detect(Path path, String content) {
        Optional<String> byExtension = detect(path);
        if (byExtension.isPresent()) {
            return byExtension;
        }

        if (content != null && content.startsWith("#!")) {
            String firstLine = content.lines().findFirst().orElse("");

            if (firstLine.contains("python")) {
                return Optional.of("python");
            }
            if (firstLine.contains("node") || firstLine.contains("deno") || firstLine.contains("bun")) {
                return Optional.of("javascript");
            }
        }

        return Optional.empty();
    }

    public static boolean isSupported(String langId) {
        return langId != null && SUPPORTED_LANGUAGES.contains(langId.toLowerCase());
    }

    /**
     * @return неизменяемый список идентификаторов языков
     */
    public static List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }
}
