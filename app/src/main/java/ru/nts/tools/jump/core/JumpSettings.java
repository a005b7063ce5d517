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
package ru.nts.tools.jump.core;

import ru.nts.tools.jump.core.treesitter.LanguageDetector;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Настройки сервера навигации, читаются один раз из переменных окружения.
 * <ul>
 *   <li>{@code PROJECT_ROOT} корень песочницы для путей (по умолчанию текущая директория);</li>
 *   <li>{@code MCP_DEBUG} диагностика в stderr;</li>
 *   <li>{@code SIBLING_JUMP_LANGUAGES} список языков через запятую, для которых навигация включена изначально;</li>
 *   <li>{@code SIBLING_JUMP_MAX_COUNT} верхняя граница параметра count (по умолчанию 100).</li>
 * </ul>
 * Некорректные значения заменяются значениями по умолчанию с предупреждением в stderr.
 *
 * @param projectRoot корень проекта
 * @param debug       режим отладки
 * @param languages   ограничение языков; пустое множество = без ограничения
 * @param maxCount    максимальное число повторов одного перехода
 */
public record JumpSettings(Path projectRoot, boolean debug, Set<String> languages, int maxCount) {

    public static final int DEFAULT_MAX_COUNT = 100;

    public JumpSettings {
        languages = Collections.unmodifiableSet(new LinkedHashSet<>(languages));
    }

    public static JumpSettings fromEnvironment() {
        return from(System.getenv());
    }

    public static JumpSettings from(Map<String, String> env) {
        boolean debug = "true".equalsIgnoreCase(env.get("MCP_DEBUG"));
        return new JumpSettings(
                parseRoot(env.get("PROJECT_ROOT")),
                debug,
                parseLanguages(env.get("SIBLING_JUMP_LANGUAGES")),
                parseMaxCount(env.get("SIBLING_JUMP_MAX_COUNT")));
    }

    public boolean hasLanguageRestriction() {
        return !languages.isEmpty();
    }

    private static Path parseRoot(String value) {
        Path fallback = Paths.get(".").toAbsolutePath().normalize();
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            Path root = Paths.get(value).toAbsolutePath().normalize();
            if (Files.isDirectory(root)) {
                return root;
            }
            warn("PROJECT_ROOT is not a directory: " + value + ", using " + fallback);
        } catch (InvalidPathException e) {
            warn("PROJECT_ROOT is not a valid path: " + value + ", using " + fallback);
        }
        return fallback;
    }

    private static Set<String> parseLanguages(String value) {
        Set<String> result = new LinkedHashSet<>();
        if (value == null || value.isBlank()) {
            return result;
        }
        for (String part : value.split(",")) {
            String langId = part.trim().toLowerCase();
            if (langId.isEmpty()) {
                continue;
            }
            if (LanguageDetector.isSupported(langId)) {
                result.add(langId);
            } else {
                warn("SIBLING_JUMP_LANGUAGES: unknown language '" + langId + "' ignored. Supported: "
                        + LanguageDetector.getSupportedLanguages());
            }
        }
        return result;
    }

    private static int parseMaxCount(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_MAX_COUNT;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed >= 1) {
                return parsed;
            }
            warn("SIBLING_JUMP_MAX_COUNT must be positive: " + value + ", using " + DEFAULT_MAX_COUNT);
        } catch (NumberFormatException e) {
            warn("SIBLING_JUMP_MAX_COUNT is not a number: " + value + ", using " + DEFAULT_MAX_COUNT);
        }
        return DEFAULT_MAX_COUNT;
    }

    private static void warn(String message) {
        System.err.println("[SERVER] WARNING: " + message);
    }
}
