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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Утилита для проверки и нормализации путей файловой системы (Path Sanitizer).
 * Реализует "песочницу": инструменты читают только файлы внутри корня проекта
 * и не загружают сверхбольшие файлы.
 */
public class PathSanitizer {

    /**
     * Текущий корень рабочей директории. Все операции должны ограничиваться этим путем.
     */
    private static Path root = Paths.get(".").toAbsolutePath().normalize();

    /**
     * Максимально допустимый размер файла для разбора (10 MB).
     */
    private static final long MAX_TEXT_FILE_SIZE = 10 * 1024 * 1024;

    /**
     * Переопределяет корень проекта (PROJECT_ROOT при старте, временные папки в тестах).
     *
     * @param newRoot Новый путь, который будет считаться корнем "песочницы".
     */
    public static void setRoot(Path newRoot) {
        root = newRoot.toAbsolutePath().normalize();
    }

    /**
     * Нормализует путь и гарантирует, что он находится строго внутри корня проекта.
     *
     * @param requestedPath Путь от клиента (абсолютный, относительный или с '..').
     *
     * @return Абсолютный нормализованный объект {@link Path}.
     *
     * @throws SecurityException Если путь ведет за пределы корня.
     */
    public static Path sanitize(String requestedPath) {
        // Предварительная нормализация разделителей для Windows
        String normalizedRequest = requestedPath.replace('\\', '/');
        Path requested = Paths.get(normalizedRequest);

        Path target = requested.isAbsolute()
                ? requested.toAbsolutePath().normalize()
                : root.resolve(normalizedRequest).toAbsolutePath().normalize();

        // Проверка Path Traversal: итоговый путь обязан начинаться с префикса корня
        if (!target.startsWith(root)) {
            throw new SecurityException("Access denied: path is outside of working directory: " + requestedPath + " (Root: " + root + ")");
        }
        return target;
    }

    /**
     * Проверяет файл на соответствие лимиту размера.
     *
     * @throws IOException   Если возникла ошибка при определении размера файла.
     * @throws NtsException Если размер файла превышает {@link #MAX_TEXT_FILE_SIZE} (FILE_TOO_LARGE).
     */
    public static void checkFileSize(Path path) throws IOException {
        if (Files.exists(path) && Files.isRegularFile(path)) {
            long size = Files.size(path);
            if (size > MAX_TEXT_FILE_SIZE) {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("path", path.getFileName());
                context.put("size", size);
                context.put("limit", MAX_TEXT_FILE_SIZE);
                throw new NtsException(NtsErrorCode.FILE_TOO_LARGE, context);
            }
        }
    }

    public static Path getRoot() {
        return root;
    }
}
