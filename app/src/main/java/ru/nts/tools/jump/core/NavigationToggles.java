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

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Включение и выключение навигации по документам.
 * Явные переопределения хранятся по нормализованному пути; без переопределения документ включен,
 * если не задано ограничение языков. При ограничении включены только документы перечисленных языков.
 */
public class NavigationToggles {

    private final Map<Path, Boolean> overrides = new ConcurrentHashMap<>();
    private final Set<String> languages;

    /**
     * @param languages ограничение языков; пустое множество = навигация включена для всех документов
     */
    public NavigationToggles(Set<String> languages) {
        this.languages = Set.copyOf(languages);
    }

    public boolean isEnabled(Path path) {
        Boolean override = overrides.get(key(path));
        return override != null ? override : enabledByDefault(path);
    }

    public void enable(Path path) {
        overrides.put(key(path), true);
    }

    public void disable(Path path) {
        overrides.put(key(path), false);
    }

    /**
     * @return новое состояние документа
     */
    public boolean toggle(Path path) {
        return overrides.compute(key(path), (p, current) -> !(current != null ? current : enabledByDefault(p)));
    }

    /**
     * @return true, если для документа задано явное переопределение
     */
    public boolean hasOverride(Path path) {
        return overrides.containsKey(key(path));
    }

    private boolean enabledByDefault(Path path) {
        if (languages.isEmpty()) {
            return true;
        }
        Optional<String> langId = LanguageDetector.detect(path);
        if (langId.isEmpty()) {
            return false;
        }
        // tsx разбирается грамматикой typescript
        return languages.contains(langId.get()) || ("tsx".equals(langId.get()) && languages.contains("typescript"));
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
