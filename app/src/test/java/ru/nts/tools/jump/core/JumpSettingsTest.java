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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JumpSettingsTest {

    @Test
    void defaults() {
        JumpSettings settings = JumpSettings.from(Map.of());

        assertEquals(Paths.get(".").toAbsolutePath().normalize(), settings.projectRoot());
        assertFalse(settings.debug());
        assertFalse(settings.hasLanguageRestriction());
        assertEquals(JumpSettings.DEFAULT_MAX_COUNT, settings.maxCount());
    }

    @Test
    void readsAllVariables(@TempDir Path root) {
        JumpSettings settings = JumpSettings.from(Map.of(
                "PROJECT_ROOT", root.toString(),
                "MCP_DEBUG", "TRUE",
                "SIBLING_JUMP_LANGUAGES", " Python, typescript ,",
                "SIBLING_JUMP_MAX_COUNT", "7"));

        assertEquals(root.toAbsolutePath().normalize(), settings.projectRoot());
        assertTrue(settings.debug());
        assertEquals(Set.of("python", "typescript"), settings.languages());
        assertEquals(7, settings.maxCount());
    }

    @Test
    void invalidValuesFallBack(@TempDir Path root) {
        JumpSettings settings = JumpSettings.from(Map.of(
                "PROJECT_ROOT", root.resolve("missing").toString(),
                "SIBLING_JUMP_LANGUAGES", "cobol,java",
                "SIBLING_JUMP_MAX_COUNT", "0"));

        assertEquals(Paths.get(".").toAbsolutePath().normalize(), settings.projectRoot());
        assertEquals(Set.of("java"), settings.languages());
        assertEquals(JumpSettings.DEFAULT_MAX_COUNT, settings.maxCount());

        assertEquals(JumpSettings.DEFAULT_MAX_COUNT,
                JumpSettings.from(Map.of("SIBLING_JUMP_MAX_COUNT", "many")).maxCount());
    }
}
