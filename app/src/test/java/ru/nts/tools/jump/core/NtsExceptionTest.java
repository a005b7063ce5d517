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

import static org.junit.jupiter.api.Assertions.*;

class NtsExceptionTest {

    @Test
    void solutionPlaceholdersAreResolved() {
        NtsParamException e = NtsParamException.lineExceeds(40, 12, "src/app.ts");

        String message = e.getMessage();
        assertTrue(message.startsWith("[ERROR: PARAM_LINE_EXCEEDS]"));
        assertTrue(message.contains("File has 12 lines, requested line 40"));
        assertTrue(message.contains("Context: line=40, totalLines=12, path=src/app.ts"));
        assertEquals(NtsErrorCode.PARAM_LINE_EXCEEDS, e.getCode());
    }

    @Test
    void unknownPlaceholdersAreMasked() {
        NtsException e = new NtsException(NtsErrorCode.IO_ERROR, "path", "a.ts");

        assertTrue(e.toUserMessage().contains("Reading 'a.ts' failed: ..."));
        assertEquals("a.ts", e.getContext().get("path"));
        assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("x", 1));
    }
}
