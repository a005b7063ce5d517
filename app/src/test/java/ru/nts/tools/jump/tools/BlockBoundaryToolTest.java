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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.jump.core.NavigationToggles;
import ru.nts.tools.jump.core.PathSanitizer;
import ru.nts.tools.jump.engine.StructuralNavigator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для обхода границ конструкций (nts_block_boundary).
 */
class BlockBoundaryToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final BlockBoundaryTool tool =
            new BlockBoundaryTool(StructuralNavigator.standard(false), new NavigationToggles(Set.of()));

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        PathSanitizer.setRoot(tempDir);
        Files.writeString(tempDir.resolve("call.js"), "foo(a,\n    b\n);\n");
    }

    private ObjectNode params(int line, int column) {
        ObjectNode params = mapper.createObjectNode();
        params.put("path", "call.js");
        params.put("line", line);
        params.put("column", column);
        return params;
    }

    @Test
    void cyclesBetweenCallNameAndClosingParen() throws Exception {
        JsonNode forward = tool.execute(params(1, 1)).get("result");
        assertTrue(forward.get("moved").asBoolean());
        assertEquals(3, forward.get("line").asInt());
        assertEquals(1, forward.get("column").asInt());
        assertEquals("call-expression", forward.get("handler").asText());
        assertEquals("closing_paren", forward.get("kind").asText());

        JsonNode back = tool.execute(params(3, 1)).get("result");
        assertEquals(1, back.get("line").asInt());
        assertEquals("call_name", back.get("kind").asText());
    }

    @Test
    void selectModeReturnsRange() throws Exception {
        ObjectNode params = params(1, 1);
        params.put("mode", "select");

        JsonNode result = tool.execute(params).get("result");

        JsonNode selection = result.get("selection");
        assertEquals(1, selection.get("start").get("line").asInt());
        assertEquals(1, selection.get("start").get("column").asInt());
        assertEquals(3, selection.get("end").get("line").asInt());
        assertEquals(1, selection.get("end").get("column").asInt());
    }

    @Test
    void plainCodeIsNoOp() throws Exception {
        Files.writeString(tempDir.resolve("plain.js"), "x = 1;\n");
        ObjectNode params = params(1, 1);
        params.put("path", "plain.js");

        JsonNode result = tool.execute(params).get("result");

        assertFalse(result.get("moved").asBoolean());
        assertTrue(result.get("reason").asText().startsWith("no construct"));
    }

    @Test
    void unknownModeIsError() {
        ObjectNode params = params(1, 1);
        params.put("mode", "jump");

        JsonNode response = tool.executeWithFeedback(params);
        assertTrue(response.path("isError").asBoolean());
    }
}
