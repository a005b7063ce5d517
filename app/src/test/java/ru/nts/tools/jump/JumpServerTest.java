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
package ru.nts.tools.jump;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.jump.core.JumpSettings;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Интеграционные тесты JSON-RPC цикла сервера навигации.
 */
class JumpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final InputStream originalIn = System.in;
    private final PrintStream originalOut = System.out;

    @TempDir
    Path tempDir;

    @AfterEach
    void restoreStreams() {
        System.setIn(originalIn);
        System.setOut(originalOut);
    }

    /**
     * Прогоняет строки запросов через сервер и возвращает ответы по одному JSON на строку.
     */
    private List<JsonNode> exchange(String... requests) throws Exception {
        String input = String.join("\n", requests) + "\n";
        System.setIn(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));

        JumpServer.run(JumpSettings.from(Map.of("PROJECT_ROOT", tempDir.toString())));

        List<JsonNode> responses = new ArrayList<>();
        for (String line : outContent.toString(StandardCharsets.UTF_8).split("\n")) {
            if (line.trim().startsWith("{")) {
                responses.add(mapper.readTree(line));
            }
        }
        return responses;
    }

    @Test
    void initializeAndPing() throws Exception {
        List<JsonNode> responses = exchange(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"clientInfo\":{\"name\":\"test\"}}}",
                "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
                "",
                "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}");

        assertEquals(2, responses.size(), "На уведомление ответ не отправляется");
        JsonNode init = responses.get(0);
        assertEquals(1, init.get("id").asInt());
        assertEquals("2024-11-05", init.get("result").get("protocolVersion").asText());
        assertEquals("NTS-Jump-MCP", init.get("result").get("serverInfo").get("name").asText());
        assertFalse(init.get("result").get("capabilities").get("tools").get("listChanged").asBoolean());

        JsonNode ping = responses.get(1);
        assertEquals(2, ping.get("id").asInt());
        assertEquals(0, ping.get("result").size());
    }

    @Test
    void listsNavigationTools() throws Exception {
        JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/list\"}").get(0);

        List<String> names = new ArrayList<>();
        response.get("result").get("tools").forEach(t -> names.add(t.get("name").asText()));
        assertTrue(names.containsAll(List.of("nts_sibling_jump", "nts_block_boundary", "nts_jump_toggle")));
        assertEquals(3, names.size());
    }

    @Test
    void callsToolThroughProtocol() throws Exception {
        Files.writeString(tempDir.resolve("main.py"), "a = 1\nb = 2\n");

        JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/call\",\"params\":"
                + "{\"name\":\"nts_sibling_jump\",\"arguments\":{\"path\":\"main.py\",\"line\":1,\"column\":1}}}").get(0);

        JsonNode result = response.get("result").get("result");
        assertTrue(result.get("moved").asBoolean());
        assertEquals(2, result.get("line").asInt());
    }

    @Test
    void protocolErrors() throws Exception {
        List<JsonNode> responses = exchange(
                "{not json",
                "{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"resources/list\"}",
                "{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"tools/call\",\"params\":{\"name\":\"nts_unknown\"}}");

        assertEquals(3, responses.size());
        assertEquals(-32700, responses.get(0).get("error").get("code").asInt());
        assertTrue(responses.get(0).get("id").isNull());
        assertEquals(-32601, responses.get(1).get("error").get("code").asInt());
        assertEquals(-32602, responses.get(2).get("error").get("code").asInt());
    }
}
