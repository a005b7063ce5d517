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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.jump.core.JumpSettings;
import ru.nts.tools.jump.core.McpRouter;
import ru.nts.tools.jump.core.NavigationToggles;
import ru.nts.tools.jump.core.PathSanitizer;
import ru.nts.tools.jump.engine.StructuralNavigator;
import ru.nts.tools.jump.tools.BlockBoundaryTool;
import ru.nts.tools.jump.tools.JumpToggleTool;
import ru.nts.tools.jump.tools.SiblingJumpTool;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * MCP сервер структурной навигации по коду.
 * Реализует протокол Model Context Protocol через стандартные потоки ввода-вывода (stdio).
 * Запросы обрабатываются последовательно в порядке поступления: инструменты только читают файлы
 * и работают быстро, а порядок ответов совпадает с порядком запросов.
 */
public class JumpServer {

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Флаг включения отладочной информации в stderr (MCP_DEBUG=true).
     * Некоторые клиенты объединяют stderr и stdout, поэтому по умолчанию выключен.
     */
    private static volatile boolean debug = false;

    /**
     * Точка входа в приложение. Читает настройки из окружения и запускает цикл чтения команд.
     *
     * @param args Аргументы командной строки (не используются).
     */
    public static void main(String[] args) {
        // Принудительно устанавливаем UTF-8 для стандартных потоков вывода,
        // так как на Windows они по умолчанию используют системную кодировку.
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        run(JumpSettings.fromEnvironment());
    }

    /**
     * Запускает цикл чтения JSON-RPC сообщений из stdin до конца потока.
     */
    static void run(JumpSettings settings) {
        debug = settings.debug();

        // Клиенты MCP могут запускать сервер с произвольным CWD, поэтому корень берется из PROJECT_ROOT
        PathSanitizer.setRoot(settings.projectRoot());
        log("Project root: " + PathSanitizer.getRoot());
        if (settings.hasLanguageRestriction()) {
            log("Navigation enabled by default only for: " + settings.languages());
        }

        McpRouter router = createRouter(settings);
        log("Jump server starting...");

        try (var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    processMessage(router, line);
                }
            }
        } catch (IOException e) {
            log("Error in server loop: " + e.getMessage());
        }
    }

    /**
     * Регистрирует инструменты навигации с общим навигатором и таблицей включения документов.
     */
    static McpRouter createRouter(JumpSettings settings) {
        McpRouter router = new McpRouter(mapper);
        StructuralNavigator navigator = StructuralNavigator.standard(settings.debug());
        NavigationToggles toggles = new NavigationToggles(settings.languages());

        router.registerTool(new SiblingJumpTool(navigator, toggles, settings.maxCount()));
        router.registerTool(new BlockBoundaryTool(navigator, toggles));
        router.registerTool(new JumpToggleTool(toggles));
        return router;
    }

    /**
     * Обрабатывает одиночное JSON-RPC сообщение: парсинг, диспетчеризация метода и отправка ответа.
     *
     * @param message Строка, содержащая JSON-RPC запрос.
     */
    private static void processMessage(McpRouter router, String message) {
        JsonNode request;
        try {
            request = mapper.readTree(message);
        } catch (JsonProcessingException e) {
            log("Failed to parse message: " + e.getMessage());
            ObjectNode response = mapper.createObjectNode();
            response.put("jsonrpc", "2.0");
            response.putNull("id");
            response.set("error", error(-32700, "Parse error: " + e.getOriginalMessage()));
            sendResponse(response);
            return;
        }

        String method = request.path("method").asText();
        JsonNode id = request.get("id");
        log("Received method: " + method);

        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        if (id != null) {
            response.set("id", id);
        }

        try {
            switch (method) {
                case "initialize" -> {
                    var clientInfo = request.path("params").path("clientInfo");
                    log("Client info: " + clientInfo.path("name").asText("unknown")
                            + " (" + clientInfo.path("version").asText("") + ")");

                    var result = mapper.createObjectNode();
                    result.put("protocolVersion", "2024-11-05");
                    var capabilities = result.putObject("capabilities");
                    capabilities.putObject("tools").put("listChanged", false);

                    var serverInfo = result.putObject("serverInfo");
                    serverInfo.put("name", "NTS-Jump-MCP");
                    serverInfo.put("version", "1.0.0");
                    response.set("result", result);
                }
                case "notifications/initialized" -> {
                    // На уведомление ответ не отправляется
                    log("Client initialized connection.");
                    return;
                }
                case "ping" -> response.set("result", mapper.createObjectNode());
                case "tools/list" -> response.set("result", router.listTools());
                case "tools/call" -> {
                    String toolName = request.path("params").path("name").asText();
                    JsonNode params = request.path("params").path("arguments");
                    response.set("result", router.callTool(toolName, params));
                }
                default -> {
                    if (id != null) {
                        response.set("error", error(-32601, "Method not found: " + method));
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            log("IllegalArgumentException: " + e.getMessage());
            if (id != null) {
                response.set("error", error(-32602, "Invalid params: " + e.getMessage()));
            }
        } catch (RuntimeException e) {
            log("Exception in tool: " + e.getClass().getName() + ": " + e.getMessage());
            if (id != null) {
                response.set("error", error(-32603, "Internal error: " + e.getMessage()));
            }
        }

        // Ответ отправляется только на запросы (есть id)
        if (id != null) {
            sendResponse(response);
        }
    }

    private static ObjectNode error(int code, String message) {
        var error = mapper.createObjectNode();
        error.put("code", code);
        error.put("message", message);
        return error;
    }

    /**
     * Отправка ответа в стандартный поток вывода, по одному JSON на строку.
     */
    private static synchronized void sendResponse(ObjectNode response) {
        try {
            String json = mapper.writeValueAsString(response);
            log(">>> SEND: " + json);
            System.out.print(json + "\n");
            System.out.flush();
        } catch (IOException e) {
            log("Failed to send response: " + e.getMessage());
        }
    }

    private static void log(String message) {
        if (debug) {
            System.err.println("[SERVER] " + message);
        }
    }
}
