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
import ru.nts.tools.jump.core.McpTool;
import ru.nts.tools.jump.core.NavigationToggles;
import ru.nts.tools.jump.core.NtsErrorCode;
import ru.nts.tools.jump.core.NtsException;
import ru.nts.tools.jump.core.NtsParamException;
import ru.nts.tools.jump.core.PathSanitizer;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * MCP Tool для включения и выключения структурной навигации в документе.
 */
public class JumpToggleTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final NavigationToggles toggles;

    public JumpToggleTool(NavigationToggles toggles) {
        this.toggles = toggles;
    }

    @Override
    public String getName() {
        return "nts_jump_toggle";
    }

    @Override
    public String getDescription() {
        return """
            Enable or disable structural navigation for a document.

            ACTIONS: enable | disable | toggle | status
            Disabled documents make nts_sibling_jump and nts_block_boundary a no-op.
            """;
    }

    @Override
    public String getCategory() {
        return "navigation";
    }

    @Override
    public JsonNode getInputSchema() {
        var schema = mapper.createObjectNode();
        schema.put("type", "object");
        var props = schema.putObject("properties");

        props.putObject("path").put("type", "string").put("description",
                "File path (relative or absolute). REQUIRED.");

        props.putObject("action").put("type", "string").put("description",
                "'enable', 'disable', 'toggle' or 'status'. Default: 'status'.");

        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        String pathStr = params.path("path").asText("");
        if (pathStr.isEmpty()) {
            throw NtsParamException.missing("path");
        }
        Path path = PathSanitizer.sanitize(pathStr);
        if (!Files.exists(path)) {
            throw new NtsException(NtsErrorCode.FILE_NOT_FOUND, "path", pathStr);
        }

        String action = params.path("action").asText("status").toLowerCase();
        boolean enabled = switch (action) {
            case "enable" -> {
                toggles.enable(path);
                yield true;
            }
            case "disable" -> {
                toggles.disable(path);
                yield false;
            }
            case "toggle" -> toggles.toggle(path);
            case "status" -> toggles.isEnabled(path);
            default -> throw NtsParamException.invalid("action", action, "enable, disable, toggle or status");
        };

        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text",
                "Structural navigation is " + (enabled ? "enabled" : "disabled") + " for " + path.getFileName());
        ObjectNode result = res.putObject("result");
        result.put("path", path.toString());
        result.put("enabled", enabled);
        result.put("override", toggles.hasOverride(path));
        return res;
    }
}
