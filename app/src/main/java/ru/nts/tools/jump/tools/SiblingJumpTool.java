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
import ru.nts.tools.jump.core.NtsParamException;
import ru.nts.tools.jump.engine.CursorPosition;
import ru.nts.tools.jump.engine.StructuralNavigator;
import ru.nts.tools.jump.engine.VirtualCursorHost;

import java.util.Optional;

/**
 * MCP Tool для перехода к соседней структурной единице кода (next / prev).
 */
public class SiblingJumpTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final StructuralNavigator navigator;
    private final NavigationToggles toggles;
    private final int maxCount;

    public SiblingJumpTool(StructuralNavigator navigator, NavigationToggles toggles, int maxCount) {
        this.navigator = navigator;
        this.toggles = toggles;
        this.maxCount = maxCount;
    }

    @Override
    public String getName() {
        return "nts_sibling_jump";
    }

    @Override
    public String getDescription() {
        return """
            Structural sibling navigation (tree-sitter).

            Moves the cursor from the code unit under it to the next or previous
            unit on the same level: statements, object properties, array elements,
            arguments, parameters, union members, JSX attributes.
            Special ladders: method chains, if/else-if/else, switch cases, try/catch/finally.

            INPUT: path + line/column (1-based) + direction + count
            OUTPUT: new cursor position, or no-op with the reason.

            LANGUAGES: Java, JS/JSX, TS/TSX, Python
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

        props.putObject("line").put("type", "integer").put("description",
                "Cursor line (1-based). Default: 1.");

        props.putObject("column").put("type", "integer").put("description",
                "Cursor column (1-based). Default: 1.");

        props.putObject("direction").put("type", "string").put("description",
                "'next' or 'prev'. Default: 'next'.");

        props.putObject("count").put("type", "integer").put("description",
                "How many jumps to repeat (1.." + maxCount + "). Default: 1. Stops at the first jump without target.");

        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        boolean forward = parseDirection(params.path("direction").asText("next"));
        int count = params.path("count").asInt(1);
        if (count < 1 || count > maxCount) {
            throw NtsParamException.outOfRange("count", count, 1, maxCount);
        }

        NavigationDocument document = NavigationDocument.open(params);
        CursorPosition start = document.cursor(params);

        if (!document.parsed()) {
            return noOp(start, document.unavailableReason());
        }
        if (!toggles.isEnabled(document.path())) {
            return noOp(start, "navigation is disabled for this document (see nts_jump_toggle)");
        }

        VirtualCursorHost host = new VirtualCursorHost(document.tree(), start);
        Optional<CursorPosition> moved = navigator.navigateSibling(host, forward, count);
        if (moved.isEmpty()) {
            return noOp(start, "no " + (forward ? "next" : "previous") + " sibling at " + start.format());
        }

        CursorPosition target = moved.get();
        int jumps = host.jumpHistory().size();
        String text = "Moved " + (forward ? "next" : "prev") + " to " + target.format()
                + " (" + jumps + (jumps == 1 ? " jump" : " jumps") + ")";
        if (jumps < count) {
            text += ", stopped early: no further sibling";
        }
        return createResponse(text, true, target, jumps, null);
    }

    private boolean parseDirection(String direction) {
        return switch (direction.toLowerCase()) {
            case "next" -> true;
            case "prev", "previous" -> false;
            default -> throw NtsParamException.invalid("direction", direction, "'next' or 'prev'");
        };
    }

    private JsonNode noOp(CursorPosition cursor, String reason) {
        return createResponse("No-op: " + reason, false, cursor, 0, reason);
    }

    private JsonNode createResponse(String text, boolean moved, CursorPosition cursor, int jumps, String reason) {
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", text);
        ObjectNode result = res.putObject("result");
        result.put("moved", moved);
        result.put("line", cursor.row() + 1);
        result.put("column", cursor.col() + 1);
        result.put("jumps", jumps);
        if (reason != null) {
            result.put("reason", reason);
        }
        return res;
    }
}
