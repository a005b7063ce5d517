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
import ru.nts.tools.jump.engine.boundary.BoundaryPosition;
import ru.nts.tools.jump.engine.boundary.BoundaryResult;
import ru.nts.tools.jump.engine.boundary.CycleMode;

import java.util.Optional;

/**
 * MCP Tool для обхода границ конструкции под курсором: имя свойства, вызов, switch, цикл,
 * if-цепочка, объявление. Каждый вызов переводит курсор на следующую границу по кругу,
 * в режиме select возвращает диапазон всей конструкции.
 */
public class BlockBoundaryTool implements McpTool {

    private final ObjectMapper mapper = new ObjectMapper();
    private final StructuralNavigator navigator;
    private final NavigationToggles toggles;

    public BlockBoundaryTool(StructuralNavigator navigator, NavigationToggles toggles) {
        this.navigator = navigator;
        this.toggles = toggles;
    }

    @Override
    public String getName() {
        return "nts_block_boundary";
    }

    @Override
    public String getDescription() {
        return """
            Cycle through the boundaries of the construct under the cursor (tree-sitter).

            CONSTRUCTS: object property with call value, call expression (incl. await),
            switch/case, loops, if/else-if/else, declarations (const/let/var, type, interface, function).

            MODES:
            - normal: move to the next boundary (wraps around)
            - select: return the range from the first to the last boundary

            INPUT: path + line/column (1-based) + mode
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

        props.putObject("mode").put("type", "string").put("description",
                "'normal' (move to next boundary) or 'select' (range of the whole construct). Default: 'normal'.");

        schema.putArray("required").add("path");
        return schema;
    }

    @Override
    public JsonNode execute(JsonNode params) throws Exception {
        CycleMode mode = parseMode(params.path("mode").asText("normal"));

        NavigationDocument document = NavigationDocument.open(params);
        CursorPosition start = document.cursor(params);

        if (!document.parsed()) {
            return noOp(start, document.unavailableReason());
        }
        if (!toggles.isEnabled(document.path())) {
            return noOp(start, "navigation is disabled for this document (see nts_jump_toggle)");
        }

        VirtualCursorHost host = new VirtualCursorHost(document.tree(), start);
        Optional<BoundaryResult> outcome = navigator.cycleBoundary(host, mode);
        if (outcome.isEmpty()) {
            return noOp(start, "no construct with boundaries at " + start.format());
        }

        BoundaryResult result = outcome.get();
        if (result.isSelection()) {
            return selection(result);
        }
        BoundaryPosition target = result.target();
        String text = "Moved to " + target.kind().tag() + " at " + target.position().format()
                + " [" + result.handler() + "]";
        return position(text, true, target.position(), result.handler(), target.kind().tag(), null);
    }

    private CycleMode parseMode(String mode) {
        return switch (mode.toLowerCase()) {
            case "normal" -> CycleMode.NORMAL;
            case "select" -> CycleMode.SELECT_RANGE;
            default -> throw NtsParamException.invalid("mode", mode, "'normal' or 'select'");
        };
    }

    private JsonNode noOp(CursorPosition cursor, String reason) {
        return position("No-op: " + reason, false, cursor, null, null, reason);
    }

    private JsonNode position(String text, boolean moved, CursorPosition cursor,
                              String handler, String kind, String reason) {
        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", text);
        ObjectNode result = res.putObject("result");
        result.put("moved", moved);
        result.put("line", cursor.row() + 1);
        result.put("column", cursor.col() + 1);
        if (handler != null) {
            result.put("handler", handler);
            result.put("kind", kind);
        }
        if (reason != null) {
            result.put("reason", reason);
        }
        return res;
    }

    private JsonNode selection(BoundaryResult outcome) {
        CursorPosition from = outcome.target().position();
        CursorPosition to = outcome.selectionEnd().position();

        ObjectNode res = mapper.createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text",
                "Selected " + from.format() + " - " + to.format() + " [" + outcome.handler() + "]");
        ObjectNode result = res.putObject("result");
        result.put("handler", outcome.handler());
        ObjectNode selection = result.putObject("selection");
        selection.putObject("start").put("line", from.row() + 1).put("column", from.col() + 1);
        selection.putObject("end").put("line", to.row() + 1).put("column", to.col() + 1);
        return res;
    }
}
