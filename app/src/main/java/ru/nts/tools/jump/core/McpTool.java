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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Базовый интерфейс для инструментов (Tools) сервера навигации в рамках Model Context Protocol.
 */
public interface McpTool {

    String getName();
    String getDescription();
    String getCategory();
    JsonNode getInputSchema();
    JsonNode execute(JsonNode params) throws Exception;

    /**
     * Обертка над execute: любая ошибка превращается в ответ с isError и понятным текстом.
     */
    default JsonNode executeWithFeedback(JsonNode params) {
        try {
            return execute(params);
        } catch (NtsException e) {
            return createErrorResponse(e.getCode().name(), e.toUserMessage());
        } catch (IllegalArgumentException e) {
            return createErrorResponse("INVALID_ARGUMENTS", "Invalid request parameters: " + e.getMessage());
        } catch (SecurityException e) {
            return createErrorResponse("SECURITY_VIOLATION", "Security policy violation: " + e.getMessage());
        } catch (IllegalStateException e) {
            return createErrorResponse("VALIDATION_FAILED", "State validation failed: " + e.getMessage());
        } catch (java.io.IOException e) {
            return createErrorResponse("SYSTEM_ERROR", "System I/O error: " + e.getMessage());
        } catch (Exception e) {
            NtsErrorCode code = NtsErrorCode.INTERNAL_ERROR;
            return createErrorResponse(code.name(), code.format(Map.of("error", e.toString())));
        }
    }

    private JsonNode createErrorResponse(String type, String message) {
        ObjectNode res = new ObjectMapper().createObjectNode();
        res.putArray("content").addObject().put("type", "text").put("text", "Error [" + type + "]: " + message);
        res.put("isError", true);
        return res;
    }
}
