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

import java.util.Map;

/**
 * Structured error codes for the navigation tools.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example usage in tool output:
 * <pre>
 * [ERROR: PARAM_LINE_EXCEEDS]
 * Message: Line number exceeds file
 * Solution: File has 12 lines, requested line 40. Use a line between 1 and 12.
 * Context: line=40, totalLines=12, path=src/app.ts
 * </pre>
 */
public enum NtsErrorCode {

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check file path '%path%'. Paths are resolved against the project root."),

    FILE_NOT_READABLE("File not readable",
            "Check file permissions. Ensure the file is not locked."),

    FILE_TOO_LARGE("File too large",
            "File has %size% bytes, structural navigation reads files up to %limit% bytes."),

    // ============ Parameter Errors ============

    PARAM_MISSING("Required parameter missing",
            "Provide the required parameter '%parameter%'. Check tool documentation."),

    PARAM_INVALID("Invalid parameter value",
            "Parameter '%parameter%' expects %expected%."),

    PARAM_OUT_OF_RANGE("Parameter out of range",
            "Parameter '%parameter%' must be between %min% and %max%."),

    PARAM_LINE_EXCEEDS("Line number exceeds file",
            "File has %totalLines% lines, requested line %line%. Use a line between 1 and %totalLines%."),

    // ============ System Errors ============

    IO_ERROR("I/O error occurred",
            "Reading '%path%' failed: %error%. Check permissions and try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected %error%. Run with MCP_DEBUG=true and check stderr for details.");

    private final String message;
    private final String solution;

    NtsErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, parameter, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }
}
