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
package ru.nts.tools.jump.engine.boundary;

import java.util.Locale;

/**
 * Тип граничной позиции конструкции.
 */
public enum BoundaryKind {
    PROPERTY_NAME,
    CALL_NAME,
    AWAIT_KEYWORD,
    CLOSING_PAREN,
    SWITCH_KEYWORD,
    CASE_KEYWORD,
    DEFAULT_KEYWORD,
    LOOP_KEYWORD,
    IF_KEYWORD,
    ELSE_IF_KEYWORD,
    ELIF_KEYWORD,
    ELSE_KEYWORD,
    DECLARATION_KEYWORD,
    TYPE_KEYWORD,
    FUNCTION_KEYWORD,
    CLOSING_BRACKET;

    /**
     * Имя для ответов инструментов: "closing_bracket", "else_if_keyword"...
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
