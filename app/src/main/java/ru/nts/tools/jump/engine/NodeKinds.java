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
package ru.nts.tools.jump.engine;

import java.util.Set;

/**
 * Статические наборы типов узлов, на которых построен классификатор.
 * Имена типов соответствуют грамматикам tree-sitter для JS/TS/JSX, Python и Java.
 */
public final class NodeKinds {

    private NodeKinds() {}

    /**
     * Разделители комментариев разных языков.
     */
    public static final Set<String> COMMENT_DELIMITERS = Set.of(
            "//", "/*", "*/", "#", "<!--", "-->", "comment_content"
    );

    /**
     * Пунктуация и скобки.
     */
    public static final Set<String> PUNCTUATION = Set.of(
            "{", "}", "(", ")", "[", "]", ",", ";", ":", "<", ">", "</", "/>"
    );

    /**
     * Полноценные единицы навигации: операторы, объявления, члены объектов и типов, JSX-элементы.
     */
    public static final Set<String> MEANINGFUL = Set.of(
            // Операторы
            "expression_statement", "if_statement", "for_statement", "while_statement",
            "do_statement", "for_in_statement", "return_statement", "break_statement",
            "continue_statement", "throw_statement", "try_statement", "switch_statement",
            "switch_case", "switch_default",
            // Объявления
            "lexical_declaration", "variable_declaration", "function_declaration",
            "class_declaration", "method_definition", "export_statement", "import_statement",
            // TypeScript / JavaScript
            "property_signature", "public_field_definition", "pair",
            "shorthand_property_identifier", "type_alias_declaration", "interface_declaration",
            // JSX
            "jsx_self_closing_element", "jsx_element", "jsx_attribute", "jsx_expression",
            // Деструктуризация
            "shorthand_property_identifier_pattern", "pair_pattern",
            // Типы
            "type_parameter", "literal_type",
            // Python
            "function_definition", "class_definition", "decorated_definition", "pass_statement",
            "import_from_statement", "with_statement", "assert_statement", "raise_statement",
            // Java
            "local_variable_declaration", "field_declaration",
            "method_declaration", "constructor_declaration"
    );

    /**
     * Контейнеры, между детьми которых курсор может стоять на пробелах.
     */
    public static final Set<String> CONTAINERS = Set.of(
            "statement_block", "block", "object", "object_type", "array"
    );

    /**
     * Однородные списки: прямые дети являются элементами навигации.
     */
    public static final Set<String> LIST_CONTAINERS = Set.of(
            "array", "arguments", "formal_parameters", "named_imports", "array_pattern",
            "object_pattern", "type_parameters", "union_type"
    );

    /**
     * Контейнеры, на которых останавливается подъем от комментария или пустой строки.
     */
    public static final Set<String> ESCAPE_CONTAINERS = Set.of(
            "block", "statement_block"
    );

    /**
     * Блоки операторов, внутри которых навигация по операторам важнее навигации по элементам списка.
     */
    public static final Set<String> STATEMENT_BLOCKS = Set.of("statement_block", "block");

    public static final Set<String> CASE_CLAUSES = Set.of("switch_case", "switch_default");

    /**
     * Члены объединения типов при развертывании вложенных union_type.
     */
    public static final Set<String> UNION_MEMBERS = Set.of("type_identifier", "literal_type", "object_type");

    public static final String UNION_TYPE = "union_type";

    public static final Set<String> JSX_ELEMENTS = Set.of(
            "jsx_element", "jsx_self_closing_element", "jsx_opening_element"
    );

    public static final Set<String> JSX_TAG_HALVES = Set.of("jsx_opening_element", "jsx_closing_element");
}
