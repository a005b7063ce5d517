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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ошибка инструмента навигации с кодом {@link NtsErrorCode} и контекстом для подсказки.
 * <p>
 * Контекст подставляется в плейсхолдеры решения: {@code %path%}, {@code %parameter%} и т.д.
 */
public class NtsException extends RuntimeException {

    private final NtsErrorCode code;
    private final Map<String, Object> context;

    public NtsException(NtsErrorCode code, Map<String, Object> context) {
        this(code, context, null);
    }

    public NtsException(NtsErrorCode code, String key, Object value) {
        this(code, Map.of(key, value), null);
    }

    public NtsException(NtsErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Map.of();
    }

    public NtsErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Текст для клиента: код, сообщение, решение с подставленным контекстом.
     */
    public String toUserMessage() {
        return code.format(context);
    }

    @Override
    public String getMessage() {
        return toUserMessage();
    }
}
