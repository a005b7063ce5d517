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
package ru.nts.tools.jump.engine.detect;

import java.util.Set;

/**
 * Особенности диалекта, влияющие на распознавание лестниц.
 *
 * @param langId             идентификатор языка
 * @param explicitTerminator у блока if есть собственный закрывающий токен ({@code end});
 *                           курсор на нем считается позицией "после последней ветки"
 */
public record DialectProfile(String langId, boolean explicitTerminator) {

    private static final Set<String> TERMINATED = Set.of("lua", "ruby", "bash");

    public static DialectProfile of(String langId) {
        String id = langId == null ? "" : langId;
        return new DialectProfile(id, TERMINATED.contains(id));
    }
}
