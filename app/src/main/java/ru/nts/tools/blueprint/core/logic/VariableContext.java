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
package ru.nts.tools.blueprint.core.logic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Контекст переменных резолвера: глобальные переменные и стек привязок переменных цикла.
 */
public final class VariableContext {

    private final Map<String, Object> globals = new LinkedHashMap<>();
    private final Deque<Map<String, Object>> bindings = new ArrayDeque<>();

    public void define(String name, Object value) {
        globals.put(name, value);
    }

    public boolean isDefined(String name) {
        for (Map<String, Object> frame : bindings) {
            if (frame.containsKey(name)) return true;
        }
        return globals.containsKey(name);
    }

    /**
     * @return значение или null, если переменная не определена
     */
    public Object lookup(String name) {
        for (Map<String, Object> frame : bindings) {
            if (frame.containsKey(name)) return frame.get(name);
        }
        return globals.get(name);
    }

    public void bind(String name, Object value) {
        Map<String, Object> frame = new HashMap<>();
        frame.put(name, value);
        bindings.push(frame);
    }

    public void unbind() {
        bindings.pop();
    }

    public Map<String, Object> globals() {
        return new LinkedHashMap<>(globals);
    }
}
