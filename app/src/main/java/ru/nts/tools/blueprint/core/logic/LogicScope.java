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

/**
 * Область видимости обхода: видимость ветви, накопленный физический путь родителя и глубина.
 */
public record LogicScope(boolean visible, String parentPath, int depth) {

    public static LogicScope root() {
        return new LogicScope(true, "", 0);
    }

    public LogicScope enter(boolean branchVisible) {
        return new LogicScope(visible && branchVisible, parentPath, depth + 1);
    }

    public LogicScope enterDirectory(String path) {
        return new LogicScope(visible, path, depth + 1);
    }

    public String join(String relative) {
        return parentPath.isEmpty() ? relative : parentPath + "/" + relative;
    }
}
