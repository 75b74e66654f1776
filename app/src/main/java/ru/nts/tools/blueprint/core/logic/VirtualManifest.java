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

import ru.nts.tools.blueprint.core.PathSanitizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Виртуальный манифест: пути, уже запланированные в текущем проходе резолвера.
 * Позволяет условию {@code exists(path)} видеть записи до того, как что-либо записано на диск.
 * Принадлежит резолверу и передается по ссылке, глобального состояния нет.
 */
public final class VirtualManifest {

    private final Set<String> paths = new HashSet<>();
    private final Path root;

    public VirtualManifest(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * Регистрирует путь и все его родительские директории.
     */
    public void register(String path) {
        String p = PathSanitizer.normalize(path);
        while (!p.isEmpty()) {
            if (!paths.add(p)) return;
            int slash = p.lastIndexOf('/');
            p = slash < 0 ? "" : p.substring(0, slash);
        }
    }

    /**
     * Сначала виртуальный манифест, затем диск под корнем проекта.
     */
    public boolean exists(String path) {
        String p = PathSanitizer.normalize(path);
        if (p.isEmpty()) return true;
        if (paths.contains(p)) return true;
        Path target = root.resolve(p).normalize();
        return target.startsWith(root) && Files.exists(target);
    }

    public boolean contains(String path) {
        return paths.contains(PathSanitizer.normalize(path));
    }
}
