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
package ru.nts.tools.blueprint.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

/**
 * Проверка, нормализация и защита путей чертежа (Path Sanitizer).
 * Реализует "песочницу" корня проекта, предотвращая:
 * 1. Выход за пределы корня проекта (Path Traversal).
 * 2. Планирование служебных файлов движка (хроника, .scaffold, .git).
 *
 * В отличие от глобального корня один экземпляр привязан к одному корню,
 * поэтому несколько проектов могут обрабатываться в одном процессе.
 */
public class PathSanitizer {

    private final Path root;

    /**
     * Набор имен файлов и папок, которые движок никогда не планирует и не удаляет.
     */
    private final Set<String> protectedNames;

    public PathSanitizer(Path root, String chronicleFileName, String stateDirName) {
        this.root = root.toAbsolutePath().normalize();
        this.protectedNames = Set.of(chronicleFileName, stateDirName, ".git");
    }

    public static PathSanitizer forConfig(EngineConfig config) {
        return new PathSanitizer(config.getProjectRoot(), config.getChronicleFileName(), config.getStateDirName());
    }

    /**
     * Приводит относительный путь чертежа к каноничному виду: разделители '/',
     * без ведущих "./" и '/', без хвостового '/', без пустых сегментов и '.'.
     * Сегменты '..' сохраняются, их проверяет {@link #resolve(String)}.
     */
    public static String normalize(String requestedPath) {
        String p = requestedPath.replace('\\', '/').trim();
        StringBuilder out = new StringBuilder();
        for (String part : p.split("/")) {
            if (part.isEmpty() || part.equals(".")) continue;
            if (out.length() > 0) out.append('/');
            out.append(part);
        }
        return out.toString();
    }

    /**
     * Выполняет санитарную проверку пути и возвращает абсолютный путь внутри корня.
     *
     * @param relativePath путь из чертежа или хроники
     *
     * @throws BlueprintException PATH_OUTSIDE_ROOT, если путь выходит за корень; PATH_PROTECTED для служебных путей
     */
    public Path resolve(String relativePath) {
        String normalized = normalize(relativePath);
        Path requested = Paths.get(normalized);
        if (requested.isAbsolute() || relativePath.replace('\\', '/').startsWith("/")) {
            throw new BlueprintException(BlueprintErrorCode.PATH_OUTSIDE_ROOT, Map.of("path", relativePath, "root", root));
        }
        Path target = root.resolve(normalized).normalize();

        // Проверка Path Traversal: итоговый путь обязан начинаться с префикса корня
        if (!target.startsWith(root) || target.equals(root)) {
            throw new BlueprintException(BlueprintErrorCode.PATH_OUTSIDE_ROOT, Map.of("path", relativePath, "root", root));
        }
        if (isProtected(root.relativize(target))) {
            throw new BlueprintException(BlueprintErrorCode.PATH_PROTECTED, "path", relativePath);
        }
        return target;
    }

    /**
     * Определяет, является ли путь (относительно корня) частью служебной инфраструктуры.
     * Проверяется только первый сегмент: вложенная папка с именем ".git" в подпроекте допустима.
     */
    public boolean isProtected(Path relative) {
        if (relative.getNameCount() == 0) return false;
        return protectedNames.contains(relative.getName(0).toString());
    }

    public boolean isProtected(String relativePath) {
        String normalized = normalize(relativePath);
        return !normalized.isEmpty() && isProtected(Paths.get(normalized));
    }

    /**
     * Превращает абсолютный путь внутри корня в относительный ключ с разделителями '/'.
     */
    public String toKey(Path absolute) {
        return root.relativize(absolute.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    public Path getRoot() {
        return root;
    }
}
