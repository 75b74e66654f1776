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
 * Один файл или директория, которые чертеж намерен материализовать (часть "Будущего").
 * Неизменяем после планирования; единственная перезапись пути выполняется при снятии виртуального корня.
 *
 * @param path        относительный путь с разделителями '/'
 * @param directory   признак директории
 * @param content     содержимое (литерал или полезная нагрузка мутации); null для директорий и семян
 * @param seed        путь-источник для {@code <<} или null
 * @param permission  права в восьмеричном виде или null
 * @param line        строка чертежа
 * @param mutation    вид мутации
 * @param replacement замена для {@link MutationKind#REWRITE}
 * @param base        более ранняя запись того же пути, служащая базой мутации, или null
 */
public record PlannedEntry(String path, boolean directory, String content, String seed, String permission,
                           int line, MutationKind mutation, String replacement, PlannedEntry base) {

    public static PlannedEntry directory(String path, String permission, int line) {
        return new PlannedEntry(path, true, null, null, permission, line, MutationKind.NONE, null, null);
    }

    public static PlannedEntry file(String path, String content, String permission, int line) {
        return new PlannedEntry(path, false, content == null ? "" : content, null, permission, line, MutationKind.NONE, null, null);
    }

    public static PlannedEntry seeded(String path, String seed, String permission, int line) {
        return new PlannedEntry(path, false, null, seed, permission, line, MutationKind.NONE, null, null);
    }

    public static PlannedEntry mutation(String path, MutationKind kind, String payload, String replacement,
                                        String permission, int line) {
        return new PlannedEntry(path, false, payload == null ? "" : payload, null, permission, line, kind, replacement, null);
    }

    public boolean isMutation() {
        return mutation != MutationKind.NONE;
    }

    public boolean isSeeded() {
        return seed != null;
    }

    /**
     * Права мутации без явного указания наследуются от базы.
     */
    public String effectivePermission() {
        if (permission != null || base == null) return permission;
        return base.effectivePermission();
    }

    public PlannedEntry withBase(PlannedEntry earlier) {
        return new PlannedEntry(path, directory, content, seed, permission, line, mutation, replacement, earlier);
    }

    public PlannedEntry withPath(String newPath) {
        return new PlannedEntry(newPath, directory, content, seed, permission, line, mutation, replacement,
                base == null ? null : base.withPath(newPath));
    }
}
