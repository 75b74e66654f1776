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
package ru.nts.tools.blueprint.core.chronicle;

/**
 * Запись манифеста хроники: последнее материализованное состояние одного пути.
 *
 * @param hash       SHA-256 содержимого (null для директорий)
 * @param size       размер в байтах
 * @param permission права в восьмеричном виде или null
 * @param directory  признак директории
 */
public record ManifestEntry(String hash, long size, String permission, boolean directory) {

    public static ManifestEntry directory(String permission) {
        return new ManifestEntry(null, 0, permission, true);
    }

    public static ManifestEntry file(String hash, long size, String permission) {
        return new ManifestEntry(hash, size, permission, false);
    }

    /**
     * Каноническая строка для печати целостности.
     */
    String canonical(String path) {
        return path + '\t' + (directory ? "dir" : "file") + '\t' + (hash == null ? "-" : hash) + '\t' + size
                + '\t' + (permission == null ? "-" : permission);
    }
}
