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
package ru.nts.tools.blueprint.core.reconcile;

/**
 * Факт о пути на живом диске ("Настоящее"), снятый во время сверки.
 *
 * @param path       относительный путь
 * @param exists     путь существует
 * @param directory  это директория
 * @param symlink    это символическая ссылка
 * @param hash       SHA-256 содержимого файла (null для директорий и отсутствующих путей)
 * @param size       размер в байтах
 * @param permission права в восьмеричном виде или null, если ФС их не поддерживает
 * @param binary     содержимое бинарное
 * @param modified   время изменения (мс эпохи)
 * @param text       текст файла, только если он небольшой и не бинарный
 * @param error      причина, по которой файл не удалось прочитать, или null
 */
public record DiskSnapshot(String path, boolean exists, boolean directory, boolean symlink, String hash, long size,
                           String permission, boolean binary, long modified, String text, String error) {

    public static DiskSnapshot absent(String path) {
        return new DiskSnapshot(path, false, false, false, null, 0, null, false, 0, null, null);
    }

    public boolean isReadable() {
        return error == null;
    }
}
