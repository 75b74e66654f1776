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
 * Точная последовательность байтов, которая будет записана по запланированной записи, и ее хеш.
 *
 * @param path    относительный путь
 * @param bytes   байты (null для директорий и при сбое)
 * @param hash    SHA-256 байтов
 * @param binary  содержимое бинарное
 * @param text    текст (null для бинарного содержимого)
 * @param failure причина, по которой содержимое не удалось вычислить, или null
 * @param note    предупреждение о вычисленном содержимом (например, смена кодировки) или null
 */
public record IntendedContent(String path, byte[] bytes, String hash, boolean binary, String text, String failure,
                              String note) {

    public static IntendedContent directory(String path) {
        return new IntendedContent(path, null, null, false, null, null, null);
    }

    public static IntendedContent failed(String path, String reason) {
        return new IntendedContent(path, null, null, false, null, reason, null);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public long size() {
        return bytes == null ? 0 : bytes.length;
    }
}
