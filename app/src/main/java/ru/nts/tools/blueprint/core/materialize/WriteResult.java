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
package ru.nts.tools.blueprint.core.materialize;

import ru.nts.tools.blueprint.core.Severity;

/**
 * Итог материализации одного пути.
 *
 * @param path         путь (для перемещения путь назначения)
 * @param action       действие
 * @param origin       исходный путь перемещения или null
 * @param directory    это директория
 * @param hash         хеш записанного содержимого (null для директорий и удалений)
 * @param bytesWritten записано байтов
 * @param permission   примененные права или null
 * @param success      действие выполнено
 * @param severity     серьезность сбоя или предупреждения (null, если все чисто)
 * @param message      пояснение сбоя или предупреждения
 * @param simulated    пробный прогон: диск не менялся
 */
public record WriteResult(String path, WriteAction action, String origin, boolean directory, String hash,
                          long bytesWritten, String permission, boolean success, Severity severity,
                          String message, boolean simulated) {

    public static WriteResult ok(String path, WriteAction action, String origin, boolean directory, String hash,
                                 long bytes, String permission, boolean simulated) {
        return new WriteResult(path, action, origin, directory, hash, bytes, permission, true, null, null, simulated);
    }

    public static WriteResult failed(String path, WriteAction action, String origin, boolean directory, String message) {
        return new WriteResult(path, action, origin, directory, null, 0, null, false, Severity.ERROR, message, false);
    }

    public static WriteResult skipped(String path, boolean directory, String reason, boolean simulated) {
        return new WriteResult(path, WriteAction.SKIPPED, null, directory, null, 0, null, true, Severity.INFO, reason, simulated);
    }

    /**
     * Запись выполнена, но права применить не удалось.
     */
    public WriteResult withWarning(String warning) {
        return new WriteResult(path, action, origin, directory, hash, bytesWritten, null, success, Severity.WARNING, warning, simulated);
    }

    public WriteResult withNote(String note) {
        return new WriteResult(path, action, origin, directory, hash, bytesWritten, permission, success, Severity.INFO, note, simulated);
    }

    public boolean blocksCommit(Severity threshold) {
        return severity != null && severity.atLeast(threshold);
    }
}
