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

import ru.nts.tools.blueprint.core.chronicle.ManifestEntry;
import ru.nts.tools.blueprint.core.logic.PlannedEntry;

/**
 * Решение сверки для одного пути (для перемещения: для пары origin → path).
 *
 * @param path      путь (для MOVE это путь назначения)
 * @param kind      класс изменения
 * @param directory это директория
 * @param origin    исходный путь перемещения или null
 * @param entry     запланированная запись (Будущее) или null
 * @param intended  итоговое содержимое или null
 * @param present   снимок диска (для MOVE снимок исходного пути)
 * @param past      запись хроники (для MOVE запись исходного пути) или null
 * @param diff      unified diff для обновлений текстовых файлов
 * @param reason    пояснение (причина конфликта и т.п.)
 */
public record PlannedChange(String path, ChangeKind kind, boolean directory, String origin,
                            PlannedEntry entry, IntendedContent intended, DiskSnapshot present,
                            ManifestEntry past, String diff, String reason) {

    public String beforeText() {
        return present == null ? null : present.text();
    }

    public String afterText() {
        return intended == null ? null : intended.text();
    }

    /**
     * Хеш, который путь будет иметь после применения (null для директорий и удалений).
     */
    public String intendedHash() {
        return intended == null ? null : intended.hash();
    }

    /**
     * Права, которые нужно применить к пути после записи.
     */
    public String permission() {
        return entry == null ? null : entry.effectivePermission();
    }

    public PlannedChange withDiff(String newDiff) {
        return new PlannedChange(path, kind, directory, origin, entry, intended, present, past, newDiff, reason);
    }
}
