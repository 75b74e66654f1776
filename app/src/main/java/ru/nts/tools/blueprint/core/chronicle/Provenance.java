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

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Происхождение записи хроники: какой прогон, когда и из какого blueprint.
 *
 * @param runId     идентификатор прогона
 * @param timestamp момент фиксации
 * @param blueprint путь или имя blueprint (может быть null)
 * @param counts    счетчики действий прогона (created, updated, ...)
 */
public record Provenance(String runId, Instant timestamp, String blueprint, Map<String, Integer> counts) {

    public Provenance {
        counts = counts == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    public static Provenance newRun(String blueprint, Map<String, Integer> counts) {
        return new Provenance(UUID.randomUUID().toString(), Instant.now(), blueprint, counts);
    }
}
