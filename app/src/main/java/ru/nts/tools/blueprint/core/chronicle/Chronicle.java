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
 * Содержимое файла хроники.
 *
 * @param version    версия формата
 * @param provenance происхождение последней фиксации (null для пустой хроники)
 * @param manifest   манифест управляемых путей
 * @param seal       печать целостности манифеста
 */
public record Chronicle(int version, Provenance provenance, ChronicleManifest manifest, String seal) {

    public static final int CURRENT_VERSION = 1;

    public static Chronicle empty() {
        return new Chronicle(CURRENT_VERSION, null, ChronicleManifest.empty(), IntegritySeal.of(ChronicleManifest.empty()));
    }

    public static Chronicle sealed(Provenance provenance, ChronicleManifest manifest) {
        return new Chronicle(CURRENT_VERSION, provenance, manifest, IntegritySeal.of(manifest));
    }

    public boolean isIntact() {
        return IntegritySeal.verify(manifest, seal);
    }
}
