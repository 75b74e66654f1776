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

import ru.nts.tools.blueprint.core.FileUtils;

import java.nio.charset.StandardCharsets;

/**
 * Печать целостности: SHA-256 над каноническими строками манифеста.
 */
public final class IntegritySeal {

    public static final String ALGORITHM = "SHA-256";

    private IntegritySeal() {
    }

    public static String of(ChronicleManifest manifest) {
        return FileUtils.sha256(manifest.canonicalText().getBytes(StandardCharsets.UTF_8));
    }

    public static boolean verify(ChronicleManifest manifest, String seal) {
        return seal != null && seal.equalsIgnoreCase(of(manifest));
    }
}
