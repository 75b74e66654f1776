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

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Манифест хроники ("Прошлое"): отображение относительного пути в {@link ManifestEntry}.
 * Неизменяем; ключи всегда отсортированы, поэтому сериализация и печать детерминированы.
 */
public final class ChronicleManifest {

    private static final ChronicleManifest EMPTY = new ChronicleManifest(new TreeMap<>());

    private final SortedMap<String, ManifestEntry> entries;

    private ChronicleManifest(SortedMap<String, ManifestEntry> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    public static ChronicleManifest empty() {
        return EMPTY;
    }

    public static ChronicleManifest of(Map<String, ManifestEntry> entries) {
        return new ChronicleManifest(new TreeMap<>(entries));
    }

    public ManifestEntry get(String path) {
        return entries.get(path);
    }

    public boolean contains(String path) {
        return entries.containsKey(path);
    }

    public Set<String> paths() {
        return entries.keySet();
    }

    public SortedMap<String, ManifestEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Переписывает ключи; ключи, для которых функция вернула null, отбрасываются.
     */
    public ChronicleManifest rekey(UnaryOperator<String> mapping) {
        TreeMap<String, ManifestEntry> copy = new TreeMap<>();
        entries.forEach((path, entry) -> {
            String mapped = mapping.apply(path);
            if (mapped != null) copy.put(mapped, entry);
        });
        return new ChronicleManifest(copy);
    }

    /**
     * Канонические строки манифеста, по одной на путь, в порядке ключей.
     */
    public String canonicalText() {
        StringBuilder sb = new StringBuilder();
        entries.forEach((path, entry) -> sb.append(entry.canonical(path)).append('\n'));
        return sb.toString();
    }

    public Builder toBuilder() {
        return new Builder(entries);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChronicleManifest other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ChronicleManifest" + entries;
    }

    public static final class Builder {
        private final TreeMap<String, ManifestEntry> entries;

        private Builder(Map<String, ManifestEntry> initial) {
            this.entries = new TreeMap<>(initial);
        }

        public Builder put(String path, ManifestEntry entry) {
            entries.put(path, entry);
            return this;
        }

        public Builder remove(String path) {
            entries.remove(path);
            return this;
        }

        public ChronicleManifest build() {
            return new ChronicleManifest(entries);
        }
    }
}
