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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Поток результатов записи одного прогона.
 */
public record MaterializationReport(List<WriteResult> results, boolean simulated) {

    public MaterializationReport {
        results = List.copyOf(results);
    }

    public List<WriteResult> failures() {
        return results.stream().filter(r -> !r.success()).collect(Collectors.toList());
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> !r.success());
    }

    /**
     * Результаты, которые блокируют фиксацию хроники при указанном пороге.
     */
    public List<WriteResult> blocking(Severity threshold) {
        return results.stream().filter(r -> r.blocksCommit(threshold)).collect(Collectors.toList());
    }

    public Map<WriteAction, Integer> counts() {
        Map<WriteAction, Integer> counts = new EnumMap<>(WriteAction.class);
        for (WriteAction action : WriteAction.values()) counts.put(action, 0);
        for (WriteResult r : results) {
            if (r.success()) counts.merge(r.action(), 1, Integer::sum);
        }
        return counts;
    }

    public Optional<WriteResult> result(String path) {
        return results.stream().filter(r -> r.path().equals(path)).findFirst();
    }
}
