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

import ru.nts.tools.blueprint.core.materialize.WriteResult;

import java.util.List;

/**
 * Итог фиксации хроники.
 *
 * @param committed хроника записана
 * @param chronicle новая хроника (или прежняя, если фиксация заблокирована)
 * @param blockers  результаты записи, заблокировавшие фиксацию
 * @param reason    пояснение, если фиксация не выполнена
 */
public record CommitOutcome(boolean committed, Chronicle chronicle, List<WriteResult> blockers, String reason) {

    public CommitOutcome {
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
    }

    public static CommitOutcome committed(Chronicle chronicle) {
        return new CommitOutcome(true, chronicle, List.of(), null);
    }

    public static CommitOutcome skipped(Chronicle previous, List<WriteResult> blockers, String reason) {
        return new CommitOutcome(false, previous, blockers, reason);
    }
}
