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
package ru.nts.tools.blueprint.core.logic;

/**
 * Состояние цепочки {@code @if}/{@code @elif}/{@code @else} в пределах одного родителя.
 */
public enum ChainStatus {
    /** Ни одна ветвь еще не сработала. */
    PENDING,
    /** Сработала текущая ветвь. */
    ENTERED,
    /** Ветвь уже сработала раньше (или цепочка невидима): последующие ветви не вычисляются. */
    CLOSED
}
