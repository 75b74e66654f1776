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

import java.util.Collection;

/**
 * Вторичное хранилище истории прогонов.
 * Сбои приемника не должны ронять прогон: вызывающий код логирует и продолжает.
 */
public interface ChronicleSink extends AutoCloseable {

    ChronicleSink NONE = new ChronicleSink() {
        @Override
        public void record(Chronicle chronicle, Collection<String> touched) {
        }

        @Override
        public void close() {
        }
    };

    /**
     * Записывает зафиксированную хронику.
     *
     * @param chronicle зафиксированная хроника
     * @param touched   пути, измененные прогоном
     */
    void record(Chronicle chronicle, Collection<String> touched) throws Exception;

    @Override
    void close();
}
