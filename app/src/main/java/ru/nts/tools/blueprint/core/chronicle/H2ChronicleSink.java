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

import ru.nts.tools.blueprint.core.EngineLog;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * Вторичное хранилище хроники в embedded H2.
 * Каждая фиксация добавляет строку прогона и полный снимок манифеста.
 */
public class H2ChronicleSink implements ChronicleSink {

    private final ChronicleDatabase database;
    private final ChronicleRepository repository = new ChronicleRepository();

    public H2ChronicleSink(ChronicleDatabase database) {
        this.database = database;
    }

    @Override
    public void record(Chronicle chronicle, Collection<String> touched) throws SQLException {
        try (Connection conn = database.getInitializedConnection()) {
            conn.setAutoCommit(false);
            try {
                repository.insertRun(conn, chronicle);
                repository.insertManifest(conn, chronicle.provenance().runId(), chronicle.manifest(), touched);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
        EngineLog.debug("Run " + chronicle.provenance().runId() + " recorded in " + database.getDbPath());
    }

    public List<ChronicleRepository.RunRecord> recentRuns(int limit) throws SQLException {
        try (Connection conn = database.getInitializedConnection()) {
            return repository.recentRuns(conn, limit);
        }
    }

    public ChronicleManifest manifestOf(String runId) throws SQLException {
        try (Connection conn = database.getInitializedConnection()) {
            return repository.manifestOf(conn, runId);
        }
    }

    public List<ChronicleRepository.PathHistory> historyOf(String path) throws SQLException {
        try (Connection conn = database.getInitializedConnection()) {
            return repository.historyOf(conn, path);
        }
    }

    @Override
    public void close() {
        database.close();
    }
}
