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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Жизненный цикл embedded H2 базы с историей прогонов.
 *
 * База лежит в служебной директории проекта:
 *   {project}/.scaffold/chronicle  (.mv.db файл создается H2 автоматически)
 *
 * Схема версионируется через строку schema_version в таблице chronicle_metadata.
 */
public class ChronicleDatabase implements AutoCloseable {

    private static final int SCHEMA_VERSION = 1;

    private final Path dbPath;  // null for in-memory mode
    private final String jdbcUrl;
    private volatile boolean initialized;
    private volatile boolean closed;

    /**
     * @param stateDir служебная директория проекта (.scaffold)
     */
    public ChronicleDatabase(Path stateDir) {
        this.dbPath = stateDir.resolve("chronicle");
        // DB_CLOSE_DELAY=0 — закрывать сразу при последнем disconnect
        this.jdbcUrl = "jdbc:h2:" + dbPath.toAbsolutePath().toString().replace('\\', '/')
                + ";DB_CLOSE_DELAY=0";
    }

    private ChronicleDatabase(String jdbcUrl) {
        this.dbPath = null;
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * In-memory база для тестов; живет до завершения JVM.
     */
    public static ChronicleDatabase inMemory() {
        return new ChronicleDatabase("jdbc:h2:mem:chronicle-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    /**
     * Создает директорию и схему. Безопасен для повторного вызова.
     */
    public synchronized void initialize() throws SQLException {
        if (initialized || closed) return;

        if (dbPath != null) {
            try {
                Files.createDirectories(dbPath.getParent());
            } catch (IOException e) {
                throw new SQLException("Cannot create state directory: " + e.getMessage(), e);
            }
        }

        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {
            if (getCurrentVersion(stmt) < SCHEMA_VERSION) {
                createSchema(stmt);
                setVersion(stmt, SCHEMA_VERSION);
            }
        }
        initialized = true;
    }

    public Connection getConnection() throws SQLException {
        if (closed) {
            throw new SQLException("ChronicleDatabase is closed");
        }
        return DriverManager.getConnection(jdbcUrl);
    }

    /**
     * Соединение с гарантированной инициализацией схемы.
     */
    public Connection getInitializedConnection() throws SQLException {
        if (!initialized) {
            initialize();
        }
        return getConnection();
    }

    public Path getDbPath() {
        return dbPath;
    }

    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        initialized = false;
    }

    // ==================== Schema Management ====================

    private int getCurrentVersion(Statement stmt) {
        try (var rs = stmt.executeQuery(
                "SELECT meta_value FROM chronicle_metadata WHERE meta_key = 'schema_version'")) {
            if (rs.next()) {
                return Integer.parseInt(rs.getString("meta_value"));
            }
        } catch (SQLException e) {
            // Таблицы еще нет: версия 0
            return 0;
        }
        return 0;
    }

    private void setVersion(Statement stmt, int version) throws SQLException {
        stmt.executeUpdate(
                "MERGE INTO chronicle_metadata(meta_key, meta_value, updated_at) VALUES('schema_version', '"
                        + version + "', CURRENT_TIMESTAMP)");
    }

    private void createSchema(Statement stmt) throws SQLException {
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS chronicle_metadata (
                    meta_key VARCHAR(255) PRIMARY KEY,
                    meta_value CLOB,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                )
                """);

        // Прогоны (одна строка на зафиксированную хронику)
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS runs (
                    run_id VARCHAR(64) PRIMARY KEY,
                    committed_at TIMESTAMP NOT NULL,
                    blueprint VARCHAR(2048),
                    seal VARCHAR(64) NOT NULL,
                    path_count INT NOT NULL,
                    counts VARCHAR(2000)
                )
                """);
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_runs_committed ON runs(committed_at)");

        // Манифест каждого прогона
        stmt.executeUpdate("""
                CREATE TABLE IF NOT EXISTS manifest_rows (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    run_id VARCHAR(64) NOT NULL,
                    file_path VARCHAR(2048) NOT NULL,
                    is_directory BOOLEAN NOT NULL,
                    hash VARCHAR(64),
                    file_size BIGINT DEFAULT 0,
                    permission VARCHAR(4),
                    touched BOOLEAN DEFAULT FALSE,
                    FOREIGN KEY (run_id) REFERENCES runs(run_id) ON DELETE CASCADE
                )
                """);
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_mr_run ON manifest_rows(run_id)");
        stmt.executeUpdate(
                "CREATE INDEX IF NOT EXISTS idx_mr_path ON manifest_rows(file_path)");
    }
}
