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

import java.sql.*;
import java.time.Instant;
import java.util.*;

/**
 * SQL-операции вторичного хранилища хроники. Plain JDBC над embedded H2.
 *
 * Все методы принимают Connection извне: транзакционностью управляет вызывающий код.
 * <pre>
 *   try (Connection conn = db.getInitializedConnection()) {
 *       conn.setAutoCommit(false);
 *       repo.insertRun(conn, chronicle);
 *       repo.insertManifest(conn, runId, manifest, touched);
 *       conn.commit();
 *   }
 * </pre>
 */
public class ChronicleRepository {

    /**
     * Строка таблицы прогонов.
     */
    public record RunRecord(String runId, Instant committedAt, String blueprint, String seal,
                            int pathCount, String counts) {
    }

    /**
     * Состояние пути в одном из прогонов.
     */
    public record PathHistory(String runId, Instant committedAt, ManifestEntry entry, boolean touched) {
    }

    // ==================== Runs ====================

    public void insertRun(Connection conn, Chronicle chronicle) throws SQLException {
        Provenance p = chronicle.provenance();
        String sql = """
                INSERT INTO runs (run_id, committed_at, blueprint, seal, path_count, counts)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, p.runId());
            ps.setTimestamp(2, Timestamp.from(p.timestamp()));
            ps.setString(3, p.blueprint());
            ps.setString(4, chronicle.seal());
            ps.setInt(5, chronicle.manifest().size());
            ps.setString(6, p.counts().toString());
            ps.executeUpdate();
        }
    }

    /**
     * Последние прогоны, от новых к старым.
     */
    public List<RunRecord> recentRuns(Connection conn, int limit) throws SQLException {
        String sql = """
                SELECT run_id, committed_at, blueprint, seal, path_count, counts
                FROM runs ORDER BY committed_at DESC, run_id LIMIT ?
                """;
        List<RunRecord> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new RunRecord(
                            rs.getString("run_id"),
                            rs.getTimestamp("committed_at").toInstant(),
                            rs.getString("blueprint"),
                            rs.getString("seal"),
                            rs.getInt("path_count"),
                            rs.getString("counts")));
                }
            }
        }
        return result;
    }

    // ==================== Manifest rows ====================

    public void insertManifest(Connection conn, String runId, ChronicleManifest manifest,
                               Collection<String> touched) throws SQLException {
        Set<String> touchedSet = new HashSet<>(touched);
        String sql = """
                INSERT INTO manifest_rows (run_id, file_path, is_directory, hash, file_size, permission, touched)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Map.Entry<String, ManifestEntry> e : manifest.entries().entrySet()) {
                ManifestEntry entry = e.getValue();
                ps.setString(1, runId);
                ps.setString(2, e.getKey());
                ps.setBoolean(3, entry.directory());
                ps.setString(4, entry.hash());
                ps.setLong(5, entry.size());
                ps.setString(6, entry.permission());
                ps.setBoolean(7, touchedSet.contains(e.getKey()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    /**
     * Манифест, зафиксированный указанным прогоном (пустой, если прогон неизвестен).
     */
    public ChronicleManifest manifestOf(Connection conn, String runId) throws SQLException {
        String sql = """
                SELECT file_path, is_directory, hash, file_size, permission
                FROM manifest_rows WHERE run_id = ?
                """;
        Map<String, ManifestEntry> entries = new TreeMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.put(rs.getString("file_path"), mapEntry(rs));
                }
            }
        }
        return ChronicleManifest.of(entries);
    }

    /**
     * История пути по прогонам, от новых к старым.
     */
    public List<PathHistory> historyOf(Connection conn, String path) throws SQLException {
        String sql = """
                SELECT r.run_id, r.committed_at, m.is_directory, m.hash, m.file_size, m.permission, m.touched
                FROM manifest_rows m JOIN runs r ON r.run_id = m.run_id
                WHERE m.file_path = ?
                ORDER BY r.committed_at DESC, r.run_id
                """;
        List<PathHistory> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, path);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new PathHistory(
                            rs.getString("run_id"),
                            rs.getTimestamp("committed_at").toInstant(),
                            mapEntry(rs),
                            rs.getBoolean("touched")));
                }
            }
        }
        return result;
    }

    private static ManifestEntry mapEntry(ResultSet rs) throws SQLException {
        return new ManifestEntry(rs.getString("hash"), rs.getLong("file_size"),
                rs.getString("permission"), rs.getBoolean("is_directory"));
    }
}
