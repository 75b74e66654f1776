package ru.nts.tools.blueprint.core.chronicle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class H2ChronicleSinkTest {

    private H2ChronicleSink sink;

    @BeforeEach
    void setUp() {
        sink = new H2ChronicleSink(ChronicleDatabase.inMemory());
    }

    @AfterEach
    void tearDown() {
        sink.close();
    }

    private static Chronicle run(String runId, String at, Map<String, ManifestEntry> entries) {
        return Chronicle.sealed(new Provenance(runId, Instant.parse(at), "app.blueprint", Map.of("created", entries.size())),
                ChronicleManifest.of(entries));
    }

    @Test
    @DisplayName("recorded runs are listed newest first")
    void recentRuns() throws Exception {
        sink.record(run("r1", "2025-01-01T00:00:00Z", Map.of("a.txt", ManifestEntry.file("h1", 1, null))), List.of("a.txt"));
        sink.record(run("r2", "2025-01-02T00:00:00Z", Map.of("a.txt", ManifestEntry.file("h2", 1, null))), List.of("a.txt"));

        List<ChronicleRepository.RunRecord> runs = sink.recentRuns(10);
        assertEquals(List.of("r2", "r1"), runs.stream().map(ChronicleRepository.RunRecord::runId).toList());
        assertEquals(1, runs.get(0).pathCount());
        assertEquals("app.blueprint", runs.get(0).blueprint());
        assertEquals(1, sink.recentRuns(1).size());
    }

    @Test
    @DisplayName("manifest of a run is restored entry by entry")
    void manifestOf() throws Exception {
        Map<String, ManifestEntry> entries = Map.of(
                "src", ManifestEntry.directory("755"),
                "src/main.py", ManifestEntry.file("abc", 42, "644"));
        sink.record(run("r1", "2025-01-01T00:00:00Z", entries), List.of("src/main.py"));

        assertEquals(ChronicleManifest.of(entries), sink.manifestOf("r1"));
        assertTrue(sink.manifestOf("unknown").isEmpty());
    }

    @Test
    @DisplayName("history of a path marks the runs that touched it")
    void historyOf() throws Exception {
        sink.record(run("r1", "2025-01-01T00:00:00Z", Map.of("a.txt", ManifestEntry.file("h1", 1, null))), List.of("a.txt"));
        sink.record(run("r2", "2025-01-02T00:00:00Z", Map.of(
                "a.txt", ManifestEntry.file("h1", 1, null),
                "b.txt", ManifestEntry.file("h3", 1, null))), List.of("b.txt"));

        List<ChronicleRepository.PathHistory> history = sink.historyOf("a.txt");
        assertEquals(2, history.size());
        assertEquals("r2", history.get(0).runId());
        assertFalse(history.get(0).touched());
        assertTrue(history.get(1).touched());
        assertEquals("h1", history.get(1).entry().hash());
    }

    @Test
    @DisplayName("duplicate run id rolls back the whole run")
    void rollback() throws Exception {
        sink.record(run("r1", "2025-01-01T00:00:00Z", Map.of("a.txt", ManifestEntry.file("h1", 1, null))), List.of());
        assertThrows(Exception.class, () ->
                sink.record(run("r1", "2025-01-02T00:00:00Z", Map.of("z.txt", ManifestEntry.file("h9", 1, null))), List.of()));

        assertEquals(1, sink.recentRuns(10).size());
        assertTrue(sink.historyOf("z.txt").isEmpty());
    }

    @Test
    @DisplayName("file database lives under the state directory")
    void fileDatabase(@TempDir Path stateDir) throws Exception {
        ChronicleDatabase database = new ChronicleDatabase(stateDir.resolve(".scaffold"));
        try (Connection conn = database.getInitializedConnection();
             Statement stmt = conn.createStatement()) {
            assertTrue(database.isInitialized());
            assertTableExists(stmt, "RUNS");
            assertTableExists(stmt, "MANIFEST_ROWS");
            assertTableExists(stmt, "CHRONICLE_METADATA");
        } finally {
            database.close();
        }
        assertTrue(Files.isDirectory(stateDir.resolve(".scaffold")));
        assertEquals(stateDir.resolve(".scaffold").resolve("chronicle"), database.getDbPath());
    }

    private static void assertTableExists(Statement stmt, String table) throws Exception {
        try (ResultSet rs = stmt.executeQuery(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = '" + table + "'")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1), "Table " + table + " should exist");
        }
    }
}
