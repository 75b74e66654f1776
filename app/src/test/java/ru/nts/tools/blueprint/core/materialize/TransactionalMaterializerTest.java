package ru.nts.tools.blueprint.core.materialize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.blueprint.core.BlueprintErrorCode;
import ru.nts.tools.blueprint.core.BlueprintException;
import ru.nts.tools.blueprint.core.EngineConfig;
import ru.nts.tools.blueprint.core.FileUtils;
import ru.nts.tools.blueprint.core.Severity;
import ru.nts.tools.blueprint.core.chronicle.ChronicleManifest;
import ru.nts.tools.blueprint.core.chronicle.ManifestEntry;
import ru.nts.tools.blueprint.core.logic.LogicResolver;
import ru.nts.tools.blueprint.core.parser.StructuralCompiler;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationOracle;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationPlan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class TransactionalMaterializerTest {

    @TempDir
    Path root;

    private ReconciliationPlan plan(EngineConfig config, ChronicleManifest history, String... lines) {
        var resolution = new LogicResolver(config).resolve(new StructuralCompiler(4).compile(String.join("\n", lines)));
        return new ReconciliationOracle(config).plan(resolution, history);
    }

    private MaterializationReport run(EngineConfig config, ChronicleManifest history, String... lines) {
        return new TransactionalMaterializer(config).apply(plan(config, history, lines));
    }

    private EngineConfig config() {
        return EngineConfig.forRoot(root).withWorkers(2);
    }

    private void write(String path, String text) throws IOException {
        Path target = root.resolve(path);
        Files.createDirectories(target.getParent());
        Files.writeString(target, text, StandardCharsets.UTF_8);
    }

    private String read(String path) throws IOException {
        return Files.readString(root.resolve(path), StandardCharsets.UTF_8);
    }

    private static ManifestEntry tracked(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return ManifestEntry.file(FileUtils.sha256(bytes), bytes.length, null);
    }

    // ==================== Writes ====================

    @Test
    @DisplayName("creates directories and files with the planned bytes")
    void createsTree() throws IOException {
        MaterializationReport report = run(config(), ChronicleManifest.empty(),
                "src/",
                "    main.py :: \"print('hi')\"",
                "    empty/");
        assertFalse(report.hasFailures());
        assertEquals("print('hi')", read("src/main.py"));
        assertTrue(Files.isDirectory(root.resolve("src/empty")));

        WriteResult main = report.result("src/main.py").orElseThrow();
        assertEquals(WriteAction.CREATED, main.action());
        assertEquals(FileUtils.sha256(root.resolve("src/main.py")), main.hash());
        assertEquals(11, main.bytesWritten());
        assertEquals(3, report.counts().get(WriteAction.CREATED));
    }

    @Test
    @DisplayName("no temporary siblings remain after a write")
    void noLeftovers() throws IOException {
        run(config(), ChronicleManifest.empty(), "a.txt :: \"x\"");
        try (var files = Files.list(root)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    @DisplayName("updating a file keeps its managed and untracked .old/.tmp siblings")
    void siblingsSurviveUpdate() throws IOException {
        write("cfg", "1");
        write("cfg.old", "keep");
        write("notes.txt.tmp", "scratch");
        ChronicleManifest history = ChronicleManifest.of(Map.of("cfg", tracked("1"), "cfg.old", tracked("keep")));

        MaterializationReport report = run(config(), history,
                "cfg :: \"2\"",
                "cfg.old :: \"keep\"",
                "notes.txt :: \"planned\"");

        assertFalse(report.hasFailures());
        assertEquals(WriteAction.UPDATED, report.result("cfg").orElseThrow().action());
        assertEquals("2", read("cfg"));
        assertEquals("keep", read("cfg.old"));
        assertEquals("planned", read("notes.txt"));
        assertEquals("scratch", read("notes.txt.tmp"));
    }

    @Test
    @DisplayName("dry run reports every action and leaves the disk alone")
    void dryRun() throws IOException {
        write("old.txt", "bye");
        MaterializationReport report = run(config().withDryRun(true),
                ChronicleManifest.of(Map.of("old.txt", tracked("bye"))),
                "new.txt :: \"hello\"");
        assertTrue(report.simulated());
        assertTrue(report.results().stream().allMatch(WriteResult::simulated));
        assertEquals(WriteAction.CREATED, report.result("new.txt").orElseThrow().action());
        assertEquals(WriteAction.DELETED, report.result("old.txt").orElseThrow().action());
        assertFalse(Files.exists(root.resolve("new.txt")));
        assertTrue(Files.exists(root.resolve("old.txt")));
    }

    // ==================== Conflicts ====================

    @Nested
    class Conflicts {

        private final ChronicleManifest history = ChronicleManifest.of(Map.of("a.txt", tracked("original")));

        private void editByHand() throws IOException {
            write("a.txt", "hand edit");
        }

        @Test
        @DisplayName("ABORT refuses before the first write")
        void abort() throws IOException {
            editByHand();
            BlueprintException e = assertThrows(BlueprintException.class,
                    () -> run(config(), history, "a.txt :: \"blueprint\"", "b.txt :: \"new\""));
            assertEquals(BlueprintErrorCode.CONFLICTS_PRESENT, e.getCode());
            assertEquals("hand edit", read("a.txt"));
            assertFalse(Files.exists(root.resolve("b.txt")));
        }

        @Test
        @DisplayName("SKIP leaves the conflict and applies the rest")
        void skip() throws IOException {
            editByHand();
            MaterializationReport report = run(config().withConflictPolicy(ConflictPolicy.SKIP), history,
                    "a.txt :: \"blueprint\"", "b.txt :: \"new\"");
            assertEquals(WriteAction.SKIPPED, report.result("a.txt").orElseThrow().action());
            assertEquals("hand edit", read("a.txt"));
            assertEquals("new", read("b.txt"));
            assertFalse(report.hasFailures());
        }

        @Test
        @DisplayName("FORCE overwrites the conflicting file")
        void force() throws IOException {
            editByHand();
            MaterializationReport report = run(config().withConflictPolicy(ConflictPolicy.FORCE), history,
                    "a.txt :: \"blueprint\"");
            assertEquals(WriteAction.UPDATED, report.result("a.txt").orElseThrow().action());
            assertEquals("blueprint", read("a.txt"));
        }
    }

    @Test
    @DisplayName("file changed between planning and writing is not overwritten")
    void diskChanged() throws IOException {
        write("a.txt", "v1");
        EngineConfig config = config();
        ReconciliationPlan plan = plan(config, ChronicleManifest.of(Map.of("a.txt", tracked("v1"))), "a.txt :: \"v2\"");
        write("a.txt", "racing writer");

        MaterializationReport report = new TransactionalMaterializer(config).apply(plan);
        WriteResult result = report.result("a.txt").orElseThrow();
        assertFalse(result.success());
        assertEquals(Severity.ERROR, result.severity());
        assertTrue(result.message().contains("DISK_CHANGED"));
        assertEquals("racing writer", read("a.txt"));
    }

    // ==================== Deletes and moves ====================

    @Test
    @DisplayName("deleting the last file prunes empty parents but keeps planned directories")
    void deletePrunesParents() throws IOException {
        write("keep/deep/gone.txt", "x");
        write("drop/deep/gone.txt", "x");
        ChronicleManifest history = ChronicleManifest.of(Map.of(
                "keep/deep/gone.txt", tracked("x"),
                "drop/deep/gone.txt", tracked("x")));
        MaterializationReport report = run(config(), history, "keep/", "other.txt :: \"o\"");
        assertFalse(report.hasFailures());
        assertTrue(Files.isDirectory(root.resolve("keep")));
        assertFalse(Files.exists(root.resolve("keep/deep")));
        assertFalse(Files.exists(root.resolve("drop")));
    }

    @Test
    @DisplayName("non-empty tracked directory is kept with a note")
    void nonEmptyDirectory() throws IOException {
        Files.createDirectories(root.resolve("logs"));
        write("logs/today.log", "untracked");
        MaterializationReport report = run(config(), ChronicleManifest.of(Map.of("logs", ManifestEntry.directory(null))),
                "other.txt :: \"o\"");
        WriteResult result = report.result("logs").orElseThrow();
        assertTrue(result.success());
        assertEquals(Severity.INFO, result.severity());
        assertTrue(Files.exists(root.resolve("logs/today.log")));
    }

    @Test
    @DisplayName("move renames the file instead of rewriting it")
    void move() throws IOException {
        write("old/util.py", "x = 1");
        MaterializationReport report = run(config(), ChronicleManifest.of(Map.of("old/util.py", tracked("x = 1"))),
                "lib/util.py :: \"x = 1\"");
        WriteResult result = report.result("lib/util.py").orElseThrow();
        assertEquals(WriteAction.MOVED, result.action());
        assertEquals("old/util.py", result.origin());
        assertEquals("x = 1", read("lib/util.py"));
        assertFalse(Files.exists(root.resolve("old")));
    }

    // ==================== Permissions ====================

    @Test
    @DisplayName("permission suffix is applied after the write")
    void permission() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        MaterializationReport report = run(config(), ChronicleManifest.empty(), "run.sh :: \"#!/bin/sh\" %% +x");
        assertEquals("755", report.result("run.sh").orElseThrow().permission());
        assertEquals("rwxr-xr-x", PosixFilePermissions.toString(Files.getPosixFilePermissions(root.resolve("run.sh"))));
    }

    @Test
    void toSymbolic() {
        assertEquals("rw-r--r--", TransactionalMaterializer.toSymbolic("644"));
        assertEquals("rwx------", TransactionalMaterializer.toSymbolic("700"));
    }
}
