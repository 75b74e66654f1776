package ru.nts.tools.blueprint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.blueprint.core.BlueprintErrorCode;
import ru.nts.tools.blueprint.core.BlueprintException;
import ru.nts.tools.blueprint.core.EngineConfig;
import ru.nts.tools.blueprint.core.ProjectLock;
import ru.nts.tools.blueprint.core.chronicle.ChronicleDatabase;
import ru.nts.tools.blueprint.core.chronicle.ChronicleRepository;
import ru.nts.tools.blueprint.core.chronicle.ChronicleStore;
import ru.nts.tools.blueprint.core.chronicle.H2ChronicleSink;
import ru.nts.tools.blueprint.core.materialize.ConflictPolicy;
import ru.nts.tools.blueprint.core.materialize.WriteAction;
import ru.nts.tools.blueprint.core.reconcile.ChangeKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сквозные сценарии: compile → plan → apply → chronicle.
 */
class BlueprintEngineTest {

    @TempDir
    Path root;

    private static final String BLUEPRINT = String.join("\n",
            "$$ project = demo",
            "$$ with_tests = true",
            "src/",
            "    {{ project }}/",
            "        __init__.py",
            "        main.py :: \"print('{{ project | upper }}')\"",
            "@if with_tests",
            "    tests/",
            "        test_main.py :: \"assert True\"",
            "@endif",
            "%% post-run",
            "    >> pip install -e .");

    private EngineConfig config() {
        return EngineConfig.forRoot(root).withWorkers(2);
    }

    private BlueprintEngine engine() {
        return new BlueprintEngine(config());
    }

    private String read(String path) throws IOException {
        return Files.readString(root.resolve(path), StandardCharsets.UTF_8);
    }

    // ==================== Lifecycle ====================

    @Test
    @DisplayName("first run creates the tree and commits the chronicle")
    void firstRun() throws IOException {
        ApplyReport report = engine().applyText(BLUEPRINT, "demo.blueprint");

        assertTrue(report.success());
        assertTrue(report.committed());
        assertEquals(0, report.exitCode());
        assertEquals("print('DEMO')", read("src/demo/main.py"));
        assertEquals("", read("src/demo/__init__.py"));
        assertEquals("assert True", read("tests/test_main.py"));
        assertEquals(6, report.summary().get("created"));
        assertEquals(List.of("pip install -e ."), report.commands().stream().map(c -> c.command()).toList());

        ChronicleStore.LoadResult loaded = new ChronicleStore().load(config().getChroniclePath());
        assertFalse(loaded.isCorrupted());
        assertEquals(6, loaded.chronicle().manifest().size());
        assertEquals("demo.blueprint", loaded.chronicle().provenance().blueprint());
    }

    @Test
    @DisplayName("second run of the same blueprint changes nothing")
    void idempotent() {
        engine().applyText(BLUEPRINT, null);
        ApplyReport again = engine().applyText(BLUEPRINT, null);

        assertTrue(again.success());
        assertFalse(again.plan().hasChanges());
        assertEquals(6, again.summary().get("unchanged"));
        assertEquals(0, again.summary().get("created"));
    }

    @Test
    @DisplayName("edited blueprint updates, removes and keeps paths")
    void evolve() throws IOException {
        engine().applyText(BLUEPRINT, null);
        String next = BLUEPRINT
                .replace("$$ with_tests = true", "$$ with_tests = false")
                .replace("print('{{ project | upper }}')", "print('v2')");

        ApplyReport report = engine().applyText(next, null);
        assertTrue(report.success());
        assertEquals(1, report.summary().get("updated"));
        assertEquals(2, report.summary().get("deleted"));
        assertEquals("print('v2')", read("src/demo/main.py"));
        assertFalse(Files.exists(root.resolve("tests")));
        assertTrue(Files.exists(root.resolve("src/demo/__init__.py")));
    }

    @Test
    @DisplayName("renamed file with the same content is moved")
    void rename() {
        engine().applyText("a/config.yml :: \"key: 1\"", null);
        ApplyReport report = engine().applyText("b/config.yml :: \"key: 1\"", null);

        assertEquals(1, report.summary().get("moved"));
        assertEquals(WriteAction.MOVED, report.results().get(0).action());
        assertFalse(Files.exists(root.resolve("a")));
        assertTrue(Files.exists(root.resolve("b/config.yml")));
    }

    // ==================== Conflicts ====================

    @Nested
    class Conflicts {

        private void prepare() throws IOException {
            engine().applyText("notes.md :: \"v1\"", null);
            Files.writeString(root.resolve("notes.md"), "my own notes", StandardCharsets.UTF_8);
        }

        @Test
        @DisplayName("ABORT returns an aborted report and writes nothing")
        void abort() throws IOException {
            prepare();
            ApplyReport report = engine().applyText("notes.md :: \"v2\"\nextra.txt :: \"x\"", null);

            assertFalse(report.success());
            assertFalse(report.committed());
            assertNotNull(report.aborted());
            assertEquals(1, report.exitCode());
            assertEquals(1, report.summary().get("conflict"));
            assertTrue(report.results().isEmpty());
            assertEquals("my own notes", read("notes.md"));
            assertFalse(Files.exists(root.resolve("extra.txt")));
        }

        @Test
        @DisplayName("SKIP applies the rest, commits and still reports failure")
        void skip() throws IOException {
            prepare();
            ApplyReport report = new BlueprintEngine(config().withConflictPolicy(ConflictPolicy.SKIP))
                    .applyText("notes.md :: \"v2\"\nextra.txt :: \"x\"", null);

            assertFalse(report.success());
            assertTrue(report.committed());
            assertEquals("my own notes", read("notes.md"));
            assertEquals("x", read("extra.txt"));
            assertTrue(report.chronicle().manifest().contains("notes.md"));
        }

        @Test
        @DisplayName("FORCE overwrites the manual edit")
        void force() throws IOException {
            prepare();
            ApplyReport report = new BlueprintEngine(config().withConflictPolicy(ConflictPolicy.FORCE))
                    .applyText("notes.md :: \"v2\"", null);

            assertTrue(report.success());
            assertEquals("v2", read("notes.md"));
        }
    }

    // ==================== Planning and dry run ====================

    @Test
    @DisplayName("planning reads only and reports the diff")
    void planOnly() throws IOException {
        engine().applyText("app.py :: \"v = 1\"", null);
        PlanningResult planning = engine().planText("app.py :: \"v = 2\"");

        assertEquals(ChangeKind.UPDATE, planning.plan().lookup("app.py").orElseThrow().kind());
        assertTrue(planning.plan().lookup("app.py").orElseThrow().diff().contains("+v = 2"));
        assertEquals("v = 1", read("app.py"));
    }

    @Test
    @DisplayName("dry run leaves no trace on disk")
    void dryRun() throws IOException {
        ApplyReport report = new BlueprintEngine(config().withDryRun(true)).applyText(BLUEPRINT, null);

        assertTrue(report.success());
        assertTrue(report.simulated());
        assertFalse(report.committed());
        try (Stream<Path> files = Files.list(root)) {
            assertEquals(0, files.count());
        }
    }

    // ==================== Chronicle ====================

    @Test
    @DisplayName("corrupted chronicle is backed up and the run proceeds")
    void corruptedChronicle() throws IOException {
        Files.writeString(config().getChroniclePath(), "{broken");
        ApplyReport report = engine().applyText("a.txt :: \"x\"", null);

        assertTrue(report.success());
        assertTrue(report.diagnostics().stream().anyMatch(d -> d.code().equals("CHRONICLE_CORRUPTED")));
        try (Stream<Path> files = Files.list(root)) {
            assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("scaffold.lock" + ChronicleStore.CORRUPT_SUFFIX)));
        }
        assertFalse(new ChronicleStore().load(config().getChroniclePath()).isCorrupted());
    }

    @Test
    @DisplayName("each committed run lands in the secondary store")
    void secondaryStore() throws Exception {
        engine().applyText("a.txt :: \"1\"", "first");
        engine().applyText("a.txt :: \"2\"", "second");

        H2ChronicleSink sink = new H2ChronicleSink(new ChronicleDatabase(config().getStateDir()));
        try {
            List<ChronicleRepository.RunRecord> runs = sink.recentRuns(10);
            assertEquals(2, runs.size());
            assertEquals(2, sink.historyOf("a.txt").size());
        } finally {
            sink.close();
        }
    }

    @Test
    @DisplayName("secondary store can be disabled")
    void noSecondaryStore() {
        new BlueprintEngine(config().withSecondaryStore(false)).applyText("a.txt :: \"1\"", null);
        assertFalse(Files.exists(config().getStateDir().resolve("chronicle.mv.db")));
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("concurrent run on the same root is refused")
    void locked() throws Exception {
        try (ProjectLock ignored = ProjectLock.acquire(config().getStateDir())) {
            BlueprintException e = assertThrows(BlueprintException.class, () -> engine().applyText("a.txt", null));
            assertEquals(BlueprintErrorCode.PROJECT_LOCKED, e.getCode());
        }
        assertFalse(Files.exists(root.resolve("a.txt")));
    }

    @Test
    @DisplayName("missing and non-UTF-8 blueprint files are rejected")
    void unreadableBlueprint() throws IOException {
        assertEquals(BlueprintErrorCode.BLUEPRINT_NOT_FOUND,
                assertThrows(BlueprintException.class, () -> engine().apply(root.resolve("nope.blueprint"))).getCode());

        Path bad = root.resolve("bad.blueprint");
        Files.write(bad, new byte[]{'a', (byte) 0xC3, (byte) 0x28});
        assertEquals(BlueprintErrorCode.BLUEPRINT_NOT_READABLE,
                assertThrows(BlueprintException.class, () -> engine().plan(bad)).getCode());
    }

    @Test
    @DisplayName("binary blueprint fails compilation")
    void compileFailed() {
        BlueprintException e = assertThrows(BlueprintException.class, () -> engine().compileText("a\u0000b"));
        assertEquals(BlueprintErrorCode.COMPILE_FAILED, e.getCode());
    }

    @Test
    @DisplayName("nesting deeper than the ceiling aborts the run")
    void recursionLimit() {
        BlueprintEngine shallow = new BlueprintEngine(config().withRecursionLimit(1));
        BlueprintException e = assertThrows(BlueprintException.class,
                () -> shallow.applyText("a/\n    b/\n        c.txt", null));
        assertEquals(BlueprintErrorCode.RECURSION_LIMIT, e.getCode());
    }
}
