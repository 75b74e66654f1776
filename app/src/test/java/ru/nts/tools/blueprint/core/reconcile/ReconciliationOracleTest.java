package ru.nts.tools.blueprint.core.reconcile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.blueprint.core.EngineConfig;
import ru.nts.tools.blueprint.core.FileUtils;
import ru.nts.tools.blueprint.core.Severity;
import ru.nts.tools.blueprint.core.chronicle.ChronicleManifest;
import ru.nts.tools.blueprint.core.chronicle.ManifestEntry;
import ru.nts.tools.blueprint.core.logic.LogicResolver;
import ru.nts.tools.blueprint.core.logic.MutationKind;
import ru.nts.tools.blueprint.core.logic.ResolutionResult;
import ru.nts.tools.blueprint.core.parser.StructuralCompiler;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationOracleTest {

    @TempDir
    Path root;

    private EngineConfig config;

    @BeforeEach
    void setUp() {
        config = EngineConfig.forRoot(root).withWorkers(2);
    }

    private ReconciliationPlan plan(ChronicleManifest history, String... lines) {
        ResolutionResult resolution = new LogicResolver(config)
                .resolve(new StructuralCompiler(4).compile(String.join("\n", lines)));
        return new ReconciliationOracle(config).plan(resolution, history);
    }

    private ReconciliationPlan plan(String... lines) {
        return plan(ChronicleManifest.empty(), lines);
    }

    private void write(String path, String text) throws IOException {
        Path target = root.resolve(path);
        Files.createDirectories(target.getParent());
        Files.writeString(target, text, StandardCharsets.UTF_8);
    }

    private static ManifestEntry tracked(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return ManifestEntry.file(FileUtils.sha256(bytes), bytes.length, null);
    }

    private static ChronicleManifest history(Map<String, ManifestEntry> entries) {
        return ChronicleManifest.of(entries);
    }

    private static ChangeKind kindOf(ReconciliationPlan plan, String path) {
        return plan.lookup(path).orElseThrow().kind();
    }

    // ==================== Lifecycle of a single file ====================

    @Nested
    class SingleFile {

        @Test
        @DisplayName("empty project: directory and file are created")
        void create() {
            ReconciliationPlan plan = plan("src/", "    main.py :: \"print(1)\"");
            assertEquals(Set.of("src", "src/main.py"), plan.paths(ChangeKind.CREATE));
            assertTrue(plan.hasChanges());
            assertFalse(plan.hasConflicts());
        }

        @Test
        @DisplayName("same content on disk and in history is unchanged")
        void unchanged() throws IOException {
            write("src/main.py", "print(1)");
            ReconciliationPlan plan = plan(history(Map.of("src", ManifestEntry.directory(null), "src/main.py", tracked("print(1)"))),
                    "src/", "    main.py :: \"print(1)\"");
            assertFalse(plan.hasChanges());
            assertEquals(2, plan.count(ChangeKind.UNCHANGED));
        }

        @Test
        @DisplayName("new blueprint content over an untouched file is an update with a diff")
        void update() throws IOException {
            write("src/main.py", "print(1)");
            ReconciliationPlan plan = plan(history(Map.of("src/main.py", tracked("print(1)"))),
                    "src/", "    main.py :: \"print(2)\"");
            PlannedChange change = plan.lookup("src/main.py").orElseThrow();
            assertEquals(ChangeKind.UPDATE, change.kind());
            assertTrue(change.diff().contains("-print(1)"));
            assertTrue(change.diff().contains("+print(2)"));
        }

        @Test
        @DisplayName("manual edit on disk is a conflict, never overwritten silently")
        void manualEditConflict() throws IOException {
            write("src/main.py", "print('hand edit')");
            ReconciliationPlan plan = plan(history(Map.of("src/main.py", tracked("print(1)"))),
                    "src/", "    main.py :: \"print(2)\"");
            PlannedChange change = plan.lookup("src/main.py").orElseThrow();
            assertEquals(ChangeKind.CONFLICT, change.kind());
            assertTrue(change.reason().startsWith("Modified on disk"));
            assertNotNull(change.diff());
            assertTrue(plan.hasConflicts());
            assertTrue(plan.diagnostics().stream().anyMatch(d -> d.code().equals("CONFLICT")));
        }

        @Test
        @DisplayName("disk already matching the blueprint refreshes history")
        void historyRefresh() throws IOException {
            write("a.txt", "new");
            ReconciliationPlan plan = plan(history(Map.of("a.txt", tracked("old"))), "a.txt :: \"new\"");
            PlannedChange change = plan.lookup("a.txt").orElseThrow();
            assertEquals(ChangeKind.UNCHANGED, change.kind());
            assertEquals("History refreshed from disk", change.reason());
        }

        @Test
        @DisplayName("untracked file with other content is updated")
        void untracked() throws IOException {
            write("a.txt", "mine");
            PlannedChange change = plan("a.txt :: \"theirs\"").lookup("a.txt").orElseThrow();
            assertEquals(ChangeKind.UPDATE, change.kind());
            assertEquals("Untracked file will be overwritten", change.reason());
        }

        @Test
        @DisplayName("untracked file with identical content is unchanged")
        void untrackedIdentical() throws IOException {
            write("a.txt", "same");
            assertEquals(ChangeKind.UNCHANGED, kindOf(plan("a.txt :: \"same\""), "a.txt"));
        }
    }

    // ==================== Removal ====================

    @Nested
    class Removal {

        @Test
        @DisplayName("tracked file dropped from the blueprint is deleted")
        void delete() throws IOException {
            write("old.txt", "bye");
            ReconciliationPlan plan = plan(history(Map.of("old.txt", tracked("bye"))), "keep.txt :: \"k\"");
            assertEquals(ChangeKind.DELETE, kindOf(plan, "old.txt"));
        }

        @Test
        @DisplayName("edited tracked file dropped from the blueprint is a conflict")
        void editedDelete() throws IOException {
            write("old.txt", "edited");
            ReconciliationPlan plan = plan(history(Map.of("old.txt", tracked("bye"))), "keep.txt :: \"k\"");
            assertEquals(ChangeKind.CONFLICT, kindOf(plan, "old.txt"));
        }

        @Test
        @DisplayName("tracked file already gone only leaves the history")
        void alreadyAbsent() {
            ReconciliationPlan plan = plan(history(Map.of("gone.txt", tracked("x"))), "keep.txt :: \"k\"");
            PlannedChange change = plan.lookup("gone.txt").orElseThrow();
            assertEquals(ChangeKind.DELETE, change.kind());
            assertEquals("Already absent on disk", change.reason());
        }

        @Test
        @DisplayName("untracked files outside the blueprint are never touched")
        void untrackedIgnored() throws IOException {
            write("notes.txt", "private");
            ReconciliationPlan plan = plan("a.txt :: \"x\"");
            assertTrue(plan.lookup("notes.txt").isEmpty());
        }
    }

    // ==================== Moves ====================

    @Nested
    class Moves {

        @Test
        @DisplayName("delete plus create with identical content becomes a move")
        void move() throws IOException {
            write("old/util.py", "x = 1");
            ReconciliationPlan plan = plan(history(Map.of("old/util.py", tracked("x = 1"))), "lib/util.py :: \"x = 1\"");
            PlannedChange change = plan.lookup("lib/util.py").orElseThrow();
            assertEquals(ChangeKind.MOVE, change.kind());
            assertEquals("old/util.py", change.origin());
            assertSame(change, plan.lookup("old/util.py").orElseThrow());
            assertEquals(0, plan.count(ChangeKind.DELETE));
        }

        @Test
        @DisplayName("seed decides between identical candidates")
        void seedWins() throws IOException {
            write("a/conf.txt", "same");
            write("b/other.txt", "same");
            ReconciliationPlan plan = plan(history(Map.of("a/conf.txt", tracked("same"), "b/other.txt", tracked("same"))),
                    "c/conf.txt << b/other.txt");
            PlannedChange change = plan.lookup("c/conf.txt").orElseThrow();
            assertEquals(ChangeKind.MOVE, change.kind());
            assertEquals("b/other.txt", change.origin());
            assertEquals(ChangeKind.DELETE, kindOf(plan, "a/conf.txt"));
        }

        @Test
        @DisplayName("same file name is preferred, then the deeper common parent")
        void pickOrder() {
            PlannedChange create = change("src/app/util.py", ChangeKind.CREATE);
            PlannedChange byName = change("lib/util.py", ChangeKind.DELETE);
            PlannedChange byParent = change("src/app/helpers.py", ChangeKind.DELETE);
            assertSame(byName, ReconciliationOracle.pickOrigin(create, List.of(byParent, byName)));

            PlannedChange shallow = change("other/x.py", ChangeKind.DELETE);
            PlannedChange deep = change("src/app/y.py", ChangeKind.DELETE);
            assertSame(deep, ReconciliationOracle.pickOrigin(create, List.of(shallow, deep)));
        }

        @Test
        void commonParentDepth() {
            assertEquals(2, ReconciliationOracle.commonParentDepth("a/b/c.txt", "a/b/d.txt"));
            assertEquals(0, ReconciliationOracle.commonParentDepth("a.txt", "a/b.txt"));
        }

        private PlannedChange change(String path, ChangeKind kind) {
            return new PlannedChange(path, kind, false, null, null, null, DiskSnapshot.absent(path), null, null, null);
        }
    }

    // ==================== Edge cases ====================

    @Test
    @DisplayName("missing seed is a conflict")
    void missingSeed() {
        PlannedChange change = plan("copy.txt << nowhere.txt").lookup("copy.txt").orElseThrow();
        assertEquals(ChangeKind.CONFLICT, change.kind());
        assertTrue(change.reason().contains("nowhere.txt"));
    }

    @Test
    @DisplayName("file in the way of a planned directory is a conflict")
    void fileBlocksDirectory() throws IOException {
        write("build", "oops");
        assertEquals(ChangeKind.CONFLICT, kindOf(plan("build/"), "build"));
    }

    @Test
    @DisplayName("mutation on an existing file appends once")
    void diskMutation() throws IOException {
        write(".gitignore", "target/\n");
        PlannedChange change = plan(".gitignore += \"*.log\"").lookup(".gitignore").orElseThrow();
        assertEquals(ChangeKind.UPDATE, change.kind());
        assertEquals("target/\n*.log", change.afterText());

        write(".gitignore", "target/\n*.log");
        assertEquals(ChangeKind.UNCHANGED, kindOf(plan(".gitignore += \"*.log\""), ".gitignore"));
    }

    @Nested
    class DiskEncoding {

        private final Charset cp1251 = Charset.forName("windows-1251");
        // Повторяющийся текст дает детектору достаточную выборку
        private final String legacy = "Это русский текст в кодировке Windows-1251. " + "Проверка кириллицы. ".repeat(20);

        @Test
        @DisplayName("mutating a legacy-encoded file keeps its charset")
        void keepsCharset() throws IOException {
            Files.write(root.resolve("notes.txt"), legacy.getBytes(cp1251));

            PlannedChange change = plan("notes.txt += \"Конец.\"").lookup("notes.txt").orElseThrow();
            String expected = TextMutator.applyOnce(MutationKind.APPEND, legacy, "Конец.", null);
            assertEquals(ChangeKind.UPDATE, change.kind());
            assertArrayEquals(expected.getBytes(cp1251), change.intended().bytes());
            assertTrue(plan("notes.txt += \"Конец.\"").diagnostics().isEmpty());
        }

        @Test
        @DisplayName("mutating a UTF-8 file with a BOM keeps the BOM")
        void keepsBom() throws IOException {
            byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
            byte[] body = "a\n".getBytes(StandardCharsets.UTF_8);
            byte[] bytes = new byte[bom.length + body.length];
            System.arraycopy(bom, 0, bytes, 0, bom.length);
            System.arraycopy(body, 0, bytes, bom.length, body.length);
            Files.write(root.resolve("x.txt"), bytes);

            byte[] written = plan("x.txt += \"b\"").lookup("x.txt").orElseThrow().intended().bytes();
            assertArrayEquals(bom, Arrays.copyOf(written, 3));
            assertEquals("a\nb", new String(written, 3, written.length - 3, StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("text the file's charset cannot hold is written as UTF-8 with a warning")
        void transcodeWarns() throws IOException {
            Files.write(root.resolve("notes.txt"), legacy.getBytes(cp1251));

            ReconciliationPlan plan = plan("notes.txt += \"\u2713 done\"");
            PlannedChange change = plan.lookup("notes.txt").orElseThrow();
            assertEquals(change.afterText(), new String(change.intended().bytes(), StandardCharsets.UTF_8));
            assertTrue(plan.diagnostics().stream()
                    .anyMatch(d -> d.code().equals("TRANSCODED") && d.severity() == Severity.WARNING && d.line() == 1));
        }
    }

    @Test
    @DisplayName("virtual root prefix is stripped from planned and tracked paths")
    void virtualRoot() {
        ReconciliationPlan plan = plan(history(Map.of("app/old.txt", tracked("x"))),
                "$$ virtual_root = app",
                "app/",
                "    readme.md :: \"hi\"");
        assertTrue(plan.lookup("app").isEmpty());
        assertEquals(ChangeKind.CREATE, kindOf(plan, "readme.md"));
        assertTrue(plan.past().contains("old.txt"));
    }

    @Test
    @DisplayName("every path of the union lands in exactly one set")
    void partition() throws IOException {
        write("keep.txt", "k");
        write("drop.txt", "d");
        ReconciliationPlan plan = plan(history(Map.of("keep.txt", tracked("k"), "drop.txt", tracked("d"))),
                "keep.txt :: \"k\"",
                "add.txt :: \"a\"");
        int total = plan.counts().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(3, total);
        assertEquals(Set.of("add.txt"), plan.paths(ChangeKind.CREATE));
        assertEquals(Set.of("drop.txt"), plan.paths(ChangeKind.DELETE));
        assertEquals(Set.of("keep.txt"), plan.paths(ChangeKind.UNCHANGED));
    }
}
