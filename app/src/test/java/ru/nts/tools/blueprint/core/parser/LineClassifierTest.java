package ru.nts.tools.blueprint.core.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.blueprint.core.Severity;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    private LineClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new LineClassifier(4);
    }

    private ClassifiedLine classify(String raw) {
        return classifier.classify(1, raw);
    }

    // ==================== Basic kinds ====================

    @Test
    @DisplayName("blank and comment lines")
    void blankAndComments() {
        assertEquals(LineKind.BLANK, classify("   ").kind());
        assertEquals(LineKind.COMMENT, classify("# note").kind());
        assertEquals(LineKind.COMMENT, classify("   // note").kind());
    }

    @Test
    @DisplayName("indent counts tabs up to the next tab stop")
    void indentWithTabs() {
        assertEquals(4, classifier.measureIndent("\tsrc/"));
        assertEquals(4, classifier.measureIndent("  \tsrc/"));
        assertEquals(6, classifier.measureIndent("\t  src/"));
        assertEquals(0, classifier.measureIndent("\uFEFFsrc/"));
    }

    @Test
    @DisplayName("BOM and zero-width characters are ignored")
    void invisibleCharactersStripped() {
        ClassifiedLine line = classify("\uFEFFsrc/\u200B");
        assertEquals(LineKind.FORM, line.kind());
        assertEquals("src", line.form().path());
        assertTrue(line.form().directory());
    }

    // ==================== Variables ====================

    @Nested
    class Variables {

        @Test
        @DisplayName("declared variables with every prefix")
        void declaredPrefixes() {
            for (String raw : new String[]{"$$ name = \"demo\"", "let name = \"demo\"", "def name = \"demo\"", "const name = \"demo\""}) {
                ClassifiedLine line = classify(raw);
                assertEquals(LineKind.VARIABLE, line.kind(), raw);
                assertEquals("name", line.variable().name());
                assertEquals("\"demo\"", line.variable().value());
            }
        }

        @Test
        @DisplayName("type hint is captured")
        void typeHint() {
            ClassifiedLine line = classify("let debug: bool = true");
            assertEquals("bool", line.variable().typeHint());
            assertEquals("true", line.variable().value());
        }

        @Test
        @DisplayName("bare assignment is a variable, comparison is not")
        void bareAssignment() {
            assertEquals(LineKind.VARIABLE, classify("project = demo").kind());
            assertNotEquals(LineKind.VARIABLE, classify("a == b").kind());
        }
    }

    // ==================== Logic ====================

    @Nested
    class Logic {

        @Test
        @DisplayName("if with expression and trailing colon")
        void ifDirective() {
            ClassifiedLine line = classify("@if debug and x > 1:");
            assertEquals(LineKind.LOGIC, line.kind());
            assertEquals(LogicKeyword.IF, line.logic().keyword());
            assertEquals("debug and x > 1", line.logic().expression());
            assertNull(line.fault());
        }

        @Test
        @DisplayName("for header splits loop variable and iterable")
        void forHeader() {
            ClassifiedLine line = classify("@for module in modules");
            assertEquals(LogicKeyword.FOR, line.logic().keyword());
            assertEquals("module", line.logic().loopVariable());
            assertEquals("modules", line.logic().expression());
        }

        @Test
        @DisplayName("closers carry no expression")
        void closers() {
            ClassifiedLine line = classify("@endif");
            assertEquals(LogicKeyword.ENDIF, line.logic().keyword());
            assertNull(line.logic().expression());
            assertEquals(LogicKeyword.ELSE, classify("@else:").logic().keyword());
        }

        @Test
        @DisplayName("unknown directive is an error fault")
        void unknownDirective() {
            ClassifiedLine line = classify("@while running");
            assertEquals(LineKind.LOGIC, line.kind());
            assertNull(line.logic().keyword());
            assertEquals("UNKNOWN_DIRECTIVE", line.fault().code());
            assertEquals(Severity.ERROR, line.fault().severity());
        }

        @Test
        @DisplayName("if without expression")
        void missingExpression() {
            assertEquals("MISSING_EXPRESSION", classify("@if").fault().code());
            assertEquals("MISSING_EXPRESSION", classify("@for items").fault().code());
        }
    }

    // ==================== Commands ====================

    @Test
    @DisplayName("post-run single line and block header")
    void postRun() {
        ClassifiedLine single = classify("%% post-run: >> npm install");
        assertEquals(LineKind.COMMAND, single.kind());
        assertEquals("post-run", single.command().directive());
        assertEquals("npm install", single.command().text());
        assertFalse(single.command().isBlockHeader());

        ClassifiedLine header = classify("%% post-run");
        assertTrue(header.command().isBlockHeader());
        assertNull(header.fault());
    }

    @Test
    @DisplayName("other %% directives are warned and ignored")
    void unsupportedDirective() {
        ClassifiedLine line = classify("%% pre-run: echo hi");
        assertEquals(LineKind.COMMAND, line.kind());
        assertEquals(Severity.WARNING, line.fault().severity());
    }

    // ==================== Forms ====================

    @Nested
    class Forms {

        @Test
        @DisplayName("literal content in double quotes")
        void literal() {
            ClassifiedLine line = classify("src/main.py :: \"print(1)\"");
            assertEquals(LineKind.FORM, line.kind());
            assertEquals("src/main.py", line.form().path());
            assertEquals(FormOperator.LITERAL, line.form().operator());
            assertEquals("print(1)", line.form().payload());
            assertNull(line.fault());
        }

        @Test
        @DisplayName("escape sequences in double quotes, none in single quotes")
        void escapes() {
            assertEquals("a\nb", classify("f.txt :: \"a\\nb\"").form().payload());
            assertEquals("a\\nb", classify("f.txt :: 'a\\nb'").form().payload());
        }

        @Test
        @DisplayName("unquoted payload keeps hash characters")
        void unquotedPayloadKeepsHash() {
            ClassifiedLine line = classify("style.css :: a { color: #fff }");
            assertEquals("a { color: #fff }", line.form().payload());
        }

        @Test
        @DisplayName("trailing permission after quoted and unquoted payloads")
        void permissions() {
            assertEquals("755", classify("run.sh :: \"echo hi\" %% executable").form().permission());
            assertEquals("600", classify(".env :: TOKEN=1 %% secret").form().permission());
            assertEquals("644", classify("a.txt %% 0644").form().permission());
            assertEquals("444", classify("bin/ %% readonly").form().permission());
        }

        @Test
        @DisplayName("invalid permission is an error and ignored")
        void invalidPermission() {
            ClassifiedLine line = classify("a.txt :: \"x\" %% 999");
            assertNull(line.form().permission());
            assertEquals("INVALID_PERMISSION", line.fault().code());
        }

        @Test
        @DisplayName("seed path")
        void seed() {
            ClassifiedLine line = classify("src/app.py << src/main.py");
            assertEquals(FormOperator.SEED, line.form().operator());
            assertEquals("src/main.py", line.form().payload());
            assertEquals("MISSING_SEED", classify("src/app.py <<").fault().code());
        }

        @Test
        @DisplayName("mutation operators")
        void mutations() {
            assertEquals(FormOperator.APPEND, classify(".gitignore += \"*.log\"").form().operator());
            assertEquals(FormOperator.PREPEND, classify("main.py ^= '# header'").form().operator());
            assertEquals(FormOperator.SUBTRACT, classify("main.py -= 'debug'").form().operator());
        }

        @Test
        @DisplayName("rewrite with quoted find and replace")
        void rewrite() {
            ClassifiedLine line = classify("setup.cfg ~= 'version = (\\d+)' -> 'version = 2'");
            assertEquals(FormOperator.REWRITE, line.form().operator());
            assertEquals("version = (\\d+)", line.form().payload());
            assertEquals("version = 2", line.form().replacement());
            assertEquals("MALFORMED_REWRITE", classify("setup.cfg ~= 'x'").fault().code());
        }

        @Test
        @DisplayName("triple quote opens a block")
        void tripleQuote() {
            ClassifiedLine line = classify("README.md :: \"\"\"");
            assertEquals("\"\"\"", line.form().blockQuote());
            assertNull(line.form().payload());

            ClassifiedLine inline = classify("README.md :: '''one line'''");
            assertEquals("one line", inline.form().payload());
            assertNull(inline.form().blockQuote());
        }

        @Test
        @DisplayName("operator without payload awaits an implicit block")
        void implicitBlock() {
            assertTrue(classify("README.md ::").form().awaitsImplicitBlock());
            assertFalse(classify("README.md").form().awaitsImplicitBlock());
        }

        @Test
        @DisplayName("directory with content is warned and the content dropped")
        void directoryContent() {
            ClassifiedLine line = classify("src/ :: \"x\"");
            assertTrue(line.form().directory());
            assertEquals(FormOperator.NONE, line.form().operator());
            assertEquals("DIRECTORY_CONTENT", line.fault().code());
        }

        @Test
        @DisplayName("template placeholder with spaces stays in the path")
        void templatePath() {
            ClassifiedLine line = classify("src/{{ name | snake }}.py :: \"x\"");
            assertEquals("src/{{ name | snake }}.py", line.form().path());
            assertEquals("x", line.form().payload());
        }

        @Test
        @DisplayName("quoted path with spaces and backslashes")
        void quotedPath() {
            ClassifiedLine line = classify("'my docs\\notes.txt' :: \"x\"");
            assertEquals("my docs/notes.txt", line.form().path());
        }
    }

    @Test
    @DisplayName("permission names and octal forms")
    void parsePermission() {
        assertEquals("755", LineClassifier.parsePermission("+x"));
        assertEquals("755", LineClassifier.parsePermission("EXEC"));
        assertEquals("750", LineClassifier.parsePermission("0750"));
        assertNull(LineClassifier.parsePermission("rwx"));
        assertNull(LineClassifier.parsePermission("0888"));
    }
}
