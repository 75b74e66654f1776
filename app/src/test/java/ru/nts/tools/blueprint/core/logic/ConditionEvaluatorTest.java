package ru.nts.tools.blueprint.core.logic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    @TempDir
    Path root;

    private VariableContext context;
    private VirtualManifest manifest;
    private ConditionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        context = new VariableContext();
        manifest = new VirtualManifest(root);
        evaluator = new ConditionEvaluator(context, manifest);
        context.define("debug", true);
        context.define("lang", "python");
        context.define("workers", 4L);
        context.define("features", List.of("api", "cli"));
    }

    @Test
    @DisplayName("boolean operators in both spellings")
    void booleanOperators() throws Exception {
        assertTrue(evaluator.test("debug and lang == 'python'"));
        assertTrue(evaluator.test("debug && workers > 2"));
        assertFalse(evaluator.test("not debug"));
        assertFalse(evaluator.test("!debug"));
        assertTrue(evaluator.test("false or debug"));
        assertTrue(evaluator.test("false || (workers >= 4 and lang != \"go\")"));
    }

    @Test
    @DisplayName("comparisons are numeric when both sides are numbers")
    void numericComparison() throws Exception {
        assertTrue(evaluator.test("workers < 10"));
        assertTrue(evaluator.test("workers == '4'"));
        assertFalse(evaluator.test("workers <= 3"));
    }

    @Test
    @DisplayName("membership in lists and substrings")
    void membership() throws Exception {
        assertTrue(evaluator.test("'api' in features"));
        assertTrue(evaluator.test("'web' not in features"));
        assertTrue(evaluator.test("'yth' in lang"));
        assertTrue(evaluator.test("lang in ['python', 'go']"));
    }

    @Test
    @DisplayName("defined() takes a name, not a value")
    void definedFunction() throws Exception {
        assertTrue(evaluator.test("defined(lang)"));
        assertFalse(evaluator.test("defined(missing)"));
    }

    @Test
    @DisplayName("exists() sees planned paths and disk")
    void existsFunction() throws Exception {
        Files.createDirectories(root.resolve("docs"));
        manifest.register("src/main.py");

        assertTrue(evaluator.test("exists('src/main.py')"));
        assertTrue(evaluator.test("exists('src')"));
        assertTrue(evaluator.test("exists('docs')"));
        assertFalse(evaluator.test("exists('nope.txt')"));
        assertFalse(evaluator.test("exists('../outside')"));
    }

    @Test
    @DisplayName("undefined variable is a fault, not false")
    void undefinedVariable() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> evaluator.test("missing == 1"));
        assertTrue(e.getMessage().contains("missing"));
    }

    @Test
    @DisplayName("malformed expressions are faults")
    void malformed() {
        assertThrows(EvaluationException.class, () -> evaluator.test("(debug"));
        assertThrows(EvaluationException.class, () -> evaluator.test("debug debug"));
        assertThrows(EvaluationException.class, () -> evaluator.test("'open"));
        assertThrows(EvaluationException.class, () -> evaluator.test("frobnicate(1)"));
        assertThrows(EvaluationException.class, () -> evaluator.test("  "));
        assertThrows(EvaluationException.class, () -> evaluator.test("a $ b"));
    }

    @Test
    @DisplayName("loop binding shadows globals")
    void loopBinding() throws Exception {
        context.bind("lang", "go");
        try {
            assertTrue(evaluator.test("lang == 'go'"));
        } finally {
            context.unbind();
        }
        assertTrue(evaluator.test("lang == 'python'"));
    }

    @Test
    @DisplayName("evaluate returns list literals")
    void evaluateList() throws Exception {
        assertEquals(List.of("a", 2L), evaluator.evaluate("['a', 2]"));
        assertEquals(List.of("api", "cli"), evaluator.evaluate("features"));
    }
}
