package ru.nts.tools.blueprint.core.logic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateAlchemistTest {

    private VariableContext context;
    private TemplateAlchemist alchemist;
    private List<String> warnings;

    @BeforeEach
    void setUp() {
        context = new VariableContext();
        alchemist = new TemplateAlchemist(context);
        warnings = new ArrayList<>();
        context.define("name", "My Cool App");
        context.define("items", List.of("a", "b"));
    }

    private String expand(String template) {
        return alchemist.expand(template, (code, message) -> warnings.add(code));
    }

    @Test
    @DisplayName("plain substitution and filter chains")
    void substitution() {
        assertEquals("# My Cool App", expand("# {{ name }}"));
        assertEquals("my_cool_app.py", expand("{{name|snake}}.py"));
        assertEquals("MY-COOL-APP", expand("{{ name | kebab | upper }}"));
        assertEquals("a, b", expand("{{ items }}"));
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("undefined variable keeps the placeholder and warns")
    void undefinedVariable() {
        assertEquals("x {{ missing }} y", expand("x {{ missing }} y"));
        assertEquals(List.of("UNDEFINED_VARIABLE"), warnings);
    }

    @Test
    @DisplayName("unknown filter is skipped with a warning")
    void unknownFilter() {
        assertEquals("my cool app", expand("{{ name | shout | lower }}"));
        assertEquals(List.of("UNKNOWN_FILTER"), warnings);
    }

    @Test
    @DisplayName("text without placeholders and null pass through")
    void passThrough() {
        assertEquals("$1 and \\ stay", expand("$1 and \\ stay"));
        assertNull(expand(null));
    }

    @Test
    @DisplayName("replacement text with dollar signs is inserted literally")
    void dollarInValue() {
        context.define("price", "$5");
        assertEquals("cost: $5", expand("cost: {{ price }}"));
    }

    @Test
    @DisplayName("case filters")
    void filters() {
        assertEquals("myCoolApp", TemplateAlchemist.applyFilter("camel", "my-cool app"));
        assertEquals("MyCoolApp", TemplateAlchemist.applyFilter("pascal", "myCoolApp"));
        assertEquals("http_server", TemplateAlchemist.applyFilter("snake", "HttpServer"));
        assertEquals("hello-world", TemplateAlchemist.applyFilter("slug", "Hello, World!"));
        assertEquals("Hello World", TemplateAlchemist.applyFilter("title", "hello WORLD"));
        assertEquals("x", TemplateAlchemist.applyFilter("trim", "  x "));
        assertNull(TemplateAlchemist.applyFilter("reverse", "x"));
    }
}
