package ru.nts.tools.blueprint.core.logic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogicValuesTest {

    @Test
    @DisplayName("literal parsing")
    void parseLiteral() {
        assertEquals("demo", LogicValues.parseLiteral("\"demo\""));
        assertEquals("it's", LogicValues.parseLiteral("\"it's\""));
        assertEquals(Boolean.TRUE, LogicValues.parseLiteral("TRUE"));
        assertEquals(42L, LogicValues.parseLiteral(" 42 "));
        assertEquals(List.of("a", 1L, "c, d"), LogicValues.parseLiteral("[a, 1, 'c, d']"));
        assertEquals("bare words", LogicValues.parseLiteral("bare words"));
        assertEquals("", LogicValues.parseLiteral("  "));
    }

    @Test
    @DisplayName("truthiness")
    void truthy() {
        assertFalse(LogicValues.truthy(null));
        assertFalse(LogicValues.truthy(0L));
        assertFalse(LogicValues.truthy("no"));
        assertFalse(LogicValues.truthy(List.of()));
        assertTrue(LogicValues.truthy("yes"));
        assertTrue(LogicValues.truthy(List.of("x")));
    }

    @Test
    @DisplayName("iteration over lists and comma separated strings")
    void asIterable() {
        assertEquals(List.of("a", "b"), LogicValues.asIterable("a, b,"));
        assertEquals(List.of(3L), LogicValues.asIterable(3L));
    }

    @Test
    @DisplayName("loose equality")
    void looselyEquals() {
        assertTrue(LogicValues.looselyEquals(true, "true"));
        assertTrue(LogicValues.looselyEquals(7L, "7"));
        assertFalse(LogicValues.looselyEquals(true, "yes"));
        assertTrue(LogicValues.looselyEquals("a", "a"));
    }
}
