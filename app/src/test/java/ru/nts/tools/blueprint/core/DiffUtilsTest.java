package ru.nts.tools.blueprint.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffUtilsTest {

    @Test
    @DisplayName("identical texts produce an empty diff")
    void identical() {
        assertEquals("", DiffUtils.getUnifiedDiff("a.txt", "x\n", "x\n"));
    }

    @Test
    @DisplayName("single changed line yields one hunk with headers")
    void changedLine() {
        String diff = DiffUtils.getUnifiedDiff("src/main.py", "a\nb\nc\n", "a\nB\nc\n");
        assertTrue(diff.startsWith("--- a/src/main.py\n+++ b/src/main.py\n@@ "));
        assertTrue(diff.contains("\n-b\n"));
        assertTrue(diff.contains("\n+B\n"));
        assertTrue(diff.contains("\n a\n"));
    }

    @Test
    @DisplayName("creation from empty text is all insertions")
    void fromEmpty() {
        String diff = DiffUtils.getUnifiedDiff("n.txt", "", "one\ntwo");
        assertTrue(diff.contains("+one"));
        assertTrue(diff.contains("+two"));
        assertFalse(diff.contains("\n-"));
    }
}
