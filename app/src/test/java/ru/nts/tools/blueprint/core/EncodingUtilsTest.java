package ru.nts.tools.blueprint.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EncodingUtilsTest {

    @Test
    @DisplayName("NUL bytes mark binary content")
    void binary() {
        assertTrue(EncodingUtils.isBinary(new byte[]{'P', 'K', 3, 4, 0, 0}));
        assertFalse(EncodingUtils.isBinary("plain text".getBytes(StandardCharsets.UTF_8)));
        assertFalse(EncodingUtils.isBinary(new byte[]{(byte) 0xFF, (byte) 0xFE, 'a', 0}));
    }

    @Test
    @DisplayName("valid UTF-8 is decoded directly, BOM stripped")
    void utf8() {
        byte[] withBom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'h', 'i'};
        EncodingUtils.TextFileContent decoded = EncodingUtils.decode(withBom);
        assertEquals("hi", decoded.content());
        assertEquals(StandardCharsets.UTF_8, decoded.charset());
        assertEquals("Привет", EncodingUtils.decode("Привет".getBytes(StandardCharsets.UTF_8)).content());
    }

    @Test
    @DisplayName("legacy Cyrillic text is detected")
    void cyrillic() {
        // Повторяющийся текст дает детектору достаточную выборку
        String text = "Это русский текст в кодировке Windows-1251. " + "Проверка кириллицы. ".repeat(20);
        byte[] bytes = text.getBytes(Charset.forName("windows-1251"));
        assertEquals(text, EncodingUtils.decode(bytes).content());
    }
}
