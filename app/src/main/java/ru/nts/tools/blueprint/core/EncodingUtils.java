/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.blueprint.core;

import org.mozilla.universalchardet.UniversalDetector;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Утилиты для определения кодировки и декодирования содержимого файлов с диска.
 * Использует UniversalDetector (juniversalchardet) для автоматического определения Charset.
 * Снимки диска и базы мутаций читаются через этот класс. Литералы пишутся в UTF-8,
 * мутация файла с диска сохраняет его кодировку и BOM.
 */
public class EncodingUtils {

    private static final int BINARY_PROBE = 8192;

    /**
     * Результат декодирования текста с определенной кодировкой.
     *
     * @param content Содержимое файла в виде строки.
     * @param charset Кодировка, использованная для декодирования байтов.
     */
    public record TextFileContent(String content, Charset charset) {
    }

    /**
     * Эвристика бинарного файла: наличие NULL-байтов в начале содержимого.
     * UTF-16/32 с BOM бинарными не считаются.
     */
    public static boolean isBinary(byte[] bytes) {
        if (hasUtf16or32Bom(bytes)) return false;
        int checkLimit = Math.min(bytes.length, BINARY_PROBE);
        for (int i = 0; i < checkLimit; i++) {
            if (bytes[i] == 0) return true;
        }
        return false;
    }

    /**
     * Декодирует байты с автоопределением кодировки.
     * Для валидного UTF-8 детектор не вызывается.
     */
    public static TextFileContent decode(byte[] bytes) {
        if (isValidUtf8(bytes)) {
            return new TextFileContent(new String(stripBom(bytes, StandardCharsets.UTF_8), StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        }

        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();

        String encoding = detector.getDetectedCharset();
        Charset charset = Charset.forName("windows-1251"); // самый частый не-UTF текст в наших проектах
        if (encoding != null) {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalArgumentException e) {
                EngineLog.debug("Unsupported charset '" + encoding + "', falling back to " + charset);
            }
        }
        return new TextFileContent(new String(stripBom(bytes, charset), charset), charset);
    }

    /**
     * BOM в начале исходных байтов для указанной кодировки (пустой массив, если его нет).
     */
    public static byte[] bomOf(byte[] bytes, Charset charset) {
        int length = bytes.length - stripBom(bytes, charset).length;
        return Arrays.copyOf(bytes, length);
    }

    /**
     * Кодирует текст в кодировку исходного файла и возвращает его BOM на место.
     *
     * @return байты или null, если кодировка не может представить текст
     */
    public static byte[] encode(String text, Charset charset, byte[] bom) {
        if (!charset.newEncoder().canEncode(text)) {
            return null;
        }
        byte[] body = text.getBytes(charset);
        if (bom.length == 0 || startsWith(body, bom)) {
            return body;
        }
        byte[] result = Arrays.copyOf(bom, bom.length + body.length);
        System.arraycopy(body, 0, result, bom.length, body.length);
        return result;
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) return false;
        return Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static boolean hasUtf16or32Bom(byte[] b) {
        if (b.length < 2) return false;
        int b0 = b[0] & 0xFF;
        int b1 = b[1] & 0xFF;
        return (b0 == 0xFE && b1 == 0xFF) || (b0 == 0xFF && b1 == 0xFE);
    }

    private static byte[] stripBom(byte[] allBytes, Charset charset) {
        if (allBytes.length < 2) return allBytes;

        String name = charset.name().toUpperCase();
        if (!name.startsWith("UTF-")) return allBytes; // BOM только для UTF

        int offset = 0;
        if (name.equals("UTF-8")) {
            if (allBytes.length >= 3 && (allBytes[0] & 0xFF) == 0xEF && (allBytes[1] & 0xFF) == 0xBB && (allBytes[2] & 0xFF) == 0xBF) {
                offset = 3;
            }
        } else if (name.startsWith("UTF-16")) {
            if (hasUtf16or32Bom(allBytes)) offset = 2;
        }

        if (offset > 0) {
            byte[] withoutBom = new byte[allBytes.length - offset];
            System.arraycopy(allBytes, offset, withoutBom, 0, withoutBom.length);
            return withoutBom;
        }
        return allBytes;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue; // ASCII

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
