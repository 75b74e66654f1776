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
package ru.nts.tools.blueprint.core.reconcile;

import ru.nts.tools.blueprint.core.*;
import ru.nts.tools.blueprint.core.logic.PlannedEntry;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Вычисляет итоговое содержимое каждой запланированной записи: ровно те байты, которые будут записаны,
 * чтобы сравнение хешей было побитовым.
 *
 * Литерал пишется в UTF-8, семя копируется байт в байт, мутация применяется к своей базе:
 * более ранней записи того же пути, иначе к файлу на диске (в его кодировке), иначе к пустому тексту.
 */
public class ContentResolver {

    private final PathSanitizer sanitizer;

    public ContentResolver(PathSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    /**
     * Литералы и семена считаются параллельно; мутации, зависящие от своей базы, последовательно.
     */
    public Map<String, IntendedContent> resolveAll(List<PlannedEntry> entries, ExecutorService executor) {
        Map<String, IntendedContent> result = new ConcurrentHashMap<>();
        List<Future<?>> futures = new ArrayList<>();
        for (PlannedEntry entry : entries) {
            if (!entry.isMutation()) {
                futures.add(executor.submit(() -> result.put(entry.path(), resolve(entry))));
            }
        }
        for (Future<?> future : futures) {
            DiskScanner.await(future);
        }
        for (PlannedEntry entry : entries) {
            if (entry.isMutation()) {
                result.put(entry.path(), resolve(entry));
            }
        }
        return new TreeMap<>(result);
    }

    public IntendedContent resolve(PlannedEntry entry) {
        if (entry.directory()) {
            return IntendedContent.directory(entry.path());
        }
        if (entry.isSeeded()) {
            return fromSeed(entry);
        }
        if (entry.isMutation()) {
            return mutate(entry);
        }
        return ofText(entry.path(), entry.content());
    }

    private IntendedContent fromSeed(PlannedEntry entry) {
        String reason = BlueprintErrorCode.SEED_NOT_FOUND.format(Map.of("seed", entry.seed(), "line", entry.line()));
        Path seed;
        try {
            seed = sanitizer.resolve(entry.seed());
        } catch (BlueprintException e) {
            return IntendedContent.failed(entry.path(), e.getCode().format(e.getContext()));
        }
        if (!Files.isRegularFile(seed)) {
            return IntendedContent.failed(entry.path(), reason);
        }
        try {
            return ofBytes(entry.path(), FileUtils.safeReadAllBytes(seed));
        } catch (IOException e) {
            return IntendedContent.failed(entry.path(), reason + " (" + e.getMessage() + ")");
        }
    }

    private IntendedContent mutate(PlannedEntry entry) {
        String base;
        EncodingUtils.TextFileContent decoded = null;
        byte[] bom = null;
        if (entry.base() != null) {
            IntendedContent earlier = resolve(entry.base());
            if (earlier.isFailed()) {
                return IntendedContent.failed(entry.path(), earlier.failure());
            }
            if (earlier.binary()) {
                return IntendedContent.failed(entry.path(), "Cannot apply a text mutation to binary content (line " + entry.line() + ")");
            }
            base = earlier.text();
        } else {
            Path onDisk = sanitizer.getRoot().resolve(entry.path());
            if (Files.isRegularFile(onDisk)) {
                try {
                    byte[] bytes = FileUtils.safeReadAllBytes(onDisk);
                    if (EncodingUtils.isBinary(bytes)) {
                        return IntendedContent.failed(entry.path(), "Cannot apply a text mutation to binary file (line " + entry.line() + ")");
                    }
                    decoded = EncodingUtils.decode(bytes);
                    bom = EncodingUtils.bomOf(bytes, decoded.charset());
                    base = decoded.content();
                } catch (IOException e) {
                    return IntendedContent.failed(entry.path(), "Cannot read mutation base: " + e.getMessage());
                }
            } else {
                base = "";
            }
        }
        if (decoded == null) {
            return ofText(entry.path(), TextMutator.apply(entry.mutation(), base, entry.content(), entry.replacement()));
        }

        // Файл с диска остается в своей кодировке и со своим BOM
        String mutated = TextMutator.applyOnce(entry.mutation(), base, entry.content(), entry.replacement());
        Charset charset = decoded.charset();
        byte[] encoded = EncodingUtils.encode(mutated, charset, bom);
        if (encoded != null) {
            return new IntendedContent(entry.path(), encoded, FileUtils.sha256(encoded), false, mutated, null, null);
        }
        byte[] utf8 = mutated.getBytes(StandardCharsets.UTF_8);
        String note = entry.path() + " is " + charset.name() + " but the mutation (line " + entry.line()
                + ") cannot be represented in it; the file is rewritten as UTF-8";
        EngineLog.warn(note);
        return new IntendedContent(entry.path(), utf8, FileUtils.sha256(utf8), false, mutated, null, note);
    }

    static IntendedContent ofText(String path, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return new IntendedContent(path, bytes, FileUtils.sha256(bytes), false, text, null, null);
    }

    static IntendedContent ofBytes(String path, byte[] bytes) {
        boolean binary = EncodingUtils.isBinary(bytes);
        String text = binary ? null : EncodingUtils.decode(bytes).content();
        return new IntendedContent(path, bytes, FileUtils.sha256(bytes), binary, text, null, null);
    }
}
