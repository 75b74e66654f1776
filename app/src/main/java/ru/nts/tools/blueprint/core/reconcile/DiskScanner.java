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

import ru.nts.tools.blueprint.core.BlueprintErrorCode;
import ru.nts.tools.blueprint.core.BlueprintException;
import ru.nts.tools.blueprint.core.EncodingUtils;
import ru.nts.tools.blueprint.core.EngineLog;
import ru.nts.tools.blueprint.core.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.*;
import java.util.concurrent.*;

/**
 * Параллельный снимок диска по объединению путей Будущего и Прошлого.
 * Каждый путь обрабатывается независимо на ограниченном пуле потоков; общее состояние только
 * в конкурентной карте результатов.
 */
public class DiskScanner {

    private final Path root;
    private final long maxTextBytes;

    public DiskScanner(Path root, long maxTextBytes) {
        this.root = root.toAbsolutePath().normalize();
        this.maxTextBytes = maxTextBytes;
    }

    /**
     * Снимает состояние всех путей на пуле из {@code workers} потоков.
     */
    public Map<String, DiskSnapshot> scan(Collection<String> paths, ExecutorService executor) {
        Map<String, DiskSnapshot> result = new ConcurrentHashMap<>();
        List<Future<?>> futures = new ArrayList<>();
        for (String path : new LinkedHashSet<>(paths)) {
            futures.add(executor.submit(() -> result.put(path, snapshot(path))));
        }
        for (Future<?> future : futures) {
            await(future);
        }
        return new TreeMap<>(result);
    }

    static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BlueprintException(BlueprintErrorCode.INTERNAL_ERROR, e);
        } catch (ExecutionException e) {
            throw new BlueprintException(BlueprintErrorCode.INTERNAL_ERROR, e.getCause());
        }
    }

    /**
     * Снимок одного пути. Ошибка чтения не бросается, а записывается в снимок.
     */
    public DiskSnapshot snapshot(String relativePath) {
        Path target = root.resolve(relativePath).normalize();
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            return DiskSnapshot.absent(relativePath);
        }
        boolean symlink = Files.isSymbolicLink(target);
        String permission = readPermission(target);
        try {
            long modified = Files.getLastModifiedTime(target).toMillis();
            if (Files.isDirectory(target)) {
                return new DiskSnapshot(relativePath, true, true, symlink, null, 0, permission, false, modified, null, null);
            }
            long size = Files.size(target);
            if (size <= maxTextBytes) {
                byte[] bytes = FileUtils.safeReadAllBytes(target);
                boolean binary = EncodingUtils.isBinary(bytes);
                String text = binary ? null : EncodingUtils.decode(bytes).content();
                return new DiskSnapshot(relativePath, true, false, symlink, FileUtils.sha256(bytes), bytes.length,
                        permission, binary, modified, text, null);
            }
            // Большой файл: только потоковый хеш, без текста для diff
            return new DiskSnapshot(relativePath, true, false, symlink, FileUtils.sha256(target), size,
                    permission, probeBinary(target), modified, null, null);
        } catch (IOException e) {
            EngineLog.warn("Cannot read " + relativePath + ": " + e.getMessage());
            return new DiskSnapshot(relativePath, true, Files.isDirectory(target), symlink, null, 0, permission,
                    false, 0, null, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private boolean probeBinary(Path target) throws IOException {
        byte[] head = FileUtils.executeWithRetry(() -> {
            try (var in = Files.newInputStream(target)) {
                return in.readNBytes(8192);
            }
        });
        return EncodingUtils.isBinary(head);
    }

    /**
     * Права файла в восьмеричном виде ("644") или null на ФС без POSIX.
     */
    public static String readPermission(Path target) {
        try {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(target, LinkOption.NOFOLLOW_LINKS);
            return toOctal(perms);
        } catch (UnsupportedOperationException | IOException e) {
            return null;
        }
    }

    static String toOctal(Set<PosixFilePermission> perms) {
        int owner = 0, group = 0, others = 0;
        for (PosixFilePermission p : perms) {
            switch (p) {
                case OWNER_READ -> owner |= 4;
                case OWNER_WRITE -> owner |= 2;
                case OWNER_EXECUTE -> owner |= 1;
                case GROUP_READ -> group |= 4;
                case GROUP_WRITE -> group |= 2;
                case GROUP_EXECUTE -> group |= 1;
                case OTHERS_READ -> others |= 4;
                case OTHERS_WRITE -> others |= 2;
                case OTHERS_EXECUTE -> others |= 1;
            }
        }
        return "" + owner + group + others;
    }
}
