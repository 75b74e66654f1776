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

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.nio.file.attribute.PosixFileAttributeView;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Утилиты для безопасной работы с файловой системой.
 * Реализует Safe Swap (атомарная перезапись через временные файлы),
 * Retry Pattern для обхода блокировок в Windows и SHA-256 хеширование контента.
 */
public class FileUtils {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms
    private static final SecureRandom TEMP_SUFFIX = new SecureRandom();

    /**
     * Выполняет IO-операцию с механизмом повторов.
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        IOException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (FileSystemException e) {
                lastException = e;
                long backoff = INITIAL_BACKOFF * (long) Math.pow(2, i);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Retry interrupted", ie);
                }
            }
        }
        throw lastException;
    }

    /**
     * Гарантирует существование родительской директории для указанного пути.
     */
    public static void ensureParentExists(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Рекурсивно удаляет пустые родительские директории, начиная от указанного пути
     * и заканчивая корнем проекта (не включая корень). Директории, для которых {@code keep} истинно,
     * не удаляются и останавливают подъем.
     */
    public static void deleteEmptyParents(Path path, Path root, Predicate<Path> keep) {
        Path parent = path.getParent();
        while (parent != null && !parent.equals(root) && parent.startsWith(root) && Files.exists(parent)) {
            if (keep.test(parent)) return;
            try {
                if (!deleteDirectoryIfEmpty(parent)) return;
            } catch (IOException e) {
                EngineLog.debug("Keeping directory " + parent + ": " + e.getMessage());
                return;
            }
            parent = parent.getParent();
        }
    }

    /**
     * Удаляет директорию, только если она пуста.
     *
     * @return true, если директория удалена или уже отсутствовала
     */
    public static boolean deleteDirectoryIfEmpty(Path dir) throws IOException {
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) return true;
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) return false;
        try (var s = Files.list(dir)) {
            if (s.findAny().isPresent()) return false; // Папка не пуста
        }
        return executeWithRetry(() -> Files.deleteIfExists(dir)) || !Files.exists(dir);
    }

    /**
     * Безопасная запись байтов в файл с использованием алгоритма Safe Swap:
     * запись в уникальный временный файл рядом с целью, затем атомарная замена.
     * Файл ни в какой момент не виден частично записанным; соседние файлы
     * (в том числе {@code name.tmp} и {@code name.old}) не затрагиваются.
     */
    public static void safeWrite(Path path, byte[] bytes) throws IOException {
        ensureParentExists(path);
        String name = path.getFileName().toString();

        executeWithRetry(() -> {
            Path tempFile = createSiblingTemp(path, name, bytes);
            try {
                if (Files.exists(path) && Files.getFileStore(tempFile).supportsFileAttributeView(PosixFileAttributeView.class)) {
                    // Перезапись не меняет права существующего файла
                    Files.setPosixFilePermissions(tempFile, Files.getPosixFilePermissions(path));
                }
                moveAtomically(tempFile, path);
            } catch (IOException e) {
                Files.deleteIfExists(tempFile);
                throw e;
            }
            return null;
        });
    }

    /**
     * Создает временный файл с уникальным именем {@code .name.<random>.tmp} рядом с целью.
     * CREATE_NEW гарантирует, что существующий файл никогда не перезаписывается.
     */
    private static Path createSiblingTemp(Path path, String name, byte[] bytes) throws IOException {
        for (int attempt = 0; ; attempt++) {
            Path candidate = path.resolveSibling("." + name + "." + Long.toHexString(TEMP_SUFFIX.nextLong()) + ".tmp");
            try {
                Files.write(candidate, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return candidate;
            } catch (FileAlreadyExistsException e) {
                if (attempt >= MAX_RETRIES) throw e;
            } catch (IOException e) {
                Files.deleteIfExists(candidate);
                throw e;
            }
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Безопасное чтение всех байтов файла.
     */
    public static byte[] safeReadAllBytes(Path path) throws IOException {
        return executeWithRetry(() -> Files.readAllBytes(path));
    }

    /**
     * Безопасное перемещение/переименование файла.
     */
    public static void safeMove(Path source, Path target, CopyOption... options) throws IOException {
        ensureParentExists(target);
        executeWithRetry(() -> {
            Files.move(source, target, options);
            return null;
        });
    }

    /**
     * Безопасное удаление файла.
     */
    public static void safeDelete(Path path) throws IOException {
        executeWithRetry(() -> {
            Files.deleteIfExists(path);
            return null;
        });
    }

    /**
     * SHA-256 от массива байтов в виде hex-строки (нижний регистр).
     */
    public static String sha256(byte[] bytes) {
        return HexFormat.of().formatHex(newDigest().digest(bytes));
    }

    /**
     * Потоковый SHA-256 содержимого файла.
     */
    public static String sha256(Path path) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] buffer = new byte[8192];
            int len;
            while ((len = in.read(buffer)) != -1) {
                digest.update(buffer, 0, len);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
