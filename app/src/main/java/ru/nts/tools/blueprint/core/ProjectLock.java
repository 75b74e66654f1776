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

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Эксклюзивная блокировка проекта на время применения плана.
 * Хроника является единственной точкой сериализации для корня проекта,
 * поэтому два одновременных прогона по одному корню не допускаются.
 * Используется системная блокировка файла (.scaffold/run.lock): она снимается ОС при падении процесса.
 */
public final class ProjectLock implements AutoCloseable {

    public static final String LOCK_FILE = "run.lock";

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private ProjectLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Захватывает блокировку без ожидания.
     *
     * @throws BlueprintException PROJECT_LOCKED, если блокировку держит другой прогон
     */
    public static ProjectLock acquire(Path stateDir) throws IOException {
        Files.createDirectories(stateDir);
        Path lockFile = stateDir.resolve(LOCK_FILE);
        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // Блокировку держит этот же процесс (другой поток или движок)
            lock = null;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        if (lock == null) {
            channel.close();
            throw new BlueprintException(BlueprintErrorCode.PROJECT_LOCKED, "lock", lockFile);
        }
        EngineLog.debug("Project lock acquired: " + lockFile);
        return new ProjectLock(lockFile, channel, lock);
    }

    public Path getLockFile() {
        return lockFile;
    }

    @Override
    public void close() throws IOException {
        try {
            if (lock.isValid()) lock.release();
        } finally {
            channel.close();
        }
        EngineLog.debug("Project lock released: " + lockFile);
    }
}
