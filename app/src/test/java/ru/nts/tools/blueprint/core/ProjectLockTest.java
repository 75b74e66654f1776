package ru.nts.tools.blueprint.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProjectLockTest {

    @TempDir
    Path stateDir;

    @Test
    @DisplayName("second acquire fails while the first lock is held")
    void exclusive() throws Exception {
        try (ProjectLock lock = ProjectLock.acquire(stateDir)) {
            assertTrue(Files.exists(lock.getLockFile()));
            BlueprintException e = assertThrows(BlueprintException.class, () -> ProjectLock.acquire(stateDir));
            assertEquals(BlueprintErrorCode.PROJECT_LOCKED, e.getCode());
        }
    }

    @Test
    @DisplayName("lock can be taken again after release")
    void reacquire() throws Exception {
        ProjectLock.acquire(stateDir).close();
        try (ProjectLock again = ProjectLock.acquire(stateDir)) {
            assertEquals(stateDir.resolve(ProjectLock.LOCK_FILE), again.getLockFile());
        }
    }

    @Test
    @DisplayName("missing state directory is created")
    void createsStateDir() throws Exception {
        Path nested = stateDir.resolve("deep/.scaffold");
        try (ProjectLock ignored = ProjectLock.acquire(nested)) {
            assertTrue(Files.isDirectory(nested));
        }
    }
}
