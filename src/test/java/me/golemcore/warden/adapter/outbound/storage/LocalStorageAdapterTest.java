package me.golemcore.warden.adapter.outbound.storage;

import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    private static final String SESSIONS = "sessions";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        WardenProperties properties = new WardenProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateKnownDirectoriesOnInit() {
        for (String dir : LocalStorageAdapter.KNOWN_DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(dir)), dir);
        }
    }

    @Test
    void shouldPutAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "a.json", "{\"id\":\"a\"}", false).get();

        assertEquals("{\"id\":\"a\"}", storageAdapter.getText(SESSIONS, "a.json").get());
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(SESSIONS, "missing.json").get());
    }

    @Test
    void shouldDeleteAndIgnoreMissing() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "gone.json", "x", false).get();

        storageAdapter.deleteObject(SESSIONS, "gone.json").get();
        storageAdapter.deleteObject(SESSIONS, "gone.json").get();

        assertNull(storageAdapter.getText(SESSIONS, "gone.json").get());
    }

    // ==================== atomic writes ====================

    @Test
    void shouldReplaceContentAtomicallyWithoutLeavingTempFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("checkpoints", "s1.json", "v1", false).get();
        storageAdapter.putTextAtomic("checkpoints", "s1.json", "v2", false).get();

        assertEquals("v2", storageAdapter.getText("checkpoints", "s1.json").get());
        assertFalse(Files.exists(tempDir.resolve("checkpoints").resolve("s1.json.tmp")));
    }

    @Test
    void shouldKeepBackupWhenRequested() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "s1.json", "old", true).get();
        storageAdapter.putTextAtomic(SESSIONS, "s1.json", "new", true).get();

        assertEquals("old", storageAdapter.getText(SESSIONS, "s1.json.bak").get());
        assertEquals(List.of("s1.json"), storageAdapter.listObjects(SESSIONS, "").get());
    }

    // ==================== listing ====================

    @Test
    void shouldListByPrefixInSortedOrder() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "b.json", "1", false).get();
        storageAdapter.putTextAtomic(SESSIONS, "a.json", "2", false).get();
        storageAdapter.putTextAtomic(SESSIONS, "other.txt", "3", false).get();

        assertEquals(List.of("a.json", "b.json", "other.txt"), storageAdapter.listObjects(SESSIONS, "").get());
        assertEquals(List.of("other.txt"), storageAdapter.listObjects(SESSIONS, "o").get());
    }

    @Test
    void shouldReturnEmptyListForNonExistentDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("non-existent-dir", "").get().isEmpty());
    }

    // ==================== appends ====================

    @Test
    void shouldNotInterleaveConcurrentAppends() throws ExecutionException, InterruptedException {
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            writes.add(storageAdapter.appendText("decisions", "s1.jsonl", "{\"line\":" + i + "}\n"));
        }
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get();

        String[] lines = storageAdapter.getText("decisions", "s1.jsonl").get().split("\n");
        assertEquals(50, lines.length);
        for (String line : lines) {
            assertTrue(line.matches("\\{\"line\":\\d+}"), line);
        }
    }

    // ==================== path traversal ====================

    @Test
    void shouldBlockPathTraversalOnRead() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(SESSIONS, "../../etc/passwd").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void shouldBlockPathTraversalOnAtomicWrite() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(SESSIONS, "../../../secret", "x", false).get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
