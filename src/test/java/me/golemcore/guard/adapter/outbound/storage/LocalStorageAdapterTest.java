package me.golemcore.guard.adapter.outbound.storage;

import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String SECURITY_DIR = "security";
    private static final String AUDIT_FILE = "audit.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        GuardProperties properties = new GuardProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateAuditDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(SECURITY_DIR)));
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SECURITY_DIR, AUDIT_FILE, "[]", false).get();

        assertEquals("[]", storageAdapter.getText(SECURITY_DIR, AUDIT_FILE).get());
        assertFalse(Files.exists(tempDir.resolve(SECURITY_DIR).resolve(AUDIT_FILE + ".tmp")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(SECURITY_DIR, "missing.json").get());
    }

    @Test
    void putTextAtomic_keepsBackupWhenRequested() throws Exception {
        storageAdapter.putTextAtomic(SECURITY_DIR, AUDIT_FILE, "first", false).get();
        storageAdapter.putTextAtomic(SECURITY_DIR, AUDIT_FILE, "second", true).get();

        Path backup = tempDir.resolve(SECURITY_DIR).resolve(AUDIT_FILE + ".bak");
        assertEquals("first", Files.readString(backup));
        assertEquals("second", storageAdapter.getText(SECURITY_DIR, AUDIT_FILE).get());
    }

    @Test
    void putTextAtomic_overwritesWithoutBackupByDefault() throws Exception {
        storageAdapter.putTextAtomic(SECURITY_DIR, AUDIT_FILE, "first", false).get();
        storageAdapter.putTextAtomic(SECURITY_DIR, AUDIT_FILE, "second", false).get();

        assertFalse(Files.exists(tempDir.resolve(SECURITY_DIR).resolve(AUDIT_FILE + ".bak")));
        assertEquals("second", storageAdapter.getText(SECURITY_DIR, AUDIT_FILE).get());
    }

    @Test
    void ensureDirectory_createsNestedDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("archive/2026").get();

        assertTrue(Files.isDirectory(tempDir.resolve("archive").resolve("2026")));
    }

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(SECURITY_DIR, "../../escape.json", "x", false).get());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());

        ExecutionException dirError = assertThrows(ExecutionException.class,
                () -> storageAdapter.ensureDirectory("../outside").get());
        assertInstanceOf(IllegalArgumentException.class, dirError.getCause());
    }
}
