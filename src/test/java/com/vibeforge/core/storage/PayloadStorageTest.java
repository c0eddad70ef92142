package com.vibeforge.core.storage;

import com.vibeforge.config.VibeForgeSettings;
import com.vibeforge.core.storage.PayloadStorage.StorageException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PayloadStorageTest {

    @TempDir
    Path tempDir;

    private PayloadStorage storage;

    @BeforeEach
    void setUp() {
        storage = new PayloadStorage(VibeForgeSettings.forStore(tempDir));
    }

    @Test
    void testWriteAndRead() throws Exception {
        storage.write("artifacts/chart.js", "export default function A() {}");

        assertEquals("export default function A() {}", storage.read("artifacts/chart.js"));
        assertTrue(Files.exists(tempDir.resolve("artifacts/chart.js")));
    }

    @Test
    void testOverwriteLeavesNoTempFile() throws Exception {
        storage.write("index/rows.json", "[]");
        storage.write("index/rows.json", "[1]");

        assertEquals("[1]", storage.read("index/rows.json"));
        assertEquals(List.of("rows.json"), storage.list("index"));
    }

    @Test
    void testPathTraversalPrevention() {
        assertThrows(StorageException.class, () -> storage.read("../../etc/passwd"));
        assertThrows(StorageException.class, () -> storage.write("../outside.js", "x"));
        assertFalse(storage.exists("../outside.js"));
    }

    @Test
    void testPayloadSizeCap() {
        VibeForgeSettings tiny = new VibeForgeSettings(tempDir.toString(), 8, 3, 120, false, "node");
        PayloadStorage capped = new PayloadStorage(tiny);

        assertThrows(StorageException.class, () -> capped.write("big.js", "0123456789"));
    }

    @Test
    void testDeleteReportsWhetherFileExisted() throws Exception {
        storage.write("audits/a.json", "{}");

        assertTrue(storage.delete("audits/a.json"));
        assertFalse(storage.delete("audits/a.json"));
        assertFalse(storage.exists("audits/a.json"));
    }

    @Test
    void testListMissingDirectoryIsEmpty() throws Exception {
        assertTrue(storage.list("nothing-here").isEmpty());
    }
}
