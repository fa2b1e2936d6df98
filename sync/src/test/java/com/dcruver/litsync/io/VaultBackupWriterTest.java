package com.dcruver.litsync.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class VaultBackupWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testSnapshotContainsEveryFile() throws Exception {
        Path vault = tempDir.resolve("vault");
        Files.createDirectories(vault.resolve("AI"));
        Files.writeString(vault.resolve("AI").resolve("a.md"), "a");
        Files.writeString(vault.resolve("b.md"), "b");

        Clock clock = Clock.fixed(Instant.parse("2025-01-02T03:04:05Z"), ZoneId.of("UTC"));
        VaultBackupWriter writer = new VaultBackupWriter(tempDir.resolve("backups"), clock);

        Path first = writer.createBackup(vault);
        Path second = writer.createBackup(vault);

        assertTrue(first.getFileName().toString().startsWith("vault-backup-"));
        assertTrue(first.getFileName().toString().endsWith(".zip"));
        assertNotEquals(first, second, "an existing snapshot is never overwritten");

        Set<String> entries = new HashSet<>();
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(first))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries.add(entry.getName());
            }
        }
        assertEquals(Set.of("AI/a.md", "b.md"), entries);
    }
}
