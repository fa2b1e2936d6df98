package com.dcruver.litsync.io;

import com.dcruver.litsync.state.IntegrityException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes a timestamped ZIP snapshot of the whole vault before it is reorganized.
 * Snapshots are never deleted by this application.
 */
@Slf4j
public class VaultBackupWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path backupDir;
    private final Clock clock;

    public VaultBackupWriter(Path backupDir, Clock clock) {
        this.backupDir = backupDir;
        this.clock = clock;
    }

    /**
     * Snapshot the vault.
     *
     * @return the ZIP file written
     * @throws IntegrityException if the snapshot could not be completed
     */
    public Path createBackup(Path vaultRoot) {
        String timestamp = TIMESTAMP_FORMAT.withZone(ZoneId.systemDefault()).format(clock.instant());
        Path backupFile = backupDir.resolve("vault-backup-" + timestamp + ".zip");

        try {
            Files.createDirectories(backupDir);
            if (Files.exists(backupFile)) {
                backupFile = backupDir.resolve("vault-backup-" + timestamp + "-" + System.nanoTime() + ".zip");
            }

            List<Path> files;
            try (Stream<Path> paths = Files.walk(vaultRoot)) {
                files = paths.filter(Files::isRegularFile).sorted().toList();
            }

            int count = 0;
            try (OutputStream out = Files.newOutputStream(backupFile);
                 ZipOutputStream zip = new ZipOutputStream(out)) {
                for (Path file : files) {
                    String entryName = vaultRoot.relativize(file).toString().replace('\\', '/');
                    zip.putNextEntry(new ZipEntry(entryName));
                    Files.copy(file, zip);
                    zip.closeEntry();
                    count++;
                }
            }

            log.info("Created vault backup with {} files: {}", count, backupFile);
            return backupFile;
        } catch (IOException e) {
            try {
                Files.deleteIfExists(backupFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new IntegrityException("Vault backup failed, no changes were made: " + e.getMessage(), e);
        }
    }
}
