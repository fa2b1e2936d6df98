package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.io.VaultBackupWriter;
import com.dcruver.litsync.io.VaultDocumentStore;
import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryItem;
import com.dcruver.litsync.reconcile.OperationRecord.Status;
import com.dcruver.litsync.reconcile.OperationRecord.Type;
import com.dcruver.litsync.reporting.AuditLogWriter;
import com.dcruver.litsync.state.IntegrityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static com.dcruver.litsync.library.InMemoryLibraryClient.item;
import static org.junit.jupiter.api.Assertions.*;

class ReconciliationExecutorTest {

    @TempDir
    Path tempDir;

    private Path vault;
    private Path backups;
    private VaultDocumentStore store;
    private AuditLogWriter auditLog;
    private ReconciliationExecutor executor;
    private final Differ differ = new Differ();
    private final Clock clock = Clock.fixed(Instant.parse("2025-03-14T10:15:30Z"), ZoneId.of("UTC"));

    @BeforeEach
    void setUp() throws IOException {
        vault = Files.createDirectories(tempDir.resolve("vault"));
        backups = tempDir.resolve("backups");
        store = new VaultDocumentStore(vault, "_archived", "img");
        auditLog = new AuditLogWriter(tempDir.resolve("state").resolve("logs"), clock);
        executor = newExecutor(new VaultBackupWriter(backups, clock));
    }

    private ReconciliationExecutor newExecutor(VaultBackupWriter backupWriter) {
        return new ReconciliationExecutor(store, backupWriter, auditLog, clock, "_archived", tempDir.resolve("state"));
    }

    @Test
    void testArchivesOrphanAndReportsNewItem() throws IOException {
        Path a = writeNote("AI/ML", "A");
        Path c = writeNote("Old/Path", "C");
        String cContent = Files.readString(c);

        ReconciliationPlan plan = plan(List.of(item("A", "AI/ML"), item("B", "AI/ML")));
        ExecutionReport report = executor.apply(plan, ApplyOptions.builder().build());

        Path archived = vault.resolve("_archived").resolve("20250314").resolve("Old").resolve("Path")
            .resolve(c.getFileName());
        assertFalse(Files.exists(c));
        assertEquals(cContent, Files.readString(archived));
        assertTrue(Files.exists(a));
        assertFalse(Files.exists(vault.resolve("Old")), "emptied folders are removed");

        assertEquals(1, report.count(Type.ARCHIVE, Status.APPLIED));
        assertEquals(1, report.count(Type.PENDING_ADD, Status.PLANNED));
        assertFalse(report.hasFailures());
        assertNotNull(report.getBackupFile());
        assertTrue(Files.exists(report.getBackupFile()));
    }

    @Test
    void testMoveToNewCollectionRemovesEmptyFolder() throws IOException {
        Path d = writeNote("X/Y", "D");

        ExecutionReport report = executor.apply(plan(List.of(item("D", "X/Z"))), ApplyOptions.builder().build());

        assertTrue(Files.exists(vault.resolve("X").resolve("Z").resolve(d.getFileName())));
        assertFalse(Files.exists(vault.resolve("X").resolve("Y")));
        assertTrue(Files.isDirectory(vault.resolve("X")));
        assertEquals(1, report.count(Type.MOVE, Status.APPLIED));
        assertEquals(1, report.count(Type.REMOVE_EMPTY_DIR, Status.APPLIED));
    }

    @Test
    void testApplyingSamePlanTwiceOnlySkips() throws IOException {
        writeNote("X/Y", "D");
        writeNote("Gone", "G");
        ReconciliationPlan plan = plan(List.of(item("D", "X/Z")));

        executor.apply(plan, ApplyOptions.builder().build());
        ExecutionReport second = executor.apply(plan, ApplyOptions.builder().build());

        assertEquals(1, second.count(Type.MOVE, Status.SKIPPED));
        assertEquals(1, second.count(Type.ARCHIVE, Status.SKIPPED));
        assertEquals(0, second.count(Status.APPLIED));
        assertFalse(second.hasFailures());
    }

    @Test
    void testOccupiedDestinationIsConflictAndBothFilesKept() throws IOException {
        Path source = writeNote("X/Y", "D");
        Path blocker = vault.resolve("X").resolve("Z").resolve(source.getFileName());
        Files.createDirectories(blocker.getParent());
        Files.writeString(blocker, "someone else's note");

        ExecutionReport report = executor.apply(plan(List.of(item("D", "X/Z"))), ApplyOptions.builder().build());

        assertTrue(Files.exists(source));
        assertEquals("someone else's note", Files.readString(blocker));
        assertEquals(1, report.count(Type.CONFLICT, Status.FAILED));
        assertTrue(report.failures().get(0).getMessage().contains("destination already exists"));
    }

    @Test
    void testDryRunChangesNothing() throws IOException {
        Path d = writeNote("X/Y", "D");
        Path g = writeNote("Gone", "G");

        ExecutionReport report = executor.apply(plan(List.of(item("D", "X/Z"))),
            ApplyOptions.builder().dryRun(true).build());

        assertTrue(Files.exists(d));
        assertTrue(Files.exists(g));
        assertFalse(Files.exists(vault.resolve("_archived")));
        assertFalse(Files.exists(backups));
        assertNull(report.getBackupFile());
        assertEquals(1, report.count(Type.MOVE, Status.PLANNED));
        assertEquals(1, report.count(Type.ARCHIVE, Status.PLANNED));
        assertTrue(report.isDryRun());
    }

    @Test
    void testBackupFailureAbortsBeforeAnyChange() throws IOException {
        Path d = writeNote("X/Y", "D");
        Path notADirectory = tempDir.resolve("backup-file");
        Files.writeString(notADirectory, "occupied");
        ReconciliationExecutor failing = newExecutor(new VaultBackupWriter(notADirectory, clock));

        ReconciliationPlan plan = plan(List.of(item("D", "X/Z")));
        assertThrows(IntegrityException.class, () -> failing.apply(plan, ApplyOptions.builder().build()));

        assertTrue(Files.exists(d));
    }

    @Test
    void testNoBackupWhenDisabledOrNothingToChange() throws IOException {
        writeNote("AI", "A");
        ExecutionReport inSync = executor.apply(plan(List.of(item("A", "AI"))), ApplyOptions.builder().build());
        assertNull(inSync.getBackupFile());

        writeNote("Old", "B");
        ExecutionReport noBackup = executor.apply(plan(List.of(item("A", "AI"), item("B", "New"))),
            ApplyOptions.builder().backup(false).build());
        assertNull(noBackup.getBackupFile());
        assertEquals(1, noBackup.count(Type.MOVE, Status.APPLIED));
        assertFalse(Files.exists(backups));
    }

    @Test
    void testDotCollectionNamesStayInsideVault() throws IOException {
        Path e = writeNote("AI", "E");

        ExecutionReport report = executor.apply(plan(List.of(item("E", "../Outside"))), ApplyOptions.builder().build());

        assertEquals(1, report.count(Type.MOVE, Status.APPLIED));
        assertTrue(Files.exists(vault.resolve("__").resolve("Outside").resolve(e.getFileName())));
        assertFalse(Files.exists(tempDir.resolve("Outside")));
    }

    @Test
    void testMoveOutsideVaultFails() throws IOException {
        Path f = writeNote("AI", "F");
        PlannedMove escape = PlannedMove.builder()
            .key("F")
            .fromPath(CollectionPath.of("AI"))
            .toPath(CollectionPath.of("..", "Outside"))
            .file(f)
            .build();
        ReconciliationPlan plan = new ReconciliationPlan(Map.of(), Map.of(), Map.of("F", escape), List.of(), null);

        ExecutionReport report = executor.apply(plan, ApplyOptions.builder().backup(false).build());

        assertEquals(1, report.count(Type.MOVE, Status.FAILED));
        assertTrue(Files.exists(f));
        assertFalse(Files.exists(tempDir.resolve("Outside")));
    }

    @Test
    void testDuplicatesAreReportedNotTouched() throws IOException {
        Path kept = writeNote("AI", "A");
        Path duplicate = writeNote("Other", "A");

        ExecutionReport report = executor.apply(plan(List.of(item("A", "AI"))), ApplyOptions.builder().build());

        assertTrue(Files.exists(kept));
        assertTrue(Files.exists(duplicate));
        assertEquals(1, report.count(Type.CONFLICT, Status.FAILED));
    }

    @Test
    void testEveryOperationIsAudited() throws IOException {
        writeNote("Gone", "G");

        executor.apply(plan(List.of(item("N", "New"))), ApplyOptions.builder().build());

        List<String> lines = Files.readAllLines(auditLog.getLogFile());
        assertTrue(lines.stream().anyMatch(l -> l.contains("\"type\":\"ARCHIVE\"") && l.contains("\"key\":\"G\"")));
        assertTrue(lines.stream().anyMatch(l -> l.contains("\"type\":\"PENDING_ADD\"") && l.contains("\"key\":\"N\"")));
    }

    @Test
    void testArchiveFolderIsNeverScannedAgain() throws IOException {
        writeNote("Gone", "G");
        executor.apply(plan(List.of()), ApplyOptions.builder().build());

        try (Stream<Path> files = Files.walk(vault.resolve("_archived"))) {
            assertEquals(1, files.filter(Files::isRegularFile).count());
        }
        assertTrue(plan(List.of()).isEmpty());
    }

    private ReconciliationPlan plan(List<LibraryItem> items) throws IOException {
        return differ.computePlan(items, store.listDocuments(), null);
    }

    private Path writeNote(String folder, String key) throws IOException {
        Path dir = vault.resolve(folder);
        Files.createDirectories(dir);
        Path file = dir.resolve("Paper " + key + "_" + key + ".md");
        Files.writeString(file, "---\nkey: " + key + "\ntitle: \"Paper " + key + "\"\n---\n\n# Paper " + key + "\n",
            StandardCharsets.UTF_8);
        return file;
    }
}
