package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.io.DocumentStore;
import com.dcruver.litsync.io.LocalDocument;
import com.dcruver.litsync.io.VaultBackupWriter;
import com.dcruver.litsync.library.LibraryItem;
import com.dcruver.litsync.reconcile.OperationRecord.Status;
import com.dcruver.litsync.reconcile.OperationRecord.Type;
import com.dcruver.litsync.reporting.AuditLogWriter;
import com.dcruver.litsync.reporting.AuditRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a reconciliation plan to the vault.
 * <p>
 * Notes are never deleted: notes of removed items go to a dated archive partition.
 * Each operation re-checks the filesystem first, so applying the same plan twice
 * only produces SKIPPED records the second time. Per-file failures are collected
 * in the report; only a failed backup aborts the call.
 */
@Slf4j
public class ReconciliationExecutor {

    private static final DateTimeFormatter ARCHIVE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final DocumentStore store;
    private final VaultBackupWriter backupWriter;
    private final AuditLogWriter auditLog;
    private final Clock clock;
    private final String archiveFolder;
    private final Set<Path> protectedDirs = new LinkedHashSet<>();

    public ReconciliationExecutor(DocumentStore store, VaultBackupWriter backupWriter, AuditLogWriter auditLog,
                                  Clock clock, String archiveFolder, Path stateDir) {
        this.store = store;
        this.backupWriter = backupWriter;
        this.auditLog = auditLog;
        this.clock = clock;
        this.archiveFolder = archiveFolder;

        Path root = store.getRoot();
        protectedDirs.add(root);
        store.reservedFolders().forEach(name -> protectedDirs.add(root.resolve(name)));
        if (stateDir != null) {
            protectedDirs.add(stateDir.toAbsolutePath().normalize());
        }
    }

    public ExecutionReport apply(ReconciliationPlan plan, ApplyOptions options) {
        log.info("Applying plan ({}), dryRun={}, backup={}", plan.summary(), options.isDryRun(), options.isBackup());

        List<OperationRecord> operations = new ArrayList<>();
        Path backupFile = null;

        if (!options.isDryRun() && options.isBackup() && hasWork(plan)) {
            backupFile = backupWriter.createBackup(store.getRoot());
        }

        Set<Path> vacatedDirs = new LinkedHashSet<>();

        for (PlannedMove move : plan.getMoved().values()) {
            Path target;
            try {
                target = move.getToPath().resolveAgainst(store.getRoot()).resolve(move.getFile().getFileName());
            } catch (IllegalArgumentException e) {
                log.warn("MOVE {}: {}", move.getKey(), e.getMessage());
                operations.add(record(Type.MOVE, move.getKey(), move.getFile(), null, Status.FAILED, e.getMessage()));
                continue;
            }
            if (options.isDryRun()) {
                operations.add(record(Type.MOVE, move.getKey(), move.getFile(), target, Status.PLANNED,
                    "move " + describe(move.getFromPath().toString()) + " -> " + move.getToPath()));
                continue;
            }
            operations.add(relocate(Type.MOVE, move.getKey(), move.getFile(), target, "already moved"));
            vacatedDirs.add(move.getFile().getParent());
        }

        String partition = LocalDate.now(clock).format(ARCHIVE_DATE);
        Path archiveRoot = store.getRoot().resolve(archiveFolder).resolve(partition);
        for (Map.Entry<String, LocalDocument> entry : plan.getDeleted().entrySet()) {
            LocalDocument doc = entry.getValue();
            Path target = archiveRoot.resolve(store.getRoot().relativize(doc.getFile()));
            if (options.isDryRun()) {
                operations.add(record(Type.ARCHIVE, entry.getKey(), doc.getFile(), target, Status.PLANNED,
                    "archive (item no longer in library)"));
                continue;
            }
            operations.add(relocate(Type.ARCHIVE, entry.getKey(), doc.getFile(), target, "already archived"));
            vacatedDirs.add(doc.getFile().getParent());
        }

        if (!options.isDryRun()) {
            operations.addAll(removeEmptyDirs(vacatedDirs));
        }

        for (Map.Entry<String, LibraryItem> entry : plan.getAdded().entrySet()) {
            Path folder = entry.getValue().canonicalPath().resolveAgainst(store.getRoot());
            operations.add(record(Type.PENDING_ADD, entry.getKey(), null, folder, Status.PLANNED,
                "new item: " + entry.getValue().getTitle()));
        }

        for (LocalDocument duplicate : plan.getDuplicates()) {
            operations.add(record(Type.CONFLICT, duplicate.getKey(), duplicate.getFile(), null, Status.FAILED,
                "duplicate note for key, left in place"));
        }

        ExecutionReport report = ExecutionReport.builder()
            .operations(operations)
            .backupFile(backupFile)
            .dryRun(options.isDryRun())
            .build();

        log.info("Plan applied: {} applied, {} skipped, {} failed, {} planned",
            report.count(Status.APPLIED), report.count(Status.SKIPPED),
            report.count(Status.FAILED), report.count(Status.PLANNED));
        return report;
    }

    private static boolean hasWork(ReconciliationPlan plan) {
        return !plan.getMoved().isEmpty() || !plan.getDeleted().isEmpty();
    }

    private OperationRecord relocate(Type type, String key, Path source, Path target, String doneMessage) {
        boolean sourceExists = Files.exists(source);
        boolean targetExists = Files.exists(target);

        if (!sourceExists && targetExists) {
            log.info("{} {}: {}", type, key, doneMessage);
            return record(type, key, source, target, Status.SKIPPED, doneMessage);
        }
        if (!sourceExists) {
            log.warn("{} {}: source missing: {}", type, key, source);
            return record(type, key, source, target, Status.FAILED, "source missing");
        }
        if (targetExists) {
            log.warn("{} {}: destination already exists, keeping both: {}", type, key, target);
            return record(Type.CONFLICT, key, source, target, Status.FAILED,
                type.name().toLowerCase() + " blocked: destination already exists");
        }

        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target);
            log.info("{} {}: {} -> {}", type, key,
                store.getRoot().relativize(source), store.getRoot().relativize(target));
            return record(type, key, source, target, Status.APPLIED, null);
        } catch (IOException e) {
            log.error("{} {} failed: {}", type, key, e.getMessage(), e);
            return record(type, key, source, target, Status.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Remove folders emptied by moves and archives, walking up toward the vault root.
     */
    private List<OperationRecord> removeEmptyDirs(Set<Path> vacatedDirs) {
        List<OperationRecord> removed = new ArrayList<>();
        List<Path> ordered = vacatedDirs.stream()
            .sorted(Comparator.comparingInt(Path::getNameCount).reversed())
            .toList();

        for (Path start : ordered) {
            Path dir = start;
            while (dir != null && isRemovable(dir)) {
                try {
                    if (!Files.isDirectory(dir) || !isEmpty(dir)) {
                        break;
                    }
                    Files.delete(dir);
                    log.info("Removed empty folder: {}", store.getRoot().relativize(dir));
                    removed.add(record(Type.REMOVE_EMPTY_DIR, null, dir, null, Status.APPLIED, null));
                } catch (IOException e) {
                    log.warn("Could not remove folder {}: {}", dir, e.getMessage());
                    removed.add(record(Type.REMOVE_EMPTY_DIR, null, dir, null, Status.FAILED, e.getMessage()));
                    break;
                }
                dir = dir.getParent();
            }
        }
        return removed;
    }

    private boolean isRemovable(Path dir) {
        Path normalized = dir.toAbsolutePath().normalize();
        if (!normalized.startsWith(store.getRoot()) || protectedDirs.contains(normalized)) {
            return false;
        }
        for (Path guarded : protectedDirs) {
            if (!guarded.equals(store.getRoot()) && normalized.startsWith(guarded)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        }
    }

    private OperationRecord record(Type type, String key, Path source, Path target, Status status, String message) {
        OperationRecord op = OperationRecord.builder()
            .type(type)
            .key(key)
            .source(source)
            .target(target)
            .status(status)
            .message(message)
            .build();
        auditLog.record(AuditRecord.builder()
            .event("operation")
            .key(key)
            .type(type.name())
            .status(status.name())
            .source(source != null ? source.toString() : null)
            .target(target != null ? target.toString() : null)
            .message(message)
            .build());
        return op;
    }

    private static String describe(String path) {
        return path.isEmpty() ? "(vault root)" : path;
    }
}
