package com.dcruver.litsync.app;

import com.dcruver.litsync.config.SyncProperties;
import com.dcruver.litsync.io.LocalDocument;
import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryItem;
import com.dcruver.litsync.nlp.ResponseCache;
import com.dcruver.litsync.pipeline.ItemOutcome;
import com.dcruver.litsync.pipeline.PipelineOptions;
import com.dcruver.litsync.pipeline.RunSummary;
import com.dcruver.litsync.reconcile.ApplyOptions;
import com.dcruver.litsync.reconcile.ExecutionReport;
import com.dcruver.litsync.reconcile.OperationRecord;
import com.dcruver.litsync.reconcile.PlannedMove;
import com.dcruver.litsync.reconcile.ReconciliationPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Spring Shell commands for the literature sync.
 * Every command returns a plain-text report; a command with failed items or
 * failed plan operations throws {@link SyncFailedException} so the exit status is non-zero.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class SyncShellCommands {

    private static final int MAX_LISTED = 50;

    private final SyncService syncService;
    private final SyncProperties properties;

    @ShellMethod(key = "diff", value = "Show how the vault differs from the library without changing anything")
    public String diff(
        @ShellOption(value = "--collection", defaultValue = ShellOption.NULL, help = "Collection path substring") String collection,
        @ShellOption(value = "--output", defaultValue = ShellOption.NULL, help = "Also write the plan as JSON") String output
    ) throws IOException {
        ReconciliationPlan plan = syncService.diff(collection);
        String report = formatPlan(plan);
        if (output != null) {
            Path file = Path.of(output);
            syncService.exportPlan(plan, file);
            report += "\nPlan written to " + file + "\n";
        }
        return report;
    }

    @ShellMethod(key = "apply", value = "Move and archive vault notes so the vault mirrors the library")
    public String apply(
        @ShellOption(value = "--collection", defaultValue = ShellOption.NULL) String collection,
        @ShellOption(value = "--dry-run", defaultValue = "false") boolean dryRun,
        @ShellOption(value = "--no-backup", defaultValue = "false") boolean noBackup,
        @ShellOption(value = "--from-json", defaultValue = ShellOption.NULL, help = "Plan written by diff --output") String fromJson
    ) throws IOException {
        ApplyOptions options = ApplyOptions.builder()
            .dryRun(dryRun)
            .backup(!noBackup)
            .build();
        SyncService.ApplyResult result;
        if (fromJson != null) {
            if (collection != null) {
                log.warn("--collection is ignored when applying a plan file");
            }
            log.info("Applying reconciliation plan from {}{}", fromJson, dryRun ? " (dry run)" : "");
            result = syncService.applyFromFile(Path.of(fromJson), options);
        } else {
            log.info("Applying reconciliation plan{}", dryRun ? " (dry run)" : "");
            result = syncService.apply(collection, options);
        }

        String report = formatPlan(result.plan()) + "\n" + formatReport(result.report());
        if (result.report().hasFailures()) {
            throw new SyncFailedException(report);
        }
        return report;
    }

    @ShellMethod(key = "run", value = "Generate literature notes for library items not yet done")
    public String run(
        @ShellOption(value = "--collection", defaultValue = ShellOption.NULL) String collection,
        @ShellOption(value = "--dry-run", defaultValue = "false") boolean dryRun,
        @ShellOption(value = "--workers", defaultValue = ShellOption.NULL) Integer workers,
        @ShellOption(value = "--resume", defaultValue = "false") boolean resume,
        @ShellOption(value = "--force", defaultValue = "false") boolean force,
        @ShellOption(value = "--skip-summarization", defaultValue = "false") boolean skipSummarization,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--copy-pdfs", defaultValue = "false") boolean copyPdfs,
        @ShellOption(value = "--from-json", defaultValue = ShellOption.NULL, help = "Only the items a plan file lists as added") String fromJson
    ) throws IOException {
        PipelineOptions options = pipelineOptions(collection, dryRun, workers, resume, force, skipSummarization, limit,
            copyPdfs);
        log.info("Running pipeline with {} workers", options.getWorkers());
        RunSummary summary;
        if (fromJson != null) {
            if (resume) {
                throw new IllegalArgumentException("--resume continues the saved queue and cannot take --from-json");
            }
            summary = syncService.runPipelineFromFile(Path.of(fromJson), options);
        } else {
            summary = syncService.runPipeline(options);
        }

        String report = formatRunSummary(summary);
        if (summary.hasFailures()) {
            throw new SyncFailedException(report);
        }
        return report;
    }

    @ShellMethod(key = "sync", value = "Reconcile the vault, then generate notes for newly added items")
    public String sync(
        @ShellOption(value = "--collection", defaultValue = ShellOption.NULL) String collection,
        @ShellOption(value = "--dry-run", defaultValue = "false") boolean dryRun,
        @ShellOption(value = "--no-backup", defaultValue = "false") boolean noBackup,
        @ShellOption(value = "--workers", defaultValue = ShellOption.NULL) Integer workers,
        @ShellOption(value = "--resume", defaultValue = "false") boolean resume,
        @ShellOption(value = "--force", defaultValue = "false") boolean force,
        @ShellOption(value = "--skip-summarization", defaultValue = "false") boolean skipSummarization,
        @ShellOption(value = "--limit", defaultValue = ShellOption.NULL) Integer limit,
        @ShellOption(value = "--copy-pdfs", defaultValue = "false") boolean copyPdfs
    ) throws IOException {
        ApplyOptions applyOptions = ApplyOptions.builder()
            .dryRun(dryRun)
            .backup(!noBackup)
            .build();
        PipelineOptions options = pipelineOptions(collection, dryRun, workers, resume, force, skipSummarization, limit,
            copyPdfs);

        log.info("Running full sync{}", dryRun ? " (dry run)" : "");
        SyncResult result = syncService.sync(applyOptions, options);

        StringBuilder sb = new StringBuilder();
        sb.append(formatPlan(result.getPlan())).append("\n");
        sb.append(formatReport(result.getReport())).append("\n");
        sb.append(formatRunSummary(result.getRunSummary()));
        if (result.hasFailures()) {
            throw new SyncFailedException(sb.toString());
        }
        return sb.toString();
    }

    @ShellMethod(key = "collections", value = "List library collections with their item counts")
    public String collections() {
        Map<CollectionPath, Integer> counts = syncService.listCollections();
        if (counts.isEmpty()) {
            return "No collections found.\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Collections:\n");
        counts.forEach((path, count) -> sb.append(String.format("  %-60s %5d\n", path, count)));
        sb.append(String.format("\nTotal: %d collections\n", counts.size()));
        return sb.toString();
    }

    @ShellMethod(key = "cache stats", value = "Show summary cache statistics")
    public String cacheStats() {
        ResponseCache.CacheStats stats = syncService.cacheStats();
        return String.format("""
            Summary cache: %s
            - Entries: %d
            - Fresh: %d
            - Stale: %d
            - Freshness window: %d days
            """, stats.getFile(), stats.getSize(), stats.getFreshCount(), stats.getStaleCount(),
            stats.getFreshness().toDays());
    }

    @ShellMethod(key = "cache clear", value = "Remove every cached summary")
    public String cacheClear() throws IOException {
        int removed = syncService.clearCache();
        return String.format("Removed %d cached summaries.\n", removed);
    }

    private PipelineOptions pipelineOptions(String collection, boolean dryRun, Integer workers, boolean resume,
                                            boolean force, boolean skipSummarization, Integer limit,
                                            boolean copyPdfs) {
        int workerCount = workers != null ? workers : properties.getWorkers();
        if (workerCount < 1) {
            throw new IllegalArgumentException("--workers must be at least 1");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("--limit must not be negative");
        }
        return PipelineOptions.builder()
            .workers(workerCount)
            .checkpointInterval(properties.getCheckpointInterval())
            .collectionFilter(collection)
            .dryRun(dryRun)
            .resume(resume)
            .force(force)
            .skipSummarization(skipSummarization)
            .copyPdfs(copyPdfs)
            .limit(limit)
            .build();
    }

    static String formatPlan(ReconciliationPlan plan) {
        StringBuilder sb = new StringBuilder();
        sb.append("Reconciliation plan");
        if (plan.getCollectionFilter() != null) {
            sb.append(" (collection filter: ").append(plan.getCollectionFilter()).append(")");
        }
        sb.append(":\n");
        sb.append("  ").append(plan.summary()).append("\n");

        if (plan.isEmpty()) {
            sb.append("\nVault is in sync with the library.\n");
            return sb.toString();
        }

        if (!plan.getAdded().isEmpty()) {
            sb.append("\nTo generate:\n");
            int shown = 0;
            for (LibraryItem item : plan.getAdded().values()) {
                if (shown++ == MAX_LISTED) {
                    sb.append(String.format("  ... and %d more\n", plan.getAdded().size() - MAX_LISTED));
                    break;
                }
                sb.append(String.format("  + [%s] %s -> %s\n", item.getKey(), item.getTitle(), item.canonicalPath()));
            }
        }
        if (!plan.getMoved().isEmpty()) {
            sb.append("\nTo move:\n");
            for (PlannedMove move : plan.getMoved().values()) {
                sb.append(String.format("  ~ [%s] %s -> %s\n", move.getKey(),
                    displayPath(move.getFromPath()), move.getToPath()));
            }
        }
        if (!plan.getDeleted().isEmpty()) {
            sb.append("\nTo archive:\n");
            for (LocalDocument doc : plan.getDeleted().values()) {
                sb.append(String.format("  - [%s] %s\n", doc.getKey(), doc.getFile()));
            }
        }
        if (!plan.getDuplicates().isEmpty()) {
            sb.append("\nDuplicate notes (left untouched):\n");
            for (LocalDocument doc : plan.getDuplicates()) {
                sb.append(String.format("  ! [%s] %s\n", doc.getKey(), doc.getFile()));
            }
        }
        return sb.toString();
    }

    static String formatReport(ExecutionReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.isDryRun() ? "Dry run, nothing changed:\n" : "Applied:\n");
        if (report.getBackupFile() != null) {
            sb.append("  Backup: ").append(report.getBackupFile()).append("\n");
        }
        OperationRecord.Status done = report.isDryRun() ? OperationRecord.Status.PLANNED : OperationRecord.Status.APPLIED;
        sb.append(String.format("  Moves: %d, archived: %d, empty folders removed: %d, skipped: %d, failed: %d\n",
            report.count(OperationRecord.Type.MOVE, done),
            report.count(OperationRecord.Type.ARCHIVE, done),
            report.count(OperationRecord.Type.REMOVE_EMPTY_DIR, OperationRecord.Status.APPLIED),
            report.count(OperationRecord.Status.SKIPPED),
            report.count(OperationRecord.Status.FAILED)));
        for (OperationRecord failure : report.failures()) {
            sb.append(String.format("  ✗ %s [%s] %s\n", failure.getType(), failure.getKey(), failure.getMessage()));
        }
        return sb.toString();
    }

    static String formatRunSummary(RunSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append(summary.isDryRun() ? "Pipeline (dry run):\n" : "Pipeline:\n");
        sb.append(String.format("  Succeeded: %d\n", summary.getSucceeded()));
        sb.append(String.format("  Failed: %d\n", summary.getFailed()));
        sb.append(String.format("  Skipped: %d\n", summary.getSkipped()));
        sb.append(String.format("  Already done: %d\n", summary.getAlreadyDone()));
        for (ItemOutcome failure : summary.failures()) {
            sb.append(String.format("  ✗ [%s] %s at %s: %s\n", failure.getKey(), failure.getTitle(),
                failure.getFailedStage(), failure.getReason()));
        }
        if (summary.isDrained()) {
            sb.append("\nStopped early. Run again with --resume to continue.\n");
        }
        return sb.toString();
    }

    private static String displayPath(CollectionPath path) {
        return path.isRoot() ? "(vault root)" : path.toString();
    }
}
