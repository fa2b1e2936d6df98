package com.dcruver.litsync.app;

import com.dcruver.litsync.io.DocumentStore;
import com.dcruver.litsync.io.LocalDocument;
import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryClient;
import com.dcruver.litsync.library.LibraryItem;
import com.dcruver.litsync.nlp.ResponseCache;
import com.dcruver.litsync.pipeline.BatchPipeline;
import com.dcruver.litsync.pipeline.PipelineOptions;
import com.dcruver.litsync.pipeline.RunSummary;
import com.dcruver.litsync.reconcile.ApplyOptions;
import com.dcruver.litsync.reconcile.Differ;
import com.dcruver.litsync.reconcile.ExecutionReport;
import com.dcruver.litsync.reconcile.PlanFile;
import com.dcruver.litsync.reconcile.ReconciliationExecutor;
import com.dcruver.litsync.reconcile.ReconciliationPlan;
import com.dcruver.litsync.state.IntegrityException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for every sync mode.
 * <p>
 * Modes that change the vault or the run state take an exclusive lock on
 * {@code vault.lock} in the state directory first. A full sync applies the whole
 * reconciliation plan before the pipeline starts on the added items.
 */
@Slf4j
public class SyncService {

    static final String LOCK_FILE = "vault.lock";

    private static final Duration DRAIN_TIMEOUT = Duration.ofMinutes(5);

    private final LibraryClient library;
    private final DocumentStore store;
    private final Differ differ;
    private final ReconciliationExecutor executor;
    private final BatchPipeline pipeline;
    private final ResponseCache responseCache;
    private final PlanFile planFile;
    private final Path stateDir;

    public SyncService(LibraryClient library, DocumentStore store, Differ differ, ReconciliationExecutor executor,
                       BatchPipeline pipeline, ResponseCache responseCache, PlanFile planFile, Path stateDir) {
        this.library = library;
        this.store = store;
        this.differ = differ;
        this.executor = executor;
        this.pipeline = pipeline;
        this.responseCache = responseCache;
        this.planFile = planFile;
        this.stateDir = stateDir;
    }

    public ReconciliationPlan diff(String collectionFilter) throws IOException {
        List<LibraryItem> items = library.listItems(null);
        List<LocalDocument> documents = store.listDocuments();
        log.info("Comparing {} library items with {} vault notes", items.size(), documents.size());
        return differ.computePlan(items, documents, collectionFilter);
    }

    public void exportPlan(ReconciliationPlan plan, Path output) throws IOException {
        planFile.write(plan, output);
    }

    public ApplyResult apply(String collectionFilter, ApplyOptions options) throws IOException {
        return withVaultLock("apply", () -> {
            ReconciliationPlan plan = diff(collectionFilter);
            return new ApplyResult(plan, executor.apply(plan, options));
        });
    }

    /**
     * Apply a plan exported by {@link #exportPlan}. Every operation re-checks the vault,
     * so notes already moved or archived since the export are skipped.
     */
    public ApplyResult applyFromFile(Path input, ApplyOptions options) throws IOException {
        return withVaultLock("apply", () -> {
            ReconciliationPlan plan = planFile.read(input);
            return new ApplyResult(plan, executor.apply(plan, options));
        });
    }

    public RunSummary runPipeline(PipelineOptions options) throws IOException {
        return withVaultLock("run", () -> pipeline.run(candidates(options), options));
    }

    /**
     * Generate notes for the items an exported plan lists as added, looked up in the whole library.
     */
    public RunSummary runPipelineFromFile(Path input, PipelineOptions options) throws IOException {
        return withVaultLock("run", () -> {
            ReconciliationPlan plan = planFile.read(input);
            Map<String, LibraryItem> byKey = new LinkedHashMap<>();
            library.listItems(null).forEach(item -> byKey.putIfAbsent(item.getKey(), item));

            List<LibraryItem> toProcess = new ArrayList<>();
            for (String key : plan.getAdded().keySet()) {
                LibraryItem item = byKey.get(key);
                if (item == null) {
                    log.warn("Item {} from {} is not in the library, skipping", key, input);
                } else {
                    toProcess.add(item);
                }
            }
            log.info("{} of {} added items from {} found in the library",
                toProcess.size(), plan.getAdded().size(), input);
            return pipeline.run(toProcess, options);
        });
    }

    /**
     * Reconcile the vault completely, then generate notes for the items the plan found missing.
     */
    public SyncResult sync(ApplyOptions applyOptions, PipelineOptions pipelineOptions) throws IOException {
        return withVaultLock("sync", () -> {
            ReconciliationPlan plan = diff(pipelineOptions.getCollectionFilter());
            ExecutionReport report = executor.apply(plan, applyOptions);

            List<LibraryItem> toProcess = pipelineOptions.isResume()
                ? library.listItems(null)
                : new ArrayList<>(plan.getAdded().values());
            RunSummary summary = pipeline.run(toProcess, pipelineOptions);

            return SyncResult.builder()
                .plan(plan)
                .report(report)
                .runSummary(summary)
                .build();
        });
    }

    public Map<CollectionPath, Integer> listCollections() {
        return library.listCollections();
    }

    public ResponseCache.CacheStats cacheStats() {
        return responseCache.getStats();
    }

    public int clearCache() throws IOException {
        return withVaultLock("cache clear", responseCache::clear);
    }

    /**
     * Let an in-flight pipeline run finish its current items before the context goes away.
     */
    @PreDestroy
    public void drain() {
        pipeline.requestStop();
        try {
            if (!pipeline.awaitIdle(DRAIN_TIMEOUT)) {
                log.warn("Pipeline still busy after {}; checkpoint may lag behind", DRAIN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private List<LibraryItem> candidates(PipelineOptions options) {
        // A resumed queue may span collections, so look keys up in the whole library
        return library.listItems(options.isResume() ? null : options.getCollectionFilter());
    }

    <T> T withVaultLock(String mode, LockedAction<T> action) throws IOException {
        Files.createDirectories(stateDir);
        Path lockFile = stateDir.resolve(LOCK_FILE);
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock lock = tryLock(channel, lockFile)) {
            log.debug("Acquired {} for {}", lockFile, mode);
            return action.run();
        }
    }

    private static FileLock tryLock(FileChannel channel, Path lockFile) throws IOException {
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        }
        if (lock == null) {
            throw new IntegrityException("Another invocation holds " + lockFile);
        }
        return lock;
    }

    @FunctionalInterface
    interface LockedAction<T> {
        T run() throws IOException;
    }

    public record ApplyResult(ReconciliationPlan plan, ExecutionReport report) {
    }
}
