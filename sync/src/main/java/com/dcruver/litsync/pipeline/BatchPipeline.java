package com.dcruver.litsync.pipeline;

import com.dcruver.litsync.library.LibraryItem;
import com.dcruver.litsync.reporting.AuditLogWriter;
import com.dcruver.litsync.state.Checkpoint;
import com.dcruver.litsync.state.CheckpointStore;
import com.dcruver.litsync.state.DoneRecord;
import com.dcruver.litsync.state.IntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs library items through the {@link ItemProcessor} on a fixed pool of workers.
 * <p>
 * Items already in the done record are not queued. Every finished item goes to a single
 * {@link CheckpointWriter}, which appends successes to the done record and saves the
 * checkpoint periodically, so an interrupted run can resume where it stopped. At most
 * one worker handles a given key at a time. {@link #requestStop()} lets in-flight items
 * finish, stops dequeuing, keeps the checkpoint and returns a drained summary.
 */
@Slf4j
public class BatchPipeline {

    public static final String MDC_ITEM_KEY = "itemKey";

    private final ItemProcessor processor;
    private final DoneRecord doneRecord;
    private final CheckpointStore checkpointStore;
    private final AuditLogWriter auditLog;
    private final Clock clock;

    private final AtomicBoolean draining = new AtomicBoolean();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<String, ItemState> states = new ConcurrentHashMap<>();
    private volatile CountDownLatch running = new CountDownLatch(0);

    public BatchPipeline(ItemProcessor processor, DoneRecord doneRecord, CheckpointStore checkpointStore,
                         AuditLogWriter auditLog, Clock clock) {
        this.processor = processor;
        this.doneRecord = doneRecord;
        this.checkpointStore = checkpointStore;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public RunSummary run(List<LibraryItem> candidates, PipelineOptions options) {
        draining.set(false);
        states.clear();
        running = new CountDownLatch(1);
        try {
            return execute(candidates, options);
        } finally {
            running.countDown();
        }
    }

    private RunSummary execute(List<LibraryItem> candidates, PipelineOptions options) {
        Map<String, LibraryItem> byKey = new LinkedHashMap<>();
        candidates.forEach(item -> byKey.putIfAbsent(item.getKey(), item));

        List<ItemOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
        // Forced runs ignore the done record while selecting; only queued keys are dropped from it
        Set<String> done = options.isForce() ? Set.of() : doneRecord.snapshot();

        Checkpoint checkpoint;
        List<String> queueKeys;
        int alreadyDone;

        Optional<Checkpoint> saved = options.isResume() ? checkpointStore.load() : Optional.empty();
        if (saved.isPresent()) {
            Checkpoint previous = saved.get();
            if (!Objects.equals(normalize(previous.getCollectionFilter()), normalize(options.getCollectionFilter()))) {
                log.warn("Resuming checkpoint made for collection filter '{}' while '{}' was requested",
                    previous.getCollectionFilter(), options.getCollectionFilter());
            }
            queueKeys = new ArrayList<>();
            alreadyDone = 0;
            for (String key : previous.getPendingQueue()) {
                if (previous.getProcessedKeys().contains(key) || done.contains(key)) {
                    alreadyDone++;
                } else if (!byKey.containsKey(key)) {
                    log.warn("Pending item {} is no longer in the library, skipping", key);
                    outcomes.add(ItemOutcome.skipped(key, "no longer in library"));
                } else {
                    queueKeys.add(key);
                }
            }
            checkpoint = previous.copy();
            checkpoint.getFailedKeys().clear();
            log.info("Resuming: {} items left of {} pending", queueKeys.size(), previous.getPendingQueue().size());
        } else {
            if (options.isResume()) {
                log.info("No checkpoint found, starting fresh");
            }
            queueKeys = new ArrayList<>();
            alreadyDone = 0;
            for (String key : byKey.keySet()) {
                if (done.contains(key)) {
                    alreadyDone++;
                } else {
                    queueKeys.add(key);
                }
            }
            if (options.getLimit() != null && options.getLimit() >= 0 && queueKeys.size() > options.getLimit()) {
                log.info("Limiting run to {} of {} items", options.getLimit(), queueKeys.size());
                queueKeys = new ArrayList<>(queueKeys.subList(0, options.getLimit()));
            }
            checkpoint = Checkpoint.builder()
                .pendingQueue(new ArrayList<>(queueKeys))
                .collectionFilter(options.getCollectionFilter())
                .lastUpdated(clock.instant())
                .build();
        }

        if (options.isForce() && !options.isDryRun()) {
            int removed = doneRecord.remove(queueKeys);
            log.info("Force: {} of {} queued items dropped from the done record", removed, queueKeys.size());
        }

        log.info("Pipeline starting: {} queued, {} already done, {} workers{}",
            queueKeys.size(), alreadyDone, options.getWorkers(), options.isDryRun() ? " (dry run)" : "");

        if (!options.isDryRun()) {
            checkpointStore.save(checkpoint);
        }

        CheckpointWriter writer = new CheckpointWriter(checkpoint, checkpointStore, doneRecord, auditLog, clock,
            options.getCheckpointInterval(), options.isDryRun(), this::requestStop);

        LinkedBlockingQueue<LibraryItem> queue = new LinkedBlockingQueue<>();
        for (String key : new LinkedHashSet<>(queueKeys)) {
            queue.add(byKey.get(key));
            states.put(key, ItemState.QUEUED);
        }

        int workers = Math.max(1, Math.min(options.getWorkers(), Math.max(1, queue.size())));
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "litsync-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workers; i++) {
            pool.execute(() -> workLoop(queue, options, writer, outcomes));
        }

        pool.shutdown();
        boolean interrupted = awaitWorkers(pool);

        Checkpoint finalState;
        try {
            finalState = writer.finish();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        IntegrityException failure = writer.getFailure();
        if (failure != null) {
            throw failure;
        }

        boolean drained = draining.get() && !queue.isEmpty();
        if (draining.get() && queue.isEmpty()) {
            log.info("Stop requested after the last item was taken; treating run as complete");
        }

        if (!options.isDryRun() && !drained) {
            checkpointStore.delete();
            finalState = null;
        } else if (drained) {
            log.info("Run drained with {} items still queued; checkpoint kept at {}",
                queue.size(), checkpointStore.getFile());
        }

        RunSummary summary = RunSummary.of(outcomes, alreadyDone, drained, options.isDryRun(),
            options.isDryRun() ? null : finalState);
        log.info("Pipeline finished: {} succeeded, {} failed, {} skipped{}",
            summary.getSucceeded(), summary.getFailed(), summary.getSkipped(), drained ? " (drained)" : "");
        return summary;
    }

    /**
     * Wait for every worker to return. An interrupt starts draining and the wait goes on,
     * so in-flight items still finish before the checkpoint is written.
     *
     * @return whether the calling thread was interrupted meanwhile
     */
    private boolean awaitWorkers(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
                    return interrupted;
                }
                log.trace("Waiting for workers ({} in flight)", inFlight.size());
            } catch (InterruptedException e) {
                if (!interrupted) {
                    log.warn("Interrupted while waiting for workers, draining");
                }
                interrupted = true;
                requestStop();
            }
        }
    }

    private void workLoop(LinkedBlockingQueue<LibraryItem> queue, PipelineOptions options,
                          CheckpointWriter writer, List<ItemOutcome> outcomes) {
        while (!draining.get()) {
            LibraryItem item = queue.poll();
            if (item == null) {
                return;
            }
            if (!inFlight.add(item.getKey())) {
                log.warn("Item {} is already being processed, not starting it twice", item.getKey());
                continue;
            }
            try {
                ItemOutcome outcome = processOne(item, options);
                outcomes.add(outcome);
                writer.submit(outcome);
            } finally {
                inFlight.remove(item.getKey());
            }
        }
    }

    private ItemOutcome processOne(LibraryItem item, PipelineOptions options) {
        String key = item.getKey();
        Instant started = clock.instant();
        MDC.put(MDC_ITEM_KEY, key);
        try {
            log.info("Processing: {}", item.getTitle());
            Path document = processor.process(item, options, state -> states.put(key, state));
            states.put(key, ItemState.DONE);
            Duration elapsed = Duration.between(started, clock.instant());
            log.info("Done in {} ms{}", elapsed.toMillis(), document != null ? ": " + document : "");
            return ItemOutcome.done(key, item.getTitle(), document, elapsed);
        } catch (StageFailureException e) {
            states.put(key, ItemState.FAILED);
            log.error("Failed at {}: {}", e.getStage(), e.getReason());
            return ItemOutcome.failed(key, item.getTitle(), e.getStage(), e.getReason(),
                Duration.between(started, clock.instant()));
        } catch (RuntimeException e) {
            ItemState stage = states.getOrDefault(key, ItemState.QUEUED);
            states.put(key, ItemState.FAILED);
            log.error("Unexpected failure at {}", stage, e);
            return ItemOutcome.failed(key, item.getTitle(), stage, e.getClass().getSimpleName() + ": " + e.getMessage(),
                Duration.between(started, clock.instant()));
        } finally {
            MDC.remove(MDC_ITEM_KEY);
        }
    }

    /**
     * Enter draining: no new items are started, in-flight items finish.
     */
    public void requestStop() {
        if (draining.compareAndSet(false, true)) {
            log.info("Stop requested, finishing in-flight items ({})", inFlight.size());
        }
    }

    public boolean isDraining() {
        return draining.get();
    }

    /**
     * Block until the current run, if any, has returned.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return running.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Map<String, ItemState> currentStates() {
        return Map.copyOf(states);
    }

    private static String normalize(String filter) {
        return filter == null || filter.isBlank() ? null : filter.trim();
    }
}
