package com.dcruver.litsync.pipeline;

import com.dcruver.litsync.reporting.AuditLogWriter;
import com.dcruver.litsync.reporting.AuditRecord;
import com.dcruver.litsync.state.Checkpoint;
import com.dcruver.litsync.state.CheckpointStore;
import com.dcruver.litsync.state.DoneRecord;
import com.dcruver.litsync.state.IntegrityException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single thread that owns the checkpoint and feeds the done record.
 * <p>
 * Workers hand every finished item to {@link #submit(ItemOutcome)}; all mutation of the
 * checkpoint happens on the writer thread. The checkpoint is saved every {@code interval}
 * finished items and on {@link #finish()}. The first integrity failure is kept, reported
 * through the callback, and stops further checkpoint saves.
 */
@Slf4j
class CheckpointWriter {

    private final Checkpoint checkpoint;
    private final CheckpointStore store;
    private final DoneRecord doneRecord;
    private final AuditLogWriter auditLog;
    private final Clock clock;
    private final int interval;
    private final boolean dryRun;
    private final Runnable onIntegrityFailure;

    private final ExecutorService thread = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "litsync-checkpoint");
        t.setDaemon(true);
        return t;
    });
    private final AtomicReference<IntegrityException> failure = new AtomicReference<>();
    private int sinceLastSave;

    CheckpointWriter(Checkpoint checkpoint, CheckpointStore store, DoneRecord doneRecord, AuditLogWriter auditLog,
                     Clock clock, int interval, boolean dryRun, Runnable onIntegrityFailure) {
        this.checkpoint = checkpoint;
        this.store = store;
        this.doneRecord = doneRecord;
        this.auditLog = auditLog;
        this.clock = clock;
        this.interval = Math.max(1, interval);
        this.dryRun = dryRun;
        this.onIntegrityFailure = onIntegrityFailure;
    }

    void submit(ItemOutcome outcome) {
        thread.execute(() -> record(outcome));
    }

    private void record(ItemOutcome outcome) {
        auditLog.record(AuditRecord.builder()
            .event("item")
            .key(outcome.getKey())
            .status(outcome.getState().name())
            .stage(outcome.getFailedStage() != null ? outcome.getFailedStage().name() : null)
            .message(outcome.getReason())
            .target(outcome.getDocumentPath() != null ? outcome.getDocumentPath().toString() : null)
            .durationMs(outcome.getDuration() != null ? outcome.getDuration().toMillis() : null)
            .build());

        if (dryRun) {
            return;
        }

        try {
            switch (outcome.getState()) {
                case DONE -> {
                    doneRecord.append(outcome.getKey());
                    checkpoint.getProcessedKeys().add(outcome.getKey());
                    checkpoint.getFailedKeys().remove(outcome.getKey());
                }
                case FAILED -> checkpoint.getFailedKeys().add(outcome.getKey());
                default -> {
                    return;
                }
            }

            sinceLastSave++;
            if (sinceLastSave >= interval) {
                save();
            }
        } catch (IntegrityException e) {
            fail(e);
        }
    }

    private void save() {
        if (dryRun || failure.get() != null) {
            return;
        }
        checkpoint.setLastUpdated(clock.instant());
        store.save(checkpoint);
        sinceLastSave = 0;
    }

    private void fail(IntegrityException e) {
        if (failure.compareAndSet(null, e)) {
            log.error("Integrity failure, draining pipeline: {}", e.getMessage(), e);
            onIntegrityFailure.run();
        }
    }

    /**
     * Persist the checkpoint now, from the writer thread, and wait for it.
     */
    void saveNow() {
        Future<?> done = thread.submit(() -> {
            try {
                save();
            } catch (IntegrityException e) {
                fail(e);
            }
        });
        await(done);
    }

    /**
     * Drain pending outcomes, save a final checkpoint and stop the writer thread.
     *
     * @return a copy of the checkpoint as of the end of the run
     */
    Checkpoint finish() {
        saveNow();
        Future<Checkpoint> snapshot = thread.submit(checkpoint::copy);
        Checkpoint copy = await(snapshot);
        thread.shutdown();
        try {
            if (!thread.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Checkpoint writer did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return copy;
    }

    IntegrityException getFailure() {
        return failure.get();
    }

    private static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntegrityException("Interrupted while persisting checkpoint", e);
        } catch (ExecutionException e) {
            throw new IntegrityException("Checkpoint writer failed: " + e.getCause().getMessage(), e.getCause());
        }
    }
}
