package com.dcruver.litsync.reconcile;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * What applying a plan did, operation by operation.
 */
@Data
@Builder
public class ExecutionReport {
    private final List<OperationRecord> operations;
    private final Path backupFile;
    private final boolean dryRun;

    public long count(OperationRecord.Type type, OperationRecord.Status status) {
        return operations.stream()
            .filter(op -> op.getType() == type && op.getStatus() == status)
            .count();
    }

    public long count(OperationRecord.Status status) {
        return operations.stream().filter(op -> op.getStatus() == status).count();
    }

    public boolean hasFailures() {
        return count(OperationRecord.Status.FAILED) > 0;
    }

    public List<OperationRecord> failures() {
        return operations.stream()
            .filter(op -> op.getStatus() == OperationRecord.Status.FAILED)
            .toList();
    }
}
