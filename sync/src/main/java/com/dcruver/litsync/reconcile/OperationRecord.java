package com.dcruver.litsync.reconcile;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
public class OperationRecord {

    public enum Type {
        MOVE,
        ARCHIVE,
        PENDING_ADD,
        CONFLICT,
        REMOVE_EMPTY_DIR
    }

    public enum Status {
        PLANNED,
        APPLIED,
        SKIPPED,
        FAILED
    }

    private final Type type;
    private final String key;
    private final Path source;
    private final Path target;
    private final Status status;
    private final String message;
}
