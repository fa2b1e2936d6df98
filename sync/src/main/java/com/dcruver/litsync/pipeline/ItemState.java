package com.dcruver.litsync.pipeline;

/**
 * Where an item is in the pipeline. Stages run strictly in declaration order;
 * FAILED can follow any non-terminal state.
 */
public enum ItemState {
    QUEUED,
    FETCHING,
    EXTRACTING,
    SUMMARIZING,
    RENDERING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }
}
