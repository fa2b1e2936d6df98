package com.dcruver.litsync.pipeline;

import lombok.Getter;

/**
 * An item could not get past a stage. Caught at the item boundary; never stops the run.
 */
@Getter
public class StageFailureException extends Exception {

    private final ItemState stage;
    private final String reason;

    public StageFailureException(ItemState stage, String reason, Throwable cause) {
        super(stage + ": " + reason, cause);
        this.stage = stage;
        this.reason = reason;
    }
}
