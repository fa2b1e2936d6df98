package com.dcruver.litsync.pipeline;

import com.dcruver.litsync.state.Checkpoint;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of one pipeline run.
 */
@Data
@Builder
public class RunSummary {
    private final List<ItemOutcome> outcomes;
    private final int succeeded;
    private final int failed;
    private final int skipped;

    // Items excluded up front because the done record already had them
    private final int alreadyDone;

    // Stopped early on request; the checkpoint was kept for resume
    private final boolean drained;

    private final boolean dryRun;

    // Checkpoint state at exit, null when the run completed and removed it
    private final Checkpoint checkpoint;

    public boolean hasFailures() {
        return failed > 0;
    }

    public List<ItemOutcome> failures() {
        return outcomes.stream().filter(o -> o.getState() == ItemState.FAILED).toList();
    }

    public static RunSummary of(List<ItemOutcome> outcomes, int alreadyDone, boolean drained,
                                boolean dryRun, Checkpoint checkpoint) {
        int succeeded = (int) outcomes.stream().filter(o -> o.getState() == ItemState.DONE).count();
        int failed = (int) outcomes.stream().filter(o -> o.getState() == ItemState.FAILED).count();
        int skipped = (int) outcomes.stream().filter(o -> o.getState() == ItemState.SKIPPED).count();
        return RunSummary.builder()
            .outcomes(List.copyOf(outcomes))
            .succeeded(succeeded)
            .failed(failed)
            .skipped(skipped)
            .alreadyDone(alreadyDone)
            .drained(drained)
            .dryRun(dryRun)
            .checkpoint(checkpoint)
            .build();
    }
}
