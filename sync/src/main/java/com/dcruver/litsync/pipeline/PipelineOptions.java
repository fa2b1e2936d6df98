package com.dcruver.litsync.pipeline;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PipelineOptions {

    @Builder.Default
    private final int workers = 5;

    @Builder.Default
    private final int checkpointInterval = 10;

    private final boolean resume;

    // Reprocess candidates even if already done; queued keys are dropped from the done record first
    private final boolean force;

    // Process items but write no notes and record nothing as done
    private final boolean dryRun;

    private final boolean skipSummarization;

    // Copy each attachment into a PDFs folder beside the note and link it from the note
    private final boolean copyPdfs;

    // Maximum number of items to queue, null for no limit
    private final Integer limit;

    private final String collectionFilter;
}
