package com.dcruver.litsync.app;

import com.dcruver.litsync.pipeline.RunSummary;
import com.dcruver.litsync.reconcile.ExecutionReport;
import com.dcruver.litsync.reconcile.ReconciliationPlan;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a full sync: the plan, what applying it did, and the pipeline run over added items.
 */
@Data
@Builder
public class SyncResult {
    private final ReconciliationPlan plan;
    private final ExecutionReport report;
    private final RunSummary runSummary;

    public boolean hasFailures() {
        return report.hasFailures() || runSummary.hasFailures();
    }
}
