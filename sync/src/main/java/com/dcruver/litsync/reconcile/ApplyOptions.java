package com.dcruver.litsync.reconcile;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ApplyOptions {
    private final boolean dryRun;

    @Builder.Default
    private final boolean backup = true;
}
