package com.dcruver.litsync.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mid-run progress snapshot of a pipeline invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    @Builder.Default
    private Set<String> processedKeys = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> failedKeys = new LinkedHashSet<>();

    // Queue order as selected at the start of the run
    @Builder.Default
    private List<String> pendingQueue = new ArrayList<>();

    private String collectionFilter;

    private Instant lastUpdated;

    public Checkpoint copy() {
        return Checkpoint.builder()
            .processedKeys(new LinkedHashSet<>(processedKeys))
            .failedKeys(new LinkedHashSet<>(failedKeys))
            .pendingQueue(new ArrayList<>(pendingQueue))
            .collectionFilter(collectionFilter)
            .lastUpdated(lastUpdated)
            .build();
    }
}
