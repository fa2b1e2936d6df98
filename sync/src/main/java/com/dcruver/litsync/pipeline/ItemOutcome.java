package com.dcruver.litsync.pipeline;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

@Data
@Builder
public class ItemOutcome {
    private final String key;
    private final String title;

    // DONE, FAILED or SKIPPED
    private final ItemState state;

    private final ItemState failedStage;
    private final String reason;
    private final Path documentPath;
    private final Duration duration;

    public static ItemOutcome done(String key, String title, Path documentPath, Duration duration) {
        return ItemOutcome.builder()
            .key(key)
            .title(title)
            .state(ItemState.DONE)
            .documentPath(documentPath)
            .duration(duration)
            .build();
    }

    public static ItemOutcome failed(String key, String title, ItemState stage, String reason, Duration duration) {
        return ItemOutcome.builder()
            .key(key)
            .title(title)
            .state(ItemState.FAILED)
            .failedStage(stage)
            .reason(reason)
            .duration(duration)
            .build();
    }

    public static ItemOutcome skipped(String key, String reason) {
        return ItemOutcome.builder()
            .key(key)
            .state(ItemState.SKIPPED)
            .reason(reason)
            .duration(Duration.ZERO)
            .build();
    }
}
