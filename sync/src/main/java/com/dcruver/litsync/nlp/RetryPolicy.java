package com.dcruver.litsync.nlp;

import com.dcruver.litsync.config.SyncProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * How {@link RateLimitedCaller} reacts to each kind of failure.
 * <p>
 * Rate limits back off exponentially: the n-th wait is {@code baseDelay * multiplier^(n-1)},
 * capped at {@code maxDelay}, for at most {@code maxAttempts} calls in total.
 * Transient failures are retried {@code transientRetries} times after a fixed delay.
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(5);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    int transientRetries = 2;

    @Builder.Default
    Duration transientDelay = Duration.ofSeconds(2);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy from(SyncProperties.Retry retry) {
        return RetryPolicy.builder()
            .maxAttempts(retry.getMaxAttempts())
            .baseDelay(retry.getBaseDelay())
            .multiplier(retry.getMultiplier())
            .maxDelay(retry.getMaxDelay())
            .transientRetries(retry.getTransientRetries())
            .transientDelay(retry.getTransientDelay())
            .build();
    }

    public boolean isRetryable(ExternalCallException.Kind kind) {
        return kind != ExternalCallException.Kind.PERMANENT;
    }

    /**
     * Wait before the next call after the given number of rate-limited failures (1-based).
     */
    public Duration backoffDelay(int failures) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, failures - 1));
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
