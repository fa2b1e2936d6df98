package com.dcruver.litsync.nlp;

/**
 * Every allowed attempt of a retryable call failed.
 */
public class RetriesExhaustedException extends ExternalCallException {

    public static final String REASON = "retries-exhausted";

    private final int attempts;

    public RetriesExhaustedException(int attempts, ExternalCallException lastFailure) {
        super(lastFailure.getKind(), REASON, lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
