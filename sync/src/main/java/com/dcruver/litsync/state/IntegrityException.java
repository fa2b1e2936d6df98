package com.dcruver.litsync.state;

/**
 * Durable state could not be protected: a backup, checkpoint or done-record write failed,
 * or another invocation holds the vault lock. Ends the invocation.
 */
public class IntegrityException extends RuntimeException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
