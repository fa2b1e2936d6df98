package com.dcruver.litsync.nlp;

import lombok.Getter;

/**
 * Failure of a call to an external service, classified by how a caller may react.
 */
@Getter
public class ExternalCallException extends Exception {

    public enum Kind {
        /** Service asked us to slow down (HTTP 429 and similar). */
        RATE_LIMITED,
        /** Timeout, connection failure, 5xx. */
        TRANSIENT,
        /** Bad request, authentication, unparsable answer. Retrying will not help. */
        PERMANENT
    }

    private final Kind kind;

    public ExternalCallException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExternalCallException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
