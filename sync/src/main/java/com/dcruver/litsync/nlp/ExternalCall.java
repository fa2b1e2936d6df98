package com.dcruver.litsync.nlp;

/**
 * A single attempt at an external request.
 */
@FunctionalInterface
public interface ExternalCall<Q, R> {

    R call(Q request) throws ExternalCallException;
}
