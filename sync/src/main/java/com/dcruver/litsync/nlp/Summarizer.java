package com.dcruver.litsync.nlp;

/**
 * One attempt at summarizing a paper. Retries and caching are the caller's concern.
 */
public interface Summarizer extends ExternalCall<SummaryRequest, SummaryResponse> {

    /**
     * Identifies the model and prompt version; part of the cache fingerprint.
     */
    String cacheNamespace();

    default SummaryResponse summarize(SummaryRequest request) throws ExternalCallException {
        return call(request);
    }
}
