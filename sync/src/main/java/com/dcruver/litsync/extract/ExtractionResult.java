package com.dcruver.litsync.extract;

import lombok.Value;

/**
 * Text recovered from an attachment. {@link #fallback(String)} marks an extraction that
 * produced nothing usable; callers then fall back to the item abstract.
 */
@Value
public class ExtractionResult {
    String text;
    double confidence;
    boolean fallback;
    String reason;

    public static ExtractionResult of(String text, double confidence) {
        return new ExtractionResult(text, confidence, false, null);
    }

    public static ExtractionResult fallback(String reason) {
        return new ExtractionResult("", 0.0, true, reason);
    }
}
