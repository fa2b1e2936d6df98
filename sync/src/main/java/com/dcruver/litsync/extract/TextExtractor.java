package com.dcruver.litsync.extract;

import java.util.List;

/**
 * Turns an attachment payload into text and images. Implementations never throw for
 * bad input; they return a fallback result or an empty list instead.
 */
public interface TextExtractor {

    ExtractionResult extractText(byte[] payload);

    List<ImageBlob> extractImages(byte[] payload);
}
