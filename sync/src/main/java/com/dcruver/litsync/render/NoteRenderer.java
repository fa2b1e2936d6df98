package com.dcruver.litsync.render;

import java.util.Map;

/**
 * Renders note content from named fields.
 */
public interface NoteRenderer {

    String LITERATURE_NOTE = "literature-note";

    String FIELD_ITEM = "item";
    String FIELD_SUMMARY = "summary";
    String FIELD_EXTRACTED = "textExtracted";
    String FIELD_IMAGES = "images";
    String FIELD_GENERATED_AT = "generatedAt";
    String FIELD_PDF_LINK = "pdfLink";

    /**
     * @throws IllegalArgumentException for an unknown template or missing required fields
     */
    byte[] render(String templateId, Map<String, Object> fields);
}
