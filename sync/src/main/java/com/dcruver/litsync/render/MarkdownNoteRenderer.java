package com.dcruver.litsync.render;

import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryItem;
import com.dcruver.litsync.nlp.SummaryResponse;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Markdown literature notes: YAML front matter followed by summary sections.
 * The {@code key:} front matter field is what the vault scanner reads back.
 */
public class MarkdownNoteRenderer implements NoteRenderer {

    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneId.systemDefault());

    @Override
    public byte[] render(String templateId, Map<String, Object> fields) {
        if (!LITERATURE_NOTE.equals(templateId)) {
            throw new IllegalArgumentException("Unknown template: " + templateId);
        }
        LibraryItem item = required(fields, FIELD_ITEM, LibraryItem.class);
        SummaryResponse summary = required(fields, FIELD_SUMMARY, SummaryResponse.class);
        boolean extracted = Boolean.TRUE.equals(fields.get(FIELD_EXTRACTED));
        Instant generatedAt = fields.get(FIELD_GENERATED_AT) instanceof Instant
            ? (Instant) fields.get(FIELD_GENERATED_AT) : Instant.now();
        List<?> images = fields.get(FIELD_IMAGES) instanceof List ? (List<?>) fields.get(FIELD_IMAGES) : List.of();
        String pdfLink = fields.get(FIELD_PDF_LINK) instanceof String ? (String) fields.get(FIELD_PDF_LINK) : null;

        return buildContent(item, summary, extracted, images, pdfLink, generatedAt).getBytes(StandardCharsets.UTF_8);
    }

    private String buildContent(LibraryItem item, SummaryResponse summary, boolean extracted,
                                List<?> images, String pdfLink, Instant generatedAt) {
        StringBuilder sb = new StringBuilder();

        sb.append("---\n");
        sb.append("key: ").append(item.getKey()).append("\n");
        sb.append("title: ").append(quote(item.getTitle())).append("\n");
        appendList(sb, "authors", item.getAuthors());
        if (notBlank(item.getYear())) {
            sb.append("year: ").append(item.getYear()).append("\n");
        }
        if (notBlank(item.getPublicationTitle())) {
            sb.append("publication: ").append(quote(item.getPublicationTitle())).append("\n");
        }
        if (notBlank(item.getDoi())) {
            sb.append("doi: ").append(quote(item.getDoi())).append("\n");
        }
        appendList(sb, "collections", item.sanitizedPaths().stream().map(CollectionPath::toString).toList());
        appendList(sb, "tags", summary.getKeywords());
        sb.append("zotero: ").append(quote("zotero://select/items/0_" + item.getKey())).append("\n");
        if (notBlank(pdfLink)) {
            sb.append("pdf: ").append(quote(pdfLink)).append("\n");
        }
        sb.append("pdf_extracted: ").append(extracted).append("\n");
        sb.append("created: ").append(DATE_FORMAT.format(generatedAt)).append("\n");
        sb.append("---\n\n");

        sb.append("# ").append(item.getTitle()).append("\n\n");
        sb.append("> ").append(bibliography(item)).append("\n\n");
        if (notBlank(pdfLink)) {
            sb.append("[PDF](<").append(pdfLink).append(">)\n\n");
        }

        if (!extracted) {
            sb.append("> [!warning] PDF text unavailable, summary is based on the abstract only.\n\n");
        }

        section(sb, "Summary", summary.getShortSummary());
        section(sb, "Detailed Summary", summary.getLongSummary());
        section(sb, "Contributions", summary.getSections().get(SummaryResponse.CONTRIBUTION));
        section(sb, "Limitations", summary.getSections().get(SummaryResponse.LIMITATIONS));
        section(sb, "Research Ideas", summary.getSections().get(SummaryResponse.IDEAS));

        if (!images.isEmpty()) {
            sb.append("## Figures\n\n");
            for (Object image : images) {
                sb.append("![](<").append(image).append(">)\n");
            }
            sb.append("\n");
        }

        section(sb, "Abstract", item.getAbstractNote());

        String content = sb.toString().stripTrailing();
        return content + "\n";
    }

    private static String bibliography(LibraryItem item) {
        List<String> authors = item.getAuthors() != null ? item.getAuthors() : List.of();
        String authorText = String.join(", ", authors.subList(0, Math.min(3, authors.size())))
            + (authors.size() > 3 ? "..." : "");
        return String.format("%s. (%s). %s. %s.",
            authorText,
            item.getYear() != null ? item.getYear() : "n.d.",
            item.getTitle(),
            item.getPublicationTitle() != null ? item.getPublicationTitle() : "");
    }

    private static void section(StringBuilder sb, String heading, String body) {
        if (!notBlank(body)) {
            return;
        }
        sb.append("## ").append(heading).append("\n\n");
        sb.append(body.strip()).append("\n\n");
    }

    private static void appendList(StringBuilder sb, String name, Collection<String> values) {
        if (values == null || values.isEmpty()) {
            sb.append(name).append(": []\n");
            return;
        }
        sb.append(name).append(":\n");
        for (String value : values) {
            sb.append("  - ").append(quote(value)).append("\n");
        }
    }

    static String quote(String value) {
        if (value == null) {
            return "\"\"";
        }
        String escaped = value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ");
        return "\"" + escaped + "\"";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static <T> T required(Map<String, Object> fields, String name, Class<T> type) {
        Object value = fields.get(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Missing field '" + name + "' for template");
        }
        return type.cast(value);
    }
}
