package com.dcruver.litsync.pipeline;

import com.dcruver.litsync.extract.ExtractionResult;
import com.dcruver.litsync.extract.ImageBlob;
import com.dcruver.litsync.extract.TextExtractor;
import com.dcruver.litsync.io.DocumentStore;
import com.dcruver.litsync.io.VaultDocumentStore;
import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryClient;
import com.dcruver.litsync.library.LibraryClientException;
import com.dcruver.litsync.library.LibraryItem;
import com.dcruver.litsync.nlp.ExternalCallException;
import com.dcruver.litsync.nlp.RateLimitedCaller;
import com.dcruver.litsync.nlp.SummaryRequest;
import com.dcruver.litsync.nlp.SummaryResponse;
import com.dcruver.litsync.render.NoteRenderer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Drives one library item through fetch, extract, summarize and render.
 * <p>
 * A missing attachment or unusable PDF text is not an error: the item abstract is
 * summarized instead. Summarization and write failures end the item as FAILED.
 */
@Slf4j
public class ItemProcessor {

    static final String ABSTRACT_ONLY_NOTE = "[NOTE: PDF extraction failed, using abstract only]";

    static final String PDF_FOLDER = "PDFs";

    private final LibraryClient library;
    private final TextExtractor extractor;
    private final RateLimitedCaller<SummaryRequest, SummaryResponse> summarizer;
    private final NoteRenderer renderer;
    private final DocumentStore store;
    private final Clock clock;
    private final String language;
    private final String imageFolder;

    public ItemProcessor(LibraryClient library, TextExtractor extractor,
                         RateLimitedCaller<SummaryRequest, SummaryResponse> summarizer,
                         NoteRenderer renderer, DocumentStore store, Clock clock,
                         String language, String imageFolder) {
        this.library = library;
        this.extractor = extractor;
        this.summarizer = summarizer;
        this.renderer = renderer;
        this.store = store;
        this.clock = clock;
        this.language = language;
        this.imageFolder = imageFolder;
    }

    /**
     * @param stateListener told about every stage the item enters
     * @return the written note, or null in a dry run
     */
    public Path process(LibraryItem item, PipelineOptions options, Consumer<ItemState> stateListener)
        throws StageFailureException {

        stateListener.accept(ItemState.FETCHING);
        byte[] payload = fetch(item);

        stateListener.accept(ItemState.EXTRACTING);
        String text;
        boolean extracted = false;
        List<ImageBlob> images = List.of();
        ExtractionResult extraction = payload != null
            ? extractor.extractText(payload)
            : ExtractionResult.fallback("no attachment");
        if (!extraction.isFallback()) {
            text = extraction.getText();
            extracted = true;
            images = extractor.extractImages(payload);
            log.info("Using PDF text ({} chars, {} images)", text.length(), images.size());
        } else if (item.getAbstractNote() != null && !item.getAbstractNote().isBlank()) {
            text = ABSTRACT_ONLY_NOTE + "\n\n" + item.getAbstractNote();
            log.info("Using abstract ({})", extraction.getReason());
        } else {
            text = null;
            log.warn("No text available: neither PDF nor abstract");
        }

        stateListener.accept(ItemState.SUMMARIZING);
        SummaryResponse summary = summarize(item, text, images, options.isSkipSummarization());

        stateListener.accept(ItemState.RENDERING);
        String pdfLink = options.isCopyPdfs() && payload != null ? copyPdf(item, payload, options.isDryRun()) : null;
        return render(item, summary, extracted, images, pdfLink, options.isDryRun());
    }

    private byte[] fetch(LibraryItem item) {
        if (!item.hasAttachment()) {
            log.info("No attachment");
            return null;
        }
        try {
            Optional<byte[]> payload = library.fetchAttachment(item.getAttachmentRef());
            if (payload.isEmpty()) {
                log.warn("Attachment not found: {}", item.getAttachmentRef());
            }
            return payload.orElse(null);
        } catch (LibraryClientException e) {
            log.warn("Attachment unreadable, falling back to abstract: {}", e.getMessage());
            return null;
        }
    }

    private SummaryResponse summarize(LibraryItem item, String text, List<ImageBlob> images, boolean skip)
        throws StageFailureException {
        if (skip || text == null) {
            return SummaryResponse.placeholder(item.getTags());
        }

        SummaryRequest request = SummaryRequest.builder()
            .title(item.getTitle())
            .text(text)
            .images(images)
            .languageHint(language)
            .build();
        try {
            SummaryResponse summary = summarizer.call(request);
            if (summary.getKeywords() == null || summary.getKeywords().isEmpty()) {
                summary.setKeywords(item.getTags() != null ? new ArrayList<>(item.getTags()) : new ArrayList<>());
            }
            return summary;
        } catch (ExternalCallException e) {
            throw new StageFailureException(ItemState.SUMMARIZING, e.getMessage(), e);
        }
    }

    private Path render(LibraryItem item, SummaryResponse summary, boolean extracted,
                        List<ImageBlob> images, String pdfLink, boolean dryRun) throws StageFailureException {
        CollectionPath folder = item.canonicalPath();
        String fileName = VaultDocumentStore.noteFileName(item.getTitle(), item.getKey());

        try {
            List<String> imageLinks = dryRun ? List.of() : writeImages(item, folder, images);

            Map<String, Object> fields = new HashMap<>();
            fields.put(NoteRenderer.FIELD_ITEM, item);
            fields.put(NoteRenderer.FIELD_SUMMARY, summary);
            fields.put(NoteRenderer.FIELD_EXTRACTED, extracted);
            fields.put(NoteRenderer.FIELD_IMAGES, imageLinks);
            fields.put(NoteRenderer.FIELD_GENERATED_AT, clock.instant());
            if (pdfLink != null) {
                fields.put(NoteRenderer.FIELD_PDF_LINK, pdfLink);
            }
            byte[] content = renderer.render(NoteRenderer.LITERATURE_NOTE, fields);

            if (dryRun) {
                log.info("[DRY RUN] Would write {}/{}", folder, fileName);
                return null;
            }
            return store.write(folder, fileName, content);
        } catch (IOException | IllegalArgumentException e) {
            throw new StageFailureException(ItemState.RENDERING, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Copy the attachment to {@code PDFs/} beside the note. A failed copy only costs the link.
     *
     * @return link relative to the note, or null when nothing was copied
     */
    private String copyPdf(LibraryItem item, byte[] payload, boolean dryRun) {
        CollectionPath pdfFolder = item.canonicalPath().child(PDF_FOLDER);
        String fileName = VaultDocumentStore.noteFileName(item.getTitle(), item.getKey())
            .replaceFirst("\\.md$", ".pdf");
        if (dryRun) {
            log.info("[DRY RUN] Would copy PDF to {}/{}", pdfFolder, fileName);
            return null;
        }
        try {
            store.write(pdfFolder, fileName, payload);
            log.info("Copied PDF to {}/{}", pdfFolder, fileName);
            return PDF_FOLDER + "/" + fileName;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to copy PDF, keeping the note without it: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Store figures under the image folder and return links relative to the note.
     */
    private List<String> writeImages(LibraryItem item, CollectionPath noteFolder, List<ImageBlob> images)
        throws IOException {
        List<String> links = new ArrayList<>();
        if (images.isEmpty()) {
            return links;
        }
        String paperFolder = CollectionPath.sanitizeSegment(item.getTitle());
        if (paperFolder.length() > 100) {
            paperFolder = paperFolder.substring(0, 100).trim();
        }
        paperFolder = paperFolder + "_" + item.getKey();
        CollectionPath imageDir = CollectionPath.of(imageFolder, paperFolder);
        String prefix = "../".repeat(noteFolder.depth());
        for (ImageBlob image : images) {
            store.write(imageDir, image.getName(), image.getData());
            links.add(prefix + imageFolder + "/" + paperFolder + "/" + image.getName());
        }
        return links;
    }
}
