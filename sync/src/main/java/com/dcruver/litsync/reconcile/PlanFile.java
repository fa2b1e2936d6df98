package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.io.AtomicFiles;
import com.dcruver.litsync.io.LocalDocument;
import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON export of a reconciliation plan, so a plan computed by {@code diff} can be
 * reviewed and later applied or used to pick the items to generate.
 * <p>
 * Note files are stored relative to the vault root. Reading a plan back rejects any
 * file that resolves outside the vault.
 */
@Slf4j
public class PlanFile {

    private final Path vaultRoot;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public PlanFile(Path vaultRoot, Clock clock) {
        this.vaultRoot = vaultRoot.toAbsolutePath().normalize();
        this.clock = clock;
    }

    public void write(ReconciliationPlan plan, Path file) throws IOException {
        Document document = toDocument(plan);
        AtomicFiles.writeString(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document));
        log.info("Plan written to {} ({})", file, plan.summary());
    }

    /**
     * @throws IOException if the file cannot be read or is not a plan document
     * @throws IllegalArgumentException if an entry is incomplete, names a file outside the vault,
     *                                  or claims a key twice
     */
    public ReconciliationPlan read(Path file) throws IOException {
        Document document = objectMapper.readValue(Files.readString(file), Document.class);

        Map<String, LibraryItem> added = new LinkedHashMap<>();
        for (Entry entry : entries(document.getAdded())) {
            putOnce(added, requireKey(entry), LibraryItem.builder()
                .key(entry.getKey())
                .title(entry.getTitle())
                .collectionPaths(Set.of(CollectionPath.parse(entry.getCollection())))
                .build());
        }

        Map<String, LocalDocument> deleted = new LinkedHashMap<>();
        for (Entry entry : entries(document.getDeleted())) {
            putOnce(deleted, requireKey(entry), toLocalDocument(entry));
        }

        Map<String, PlannedMove> moved = new LinkedHashMap<>();
        for (Entry entry : entries(document.getMoved())) {
            LocalDocument doc = toLocalDocument(entry);
            putOnce(moved, requireKey(entry), PlannedMove.builder()
                .key(entry.getKey())
                .fromPath(doc.getFolderPath())
                .toPath(CollectionPath.parse(entry.getNewCollection()))
                .file(doc.getFile())
                .build());
        }

        List<LocalDocument> duplicates = new ArrayList<>();
        for (Entry entry : entries(document.getDuplicates())) {
            requireKey(entry);
            duplicates.add(toLocalDocument(entry));
        }

        try {
            ReconciliationPlan plan = new ReconciliationPlan(added, deleted, moved, duplicates,
                document.getCollectionFilter());
            log.info("Plan read from {} ({}), generated {}", file, plan.summary(), document.getGeneratedAt());
            return plan;
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException("Plan " + file + " is inconsistent: " + e.getMessage(), e);
        }
    }

    private Document toDocument(ReconciliationPlan plan) {
        Document document = new Document();
        document.setGeneratedAt(clock.instant());
        document.setCollectionFilter(plan.getCollectionFilter());
        plan.getAdded().values().forEach(item -> document.getAdded().add(Entry.builder()
            .key(item.getKey())
            .title(item.getTitle())
            .collection(item.canonicalPath().toString())
            .build()));
        plan.getDeleted().values().forEach(doc -> document.getDeleted().add(fromLocalDocument(doc)));
        plan.getMoved().values().forEach(move -> document.getMoved().add(Entry.builder()
            .key(move.getKey())
            .oldCollection(move.getFromPath().toString())
            .newCollection(move.getToPath().toString())
            .filePath(relative(move.getFile()))
            .build()));
        plan.getDuplicates().forEach(doc -> document.getDuplicates().add(fromLocalDocument(doc)));
        return document;
    }

    private Entry fromLocalDocument(LocalDocument doc) {
        return Entry.builder()
            .key(doc.getKey())
            .title(doc.getTitle())
            .collection(doc.getFolderPath().toString())
            .filePath(relative(doc.getFile()))
            .build();
    }

    private LocalDocument toLocalDocument(Entry entry) {
        if (entry.getFilePath() == null || entry.getFilePath().isBlank()) {
            throw new IllegalArgumentException("Plan entry " + entry.getKey() + " has no file_path");
        }
        Path file = vaultRoot.resolve(entry.getFilePath()).normalize();
        if (!file.startsWith(vaultRoot) || file.equals(vaultRoot)) {
            throw new IllegalArgumentException("Plan entry " + entry.getKey() + " points outside the vault: "
                + entry.getFilePath());
        }
        return LocalDocument.builder()
            .key(entry.getKey())
            .folderPath(CollectionPath.relativeFolder(vaultRoot, file.getParent()))
            .file(file)
            .title(entry.getTitle())
            .build();
    }

    private String relative(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        return absolute.startsWith(vaultRoot)
            ? vaultRoot.relativize(absolute).toString().replace('\\', '/')
            : absolute.toString();
    }

    private static <T> void putOnce(Map<String, T> entries, String key, T value) {
        if (entries.putIfAbsent(key, value) != null) {
            throw new IllegalArgumentException("Plan lists key " + key + " twice");
        }
    }

    private static List<Entry> entries(List<Entry> entries) {
        return entries != null ? entries : List.of();
    }

    private static String requireKey(Entry entry) {
        if (entry.getKey() == null || entry.getKey().isBlank()) {
            throw new IllegalArgumentException("Plan entry without a key");
        }
        return entry.getKey();
    }

    @Data
    @NoArgsConstructor
    public static class Document {
        private Instant generatedAt;
        private String collectionFilter;
        private List<Entry> added = new ArrayList<>();
        private List<Entry> deleted = new ArrayList<>();
        private List<Entry> moved = new ArrayList<>();
        private List<Entry> duplicates = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private String key;
        private String title;
        private String collection;
        private String oldCollection;
        private String newCollection;
        private String filePath;
    }
}
