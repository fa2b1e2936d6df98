package com.dcruver.litsync.io;

import com.dcruver.litsync.library.CollectionPath;
import com.github.difflib.DiffUtils;
import com.github.difflib.patch.Patch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Markdown vault on the local filesystem.
 * <p>
 * A note belongs to the sync when its YAML front matter has a {@code key:} field, or
 * failing that, its file name ends in {@code _<KEY>.md}. Archive and image folders
 * and dot-folders are never scanned.
 */
@Slf4j
public class VaultDocumentStore implements DocumentStore {

    private static final Pattern FRONT_MATTER_DELIMITER = Pattern.compile("^---\\s*$");
    private static final Pattern FRONT_MATTER_FIELD = Pattern.compile("^([A-Za-z_][\\w-]*):\\s*(.*?)\\s*$");
    private static final Pattern KEY_SUFFIX = Pattern.compile("^(.*)_([A-Za-z0-9]+)\\.md$");

    private final Path root;
    private final String archiveFolder;
    private final String imageFolder;

    public VaultDocumentStore(Path root, String archiveFolder, String imageFolder) {
        this.root = root.toAbsolutePath().normalize();
        this.archiveFolder = archiveFolder;
        this.imageFolder = imageFolder;
    }

    @Override
    public Path getRoot() {
        return root;
    }

    @Override
    public List<String> reservedFolders() {
        return List.of(archiveFolder, imageFolder);
    }

    @Override
    public List<LocalDocument> listDocuments() throws IOException {
        if (!Files.isDirectory(root)) {
            log.warn("Vault directory does not exist: {}", root);
            return List.of();
        }

        List<Path> markdownFiles;
        try (Stream<Path> paths = Files.walk(root)) {
            markdownFiles = paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".md"))
                .filter(p -> !isExcluded(p))
                .sorted(Comparator.comparing(p -> root.relativize(p).toString()))
                .toList();
        }

        List<LocalDocument> documents = new ArrayList<>();
        for (Path file : markdownFiles) {
            try {
                LocalDocument doc = parse(file);
                if (doc != null) {
                    documents.add(doc);
                } else {
                    log.debug("Skipping unmanaged note: {}", root.relativize(file));
                }
            } catch (IOException e) {
                log.error("Failed to read note: {}", file, e);
            }
        }

        log.info("Found {} keyed notes in {}", documents.size(), root);
        return documents;
    }

    private boolean isExcluded(Path file) {
        Path relative = root.relativize(file.getParent());
        for (Path part : relative) {
            String name = part.toString();
            if (name.isEmpty()) {
                continue;
            }
            if (name.startsWith(".") || name.equals(archiveFolder) || name.equals(imageFolder)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parse a note, returning null when no key can be found.
     */
    LocalDocument parse(Path file) throws IOException {
        List<String> lines = readText(file).lines().toList();

        String key = null;
        String title = null;

        if (!lines.isEmpty() && FRONT_MATTER_DELIMITER.matcher(lines.get(0)).matches()) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                if (FRONT_MATTER_DELIMITER.matcher(line).matches()) {
                    break;
                }
                Matcher fieldMatcher = FRONT_MATTER_FIELD.matcher(line);
                if (fieldMatcher.matches()) {
                    String field = fieldMatcher.group(1);
                    String value = unquote(fieldMatcher.group(2));
                    if ("key".equals(field) && !value.isBlank()) {
                        key = value;
                    } else if ("title".equals(field) && !value.isBlank()) {
                        title = value;
                    }
                }
            }
        }

        Matcher suffixMatcher = KEY_SUFFIX.matcher(file.getFileName().toString());
        boolean hasSuffix = suffixMatcher.matches();
        if (key == null && hasSuffix) {
            key = suffixMatcher.group(2);
        }
        if (key == null) {
            return null;
        }
        if (title == null) {
            title = hasSuffix ? suffixMatcher.group(1) : file.getFileName().toString().replaceFirst("\\.md$", "");
        }

        return LocalDocument.builder()
            .key(key)
            .folderPath(CollectionPath.relativeFolder(root, file.getParent()))
            .file(file.toAbsolutePath().normalize())
            .title(title)
            .build();
    }

    // Notes saved in another encoding still parse; undecodable bytes become U+FFFD
    private static String readText(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static String unquote(String value) {
        if (value.length() >= 2
            && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    @Override
    public Path write(CollectionPath folder, String fileName, byte[] content) throws IOException {
        Path target = folder.resolveAgainst(root).resolve(fileName);

        if (fileName.endsWith(".md") && Files.exists(target)) {
            List<String> original = readText(target).lines().toList();
            List<String> revised = new String(content, StandardCharsets.UTF_8).lines().toList();
            Patch<String> patch = DiffUtils.diff(original, revised);
            log.info("Overwriting {} ({} changed hunks)", root.relativize(target), patch.getDeltas().size());
        }

        AtomicFiles.write(target, content);
        log.debug("Wrote note to: {}", target);
        return target;
    }

    /**
     * File name for a note: title reduced to letters, digits, space, dash and underscore
     * (at most 100 characters) followed by {@code _<KEY>.md}.
     */
    public static String noteFileName(String title, String key) {
        StringBuilder safe = new StringBuilder();
        String source = title != null ? title : "";
        source.codePoints()
            .filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_')
            .forEach(safe::appendCodePoint);
        String trimmed = safe.length() > 100 ? safe.substring(0, 100) : safe.toString();
        return trimmed + "_" + key + ".md";
    }
}
