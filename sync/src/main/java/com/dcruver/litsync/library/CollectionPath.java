package com.dcruver.litsync.library;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Ordered folder hierarchy an item is filed under, e.g. {@code AI/ML}.
 * Ordering is lexicographic segment by segment, shorter path first on a common prefix.
 */
@Getter
@EqualsAndHashCode
public final class CollectionPath implements Comparable<CollectionPath> {

    public static final String UNCATEGORIZED_NAME = "Uncategorized";

    public static final CollectionPath ROOT = new CollectionPath(List.of());
    public static final CollectionPath UNCATEGORIZED = new CollectionPath(List.of(UNCATEGORIZED_NAME));

    private final List<String> segments;

    private CollectionPath(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    public static CollectionPath of(String... segments) {
        return of(Arrays.asList(segments));
    }

    public static CollectionPath of(List<String> segments) {
        List<String> cleaned = new ArrayList<>();
        for (String segment : segments) {
            if (segment != null && !segment.isBlank()) {
                cleaned.add(segment.trim());
            }
        }
        return new CollectionPath(cleaned);
    }

    /**
     * Parse a slash separated path such as {@code "X/Y"}.
     */
    public static CollectionPath parse(String path) {
        if (path == null || path.isBlank()) {
            return ROOT;
        }
        return of(path.split("/"));
    }

    /**
     * Folder path of {@code folder} relative to {@code root}.
     */
    public static CollectionPath relativeFolder(Path root, Path folder) {
        Path relative = root.relativize(folder);
        List<String> segments = new ArrayList<>();
        for (Path part : relative) {
            segments.add(part.toString());
        }
        return of(segments);
    }

    /**
     * Same path with every segment made safe for use as a folder name.
     */
    public CollectionPath sanitized() {
        return of(segments.stream().map(CollectionPath::sanitizeSegment).toList());
    }

    public static String sanitizeSegment(String name) {
        String sanitized = name.replace('/', '-').replace('\\', '-').replace(':', '-');
        sanitized = sanitized.replaceAll("[*?\"<>|]", "").trim();
        // "." and ".." would point at the current or parent folder
        if (!sanitized.isEmpty() && sanitized.chars().allMatch(c -> c == '.')) {
            return sanitized.replace('.', '_');
        }
        return sanitized;
    }

    public CollectionPath child(String segment) {
        List<String> extended = new ArrayList<>(segments);
        extended.add(segment);
        return of(extended);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    /**
     * Case-insensitive check whether the joined path contains the filter text.
     */
    public boolean matchesFilter(String filter) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        return toString().toLowerCase(Locale.ROOT).contains(filter.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Folder this path names below {@code root}.
     *
     * @throws IllegalArgumentException if a segment would leave {@code root}
     */
    public Path resolveAgainst(Path root) {
        Path result = root;
        for (String segment : segments) {
            result = result.resolve(segment);
        }
        Path base = root.normalize();
        Path normalized = result.normalize();
        if (!normalized.startsWith(base) || (!isRoot() && normalized.equals(base))) {
            throw new IllegalArgumentException("Collection path '" + this + "' escapes " + root);
        }
        return result;
    }

    @Override
    public int compareTo(CollectionPath other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
