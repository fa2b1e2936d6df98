package com.dcruver.litsync.library;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A record in the reference-manager library.
 * Read-only to this application; built and validated by a {@link LibraryClient}.
 */
@Data
@Builder
@With
public class LibraryItem {
    private final String key;
    private final String title;
    private final List<String> authors;
    private final String year;
    private final String abstractNote;
    private final String publicationTitle;
    private final String doi;
    private final List<String> tags;

    // Never empty once validated; items without a collection get UNCATEGORIZED
    private final Set<CollectionPath> collectionPaths;

    // Opaque pointer to the binary attachment, null when the item has none
    private final String attachmentRef;

    // Rarely used metadata (volume, pages, publisher, item type, citation key)
    private final Map<String, String> extra;

    /**
     * Destination folder for this item's note: the smallest sanitized collection path.
     */
    public CollectionPath canonicalPath() {
        return sanitizedPaths().first();
    }

    public TreeSet<CollectionPath> sanitizedPaths() {
        TreeSet<CollectionPath> paths = new TreeSet<>();
        if (collectionPaths != null) {
            collectionPaths.forEach(p -> paths.add(p.sanitized()));
        }
        paths.remove(CollectionPath.ROOT);
        if (paths.isEmpty()) {
            paths.add(CollectionPath.UNCATEGORIZED);
        }
        return paths;
    }

    public boolean matchesFilter(String filter) {
        return sanitizedPaths().stream().anyMatch(p -> p.matchesFilter(filter))
            || (collectionPaths != null && collectionPaths.stream().anyMatch(p -> p.matchesFilter(filter)));
    }

    public boolean hasAttachment() {
        return attachmentRef != null && !attachmentRef.isBlank();
    }

    public String getExtra(String name) {
        return extra != null ? extra.get(name) : null;
    }
}
