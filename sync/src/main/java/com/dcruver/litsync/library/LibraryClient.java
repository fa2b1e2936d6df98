package com.dcruver.litsync.library;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the reference-manager library.
 */
public interface LibraryClient {

    /**
     * All items, optionally restricted to those whose collection path contains the filter.
     * Pagination, if any, is handled by the implementation.
     */
    List<LibraryItem> listItems(String collectionFilter);

    /**
     * Binary payload behind an attachment pointer, or empty when it cannot be found.
     */
    Optional<byte[]> fetchAttachment(String attachmentRef);

    /**
     * Every collection path with the number of items filed under it.
     */
    Map<CollectionPath, Integer> listCollections();
}
