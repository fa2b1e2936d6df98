package com.dcruver.litsync.library;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Library held in memory for tests. Attachments are looked up by reference.
 */
public class InMemoryLibraryClient implements LibraryClient {

    private final List<LibraryItem> items = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, byte[]> attachments = new HashMap<>();

    public InMemoryLibraryClient add(LibraryItem item) {
        items.add(item);
        return this;
    }

    public InMemoryLibraryClient attach(String ref, byte[] payload) {
        attachments.put(ref, payload);
        return this;
    }

    public void remove(String key) {
        items.removeIf(i -> i.getKey().equals(key));
    }

    @Override
    public List<LibraryItem> listItems(String collectionFilter) {
        synchronized (items) {
            return items.stream().filter(i -> i.matchesFilter(collectionFilter)).toList();
        }
    }

    @Override
    public Optional<byte[]> fetchAttachment(String attachmentRef) {
        return Optional.ofNullable(attachments.get(attachmentRef));
    }

    @Override
    public Map<CollectionPath, Integer> listCollections() {
        Map<CollectionPath, Integer> counts = new TreeMap<>();
        synchronized (items) {
            for (LibraryItem item : items) {
                item.getCollectionPaths().forEach(p -> counts.merge(p, 1, Integer::sum));
            }
        }
        return counts;
    }

    public static LibraryItem item(String key, String... paths) {
        List<CollectionPath> parsed = new ArrayList<>();
        for (String path : paths) {
            parsed.add(CollectionPath.parse(path));
        }
        return LibraryItem.builder()
            .key(key)
            .title("Paper " + key)
            .authors(List.of("Doe, Jane"))
            .year("2024")
            .abstractNote("Abstract of " + key)
            .publicationTitle("Journal")
            .tags(List.of("tag-" + key.toLowerCase()))
            .collectionPaths(parsed.isEmpty() ? Set.of(CollectionPath.UNCATEGORIZED) : Set.copyOf(parsed))
            .extra(Map.of())
            .build();
    }
}
