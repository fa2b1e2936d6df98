package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.io.LocalDocument;
import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryItem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the reconciliation plan between library items and vault notes.
 * <p>
 * A note is in sync when its folder equals one of its item's sanitized collection paths.
 * A note in any other folder is moved to the item's smallest sanitized path. With a
 * collection filter, only keys whose item or note falls under the filter are compared,
 * but their counterparts are looked up in the full inputs.
 */
@Slf4j
public class Differ {

    public ReconciliationPlan computePlan(List<LibraryItem> libraryItems,
                                          List<LocalDocument> localDocuments,
                                          String collectionFilter) {
        Map<String, LibraryItem> itemsByKey = new LinkedHashMap<>();
        for (LibraryItem item : libraryItems) {
            itemsByKey.putIfAbsent(item.getKey(), item);
        }

        Map<String, List<LocalDocument>> docsByKey = new LinkedHashMap<>();
        for (LocalDocument doc : localDocuments) {
            docsByKey.computeIfAbsent(doc.getKey(), k -> new ArrayList<>()).add(doc);
        }

        Set<String> scope = new TreeSet<>();
        for (LibraryItem item : itemsByKey.values()) {
            if (item.matchesFilter(collectionFilter)) {
                scope.add(item.getKey());
            }
        }
        for (LocalDocument doc : localDocuments) {
            if (doc.getFolderPath().matchesFilter(collectionFilter)) {
                scope.add(doc.getKey());
            }
        }

        Map<String, LibraryItem> added = new LinkedHashMap<>();
        Map<String, LocalDocument> deleted = new LinkedHashMap<>();
        Map<String, PlannedMove> moved = new LinkedHashMap<>();
        List<LocalDocument> duplicates = new ArrayList<>();

        for (String key : scope) {
            LibraryItem item = itemsByKey.get(key);
            List<LocalDocument> docs = docsByKey.getOrDefault(key, List.of());

            if (docs.isEmpty()) {
                added.put(key, item);
                continue;
            }

            LocalDocument primary = choosePrimary(item, docs);
            for (LocalDocument doc : docs) {
                if (doc != primary) {
                    duplicates.add(doc);
                }
            }

            if (item == null) {
                deleted.put(key, primary);
            } else if (!isInSync(item, primary)) {
                moved.put(key, PlannedMove.builder()
                    .key(key)
                    .fromPath(primary.getFolderPath())
                    .toPath(item.canonicalPath())
                    .file(primary.getFile())
                    .build());
            }
        }

        ReconciliationPlan plan = new ReconciliationPlan(added, deleted, moved, duplicates, collectionFilter);
        log.info("Reconciliation plan{}: {}",
            collectionFilter != null && !collectionFilter.isBlank() ? " for '" + collectionFilter + "'" : "",
            plan.summary());
        return plan;
    }

    private static LocalDocument choosePrimary(LibraryItem item, List<LocalDocument> docs) {
        if (item != null) {
            for (LocalDocument doc : docs) {
                if (isInSync(item, doc)) {
                    return doc;
                }
            }
        }
        return docs.get(0);
    }

    private static boolean isInSync(LibraryItem item, LocalDocument doc) {
        CollectionPath folder = doc.getFolderPath();
        return item.sanitizedPaths().contains(folder);
    }
}
