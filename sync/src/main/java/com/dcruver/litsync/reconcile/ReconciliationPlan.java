package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.io.LocalDocument;
import com.dcruver.litsync.library.LibraryItem;
import lombok.Getter;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Difference between the library and the vault, computed once per run.
 * A key appears in at most one of added, deleted and moved.
 */
@Getter
public final class ReconciliationPlan {

    private final Map<String, LibraryItem> added;
    private final Map<String, LocalDocument> deleted;
    private final Map<String, PlannedMove> moved;

    // Extra copies of a key already claimed by another note; reported, never acted on
    private final List<LocalDocument> duplicates;

    private final String collectionFilter;

    public ReconciliationPlan(Map<String, LibraryItem> added,
                              Map<String, LocalDocument> deleted,
                              Map<String, PlannedMove> moved,
                              List<LocalDocument> duplicates,
                              String collectionFilter) {
        this.added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        this.deleted = Collections.unmodifiableMap(new LinkedHashMap<>(deleted));
        this.moved = Collections.unmodifiableMap(new LinkedHashMap<>(moved));
        this.duplicates = List.copyOf(duplicates);
        this.collectionFilter = collectionFilter;
        checkDisjoint();
    }

    private void checkDisjoint() {
        Set<String> seen = new HashSet<>(added.keySet());
        for (String key : deleted.keySet()) {
            if (!seen.add(key)) {
                throw new IllegalStateException("Key " + key + " is both added and deleted");
            }
        }
        for (String key : moved.keySet()) {
            if (!seen.add(key)) {
                throw new IllegalStateException("Key " + key + " is moved and also added or deleted");
            }
        }
    }

    public boolean isEmpty() {
        return added.isEmpty() && deleted.isEmpty() && moved.isEmpty() && duplicates.isEmpty();
    }

    public String summary() {
        return String.format("%d added, %d deleted, %d moved, %d duplicates",
            added.size(), deleted.size(), moved.size(), duplicates.size());
    }
}
