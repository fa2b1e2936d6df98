package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.io.LocalDocument;
import com.dcruver.litsync.library.CollectionPath;
import com.dcruver.litsync.library.LibraryItem;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.dcruver.litsync.library.InMemoryLibraryClient.item;
import static org.junit.jupiter.api.Assertions.*;

class DifferTest {

    private final Differ differ = new Differ();

    @Test
    void testNewItemsAreAddedAndOrphanNotesDeleted() {
        List<LibraryItem> items = List.of(item("A", "AI/ML"), item("B", "AI/ML"));
        List<LocalDocument> docs = List.of(doc("A", "AI/ML"), doc("C", "Old/Path"));

        ReconciliationPlan plan = differ.computePlan(items, docs, null);

        assertEquals(Set.of("B"), plan.getAdded().keySet());
        assertEquals(Set.of("C"), plan.getDeleted().keySet());
        assertTrue(plan.getMoved().isEmpty());
        assertTrue(plan.getDuplicates().isEmpty());
    }

    @Test
    void testNoteInOldCollectionIsMoved() {
        ReconciliationPlan plan = differ.computePlan(List.of(item("D", "X/Z")), List.of(doc("D", "X/Y")), null);

        PlannedMove move = plan.getMoved().get("D");
        assertNotNull(move);
        assertEquals(CollectionPath.parse("X/Y"), move.getFromPath());
        assertEquals(CollectionPath.parse("X/Z"), move.getToPath());
        assertTrue(plan.getAdded().isEmpty());
        assertTrue(plan.getDeleted().isEmpty());
    }

    @Test
    void testNoteInAnyOfSeveralCollectionsIsInSync() {
        LibraryItem multi = item("M", "B/Second", "A/First");

        assertTrue(differ.computePlan(List.of(multi), List.of(doc("M", "B/Second")), null).isEmpty());

        ReconciliationPlan plan = differ.computePlan(List.of(multi), List.of(doc("M", "Elsewhere")), null);
        assertEquals(CollectionPath.parse("A/First"), plan.getMoved().get("M").getToPath());
    }

    @Test
    void testNoteAtVaultRootIsMovedIntoCollection() {
        ReconciliationPlan plan = differ.computePlan(List.of(item("R", "AI")), List.of(doc("R", "")), null);

        assertTrue(plan.getMoved().get("R").getFromPath().isRoot());
        assertEquals(CollectionPath.parse("AI"), plan.getMoved().get("R").getToPath());
    }

    @Test
    void testUncategorizedItemBelongsInUncategorizedFolder() {
        ReconciliationPlan plan = differ.computePlan(List.of(item("U")), List.of(doc("U", "Uncategorized")), null);
        assertTrue(plan.isEmpty());
    }

    @Test
    void testFilterLimitsScopeButLooksUpFullInputs() {
        List<LibraryItem> items = List.of(item("A", "AI/ML"), item("B", "Biology"), item("E", "AI/Vision"));
        List<LocalDocument> docs = List.of(
            doc("A", "Biology"),
            doc("B", "Biology"),
            doc("Z", "Biology"),
            doc("E", "AI/Old"));

        ReconciliationPlan plan = differ.computePlan(items, docs, "ai/");

        // A is in scope through its item, E through both, Z and B are outside the filter
        assertEquals(Set.of("A", "E"), plan.getMoved().keySet());
        assertTrue(plan.getDeleted().isEmpty());
        assertTrue(plan.getAdded().isEmpty());
        assertEquals("ai/", plan.getCollectionFilter());
    }

    @Test
    void testFilterIncludesNotesWhoseFolderMatches() {
        ReconciliationPlan plan = differ.computePlan(List.of(item("A", "Biology")), List.of(doc("A", "AI/ML")), "AI");

        assertEquals(Set.of("A"), plan.getMoved().keySet());
        assertEquals(CollectionPath.parse("Biology"), plan.getMoved().get("A").getToPath());
    }

    @Test
    void testDuplicateNotesAreReportedAndInSyncCopyKept() {
        LocalDocument stray = doc("A", "Old");
        LocalDocument inPlace = doc("A", "AI");

        ReconciliationPlan plan = differ.computePlan(List.of(item("A", "AI")), List.of(stray, inPlace), null);

        assertTrue(plan.getMoved().isEmpty());
        assertEquals(List.of(stray), plan.getDuplicates());
    }

    @Test
    void testKeysAppearInAtMostOneCategory() {
        List<LibraryItem> items = List.of(item("A", "X"), item("B", "Y"), item("C", "Z"));
        List<LocalDocument> docs = List.of(doc("A", "X"), doc("B", "Old"), doc("D", "X"), doc("D", "Y"));

        ReconciliationPlan plan = differ.computePlan(items, docs, null);

        assertEquals(Set.of("C"), plan.getAdded().keySet());
        assertEquals(Set.of("D"), plan.getDeleted().keySet());
        assertEquals(Set.of("B"), plan.getMoved().keySet());
        assertEquals(1, plan.getDuplicates().size());
    }

    @Test
    void testPlanRejectsOverlappingCategories() {
        LibraryItem a = item("A", "X");
        assertThrows(IllegalStateException.class, () -> new ReconciliationPlan(
            Map.of("A", a), Map.of("A", doc("A", "X")), Map.of(), List.of(), null));
    }

    private static LocalDocument doc(String key, String folder) {
        CollectionPath path = CollectionPath.parse(folder);
        return LocalDocument.builder()
            .key(key)
            .folderPath(path)
            .file(path.resolveAgainst(Path.of("/vault")).resolve("Paper " + key + "_" + key + ".md"))
            .title("Paper " + key)
            .build();
    }
}
