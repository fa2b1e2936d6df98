package com.dcruver.litsync.library;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class CollectionPathTest {

    @Test
    void testParseDropsEmptySegments() {
        CollectionPath path = CollectionPath.parse("/AI//ML/ ");
        assertEquals(List.of("AI", "ML"), path.getSegments());
        assertEquals("AI/ML", path.toString());
        assertTrue(CollectionPath.parse("").isRoot());
        assertTrue(CollectionPath.parse(null).isRoot());
    }

    @Test
    void testOrderingIsLexicographicBySegment() {
        TreeSet<CollectionPath> paths = new TreeSet<>(List.of(
            CollectionPath.parse("X/Z"),
            CollectionPath.parse("X"),
            CollectionPath.parse("B/Z"),
            CollectionPath.parse("X/Y")));

        assertEquals(List.of("B/Z", "X", "X/Y", "X/Z"), paths.stream().map(CollectionPath::toString).toList());
    }

    @Test
    void testSanitizedReplacesPathSeparatorsAndDropsReservedCharacters() {
        CollectionPath path = CollectionPath.of("Vision: 2D/3D", "What?*");
        assertEquals(List.of("Vision- 2D-3D", "What"), path.sanitized().getSegments());
    }

    @Test
    void testDotOnlySegmentsAreRenamed() {
        CollectionPath path = CollectionPath.of("..", ".", "v1.2", " ... ");
        assertEquals(List.of("__", "_", "v1.2", "___"), path.sanitized().getSegments());

        Path root = Path.of("/vault");
        Path folder = path.sanitized().resolveAgainst(root);
        assertTrue(folder.normalize().startsWith(root));
        assertEquals(root.resolve("__").resolve("_").resolve("v1.2").resolve("___"), folder);
    }

    @Test
    void testResolveRejectsPathsLeavingRoot() {
        Path root = Path.of("/vault");
        assertThrows(IllegalArgumentException.class, () -> CollectionPath.of("..", "etc").resolveAgainst(root));
        assertThrows(IllegalArgumentException.class, () -> CollectionPath.of("AI", "..", "..").resolveAgainst(root));
        assertThrows(IllegalArgumentException.class, () -> CollectionPath.of(".").resolveAgainst(root));
        assertEquals(root, CollectionPath.ROOT.resolveAgainst(root));
    }

    @Test
    void testFilterIsCaseInsensitiveSubstring() {
        CollectionPath path = CollectionPath.parse("AI/Machine Learning");
        assertTrue(path.matchesFilter("machine"));
        assertTrue(path.matchesFilter("ai/mach"));
        assertTrue(path.matchesFilter(null));
        assertFalse(path.matchesFilter("Biology"));
    }

    @Test
    void testRelativeFolderAndResolveAreInverse() {
        Path root = Path.of("/vault");
        CollectionPath path = CollectionPath.relativeFolder(root, root.resolve("AI").resolve("ML"));
        assertEquals(CollectionPath.of("AI", "ML"), path);
        assertEquals(root.resolve("AI").resolve("ML"), path.resolveAgainst(root));
        assertTrue(CollectionPath.relativeFolder(root, root).isRoot());
    }

    @Test
    void testCanonicalPathIsSmallestSanitizedPath() {
        LibraryItem item = LibraryItem.builder()
            .key("K1")
            .title("T")
            .collectionPaths(Set.of(CollectionPath.parse("X/Z"), CollectionPath.parse("X/Y"), CollectionPath.ROOT))
            .build();

        assertEquals(CollectionPath.parse("X/Y"), item.canonicalPath());
        assertEquals(2, item.sanitizedPaths().size());
    }

    @Test
    void testItemWithoutCollectionsIsUncategorized() {
        LibraryItem item = LibraryItem.builder().key("K2").title("T").build();
        assertEquals(CollectionPath.UNCATEGORIZED, item.canonicalPath());
        assertTrue(item.matchesFilter("uncategorized"));
        assertFalse(item.hasAttachment());
        assertNull(item.getExtra("volume"));
    }
}
