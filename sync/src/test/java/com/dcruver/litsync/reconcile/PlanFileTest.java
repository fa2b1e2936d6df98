package com.dcruver.litsync.reconcile;

import com.dcruver.litsync.io.VaultDocumentStore;
import com.dcruver.litsync.library.CollectionPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static com.dcruver.litsync.library.InMemoryLibraryClient.item;
import static org.junit.jupiter.api.Assertions.*;

class PlanFileTest {

    @TempDir
    Path tempDir;

    private Path vault;
    private VaultDocumentStore store;
    private PlanFile planFile;

    @BeforeEach
    void setUp() throws IOException {
        vault = Files.createDirectories(tempDir.resolve("vault"));
        store = new VaultDocumentStore(vault, "_archived", "img");
        planFile = new PlanFile(vault, Clock.fixed(Instant.parse("2025-03-14T10:15:30Z"), ZoneId.of("UTC")));
    }

    @Test
    void testWrittenPlanReadsBackWithSameKeysAndLocations() throws IOException {
        writeNote("Old", "C");
        writeNote("X", "D");
        writeNote("AI", "A");
        writeNote("Other", "A");
        ReconciliationPlan plan = new Differ().computePlan(
            List.of(item("A", "AI"), item("B", "AI/ML"), item("D", "Y")), store.listDocuments(), null);
        Path file = tempDir.resolve("plan.json");

        planFile.write(plan, file);
        ReconciliationPlan read = planFile.read(file);

        assertTrue(Files.readString(file).contains("\"generated_at\" : \"2025-03-14T10:15:30Z\""));
        assertEquals(plan.getAdded().keySet(), read.getAdded().keySet());
        assertEquals(CollectionPath.parse("AI/ML"), read.getAdded().get("B").canonicalPath());
        assertEquals(plan.getDeleted().get("C").getFile(), read.getDeleted().get("C").getFile());
        assertEquals(CollectionPath.parse("Old"), read.getDeleted().get("C").getFolderPath());
        PlannedMove move = read.getMoved().get("D");
        assertEquals(CollectionPath.parse("X"), move.getFromPath());
        assertEquals(CollectionPath.parse("Y"), move.getToPath());
        assertEquals(plan.getMoved().get("D").getFile(), move.getFile());
        assertEquals(1, read.getDuplicates().size());
    }

    @Test
    void testKeyListedTwiceIsRejected() throws IOException {
        Path file = tempDir.resolve("plan.json");
        Files.writeString(file, """
            {
              "added": [{"key": "A", "collection": "AI"}],
              "deleted": [{"key": "A", "file_path": "AI/Paper A_A.md"}]
            }
            """);
        assertThrows(IllegalArgumentException.class, () -> planFile.read(file));

        Files.writeString(file, """
            {"moved": [{"key": "D", "new_collection": "Y", "file_path": "X/a_D.md"},
                       {"key": "D", "new_collection": "Z", "file_path": "X/a_D.md"}]}
            """);
        assertThrows(IllegalArgumentException.class, () -> planFile.read(file));
    }

    @Test
    void testMalformedPlanIsAnIOException() throws IOException {
        Path file = Files.writeString(tempDir.resolve("plan.json"), "[ not a plan");
        assertThrows(IOException.class, () -> planFile.read(file));
    }

    private void writeNote(String folder, String key) throws IOException {
        Path dir = Files.createDirectories(vault.resolve(folder));
        Files.writeString(dir.resolve("Paper " + key + "_" + key + ".md"),
            "---\nkey: " + key + "\n---\n\n# Paper " + key + "\n", StandardCharsets.UTF_8);
    }
}
