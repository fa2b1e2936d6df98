package com.dcruver.litsync.io;

import com.dcruver.litsync.library.CollectionPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VaultDocumentStoreTest {

    @TempDir
    Path vault;

    private VaultDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new VaultDocumentStore(vault, "_archived", "img");
    }

    @Test
    void testKeyFromFrontMatter() throws Exception {
        write("AI/ML/Some Paper.md", """
            ---
            key: ABCD1234
            title: "Attention Is All You Need"
            authors:
              - "Vaswani, Ashish"
            ---

            # Attention Is All You Need
            """);

        List<LocalDocument> docs = store.listDocuments();

        assertEquals(1, docs.size());
        LocalDocument doc = docs.get(0);
        assertEquals("ABCD1234", doc.getKey());
        assertEquals("Attention Is All You Need", doc.getTitle());
        assertEquals(CollectionPath.parse("AI/ML"), doc.getFolderPath());
        assertEquals("Some Paper.md", doc.getFileName());
    }

    @Test
    void testKeyFromFileNameSuffix() throws Exception {
        write("Notes/Old Paper_XYZ789.md", "# Old Paper\n\nNo front matter here.\n");

        LocalDocument doc = store.listDocuments().get(0);

        assertEquals("XYZ789", doc.getKey());
        assertEquals("Old Paper", doc.getTitle());
    }

    @Test
    void testFrontMatterKeyWinsOverSuffix() throws Exception {
        write("Paper_SUFFIX1.md", "---\nkey: 'REALKEY'\n---\n");

        LocalDocument doc = store.listDocuments().get(0);

        assertEquals("REALKEY", doc.getKey());
        assertTrue(doc.getFolderPath().isRoot());
    }

    @Test
    void testUnkeyedArchivedAndHiddenNotesAreIgnored() throws Exception {
        write("Journal/daily.md", "# Just a note\n");
        write("_archived/20250101/AI/Gone_GONE1.md", "---\nkey: GONE1\n---\n");
        write("img/Paper_K/figure.md", "---\nkey: IMG1\n---\n");
        write(".obsidian/templates/Template_TPL1.md", "---\nkey: TPL1\n---\n");
        write("README.txt", "not markdown");

        assertTrue(store.listDocuments().isEmpty());
    }

    @Test
    void testMissingVaultHasNoDocuments() throws Exception {
        VaultDocumentStore missing = new VaultDocumentStore(vault.resolve("nope"), "_archived", "img");
        assertTrue(missing.listDocuments().isEmpty());
    }

    @Test
    void testWriteCreatesFoldersAndReplacesContent() throws Exception {
        Path written = store.write(CollectionPath.parse("AI/ML"), "Paper_K1.md",
            "---\nkey: K1\n---\nfirst\n".getBytes(StandardCharsets.UTF_8));
        store.write(CollectionPath.parse("AI/ML"), "Paper_K1.md",
            "---\nkey: K1\n---\nsecond\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(vault.resolve("AI").resolve("ML").resolve("Paper_K1.md").toAbsolutePath().normalize(), written);
        assertEquals("---\nkey: K1\n---\nsecond\n", Files.readString(written));
        try (var files = Files.list(written.getParent())) {
            assertEquals(1, files.count(), "no temp files left behind");
        }
    }

    @Test
    void testLatin1NoteIsStillListed() throws Exception {
        Path file = vault.resolve("Old/Caf\u00e9 Paper_LAT1.md");
        Files.createDirectories(file.getParent());
        Files.write(file, "---\nkey: LAT1\ntitle: \"Caf\u00e9 notes\"\n---\n\nR\u00e9sum\u00e9\n"
            .getBytes(StandardCharsets.ISO_8859_1));
        write("Old/Plain_PLN1.md", "# Plain\n");

        List<LocalDocument> docs = store.listDocuments();

        assertEquals(2, docs.size());
        LocalDocument latin = docs.stream().filter(d -> d.getKey().equals("LAT1")).findFirst().orElseThrow();
        assertEquals(CollectionPath.parse("Old"), latin.getFolderPath());
        assertTrue(latin.getTitle().startsWith("Caf"));
    }

    @Test
    void testNoteFileName() {
        assertEquals("Attention Is All You Need_ABCD1234.md",
            VaultDocumentStore.noteFileName("Attention Is All You Need", "ABCD1234"));
        assertEquals("Whats new 2D3D_K.md", VaultDocumentStore.noteFileName("What's new: 2D/3D?", "K"));
        assertEquals(100 + "_K.md".length(), VaultDocumentStore.noteFileName("x".repeat(150), "K").length());
    }

    private void write(String relative, String content) throws Exception {
        Path file = vault.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
