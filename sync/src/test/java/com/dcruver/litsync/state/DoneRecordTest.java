package com.dcruver.litsync.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class DoneRecordTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesEmptyFileOnFirstUse() {
        Path file = tempDir.resolve("state").resolve("done.txt");
        DoneRecord record = new DoneRecord(file);

        assertTrue(Files.exists(file));
        assertEquals(0, record.size());
    }

    @Test
    void testAppendIsIdempotentAndDurable() throws Exception {
        Path file = tempDir.resolve("done.txt");
        DoneRecord record = new DoneRecord(file);

        assertTrue(record.append("A"));
        assertTrue(record.append("B"));
        assertFalse(record.append("A"));

        assertEquals(List.of("A", "B"), Files.readAllLines(file));
        DoneRecord reloaded = new DoneRecord(file);
        assertEquals(Set.of("A", "B"), reloaded.snapshot());
        assertTrue(reloaded.contains("B"));
    }

    @Test
    void testIgnoresBlankLinesWhenLoading() throws Exception {
        Path file = tempDir.resolve("done.txt");
        Files.writeString(file, "A\n\n  B  \n");

        assertEquals(Set.of("A", "B"), new DoneRecord(file).snapshot());
    }

    @Test
    void testRemoveRewritesFile() throws Exception {
        Path file = tempDir.resolve("done.txt");
        DoneRecord record = new DoneRecord(file);
        record.append("A");
        record.append("B");
        record.append("C");

        assertEquals(2, record.remove(List.of("A", "C", "Z")));
        assertEquals(0, record.remove(List.of("Z")));

        assertEquals(List.of("B"), Files.readAllLines(file));
        assertFalse(record.contains("A"));
    }

    @Test
    void testConcurrentAppendsKeepEveryKeyOnce() throws Exception {
        Path file = tempDir.resolve("done.txt");
        DoneRecord record = new DoneRecord(file);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String key = "K" + (i % 50);
                futures.add(pool.submit(() -> record.append(key)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(50, lines.size());
        assertEquals(50, Set.copyOf(lines).size());
    }

    @Test
    void testUnwritableLocationIsIntegrityFailure() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");

        assertThrows(IntegrityException.class, () -> new DoneRecord(blocker.resolve("done.txt")));
    }
}
