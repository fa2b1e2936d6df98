package com.dcruver.litsync.state;

import com.dcruver.litsync.io.AtomicFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Append-only list of item keys that finished the whole pipeline, one key per line.
 * <p>
 * All access goes through the instance monitor. Only {@link #remove(Collection)} rewrites
 * the file; everything else appends.
 */
@Slf4j
public class DoneRecord {

    private final Path file;
    private final Set<String> keys = new LinkedHashSet<>();

    public DoneRecord(Path file) {
        this.file = file;
        load();
    }

    private synchronized void load() {
        try {
            if (!Files.exists(file)) {
                Files.createDirectories(file.toAbsolutePath().getParent());
                Files.createFile(file);
                log.info("Created empty done record at {}", file);
                return;
            }
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String key = line.trim();
                if (!key.isEmpty()) {
                    keys.add(key);
                }
            }
            log.info("Loaded {} completed keys from {}", keys.size(), file);
        } catch (IOException e) {
            throw new IntegrityException("Cannot read done record " + file, e);
        }
    }

    public synchronized boolean contains(String key) {
        return keys.contains(key);
    }

    /**
     * Record a completed key. Appending a key that is already present is a no-op.
     *
     * @return true if the key was new
     */
    public synchronized boolean append(String key) {
        if (keys.contains(key)) {
            return false;
        }
        try {
            Files.writeString(file, key + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IntegrityException("Cannot append to done record " + file, e);
        }
        keys.add(key);
        return true;
    }

    /**
     * Drop keys so they are processed again. Rewrites the file.
     *
     * @return number of keys actually removed
     */
    public synchronized int remove(Collection<String> toRemove) {
        int before = keys.size();
        keys.removeAll(toRemove);
        int removed = before - keys.size();
        if (removed == 0) {
            return 0;
        }
        StringBuilder sb = new StringBuilder();
        keys.forEach(k -> sb.append(k).append('\n'));
        try {
            AtomicFiles.writeString(file, sb.toString());
        } catch (IOException e) {
            throw new IntegrityException("Cannot rewrite done record " + file, e);
        }
        log.info("Removed {} keys from done record for reprocessing", removed);
        return removed;
    }

    public synchronized Set<String> snapshot() {
        return Set.copyOf(keys);
    }

    public synchronized int size() {
        return keys.size();
    }

    public Path getFile() {
        return file;
    }
}
