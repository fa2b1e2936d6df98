package com.dcruver.litsync.nlp;

import com.dcruver.litsync.io.AtomicFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of external responses keyed by request fingerprint.
 * <p>
 * Loaded from a JSON file at construction and written through on every put, so a
 * crash never loses a paid-for response. Entries older than the freshness window are
 * treated as misses and dropped.
 */
@Slf4j
public class ResponseCache {

    private final Path cacheFile;
    private final Duration freshness;
    private final Clock clock;
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public ResponseCache(Path cacheFile, Duration freshness, Clock clock) {
        this.cacheFile = cacheFile;
        this.freshness = freshness;
        this.clock = clock;
        load();
    }

    private void load() {
        if (!Files.exists(cacheFile)) {
            log.info("No existing response cache found, starting fresh");
            return;
        }
        try {
            Map<String, CacheEntry> loaded = objectMapper.readValue(Files.readString(cacheFile),
                objectMapper.getTypeFactory().constructMapType(HashMap.class, String.class, CacheEntry.class));
            cache.putAll(loaded);
            log.info("Loaded response cache with {} entries", cache.size());
        } catch (IOException e) {
            log.error("Response cache {} is unreadable, starting empty: {}", cacheFile, e.getMessage());
        }
    }

    public Optional<JsonNode> get(String fingerprint) {
        CacheEntry entry = cache.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        if (!isFresh(entry)) {
            log.debug("Cache entry {} expired (cached at {})", shorten(fingerprint), entry.getCachedAt());
            cache.remove(fingerprint);
            return Optional.empty();
        }
        log.debug("Cache hit for {}", shorten(fingerprint));
        return Optional.of(entry.getResponse());
    }

    public synchronized void put(String fingerprint, JsonNode response) throws IOException {
        CacheEntry entry = new CacheEntry();
        entry.setCachedAt(clock.instant());
        entry.setResponse(response);
        cache.put(fingerprint, entry);
        save();
    }

    public synchronized int clear() throws IOException {
        int size = cache.size();
        cache.clear();
        save();
        log.info("Cleared response cache ({} entries)", size);
        return size;
    }

    public CacheStats getStats() {
        CacheStats stats = new CacheStats();
        stats.setFile(cacheFile.toString());
        stats.setSize(cache.size());
        int fresh = (int) cache.values().stream().filter(this::isFresh).count();
        stats.setFreshCount(fresh);
        stats.setStaleCount(cache.size() - fresh);
        stats.setFreshness(freshness);
        return stats;
    }

    private boolean isFresh(CacheEntry entry) {
        return entry.getCachedAt() != null
            && !entry.getCachedAt().plus(freshness).isBefore(clock.instant());
    }

    private void save() throws IOException {
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(cache);
        AtomicFiles.writeString(cacheFile, json);
    }

    private static String shorten(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }

    @Data
    public static class CacheEntry {
        private Instant cachedAt;
        private JsonNode response;
    }

    @Data
    public static class CacheStats {
        private String file;
        private int size;
        private int freshCount;
        private int staleCount;
        private Duration freshness;
    }
}
