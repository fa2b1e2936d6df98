package com.dcruver.litsync.state;

import com.dcruver.litsync.io.AtomicFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists the pipeline checkpoint as one JSON document, replaced atomically on every save.
 */
@Slf4j
public class CheckpointStore {

    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public CheckpointStore(Path file) {
        this.file = file;
    }

    public Optional<Checkpoint> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            Checkpoint checkpoint = objectMapper.readValue(Files.readString(file), Checkpoint.class);
            log.info("Loaded checkpoint: {} processed, {} failed, {} queued",
                checkpoint.getProcessedKeys().size(), checkpoint.getFailedKeys().size(),
                checkpoint.getPendingQueue().size());
            return Optional.of(checkpoint);
        } catch (IOException e) {
            throw new IntegrityException("Checkpoint " + file + " is unreadable; delete it to start fresh", e);
        }
    }

    public void save(Checkpoint checkpoint) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(checkpoint);
            AtomicFiles.writeString(file, json);
            log.debug("Checkpoint saved ({} processed)", checkpoint.getProcessedKeys().size());
        } catch (IOException e) {
            throw new IntegrityException("Cannot write checkpoint " + file, e);
        }
    }

    public void delete() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Run complete, checkpoint removed");
            }
        } catch (IOException e) {
            throw new IntegrityException("Cannot delete checkpoint " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
