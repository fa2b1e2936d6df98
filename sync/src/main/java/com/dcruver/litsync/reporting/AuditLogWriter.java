package com.dcruver.litsync.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Appends JSON lines to {@code logs/audit-<timestamp>.jsonl}, one file per invocation.
 * The file is created on the first record.
 */
@Slf4j
public class AuditLogWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Clock clock;
    private final Path logFile;

    public AuditLogWriter(Path logsDir, Clock clock) {
        this.clock = clock;
        String timestamp = TIMESTAMP_FORMAT.withZone(ZoneId.systemDefault()).format(clock.instant());
        this.logFile = logsDir.resolve("audit-" + timestamp + ".jsonl");
    }

    public synchronized void record(AuditRecord record) {
        if (record.getTimestamp() == null) {
            record.setTimestamp(clock.instant());
        }
        try {
            String line = objectMapper.writeValueAsString(record);
            Files.createDirectories(logFile.getParent());
            Files.writeString(logFile, line + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit record for {}: {}", record.getKey(), e.getMessage());
        } catch (IOException e) {
            log.warn("Could not append to audit log {}: {}", logFile, e.getMessage());
        }
    }

    public Path getLogFile() {
        return logFile;
    }
}
