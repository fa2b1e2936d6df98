package com.dcruver.litsync.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One line of the audit log: a reconciliation operation or a pipeline item outcome.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditRecord {
    private Instant timestamp;

    // "operation" or "item"
    private String event;

    private String key;
    private String type;
    private String status;
    private String stage;
    private String source;
    private String target;
    private String message;
    private Long durationMs;
}
