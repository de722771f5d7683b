package com.landrecords.ec.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Tracks each batch search run for observability.
 * Stored in the batch_runs table.
 */
@Data
@Builder
public class BatchRun {

    private String runId;
    private String partyName;
    private LocalDate fromDate;
    private LocalDate toDate;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | COMPLETED | SESSION_EXPIRED | CANCELLED | FAILED
    private int targetsTotal;
    private int targetsAttempted;
    private int rowsFound;
    private int errorCount;
    private boolean sessionExpired;
    private boolean cancelled;
}
