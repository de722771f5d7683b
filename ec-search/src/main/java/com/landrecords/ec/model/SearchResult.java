package com.landrecords.ec.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One row returned by the search API, tagged with its target and batch metadata.
 * Append-only: written once per row and never updated.
 */
@Data
@Builder
public class SearchResult {

    private String runId;

    // ── Target ──────────────────────────────────────────────────────────────
    private int districtCode;
    private int talukaCode;
    private int hobliCode;
    private int villageCode;
    private String villageName;

    // ── Remote row ──────────────────────────────────────────────────────────
    /** Fields in the order the remote form returned them, unknown keys included */
    private Map<String, Object> fieldMap;

    // ── Batch metadata ──────────────────────────────────────────────────────
    private String partyName;
    private LocalDate fromDate;
    private LocalDate toDate;
    private LocalDateTime foundAt;
}
