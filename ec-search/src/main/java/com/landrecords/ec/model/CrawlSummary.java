package com.landrecords.ec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outcome of one crawl pass.
 *
 * "Skipped" counts the fetches at that level that failed after every retry; each one means
 * the children of one parent node were not ingested.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlSummary {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private int districtsIngested;
    private int talukasIngested;
    private int hoblisIngested;
    private int villagesIngested;

    private int talukaFetchesSkipped;
    private int hobliFetchesSkipped;
    private int villageFetchesSkipped;

    private int writeFailures;

    /** District subtrees that stopped on an unexpected error. */
    private int subtreeFailures;

    public int totalSkipped() {
        return talukaFetchesSkipped + hobliFetchesSkipped + villageFetchesSkipped;
    }
}
