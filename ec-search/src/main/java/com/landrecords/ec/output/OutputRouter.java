package com.landrecords.ec.output;

import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.BatchRun;
import com.landrecords.ec.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes search results to the configured sink(s): JDBC, CSV, or BOTH.
 * Batch run tracking always goes to the database.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final SearchResultJdbcWriter jdbcWriter;
    private final SearchResultCsvWriter csvWriter;
    private final EcSearchProperties properties;

    public void write(List<SearchResult> results) {
        EcSearchProperties.Output.OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case JDBC -> jdbcWriter.write(results);
            case CSV -> csvWriter.write(results);
            case BOTH -> {
                jdbcWriter.write(results);
                csvWriter.write(results);
            }
        }
    }

    public void writeBatchRun(BatchRun run) {
        try {
            jdbcWriter.writeBatchRun(run);
        } catch (RuntimeException e) {
            log.warn("Failed to write batch run {}: {}", run.getRunId(), e.getMessage());
        }
    }
}
