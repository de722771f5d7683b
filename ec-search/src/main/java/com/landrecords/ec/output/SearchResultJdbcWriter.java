package com.landrecords.ec.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrecords.ec.model.BatchRun;
import com.landrecords.ec.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Append-only result rows and one tracking row per batch run, in the embedded database.
 * Each remote row keeps its fields, in arrival order, as a JSON document.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchResultJdbcWriter {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void ensureSchema() {
        log.info("Ensuring search result schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_results
            (
                id              BIGINT AUTO_INCREMENT PRIMARY KEY,
                run_id          VARCHAR(64) NOT NULL,
                district_code   INT NOT NULL,
                taluka_code     INT NOT NULL,
                hobli_code      INT NOT NULL,
                village_code    INT NOT NULL,
                village_name    VARCHAR(255),
                party_name      VARCHAR(255) NOT NULL,
                from_date       DATE,
                to_date         DATE,
                found_at        TIMESTAMP NOT NULL,
                field_map       CLOB
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_search_results_run ON search_results (run_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS batch_runs
            (
                run_id              VARCHAR(64) PRIMARY KEY,
                party_name          VARCHAR(255) NOT NULL,
                from_date           DATE,
                to_date             DATE,
                started_at          TIMESTAMP NOT NULL,
                completed_at        TIMESTAMP,
                status              VARCHAR(32) NOT NULL,
                targets_total       INT,
                targets_attempted   INT,
                rows_found          INT,
                error_count         INT,
                session_expired     BOOLEAN,
                cancelled           BOOLEAN
            )
        """);

        log.info("Search result schema ready.");
    }

    public void write(List<SearchResult> results) {
        if (results.isEmpty()) return;

        List<Object[]> batch = new ArrayList<>(results.size());
        for (SearchResult r : results) {
            batch.add(new Object[]{
                    r.getRunId(),
                    r.getDistrictCode(),
                    r.getTalukaCode(),
                    r.getHobliCode(),
                    r.getVillageCode(),
                    r.getVillageName(),
                    r.getPartyName(),
                    date(r.getFromDate()),
                    date(r.getToDate()),
                    timestamp(r.getFoundAt()),
                    toJson(r)
            });
        }

        jdbcTemplate.batchUpdate("""
            INSERT INTO search_results
            (run_id, district_code, taluka_code, hobli_code, village_code, village_name,
             party_name, from_date, to_date, found_at, field_map)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, batch);
        log.debug("Wrote {} result rows for run {}", results.size(), results.get(0).getRunId());
    }

    /** Insert or replace the tracking row; called when a run starts and again when it ends. */
    public void writeBatchRun(BatchRun run) {
        jdbcTemplate.update("""
            MERGE INTO batch_runs
            (run_id, party_name, from_date, to_date, started_at, completed_at, status,
             targets_total, targets_attempted, rows_found, error_count, session_expired, cancelled)
            KEY (run_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
                run.getRunId(),
                run.getPartyName(),
                date(run.getFromDate()),
                date(run.getToDate()),
                timestamp(run.getStartedAt()),
                timestamp(run.getCompletedAt()),
                run.getStatus(),
                run.getTargetsTotal(),
                run.getTargetsAttempted(),
                run.getRowsFound(),
                run.getErrorCount(),
                run.isSessionExpired(),
                run.isCancelled());
    }

    public long countByRun(String runId) {
        Long n = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM search_results WHERE run_id = ?", Long.class, runId);
        return n == null ? 0 : n;
    }

    public List<SearchResult> findByRun(String runId) {
        return jdbcTemplate.query("SELECT * FROM search_results WHERE run_id = ? ORDER BY id", (rs, rowNum) -> {
            Date from = rs.getDate("from_date");
            Date to = rs.getDate("to_date");
            return SearchResult.builder()
                    .runId(rs.getString("run_id"))
                    .districtCode(rs.getInt("district_code"))
                    .talukaCode(rs.getInt("taluka_code"))
                    .hobliCode(rs.getInt("hobli_code"))
                    .villageCode(rs.getInt("village_code"))
                    .villageName(rs.getString("village_name"))
                    .partyName(rs.getString("party_name"))
                    .fromDate(from == null ? null : from.toLocalDate())
                    .toDate(to == null ? null : to.toLocalDate())
                    .foundAt(rs.getTimestamp("found_at").toLocalDateTime())
                    .fieldMap(fromJson(rs.getString("field_map")))
                    .build();
        }, runId);
    }

    public Optional<BatchRun> findBatchRun(String runId) {
        List<BatchRun> rows = jdbcTemplate.query("SELECT * FROM batch_runs WHERE run_id = ?", (rs, rowNum) -> {
            Date from = rs.getDate("from_date");
            Date to = rs.getDate("to_date");
            Timestamp completed = rs.getTimestamp("completed_at");
            return BatchRun.builder()
                    .runId(rs.getString("run_id"))
                    .partyName(rs.getString("party_name"))
                    .fromDate(from == null ? null : from.toLocalDate())
                    .toDate(to == null ? null : to.toLocalDate())
                    .startedAt(rs.getTimestamp("started_at").toLocalDateTime())
                    .completedAt(completed == null ? null : completed.toLocalDateTime())
                    .status(rs.getString("status"))
                    .targetsTotal(rs.getInt("targets_total"))
                    .targetsAttempted(rs.getInt("targets_attempted"))
                    .rowsFound(rs.getInt("rows_found"))
                    .errorCount(rs.getInt("error_count"))
                    .sessionExpired(rs.getBoolean("session_expired"))
                    .cancelled(rs.getBoolean("cancelled"))
                    .build();
        }, runId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String toJson(SearchResult r) {
        try {
            return objectMapper.writeValueAsString(r.getFieldMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise result fields for village " + r.getVillageCode(), e);
        }
    }

    private LinkedHashMap<String, Object> fromJson(String json) {
        if (json == null) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, FIELD_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored result fields are unreadable", e);
        }
    }

    private static Date date(LocalDate d) {
        return d == null ? null : Date.valueOf(d);
    }

    private static Timestamp timestamp(LocalDateTime t) {
        return t == null ? null : Timestamp.valueOf(t);
    }
}
