package com.landrecords.ec.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landrecords.ec.model.CrawlSummary;
import com.landrecords.ec.model.District;
import com.landrecords.ec.model.Hobli;
import com.landrecords.ec.model.LocationMatch;
import com.landrecords.ec.model.Taluka;
import com.landrecords.ec.model.Village;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable district / taluka / hobli / village tables.
 *
 * Upserts are keyed by code (village: code + hobli code) so a re-crawl replaces rows
 * instead of duplicating them. Children are rejected unless their parent is already stored.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class LocationStore {

    private static final String META_LAST_UPDATED = "last_updated";
    private static final String META_STATS = "stats";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final RowMapper<District> DISTRICT_MAPPER = (rs, rowNum) -> new District(
            rs.getInt("code"),
            rs.getString("name"),
            rs.getString("localized_name")
    );

    private static final RowMapper<Taluka> TALUKA_MAPPER = (rs, rowNum) -> new Taluka(
            rs.getInt("code"),
            rs.getString("name"),
            rs.getString("localized_name"),
            rs.getInt("district_code")
    );

    private static final RowMapper<Hobli> HOBLI_MAPPER = (rs, rowNum) -> new Hobli(
            rs.getInt("code"),
            rs.getString("name"),
            rs.getString("localized_name"),
            rs.getInt("taluka_code")
    );

    private static final RowMapper<Village> VILLAGE_MAPPER = (rs, rowNum) -> new Village(
            rs.getInt("code"),
            rs.getString("name"),
            rs.getString("localized_name"),
            rs.getInt("hobli_code"),
            rs.getBoolean("is_urban")
    );

    public void ensureSchema() {
        log.info("Ensuring location schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS district
            (
                code            INT PRIMARY KEY,
                name            VARCHAR(255) NOT NULL,
                localized_name  VARCHAR(255)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS taluka
            (
                code            INT PRIMARY KEY,
                name            VARCHAR(255) NOT NULL,
                localized_name  VARCHAR(255),
                district_code   INT NOT NULL,
                FOREIGN KEY (district_code) REFERENCES district (code)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS hobli
            (
                code            INT PRIMARY KEY,
                name            VARCHAR(255) NOT NULL,
                localized_name  VARCHAR(255),
                taluka_code     INT NOT NULL,
                FOREIGN KEY (taluka_code) REFERENCES taluka (code)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS village
            (
                code            INT NOT NULL,
                hobli_code      INT NOT NULL,
                name            VARCHAR(255) NOT NULL,
                localized_name  VARCHAR(255),
                is_urban        BOOLEAN DEFAULT FALSE,
                PRIMARY KEY (code, hobli_code),
                FOREIGN KEY (hobli_code) REFERENCES hobli (code)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS crawl_metadata
            (
                meta_key        VARCHAR(64) PRIMARY KEY,
                meta_value      CLOB
            )
        """);

        log.info("Location schema ready.");
    }

    // ── Upserts ──────────────────────────────────────────────────────────────

    public void upsertDistrict(District d) {
        jdbcTemplate.update("""
            MERGE INTO district (code, name, localized_name) KEY (code)
            VALUES (?, ?, ?)
            """, d.code(), d.name(), d.localizedName());
    }

    public void upsertTaluka(Taluka t) {
        requireParent("district", t.districtCode(), "taluka", t.code());
        merge("taluka", t.code(), """
            MERGE INTO taluka (code, name, localized_name, district_code) KEY (code)
            VALUES (?, ?, ?, ?)
            """, t.code(), t.name(), t.localizedName(), t.districtCode());
    }

    public void upsertHobli(Hobli h) {
        requireParent("taluka", h.talukaCode(), "hobli", h.code());
        merge("hobli", h.code(), """
            MERGE INTO hobli (code, name, localized_name, taluka_code) KEY (code)
            VALUES (?, ?, ?, ?)
            """, h.code(), h.name(), h.localizedName(), h.talukaCode());
    }

    public void upsertVillage(Village v) {
        requireParent("hobli", v.hobliCode(), "village", v.code());
        merge("village", v.code(), """
            MERGE INTO village (code, hobli_code, name, localized_name, is_urban) KEY (code, hobli_code)
            VALUES (?, ?, ?, ?, ?)
            """, v.code(), v.hobliCode(), v.name(), v.localizedName(), v.urban());
    }

    // ── Listings (ordered by display name) ───────────────────────────────────

    public List<District> listDistricts() {
        return jdbcTemplate.query("SELECT * FROM district ORDER BY name, code", DISTRICT_MAPPER);
    }

    public List<Taluka> listTalukas(Integer districtCode) {
        if (districtCode == null) {
            return jdbcTemplate.query("SELECT * FROM taluka ORDER BY name, code", TALUKA_MAPPER);
        }
        return jdbcTemplate.query("SELECT * FROM taluka WHERE district_code = ? ORDER BY name, code",
                TALUKA_MAPPER, districtCode);
    }

    public List<Hobli> listHoblis(Integer talukaCode) {
        if (talukaCode == null) {
            return jdbcTemplate.query("SELECT * FROM hobli ORDER BY name, code", HOBLI_MAPPER);
        }
        return jdbcTemplate.query("SELECT * FROM hobli WHERE taluka_code = ? ORDER BY name, code",
                HOBLI_MAPPER, talukaCode);
    }

    public List<Village> listVillages(Integer hobliCode) {
        if (hobliCode == null) {
            return jdbcTemplate.query("SELECT * FROM village ORDER BY name, code, hobli_code", VILLAGE_MAPPER);
        }
        return jdbcTemplate.query("SELECT * FROM village WHERE hobli_code = ? ORDER BY name, code",
                VILLAGE_MAPPER, hobliCode);
    }

    public Optional<District> findDistrict(int code) {
        List<District> rows = jdbcTemplate.query("SELECT * FROM district WHERE code = ?", DISTRICT_MAPPER, code);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Taluka> findTaluka(int code) {
        List<Taluka> rows = jdbcTemplate.query("SELECT * FROM taluka WHERE code = ?", TALUKA_MAPPER, code);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Hobli> findHobli(int code) {
        List<Hobli> rows = jdbcTemplate.query("SELECT * FROM hobli WHERE code = ?", HOBLI_MAPPER, code);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Districts, talukas and hoblis whose English name contains {@code term} (case-insensitive)
     * or whose code equals it, in hierarchy order then by name.
     */
    public List<LocationMatch> search(String term) {
        if (term == null || term.isBlank()) {
            return List.of();
        }
        String trimmed = term.trim();
        String like = "%" + trimmed.toLowerCase().replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
        int code = trimmed.matches("\\d{1,9}") ? Integer.parseInt(trimmed) : -1;

        List<LocationMatch> matches = new ArrayList<>();
        matches.addAll(jdbcTemplate.query("""
            SELECT code, name, localized_name FROM district
            WHERE LOWER(name) LIKE ? ESCAPE '\\' OR code = ?
            ORDER BY name, code
            """, (rs, rowNum) -> new LocationMatch(LocationMatch.Level.DISTRICT,
                rs.getInt("code"), rs.getString("name"), rs.getString("localized_name"),
                null, null, null, null), like, code));

        matches.addAll(jdbcTemplate.query("""
            SELECT t.code, t.name, t.localized_name, d.code AS district_code, d.name AS district_name
            FROM taluka t
            JOIN district d ON t.district_code = d.code
            WHERE LOWER(t.name) LIKE ? ESCAPE '\\' OR t.code = ?
            ORDER BY t.name, t.code
            """, (rs, rowNum) -> new LocationMatch(LocationMatch.Level.TALUKA,
                rs.getInt("code"), rs.getString("name"), rs.getString("localized_name"),
                null, null, rs.getInt("district_code"), rs.getString("district_name")), like, code));

        matches.addAll(jdbcTemplate.query("""
            SELECT h.code, h.name, h.localized_name, t.code AS taluka_code, t.name AS taluka_name,
                   d.code AS district_code, d.name AS district_name
            FROM hobli h
            JOIN taluka t ON h.taluka_code = t.code
            JOIN district d ON t.district_code = d.code
            WHERE LOWER(h.name) LIKE ? ESCAPE '\\' OR h.code = ?
            ORDER BY h.name, h.code
            """, (rs, rowNum) -> new LocationMatch(LocationMatch.Level.HOBLI,
                rs.getInt("code"), rs.getString("name"), rs.getString("localized_name"),
                rs.getInt("taluka_code"), rs.getString("taluka_name"),
                rs.getInt("district_code"), rs.getString("district_name")), like, code));
        return matches;
    }

    /** Row counts per level, in hierarchy order. */
    public Map<String, Long> counts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : List.of("district", "taluka", "hobli", "village")) {
            Long n = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            counts.put(table, n == null ? 0L : n);
        }
        return counts;
    }

    // ── Crawl metadata ───────────────────────────────────────────────────────

    public void recordCrawlSummary(CrawlSummary summary) {
        try {
            putMetadata(META_STATS, objectMapper.writeValueAsString(summary));
            putMetadata(META_LAST_UPDATED, String.valueOf(
                    summary.getCompletedAt() != null ? summary.getCompletedAt() : LocalDateTime.now()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise crawl summary", e);
        }
    }

    public Optional<CrawlSummary> lastCrawlSummary() {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT meta_value FROM crawl_metadata WHERE meta_key = ?", String.class, META_STATS);
        if (rows.isEmpty()) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(rows.get(0), CrawlSummary.class));
        } catch (JsonProcessingException e) {
            log.warn("Stored crawl summary is unreadable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void putMetadata(String key, String value) {
        jdbcTemplate.update("MERGE INTO crawl_metadata (meta_key, meta_value) KEY (meta_key) VALUES (?, ?)",
                key, value);
    }

    private void requireParent(String parentTable, int parentCode, String childLevel, int childCode) {
        Integer found = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + parentTable + " WHERE code = ?", Integer.class, parentCode);
        if (found == null || found == 0) {
            throw new ReferentialIntegrityException(childLevel, childCode, parentTable, parentCode);
        }
    }

    private void merge(String level, int code, String sql, Object... args) {
        try {
            jdbcTemplate.update(sql, args);
        } catch (DataIntegrityViolationException e) {
            // parent removed between the check and the write
            throw new ReferentialIntegrityException("Cannot write " + level + " " + code + ": " + e.getMessage(), e);
        }
    }
}
