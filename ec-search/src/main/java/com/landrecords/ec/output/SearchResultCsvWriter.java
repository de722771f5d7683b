package com.landrecords.ec.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends search results to one CSV file per run.
 *
 * Output path pattern: {outputDir}/ec_{party}_{runId}.csv
 *
 * Columns are the fixed target/batch columns, then the remote fields of the first row
 * written to the file, then {@code extra_fields} holding any later field the header does
 * not name, as JSON. Rows are flushed as each target completes, so a run that stops early
 * still leaves everything found so far on disk.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchResultCsvWriter {

    static final String[] FIXED_HEADERS = {
            "run_id", "district_code", "taluka_code", "hobli_code", "village_code", "village_name",
            "party_name", "from_date", "to_date", "found_at"
    };
    static final String EXTRA_FIELDS = "extra_fields";

    private final EcSearchProperties properties;
    private final ObjectMapper objectMapper;

    /** Remote field columns per file, fixed once the first row is written. */
    private final Map<Path, List<String>> fieldColumns = new HashMap<>();

    public synchronized Path write(List<SearchResult> results) {
        if (results.isEmpty()) return null;

        SearchResult first = results.get(0);
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(fileName(first.getPartyName(), first.getRunId()));

        boolean newFile = !Files.exists(outputPath);
        boolean includeHeader = properties.getOutput().getCsv().isIncludeHeader();
        // without a header line there is nothing to recover, so the first batch fixes the columns
        List<String> columns = fieldColumns.computeIfAbsent(outputPath,
                p -> newFile || !includeHeader ? new ArrayList<>(first.getFieldMap().keySet()) : readFieldColumns(p));

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8, true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && includeHeader) {
                writer.writeNext(header(columns));
            }
            for (SearchResult r : results) {
                writer.writeNext(toRow(r, columns));
            }
            log.info("Appended {} rows to CSV: {}", results.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    static String fileName(String partyName, String runId) {
        String party = partyName == null ? "unknown" : partyName.trim().replaceAll("[^A-Za-z0-9]+", "_");
        return String.format("ec_%s_%s.csv", party, runId);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String[] header(List<String> columns) {
        List<String> header = new ArrayList<>(Arrays.asList(FIXED_HEADERS));
        header.addAll(columns);
        header.add(EXTRA_FIELDS);
        return header.toArray(String[]::new);
    }

    private String[] toRow(SearchResult r, List<String> columns) {
        List<String> row = new ArrayList<>(List.of(
                str(r.getRunId()),
                str(r.getDistrictCode()),
                str(r.getTalukaCode()),
                str(r.getHobliCode()),
                str(r.getVillageCode()),
                str(r.getVillageName()),
                str(r.getPartyName()),
                str(r.getFromDate()),
                str(r.getToDate()),
                str(r.getFoundAt())));

        Map<String, Object> extra = new LinkedHashMap<>(r.getFieldMap());
        for (String column : columns) {
            row.add(str(extra.remove(column)));
        }
        row.add(extra.isEmpty() ? "" : json(extra));
        return row.toArray(String[]::new);
    }

    /** Recovers the remote field columns from an existing file's header. */
    private List<String> readFieldColumns(Path file) {
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile(), StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null || header.length < FIXED_HEADERS.length + 1) {
                return new ArrayList<>();
            }
            return new ArrayList<>(Arrays.asList(header).subList(FIXED_HEADERS.length, header.length - 1));
        } catch (IOException | CsvValidationException e) {
            throw new IllegalStateException("Cannot read header of existing CSV " + file, e);
        }
    }

    private String json(Map<String, Object> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise extra result fields", e);
        }
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
