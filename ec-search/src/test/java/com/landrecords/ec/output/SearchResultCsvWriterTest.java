package com.landrecords.ec.output;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.landrecords.ec.config.EcSearchProperties;
import com.landrecords.ec.model.SearchResult;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SearchResultCsvWriterTest {

    @TempDir
    Path outputDir;

    private EcSearchProperties properties;
    private SearchResultCsvWriter writer;

    @BeforeEach
    void setUp() {
        properties = new EcSearchProperties();
        properties.getOutput().getCsv().setOutputDir(outputDir.toString());
        writer = new SearchResultCsvWriter(properties, JsonMapper.builder().build());
    }

    private SearchResult result(int village, Map<String, Object> fields) {
        return SearchResult.builder()
                .runId("run-1")
                .districtCode(10).talukaCode(20).hobliCode(30).villageCode(village)
                .villageName("Village " + village)
                .partyName("Ramesh Gowda")
                .fromDate(LocalDate.of(2020, 1, 1))
                .toDate(LocalDate.of(2024, 12, 31))
                .foundAt(LocalDateTime.of(2024, 6, 1, 10, 0))
                .fieldMap(fields)
                .build();
    }

    private List<String[]> read(Path file) throws Exception {
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile(), StandardCharsets.UTF_8))) {
            return reader.readAll();
        }
    }

    @Test
    void appendsAcrossTargetsUnderOneHeader() throws Exception {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("DocumentNo", "ANK-1-2021");
        first.put("Executant", "Ramesh Gowda");

        Path file = writer.write(List.of(result(40, first)));
        writer.write(List.of(result(41, Map.of("DocumentNo", "ANK-9-2022"))));

        assertThat(file.getFileName().toString()).isEqualTo("ec_Ramesh_Gowda_run-1.csv");
        List<String[]> rows = read(file);
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).endsWith("DocumentNo", "Executant", "extra_fields");
        assertThat(rows.get(1)).contains("40", "ANK-1-2021", "Ramesh Gowda");
        assertThat(rows.get(2)).contains("41", "ANK-9-2022");
    }

    @Test
    void unknownLaterFieldsGoToExtraColumn() throws Exception {
        writer.write(List.of(result(40, Map.of("DocumentNo", "A"))));

        Map<String, Object> later = new LinkedHashMap<>();
        later.put("DocumentNo", "B");
        later.put("Remarks", "mortgage");
        Path file = writer.write(List.of(result(41, later)));

        String[] row = read(file).get(2);
        assertThat(row[row.length - 1]).isEqualTo("{\"Remarks\":\"mortgage\"}");
        assertThat(row[row.length - 2]).isEqualTo("B");
    }

    @Test
    void recoversColumnsFromExistingFile() throws Exception {
        writer.write(List.of(result(40, Map.of("DocumentNo", "A"))));

        SearchResultCsvWriter restarted = new SearchResultCsvWriter(properties, JsonMapper.builder().build());
        Path file = restarted.write(List.of(result(41, Map.of("DocumentNo", "B"))));

        List<String[]> rows = read(file);
        assertThat(rows).hasSize(3);
        assertThat(rows.get(2)[rows.get(2).length - 2]).isEqualTo("B");
    }

    @Test
    void headerlessFileIsReopenedWithoutTreatingDataAsHeader() throws Exception {
        properties.getOutput().getCsv().setIncludeHeader(false);
        writer.write(List.of(result(40, Map.of("DocumentNo", "A"))));

        SearchResultCsvWriter restarted = new SearchResultCsvWriter(properties, JsonMapper.builder().build());
        Path file = restarted.write(List.of(result(41, Map.of("DocumentNo", "B"))));

        List<String[]> rows = read(file);
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)[0]).isEqualTo("run-1");
        String[] second = rows.get(1);
        assertThat(second[second.length - 2]).isEqualTo("B");
        assertThat(second[second.length - 1]).isEmpty();
    }

    @Test
    void nothingWrittenForEmptyBatch() {
        assertThat(writer.write(List.of())).isNull();
        assertThat(outputDir.toFile().list()).isEmpty();
    }
}
