package com.vesselintel.photos.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vesselintel.photos.model.RunSummary;
import com.vesselintel.photos.model.ScrapeResult;
import com.vesselintel.photos.support.InMemoryObjectStore;
import com.vesselintel.photos.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RunReportWriterTest {

    private InMemoryObjectStore store;
    private ObjectMapper objectMapper;
    private RunReportWriter writer;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        objectMapper = TestProperties.objectMapper();
        writer = new RunReportWriter(store, new StorageKeys(TestProperties.fast()), objectMapper);
    }

    private static RunSummary summary() {
        return RunSummary.builder()
                .runId("run-1")
                .status("SUCCESS")
                .totalVessels(2)
                .totalItemsStored(3)
                .failedVessels(1)
                .build();
    }

    private static List<ScrapeResult> results() {
        return List.of(
                ScrapeResult.builder().vesselId("1234567").vesselName("Test Carrier")
                        .found(3).stored(3).totalAvailable(3).elapsed(Duration.ofMillis(1500)).build(),
                ScrapeResult.builder().vesselId("7654321").vesselName("Empty, Ltd")
                        .found(0).stored(0).totalAvailable(0).elapsed(Duration.ofMillis(200))
                        .errors(List.of("no photos on site")).build());
    }

    @Test
    @DisplayName("Writes the JSON summary and the CSV table under the report prefix")
    void write_summaryAndCsv() throws Exception {
        writer.write(summary(), results());

        String jsonKey = store.objects().keySet().stream().filter(k -> k.endsWith("run_run-1.json")).findFirst().orElseThrow();
        String csvKey = store.objects().keySet().stream().filter(k -> k.endsWith("run_run-1.csv")).findFirst().orElseThrow();
        assertThat(jsonKey).matches("reports/\\d{4}-\\d{2}-\\d{2}/run_run-1\\.json");
        assertThat(csvKey).startsWith("reports/");

        JsonNode json = objectMapper.readTree(store.objects().get(jsonKey));
        assertThat(json.get("totalItemsStored").asInt()).isEqualTo(3);
        assertThat(json.get("status").asText()).isEqualTo("SUCCESS");

        String csv = new String(store.objects().get(csvKey), StandardCharsets.UTF_8);
        assertThat(csv.lines().toList()).hasSize(3);
        assertThat(csv).startsWith("\"vessel_id\",\"vessel_name\",\"found\",\"stored\"");
        assertThat(csv).contains("\"1234567\",\"Test Carrier\",\"3\",\"3\",\"3\",\"1500\",\"\"");
        assertThat(csv).contains("\"Empty, Ltd\"");
        assertThat(csv).contains("\"no photos on site\"");
    }

    @Test
    @DisplayName("Without vessel rows only the summary is written")
    void write_noResults() {
        writer.write(summary(), List.of());

        assertThat(store.objects()).hasSize(1);
        assertThat(store.objects().keySet().iterator().next()).endsWith(".json");
    }

    @Test
    @DisplayName("Storage failures while reporting are logged, not thrown")
    void write_storageFailureSwallowed() {
        store.failWrites(true);

        assertThatCode(() -> writer.write(summary(), results())).doesNotThrowAnyException();
    }
}
