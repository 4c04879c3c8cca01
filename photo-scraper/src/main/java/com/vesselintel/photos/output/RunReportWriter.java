package com.vesselintel.photos.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import com.vesselintel.photos.model.RunSummary;
import com.vesselintel.photos.model.ScrapeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Writes the outcome of each run next to the photos:
 *
 *   {reportPrefix}/{yyyy-MM-dd}/run_{runId}.json   run summary
 *   {reportPrefix}/{yyyy-MM-dd}/run_{runId}.csv    one row per vessel
 *
 * Report failures are logged and swallowed; the photos and index are already written.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunReportWriter {

    private static final String[] HEADERS = {
            "vessel_id", "vessel_name",
            "found", "stored", "total_available",
            "elapsed_ms", "errors"
    };

    private final ObjectStore objectStore;
    private final StorageKeys keys;
    private final ObjectMapper objectMapper;

    public void write(RunSummary summary, List<ScrapeResult> results) {
        String day = LocalDate.now(ZoneOffset.UTC).toString();
        try {
            objectStore.put(keys.reportKey(day, summary.getRunId(), "json"),
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(summary),
                    "application/json");

            if (!results.isEmpty()) {
                objectStore.put(keys.reportKey(day, summary.getRunId(), "csv"),
                        toCsv(results).getBytes(StandardCharsets.UTF_8),
                        "text/csv");
            }
            log.info("Run report {} written ({} vessel rows)", summary.getRunId(), results.size());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write run report {}: {}", summary.getRunId(), e.getMessage());
        }
    }

    String toCsv(List<ScrapeResult> results) throws IOException {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (ScrapeResult r : results) {
                writer.writeNext(toRow(r));
            }
        }
        return out.toString();
    }

    private String[] toRow(ScrapeResult r) {
        return new String[]{
                str(r.getVesselId()),
                str(r.getVesselName()),
                str(r.getFound()),
                str(r.getStored()),
                str(r.getTotalAvailable()),
                str(r.getElapsed() == null ? null : r.getElapsed().toMillis()),
                r.getErrors() == null ? "" : String.join("; ", r.getErrors())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
