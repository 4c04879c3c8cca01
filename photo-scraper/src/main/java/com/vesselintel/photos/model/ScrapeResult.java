package com.vesselintel.photos.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-vessel outcome of one run. Feeds the run summary and the CSV report.
 */
@Data
@Builder
public class ScrapeResult {

    private String vesselId;
    private String vesselName;
    private int found;              // photo ids attempted
    private int stored;             // photos written to storage
    private int totalAvailable;     // site-reported count, -1 when unknown
    private Duration elapsed;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isSuccessful() {
        return stored > 0;
    }
}
