package com.vesselintel.photos.model;

import lombok.Builder;
import lombok.Data;

/**
 * Run-level statistics. Serialised as JSON into the run report prefix
 * and exposed on the status endpoint.
 */
@Data
@Builder
public class RunSummary {

    private String runId;               // UUID
    private String startedAt;
    private String completedAt;
    private String status;              // SUCCESS | UP_TO_DATE | ABORTED
    private int sourceVessels;          // vessels returned by the source
    private int alreadyIndexed;         // skipped via the index
    private int totalVessels;           // vessels scheduled this run
    private int totalItemsStored;
    private int failedVessels;
    private long elapsedMs;
    private String errorMessage;        // null on success
}
