package com.vesselintel.photos.service;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.http.ResilientSiteClient;
import com.vesselintel.photos.model.DiscoveryResult;
import com.vesselintel.photos.model.RunSummary;
import com.vesselintel.photos.model.ScrapeResult;
import com.vesselintel.photos.model.VesselId;
import com.vesselintel.photos.model.VesselTarget;
import com.vesselintel.photos.output.ObjectStore;
import com.vesselintel.photos.output.RunReportWriter;
import com.vesselintel.photos.output.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one scrape run:
 *
 *  1. verify the object store is reachable (fatal otherwise)
 *  2. load the vessel index and the vessel list, skip vessels already indexed
 *  3. discover and archive photos batch by batch, vessels within a batch in parallel
 *  4. flush the index once for vessels that got at least one photo stored
 *  5. write the run report
 *
 * A vessel that fails is counted and the batch carries on. A storage failure is
 * shared across the run: vessels and photos not yet started are skipped without
 * contacting the site, and no further batch is scheduled. Vessels finished before
 * it are still indexed and reported.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PhotoScrapeService {

    private final VesselSource vesselSource;
    private final VesselIndexService vesselIndex;
    private final PhotoDiscoveryService discoveryService;
    private final PhotoArchiveService archiveService;
    private final ResilientSiteClient siteClient;
    private final ObjectStore objectStore;
    private final RunReportWriter reportWriter;
    private final PhotoScraperProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile RunSummary lastSummary;

    /**
     * Runs unless a run is already in progress.
     *
     * @return empty when skipped because another run holds the lock
     */
    public Optional<RunSummary> runIfIdle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Scrape run already in progress - skipping trigger");
            return Optional.empty();
        }
        try {
            return Optional.of(run());
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<RunSummary> lastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    /**
     * Executes a full run.
     *
     * @throws StorageException when storage or the index cannot be reached before any vessel is scheduled
     */
    public RunSummary run() {
        Instant startedAt = Instant.now();
        String runId = UUID.randomUUID().toString();
        log.info("Starting scrape run {} against {}", runId, objectStore.describe());

        objectStore.verifyAccess();
        vesselIndex.load();
        siteClient.resetSessions();

        List<VesselTarget> vessels = vesselSource.fetchVessels();
        List<VesselTarget> toScrape = vessels.stream()
                .filter(v -> !vesselIndex.contains(v.id()))
                .toList();
        int alreadyIndexed = vessels.size() - toScrape.size();

        log.info("Vessels from source: {}, already archived: {}, to scrape: {}",
                vessels.size(), alreadyIndexed, toScrape.size());

        RunSummary.RunSummaryBuilder summary = RunSummary.builder()
                .runId(runId)
                .startedAt(startedAt.toString())
                .sourceVessels(vessels.size())
                .alreadyIndexed(alreadyIndexed)
                .totalVessels(toScrape.size());

        List<ScrapeResult> results = new ArrayList<>();
        String abortReason = null;

        if (toScrape.isEmpty()) {
            log.info("Gallery is up to date - nothing to scrape");
            summary.status("UP_TO_DATE");
        } else {
            abortReason = processInBatches(toScrape, results);
            summary.status(abortReason == null ? "SUCCESS" : "ABORTED");
        }

        int stored = 0;
        int failed = 0;
        for (ScrapeResult result : results) {
            stored += result.getStored();
            if (result.isSuccessful()) {
                vesselIndex.markPending(VesselId.of(result.getVesselId()));
            } else {
                failed++;
            }
        }
        // vessels never started because of an abort count as failed
        failed += toScrape.size() - results.size();

        try {
            vesselIndex.flush();
        } catch (StorageException e) {
            log.error("Vessel index flush failed - run {} results are stored but not indexed: {}", runId, e.getMessage(), e);
            abortReason = abortReason == null ? "index flush failed: " + e.getMessage() : abortReason;
        }

        Instant completedAt = Instant.now();
        RunSummary finished = summary
                .completedAt(completedAt.toString())
                .totalItemsStored(stored)
                .failedVessels(failed)
                .elapsedMs(Duration.between(startedAt, completedAt).toMillis())
                .errorMessage(abortReason)
                .build();

        logSummary(finished, results);
        reportWriter.write(finished, results);
        lastSummary = finished;
        return finished;
    }

    /**
     * Scrapes one vessel: discovery followed by archiving.
     *
     * @throws StorageException when a photo could not be written
     */
    public ScrapeResult scrapeVessel(VesselTarget vessel) {
        return scrapeVessel(vessel, new AtomicReference<>());
    }

    private ScrapeResult scrapeVessel(VesselTarget vessel, AtomicReference<StorageException> abortSignal) {
        throwIfAborted(vessel, abortSignal);
        Instant start = Instant.now();
        ScrapeResult.ScrapeResultBuilder result = ScrapeResult.builder()
                .vesselId(vessel.id().value())
                .vesselName(vessel.displayName());

        DiscoveryResult discovery = discoveryService.discover(vessel.id());
        result.totalAvailable(discovery.totalReported());

        if (discovery.isEmpty()) {
            List<String> errors = new ArrayList<>();
            errors.add(discovery.totalReported() == 0 ? "no photos on site" : "gallery unavailable");
            log.warn("IMO {} ({}): no photo ids found", vessel.id(), vessel.displayName());
            return result.found(0).stored(0).errors(errors).elapsed(Duration.between(start, Instant.now())).build();
        }

        throwIfAborted(vessel, abortSignal);
        log.info("Downloading {} photos for {} (IMO {})", discovery.items().size(), vessel.displayName(), vessel.id());
        PhotoArchiveService.ArchiveBatch batch = archiveService.archiveAll(vessel, discovery.items(), abortSignal);
        Duration elapsed = Duration.between(start, Instant.now());

        if (batch.stored() > 0) {
            log.info("IMO {}: {}/{} photos stored in {}s", vessel.id(), batch.stored(), batch.found(), elapsed.toSeconds());
        } else {
            log.warn("IMO {}: no photos stored out of {}", vessel.id(), batch.found());
        }

        return result
                .found(batch.found())
                .stored(batch.stored())
                .errors(new ArrayList<>(batch.errors()))
                .elapsed(elapsed)
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * @return abort reason, or null when every batch ran
     */
    private String processInBatches(List<VesselTarget> vessels, List<ScrapeResult> results) {
        PhotoScraperProperties.Concurrency concurrency = properties.getConcurrency();
        int batchSize = Math.max(1, concurrency.getBatchSize());
        int totalBatches = (vessels.size() + batchSize - 1) / batchSize;

        AtomicReference<StorageException> abortSignal = new AtomicReference<>();
        ExecutorService vesselPool = Executors.newFixedThreadPool(
                Math.max(1, Math.min(concurrency.getBatchVessels(), batchSize)),
                new CustomizableThreadFactory("vessel-"));
        try {
            for (int start = 0; start < vessels.size(); start += batchSize) {
                List<VesselTarget> batch = vessels.subList(start, Math.min(start + batchSize, vessels.size()));
                log.info("Batch {}/{} ({} vessels)", start / batchSize + 1, totalBatches, batch.size());

                String abortReason = runBatch(batch, vesselPool, abortSignal, results);
                if (abortReason != null) {
                    log.error("Aborting run: {}", abortReason);
                    return abortReason;
                }
            }
            return null;
        } finally {
            vesselPool.shutdown();
        }
    }

    private String runBatch(List<VesselTarget> batch, ExecutorService vesselPool,
                            AtomicReference<StorageException> abortSignal, List<ScrapeResult> results) {
        List<CompletableFuture<ScrapeResult>> tasks = batch.stream()
                .map(vessel -> CompletableFuture.supplyAsync(() -> scrapeVessel(vessel, abortSignal), vesselPool))
                .toList();

        for (int i = 0; i < tasks.size(); i++) {
            VesselTarget vessel = batch.get(i);
            try {
                results.add(tasks.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof VesselSkippedException) {
                    log.warn("IMO {} skipped: run aborted after a storage failure", vessel.id());
                } else if (cause instanceof StorageException se) {
                    abortSignal.compareAndSet(null, se);
                    log.error("Storage failure while archiving IMO {}: {}", vessel.id(), cause.getMessage(), cause);
                } else {
                    log.error("Error processing IMO {}: {}", vessel.id(), cause.getMessage(), cause);
                }
                List<String> errors = new ArrayList<>();
                errors.add(cause.getClass().getSimpleName() + ": " + cause.getMessage());
                results.add(ScrapeResult.builder()
                        .vesselId(vessel.id().value())
                        .vesselName(vessel.displayName())
                        .totalAvailable(DiscoveryResult.UNKNOWN_TOTAL)
                        .elapsed(Duration.ZERO)
                        .errors(errors)
                        .build());
            }
        }
        StorageException failure = abortSignal.get();
        return failure == null ? null : "storage failure: " + failure.getMessage();
    }

    private static void throwIfAborted(VesselTarget vessel, AtomicReference<StorageException> abortSignal) {
        StorageException failure = abortSignal.get();
        if (failure != null) {
            throw new VesselSkippedException(vessel, failure);
        }
    }

    /** A vessel not scraped because an earlier storage failure aborted the run. */
    static final class VesselSkippedException extends StorageException {

        VesselSkippedException(VesselTarget vessel, StorageException cause) {
            super("IMO " + vessel.id() + " skipped after storage failure: " + cause.getMessage(), cause);
        }
    }

    private void logSummary(RunSummary summary, List<ScrapeResult> results) {
        log.info("============================================================");
        log.info("SCRAPE RUN {} COMPLETE - {}", summary.getRunId(), summary.getStatus());
        log.info("Vessels from source: {}", summary.getSourceVessels());
        log.info("Already archived:    {}", summary.getAlreadyIndexed());
        log.info("Vessels scraped:     {}", summary.getTotalVessels());
        log.info("Photos stored:       {}", summary.getTotalItemsStored());
        log.info("Failed vessels:      {}", summary.getFailedVessels());
        log.info("Total time:          {}s", summary.getElapsedMs() / 1000.0);

        if (!results.isEmpty()) {
            double avgSeconds = results.stream()
                    .mapToLong(r -> r.getElapsed() == null ? 0 : r.getElapsed().toMillis())
                    .average()
                    .orElse(0) / 1000.0;
            log.info("Average per vessel:  {}s", String.format("%.1f", avgSeconds));
        }
        if (summary.getErrorMessage() != null) {
            log.error("Run ended early: {}", summary.getErrorMessage());
        }
        log.info("============================================================");
    }
}
