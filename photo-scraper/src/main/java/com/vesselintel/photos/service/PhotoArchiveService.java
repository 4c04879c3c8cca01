package com.vesselintel.photos.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vesselintel.photos.http.ResilientSiteClient;
import com.vesselintel.photos.http.SiteResponse;
import com.vesselintel.photos.model.PhotoMetadata;
import com.vesselintel.photos.model.VesselTarget;
import com.vesselintel.photos.output.ObjectStore;
import com.vesselintel.photos.output.StorageException;
import com.vesselintel.photos.output.StorageKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Downloads a vessel's photos and writes each one, with its metadata document,
 * to the object store.
 *
 * One task per photo on the shared I/O pool; the download permit pool in
 * ResilientSiteClient bounds how many actually hit the network. A failed photo
 * is counted and its siblings carry on. A storage failure is not: it is recorded in
 * the abort signal, photos not yet started are skipped without touching the site,
 * and it is rethrown once the tasks already in flight have finished.
 */
@Service
@Slf4j
public class PhotoArchiveService {

    private static final String IMAGE_CONTENT_TYPE = "image/jpeg";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final ResilientSiteClient siteClient;
    private final SiteUrls siteUrls;
    private final ObjectStore objectStore;
    private final StorageKeys keys;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public PhotoArchiveService(ResilientSiteClient siteClient,
                               SiteUrls siteUrls,
                               ObjectStore objectStore,
                               StorageKeys keys,
                               ObjectMapper objectMapper,
                               ExecutorService scrapeIoExecutor) {
        this.siteClient = siteClient;
        this.siteUrls = siteUrls;
        this.objectStore = objectStore;
        this.keys = keys;
        this.objectMapper = objectMapper;
        this.executor = scrapeIoExecutor;
    }

    public record ArchiveBatch(int found, int stored, List<String> errors) {}

    /**
     * Archives every photo id for the vessel and waits for all of them.
     *
     * @throws StorageException if any write failed; raised after all tasks completed
     */
    public ArchiveBatch archiveAll(VesselTarget vessel, Collection<String> photoIds) {
        return archiveAll(vessel, photoIds, new AtomicReference<>());
    }

    /**
     * As {@link #archiveAll(VesselTarget, Collection)}, sharing a run-wide abort signal.
     * The first storage failure is stored in {@code abortSignal}; once it is set, no
     * further photo of this or any other vessel sharing the signal is downloaded.
     */
    public ArchiveBatch archiveAll(VesselTarget vessel, Collection<String> photoIds,
                                   AtomicReference<StorageException> abortSignal) {
        if (photoIds.isEmpty()) {
            return new ArchiveBatch(0, 0, List.of());
        }

        AtomicInteger processed = new AtomicInteger();
        AtomicInteger stored = new AtomicInteger();
        List<String> errors = Collections.synchronizedList(new ArrayList<>());
        int total = photoIds.size();

        List<CompletableFuture<Boolean>> tasks = new ArrayList<>(total);
        for (String photoId : photoIds) {
            tasks.add(CompletableFuture
                    .supplyAsync(() -> archiveUnlessAborted(vessel, photoId, abortSignal), executor)
                    .whenComplete((ok, error) -> {
                        if (Boolean.TRUE.equals(ok)) {
                            stored.incrementAndGet();
                        } else if (error == null) {
                            errors.add("photo " + photoId + ": no candidate URL served an image");
                        }
                        int done = processed.incrementAndGet();
                        if (done % 10 == 0 || done == total) {
                            log.info("  IMO {} progress: {}/{} processed, {} stored", vessel.id(), done, total, stored.get());
                        }
                    }));
        }

        StorageException storageFailure = null;
        for (CompletableFuture<Boolean> task : tasks) {
            try {
                task.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof StorageException se) {
                    if (storageFailure == null) {
                        storageFailure = se;
                    }
                } else {
                    log.warn("Photo task for IMO {} failed: {}", vessel.id(), cause.getMessage(), cause);
                    errors.add(cause.getClass().getSimpleName() + ": " + cause.getMessage());
                }
            }
        }

        if (storageFailure != null) {
            throw storageFailure;
        }
        return new ArchiveBatch(total, stored.get(), List.copyOf(errors));
    }

    private boolean archiveUnlessAborted(VesselTarget vessel, String photoId,
                                         AtomicReference<StorageException> abortSignal) {
        StorageException earlier = abortSignal.get();
        if (earlier != null) {
            throw earlier;
        }
        try {
            return archive(vessel, photoId);
        } catch (StorageException e) {
            if (abortSignal.compareAndSet(null, e)) {
                log.error("Storage failure on photo {} of IMO {} - skipping remaining downloads: {}",
                        photoId, vessel.id(), e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Tries each candidate URL in order and stores the first image response.
     * Returns false when none of them served an image.
     */
    boolean archive(VesselTarget vessel, String photoId) {
        for (String url : siteUrls.imageCandidates(photoId)) {
            Optional<SiteResponse> response = siteClient.fetchBinary(url);
            if (response.isEmpty()) {
                continue;
            }
            SiteResponse image = response.get();
            if (!image.isOk() || !image.isImage()) {
                log.debug("Candidate {} rejected (status {}, type '{}')", url, image.statusCode(), image.contentType());
                continue;
            }
            store(vessel, photoId, image);
            return true;
        }
        log.debug("No image found for photo {} of IMO {}", photoId, vessel.id());
        return false;
    }

    private void store(VesselTarget vessel, String photoId, SiteResponse image) {
        objectStore.put(keys.photoKey(vessel.id(), photoId), image.body(), IMAGE_CONTENT_TYPE);

        PhotoMetadata metadata = PhotoMetadata.builder()
                .vesselId(vessel.id().value())
                .photoId(photoId)
                .imageUrl(image.url())
                .pageUrl(siteUrls.photoPage(photoId))
                .contentType(image.contentType())
                .scrapedAt(Instant.now().toString())
                .vessel(vessel.details())
                .build();

        objectStore.put(keys.metadataKey(vessel.id(), photoId), toJson(metadata), JSON_CONTENT_TYPE);
    }

    private byte[] toJson(PhotoMetadata metadata) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(metadata)
                    .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise metadata for photo " + metadata.getPhotoId(), e);
        }
    }
}
