package com.vesselintel.photos.service;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.http.ResilientSiteClient;
import com.vesselintel.photos.http.SiteResponse;
import com.vesselintel.photos.model.DiscoveryResult;
import com.vesselintel.photos.model.VesselId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Collects up to discovery.target-per-vessel photo ids for a vessel from the gallery listing.
 *
 * Per sort order: page 1 is fetched alone to learn the page size and the reported
 * total, then the remaining pages go out in waves of gallery-requests pages. The
 * target is checked between waves only, so in-flight pages are never abandoned.
 * Alternate sort orders are tried only when the site reported more photos than
 * the default order yielded.
 */
@Service
@Slf4j
public class PhotoDiscoveryService {

    private final ResilientSiteClient siteClient;
    private final GalleryPageParser parser;
    private final SiteUrls siteUrls;
    private final ExecutorService executor;
    private final PhotoScraperProperties.Discovery settings;
    private final int waveSize;

    public PhotoDiscoveryService(ResilientSiteClient siteClient,
                                 GalleryPageParser parser,
                                 SiteUrls siteUrls,
                                 ExecutorService scrapeIoExecutor,
                                 PhotoScraperProperties properties) {
        this.siteClient = siteClient;
        this.parser = parser;
        this.siteUrls = siteUrls;
        this.executor = scrapeIoExecutor;
        this.settings = properties.getDiscovery();
        this.waveSize = Math.max(1, properties.getConcurrency().getGalleryRequests());
    }

    public DiscoveryResult discover(VesselId vesselId) {
        int target = settings.getTargetPerVessel();
        Set<String> collected = ConcurrentHashMap.newKeySet();

        log.info("Searching gallery for IMO {}", vesselId);

        SortPass primary = searchSortOrder(vesselId, settings.getDefaultSort(),
                settings.getMaxPages(), target, collected);

        if (primary.unavailable()) {
            log.warn("Gallery for IMO {} could not be fetched", vesselId);
            return DiscoveryResult.unavailable();
        }
        if (collected.isEmpty()) {
            log.info("No photos found for IMO {}", vesselId);
            return DiscoveryResult.empty();
        }

        int bestTotal = primary.bestTotal();
        if (bestTotal > 0) {
            log.info("Site reports {} photos for IMO {}", bestTotal, vesselId);
            int goal = Math.min(target, bestTotal);

            for (String sort : settings.getAlternateSorts()) {
                if (collected.size() >= goal) {
                    break;
                }
                int before = collected.size();
                SortPass pass = searchSortOrder(vesselId, sort, settings.getAlternateMaxPages(), goal, collected);
                bestTotal = Math.max(bestTotal, pass.bestTotal());
                log.debug("Sort '{}' added {} new ids for IMO {}", sort, collected.size() - before, vesselId);
            }
        }

        Set<String> selected = new LinkedHashSet<>();
        for (String id : collected) {
            if (selected.size() >= target) {
                break;
            }
            selected.add(id);
        }

        int total = bestTotal > 0 ? bestTotal : collected.size();
        log.info("Collected {} photo ids for IMO {} ({} distinct seen)", selected.size(), vesselId, collected.size());
        return new DiscoveryResult(selected, total);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    record SortPass(boolean unavailable, int bestTotal) {}

    /**
     * Pages through one sort order, adding ids to collected until goal is reached,
     * the gallery runs out, or maxPages is hit.
     */
    private SortPass searchSortOrder(VesselId vesselId, String sort, int maxPages, int goal, Set<String> collected) {
        Optional<GalleryPageParser.GalleryPage> first = fetchPage(vesselId, sort, 1);
        if (first.isEmpty()) {
            return new SortPass(true, DiscoveryResult.UNKNOWN_TOTAL);
        }

        GalleryPageParser.GalleryPage page1 = first.get();
        collected.addAll(page1.photoIds());
        int bestTotal = page1.totalReported();
        int perPage = page1.photoIds().size();

        if (perPage == 0 || perPage < settings.getPageSize()) {
            return new SortPass(false, bestTotal);
        }

        int nextPage = 2;
        while (collected.size() < goal) {
            int pagesNeeded = pagesNeeded(goal, bestTotal, perPage, maxPages);
            if (nextPage > pagesNeeded) {
                break;
            }
            int waveEnd = Math.min(pagesNeeded, nextPage + waveSize - 1);

            List<CompletableFuture<Optional<GalleryPageParser.GalleryPage>>> wave = new ArrayList<>();
            for (int p = nextPage; p <= waveEnd; p++) {
                int pageNumber = p;
                wave.add(CompletableFuture
                        .supplyAsync(() -> fetchPage(vesselId, sort, pageNumber), executor)
                        .exceptionally(e -> {
                            log.warn("Page {} of '{}' for IMO {} failed: {}", pageNumber, sort, vesselId, e.getMessage());
                            return Optional.empty();
                        }));
            }

            boolean exhausted = false;
            for (CompletableFuture<Optional<GalleryPageParser.GalleryPage>> future : wave) {
                Optional<GalleryPageParser.GalleryPage> result = future.join();
                if (result.isEmpty()) {
                    continue;
                }
                GalleryPageParser.GalleryPage page = result.get();
                collected.addAll(page.photoIds());
                bestTotal = Math.max(bestTotal, page.totalReported());
                if (page.photoIds().size() < perPage) {
                    exhausted = true;
                }
            }

            if (exhausted) {
                break;
            }
            nextPage = waveEnd + 1;
        }
        return new SortPass(false, bestTotal);
    }

    /**
     * Pages to fetch for one sort order. With no reported total and a full first page
     * the configured cap is the only bound available.
     */
    static int pagesNeeded(int goal, int total, int perPage, int maxPages) {
        if (total <= 0) {
            return maxPages;
        }
        int wanted = Math.min(goal, total);
        int pages = (wanted + perPage - 1) / perPage;
        return Math.max(1, Math.min(maxPages, pages));
    }

    private Optional<GalleryPageParser.GalleryPage> fetchPage(VesselId vesselId, String sort, int page) {
        String url = siteUrls.galleryPage(vesselId, sort, page);
        Optional<SiteResponse> response = siteClient.fetchPage(url);
        if (response.isEmpty() || !response.get().isOk()) {
            log.debug("Gallery page {} ({}) for IMO {} unavailable (status {})", page, sort, vesselId,
                    response.map(r -> String.valueOf(r.statusCode())).orElse("none"));
            return Optional.empty();
        }
        return Optional.of(parser.parse(response.get().text()));
    }
}
