package com.vesselintel.photos.scheduler;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.output.ObjectStore;
import com.vesselintel.photos.service.PhotoScrapeService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the scrape shortly after startup and then again a fixed delay after
 * each run finishes (default every 2 hours).
 *
 * Override with photo-scraper.scheduling.initial-delay / fixed-delay.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final PhotoScrapeService scrapeService;
    private final ObjectStore objectStore;
    private final PhotoScraperProperties properties;

    @PostConstruct
    public void onStartup() {
        try {
            objectStore.verifyAccess();
        } catch (Exception e) {
            log.warn("Object store {} not reachable at startup (runs will fail until it is): {}",
                    objectStore.describe(), e.getMessage());
        }
        log.info("Scraper ready. First run in {}, then every {}",
                properties.getScheduling().getInitialDelay(), properties.getScheduling().getFixedDelay());
    }

    @Scheduled(initialDelayString = "${photo-scraper.scheduling.initial-delay:PT30S}",
            fixedDelayString = "${photo-scraper.scheduling.fixed-delay:PT2H}")
    public void scheduledScrape() {
        log.info("Scheduled scrape triggered");
        try {
            scrapeService.runIfIdle();
        } catch (Exception e) {
            log.error("Scheduled scrape failed: {}", e.getMessage(), e);
        }
    }
}
