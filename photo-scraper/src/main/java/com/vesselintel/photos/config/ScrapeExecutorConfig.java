package com.vesselintel.photos.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared pool for gallery page fetches and photo downloads.
 * Actual network concurrency is capped by the semaphores in ResilientSiteClient;
 * the pool only needs enough threads to keep both semaphores saturated.
 */
@Configuration
@Slf4j
public class ScrapeExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scrapeIoExecutor(PhotoScraperProperties properties) {
        PhotoScraperProperties.Concurrency concurrency = properties.getConcurrency();
        int threads = concurrency.getDownloads() + concurrency.getGalleryRequests();
        log.info("Scrape I/O pool: {} threads ({} downloads, {} gallery requests)",
                threads, concurrency.getDownloads(), concurrency.getGalleryRequests());
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("scrape-io-"));
    }
}
