package com.vesselintel.photos.http;

import com.vesselintel.photos.config.PhotoScraperProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GET access to the photo site that survives rate limiting and challenges.
 *
 * Every call is retried up to retry.max-attempts with exponential backoff
 * (base * 2^n plus random jitter):
 *   429        back off, retry on the same session
 *   403        challenge failed: re-establish that pool slot, then retry
 *              (skipped on the last attempt)
 *   5xx        back off, retry
 *   I/O error  back off, retry (timeouts included)
 * Anything else, 404 included, is returned to the caller as-is.
 *
 * Gallery pages and binary downloads draw from separate permit pools.
 */
@Component
@Slf4j
public class ResilientSiteClient {

    private final BrowserSessionPool pool;
    private final PhotoScraperProperties.Site site;
    private final Semaphore galleryPermits;
    private final Semaphore downloadPermits;
    private final Retry retry;

    public ResilientSiteClient(BrowserSessionPool pool, PhotoScraperProperties properties) {
        this.pool = pool;
        this.site = properties.getSite();
        this.galleryPermits = new Semaphore(properties.getConcurrency().getGalleryRequests(), true);
        this.downloadPermits = new Semaphore(properties.getConcurrency().getDownloads(), true);
        this.retry = Retry.of("photo-site", retryConfig(properties.getRetry()));
    }

    /** Fetches an HTML page; empty when every attempt failed. */
    public Optional<SiteResponse> fetchPage(String url) {
        return withPermit(galleryPermits, url, true);
    }

    /** Fetches binary content; empty when every attempt failed. */
    public Optional<SiteResponse> fetchBinary(String url) {
        return withPermit(downloadPermits, url, false);
    }

    public void resetSessions() {
        pool.reset();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<SiteResponse> withPermit(Semaphore permits, String url, boolean politeDelay) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        try {
            if (politeDelay) {
                pause();
            }
            return execute(url);
        } finally {
            permits.release();
        }
    }

    private Optional<SiteResponse> execute(String url) {
        try {
            int maxAttempts = retry.getRetryConfig().getMaxAttempts();
            AtomicInteger attempts = new AtomicInteger();
            SiteResponse response = retry.executeCheckedSupplier(
                    () -> attempt(url, attempts.incrementAndGet() < maxAttempts));
            if (isRetryable(response.statusCode())) {
                log.warn("Giving up on {} after {} attempts (last status {})",
                        url, maxAttempts, response.statusCode());
                return Optional.empty();
            }
            return Optional.of(response);
        } catch (IOException e) {
            log.warn("Giving up on {} after {} attempts: {}",
                    url, retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Unexpected failure fetching " + url, t);
        }
    }

    private SiteResponse attempt(String url, boolean retryFollows) throws IOException, InterruptedException {
        BrowserSessionPool.Lease lease = pool.acquire();
        SiteResponse response;
        try {
            response = lease.session().get(url);
        } catch (IOException e) {
            log.debug("Request to {} failed on slot {}: {}", url, lease.slot(), e.getMessage());
            throw e;
        }

        if (response.statusCode() == 403) {
            if (retryFollows) {
                log.warn("403 from {} on slot {} - re-establishing session", url, lease.slot());
                pool.recreate(lease);
            } else {
                log.warn("403 from {} on slot {} with no attempts left", url, lease.slot());
            }
        } else if (response.statusCode() == 429) {
            log.warn("Rate limited (429) on {}", url);
        } else if (response.statusCode() >= 500) {
            log.debug("Server error {} on {}", response.statusCode(), url);
        }
        return response;
    }

    private void pause() {
        long min = site.getMinRequestDelay().toMillis();
        long max = site.getMaxRequestDelay().toMillis();
        if (max <= 0) {
            return;
        }
        long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static boolean isRetryable(int status) {
        return status == 429 || status == 403 || status >= 500;
    }

    static RetryConfig retryConfig(PhotoScraperProperties.RetryPolicy policy) {
        long baseMs = policy.getBackoffBase().toMillis();
        long jitterMs = policy.getMaxJitter().toMillis();

        // numOfAttempts starts at 1 for the wait after the first failure
        IntervalFunction backoff = numOfAttempts -> {
            long exponential = baseMs * (1L << Math.min(numOfAttempts - 1, 16));
            long jitter = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs + 1) : 0L;
            return Math.max(1L, exponential + jitter);
        };

        return RetryConfig.<SiteResponse>custom()
                .maxAttempts(Math.max(1, policy.getMaxAttempts()))
                .intervalFunction(backoff)
                .retryOnResult(response -> isRetryable(response.statusCode()))
                .retryExceptions(IOException.class)
                .build();
    }
}
