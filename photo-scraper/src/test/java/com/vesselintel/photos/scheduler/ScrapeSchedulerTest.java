package com.vesselintel.photos.scheduler;

import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.output.ObjectStore;
import com.vesselintel.photos.output.StorageException;
import com.vesselintel.photos.service.PhotoScrapeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeSchedulerTest {

    @Mock
    private PhotoScrapeService scrapeService;

    @Mock
    private ObjectStore objectStore;

    private ScrapeScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ScrapeScheduler(scrapeService, objectStore, new PhotoScraperProperties());
    }

    @Test
    @DisplayName("Scheduled tick delegates to runIfIdle")
    void scheduledScrape_runsWhenIdle() {
        scheduler.scheduledScrape();

        verify(scrapeService, times(1)).runIfIdle();
    }

    @Test
    @DisplayName("A failed run does not escape the scheduler thread")
    void scheduledScrape_swallowsFailure() {
        when(scrapeService.runIfIdle()).thenThrow(new StorageException("bucket gone"));

        assertThatCode(() -> scheduler.scheduledScrape()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Unreachable storage at startup is only a warning")
    void onStartup_storageUnreachable() {
        doThrow(new StorageException("down")).when(objectStore).verifyAccess();
        when(objectStore.describe()).thenReturn("memory://test");

        assertThatCode(() -> scheduler.onStartup()).doesNotThrowAnyException();
    }
}
