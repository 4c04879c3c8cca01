package com.vesselintel.photos.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vesselintel.photos.config.PhotoScraperProperties;
import com.vesselintel.photos.http.BrowserSessionPool;
import com.vesselintel.photos.http.ResilientSiteClient;
import com.vesselintel.photos.http.SiteResponse;
import com.vesselintel.photos.model.VesselTarget;
import com.vesselintel.photos.output.StorageException;
import com.vesselintel.photos.output.StorageKeys;
import com.vesselintel.photos.support.FakeSite;
import com.vesselintel.photos.support.InMemoryObjectStore;
import com.vesselintel.photos.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhotoArchiveServiceTest {

    private static final VesselTarget VESSEL = VesselTarget.of("1234567", "Test Carrier");

    private PhotoScraperProperties properties;
    private InMemoryObjectStore store;
    private ObjectMapper objectMapper;
    private ExecutorService executor;
    private FakeSite site;

    @BeforeEach
    void setUp() {
        properties = TestProperties.fast();
        store = new InMemoryObjectStore();
        objectMapper = TestProperties.objectMapper();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PhotoArchiveService serviceFor(Function<String, SiteResponse> router) {
        site = new FakeSite(router);
        ResilientSiteClient client = new ResilientSiteClient(new BrowserSessionPool(site, properties), properties);
        return new PhotoArchiveService(client, new SiteUrls(properties), store, new StorageKeys(properties),
                objectMapper, executor);
    }

    @Test
    @DisplayName("Falls back to the next candidate URL when the primary path is missing")
    void archiveAll_candidateFallback() throws Exception {
        PhotoArchiveService service = serviceFor(url -> url.contains("/photos/big/5/4/3/")
                ? FakeSite.status(url, 404)
                : FakeSite.image(url));

        PhotoArchiveService.ArchiveBatch batch = service.archiveAll(VESSEL, List.of("4412345"));

        assertThat(batch.found()).isEqualTo(1);
        assertThat(batch.stored()).isEqualTo(1);
        assertThat(batch.errors()).isEmpty();
        assertThat(store.objects()).containsOnlyKeys(
                "vessel-photos/IMO_1234567/4412345.jpg",
                "vessel-photos/IMO_1234567/4412345.json");
        assertThat(store.contentType("vessel-photos/IMO_1234567/4412345.jpg")).isEqualTo("image/jpeg");

        JsonNode metadata = objectMapper.readTree(new String(
                store.objects().get("vessel-photos/IMO_1234567/4412345.json"), StandardCharsets.UTF_8));
        assertThat(metadata.get("vessel_id").asText()).isEqualTo("1234567");
        assertThat(metadata.get("photo_id").asText()).isEqualTo("4412345");
        assertThat(metadata.get("image_url").asText()).isEqualTo("https://photos.example.test/photos/big/4412345.jpg");
        assertThat(metadata.get("page_url").asText()).isEqualTo("https://photos.example.test/photos/4412345");
        assertThat(metadata.get("vessel").get("name").asText()).isEqualTo("Test Carrier");
    }

    @Test
    @DisplayName("A non-image response is not stored")
    void archiveAll_rejectsNonImageContent() {
        PhotoArchiveService service = serviceFor(url -> FakeSite.html(url, "<html>login</html>"));

        PhotoArchiveService.ArchiveBatch batch = service.archiveAll(VESSEL, List.of("4412345"));

        assertThat(batch.found()).isEqualTo(1);
        assertThat(batch.stored()).isZero();
        assertThat(batch.errors()).hasSize(1);
        assertThat(store.objects()).isEmpty();
    }

    @Test
    @DisplayName("One missing photo does not stop its siblings")
    void archiveAll_partialFailure() {
        PhotoArchiveService service = serviceFor(url -> url.contains("4412346")
                ? FakeSite.status(url, 404)
                : FakeSite.image(url));

        PhotoArchiveService.ArchiveBatch batch = service.archiveAll(VESSEL, List.of("4412345", "4412346", "4412347"));

        assertThat(batch.found()).isEqualTo(3);
        assertThat(batch.stored()).isEqualTo(2);
        assertThat(batch.errors()).hasSize(1);
        assertThat(batch.errors().get(0)).contains("4412346");
    }

    @Test
    @DisplayName("A storage failure is rethrown once every photo task finished")
    void archiveAll_storageFailurePropagates() {
        store.failWrites(true);
        PhotoArchiveService service = serviceFor(FakeSite::image);

        assertThatThrownBy(() -> service.archiveAll(VESSEL, List.of("4412345", "4412346")))
                .isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Photos not yet started are skipped once a write has failed")
    void archiveAll_storageFailureStopsFurtherDownloads() {
        store.failWrites(true);
        PhotoArchiveService service = serviceFor(FakeSite::image);
        List<String> photoIds = IntStream.range(0, 40)
                .mapToObj(i -> String.valueOf(4_400_000 + i))
                .collect(Collectors.toList());
        AtomicReference<StorageException> abortSignal = new AtomicReference<>();

        assertThatThrownBy(() -> service.archiveAll(VESSEL, photoIds, abortSignal))
                .isInstanceOf(StorageException.class);

        assertThat(abortSignal.get()).isNotNull();
        // at most one download per pool thread was already under way when the first write failed
        assertThat(site.requests()).hasSizeLessThanOrEqualTo(4);
    }

    @Test
    @DisplayName("An abort signal raised elsewhere in the run prevents any download")
    void archiveAll_alreadyAborted() {
        PhotoArchiveService service = serviceFor(FakeSite::image);
        AtomicReference<StorageException> abortSignal =
                new AtomicReference<>(new StorageException("bucket unreachable"));

        assertThatThrownBy(() -> service.archiveAll(VESSEL, List.of("4412345", "4412346"), abortSignal))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("bucket unreachable");

        assertThat(site.requests()).isEmpty();
        assertThat(store.objects()).isEmpty();
    }

    @Test
    @DisplayName("Archiving the same photos again overwrites the same keys")
    void archiveAll_idempotentKeys() {
        PhotoArchiveService service = serviceFor(FakeSite::image);

        service.archiveAll(VESSEL, List.of("4412345", "4412346"));
        service.archiveAll(VESSEL, List.of("4412345", "4412346"));

        assertThat(store.objects()).hasSize(4);
        assertThat(store.putCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("No ids means nothing to do")
    void archiveAll_empty() {
        PhotoArchiveService service = serviceFor(FakeSite::image);

        PhotoArchiveService.ArchiveBatch batch = service.archiveAll(VESSEL, List.of());

        assertThat(batch.found()).isZero();
        assertThat(batch.stored()).isZero();
    }
}
