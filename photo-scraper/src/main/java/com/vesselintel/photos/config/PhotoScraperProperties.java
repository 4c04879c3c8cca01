package com.vesselintel.photos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "photo-scraper")
@Data
public class PhotoScraperProperties {

    private Site site = new Site();
    private Discovery discovery = new Discovery();
    private RetryPolicy retry = new RetryPolicy();
    private Concurrency concurrency = new Concurrency();
    private Storage storage = new Storage();
    private Source source = new Source();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Site {
        private String baseUrl = "https://www.shipspotting.com";
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";
        /** Gallery probed during session warm-up to confirm the challenge was passed */
        private String warmUpVesselId = "9169031";
        private Duration connectTimeout = Duration.ofSeconds(8);
        private Duration readTimeout = Duration.ofSeconds(12);
        private Duration minRequestDelay = Duration.ofMillis(50);
        private Duration maxRequestDelay = Duration.ofMillis(120);
    }

    @Data
    public static class Discovery {
        private int targetPerVessel = 40;
        /** Items a full gallery page holds; a shorter page is the last one */
        private int pageSize = 12;
        private int maxPages = 10;
        private String defaultSort = "newest";
        private List<String> alternateSorts = new ArrayList<>(List.of("oldest", "popular"));
        private int alternateMaxPages = 2;
    }

    @Data
    public static class RetryPolicy {
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration maxJitter = Duration.ofSeconds(1);
    }

    @Data
    public static class Concurrency {
        private int sessionPoolSize = 2;
        private int galleryRequests = 4;
        private int downloads = 20;
        private int batchVessels = 10;
        private int batchSize = 10;
    }

    @Data
    public static class Storage {
        private StorageMode mode = StorageMode.LOCAL;
        private String photoPrefix = "vessel-photos";
        private String indexKey = "index/scraped_vessels.json";
        private String reportPrefix = "reports";
        private Local local = new Local();
        private S3 s3 = new S3();

        @Data
        public static class Local {
            private String rootDir = "/data/gallery";
        }

        @Data
        public static class S3 {
            private String bucket;
            private String region = "us-east-1";
            /** Optional endpoint for S3-compatible stores (MinIO, Spaces) */
            private String endpoint;
            private String accessKeyId;
            private String secretAccessKey;
        }

        public enum StorageMode {
            S3, LOCAL
        }
    }

    @Data
    public static class Source {
        private SourceMode mode = SourceMode.STATIC;
        private List<StaticVessel> vessels = new ArrayList<>();
        private TrackingApi api = new TrackingApi();

        @Data
        public static class StaticVessel {
            private String id;
            private String name;
            private String type;
        }

        @Data
        public static class TrackingApi {
            private String baseUrl = "https://api.datalastic.com/api/v0";
            private String apiKey;
            private double latitude = 32.8154;
            private double longitude = 35.0043;
            private int radiusKm = 15;
        }

        public enum SourceMode {
            STATIC, API
        }
    }

    @Data
    public static class Scheduling {
        private Duration initialDelay = Duration.ofSeconds(30);
        private Duration fixedDelay = Duration.ofHours(2);
    }
}
