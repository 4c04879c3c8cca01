package com.vesselintel.photos.config;

import com.vesselintel.photos.output.LocalObjectStore;
import com.vesselintel.photos.output.ObjectStore;
import com.vesselintel.photos.output.S3ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.nio.file.Paths;

/**
 * Selects the object store backend from photo-scraper.storage.mode.
 */
@Configuration
@Slf4j
public class StorageConfig {

    @Bean
    public ObjectStore objectStore(PhotoScraperProperties properties) {
        PhotoScraperProperties.Storage storage = properties.getStorage();

        return switch (storage.getMode()) {
            case LOCAL -> {
                log.info("Using local object store at {}", storage.getLocal().getRootDir());
                yield new LocalObjectStore(Paths.get(storage.getLocal().getRootDir()));
            }
            case S3 -> {
                PhotoScraperProperties.Storage.S3 s3 = storage.getS3();
                if (s3.getBucket() == null || s3.getBucket().isBlank()) {
                    throw new IllegalStateException("photo-scraper.storage.s3.bucket must be set in S3 mode");
                }
                log.info("Using S3 object store: bucket={}, region={}, endpoint={}",
                        s3.getBucket(), s3.getRegion(), s3.getEndpoint() == null ? "default" : s3.getEndpoint());
                yield new S3ObjectStore(buildClient(s3), s3.getBucket());
            }
        };
    }

    private S3Client buildClient(PhotoScraperProperties.Storage.S3 s3) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.getRegion()))
                .credentialsProvider(credentials(s3));

        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpoint()))
                    .forcePathStyle(true);
        }
        return builder.build();
    }

    private AwsCredentialsProvider credentials(PhotoScraperProperties.Storage.S3 s3) {
        if (s3.getAccessKeyId() == null || s3.getAccessKeyId().isBlank()
                || s3.getSecretAccessKey() == null || s3.getSecretAccessKey().isBlank()) {
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(s3.getAccessKeyId(), s3.getSecretAccessKey()));
    }
}
