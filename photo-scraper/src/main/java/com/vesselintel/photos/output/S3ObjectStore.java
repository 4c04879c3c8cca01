package com.vesselintel.photos.output;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * S3 (or S3-compatible) backend. Closed by Spring together with its client.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore, AutoCloseable {

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStore(S3Client s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucketName)
                            .key(key)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromBytes(content));
            log.debug("Uploaded {} ({} bytes) to s3://{}", key, content.length, bucketName);
        } catch (SdkException e) {
            throw new StorageException("S3 upload failed for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build());
            return Optional.of(bytes.asByteArray());
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (SdkException e) {
            throw new StorageException("S3 download failed for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        try {
            return s3Client.listObjectsV2Paginator(ListObjectsV2Request.builder()
                            .bucket(bucketName)
                            .prefix(prefix)
                            .build())
                    .contents()
                    .stream()
                    .map(S3Object::key)
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            throw new StorageException("S3 listing failed for prefix " + prefix + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void verifyAccess() {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            log.info("Bucket '{}' is accessible", bucketName);
        } catch (SdkException e) {
            throw new StorageException("Bucket '" + bucketName + "' is not accessible: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucketName;
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
