package com.batchbridge.infrastructure.storage;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Optional;

/**
 * S3-compatible object store.
 *
 * Call timeouts are configured on the client (see S3Config); transient
 * failures are retried by the "objectStore" Resilience4j instance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;

    @Value("${app.storage.bucket}")
    private String bucket;

    @Override
    @Retry(name = "objectStore")
    public void put(String key, byte[] content, String contentType) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .contentLength((long) content.length)
                    .build();

            s3Client.putObject(request, RequestBody.fromBytes(content));

            log.debug("Stored object {} ({} bytes) in bucket {}", key, content.length, bucket);

        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to store object " + key, e);
        }
    }

    @Override
    @Retry(name = "objectStore")
    public Optional<byte[]> get(String key) {
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();

            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(request);
            return Optional.of(bytes.asByteArray());

        } catch (NoSuchKeyException e) {
            log.warn("Object {} not found in bucket {}", key, bucket);
            return Optional.empty();
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to fetch object " + key, e);
        }
    }
}
