package com.example.docstandards.blob;

import com.example.docstandards.common.util.RetryUtils;
import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.NotFoundException;
import com.example.docstandards.exception.TransientStorageException;
import com.example.docstandards.observability.metrics.ValidationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.*;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionException;

@Slf4j
@Component
@ConditionalOnProperty(name = "app.blob.type", havingValue = "s3", matchIfMissing = true)
public class S3BlobStore implements BlobStore {

    private final S3AsyncClient s3AsyncClient;
    private final AppProperties.Blob blobConfig;
    private final ValidationMetrics metrics;

    public S3BlobStore(S3AsyncClient s3AsyncClient, AppProperties properties, ValidationMetrics metrics) {
        this.s3AsyncClient = s3AsyncClient;
        this.blobConfig = properties.getBlob();
        this.metrics = metrics;
        log.info("S3 blob store initialized: bucket={}, region={}, endpoint={}",
                blobConfig.getBucket(), blobConfig.getRegion(),
                blobConfig.getEndpoint() != null ? blobConfig.getEndpoint() : "default");
    }

    @Override
    @NonNull
    public Mono<byte[]> get(@NonNull String key) {
        long start = System.nanoTime();
        return Mono.fromFuture(() -> s3AsyncClient.getObject(GetObjectRequest.builder()
                                .bucket(blobConfig.getBucket())
                                .key(key)
                                .build(),
                        AsyncResponseTransformer.toBytes()))
                .map(response -> response.asByteArray())
                .onErrorMap(e -> translate(e, key))
                .doOnSuccess(bytes -> {
                    metrics.recordBlobOperation("get", true, elapsed(start));
                    log.debug("Fetched blob: key={}, size={}", key, bytes.length);
                })
                .doOnError(e -> {
                    metrics.recordBlobOperation("get", false, elapsed(start));
                    log.warn("Failed to fetch blob: key={}, error={}", key, e.getMessage());
                });
    }

    @Override
    @NonNull
    public Mono<StoredBlob> put(@NonNull byte[] content, @NonNull String contentType) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            String sha256 = BlobStore.sha256Hex(content);
            String key = BlobStore.contentKey(sha256);

            PutObjectRequest.Builder requestBuilder = PutObjectRequest.builder()
                    .bucket(blobConfig.getBucket())
                    .key(key)
                    .contentType(contentType)
                    .contentLength((long) content.length)
                    .metadata(Map.of("sha256", sha256));

            // Add KMS encryption if configured
            String kmsKeyId = blobConfig.getKmsKeyId();
            if (kmsKeyId != null && !kmsKeyId.isBlank()) {
                requestBuilder
                        .serverSideEncryption(ServerSideEncryption.AWS_KMS)
                        .ssekmsKeyId(kmsKeyId);
            }

            return Mono.fromFuture(() -> s3AsyncClient.putObject(requestBuilder.build(),
                            AsyncRequestBody.fromBytes(content)))
                    .thenReturn(new StoredBlob(key, sha256, content.length))
                    .onErrorMap(e -> translate(e, key))
                    .doOnSuccess(stored -> {
                        metrics.recordBlobOperation("put", true, elapsed(start));
                        log.debug("Stored blob: key={}, size={}", key, content.length);
                    })
                    .doOnError(e -> {
                        metrics.recordBlobOperation("put", false, elapsed(start));
                        log.error("Failed to store blob: key={}", key, e);
                    });
        });
    }

    @Override
    @NonNull
    public Mono<Void> delete(@NonNull String key) {
        return Mono.fromFuture(() ->
                        s3AsyncClient.deleteObject(DeleteObjectRequest.builder()
                                .bucket(blobConfig.getBucket())
                                .key(key)
                                .build())
                )
                .onErrorMap(e -> translate(e, key))
                .then()
                .doOnSuccess(v -> log.debug("Deleted blob: key={}", key))
                .doOnError(e -> log.error("Failed to delete blob: key={}", key, e));
    }

    @Override
    @NonNull
    public Mono<Void> ping() {
        return Mono.fromFuture(() -> s3AsyncClient.headBucket(HeadBucketRequest.builder()
                        .bucket(blobConfig.getBucket())
                        .build()))
                .then();
    }

    @Override
    @NonNull
    public Map<String, Object> describe() {
        return Map.of("type", "s3", "bucket", blobConfig.getBucket(), "region", blobConfig.getRegion());
    }

    private Throwable translate(Throwable error, String key) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof NoSuchKeyException) {
            return new NotFoundException("Blob", key);
        }
        if (cause instanceof NotFoundException || cause instanceof TransientStorageException) {
            return cause;
        }
        if (RetryUtils.isRetryable(cause)) {
            return new TransientStorageException("Blob store unavailable for key " + key, cause);
        }
        return cause;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
