package com.example.docstandards.blob;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Byte storage for document content.
 * Keys are content-addressed ({@code sha256/<hex>}), so a key always denotes the same bytes
 * and a validation job can snapshot a key without copying content.
 * Implementations can use S3 (durable) or in-memory (local runs, tests) storage.
 */
public interface BlobStore {

    String KEY_PREFIX = "sha256/";

    /**
     * Reads the bytes stored under a key.
     * Errors with {@link com.example.docstandards.exception.NotFoundException} for unknown keys and
     * {@link com.example.docstandards.exception.TransientStorageException} for retryable failures.
     */
    @NonNull
    Mono<byte[]> get(@NonNull String key);

    /**
     * Stores bytes under their content key. Storing the same bytes twice is a no-op.
     */
    @NonNull
    Mono<StoredBlob> put(@NonNull byte[] content, @NonNull String contentType);

    @NonNull
    Mono<Void> delete(@NonNull String key);

    /**
     * Completes empty when the store is reachable.
     */
    @NonNull
    Mono<Void> ping();

    @NonNull
    Map<String, Object> describe();

    static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String contentKey(String sha256Hex) {
        return KEY_PREFIX + sha256Hex;
    }
}
