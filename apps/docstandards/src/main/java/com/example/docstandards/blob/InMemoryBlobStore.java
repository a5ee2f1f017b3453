package com.example.docstandards.blob;

import com.example.docstandards.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of BlobStore for local runs and tests.
 * Content is lost on restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.blob.type", havingValue = "memory")
public class InMemoryBlobStore implements BlobStore {

    private final ConcurrentHashMap<String, byte[]> blobs = new ConcurrentHashMap<>();

    public InMemoryBlobStore() {
        log.info("In-memory blob store initialized (content is not persisted)");
    }

    @Override
    @NonNull
    public Mono<byte[]> get(@NonNull String key) {
        return Mono.defer(() -> {
            byte[] content = blobs.get(key);
            if (content == null) {
                return Mono.error(new NotFoundException("Blob", key));
            }
            return Mono.just(content.clone());
        });
    }

    @Override
    @NonNull
    public Mono<StoredBlob> put(@NonNull byte[] content, @NonNull String contentType) {
        return Mono.fromCallable(() -> {
            String sha256 = BlobStore.sha256Hex(content);
            String key = BlobStore.contentKey(sha256);
            blobs.putIfAbsent(key, content.clone());
            return new StoredBlob(key, sha256, content.length);
        });
    }

    @Override
    @NonNull
    public Mono<Void> delete(@NonNull String key) {
        return Mono.fromRunnable(() -> blobs.remove(key));
    }

    @Override
    @NonNull
    public Mono<Void> ping() {
        return Mono.empty();
    }

    @Override
    @NonNull
    public Map<String, Object> describe() {
        return Map.of("type", "memory", "objects", blobs.size());
    }
}
