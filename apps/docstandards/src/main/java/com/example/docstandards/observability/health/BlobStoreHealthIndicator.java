package com.example.docstandards.observability.health;

import com.example.docstandards.blob.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the document blob store.
 * Validation workers cannot make progress while it is down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlobStoreHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final BlobStore blobStore;

    @Override
    public Mono<Health> health() {
        return blobStore.ping()
                .timeout(TIMEOUT)
                .then(Mono.fromSupplier(() -> Health.up()
                        .withDetails(blobStore.describe())
                        .build()))
                .onErrorResume(error -> {
                    log.warn("Blob store health check failed: {}", error.getMessage());
                    return Mono.just(Health.down()
                            .withDetails(blobStore.describe())
                            .withDetail("error", String.valueOf(error.getMessage()))
                            .build());
                });
    }
}
