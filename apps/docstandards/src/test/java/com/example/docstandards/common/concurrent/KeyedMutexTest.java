package com.example.docstandards.common.concurrent;

import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.LockTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeyedMutex")
class KeyedMutexTest {

    private KeyedMutex mutex;

    @BeforeEach
    void setUp() {
        mutex = mutexWithTimeout(Duration.ofMillis(200));
    }

    private static KeyedMutex mutexWithTimeout(Duration acquireTimeout) {
        AppProperties properties = new AppProperties();
        properties.getLocks().setAcquireTimeout(acquireTimeout);
        return new KeyedMutex(properties);
    }

    /**
     * Holds {@code key} until the returned sink is emitted.
     */
    private Sinks.Empty<Void> hold(String key) throws InterruptedException {
        Sinks.Empty<Void> release = Sinks.empty();
        CountDownLatch acquired = new CountDownLatch(1);
        mutex.withLock(key, () -> {
            acquired.countDown();
            return release.asMono();
        }).subscribe();
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();
        return release;
    }

    private void awaitNoTrackedKeys() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (mutex.trackedKeys() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(mutex.trackedKeys()).isZero();
    }

    @Test
    @DisplayName("should serialize actions on the same key")
    void shouldSerializeSameKey() {
        mutex = mutexWithTimeout(Duration.ofSeconds(5));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();

        Flux<Integer> contenders = Flux.range(0, 20)
                .flatMap(i -> mutex.withLock("tree:finance", () -> Mono.fromCallable(() -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    Thread.sleep(2);
                    inside.decrementAndGet();
                    return i;
                }).subscribeOn(Schedulers.boundedElastic())));

        StepVerifier.create(contenders.count())
                .expectNext(20L)
                .verifyComplete();

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(mutex.isHeld("tree:finance")).isFalse();
    }

    @Test
    @DisplayName("should time out while another caller holds the key")
    void shouldTimeOut() throws InterruptedException {
        Sinks.Empty<Void> release = hold("tree:finance");
        assertThat(mutex.isHeld("tree:finance")).isTrue();

        StepVerifier.create(mutex.withLock("tree:finance", () -> Mono.just("late")))
                .expectError(LockTimeoutException.class)
                .verify(Duration.ofSeconds(5));

        release.tryEmitEmpty();
    }

    @Test
    @DisplayName("should release every key when the action fails")
    void shouldReleaseOnError() {
        StepVerifier.create(mutex.withLocks(List.of("tree:b", "tree:a"),
                        () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();

        assertThat(mutex.isHeld("tree:a")).isFalse();
        assertThat(mutex.isHeld("tree:b")).isFalse();
    }

    @Test
    @DisplayName("should release partially acquired keys when a later key times out")
    void shouldReleasePartialAcquisition() throws InterruptedException {
        Sinks.Empty<Void> release = hold("tree:b");

        StepVerifier.create(mutex.withLocks(List.of("tree:a", "tree:b"), () -> Mono.just("never")))
                .expectError(LockTimeoutException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(mutex.isHeld("tree:a")).isFalse();
        release.tryEmitEmpty();
    }

    @Test
    @DisplayName("should not contend across different keys")
    void shouldAllowDifferentKeys() throws InterruptedException {
        Sinks.Empty<Void> release = hold("tree:finance");

        StepVerifier.create(mutex.withLock("tree:hr", () -> Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();

        release.tryEmitEmpty();
    }

    @Test
    @DisplayName("should forget every key once its lock is released")
    void shouldForgetReleasedKeys() {
        StepVerifier.create(Flux.range(0, 5000)
                        .concatMap(i -> mutex.withLock("document:" + i, () -> Mono.just(i)))
                        .count())
                .expectNext(5000L)
                .verifyComplete();

        assertThat(mutex.trackedKeys()).isZero();
    }

    @Test
    @DisplayName("should forget keys after contention, failure and timeout")
    void shouldForgetKeysAfterContention() throws InterruptedException {
        Sinks.Empty<Void> release = hold("tree:finance");

        StepVerifier.create(mutex.withLocks(List.of("tree:finance", "tree:hr"), () -> Mono.just("late")))
                .expectError(LockTimeoutException.class)
                .verify(Duration.ofSeconds(5));
        StepVerifier.create(mutex.withLock("tree:hr", () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();
        assertThat(mutex.trackedKeys()).isEqualTo(1);

        release.tryEmitEmpty();
        awaitNoTrackedKeys();
    }

    @Test
    @DisplayName("should release a lock acquired for a caller that already cancelled")
    void shouldReleaseForCancelledWaiter() throws InterruptedException {
        mutex = mutexWithTimeout(Duration.ofSeconds(5));
        Sinks.Empty<Void> release = hold("document:doc-1");

        Disposable waiter = mutex.withLock("document:doc-1", () -> Mono.just("never delivered")).subscribe();
        Thread.sleep(100);
        waiter.dispose();
        release.tryEmitEmpty();

        awaitNoTrackedKeys();
        assertThat(mutex.isHeld("document:doc-1")).isFalse();
        StepVerifier.create(mutex.withLock("document:doc-1", () -> Mono.just("next")))
                .expectNext("next")
                .verifyComplete();
    }
}
