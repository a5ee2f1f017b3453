package com.example.docstandards.common.concurrent;

import com.example.docstandards.config.AppProperties;
import com.example.docstandards.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion keyed by string.
 *
 * <p>Permits are semaphores rather than reentrant locks because a reactive pipeline
 * may release on a different thread than the one that acquired. Multiple keys are
 * always acquired in sorted order so two callers locking overlapping sets cannot deadlock.
 *
 * <p>Each key's entry counts its holders and waiters and is removed when the count drops
 * to zero, so the map only contains keys that are currently in use.
 */
@Slf4j
@Component
public class KeyedMutex {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration acquireTimeout;

    public KeyedMutex(AppProperties properties) {
        this.acquireTimeout = properties.getLocks().getAcquireTimeout();
    }

    public <T> Mono<T> withLock(String key, Supplier<Mono<T>> action) {
        return withLocks(List.of(key), action);
    }

    public <T> Mono<T> withLocks(Collection<String> keys, Supplier<Mono<T>> action) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(keys));
        return Mono.usingWhen(
                acquireAll(ordered),
                held -> Mono.defer(action),
                Lease::releaseAsync,
                (held, error) -> held.releaseAsync(),
                Lease::releaseAsync);
    }

    private Mono<Lease> acquireAll(List<String> keys) {
        return Mono.fromCallable(() -> {
                    Lease lease = new Lease();
                    for (String key : keys) {
                        Entry entry = retain(key);
                        boolean ok;
                        try {
                            ok = entry.semaphore.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            ok = false;
                        }
                        if (!ok) {
                            forget(key);
                            lease.release();
                            log.warn("Lock acquisition timed out: key={}, timeout={}", key, acquireTimeout);
                            throw new LockTimeoutException("Timed out waiting for lock " + key);
                        }
                        lease.keys.add(key);
                    }
                    log.trace("Acquired locks: {}", keys);
                    return lease;
                })
                .subscribeOn(Schedulers.boundedElastic())
                // A lease that completes after the subscriber cancelled is discarded, not delivered
                .doOnDiscard(Lease.class, Lease::release);
    }

    private Entry retain(String key) {
        return entries.compute(key, (k, entry) -> {
            Entry current = entry != null ? entry : new Entry();
            current.references++;
            return current;
        });
    }

    private void forget(String key) {
        entries.computeIfPresent(key, (k, entry) -> --entry.references == 0 ? null : entry);
    }

    boolean isHeld(String key) {
        Entry entry = entries.get(key);
        return entry != null && entry.semaphore.availablePermits() == 0;
    }

    /**
     * Number of keys currently held or waited on.
     */
    int trackedKeys() {
        return entries.size();
    }

    private static final class Entry {
        private final Semaphore semaphore = new Semaphore(1, true);
        // Guarded by the map's per-key compute
        private int references;
    }

    private final class Lease {
        private final List<String> keys = new ArrayList<>();
        private final AtomicBoolean released = new AtomicBoolean();

        void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            for (String key : keys) {
                entries.get(key).semaphore.release();
                forget(key);
            }
        }

        Mono<Void> releaseAsync() {
            return Mono.fromRunnable(this::release);
        }
    }
}
