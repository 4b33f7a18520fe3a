package com.example.memocache.core;

import com.example.memocache.clock.ClockSource;
import com.example.memocache.eviction.Evictor;
import com.example.memocache.expiry.ExpirationPolicy;
import com.example.memocache.expiry.TtlExpirationPolicy;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes keyed computations in a bounded LRU store with optional time-to-live.
 *
 * <h4>Single-flight</h4>
 * The first caller to miss on a key becomes its leader and runs the producer; callers
 * that miss on the same key while the leader is running join the leader's result instead
 * of running the producer again. A failed computation is handed to the leader and every
 * joiner unchanged and is never cached, so the next call retries.
 *
 * <h4>Locking</h4>
 * One lock guards the store, the in-flight registry and the counters. Producers run
 * outside of it and joiners wait on the shared future, never on the lock.
 *
 * <p>Producers may return {@code null}: the caller and joiners receive it, but nothing is
 * stored, so {@link #peek} keeps reporting the key as absent.
 *
 * @param <K> key type; must have value-based {@code equals}/{@code hashCode}
 * @param <V> value type
 */
public class MemoizingEngine<K, V> {

    private static final Logger log = LoggerFactory.getLogger(MemoizingEngine.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final CacheStore<K, V> store;
    private final Map<K, CompletableFuture<V>> inFlight = new HashMap<>();
    private final ExpirationPolicy expirationPolicy;
    private final Evictor evictor;
    private final ClockSource clock;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    /** An engine whose entries never expire. */
    public MemoizingEngine(int capacity, ClockSource clock) {
        this(capacity, TtlExpirationPolicy.none(), clock);
    }

    /**
     * @param capacity maximum number of resident entries
     * @param ttl      time-to-live from insertion, or {@code null} for entries that never expire
     * @param clock    source of "now"
     * @throws CacheConfigException if {@code capacity} or {@code ttl} is not positive. A zero
     *                              ttl is rejected on purpose: every entry would be born expired.
     */
    public MemoizingEngine(int capacity, Duration ttl, ClockSource clock) {
        this(capacity, TtlExpirationPolicy.of(ttl), clock);
    }

    public MemoizingEngine(int capacity, ExpirationPolicy expirationPolicy, ClockSource clock) {
        this(new CacheStore<>(capacity), expirationPolicy, new Evictor(), clock);
    }

    MemoizingEngine(CacheStore<K, V> store, ExpirationPolicy expirationPolicy, Evictor evictor, ClockSource clock) {
        this.store = store;
        this.expirationPolicy = Objects.requireNonNull(expirationPolicy, "expirationPolicy");
        this.evictor = evictor;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached value for {@code key}, computing it with {@code producer} on a miss.
     * Joiners wait for the in-flight computation without a time limit.
     *
     * @throws Exception whatever {@code producer} threw, unchanged
     */
    public V getOrCompute(K key, Callable<? extends V> producer) throws Exception {
        return getOrCompute(key, producer, null);
    }

    /**
     * Like {@link #getOrCompute(Object, Callable)}, but a caller joining another caller's
     * computation waits at most {@code joinTimeout}.
     *
     * @param joinTimeout maximum wait for an in-flight computation, {@code null} for no limit
     * @throws CacheTimeoutException if the wait for an in-flight computation timed out
     * @throws InterruptedException  if interrupted while waiting for an in-flight computation
     * @throws Exception             whatever the producer threw, unchanged
     */
    public V getOrCompute(K key, Callable<? extends V> producer, Duration joinTimeout) throws Exception {
        Objects.requireNonNull(producer, "producer");
        Lookup<V> lookup = lookup(key);
        switch (lookup.outcome) {
            case HIT:
                return lookup.value;
            case JOIN:
                return await(key, lookup.pending, joinTimeout);
            default:
                runLeader(key, producer, lookup.pending);
                return await(key, lookup.pending, null);
        }
    }

    /**
     * Asynchronous variant: a leader runs {@code producer} on {@code executor}. The returned
     * future fails with the producer's exception as its cause; cancelling it does not affect
     * the computation or other callers.
     */
    public CompletableFuture<V> getOrComputeAsync(K key, Callable<? extends V> producer, Executor executor) {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(executor, "executor");
        Lookup<V> lookup = lookup(key);
        switch (lookup.outcome) {
            case HIT:
                return CompletableFuture.completedFuture(lookup.value);
            case JOIN:
                return isolate(lookup.pending);
            default:
                CompletableFuture<V> promise = lookup.pending;
                try {
                    executor.execute(() -> runLeader(key, producer, promise));
                } catch (RejectedExecutionException e) {
                    settleFailure(key, promise, e);
                }
                return isolate(promise);
        }
    }

    /** Read-only lookup: no computation, no recency or statistics change. */
    public Optional<V> peek(K key) {
        lock.lock();
        try {
            Optional<CacheEntry<K, V>> entry = store.get(key);
            if (entry.isPresent() && expirationPolicy.isValid(entry.get(), clock.nanoTime())) {
                return Optional.ofNullable(entry.get().value());
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /** @return true if an entry was removed */
    public boolean invalidate(K key) {
        lock.lock();
        try {
            return store.remove(key).isPresent();
        } finally {
            lock.unlock();
        }
    }

    /** Drops every resident entry. In-flight computations still store their results. */
    public void clear() {
        lock.lock();
        try {
            store.clear();
        } finally {
            lock.unlock();
        }
    }

    /** @return number of expired entries removed */
    public int sweepExpired() {
        List<CacheEntry<K, V>> expired;
        lock.lock();
        try {
            expired = evictor.sweepExpired(store, clock.nanoTime(), expirationPolicy);
            expirations += expired.size();
        } finally {
            lock.unlock();
        }
        if (!expired.isEmpty()) {
            log.debug("[MemoizingEngine] Swept {} expired entries", expired.size());
        }
        return expired.size();
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits, misses, evictions, expirations, store.size(), inFlight.size());
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return store.capacity();
    }

    /** The fixed time-to-live, if this engine expires entries by {@link TtlExpirationPolicy}. */
    public Optional<Duration> ttl() {
        if (expirationPolicy instanceof TtlExpirationPolicy) {
            return ((TtlExpirationPolicy) expirationPolicy).ttl();
        }
        return Optional.empty();
    }

    public List<K> keysMostRecentFirst() {
        lock.lock();
        try {
            return store.keysMostRecentFirst();
        } finally {
            lock.unlock();
        }
    }

    private Lookup<V> lookup(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            long now = clock.nanoTime();
            Optional<CacheEntry<K, V>> entry = store.get(key);
            if (entry.isPresent()) {
                if (expirationPolicy.isValid(entry.get(), now)) {
                    store.touch(key);
                    hits++;
                    return Lookup.hit(entry.get().value());
                }
                if (evictor.reapIfExpired(store, key, now, expirationPolicy).isPresent()) {
                    expirations++;
                    log.debug("[MemoizingEngine] Expired entry reaped on read: {}", key);
                }
            }
            misses++;

            CompletableFuture<V> pending = inFlight.get(key);
            if (pending != null) {
                return Lookup.join(pending);
            }
            CompletableFuture<V> promise = new CompletableFuture<>();
            inFlight.put(key, promise);
            return Lookup.lead(promise);
        } finally {
            lock.unlock();
        }
    }

    // Never throws: every outcome is published through the promise.
    private void runLeader(K key, Callable<? extends V> producer, CompletableFuture<V> promise) {
        V value;
        try {
            value = producer.call();
        } catch (Throwable t) {
            settleFailure(key, promise, t);
            return;
        }

        List<CacheEntry<K, V>> evicted;
        try {
            evicted = storeResult(key, value, promise);
        } catch (Throwable t) {
            settleFailure(key, promise, t);
            return;
        }
        for (CacheEntry<K, V> victim : evicted) {
            log.debug("[MemoizingEngine] Evicted LRU entry: {}", victim.key());
        }
        promise.complete(value);
    }

    private List<CacheEntry<K, V>> storeResult(K key, V value, CompletableFuture<V> promise) {
        lock.lock();
        try {
            List<CacheEntry<K, V>> evicted = List.of();
            if (value != null) {
                long now = clock.nanoTime();
                store.put(key, CacheEntry.of(key, value, now, expirationPolicy.expiresAt(now)));
                evicted = evictor.enforceCapacity(store);
                evictions += evicted.size();
            }
            inFlight.remove(key, promise);
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    private void settleFailure(K key, CompletableFuture<V> promise, Throwable failure) {
        lock.lock();
        try {
            inFlight.remove(key, promise);
        } finally {
            lock.unlock();
        }
        log.warn("[MemoizingEngine] Computation failed for key: {}", key, failure);
        promise.completeExceptionally(failure);
    }

    private V await(K key, CompletableFuture<V> pending, Duration timeout) throws Exception {
        try {
            if (timeout == null) {
                return pending.get();
            }
            return pending.get(toNanosSaturated(timeout), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw asException(e.getCause());
        } catch (TimeoutException e) {
            log.warn("[MemoizingEngine] Gave up after {} waiting for in-flight computation of {}", timeout, key);
            throw new CacheTimeoutException(key, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static long toNanosSaturated(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    // A fresh future per caller, so a caller completing or cancelling its own view
    // cannot disturb the shared one.
    private static <V> CompletableFuture<V> isolate(CompletableFuture<V> shared) {
        CompletableFuture<V> view = new CompletableFuture<>();
        shared.whenComplete((result, error) -> {
            if (error != null) {
                view.completeExceptionally(error);
            } else {
                view.complete(result);
            }
        });
        return view;
    }

    private static Exception asException(Throwable cause) {
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return new ExecutionException(cause);
    }

    private enum Outcome { HIT, JOIN, LEAD }

    private static final class Lookup<V> {
        final Outcome outcome;
        final V value;
        final CompletableFuture<V> pending;

        private Lookup(Outcome outcome, V value, CompletableFuture<V> pending) {
            this.outcome = outcome;
            this.value = value;
            this.pending = pending;
        }

        static <V> Lookup<V> hit(V value) {
            return new Lookup<>(Outcome.HIT, value, null);
        }

        static <V> Lookup<V> join(CompletableFuture<V> pending) {
            return new Lookup<>(Outcome.JOIN, null, pending);
        }

        static <V> Lookup<V> lead(CompletableFuture<V> promise) {
            return new Lookup<>(Outcome.LEAD, null, promise);
        }
    }
}
