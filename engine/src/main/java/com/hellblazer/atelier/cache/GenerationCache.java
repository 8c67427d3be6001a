/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Atelier.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.atelier.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bounded LRU cache of generation results with optional time-to-live and single-flight loading.
 * <p>
 * Entries live in an access-ordered {@link LinkedHashMap} guarded by a lock. Concurrent
 * {@link #getOrCompute(Object, Supplier)} calls for the same missing key share one computation through an in-flight
 * map of futures; the callers that joined an in-flight computation are counted as coalesced. Failed computations are
 * not cached and their exception reaches every waiting caller unchanged. A computation that was in flight when
 * {@link #clear()} ran still returns its value to its callers, but does not store it.
 *
 * @author hal.hildebrand
 * @param <K> key type, normally the canonical parameter key
 * @param <V> cached value type; must be immutable to be shared safely
 */
public final class GenerationCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(GenerationCache.class);

    private final Map<K, CacheEntry<V>>             entries;
    private final Map<K, CompletableFuture<V>>      inFlight = new ConcurrentHashMap<>();
    private final ReentrantLock                     lock     = new ReentrantLock();
    private final int                               maxSize;
    private final Optional<Duration>                ttl;
    private final Clock                             clock;

    // Statistics, guarded by lock
    private long hits;
    private long misses;
    private long evictions;
    private long expirations;
    private long coalesced;
    // bumped by clear(), guarded by lock
    private long epoch;

    public GenerationCache(int maxSize, Optional<Duration> ttl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        ttl.ifPresent(d -> {
            if (d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException("ttl must be positive: " + d);
            }
        });
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, CacheEntry<V>> eldest) {
                if (size() > GenerationCache.this.maxSize) {
                    evictions++;
                    log.trace("Evicting {}", eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    public static <K, V> GenerationCache<K, V> createLRU(int maxSize) {
        return new GenerationCache<>(maxSize, Optional.empty(), Clock.systemUTC());
    }

    public static <K, V> GenerationCache<K, V> create(int maxSize, Duration ttl) {
        return new GenerationCache<>(maxSize, Optional.of(ttl), Clock.systemUTC());
    }

    /**
     * @return the live value for the key, or null on a miss
     */
    public V get(K key) {
        lock.lock();
        try {
            var value = lookup(key);
            if (value == null) {
                misses++;
            } else {
                hits++;
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        lock.lock();
        try {
            entries.put(key, new CacheEntry<>(value, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the cached value, or compute, cache and return it. At most one computation per key runs at a time;
     * concurrent callers for the same key wait for it and receive its value or its exception.
     */
    public V getOrCompute(K key, Supplier<? extends V> supplier) {
        var cached = get(key);
        if (cached != null) {
            return cached;
        }
        var promise = new CompletableFuture<V>();
        var existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            lock.lock();
            try {
                coalesced++;
            } finally {
                lock.unlock();
            }
            return await(existing);
        }
        try {
            long started;
            V value;
            lock.lock();
            try {
                started = epoch;
                value = lookup(key);
            } finally {
                lock.unlock();
            }
            if (value == null) {
                value = Objects.requireNonNull(supplier.get(), "computed value cannot be null");
                storeIfCurrent(key, value, started);
            }
            promise.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            promise.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, promise);
        }
    }

    public void invalidate(K key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(K key) {
        return peek(key) != null;
    }

    /**
     * Remove all entries and reset statistics. In-flight computations are detached: later callers for their keys start
 * a fresh computation.
     */
    public void clear() {
        lock.lock();
        try {
            epoch++;
            inFlight.clear();
            entries.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
            expirations = 0;
            coalesced = 0;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            long requests = hits + misses;
            double hitRate = requests > 0 ? (double) hits / requests : 0.0;
            return new CacheStats(hits, misses, evictions, expirations, coalesced, hitRate, entries.size(), maxSize);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop expired entries
     */
    public void cleanup() {
        if (ttl.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            var now = clock.instant();
            var iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                if (isExpired(iterator.next(), now)) {
                    iterator.remove();
                    expirations++;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void storeIfCurrent(K key, V value, long started) {
        lock.lock();
        try {
            if (epoch == started) {
                entries.put(key, new CacheEntry<>(value, clock.instant()));
            } else {
                log.trace("Discarding {} computed before clear", key);
            }
        } finally {
            lock.unlock();
        }
    }

    private V peek(K key) {
        lock.lock();
        try {
            return lookup(key);
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private V lookup(K key) {
        var entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key);
            expirations++;
            return null;
        }
        return entry.value();
    }

    private boolean isExpired(CacheEntry<V> entry, Instant now) {
        return ttl.map(d -> Duration.between(entry.createdAt(), now).compareTo(d) >= 0).orElse(false);
    }

    private static <V> V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    private record CacheEntry<V>(V value, Instant createdAt) {
    }

    public record CacheStats(long hits, long misses, long evictions, long expirations, long coalesced,
                             double hitRate, int currentSize, int maxSize) {
        public String format() {
            return String.format("Cache Stats: %.2f%% hit rate, %d/%d entries, %d hits, %d misses, %d evictions, "
                                 + "%d expirations, %d coalesced", hitRate * 100, currentSize, maxSize, hits,
                                 misses, evictions, expirations, coalesced);
        }
    }
}
