package com.mailattribution.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory TTL cache guarded by a read/write lock.
 *
 * <p>Lookups take the read lock only. {@link #getOrFetch} calls the upstream supplier outside any
 * lock and takes the write lock just to store the result, so a slow fetch never blocks readers.
 * Values rejected by the cacheability predicate (typically empty results) are returned but not
 * stored.
 */
@Slf4j
public class CacheStore<K, V> {

    private final String name;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Predicate<V> cacheable;

    private final Map<K, CacheEntry<V>> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public CacheStore(String name, Clock clock, Duration defaultTtl, Predicate<V> cacheable) {
        this.name = name;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.cacheable = cacheable;
    }

    public CacheStore(String name, Clock clock, Duration defaultTtl) {
        this(name, clock, defaultTtl, value -> value != null);
    }

    /** Returns the live value for the key, if any. */
    public Optional<V> get(K key) {
        return getEntry(key).map(CacheEntry::getValue);
    }

    /** Returns the live entry for the key; expired entries are treated as absent. */
    public Optional<CacheEntry<V>> getEntry(K key) {
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null || entry.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the entry for the key even when expired. Used to fall back to the previous value
     * when a refresh fails.
     */
    public Optional<V> getStale(K key) {
        lock.readLock().lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.getValue());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean put(K key, V value) {
        return put(key, value, defaultTtl);
    }

    /**
     * Stores a value with an explicit TTL.
     *
     * @return false when the value was rejected by the cacheability predicate
     */
    public boolean put(K key, V value, Duration ttl) {
        if (!cacheable.test(value)) {
            log.debug("Cache {}: not caching rejected value for key {}", name, key);
            return false;
        }
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            entries.put(key, new CacheEntry<>(value, now, ttl));
        } finally {
            lock.writeLock().unlock();
        }
        return true;
    }

    /**
     * Returns the cached value or fetches, stores and returns a fresh one. Concurrent misses for
     * the same key may each call the supplier; the last store wins.
     */
    public V getOrFetch(K key, Supplier<V> fetcher) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            log.debug("Cache {}: hit for {}", name, key);
            return cached.get();
        }
        log.debug("Cache {}: miss for {}", name, key);
        V value = fetcher.get();
        put(key, value);
        return value;
    }

    public void invalidate(K key) {
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drops expired entries; returns how many were removed. */
    public int evictExpired() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getName() {
        return name;
    }
}
