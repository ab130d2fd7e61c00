/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.store.memory;

import com.intuitivedesigns.cachekit.core.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Reference in-memory store.
 *
 * Characteristics:
 * - Thread-safe (ConcurrentHashMap, internally striped)
 * - Lazy expiry: no background sweep
 * - Non-evicting: entries leave only by expiry-on-read, delete or clearAll
 *
 * Reclamation is deliberately asymmetric. A single-key {@link #get} physically removes
 * an expired entry; {@link #getMany} and {@link #exists} only filter it out. Expired
 * entries that are never fetched individually stay in memory until deleted or cleared.
 */
public final class InMemoryStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStore.class);

    private static final int DEFAULT_INITIAL = 256;
    private static final long NO_EXPIRY = Long.MIN_VALUE;

    private final Map<String, Entry> store;
    private final LongSupplier nanoClock;

    public InMemoryStore() {
        this(DEFAULT_INITIAL);
    }

    /**
     * @param initialCapacity Starting size (avoids resizing overhead).
     */
    public InMemoryStore(int initialCapacity) {
        this(initialCapacity, System::nanoTime);
    }

    /**
     * Tuning constructor with an explicit monotonic clock (nanoseconds).
     */
    public InMemoryStore(int initialCapacity, LongSupplier nanoClock) {
        this.store = new ConcurrentHashMap<>(Math.max(1, initialCapacity));
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry entry = store.get(key);
        if (entry == null) {
            log.debug("InMemory GET {} -> MISS", key);
            return Optional.empty();
        }
        if (entry.isExpired(nanoClock.getAsLong())) {
            // Conditional remove: a concurrent set() of a fresh entry must survive
            store.remove(key, entry);
            log.debug("InMemory GET {} -> EXPIRED (removed)", key);
            return Optional.empty();
        }
        log.debug("InMemory GET {} -> HIT", key);
        return Optional.of(entry.copyData());
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        long expiresAt = NO_EXPIRY;
        if (ttl != null) {
            expiresAt = nanoClock.getAsLong() + saturatedNanos(ttl);
        }
        store.put(key, new Entry(Arrays.copyOf(value, value.length), expiresAt));

        if (ttl != null) {
            log.debug("InMemory SET {} (TTL: {})", key, ttl);
        } else {
            log.debug("InMemory SET {}", key);
        }
    }

    @Override
    public void delete(String key) {
        store.remove(key);
        log.debug("InMemory DELETE {}", key);
    }

    @Override
    public boolean exists(String key) {
        Entry entry = store.get(key);
        return entry != null && !entry.isExpired(nanoClock.getAsLong());
    }

    @Override
    public List<Optional<byte[]>> getMany(List<String> keys) {
        final long now = nanoClock.getAsLong();
        List<Optional<byte[]>> out = new ArrayList<>(keys.size());
        for (String key : keys) {
            Entry entry = store.get(key);
            // Filter only. Expired entries are left in place.
            if (entry == null || entry.isExpired(now)) {
                out.add(Optional.empty());
            } else {
                out.add(Optional.of(entry.copyData()));
            }
        }
        log.debug("InMemory MGET {} keys", keys.size());
        return out;
    }

    @Override
    public void deleteMany(List<String> keys) {
        for (String key : keys) {
            store.remove(key);
        }
        log.debug("InMemory MDELETE {} keys", keys.size());
    }

    @Override
    public boolean healthCheck() {
        return true;
    }

    @Override
    public void clearAll() {
        store.clear();
        log.warn("InMemory CLEAR_ALL executed - all entries dropped");
    }

    /**
     * Physical entry count, including expired entries not yet reclaimed.
     */
    public int size() {
        return store.size();
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public StoreStats stats() {
        final long now = nanoClock.getAsLong();
        int total = 0;
        int expired = 0;
        long bytes = 0;
        for (Entry e : store.values()) {
            total++;
            bytes += e.data.length;
            if (e.isExpired(now)) expired++;
        }
        return new StoreStats(total, expired, bytes);
    }

    public void logStats() {
        StoreStats s = stats();
        log.debug("Cache Stats: {} entries ({} expired), {} bytes", s.totalEntries(), s.expiredEntries(), s.totalBytes());
    }

    private static long saturatedNanos(Duration ttl) {
        try {
            return ttl.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE / 2;
        }
    }

    /**
     * Snapshot of store occupancy.
     */
    public record StoreStats(int totalEntries, int expiredEntries, long totalBytes) {}

    private static final class Entry {
        final byte[] data;
        final long expiresAtNanos;

        Entry(byte[] data, long expiresAtNanos) {
            this.data = data;
            this.expiresAtNanos = expiresAtNanos;
        }

        // Live while now <= expiry
        boolean isExpired(long nowNanos) {
            return expiresAtNanos != NO_EXPIRY && nowNanos - expiresAtNanos > 0;
        }

        byte[] copyData() {
            return Arrays.copyOf(data, data.length);
        }
    }
}
