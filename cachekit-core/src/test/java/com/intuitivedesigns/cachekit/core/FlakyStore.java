/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import com.intuitivedesigns.cachekit.store.memory.InMemoryStore;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps an {@link InMemoryStore}; the first {@code failingGets} reads and every write while
 * {@code failWrites} is set throw BACKEND.
 */
final class FlakyStore implements CacheStore {

    final InMemoryStore delegate = new InMemoryStore();
    final AtomicInteger getCalls = new AtomicInteger();
    final AtomicInteger setCalls = new AtomicInteger();
    volatile int failingGets;
    volatile boolean failWrites;

    FlakyStore failingGets(int n) {
        this.failingGets = n;
        return this;
    }

    FlakyStore failWrites() {
        this.failWrites = true;
        return this;
    }

    @Override
    public Optional<byte[]> get(String key) throws CacheException {
        if (getCalls.incrementAndGet() <= failingGets) {
            throw CacheException.backend("connection reset reading " + key, null);
        }
        return delegate.get(key);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws CacheException {
        setCalls.incrementAndGet();
        if (failWrites) {
            throw CacheException.backend("read-only replica", null);
        }
        delegate.set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        delegate.delete(key);
    }
}
