/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Map-backed source of truth for examples and tests. Counts every {@link #fetchById} call.
 */
public class InMemoryProvider<T extends CacheEntity<K>, K> implements DataProvider<T, K> {

    private final Map<K, T> data = new ConcurrentHashMap<>();
    private final LongAdder fetches = new LongAdder();

    public InMemoryProvider<T, K> put(T entity) {
        Objects.requireNonNull(entity, "entity");
        data.put(entity.cacheKey(), entity);
        return this;
    }

    public void remove(K id) {
        data.remove(id);
    }

    public void clear() {
        data.clear();
    }

    @Override
    public Optional<T> fetchById(K id) {
        fetches.increment();
        return Optional.ofNullable(data.get(id));
    }

    @Override
    public long count() {
        return data.size();
    }

    @Override
    public List<T> fetchAll() {
        return new ArrayList<>(data.values());
    }

    public long fetchCount() {
        return fetches.sum();
    }

    public void resetFetchCount() {
        fetches.reset();
    }
}
