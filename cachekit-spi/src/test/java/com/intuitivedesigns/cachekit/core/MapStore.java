/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implements only the required operations so the interface defaults are what gets tested.
 */
public final class MapStore implements CacheStore {

    final Map<String, byte[]> data = new ConcurrentHashMap<>();
    int getCalls;

    @Override
    public Optional<byte[]> get(String key) {
        getCalls++;
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        data.put(key, value);
    }

    @Override
    public void delete(String key) {
        data.remove(key);
    }
}
