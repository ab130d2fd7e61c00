/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.util.Optional;

/**
 * Reusable feeder: carries the requested id in, the result out. Not thread-safe; one per call.
 */
public class GenericFeeder<T, K> implements CacheFeeder<T, K> {

    private final K id;
    private T result;

    public GenericFeeder(K id) {
        this.id = id;
    }

    @Override
    public K requestedId() {
        return id;
    }

    @Override
    public void deliver(T entity) {
        this.result = entity;
    }

    @Override
    public void validate() throws CacheException {
        if (id == null) {
            throw CacheException.validation("Requested id is null");
        }
        if (id.toString().isBlank()) {
            throw CacheException.validation("Requested id is blank");
        }
    }

    public Optional<T> result() {
        return Optional.ofNullable(result);
    }

    public boolean hasResult() {
        return result != null;
    }

    /**
     * Hands the result to the caller and clears it.
     */
    public Optional<T> take() {
        T out = result;
        result = null;
        return Optional.ofNullable(out);
    }
}
