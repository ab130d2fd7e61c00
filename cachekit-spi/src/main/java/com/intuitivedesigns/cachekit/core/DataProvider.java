/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Source of truth consulted on a cache miss (typically a database repository).
 *
 * <p>Absence is not an error: return {@code Optional.empty()}. Report an unreachable
 * source with a REPOSITORY (or TIMEOUT) {@link CacheException}.</p>
 *
 * @param <T> entity type
 * @param <K> id type
 */
public interface DataProvider<T, K> {

    Optional<T> fetchById(K id) throws CacheException;

    /**
     * Bulk fetch, one slot per id in request order.
     */
    default List<Optional<T>> fetchByIds(List<K> ids) throws CacheException {
        List<Optional<T>> out = new ArrayList<>(ids.size());
        for (K id : ids) {
            out.add(fetchById(id));
        }
        return out;
    }

    default long count() throws CacheException {
        throw CacheException.notImplemented("count not implemented for " + getClass().getSimpleName());
    }

    default List<T> fetchAll() throws CacheException {
        throw CacheException.notImplemented("fetchAll not implemented for " + getClass().getSimpleName());
    }
}
