/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

/**
 * Caller-side hook object: names the id to load and receives the result.
 *
 * <p>A feeder is owned by one call site and is not shared between threads. The hooks
 * run in this order on success with a value: {@link #onHit}, {@link #onLoaded},
 * {@link #deliver}. On success without a value: {@link #onMiss}, then
 * {@link #deliver} with {@code null}.</p>
 *
 * @param <T> entity type
 * @param <K> id type
 */
public interface CacheFeeder<T, K> {

    /**
     * @return the id to look up. Called once per attempt, after {@link #validate()}.
     */
    K requestedId();

    /**
     * Receive the loaded entity, or {@code null} when nothing was found.
     */
    void deliver(T entity);

    /**
     * Reject the request before any store or provider access (e.g. blank id).
     */
    default void validate() throws CacheException {
    }

    default void onHit(String key) throws CacheException {
    }

    default void onMiss(String key) throws CacheException {
    }

    default void onLoaded(T entity) throws CacheException {
    }
}
