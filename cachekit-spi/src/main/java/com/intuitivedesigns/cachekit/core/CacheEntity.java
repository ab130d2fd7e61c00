/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

/**
 * Implemented by every type stored through the engine.
 *
 * <p>The namespace, id parser and envelope binding live on the entity's
 * {@code EntityType} descriptor so they cannot vary per instance.</p>
 *
 * @param <K> id type; its {@code toString()} must re-parse losslessly
 */
public interface CacheEntity<K> {

    /**
     * @return this entity's id, e.g. {@code "emp_12345"}
     */
    K cacheKey();

    /**
     * Self-check run on every entity before it is delivered to a feeder.
     *
     * @throws CacheException with kind VALIDATION when the entity is inconsistent
     */
    default void validate() throws CacheException {
        // Default: always valid
    }
}
