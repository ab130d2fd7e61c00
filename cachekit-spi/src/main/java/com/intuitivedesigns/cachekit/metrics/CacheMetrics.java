/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

import java.time.Duration;

/**
 * The vendor-agnostic observer for cache events.
 *
 * Design Philosophy:
 * The engine reports to this interface only, so it compiles and runs without any
 * metrics library on the classpath. Every method has a no-op default; Micrometer-backed
 * implementations live in the metrics modules.
 *
 * Keys are full composite keys ({@code namespace:id}). Implementations must be safe
 * for concurrent use.
 */
public interface CacheMetrics extends AutoCloseable {

    /**
     * @return true if events are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void recordHit(String key, Duration elapsed) {}

    default void recordMiss(String key, Duration elapsed) {}

    default void recordSet(String key, Duration elapsed) {}

    default void recordDelete(String key, Duration elapsed) {}

    default void recordError(String key, String error) {}

    @Override
    default void close() {
        // no-op by default
    }
}
