/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

/**
 * Default sink: discards every event.
 */
public final class NoopCacheMetrics implements CacheMetrics {

    public static final NoopCacheMetrics INSTANCE = new NoopCacheMetrics();

    private NoopCacheMetrics() {}
}
