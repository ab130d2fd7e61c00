/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public CacheMetrics create(MetricsSettings s) {
        // Only claims the factory for an explicit 'metrics.provider=NOOP'
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return NoopCacheMetrics.INSTANCE;
    }
}
