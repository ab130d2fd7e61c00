/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * In-process registry with no export. Useful for tests and for reading meters programmatically.
 */
public final class SimpleMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "SIMPLE";
    }

    @Override
    public CacheMetrics create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        final SimpleMeterRegistry reg = new SimpleMeterRegistry();
        MetricsUtil.applyCommonTags(reg, s);
        return new MicrometerCacheMetrics(reg, "SIMPLE", null);
    }
}
