/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

/**
 * Service Provider Interface (SPI) for cache metrics backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.cachekit.metrics.MetricsProvider}.</p>
 */
public interface MetricsProvider {

    /**
     * The unique identifier for this provider (e.g., "SIMPLE", "PROMETHEUS").
     * <p>Matched against the {@code metrics.provider} configuration.</p>
     */
    String id();

    /**
     * Creates a metrics sink if the settings select this provider.
     *
     * @return a {@link CacheMetrics} if this provider is selected, or {@code null} to be skipped.
     */
    CacheMetrics create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
