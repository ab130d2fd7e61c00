/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static CacheMetrics init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        final ClassLoader cl = resolveClassLoader();
        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, cl);

        for (MetricsProvider p : loader) {
            try {
                final CacheMetrics metrics = p.create(settings);
                if (metrics != null) {
                    log.info("Cache metrics initialized: {} ({})", p.id(), p.getClass().getName());
                    return metrics;
                }
            } catch (LinkageError | RuntimeException e) {
                // LinkageError covers a provider whose backend jar is missing
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), e.getMessage());
                log.debug("Provider init stack trace:", e);
            }
        }

        log.info("Metrics disabled or no provider matched '{}' (NOOP active).", settings.providerId);
        return NoopCacheMetrics.INSTANCE;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
