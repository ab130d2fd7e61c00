/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsFactoryTest {

    @Test
    void unconfiguredFallsBackToNoop() {
        MetricsSettings settings = MetricsSettings.from(CacheKitConfig.of(Map.of()));

        assertEquals("NONE", settings.providerId);
        assertSame(NoopCacheMetrics.INSTANCE, MetricsFactory.init(settings));
    }

    @Test
    void unknownProviderFallsBackToNoop() {
        MetricsSettings settings = MetricsSettings.from(CacheKitConfig.of(Map.of("metrics.provider", "statsd")));

        CacheMetrics metrics = MetricsFactory.init(settings);
        assertFalse(metrics.enabled());
        assertEquals("NOOP", metrics.type());
    }

    @Test
    void simpleProviderAppliesCommonTags() {
        MetricsSettings settings = MetricsSettings.from(CacheKitConfig.of(Map.of(
                "metrics.provider", " simple ",
                "metrics.tag.env", "prod",
                "metrics.tag.blank", "  ")));

        assertEquals(Map.of("env", "prod"), settings.commonTags);

        CacheMetrics metrics = MetricsFactory.init(settings);
        assertInstanceOf(MicrometerCacheMetrics.class, metrics);
        assertEquals("SIMPLE", metrics.type());

        metrics.recordHit("user:1", null);
        MeterRegistry registry = ((MicrometerCacheMetrics) metrics).registry();
        assertEquals(1.0, registry.get(MicrometerCacheMetrics.HITS)
                .tags("env", "prod", "namespace", "user").counter().count());
        metrics.close();
    }

    @Test
    void settingsClampPortAndNormalizePath() {
        MetricsSettings settings = MetricsSettings.from(CacheKitConfig.of(Map.of(
                "metrics.prometheus.port", "99999",
                "metrics.prometheus.path", "scrape")));

        assertEquals(65_535, settings.prometheusPort);
        assertEquals("/scrape", settings.prometheusPath);
        assertTrue(settings.toString().contains("prometheusPort=65535"));
    }

    @Test
    void noopSinkIgnoresEverything() {
        CacheMetrics noop = NoopCacheMetrics.INSTANCE;
        assertDoesNotThrow(() -> {
            noop.recordHit("user:1", null);
            noop.recordError("user:1", "x");
            noop.close();
        });
    }
}
