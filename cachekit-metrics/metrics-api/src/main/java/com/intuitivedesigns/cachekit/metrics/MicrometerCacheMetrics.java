/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer-backed cache metrics.
 *
 * Meters:
 * - cache.hits / cache.misses / cache.sets / cache.deletes / cache.errors (counters)
 * - cache.latency (timer, tagged with outcome=hit|miss|set|delete)
 *
 * Every meter carries a {@code namespace} tag derived from the key.
 */
public class MicrometerCacheMetrics implements CacheMetrics {

    private static final Logger log = LoggerFactory.getLogger(MicrometerCacheMetrics.class);

    public static final String HITS = "cache.hits";
    public static final String MISSES = "cache.misses";
    public static final String SETS = "cache.sets";
    public static final String DELETES = "cache.deletes";
    public static final String ERRORS = "cache.errors";
    public static final String LATENCY = "cache.latency";

    public static final String TAG_NAMESPACE = "namespace";
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;
    private final String type;
    private final AutoCloseable onClose;

    public MicrometerCacheMetrics(MeterRegistry registry) {
        this(registry, "MICROMETER", null);
    }

    /**
     * @param onClose Extra resource released after the registry (e.g. an HTTP endpoint). May be null.
     */
    public MicrometerCacheMetrics(MeterRegistry registry, String type, AutoCloseable onClose) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.type = (type == null || type.isBlank()) ? "MICROMETER" : type;
        this.onClose = onClose;
    }

    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void recordHit(String key, Duration elapsed) {
        record(HITS, "hit", key, elapsed);
    }

    @Override
    public void recordMiss(String key, Duration elapsed) {
        record(MISSES, "miss", key, elapsed);
    }

    @Override
    public void recordSet(String key, Duration elapsed) {
        record(SETS, "set", key, elapsed);
    }

    @Override
    public void recordDelete(String key, Duration elapsed) {
        record(DELETES, "delete", key, elapsed);
    }

    @Override
    public void recordError(String key, String error) {
        counter(ERRORS, MetricsUtil.namespaceOf(key)).increment();
        log.debug("Cache error recorded for {}: {}", key, error);
    }

    @Override
    public void close() {
        if (onClose != null) {
            try {
                onClose.close();
            } catch (Exception e) {
                log.warn("Failed to release metrics resource for {}: {}", type, e.getMessage());
            }
        }
        registry.close();
    }

    private void record(String counterName, String outcome, String key, Duration elapsed) {
        final String ns = MetricsUtil.namespaceOf(key);
        counter(counterName, ns).increment();
        if (elapsed != null && !elapsed.isNegative()) {
            Timer.builder(LATENCY)
                    .description("Cache operation latency")
                    .tag(TAG_NAMESPACE, ns)
                    .tag(TAG_OUTCOME, outcome)
                    .register(registry)
                    .record(elapsed);
        }
    }

    private Counter counter(String name, String namespace) {
        return Counter.builder(name)
                .tag(TAG_NAMESPACE, namespace)
                .register(registry);
    }
}
