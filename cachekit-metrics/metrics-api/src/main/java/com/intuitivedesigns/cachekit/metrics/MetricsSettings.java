/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.metrics;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable configuration container for cache metrics.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";
    private static final String KEY_PROM_PATH = "metrics.prometheus.path";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_PROM_PATH = "/metrics";

    public final String providerId;
    public final Map<String, String> commonTags;

    /** 0 disables the scrape endpoint; the registry is still created. */
    public final int prometheusPort;
    public final String prometheusPath;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort, String prometheusPath) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
        this.prometheusPath = prometheusPath;
    }

    public static MetricsSettings from(CacheKitConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        final Map<String, String> tags = new TreeMap<>();
        for (Map.Entry<String, String> e : config.withPrefix(KEY_TAG_PREFIX).entrySet()) {
            final String k = normalize(e.getKey());
            final String v = normalize(e.getValue());
            if (k != null && v != null) {
                tags.put(k, v);
            }
        }

        final int port = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);

        String path = normalize(config.getString(KEY_PROM_PATH, DEFAULT_PROM_PATH));
        if (path == null) path = DEFAULT_PROM_PATH;
        if (!path.startsWith("/")) path = "/" + path;

        return new MetricsSettings(provider == null ? DEFAULT_PROVIDER : provider,
                Collections.unmodifiableMap(tags), port, path);
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheusPort=" + prometheusPort +
                ", prometheusPath='" + prometheusPath + '\'' +
                '}';
    }

    // --- Helpers ---

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
