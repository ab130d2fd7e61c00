/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.config;

import com.intuitivedesigns.cachekit.core.CacheException;
import com.intuitivedesigns.cachekit.core.CacheStore;
import com.intuitivedesigns.cachekit.spi.StorePlugin;
import com.intuitivedesigns.cachekit.spi.StorePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves {@code cache.store} to a {@link StorePlugin} on the classpath and builds the store.
 */
public final class StoreFactory {

    private static final Logger log = LoggerFactory.getLogger(StoreFactory.class);

    static final String KEY_STORE_TYPE = "cache.store";
    static final String DEFAULT_STORE = "MEMORY";

    private static final StorePluginRegistry REGISTRY = new StorePluginRegistry(resolveClassLoader());

    private StoreFactory() {}

    public static CacheStore createStore(CacheKitConfig config) throws CacheException {
        Objects.requireNonNull(config, "config");

        final String id = normalizeId(config.getString(KEY_STORE_TYPE, DEFAULT_STORE), DEFAULT_STORE);
        final StorePlugin plugin;
        try {
            plugin = REGISTRY.require(id, KEY_STORE_TYPE);
        } catch (IllegalArgumentException e) {
            throw CacheException.config(e.getMessage());
        }

        try {
            final CacheStore store = plugin.create(config);
            log.info("Cache store created: {}", plugin.id());
            return store;
        } catch (RuntimeException e) {
            throw new CacheException(CacheException.Kind.CONFIG,
                    "Failed creating store [" + plugin.id() + "]: " + e.getMessage(), e);
        }
    }

    public static void logAvailablePlugins() {
        log.info("Store plugins: {}", REGISTRY.availableIds());
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : StoreFactory.class.getClassLoader();
    }
}
