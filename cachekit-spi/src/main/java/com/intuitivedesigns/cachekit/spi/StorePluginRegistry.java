/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry for store plugin discovery.
 *
 * <p><b>Performance Note:</b> This class performs the ServiceLoader classpath scan
 * <b>once</b> at construction and caches the results. Subsequent lookups are O(1).</p>
 */
public final class StorePluginRegistry {

    private final Map<String, StorePlugin> byId;

    public StorePluginRegistry() {
        this(resolveClassLoader());
    }

    public StorePluginRegistry(ClassLoader cl) {
        Map<String, StorePlugin> tmp = new LinkedHashMap<>();
        for (StorePlugin plugin : ServiceLoader.load(StorePlugin.class, cl)) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate store plugin ID '" + id + "'. Conflict between: "
                        + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    public StorePlugin require(String id, String configKeyName) {
        StorePlugin plugin = byId.get(PluginIds.normalize(id));
        if (plugin == null) {
            throw new IllegalArgumentException("No store plugin found for '" + configKeyName + "=" + id + "'. "
                    + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<StorePlugin> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }

    private static ClassLoader resolveClassLoader() {
        ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : StorePluginRegistry.class.getClassLoader();
    }
}
