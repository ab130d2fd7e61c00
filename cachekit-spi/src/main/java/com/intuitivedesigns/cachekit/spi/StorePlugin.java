/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.spi;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.core.CacheException;
import com.intuitivedesigns.cachekit.core.CacheStore;

/**
 * SPI Factory for creating {@link CacheStore} instances.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.cachekit.spi.StorePlugin}.</p>
 *
 * Example IDs: "MEMORY", "REDIS"
 */
public interface StorePlugin {

    /**
     * @return The unique ID of this plugin, matched against {@code cache.store}.
     */
    String id();

    /**
     * Creates a new store from configuration.
     *
     * @throws CacheException with kind CONFIG or BACKEND if the store cannot be built
     */
    CacheStore create(CacheKitConfig config) throws CacheException;
}
