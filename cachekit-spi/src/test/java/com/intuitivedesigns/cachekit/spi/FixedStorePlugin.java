/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.spi;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.core.CacheStore;
import com.intuitivedesigns.cachekit.core.MapStore;

/**
 * Registered through test resources so registry discovery can be exercised without a real backend.
 */
public final class FixedStorePlugin implements StorePlugin {

    @Override
    public String id() {
        return " fixed ";
    }

    @Override
    public CacheStore create(CacheKitConfig config) {
        return new MapStore();
    }
}
