/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.store.redis;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.core.CacheException;
import com.intuitivedesigns.cachekit.core.CacheStore;
import com.intuitivedesigns.cachekit.spi.StorePlugin;

public final class RedisStorePlugin implements StorePlugin {

    public static final String ID = "REDIS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheStore create(CacheKitConfig config) throws CacheException {
        return RedisStore.fromConfig(config);
    }
}
