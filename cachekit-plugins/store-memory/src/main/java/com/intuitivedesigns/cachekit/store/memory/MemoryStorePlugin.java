/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.store.memory;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.core.CacheStore;
import com.intuitivedesigns.cachekit.spi.StorePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemoryStorePlugin implements StorePlugin {

    public static final String ID = "MEMORY";
    private static final Logger log = LoggerFactory.getLogger(MemoryStorePlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheStore create(CacheKitConfig config) {
        int initial = config.getInt("memory.initial.capacity", 256);
        log.info("Creating in-memory store (initialCapacity={})", initial);
        return new InMemoryStore(initial);
    }
}
