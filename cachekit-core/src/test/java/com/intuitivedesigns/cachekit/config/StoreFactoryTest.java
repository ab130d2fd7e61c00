/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.config;

import com.intuitivedesigns.cachekit.core.CacheException;
import com.intuitivedesigns.cachekit.core.CacheStore;
import com.intuitivedesigns.cachekit.store.memory.InMemoryStore;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StoreFactoryTest {

    @Test
    void defaultsToMemory() throws CacheException {
        try (CacheStore store = StoreFactory.createStore(CacheKitConfig.of(Map.of()))) {
            assertInstanceOf(InMemoryStore.class, store);
        }
    }

    @Test
    void blankFallsBackToDefault() throws CacheException {
        try (CacheStore store = StoreFactory.createStore(CacheKitConfig.of(Map.of("cache.store", "  ")))) {
            assertInstanceOf(InMemoryStore.class, store);
        }
    }

    @Test
    void unknownStoreIsConfigErrorListingOptions() {
        CacheException e = assertThrows(CacheException.class,
                () -> StoreFactory.createStore(CacheKitConfig.of(Map.of("cache.store", "memcached"))));

        assertEquals(CacheException.Kind.CONFIG, e.kind());
        assertTrue(e.getMessage().contains("MEMORY"));
        assertDoesNotThrow(StoreFactory::logAvailablePlugins);
    }
}
