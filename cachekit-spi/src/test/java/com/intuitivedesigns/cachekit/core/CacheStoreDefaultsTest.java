/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CacheStoreDefaultsTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void existsDelegatesToGet() throws CacheException {
        MapStore store = new MapStore();
        store.set("user:1", b("a"), null);

        assertTrue(store.exists("user:1"));
        assertFalse(store.exists("user:2"));
        assertEquals(2, store.getCalls);
    }

    @Test
    void getManyPreservesOrderAndMarksAbsentPositions() throws CacheException {
        MapStore store = new MapStore();
        store.set("k:1", b("one"), null);
        store.set("k:3", b("three"), null);

        List<Optional<byte[]>> out = store.getMany(List.of("k:3", "k:2", "k:1"));

        assertEquals(3, out.size());
        assertArrayEquals(b("three"), out.get(0).orElseThrow());
        assertTrue(out.get(1).isEmpty());
        assertArrayEquals(b("one"), out.get(2).orElseThrow());
    }

    @Test
    void deleteManyRemovesEveryKey() throws CacheException {
        MapStore store = new MapStore();
        store.set("k:1", b("1"), null);
        store.set("k:2", b("2"), null);
        store.set("k:3", b("3"), null);

        store.deleteMany(List.of("k:1", "k:2", "k:missing"));

        assertEquals(1, store.data.size());
        assertTrue(store.data.containsKey("k:3"));
    }

    @Test
    void healthCheckDefaultsToHealthy() throws CacheException {
        assertTrue(new MapStore().healthCheck());
    }

    @Test
    void clearAllIsNotImplementedByDefault() {
        CacheException e = assertThrows(CacheException.class, () -> new MapStore().clearAll());
        assertEquals(CacheException.Kind.NOT_IMPLEMENTED, e.kind());
    }

    @Test
    void closeIsNoOpByDefault() {
        assertDoesNotThrow(() -> new MapStore().close());
    }
}
