/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.store.redis;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.core.CacheException;
import com.intuitivedesigns.cachekit.core.CacheStore;
import com.intuitivedesigns.cachekit.spi.StorePluginRegistry;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.net.SocketTimeoutException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * No server required: covers error translation and plugin wiring only.
 */
class RedisStoreTest {

    @Test
    void socketTimeoutBecomesTimeout() {
        JedisConnectionException e = new JedisConnectionException(new SocketTimeoutException("Read timed out"));

        CacheException translated = RedisStore.translate("GET user:1", e);

        assertEquals(CacheException.Kind.TIMEOUT, translated.kind());
        assertSame(e, translated.getCause());
    }

    @Test
    void otherFailuresBecomeBackend() {
        CacheException translated = RedisStore.translate("SET user:1", new JedisConnectionException("Connection refused"));

        assertEquals(CacheException.Kind.BACKEND, translated.kind());
        assertTrue(translated.getMessage().contains("SET user:1"));
    }

    @Test
    void unreachableServerSurfacesAsCacheException() throws CacheException {
        CacheKitConfig config = CacheKitConfig.of(Map.of(
                "redis.host", "127.0.0.1",
                "redis.port", "1",
                "redis.timeout.ms", "200"
        ));

        try (CacheStore store = new StorePluginRegistry().require("redis", "cache.store").create(config)) {
            CacheException e = assertThrows(CacheException.class, () -> store.get("user:1"));
            assertTrue(e.kind().retryable());
        }
    }
}
