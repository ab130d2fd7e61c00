/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.store.redis;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.core.CacheException;

import java.util.Objects;

/**
 * Immutable connection settings read from {@code redis.*} keys.
 */
public record RedisSettings(String host,
                            int port,
                            String password,
                            int database,
                            int timeoutMs,
                            int poolMax,
                            int poolIdle,
                            int poolMin) {

    // ---- Config keys ----
    static final String KEY_HOST = "redis.host";
    static final String KEY_PORT = "redis.port";
    static final String KEY_PASSWORD = "redis.password";
    static final String KEY_DATABASE = "redis.database";
    static final String KEY_TIMEOUT = "redis.timeout.ms";
    static final String KEY_POOL_MAX = "redis.pool.max";
    static final String KEY_POOL_IDLE = "redis.pool.idle";
    static final String KEY_POOL_MIN = "redis.pool.min";

    public static RedisSettings from(CacheKitConfig config) throws CacheException {
        Objects.requireNonNull(config, "config");

        String host = normalize(config.getString(KEY_HOST, "localhost"));
        if (host == null) {
            throw CacheException.config("Blank value for " + KEY_HOST);
        }
        int port = config.getInt(KEY_PORT, 6379);
        if (port < 1 || port > 65_535) {
            throw CacheException.config(KEY_PORT + " out of range: " + port);
        }
        int database = config.getInt(KEY_DATABASE, 0);
        if (database < 0) {
            throw CacheException.config(KEY_DATABASE + " must be >= 0: " + database);
        }
        int timeout = config.getInt(KEY_TIMEOUT, 2000);
        if (timeout <= 0) {
            throw CacheException.config(KEY_TIMEOUT + " must be > 0: " + timeout);
        }
        int poolMax = config.getInt(KEY_POOL_MAX, 16);
        if (poolMax <= 0) {
            throw CacheException.config(KEY_POOL_MAX + " must be > 0: " + poolMax);
        }
        int poolIdle = Math.min(poolMax, Math.max(0, config.getInt(KEY_POOL_IDLE, 8)));
        int poolMin = Math.min(poolIdle, Math.max(0, config.getInt(KEY_POOL_MIN, 2)));

        return new RedisSettings(host, port, normalize(config.getString(KEY_PASSWORD, null)),
                database, timeout, poolMax, poolIdle, poolMin);
    }

    @Override
    public String toString() {
        return "RedisSettings{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database=" + database +
                ", timeoutMs=" + timeoutMs +
                ", poolMax=" + poolMax +
                ", poolIdle=" + poolIdle +
                ", poolMin=" + poolMin +
                ", password=" + (password == null ? "none" : "****") +
                '}';
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
