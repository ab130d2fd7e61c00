/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.store.redis;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.core.CacheException;
import com.intuitivedesigns.cachekit.core.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed store.
 * Features:
 * - JedisPool for high-throughput concurrency (the pool is the synchronization)
 * - Config-driven factory
 * - Millisecond TTLs via PSETEX
 * - Socket timeouts surface as TIMEOUT, everything else as BACKEND
 */
public final class RedisStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisStore.class);

    private final JedisPool jedisPool;
    private final String description;

    public RedisStore(JedisPool pool, String description) {
        this.jedisPool = Objects.requireNonNull(pool, "pool");
        this.description = (description == null || description.isBlank()) ? "redis" : description;
    }

    /**
     * Factory: builds the pool from {@code redis.*} keys.
     */
    public static RedisStore fromConfig(CacheKitConfig config) throws CacheException {
        RedisSettings s = RedisSettings.from(config);

        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(s.poolMax());
        poolConfig.setMaxIdle(s.poolIdle());
        poolConfig.setMinIdle(s.poolMin());
        poolConfig.setTestOnBorrow(false); // fast borrow
        poolConfig.setTestWhileIdle(true); // health check in background

        JedisPool pool;
        try {
            // A null password means no AUTH
            pool = new JedisPool(poolConfig, s.host(), s.port(), s.timeoutMs(), s.password(), s.database());
        } catch (JedisException e) {
            throw CacheException.backend("Failed to create Redis pool for " + s.host() + ":" + s.port(), e);
        }

        log.info("Redis store active: {}:{}/{} (pool max={})", s.host(), s.port(), s.database(), s.poolMax());
        return new RedisStore(pool, s.host() + ":" + s.port());
    }

    @Override
    public Optional<byte[]> get(String key) throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            byte[] raw = jedis.get(bytes(key));
            log.debug("Redis GET {} -> {}", key, raw == null ? "MISS" : "HIT");
            return Optional.ofNullable(raw);
        } catch (JedisException e) {
            throw translate("GET " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            // Atomic Set-with-Expiry
            if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                jedis.psetex(bytes(key), Math.max(1L, ttl.toMillis()), value);
                log.debug("Redis SET {} (TTL: {}ms)", key, ttl.toMillis());
            } else {
                jedis.set(bytes(key), value);
                log.debug("Redis SET {}", key);
            }
        } catch (JedisException e) {
            throw translate("SET " + key, e);
        }
    }

    @Override
    public void delete(String key) throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(bytes(key));
            log.debug("Redis DELETE {}", key);
        } catch (JedisException e) {
            throw translate("DEL " + key, e);
        }
    }

    @Override
    public boolean exists(String key) throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.exists(bytes(key));
        } catch (JedisException e) {
            throw translate("EXISTS " + key, e);
        }
    }

    @Override
    public List<Optional<byte[]>> getMany(List<String> keys) throws CacheException {
        if (keys.isEmpty()) return List.of();
        try (Jedis jedis = jedisPool.getResource()) {
            List<byte[]> raw = jedis.mget(bytes(keys));
            List<Optional<byte[]>> out = new ArrayList<>(raw.size());
            for (byte[] b : raw) {
                out.add(Optional.ofNullable(b));
            }
            log.debug("Redis MGET {} keys", keys.size());
            return out;
        } catch (JedisException e) {
            throw translate("MGET (" + keys.size() + " keys)", e);
        }
    }

    @Override
    public void deleteMany(List<String> keys) throws CacheException {
        if (keys.isEmpty()) return;
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(bytes(keys));
            log.debug("Redis MDELETE {} keys", keys.size());
        } catch (JedisException e) {
            throw translate("DEL (" + keys.size() + " keys)", e);
        }
    }

    @Override
    public boolean healthCheck() throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            return "PONG".equalsIgnoreCase(jedis.ping());
        } catch (JedisException e) {
            throw translate("PING", e);
        }
    }

    @Override
    public void clearAll() throws CacheException {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.flushDB();
            log.warn("Redis FLUSHDB executed on {} - all entries dropped", description);
        } catch (JedisException e) {
            throw translate("FLUSHDB", e);
        }
    }

    @Override
    public void close() {
        if (!jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis store closed: {}", description);
        }
    }

    static CacheException translate(String op, JedisException e) {
        if (hasCause(e, SocketTimeoutException.class)) {
            return CacheException.timeout("Redis " + op + " timed out", e);
        }
        return CacheException.backend("Redis " + op + " failed: " + e.getMessage(), e);
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) return true;
            if (c.getCause() == c) break;
        }
        return false;
    }

    private static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[][] bytes(List<String> keys) {
        byte[][] out = new byte[keys.size()][];
        for (int i = 0; i < out.length; i++) {
            out[i] = bytes(keys.get(i));
        }
        return out;
    }
}
