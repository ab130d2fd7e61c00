/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import com.intuitivedesigns.cachekit.metrics.CacheMetrics;
import com.intuitivedesigns.cachekit.metrics.NoopCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Strategy and retry engine.
 *
 * Per call:
 * 1. Validate the feeder, build the key from its id
 * 2. Run the strategy against store and provider (retried with exponential backoff)
 * 3. Hand the result to the feeder and report it to metrics
 *
 * Holds no mutable state: one instance serves any number of threads. Concurrent misses
 * on the same key each consult the provider; there is no request coalescing.
 */
public final class CacheOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CacheOrchestrator.class);

    static final long BACKOFF_BASE_MS = 100L;
    private static final int MAX_BACKOFF_SHIFT = 20;

    private final CacheStore store;
    private final CacheMetrics metrics;
    private final TtlPolicy ttlPolicy;

    public CacheOrchestrator(CacheStore store) {
        this(store, NoopCacheMetrics.INSTANCE, TtlPolicy.useStoreDefault());
    }

    public CacheOrchestrator(CacheStore store, CacheMetrics metrics, TtlPolicy ttlPolicy) {
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.ttlPolicy = Objects.requireNonNull(ttlPolicy, "ttlPolicy");
    }

    public CacheOrchestrator withMetrics(CacheMetrics metrics) {
        return new CacheOrchestrator(store, metrics, ttlPolicy);
    }

    public CacheOrchestrator withTtlPolicy(TtlPolicy policy) {
        return new CacheOrchestrator(store, metrics, policy);
    }

    public CacheStore store() {
        return store;
    }

    public CacheMetrics metrics() {
        return metrics;
    }

    public TtlPolicy ttlPolicy() {
        return ttlPolicy;
    }

    public <T extends CacheEntity<K>, K> void execute(EntityType<T, K> type,
                                                     CacheFeeder<T, K> feeder,
                                                     DataProvider<T, K> provider,
                                                     CacheStrategy strategy) throws CacheException {
        execute(type, feeder, provider, strategy, OperationConfig.defaults());
    }

    /**
     * Runs {@code strategy} for the feeder's id. On return the feeder holds the entity or absence.
     *
     * @throws CacheException the last attempt's error once retries are exhausted
     */
    public <T extends CacheEntity<K>, K> void execute(EntityType<T, K> type,
                                                     CacheFeeder<T, K> feeder,
                                                     DataProvider<T, K> provider,
                                                     CacheStrategy strategy,
                                                     OperationConfig config) throws CacheException {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(feeder, "feeder");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(config, "config");

        final long maxAttempts = (long) config.retryCount() + 1;
        CacheException last = null;

        for (long attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                executeOnce(type, feeder, provider, strategy, config);
                return;
            } catch (CacheException e) {
                last = e;
                if (attempt < maxAttempts) {
                    final long backoffMs = backoffMillis(attempt);
                    log.warn("Cache operation failed for namespace={} (attempt {}/{}), retrying in {}ms: {}",
                            type.namespace(), attempt, maxAttempts, backoffMs, e.toString());
                    try {
                        Thread.sleep(backoffMs);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        log.warn("Retry backoff interrupted; giving up after attempt {}", attempt);
                        throw last;
                    }
                }
            }
        }
        throw last;
    }

    static long backoffMillis(long attempt) {
        return BACKOFF_BASE_MS << (int) Math.min(attempt - 1, MAX_BACKOFF_SHIFT);
    }

    private <T extends CacheEntity<K>, K> void executeOnce(EntityType<T, K> type,
                                                          CacheFeeder<T, K> feeder,
                                                          DataProvider<T, K> provider,
                                                          CacheStrategy strategy,
                                                          OperationConfig config) throws CacheException {
        feeder.validate();

        final K id = feeder.requestedId();
        if (id == null) {
            throw CacheException.validation("Feeder returned a null id for namespace " + type.namespace());
        }
        final String key = type.key(id);

        final long start = System.nanoTime();
        final Optional<T> result;
        try {
            result = runStrategy(type, key, provider, strategy, config);
        } catch (CacheException e) {
            metrics.recordError(key, e.toString());
            throw e;
        }
        final Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (result.isPresent()) {
            final T entity = result.get();
            entity.validate();
            feeder.onHit(key);
            feeder.onLoaded(entity);
            feeder.deliver(entity);
            metrics.recordHit(key, elapsed);
            log.debug("{} {} -> HIT ({}us)", strategy, key, elapsed.toNanos() / 1_000);
        } else {
            feeder.onMiss(key);
            feeder.deliver(null);
            metrics.recordMiss(key, elapsed);
            log.debug("{} {} -> MISS ({}us)", strategy, key, elapsed.toNanos() / 1_000);
        }
    }

    private <T extends CacheEntity<K>, K> Optional<T> runStrategy(EntityType<T, K> type,
                                                                 String key,
                                                                 DataProvider<T, K> provider,
                                                                 CacheStrategy strategy,
                                                                 OperationConfig config) throws CacheException {
        switch (strategy) {
            case FRESH:
                return readStore(type, key);

            case REFRESH: {
                final Optional<T> cached = readStore(type, key);
                if (cached.isPresent()) {
                    return cached;
                }
                return loadAndStore(type, key, provider, config);
            }

            case INVALIDATE: {
                final long start = System.nanoTime();
                store.delete(key);
                metrics.recordDelete(key, Duration.ofNanos(System.nanoTime() - start));
                return loadAndStore(type, key, provider, config);
            }

            case BYPASS:
                return loadAndStore(type, key, provider, config);

            default:
                throw new IllegalStateException("Unhandled strategy " + strategy);
        }
    }

    private <T extends CacheEntity<K>, K> Optional<T> readStore(EntityType<T, K> type, String key) throws CacheException {
        final Optional<byte[]> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        // Undecodable entries propagate; the caller decides whether to evict
        return Optional.of(type.decode(raw.get()));
    }

    private <T extends CacheEntity<K>, K> Optional<T> loadAndStore(EntityType<T, K> type,
                                                                  String key,
                                                                  DataProvider<T, K> provider,
                                                                  OperationConfig config) throws CacheException {
        // Provider lookups use the id recovered from the key, so ids containing ':' round-trip
        final K lookupId = type.parseId(CacheKeys.extractId(key));
        final Optional<T> loaded = Objects.requireNonNull(provider.fetchById(lookupId),
                "DataProvider.fetchById must not return null");
        if (loaded.isEmpty()) {
            return loaded;
        }

        final byte[] bytes = type.encode(loaded.get());
        final Duration ttl = config.ttlOverride().or(() -> ttlPolicy.resolve(type.namespace())).orElse(null);
        writeBestEffort(key, bytes, ttl);
        return loaded;
    }

    private void writeBestEffort(String key, byte[] bytes, Duration ttl) {
        final long start = System.nanoTime();
        try {
            store.set(key, bytes, ttl);
            metrics.recordSet(key, Duration.ofNanos(System.nanoTime() - start));
        } catch (CacheException e) {
            // The provider value is still returned to the caller
            log.warn("Failed to cache {} after provider fetch: {}", key, e.toString());
        }
    }
}
