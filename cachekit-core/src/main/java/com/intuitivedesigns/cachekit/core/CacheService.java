/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import com.intuitivedesigns.cachekit.config.StoreFactory;
import com.intuitivedesigns.cachekit.metrics.CacheMetrics;
import com.intuitivedesigns.cachekit.metrics.MetricsFactory;
import com.intuitivedesigns.cachekit.metrics.MetricsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Application-facing entry point. Wraps one {@link CacheOrchestrator}; share a single
 * instance across threads and components.
 */
public final class CacheService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final CacheOrchestrator orchestrator;

    public CacheService(CacheStore store) {
        this(new CacheOrchestrator(store));
    }

    public CacheService(CacheOrchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    /**
     * Store from {@code cache.store}, TTL policy from {@code cache.ttl.*}, metrics from {@code metrics.*}.
     */
    public static CacheService fromConfig(CacheKitConfig config) throws CacheException {
        Objects.requireNonNull(config, "config");

        final TtlPolicy ttlPolicy = TtlPolicy.fromConfig(config);
        final CacheStore store = StoreFactory.createStore(config);
        final CacheMetrics metrics = MetricsFactory.init(MetricsSettings.from(config));

        log.info("CacheService ready: store={} ttl={} metrics={}",
                store.getClass().getSimpleName(), ttlPolicy, metrics.type());
        return new CacheService(new CacheOrchestrator(store, metrics, ttlPolicy));
    }

    public CacheOrchestrator orchestrator() {
        return orchestrator;
    }

    public <T extends CacheEntity<K>, K> void execute(EntityType<T, K> type,
                                                     CacheFeeder<T, K> feeder,
                                                     DataProvider<T, K> provider,
                                                     CacheStrategy strategy) throws CacheException {
        orchestrator.execute(type, feeder, provider, strategy);
    }

    public <T extends CacheEntity<K>, K> void executeWithConfig(EntityType<T, K> type,
                                                               CacheFeeder<T, K> feeder,
                                                               DataProvider<T, K> provider,
                                                               CacheStrategy strategy,
                                                               OperationConfig config) throws CacheException {
        orchestrator.execute(type, feeder, provider, strategy, config);
    }

    /**
     * Runs the call on {@code executor}. A {@link CacheException} completes the future
     * exceptionally, wrapped in a {@link CompletionException}.
     */
    public <T extends CacheEntity<K>, K> CompletableFuture<Void> executeAsync(EntityType<T, K> type,
                                                                             CacheFeeder<T, K> feeder,
                                                                             DataProvider<T, K> provider,
                                                                             CacheStrategy strategy,
                                                                             OperationConfig config,
                                                                             Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.runAsync(() -> {
            try {
                orchestrator.execute(type, feeder, provider, strategy, config);
            } catch (CacheException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Cache-only lookup.
     *
     * @throws CacheException CACHE_MISS if the key is absent, expired or unreadable
     */
    public <T extends CacheEntity<K>, K> T getCached(EntityType<T, K> type, K id) throws CacheException {
        final GenericFeeder<T, K> feeder = new GenericFeeder<>(id);
        orchestrator.execute(type, feeder, unused -> Optional.empty(), CacheStrategy.FRESH);
        return feeder.take().orElseThrow(() -> CacheException.cacheMiss(type.key(id)));
    }

    /**
     * Releases the store and the metrics backend.
     */
    @Override
    public void close() {
        orchestrator.store().close();
        orchestrator.metrics().close();
    }
}
