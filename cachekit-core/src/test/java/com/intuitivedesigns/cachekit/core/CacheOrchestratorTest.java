/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import com.intuitivedesigns.cachekit.metrics.MicrometerCacheMetrics;
import com.intuitivedesigns.cachekit.store.memory.InMemoryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CacheOrchestratorTest {

    private static final User ALICE = new User("1", "Alice", "alice@example.com");

    private final AtomicLong clock = new AtomicLong(0L);
    private InMemoryStore store;
    private InMemoryProvider<User, String> db;
    private CacheOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore(16, clock::get);
        db = new InMemoryProvider<User, String>().put(ALICE);
        orchestrator = new CacheOrchestrator(store);
    }

    private Optional<User> run(CacheOrchestrator o, String id, CacheStrategy strategy) throws CacheException {
        GenericFeeder<User, String> feeder = new GenericFeeder<>(id);
        o.execute(User.TYPE, feeder, db, strategy);
        return feeder.result();
    }

    @Test
    void freshNeverConsultsProvider() throws CacheException {
        assertTrue(run(orchestrator, "1", CacheStrategy.FRESH).isEmpty());
        assertEquals(0, db.fetchCount());
        assertTrue(store.isEmpty());
    }

    @Test
    void refreshPopulatesThenFreshHits() throws CacheException {
        assertEquals(Optional.of(ALICE), run(orchestrator, "1", CacheStrategy.REFRESH));
        assertEquals(1, db.fetchCount());
        assertTrue(store.exists("user:1"));

        assertEquals(Optional.of(ALICE), run(orchestrator, "1", CacheStrategy.FRESH));
        assertEquals(Optional.of(ALICE), run(orchestrator, "1", CacheStrategy.REFRESH));
        assertEquals(1, db.fetchCount(), "second REFRESH is served from the store");
    }

    @Test
    void refreshMissEverywhereLeavesStoreUntouched() throws CacheException {
        assertTrue(run(orchestrator, "404", CacheStrategy.REFRESH).isEmpty());
        assertEquals(1, db.fetchCount());
        assertTrue(store.isEmpty());
    }

    @Test
    void invalidateOverridesStaleEntry() throws CacheException {
        store.set("user:1", User.TYPE.encode(new User("1", "Stale", "old@example.com")), null);

        assertEquals("Stale", run(orchestrator, "1", CacheStrategy.REFRESH).orElseThrow().name());
        assertEquals(Optional.of(ALICE), run(orchestrator, "1", CacheStrategy.INVALIDATE));
        assertEquals(Optional.of(ALICE), run(orchestrator, "1", CacheStrategy.FRESH));
    }

    @Test
    void invalidateRemovesEntryWhenProviderHasNothing() throws CacheException {
        store.set("user:9", User.TYPE.encode(new User("9", "Gone", null)), null);

        assertTrue(run(orchestrator, "9", CacheStrategy.INVALIDATE).isEmpty());
        assertFalse(store.exists("user:9"));
    }

    @Test
    void bypassIgnoresCacheButWritesThrough() throws CacheException {
        store.set("user:1", User.TYPE.encode(new User("1", "Cached", null)), null);

        assertEquals(Optional.of(ALICE), run(orchestrator, "1", CacheStrategy.BYPASS));
        assertEquals(Optional.of(ALICE), run(orchestrator, "1", CacheStrategy.FRESH));
    }

    @Test
    void bypassWithNothingLeavesStoreUntouched() throws CacheException {
        store.set("user:2", User.TYPE.encode(new User("2", "Cached", null)), null);

        assertTrue(run(orchestrator, "2", CacheStrategy.BYPASS).isEmpty());
        assertTrue(store.exists("user:2"));
    }

    @Test
    void idsContainingSeparatorRoundTrip() throws CacheException {
        User scoped = new User("tenant:7", "Scoped", null);
        db.put(scoped);

        assertEquals(Optional.of(scoped), run(orchestrator, "tenant:7", CacheStrategy.REFRESH));
        assertTrue(store.exists("user:tenant:7"));
    }

    @Test
    void hooksRunInOrderOnHitAndMiss() throws CacheException {
        List<String> events = new ArrayList<>();
        CacheFeeder<User, String> hit = new RecordingFeeder("1", events);
        orchestrator.execute(User.TYPE, hit, db, CacheStrategy.REFRESH);
        assertEquals(List.of("validate", "onHit:user:1", "onLoaded:Alice", "deliver:Alice"), events);

        events.clear();
        CacheFeeder<User, String> miss = new RecordingFeeder("2", events);
        orchestrator.execute(User.TYPE, miss, db, CacheStrategy.REFRESH);
        assertEquals(List.of("validate", "onMiss:user:2", "deliver:null"), events);
    }

    @Test
    void feederValidationFailureStopsTheCall() {
        CacheException e = assertThrows(CacheException.class, () -> run(orchestrator, " ", CacheStrategy.REFRESH));
        assertEquals(CacheException.Kind.VALIDATION, e.kind());
        assertEquals(0, db.fetchCount());
    }

    @Test
    void entityValidationFailurePropagates() {
        db.put(new User("3", "Bad", "not-an-email"));

        CacheException e = assertThrows(CacheException.class, () -> run(orchestrator, "3", CacheStrategy.BYPASS));
        assertEquals(CacheException.Kind.VALIDATION, e.kind());
    }

    @Test
    void unreadableEntryPropagatesDecodeError() throws CacheException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CacheOrchestrator o = orchestrator.withMetrics(new MicrometerCacheMetrics(registry));
        store.set("user:1", "garbage".getBytes(StandardCharsets.UTF_8), null);

        CacheException fresh = assertThrows(CacheException.class, () -> run(o, "1", CacheStrategy.FRESH));
        assertEquals(CacheException.Kind.DESERIALIZATION, fresh.kind());
        CacheException refresh = assertThrows(CacheException.class, () -> run(o, "1", CacheStrategy.REFRESH));
        assertEquals(CacheException.Kind.DESERIALIZATION, refresh.kind());

        assertTrue(store.exists("user:1"), "entry left for the caller to evict");
        assertEquals(0, db.fetchCount());
        assertEquals(2.0, registry.get("cache.errors").tag("namespace", "user").counter().count());
        assertNull(registry.find("cache.misses").counter());
    }

    @Test
    void foreignSchemaVersionPropagatesVersionMismatch() throws CacheException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CacheOrchestrator o = orchestrator.withMetrics(new MicrometerCacheMetrics(registry));
        byte[] foreign = User.TYPE.encode(ALICE);
        foreign[4] = 2;
        store.set("user:1", foreign, null);

        CacheException fresh = assertThrows(CacheException.class, () -> run(o, "1", CacheStrategy.FRESH));
        assertEquals(CacheException.Kind.VERSION_MISMATCH, fresh.kind());
        VersionMismatchException refresh = assertThrows(VersionMismatchException.class,
                () -> run(o, "1", CacheStrategy.REFRESH));
        assertEquals(2L, refresh.found());

        assertEquals(0, db.fetchCount());
        assertEquals(2.0, registry.get("cache.errors").tag("namespace", "user").counter().count());

        // Caller-side recovery: evict, then recompute
        store.delete("user:1");
        assertEquals(Optional.of(ALICE), run(o, "1", CacheStrategy.REFRESH));
    }

    @Test
    void decodeErrorIsRetriedLikeAnyOther() throws CacheException {
        FlakyStore counting = new FlakyStore();
        counting.delegate.set("user:1", "garbage".getBytes(StandardCharsets.UTF_8), null);
        CacheOrchestrator o = new CacheOrchestrator(counting);

        CacheException e = assertThrows(CacheException.class, () -> o.execute(User.TYPE,
                new GenericFeeder<>("1"), db, CacheStrategy.FRESH, OperationConfig.defaults().withRetry(1)));
        assertEquals(CacheException.Kind.DESERIALIZATION, e.kind());
        assertEquals(2, counting.getCalls.get());
    }

    @Test
    void maximumRetryCountStillRunsTheCall() throws CacheException {
        GenericFeeder<User, String> feeder = new GenericFeeder<>("1");

        orchestrator.execute(User.TYPE, feeder, db, CacheStrategy.FRESH,
                OperationConfig.defaults().withRetry(Integer.MAX_VALUE));

        assertTrue(feeder.result().isEmpty());
        assertEquals(100L << 20, CacheOrchestrator.backoffMillis(Integer.MAX_VALUE));
    }

    @Test
    void retriesExhaustThenRethrowLastError() {
        FlakyStore flaky = new FlakyStore().failingGets(Integer.MAX_VALUE);
        CacheOrchestrator o = new CacheOrchestrator(flaky);
        GenericFeeder<User, String> feeder = new GenericFeeder<>("1");

        long start = System.nanoTime();
        CacheException e = assertThrows(CacheException.class, () ->
                o.execute(User.TYPE, feeder, db, CacheStrategy.REFRESH, OperationConfig.defaults().withRetry(2)));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(CacheException.Kind.BACKEND, e.kind());
        assertEquals(3, flaky.getCalls.get());
        assertTrue(elapsedMs >= 300, "backoff 100ms + 200ms, was " + elapsedMs);
        assertFalse(feeder.hasResult());
    }

    @Test
    void retryRecoversFromTransientFailure() throws CacheException {
        FlakyStore flaky = new FlakyStore().failingGets(1);
        CacheOrchestrator o = new CacheOrchestrator(flaky);
        GenericFeeder<User, String> feeder = new GenericFeeder<>("1");

        o.execute(User.TYPE, feeder, db, CacheStrategy.REFRESH, OperationConfig.defaults().withRetry(1));

        assertEquals(Optional.of(ALICE), feeder.result());
        assertEquals(2, flaky.getCalls.get());
    }

    @Test
    void noRetryMeansSingleAttempt() {
        FlakyStore flaky = new FlakyStore().failingGets(1);
        CacheOrchestrator o = new CacheOrchestrator(flaky);

        assertThrows(CacheException.class, () -> run(o, "1", CacheStrategy.FRESH));
        assertEquals(1, flaky.getCalls.get());
    }

    @Test
    void interruptedBackoffRethrowsAndKeepsFlag() {
        FlakyStore flaky = new FlakyStore().failingGets(Integer.MAX_VALUE);
        CacheOrchestrator o = new CacheOrchestrator(flaky);
        GenericFeeder<User, String> feeder = new GenericFeeder<>("1");

        Thread.currentThread().interrupt();
        try {
            CacheException e = assertThrows(CacheException.class, () ->
                    o.execute(User.TYPE, feeder, db, CacheStrategy.FRESH, OperationConfig.defaults().withRetry(5)));
            assertEquals(CacheException.Kind.BACKEND, e.kind());
            assertEquals(1, flaky.getCalls.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void writeFailureAfterProviderFetchIsSwallowed() throws CacheException {
        FlakyStore flaky = new FlakyStore().failWrites();
        CacheOrchestrator o = new CacheOrchestrator(flaky);

        assertEquals(Optional.of(ALICE), run(o, "1", CacheStrategy.REFRESH));
        assertEquals(1, flaky.setCalls.get());
        assertTrue(flaky.delegate.isEmpty());
    }

    @Test
    void ttlOverrideBeatsPolicy() throws CacheException {
        CacheOrchestrator o = orchestrator.withTtlPolicy(TtlPolicy.fixed(Duration.ofSeconds(60)));

        GenericFeeder<User, String> feeder = new GenericFeeder<>("1");
        o.execute(User.TYPE, feeder, db, CacheStrategy.REFRESH, OperationConfig.defaults().withTtl(Duration.ofSeconds(1)));

        clock.addAndGet(Duration.ofSeconds(2).toNanos());
        assertTrue(run(o, "1", CacheStrategy.FRESH).isEmpty(), "override of 1s applied");
    }

    @Test
    void policyTtlAppliesWithoutOverride() throws CacheException {
        CacheOrchestrator o = orchestrator.withTtlPolicy(TtlPolicy.fixed(Duration.ofSeconds(60)));
        run(o, "1", CacheStrategy.REFRESH);

        clock.addAndGet(Duration.ofSeconds(30).toNanos());
        assertTrue(run(o, "1", CacheStrategy.FRESH).isPresent());

        clock.addAndGet(Duration.ofSeconds(31).toNanos());
        assertTrue(run(o, "1", CacheStrategy.FRESH).isEmpty());
    }

    @Test
    void noPolicyMeansNoExpiry() throws CacheException {
        run(orchestrator, "1", CacheStrategy.REFRESH);
        clock.addAndGet(Duration.ofDays(30).toNanos());
        assertTrue(run(orchestrator, "1", CacheStrategy.FRESH).isPresent());
    }

    @Test
    void metricsReportHitsMissesWritesAndErrors() throws CacheException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CacheOrchestrator o = orchestrator.withMetrics(new MicrometerCacheMetrics(registry));

        run(o, "1", CacheStrategy.REFRESH);    // provider hit, one write
        run(o, "1", CacheStrategy.FRESH);      // store hit
        run(o, "2", CacheStrategy.FRESH);      // miss
        run(o, "1", CacheStrategy.INVALIDATE); // delete, write, hit

        assertEquals(3.0, registry.get("cache.hits").tag("namespace", "user").counter().count());
        assertEquals(1.0, registry.get("cache.misses").tag("namespace", "user").counter().count());
        assertEquals(2.0, registry.get("cache.sets").tag("namespace", "user").counter().count());
        assertEquals(1.0, registry.get("cache.deletes").tag("namespace", "user").counter().count());
        assertEquals(3L, registry.get("cache.latency").tag("outcome", "hit").timer().count());

        CacheOrchestrator failing = new CacheOrchestrator(new FlakyStore().failingGets(1))
                .withMetrics(new MicrometerCacheMetrics(registry));
        assertThrows(CacheException.class, () -> run(failing, "1", CacheStrategy.FRESH));
        assertEquals(1.0, registry.get("cache.errors").tag("namespace", "user").counter().count());
    }

    @Test
    void withersReturnNewInstancesSharingTheStore() {
        CacheOrchestrator other = orchestrator.withTtlPolicy(TtlPolicy.infinite());

        assertNotSame(orchestrator, other);
        assertSame(orchestrator.store(), other.store());
        assertEquals(TtlPolicy.Kind.USE_STORE_DEFAULT, orchestrator.ttlPolicy().kind());
        assertEquals(TtlPolicy.Kind.INFINITE, other.ttlPolicy().kind());
    }

    @Test
    void backoffDoublesPerAttempt() {
        assertEquals(100, CacheOrchestrator.backoffMillis(1));
        assertEquals(200, CacheOrchestrator.backoffMillis(2));
        assertEquals(400, CacheOrchestrator.backoffMillis(3));
    }

    private static final class RecordingFeeder implements CacheFeeder<User, String> {
        private final String id;
        private final List<String> events;

        RecordingFeeder(String id, List<String> events) {
            this.id = id;
            this.events = events;
        }

        @Override
        public String requestedId() {
            return id;
        }

        @Override
        public void deliver(User entity) {
            events.add("deliver:" + (entity == null ? "null" : entity.name()));
        }

        @Override
        public void validate() {
            events.add("validate");
        }

        @Override
        public void onHit(String key) {
            events.add("onHit:" + key);
        }

        @Override
        public void onMiss(String key) {
            events.add("onMiss:" + key);
        }

        @Override
        public void onLoaded(User entity) {
            events.add("onLoaded:" + entity.name());
        }
    }
}
