/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import com.intuitivedesigns.cachekit.config.CacheKitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Default expiry for writes, resolved per namespace. A per-call override in
 * {@link OperationConfig} always wins.
 */
public final class TtlPolicy {

    private static final Logger log = LoggerFactory.getLogger(TtlPolicy.class);

    // Config keys
    static final String KEY_POLICY = "cache.ttl.policy";
    static final String KEY_SECONDS = "cache.ttl.seconds";
    static final String KEY_NAMESPACE_PREFIX = "cache.ttl.namespace.";
    private static final String NAMESPACE_SUFFIX = ".seconds";

    public enum Kind {
        /** No TTL passed; the store decides. */
        USE_STORE_DEFAULT,
        FIXED,
        /** No TTL passed; entries live until deleted. */
        INFINITE,
        PER_NAMESPACE
    }

    private static final TtlPolicy STORE_DEFAULT = new TtlPolicy(Kind.USE_STORE_DEFAULT, ns -> Optional.empty(), "default");
    private static final TtlPolicy INFINITE = new TtlPolicy(Kind.INFINITE, ns -> Optional.empty(), "infinite");

    private final Kind kind;
    private final Function<String, Optional<Duration>> resolver;
    private final String description;

    private TtlPolicy(Kind kind, Function<String, Optional<Duration>> resolver, String description) {
        this.kind = kind;
        this.resolver = resolver;
        this.description = description;
    }

    public static TtlPolicy useStoreDefault() {
        return STORE_DEFAULT;
    }

    public static TtlPolicy infinite() {
        return INFINITE;
    }

    public static TtlPolicy fixed(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Fixed TTL must be positive, got " + ttl);
        }
        final Optional<Duration> resolved = Optional.of(ttl);
        return new TtlPolicy(Kind.FIXED, ns -> resolved, "fixed(" + ttl + ")");
    }

    /**
     * @param resolver Maps a namespace to its TTL; empty means no TTL for that namespace.
     */
    public static TtlPolicy perNamespace(Function<String, Optional<Duration>> resolver) {
        Objects.requireNonNull(resolver, "resolver");
        return new TtlPolicy(Kind.PER_NAMESPACE, resolver, "perNamespace");
    }

    public Kind kind() {
        return kind;
    }

    public Optional<Duration> resolve(String namespace) {
        Optional<Duration> ttl = resolver.apply(namespace);
        return ttl == null ? Optional.empty() : ttl;
    }

    /**
     * Builds a policy from {@code cache.ttl.*}:
     * <pre>
     * cache.ttl.policy=PER_NAMESPACE          # DEFAULT | FIXED | INFINITE | PER_NAMESPACE
     * cache.ttl.seconds=300                   # FIXED value, PER_NAMESPACE fallback
     * cache.ttl.namespace.user.seconds=60
     * </pre>
     *
     * @throws CacheException CONFIG for unknown policies or non-positive durations
     */
    public static TtlPolicy fromConfig(CacheKitConfig config) throws CacheException {
        Objects.requireNonNull(config, "config");

        final String raw = config.getString(KEY_POLICY, "DEFAULT").trim().toUpperCase(Locale.ROOT);
        final TtlPolicy policy;
        switch (raw) {
            case "", "DEFAULT", "USE_STORE_DEFAULT" -> policy = STORE_DEFAULT;
            case "INFINITE" -> policy = INFINITE;
            case "FIXED" -> {
                if (!config.hasPath(KEY_SECONDS)) {
                    throw CacheException.config(KEY_POLICY + "=FIXED requires " + KEY_SECONDS);
                }
                policy = fixed(positiveSeconds(KEY_SECONDS, config.getString(KEY_SECONDS, null)));
            }
            case "PER_NAMESPACE" -> {
                final Map<String, Duration> byNamespace = new HashMap<>();
                for (Map.Entry<String, String> e : config.withPrefix(KEY_NAMESPACE_PREFIX).entrySet()) {
                    final String suffix = e.getKey();
                    if (!suffix.endsWith(NAMESPACE_SUFFIX) || suffix.length() == NAMESPACE_SUFFIX.length()) {
                        log.warn("Ignoring unrecognized TTL key '{}{}'", KEY_NAMESPACE_PREFIX, suffix);
                        continue;
                    }
                    final String ns = suffix.substring(0, suffix.length() - NAMESPACE_SUFFIX.length());
                    byNamespace.put(ns, positiveSeconds(KEY_NAMESPACE_PREFIX + suffix, e.getValue()));
                }
                final Optional<Duration> fallback = config.hasPath(KEY_SECONDS)
                        ? Optional.of(positiveSeconds(KEY_SECONDS, config.getString(KEY_SECONDS, null)))
                        : Optional.empty();
                final Map<String, Duration> table = Collections.unmodifiableMap(byNamespace);
                policy = new TtlPolicy(Kind.PER_NAMESPACE,
                        ns -> Optional.ofNullable(table.get(ns)).or(() -> fallback),
                        "perNamespace" + table + (fallback.map(d -> " fallback=" + d).orElse("")));
            }
            default -> throw CacheException.config("Unknown " + KEY_POLICY + " '" + raw
                    + "'. Available options: [DEFAULT, FIXED, INFINITE, PER_NAMESPACE]");
        }

        log.info("TTL policy: {}", policy);
        return policy;
    }

    private static Duration positiveSeconds(String key, String value) throws CacheException {
        final long seconds;
        try {
            seconds = Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw CacheException.config("Invalid seconds for '" + key + "': '" + value + "'");
        }
        if (seconds <= 0) {
            throw CacheException.config("'" + key + "' must be > 0, got " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    @Override
    public String toString() {
        return "TtlPolicy{" + description + '}';
    }
}
