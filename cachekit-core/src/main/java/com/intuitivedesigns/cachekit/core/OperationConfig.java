/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call overrides. Immutable; the {@code with*} methods return new instances.
 */
public final class OperationConfig {

    private static final OperationConfig DEFAULTS = new OperationConfig(null, 0);

    private final Duration ttlOverride;
    private final int retryCount;

    private OperationConfig(Duration ttlOverride, int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, got " + retryCount);
        }
        this.ttlOverride = ttlOverride;
        this.retryCount = retryCount;
    }

    /**
     * No TTL override, no retries.
     */
    public static OperationConfig defaults() {
        return DEFAULTS;
    }

    public OperationConfig withTtl(Duration ttl) {
        return new OperationConfig(Objects.requireNonNull(ttl, "ttl"), retryCount);
    }

    public OperationConfig withRetry(int count) {
        return new OperationConfig(ttlOverride, count);
    }

    public Optional<Duration> ttlOverride() {
        return Optional.ofNullable(ttlOverride);
    }

    public int retryCount() {
        return retryCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperationConfig other)) return false;
        return retryCount == other.retryCount && Objects.equals(ttlOverride, other.ttlOverride);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ttlOverride, retryCount);
    }

    @Override
    public String toString() {
        return "OperationConfig{ttlOverride=" + ttlOverride + ", retryCount=" + retryCount + '}';
    }
}
