/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.util.Objects;

/**
 * Single checked failure type for every cache operation.
 *
 * <p>The {@link Kind} tells callers how to react. The retry loop in the engine
 * retries all kinds uniformly; {@link Kind#retryable()} and {@link Kind#evictable()}
 * exist for callers that want finer handling.</p>
 */
public class CacheException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Entity could not be encoded. Fix the entity type. */
        SERIALIZATION("Serialization error", false, false),
        /** Stored bytes are malformed. */
        DESERIALIZATION("Deserialization error", false, true),
        /** Feeder or entity self-check failed. */
        VALIDATION("Validation error", false, false),
        /** Absence surfaced as an error by a lookup that requires a hit. */
        CACHE_MISS("Cache miss", false, false),
        /** Store unavailable or misbehaving. */
        BACKEND("Backend error", true, false),
        /** Source-of-truth provider unavailable. */
        REPOSITORY("Repository error", true, false),
        /** A store or provider exceeded its own time limit. */
        TIMEOUT("Timeout", true, false),
        /** Invalid construction-time configuration. */
        CONFIG("Config error", false, false),
        /** Optional capability not offered by this implementation. */
        NOT_IMPLEMENTED("Not implemented", false, false),
        /** Envelope signature mismatch. */
        INVALID_CACHE_ENTRY("Invalid cache entry", false, true),
        /** Envelope written by a different schema version. */
        VERSION_MISMATCH("Cache version mismatch", false, true),
        OTHER("Error", false, false);

        private final String label;
        private final boolean retryable;
        private final boolean evictable;

        Kind(String label, boolean retryable, boolean evictable) {
            this.label = label;
            this.retryable = retryable;
            this.evictable = evictable;
        }

        public String label() {
            return label;
        }

        /**
         * @return true if the failure is transient and a later attempt may succeed.
         */
        public boolean retryable() {
            return retryable;
        }

        /**
         * @return true if the stored entry should be dropped and recomputed.
         */
        public boolean evictable() {
            return evictable;
        }
    }

    private final Kind kind;

    public CacheException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public CacheException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        String msg = getMessage();
        return (msg == null || msg.isEmpty()) ? kind.label() : kind.label() + ": " + msg;
    }

    // --- Factories ---

    public static CacheException serialization(String message, Throwable cause) {
        return new CacheException(Kind.SERIALIZATION, message, cause);
    }

    public static CacheException deserialization(String message, Throwable cause) {
        return new CacheException(Kind.DESERIALIZATION, message, cause);
    }

    public static CacheException validation(String message) {
        return new CacheException(Kind.VALIDATION, message);
    }

    public static CacheException cacheMiss(String key) {
        return new CacheException(Kind.CACHE_MISS, key);
    }

    public static CacheException backend(String message, Throwable cause) {
        return new CacheException(Kind.BACKEND, message, cause);
    }

    public static CacheException repository(String message, Throwable cause) {
        return new CacheException(Kind.REPOSITORY, message, cause);
    }

    public static CacheException timeout(String message, Throwable cause) {
        return new CacheException(Kind.TIMEOUT, message, cause);
    }

    public static CacheException config(String message) {
        return new CacheException(Kind.CONFIG, message);
    }

    public static CacheException notImplemented(String message) {
        return new CacheException(Kind.NOT_IMPLEMENTED, message);
    }

    public static CacheException invalidEntry(String message) {
        return new CacheException(Kind.INVALID_CACHE_ENTRY, message);
    }
}
