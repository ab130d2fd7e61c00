/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.util.Arrays;
import java.util.Locale;

/**
 * Read/fallback/write sequence for a single call. Chosen per call, never persisted.
 */
public enum CacheStrategy {

    /** Store only. A miss reports nothing; the provider is never consulted. */
    FRESH("Fresh"),

    /** Store first, provider on miss, repopulate the store. The default. */
    REFRESH("Refresh"),

    /** Delete the key, then always consult the provider and repopulate. */
    INVALIDATE("Invalidate"),

    /** Skip the store read, always consult the provider, write through. */
    BYPASS("Bypass");

    private final String displayName;

    CacheStrategy(String displayName) {
        this.displayName = displayName;
    }

    public static CacheStrategy defaultStrategy() {
        return REFRESH;
    }

    /**
     * Case-insensitive lookup, e.g. {@code "bypass"} or {@code " Fresh "}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static CacheStrategy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return defaultStrategy();
        }
        final String name = raw.trim().toUpperCase(Locale.ROOT);
        for (CacheStrategy s : values()) {
            if (s.name().equals(name)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown cache strategy '" + raw + "'. Available options: "
                + Arrays.toString(values()));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
