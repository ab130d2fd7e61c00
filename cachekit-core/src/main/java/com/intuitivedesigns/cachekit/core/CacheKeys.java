/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.util.List;
import java.util.Objects;

/**
 * Composite key helpers. Keys are {@code namespace:id}; the id may itself contain separators.
 */
public final class CacheKeys {

    public static final String SEPARATOR = ":";

    private CacheKeys() {}

    public static String build(String namespace, Object id) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        return namespace + SEPARATOR + id;
    }

    /**
     * {@code composite("order", 7, "line", 3)} -> {@code order:7:line:3}
     */
    public static String composite(String namespace, Object... parts) {
        Objects.requireNonNull(namespace, "namespace");
        StringBuilder sb = new StringBuilder(namespace);
        for (Object part : parts) {
            sb.append(SEPARATOR).append(Objects.requireNonNull(part, "part"));
        }
        return sb.toString();
    }

    public static List<String> split(String key) {
        Objects.requireNonNull(key, "key");
        return List.of(key.split(SEPARATOR, -1));
    }

    public static String namespaceOf(String key) throws CacheException {
        int idx = separatorIndex(key);
        return key.substring(0, idx);
    }

    /**
     * Everything after the first separator, so {@code session:a:b} yields {@code a:b}.
     *
     * @throws CacheException VALIDATION if the key has no separator
     */
    public static String extractId(String key) throws CacheException {
        int idx = separatorIndex(key);
        return key.substring(idx + SEPARATOR.length());
    }

    private static int separatorIndex(String key) throws CacheException {
        if (key == null) {
            throw CacheException.validation("Cache key is null");
        }
        int idx = key.indexOf(SEPARATOR);
        if (idx < 0) {
            throw CacheException.validation("Invalid cache key format: '" + key + "'");
        }
        return idx;
    }
}
