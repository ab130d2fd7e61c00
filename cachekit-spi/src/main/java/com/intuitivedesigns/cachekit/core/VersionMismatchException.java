/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

/**
 * Raised when a stored envelope carries a schema version other than the compiled one.
 * Expected during rolling deployments; callers evict the entry and recompute it.
 */
public final class VersionMismatchException extends CacheException {

    private static final long serialVersionUID = 1L;

    private final long expected;
    private final long found;

    public VersionMismatchException(long expected, long found) {
        super(Kind.VERSION_MISMATCH, "expected " + expected + ", found " + found);
        this.expected = expected;
        this.found = found;
    }

    public long expected() {
        return expected;
    }

    public long found() {
        return found;
    }
}
