/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheStrategyTest {

    @Test
    void defaultIsRefresh() {
        assertEquals(CacheStrategy.REFRESH, CacheStrategy.defaultStrategy());
    }

    @Test
    void parsesCaseInsensitively() {
        assertEquals(CacheStrategy.BYPASS, CacheStrategy.from("bypass"));
        assertEquals(CacheStrategy.FRESH, CacheStrategy.from(" Fresh "));
        assertEquals(CacheStrategy.INVALIDATE, CacheStrategy.from("INVALIDATE"));
    }

    @Test
    void blankFallsBackToDefault() {
        assertEquals(CacheStrategy.REFRESH, CacheStrategy.from(null));
        assertEquals(CacheStrategy.REFRESH, CacheStrategy.from("   "));
    }

    @Test
    void unknownNameListsOptions() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CacheStrategy.from("stale"));
        assertTrue(e.getMessage().contains("stale"));
        assertTrue(e.getMessage().contains("Refresh"));
    }

    @Test
    void displayNames() {
        assertEquals("Fresh", CacheStrategy.FRESH.toString());
        assertEquals("Bypass", CacheStrategy.BYPASS.toString());
    }
}
