/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProviderTest {

    @Test
    void fetchesAndCounts() throws CacheException {
        User a = new User("1", "A", null);
        User b = new User("2", "B", null);
        InMemoryProvider<User, String> db = new InMemoryProvider<User, String>().put(a).put(b);

        assertEquals(Optional.of(a), db.fetchById("1"));
        assertEquals(List.of(Optional.of(b), Optional.empty()), db.fetchByIds(List.of("2", "3")));
        assertEquals(3, db.fetchCount());
        assertEquals(2, db.count());
        assertEquals(2, db.fetchAll().size());

        db.remove("1");
        db.resetFetchCount();
        assertTrue(db.fetchById("1").isEmpty());
        assertEquals(1, db.fetchCount());
    }

    @Test
    void optionalOperationsDefaultToNotImplemented() {
        DataProvider<User, String> minimal = id -> Optional.empty();

        assertEquals(CacheException.Kind.NOT_IMPLEMENTED, assertThrows(CacheException.class, minimal::count).kind());
        assertEquals(CacheException.Kind.NOT_IMPLEMENTED, assertThrows(CacheException.class, minimal::fetchAll).kind());
    }
}
