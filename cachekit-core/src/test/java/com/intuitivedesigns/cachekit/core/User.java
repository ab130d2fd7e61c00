/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

public record User(String id, String name, String email) implements CacheEntity<String> {

    public static final EntityType<User, String> TYPE = EntityType.withStringIds("user", User.class);

    @Override
    public String cacheKey() {
        return id;
    }

    @Override
    public void validate() throws CacheException {
        if (email != null && !email.contains("@")) {
            throw CacheException.validation("Invalid email for user " + id + ": " + email);
        }
    }
}
