/*
 * Copyright 2025 Steven Lopez
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Byte-oriented key/value backend the engine reads from and writes to.
 *
 * Examples:
 * - In-memory map with lazy TTL expiry (the reference implementation)
 * - Redis via a pooled client
 * - Any remote cache reachable through a thin adapter
 *
 * Only {@link #get}, {@link #set} and {@link #delete} are mandatory. The bulk and
 * housekeeping operations fall back to sequential loops or conservative answers.
 *
 * <p><b>Thread-safety Contract:</b></p>
 * Every method may be called concurrently from many threads. The engine holds no
 * lock around store calls, so implementations provide their own synchronization.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * Read the raw bytes stored under {@code key}.
     *
     * @param key composite cache key
     * @return Optional.empty() if absent or expired
     * @throws CacheException if the store cannot be read
     */
    Optional<byte[]> get(String key) throws CacheException;

    /**
     * Write (or overwrite) an entry.
     *
     * @param key   composite cache key
     * @param value encoded bytes
     * @param ttl   time-to-live, or {@code null} to let the store decide
     * @throws CacheException if the write fails
     */
    void set(String key, byte[] value, Duration ttl) throws CacheException;

    /**
     * Remove an entry. Removing an absent key is not an error.
     *
     * @throws CacheException if the delete fails
     */
    void delete(String key) throws CacheException;

    default boolean exists(String key) throws CacheException {
        return get(key).isPresent();
    }

    /**
     * Bulk read. The result has one slot per requested key, in request order;
     * missing entries are {@code Optional.empty()} at their position.
     */
    default List<Optional<byte[]>> getMany(List<String> keys) throws CacheException {
        List<Optional<byte[]>> out = new ArrayList<>(keys.size());
        for (String key : keys) {
            out.add(get(key));
        }
        return out;
    }

    default void deleteMany(List<String> keys) throws CacheException {
        for (String key : keys) {
            delete(key);
        }
    }

    default boolean healthCheck() throws CacheException {
        return true;
    }

    /**
     * Drop every entry. Optional: callers must not assume a store supports it.
     *
     * @throws CacheException with kind NOT_IMPLEMENTED unless overridden
     */
    default void clearAll() throws CacheException {
        throw CacheException.notImplemented("clearAll not implemented for " + getClass().getSimpleName());
    }

    /**
     * Release client connections or pools. In-memory stores keep the default.
     */
    @Override
    default void close() {
        // Default: no-op
    }
}
