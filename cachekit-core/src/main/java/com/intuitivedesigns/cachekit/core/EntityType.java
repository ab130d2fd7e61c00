/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.core;

import com.intuitivedesigns.cachekit.codec.EnvelopeCodec;

import java.util.Objects;

/**
 * Everything the engine needs to know about one cached type: its key namespace,
 * its Java class and how to turn the textual id portion of a key back into {@code K}.
 *
 * <p>Encoding always goes through {@link EnvelopeCodec}; it cannot be replaced per type.</p>
 *
 * @param <T> The cached entity.
 * @param <K> The entity's id type.
 */
public final class EntityType<T extends CacheEntity<K>, K> {

    /**
     * Parses the id portion of a key. Failures should surface as VALIDATION.
     */
    @FunctionalInterface
    public interface IdParser<K> {
        K parse(String raw) throws CacheException;
    }

    private final String namespace;
    private final Class<T> entityClass;
    private final IdParser<K> idParser;

    public EntityType(String namespace, Class<T> entityClass, IdParser<K> idParser) {
        Objects.requireNonNull(namespace, "namespace");
        if (namespace.isBlank() || namespace.contains(CacheKeys.SEPARATOR)) {
            throw new IllegalArgumentException("Namespace must be non-blank and must not contain '"
                    + CacheKeys.SEPARATOR + "': '" + namespace + "'");
        }
        this.namespace = namespace;
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
        this.idParser = Objects.requireNonNull(idParser, "idParser");
    }

    public static <T extends CacheEntity<String>> EntityType<T, String> withStringIds(String namespace, Class<T> entityClass) {
        return new EntityType<>(namespace, entityClass, raw -> raw);
    }

    public static <T extends CacheEntity<Long>> EntityType<T, Long> withLongIds(String namespace, Class<T> entityClass) {
        return new EntityType<>(namespace, entityClass, raw -> {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                throw CacheException.validation("Invalid numeric id '" + raw + "' for namespace " + namespace);
            }
        });
    }

    public String namespace() {
        return namespace;
    }

    public Class<T> entityClass() {
        return entityClass;
    }

    public K parseId(String raw) throws CacheException {
        return idParser.parse(raw);
    }

    public String key(K id) {
        return CacheKeys.build(namespace, id);
    }

    public String keyOf(T entity) {
        return key(entity.cacheKey());
    }

    public byte[] encode(T entity) throws CacheException {
        return EnvelopeCodec.encode(entity);
    }

    public T decode(byte[] bytes) throws CacheException {
        return EnvelopeCodec.decode(bytes, entityClass);
    }

    @Override
    public String toString() {
        return "EntityType{" + namespace + " -> " + entityClass.getSimpleName() + '}';
    }
}
