/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.codec;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.intuitivedesigns.cachekit.core.CacheException;
import com.intuitivedesigns.cachekit.core.VersionMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Versioned binary envelope around every cached payload.
 *
 * <pre>
 * +-----------------+------------------+---------------------------+
 * | SIGNATURE (4 B) | VERSION (4 B LE) | CBOR PAYLOAD (N bytes)    |
 * +-----------------+------------------+---------------------------+
 *   "CKIT"            unsigned 32-bit     Jackson CBOR, sorted keys
 * </pre>
 *
 * <p>Encoding is deterministic: properties are written in alphabetical order and map
 * entries by key, so equal values always produce identical bytes.</p>
 *
 * <p>Decoding never trusts a partial entry. Checks run in order: length, signature,
 * version, payload. Any failure is a {@link CacheException}; callers evict and
 * recompute rather than fail the read path.</p>
 */
public final class EnvelopeCodec {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeCodec.class);

    public static final byte[] SIGNATURE = "CKIT".getBytes(StandardCharsets.US_ASCII);

    /**
     * Bump whenever a cached type changes shape. Older entries then fail with VERSION_MISMATCH.
     */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static final int HEADER_LENGTH = 8;

    private static final ObjectMapper MAPPER = CBORMapper.builder(new CBORFactory())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private EnvelopeCodec() {}

    public static byte[] encode(Object value) throws CacheException {
        Objects.requireNonNull(value, "value");
        final byte[] payload;
        try {
            payload = MAPPER.writeValueAsBytes(value);
        } catch (JacksonException e) {
            log.error("Cache serialization failed for {}: {}", value.getClass().getName(), e.getOriginalMessage());
            throw CacheException.serialization(value.getClass().getName() + ": " + e.getOriginalMessage(), e);
        }

        return ByteBuffer.allocate(HEADER_LENGTH + payload.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .put(SIGNATURE)
                .putInt(CURRENT_SCHEMA_VERSION)
                .put(payload)
                .array();
    }

    public static <T> T decode(byte[] bytes, Class<T> type) throws CacheException {
        Objects.requireNonNull(type, "type");

        // 1. Container large enough to carry a header
        if (bytes == null || bytes.length < HEADER_LENGTH) {
            int len = bytes == null ? 0 : bytes.length;
            log.error("Cache deserialization failed: {} bytes, header needs {}", len, HEADER_LENGTH);
            throw CacheException.deserialization("Envelope truncated: " + len + " bytes", null);
        }

        // 2. Signature
        if (!Arrays.equals(bytes, 0, SIGNATURE.length, SIGNATURE, 0, SIGNATURE.length)) {
            byte[] found = Arrays.copyOf(bytes, SIGNATURE.length);
            log.warn("Invalid cache entry: expected signature {}, got {}", Arrays.toString(SIGNATURE), Arrays.toString(found));
            throw CacheException.invalidEntry("Invalid signature: expected " + Arrays.toString(SIGNATURE)
                    + ", got " + Arrays.toString(found));
        }

        // 3. Schema version
        long found = readVersion(bytes);
        if (found != CURRENT_SCHEMA_VERSION) {
            log.warn("Cache version mismatch: expected {}, got {}", CURRENT_SCHEMA_VERSION, found);
            throw new VersionMismatchException(CURRENT_SCHEMA_VERSION, found);
        }

        // 4. Payload
        try {
            return MAPPER.readValue(bytes, HEADER_LENGTH, bytes.length - HEADER_LENGTH, type);
        } catch (JacksonException e) {
            log.error("Cache deserialization failed for {}: {}", type.getName(), e.getOriginalMessage());
            throw CacheException.deserialization(type.getName() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw CacheException.deserialization(type.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads the schema version without touching the payload (golden-blob checks, diagnostics).
     *
     * @throws CacheException if the header is truncated or the signature is wrong
     */
    public static long peekVersion(byte[] bytes) throws CacheException {
        if (bytes == null || bytes.length < HEADER_LENGTH) {
            throw CacheException.deserialization("Envelope truncated", null);
        }
        if (!Arrays.equals(bytes, 0, SIGNATURE.length, SIGNATURE, 0, SIGNATURE.length)) {
            throw CacheException.invalidEntry("Invalid signature");
        }
        return readVersion(bytes);
    }

    private static long readVersion(byte[] bytes) {
        int raw = ByteBuffer.wrap(bytes, SIGNATURE.length, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
        return Integer.toUnsignedLong(raw);
    }
}
