/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cachekit.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Flat key/value configuration.
 *
 * <p>{@link #get()} loads once from {@code -Dcachekit.config.path}, then ENV
 * {@code CACHEKIT_CONFIG_PATH}, then a classpath {@code cachekit.properties}.
 * {@link #of(Properties)} builds an instance directly (tests, embedding).</p>
 */
public final class CacheKitConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheKitConfig.class);

    public static final String PATH_PROPERTY = "cachekit.config.path";
    public static final String PATH_ENV = "CACHEKIT_CONFIG_PATH";
    public static final String CLASSPATH_RESOURCE = "cachekit.properties";

    private static volatile CacheKitConfig instance;

    private final Properties props;

    private CacheKitConfig(Properties props) {
        this.props = props;
    }

    public static CacheKitConfig get() {
        CacheKitConfig local = instance;
        if (local == null) {
            synchronized (CacheKitConfig.class) {
                local = instance;
                if (local == null) {
                    local = new CacheKitConfig(loadDefault());
                    instance = local;
                }
            }
        }
        return local;
    }

    public static CacheKitConfig of(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new CacheKitConfig(copy);
    }

    public static CacheKitConfig of(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties p = new Properties();
        source.forEach(p::setProperty);
        return new CacheKitConfig(p);
    }

    public static CacheKitConfig load(Path path) throws IOException {
        Properties p = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            p.load(is);
        }
        log.info("Loaded {} properties from {}", p.size(), path);
        return new CacheKitConfig(p);
    }

    private static Properties loadDefault() {
        // 1. System property, 2. environment variable
        String path = System.getProperty(PATH_PROPERTY);
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }

        Properties p = new Properties();
        if (path != null && !path.isBlank()) {
            try (InputStream is = Files.newInputStream(Path.of(path))) {
                p.load(is);
                log.info("Loaded {} properties from {}", p.size(), path);
            } catch (IOException e) {
                log.error("Failed to load config file: {}", path, e);
            }
            return p;
        }

        // 3. Classpath fallback
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = CacheKitConfig.class.getClassLoader();
        try (InputStream is = cl.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (is != null) {
                p.load(is);
                log.info("Loaded {} properties from classpath:{}", p.size(), CLASSPATH_RESOURCE);
            } else {
                log.warn("No configuration found (-D{} / {} / classpath:{}). Using defaults.",
                        PATH_PROPERTY, PATH_ENV, CLASSPATH_RESOURCE);
            }
        } catch (IOException e) {
            log.error("Failed to read classpath:{}", CLASSPATH_RESOURCE, e);
        }
        return p;
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid int for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Reads an ISO-8601 duration ({@code PT30S}) or a bare number of seconds.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        String s = val.trim();
        try {
            if (s.startsWith("P") || s.startsWith("p")) {
                return Duration.parse(s);
            }
            return Duration.ofSeconds(Long.parseLong(s));
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("Invalid duration for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * Entries under {@code prefix}, with the prefix stripped from the keys.
     */
    public Map<String, String> withPrefix(String prefix) {
        Map<String, String> out = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                out.put(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return out;
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
