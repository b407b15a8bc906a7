/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.config;

import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Properties-backed configuration.
 * The process-wide instance loads from -Dpk.config.path or ENV 'PK_CONFIG_PATH'.
 */
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String PATH_PROPERTY = "pk.config.path";
    public static final String PATH_ENV = "PK_CONFIG_PATH";

    private static volatile PipelineConfig instance;

    private final Properties props;

    public PipelineConfig(Properties props) {
        this.props = new Properties();
        this.props.putAll(Objects.requireNonNull(props, "props"));
    }

    public PipelineConfig(Map<String, String> values) {
        this.props = new Properties();
        this.props.putAll(Objects.requireNonNull(values, "values"));
    }

    public static PipelineConfig get() {
        PipelineConfig local = instance;
        if (local == null) {
            synchronized (PipelineConfig.class) {
                local = instance;
                if (local == null) {
                    local = new PipelineConfig(load());
                    instance = local;
                }
            }
        }
        return local;
    }

    private static Properties load() {
        // 1. Try System Property first (Passed via -Dpk.config.path)
        String path = System.getProperty(PATH_PROPERTY);

        // 2. Fallback to Environment Variable
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }

        final Properties loaded = new Properties();
        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/config.properties", PATH_PROPERTY);
            return loaded;
        }

        log.info("Loading configuration from: {}", path);
        try (InputStream is = new FileInputStream(path)) {
            loaded.load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties.", loaded.size());
        return loaded;
    }

    /**
     * A view of every key under {@code prefix}, with the prefix stripped.
     * Used to give each named pipeline its own key space.
     */
    public PipelineConfig scoped(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        final Properties sub = new Properties();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                sub.setProperty(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return new PipelineConfig(sub);
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    /**
     * @return the trimmed value, or {@code null} when absent or blank
     */
    public String getOptionalString(String key) {
        final String v = props.getProperty(key);
        if (v == null) return null;
        final String t = v.trim();
        return t.isEmpty() ? null : t;
    }

    public String requireString(String key) {
        final String v = getOptionalString(key);
        if (v == null) {
            throw new ConfigurationException("Missing required configuration key: " + key);
        }
        return v;
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for '" + key + "': " + val, e);
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid long for '" + key + "': " + val, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return (val == null || val.isBlank()) ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Comma separated list; blanks are dropped.
     */
    public List<String> getList(String key) {
        final String raw = props.getProperty(key);
        final List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String part : raw.split(",")) {
            final String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
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
