/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.spi;

import com.intuitivedesigns.pollkernel.core.ConfigurationException;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;

/**
 * Plugins of one kind, discovered once through {@link ServiceLoader} and looked up
 * by case-insensitive id.
 *
 * <p>A blank id, a duplicate id or a plugin reporting the wrong {@link PluginKind}
 * fails construction; those are packaging errors, not configuration errors.</p>
 *
 * @param <T> the plugin interface
 */
public final class PluginRegistry<T extends PipelinePlugin<?>> {

    private final PluginKind kind;
    private final Map<String, T> byId;

    public PluginRegistry(Class<T> spiType, PluginKind kind, ClassLoader cl) {
        this.kind = kind;
        final Map<String, T> found = new TreeMap<>();
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            final String id = normalizeId(plugin.id());
            final String impl = plugin.getClass().getName();
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin " + impl + " declares a blank id");
            }
            if (plugin.kind() != kind) {
                throw new IllegalStateException("Plugin " + impl + " is a " + plugin.kind() + ", registered as " + kind);
            }
            final T previous = found.putIfAbsent(id, plugin);
            if (previous != null) {
                throw new IllegalStateException("Plugin id '" + id + "' is claimed by both "
                        + previous.getClass().getName() + " and " + impl);
            }
        }
        this.byId = Collections.unmodifiableMap(found);
    }

    /**
     * @param configKey the key {@code id} was read from, quoted in the error
     * @throws ConfigurationException when no plugin has that id
     */
    public T require(String id, String configKey) {
        final T plugin = byId.get(normalizeId(id));
        if (plugin == null) {
            throw new ConfigurationException("Unknown " + kind.name().toLowerCase(Locale.ROOT) + " '"
                    + configKey + "=" + id + "'. Available: " + byId.keySet());
        }
        return plugin;
    }

    /**
     * Sorted, upper-case ids.
     */
    public Set<String> ids() {
        return byId.keySet();
    }

    public static String normalizeId(String id) {
        return (id == null) ? "" : id.trim().toUpperCase(Locale.ROOT);
    }
}
