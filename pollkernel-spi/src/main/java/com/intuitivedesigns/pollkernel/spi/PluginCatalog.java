/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.spi;

/**
 * Source and sink plugins visible to one class loader.
 */
public final class PluginCatalog {

    private final PluginRegistry<SourcePlugin> sources;
    private final PluginRegistry<SinkPlugin> sinks;

    public PluginCatalog(ClassLoader cl) {
        this.sources = new PluginRegistry<>(SourcePlugin.class, PluginKind.SOURCE, cl);
        this.sinks = new PluginRegistry<>(SinkPlugin.class, PluginKind.SINK, cl);
    }

    /**
     * Catalog of the context class loader, falling back to the one that loaded this class.
     */
    public static PluginCatalog load() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return new PluginCatalog(ctx != null ? ctx : PluginCatalog.class.getClassLoader());
    }

    public PluginRegistry<SourcePlugin> sources() {
        return sources;
    }

    public PluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }

    public String summary() {
        return "sources=" + sources.ids() + " sinks=" + sinks.ids();
    }
}
