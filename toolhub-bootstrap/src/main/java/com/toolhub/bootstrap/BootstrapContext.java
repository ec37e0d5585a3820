package com.toolhub.bootstrap;

import com.toolhub.engine.ToolEngine;
import com.toolhub.engine.ToolhubConfig;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link ToolhubBootstrap#initialize}: the env-derived configuration, the ready engine,
 * and which tool types came from where. Closing the context closes the engine.
 */
public final class BootstrapContext implements AutoCloseable {

    private final ToolhubConfig config;
    private final ToolEngine engine;
    private final List<String> internalTypes;
    private final List<String> discoveredTypes;

    BootstrapContext(ToolhubConfig config, ToolEngine engine, List<String> internalTypes, List<String> discoveredTypes) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.internalTypes = internalTypes != null ? List.copyOf(internalTypes) : List.of();
        this.discoveredTypes = discoveredTypes != null ? List.copyOf(discoveredTypes) : List.of();
    }

    public ToolhubConfig getConfig() {
        return config;
    }

    public ToolEngine getEngine() {
        return engine;
    }

    /** Built-in type ids registered at startup. */
    public List<String> getInternalTypes() {
        return internalTypes;
    }

    /** Type ids registered from providers found on the classpath, in discovery order. */
    public List<String> getDiscoveredTypes() {
        return discoveredTypes;
    }

    @Override
    public void close() {
        engine.close();
    }
}
