package com.toolhub.bootstrap;

import com.toolhub.catalog.CatalogFilter;
import com.toolhub.catalog.JsonCatalogSource;
import com.toolhub.catalog.LoadMode;
import com.toolhub.catalog.ToolCatalog;
import com.toolhub.engine.ToolEngine;
import com.toolhub.engine.ToolhubConfig;
import com.toolhub.health.HealthRecord;
import com.toolhub.internal.tools.InternalTools;
import com.toolhub.registry.TypeRegistry;
import com.toolhub.tools.ToolProvider;
import com.toolhub.tools.spec.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Startup for the tool engine: reads configuration from the environment, registers the built-in
 * tool types, discovers additional {@link ToolProvider}s on the classpath, loads the configured
 * catalog files, applies the include/exclude filters and builds the {@link ToolEngine}.
 * <p>
 * Built-in registration failures are fatal. A discovered provider that fails to load or register is
 * logged and skipped. An unreadable catalog path is fatal.
 */
public final class ToolhubBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ToolhubBootstrap.class);

    private ToolhubBootstrap() {
    }

    /** Initializes from the process environment and the context class loader. */
    public static BootstrapContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(ToolhubConfig.fromEnvironment(), Thread.currentThread().getContextClassLoader());
    }

    /**
     * Initializes with the given configuration.
     *
     * @param config      engine configuration; catalog paths and filters are read from it
     * @param classLoader loader scanned for {@code META-INF/services/com.toolhub.tools.ToolProvider}
     * @return context holding the ready engine
     * @throws com.toolhub.catalog.CatalogLoadException if a configured catalog path cannot be read
     */
    public static BootstrapContext initialize(ToolhubConfig config, ClassLoader classLoader) {
        TypeRegistry types = new TypeRegistry();
        InternalTools.registerInternalTools(types);
        List<String> internalTypes = new ArrayList<>(types.registeredTypes());
        List<String> discoveredTypes = discoverProviders(types, classLoader);
        if (types.registeredTypes().isEmpty()) {
            log.warn("No tool types registered; every catalog entry will fail with a dependency error");
        }

        List<ToolSpec> specs = readCatalog(config);
        ToolEngine engine = ToolEngine.builder().config(config).types(types).build();
        try {
            engine.loadCatalog(specs, LoadMode.REPLACE);
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }
        log.info("Bootstrap: {} tool(s) available, types={}, catalogPaths={}",
                engine.catalog().size(), types.registeredTypes(), config.getCatalogPaths());
        return new BootstrapContext(config, engine, internalTypes, discoveredTypes);
    }

    /**
     * Registers every enabled provider found by {@link ServiceLoader} whose type id is not registered
     * yet. Built-in types registered earlier keep precedence.
     *
     * @return type ids registered, in discovery order
     */
    static List<String> discoverProviders(TypeRegistry types, ClassLoader classLoader) {
        ClassLoader loader = classLoader != null ? classLoader : ToolhubBootstrap.class.getClassLoader();
        Iterator<ToolProvider> it = ServiceLoader.load(ToolProvider.class, loader).iterator();
        List<String> registered = new ArrayList<>();
        while (true) {
            ToolProvider provider;
            try {
                if (!it.hasNext()) break;
                provider = it.next();
            } catch (ServiceConfigurationError e) {
                log.error("Tool provider failed to load (skipping): {}", e.getMessage(), e);
                continue;
            }
            String typeId = null;
            try {
                typeId = provider.getTypeId();
                if (!provider.isEnabled()) {
                    log.debug("Tool provider {} is disabled", typeId);
                    continue;
                }
                if (types.isRegistered(typeId)) {
                    log.debug("Tool type {} already registered; ignoring provider {}", typeId, provider.getClass().getName());
                    continue;
                }
                types.registerProvider(provider);
                registered.add(typeId);
                log.info("Registered tool type {} (version={}) from {}", typeId, provider.getVersion(), provider.getClass().getName());
            } catch (Exception e) {
                log.error("Tool provider failed to register (skipping): type={}, error={}",
                        typeId != null ? typeId : "?", e.getMessage(), e);
            }
        }
        return registered;
    }

    /**
     * Reads every configured catalog path in order (later files redefine earlier names of the same
     * type) and keeps the entries that pass the configured include/exclude lists and categories.
     */
    static List<ToolSpec> readCatalog(ToolhubConfig config) {
        ToolCatalog staging = new ToolCatalog();
        if (config.getCatalogPaths().isEmpty()) {
            log.warn("No catalog paths configured. Set TOOLHUB_CATALOG_PATHS (e.g. TOOLHUB_CATALOG_PATHS=/etc/toolhub/tools.json)");
        }
        for (String p : config.getCatalogPaths()) {
            staging.load(JsonCatalogSource.fromPath(Path.of(p)), LoadMode.MERGE);
        }
        CatalogFilter filter = CatalogFilter.builder()
                .include(config.getIncludeTools())
                .exclude(config.getExcludeTools())
                .categories(config.getIncludeCategories())
                .build();
        List<ToolSpec> kept = staging.list(filter);
        if (kept.size() < staging.size()) {
            log.info("Bootstrap: catalog filters kept {} of {} tool(s)", kept.size(), staging.size());
        }
        return kept;
    }

    /** Starts the engine from the environment and logs the available tools and their health. */
    public static void main(String[] args) {
        try (BootstrapContext ctx = initialize()) {
            ToolEngine engine = ctx.getEngine();
            for (ToolSpec spec : engine.catalog().list()) {
                log.info("Tool {} (type={}, category={}): {}", spec.getName(), spec.getType(),
                        spec.getCategory() != null ? spec.getCategory() : "-", spec.getDescription());
            }
            List<HealthRecord> unhealthy = engine.health().allUnhealthy();
            if (unhealthy.isEmpty()) {
                log.info("No unhealthy tools");
            }
            for (HealthRecord r : unhealthy) {
                log.warn("Unhealthy tool {}: {}", r.getName(), r.getLastError());
            }
        }
    }
}
