package com.toolhub.registry;

import com.toolhub.tools.ToolFactory;
import com.toolhub.tools.ToolProvider;
import com.toolhub.tools.error.ToolDependencyException;
import com.toolhub.tools.error.ToolError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of tool types: maps a type identifier to the factory that builds instances of that
 * type. Types are registered either eagerly (factory available now) or lazily (a
 * {@link TypeResolver} produces the factory on first use).
 * <p>
 * A lazy resolver runs at most once per type, also under concurrent {@link #resolve} calls. Its
 * outcome, success or failure, is kept until {@link #invalidate(String)}, so a type whose
 * optional library is missing fails fast with the same dependency error on every resolution.
 */
public final class TypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<String, TypeEntry> types = new ConcurrentHashMap<>();

    /**
     * Registers a type whose factory is already available.
     *
     * @throws IllegalArgumentException if type is blank or already registered
     */
    public void registerEager(String type, ToolFactory factory) {
        Objects.requireNonNull(factory, "factory");
        String t = normalize(type);
        put(t, new TypeEntry(t, null, TypeResolution.resolved(t, factory), "", "1.0"));
        log.debug("Registered tool type {} (eager)", t);
    }

    /**
     * Registers a type whose factory is produced on first use.
     *
     * @throws IllegalArgumentException if type is blank or already registered
     */
    public void registerLazy(String type, TypeResolver resolver) {
        registerLazy(type, resolver, "", "1.0");
    }

    public void registerLazy(String type, TypeResolver resolver, String description, String version) {
        Objects.requireNonNull(resolver, "resolver");
        String t = normalize(type);
        put(t, new TypeEntry(t, resolver, null, description, version));
        log.debug("Registered tool type {} (lazy)", t);
    }

    /**
     * Registers a provider lazily. On first resolution the provider's required classes are checked
     * with the provider's class loader, then {@link ToolProvider#createFactory()} is called.
     */
    public void registerProvider(ToolProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String typeId = provider.getTypeId();
        registerLazy(typeId, () -> {
            ClassLoader loader = provider.getClass().getClassLoader();
            for (String className : provider.getRequiredClasses()) {
                try {
                    Class.forName(className, false, loader);
                } catch (ClassNotFoundException | LinkageError e) {
                    throw ToolDependencyException.missingClass(typeId, className, e);
                }
            }
            return provider.createFactory();
        }, provider.getDescription(), provider.getVersion());
    }

    /**
     * Returns the factory for {@code type}, running its lazy resolver if this is the first use.
     * Never throws; an unregistered type or a failed resolver yields a dependency error.
     */
    public TypeResolution resolve(String type) {
        TypeEntry entry = type != null ? types.get(type.trim()) : null;
        if (entry == null) {
            return TypeResolution.failed(type, ToolError.dependency(null,
                    "No implementation registered for type " + type,
                    List.of("Check the tool's type in the catalog", "Register a provider for type " + type),
                    Map.of("type", String.valueOf(type))));
        }
        return entry.resolve();
    }

    /**
     * Forgets the cached outcome of a lazy type so the next {@link #resolve} runs the resolver again.
     * Eager types are unaffected.
     *
     * @return true if a cached lazy outcome was cleared
     */
    public boolean invalidate(String type) {
        TypeEntry entry = type != null ? types.get(type.trim()) : null;
        return entry != null && entry.invalidate();
    }

    public boolean isRegistered(String type) {
        return type != null && types.containsKey(type.trim());
    }

    /** Registered type identifiers, sorted. */
    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(types.keySet()));
    }

    /** Description supplied at registration; empty if unregistered. */
    public String getDescription(String type) {
        TypeEntry entry = type != null ? types.get(type.trim()) : null;
        return entry != null ? entry.description : "";
    }

    private void put(String type, TypeEntry entry) {
        if (types.putIfAbsent(type, entry) != null) {
            throw new IllegalArgumentException("Tool type already registered: " + type);
        }
    }

    private static String normalize(String type) {
        String t = Objects.requireNonNull(type, "type").trim();
        if (t.isEmpty()) {
            throw new IllegalArgumentException("Tool type must be non-blank");
        }
        return t;
    }

    private static final class TypeEntry {
        private final String type;
        private final TypeResolver resolver;
        private final String description;
        private final String version;
        private volatile TypeResolution resolution;

        TypeEntry(String type, TypeResolver resolver, TypeResolution resolution, String description, String version) {
            this.type = type;
            this.resolver = resolver;
            this.resolution = resolution;
            this.description = description != null ? description : "";
            this.version = version != null ? version : "1.0";
        }

        TypeResolution resolve() {
            TypeResolution r = resolution;
            if (r != null) return r;
            synchronized (this) {
                r = resolution;
                if (r == null) {
                    r = runResolver();
                    resolution = r;
                }
                return r;
            }
        }

        synchronized boolean invalidate() {
            if (resolver == null || resolution == null) return false;
            resolution = null;
            log.info("Invalidated cached resolution of tool type {}", type);
            return true;
        }

        private TypeResolution runResolver() {
            try {
                ToolFactory factory = resolver.resolve();
                if (factory == null) {
                    return fail("Provider for type " + type + " returned no factory", null, null, null);
                }
                log.info("Resolved tool type {} (version {})", type, version);
                return TypeResolution.resolved(type, factory);
            } catch (ToolDependencyException e) {
                return fail(e.getMessage(), e.getNextSteps(), e.getDetails(), e);
            } catch (Exception | LinkageError e) {
                return fail("Failed to load implementation of type " + type + ": " + e.getMessage(),
                        null, Map.of("type", type, "cause", e.getClass().getName()), e);
            }
        }

        private TypeResolution fail(String message, List<String> nextSteps, Map<String, Object> details, Throwable cause) {
            log.warn("Tool type {} is unavailable: {}", type, message, cause);
            return TypeResolution.failed(type, ToolError.dependency(null, message, nextSteps, details));
        }
    }
}
