package com.toolhub.registry;

import com.toolhub.catalog.ToolCatalog;
import com.toolhub.health.HealthTracker;
import com.toolhub.tools.ResourceCleanup;
import com.toolhub.tools.Tool;
import com.toolhub.tools.ToolFactory;
import com.toolhub.tools.error.ToolDependencyException;
import com.toolhub.tools.error.ToolError;
import com.toolhub.tools.error.ToolException;
import com.toolhub.tools.spec.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds at most one live instance per tool name and builds it on first use.
 * <p>
 * Cached instances are returned from a lock-free map read. On a miss, construction is
 * single-flight per name: the first caller registers an in-flight future and builds the
 * instance, concurrent callers for the same name wait on that future and receive the same
 * outcome. Different names never wait on each other. Failures are returned but never cached,
 * so the next call retries construction.
 * <p>
 * Every construction attempt updates the {@link HealthTracker}. A name absent from the catalog
 * yields a not-found error without touching health.
 */
public final class ToolInstanceCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolInstanceCache.class);

    private final ToolCatalog catalog;
    private final TypeRegistry typeRegistry;
    private final HealthTracker healthTracker;
    private final Map<String, Tool> instances = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<InstanceOutcome>> inFlight = new ConcurrentHashMap<>();

    public ToolInstanceCache(ToolCatalog catalog, TypeRegistry typeRegistry, HealthTracker healthTracker) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "typeRegistry");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
    }

    /**
     * Returns the cached instance for {@code name}, constructing it if needed.
     * Never throws for construction problems; they are reported in the outcome.
     */
    public InstanceOutcome getOrCreate(String name) {
        if (name == null) {
            return InstanceOutcome.failed(ToolError.notFound(null));
        }
        Tool cached = instances.get(name);
        if (cached != null) {
            return InstanceOutcome.of(cached);
        }
        ToolSpec spec = catalog.lookup(name).orElse(null);
        if (spec == null) {
            return InstanceOutcome.failed(ToolError.notFound(name));
        }

        CompletableFuture<InstanceOutcome> mine = new CompletableFuture<>();
        CompletableFuture<InstanceOutcome> existing = inFlight.putIfAbsent(name, mine);
        if (existing != null) {
            return await(name, existing);
        }
        try {
            // A construction may have finished between the fast-path read and putIfAbsent.
            Tool raced = instances.get(name);
            InstanceOutcome outcome = raced != null ? InstanceOutcome.of(raced) : construct(spec);
            mine.complete(outcome);
            return outcome;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(name, mine);
        }
    }

    private InstanceOutcome await(String name, CompletableFuture<InstanceOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return InstanceOutcome.failed(ToolError.construction(name,
                    "Construction of " + name + " failed: " + describe(cause), null, null));
        }
    }

    private InstanceOutcome construct(ToolSpec spec) {
        String name = spec.getName();
        TypeResolution resolution = typeRegistry.resolve(spec.getType());
        if (!resolution.isResolved()) {
            ToolError error = resolution.getError().orElseThrow().forTool(name);
            healthTracker.recordFailure(name, error);
            return InstanceOutcome.failed(error);
        }
        ToolFactory factory = resolution.getFactory().orElseThrow();
        ToolError error;
        try {
            Tool tool = factory.create(spec);
            if (tool != null) {
                Tool live = tool.supportsConcurrentExecute() && spec.isConcurrentExecute() ? tool : new SerializedTool(tool);
                instances.put(name, live);
                healthTracker.recordSuccess(name);
                log.info("Constructed tool {} (type {})", name, spec.getType());
                return InstanceOutcome.of(live);
            }
            error = ToolError.construction(name, "Factory for type " + spec.getType() + " returned no instance", null, null);
        } catch (ToolDependencyException e) {
            error = ToolError.dependency(name, e.getMessage(), e.getNextSteps(), e.getDetails());
        } catch (ToolException e) {
            error = ToolError.construction(name, e.getMessage(), e.getNextSteps(), e.getDetails());
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            error = ToolError.construction(name, "Failed to construct " + name + ": " + describe(e), null,
                    Map.of("cause", e.getClass().getName()));
        }
        log.warn("Construction of tool {} failed: {}", name, error.getMessage());
        healthTracker.recordFailure(name, error);
        return InstanceOutcome.failed(error);
    }

    /**
     * Discards the cached instance so the next call reconstructs it.
     *
     * @return true if an instance was cached
     */
    public boolean evict(String name) {
        if (name == null) return false;
        Tool removed = instances.remove(name);
        if (removed == null) return false;
        cleanup(name, removed);
        log.info("Evicted tool instance {}", name);
        return true;
    }

    /** Evicts instances whose name is not in {@code names}; returns the number evicted. */
    public int retainOnly(Set<String> names) {
        Set<String> keep = names != null ? names : Set.of();
        int evicted = 0;
        for (String name : new ArrayList<>(instances.keySet())) {
            if (!keep.contains(name) && evict(name)) evicted++;
        }
        return evicted;
    }

    public boolean isCached(String name) {
        return name != null && instances.containsKey(name);
    }

    /** Names with a live instance, sorted. */
    public Set<String> cachedNames() {
        return Collections.unmodifiableSet(new TreeSet<>(instances.keySet()));
    }

    /** Discards every instance, running cleanup hooks. */
    @Override
    public void close() {
        List<String> names = new ArrayList<>(instances.keySet());
        for (String name : names) {
            evict(name);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static void cleanup(String name, Tool tool) {
        if (!(tool instanceof ResourceCleanup)) return;
        try {
            ((ResourceCleanup) tool).onExit();
        } catch (RuntimeException e) {
            log.warn("Cleanup of tool {} failed: {}", name, e.getMessage(), e);
        }
    }
}
