package com.toolhub.engine;

import com.toolhub.tools.error.ToolError;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Call metrics on a Micrometer registry:
 * <ul>
 *   <li>{@value #CALLS} counter tagged {@code tool} and {@code outcome} (success, cached, or the error kind)</li>
 *   <li>{@value #EXECUTION} timer tagged {@code tool} and {@code success}, recorded only when the tool ran</li>
 *   <li>{@value #CACHE_HITS}, {@value #CACHE_MISSES} and {@value #CACHE_SIZE} for the result cache</li>
 * </ul>
 * Calls to names absent from the catalog are tagged {@code tool=unknown} to bound tag cardinality.
 */
public final class ToolMetrics {

    public static final String CALLS = "toolhub.tool.calls";
    public static final String EXECUTION = "toolhub.tool.execution";
    public static final String CACHE_HITS = "toolhub.result.cache.hits";
    public static final String CACHE_MISSES = "toolhub.result.cache.misses";
    public static final String CACHE_SIZE = "toolhub.result.cache.size";

    static final String UNKNOWN_TOOL = "unknown";

    private final MeterRegistry registry;

    public ToolMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void bindResultCache(ResultCache cache) {
        FunctionCounter.builder(CACHE_HITS, cache, ResultCache::getHits).register(registry);
        FunctionCounter.builder(CACHE_MISSES, cache, ResultCache::getMisses).register(registry);
        Gauge.builder(CACHE_SIZE, cache, ResultCache::size).register(registry);
    }

    void recordSuccess(String tool, boolean cached) {
        registry.counter(CALLS, "tool", tool, "outcome", cached ? "cached" : "success").increment();
    }

    void recordFailure(String tool, ToolError error) {
        registry.counter(CALLS, "tool", tool, "outcome", error.getKind().name().toLowerCase(Locale.ROOT)).increment();
    }

    void recordExecution(String tool, long durationNanos, boolean success) {
        Timer.builder(EXECUTION)
                .tag("tool", tool)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
