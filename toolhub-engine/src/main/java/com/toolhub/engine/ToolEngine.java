package com.toolhub.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolhub.catalog.CatalogSource;
import com.toolhub.catalog.LoadMode;
import com.toolhub.catalog.ToolCatalog;
import com.toolhub.health.HealthTracker;
import com.toolhub.registry.ToolInstanceCache;
import com.toolhub.registry.TypeRegistry;
import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.error.ToolError;
import com.toolhub.tools.spec.ToolSpec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the tool hub: owns the catalog, type registry, instance cache, health tracker
 * and dispatcher for one process (or one test). No state is global; every engine is independent.
 * <p>
 * Calls made through the engine have their deadline enforced: when it passes, the call's context
 * is cancelled and the executing thread interrupted, and the call fails with a TIMEOUT error.
 */
public final class ToolEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolEngine.class);

    private final ToolCatalog catalog;
    private final TypeRegistry types;
    private final HealthTracker health;
    private final ToolInstanceCache instances;
    private final ResultCache resultCache;
    private final ToolMetrics metrics;
    private final ToolDispatcher dispatcher;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final ScheduledExecutorService deadlines;

    private ToolEngine(Builder b) {
        ToolhubConfig config = b.config != null ? b.config : ToolhubConfig.builder().build();
        Clock clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.catalog = b.catalog != null ? b.catalog : new ToolCatalog();
        this.types = b.types != null ? b.types : new TypeRegistry();
        this.health = b.health != null ? b.health : new HealthTracker(clock, config.getHealthMaxRecords());
        this.instances = new ToolInstanceCache(catalog, types, health);
        this.resultCache = new ResultCache(config.getResultCacheSize(), config.getResultCacheTtl(), clock);
        this.metrics = new ToolMetrics(b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry());
        metrics.bindResultCache(resultCache);
        this.dispatcher = new ToolDispatcher(catalog, instances, health, new ParameterValidator(),
                new ExecutionFailureClassifier(),
                b.failurePolicy != null ? b.failurePolicy : new DefaultFailurePolicy(),
                resultCache, metrics, b.mapper != null ? b.mapper : new ObjectMapper(), clock, config.getDefaultTimeout());
        this.ownsExecutor = b.executor == null;
        this.executor = b.executor != null ? b.executor
                : Executors.newFixedThreadPool(config.getExecutorThreads(), daemonThreads("toolhub-call"));
        this.deadlines = Executors.newSingleThreadScheduledExecutor(daemonThreads("toolhub-deadline"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Calls a tool on the current thread. Never throws for tool problems; see {@link CallResult#getError()}. */
    public CallResult call(String name, Map<String, ?> arguments) {
        return call(CallRequest.of(name, arguments));
    }

    public CallResult call(CallRequest request) {
        Objects.requireNonNull(request, "request");
        return callWithDeadline(request, dispatcher.newContext(request));
    }

    /**
     * Runs the requests concurrently on the engine's executor. Results are returned in input order
     * and each one is independent of the others.
     */
    public List<CallResult> callBatch(List<CallRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        List<CompletableFuture<CallResult>> futures = new ArrayList<>(requests.size());
        for (CallRequest request : requests) {
            futures.add(callAsync(request));
        }
        List<CallResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(joinItem(requests.get(i), futures.get(i)));
        }
        return results;
    }

    /**
     * Calls a tool on the engine's executor. Cancelling the returned future cancels the call:
     * the tool sees {@link ExecutionContext#isCancelled()} and its thread is interrupted.
     */
    public CompletableFuture<CallResult> callAsync(CallRequest request) {
        Objects.requireNonNull(request, "request");
        ExecutionContext context = dispatcher.newContext(request);
        CompletableFuture<CallResult> future = CompletableFuture.supplyAsync(() -> callWithDeadline(request, context), executor);
        future.whenComplete((result, failure) -> {
            if (failure instanceof CancellationException) {
                context.cancel();
            }
        });
        return future;
    }

    private CallResult joinItem(CallRequest request, CompletableFuture<CallResult> future) {
        try {
            return future.join();
        } catch (CancellationException | CompletionException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("Batch item {} failed outside the dispatcher: {}", request.getName(), cause.toString());
            ToolError error = e instanceof CancellationException
                    ? dispatcher.classifier().cancelled(request.getName())
                    : dispatcher.classifier().classify(request.getName(), cause);
            return CallResult.failure(request.getName(), error, 0L);
        }
    }

    private CallResult callWithDeadline(CallRequest request, ExecutionContext context) {
        Optional<Duration> remaining = context.remaining();
        ScheduledFuture<?> watchdog = remaining
                .map(r -> deadlines.schedule(context::expire, Math.max(1, r.toMillis()), TimeUnit.MILLISECONDS))
                .orElse(null);
        try {
            return dispatcher.call(request, context);
        } finally {
            if (watchdog != null) {
                watchdog.cancel(false);
            }
        }
    }

    /**
     * Forces the tool to be rebuilt on its next call: evicts the instance, invalidates a cached
     * lazy resolution of its type, and drops its cached results.
     *
     * @return false if the name is not in the catalog
     */
    public boolean reset(String name) {
        ToolSpec spec = catalog.lookup(name).orElse(null);
        if (spec == null) return false;
        instances.evict(name);
        types.invalidate(spec.getType());
        resultCache.invalidate(name);
        log.info("Reset tool {}", name);
        return true;
    }

    /**
     * Loads specs into the catalog. Cached instances whose spec changed or disappeared are evicted,
     * and health records of names no longer in the catalog are pruned.
     */
    public void loadCatalog(Collection<ToolSpec> specs, LoadMode mode) {
        Map<String, ToolSpec> before = snapshotCached();
        catalog.load(specs, mode);
        afterLoad(before);
    }

    public void loadCatalog(CatalogSource source, LoadMode mode) {
        Map<String, ToolSpec> before = snapshotCached();
        catalog.load(source, mode);
        afterLoad(before);
    }

    private Map<String, ToolSpec> snapshotCached() {
        Map<String, ToolSpec> before = new HashMap<>();
        for (String name : instances.cachedNames()) {
            catalog.lookup(name).ifPresent(s -> before.put(name, s));
        }
        return before;
    }

    private void afterLoad(Map<String, ToolSpec> before) {
        for (Map.Entry<String, ToolSpec> e : before.entrySet()) {
            if (!catalog.lookup(e.getKey()).map(e.getValue()::equals).orElse(false)) {
                instances.evict(e.getKey());
                resultCache.invalidate(e.getKey());
            }
        }
        health.retainOnly(catalog.names());
    }

    public ToolCatalog catalog() {
        return catalog;
    }

    public TypeRegistry types() {
        return types;
    }

    public HealthTracker health() {
        return health;
    }

    public ToolInstanceCache instances() {
        return instances;
    }

    public ToolDispatcher dispatcher() {
        return dispatcher;
    }

    public ResultCache resultCache() {
        return resultCache;
    }

    public MeterRegistry meterRegistry() {
        return metrics.getRegistry();
    }

    /** Stops the executors and discards every tool instance, running cleanup hooks. */
    @Override
    public void close() {
        deadlines.shutdownNow();
        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        instances.close();
        log.info("Tool engine closed");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private ToolhubConfig config;
        private ToolCatalog catalog;
        private TypeRegistry types;
        private HealthTracker health;
        private MeterRegistry meterRegistry;
        private FailurePolicy failurePolicy;
        private ExecutorService executor;
        private ObjectMapper mapper;
        private Clock clock;

        public Builder config(ToolhubConfig config) {
            this.config = config;
            return this;
        }

        public Builder catalog(ToolCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder types(TypeRegistry types) {
            this.types = types;
            return this;
        }

        public Builder health(HealthTracker health) {
            this.health = health;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        /** Executor for {@link #callAsync} and {@link #callBatch}; not shut down by {@link #close()}. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ToolEngine build() {
            return new ToolEngine(this);
        }
    }
}
