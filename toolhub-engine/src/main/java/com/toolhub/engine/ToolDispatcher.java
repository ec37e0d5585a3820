package com.toolhub.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolhub.catalog.ToolCatalog;
import com.toolhub.health.HealthTracker;
import com.toolhub.registry.InstanceOutcome;
import com.toolhub.registry.ToolInstanceCache;
import com.toolhub.tools.ExecutionContext;
import com.toolhub.tools.Tool;
import com.toolhub.tools.error.ErrorKind;
import com.toolhub.tools.error.ExecutionFailure;
import com.toolhub.tools.error.ToolError;
import com.toolhub.tools.spec.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one call through lookup, validation, instance acquisition and execution, and turns every
 * outcome into a {@link CallResult}. Problems are returned as {@link ToolError}s; nothing is
 * thrown past {@link #call}.
 * <ol>
 *   <li>name not in the catalog: NOT_FOUND, health untouched</li>
 *   <li>invalid arguments: VALIDATION with every violation, health untouched</li>
 *   <li>construction failed: DEPENDENCY or CONSTRUCTION, health updated by the instance cache</li>
 *   <li>tool threw: EXECUTION classified by {@link ExecutionFailureClassifier}; fatal failures
 *       per {@link FailurePolicy} mark the tool unavailable and evict its instance</li>
 * </ol>
 */
public final class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolCatalog catalog;
    private final ToolInstanceCache instances;
    private final HealthTracker health;
    private final ParameterValidator validator;
    private final ExecutionFailureClassifier classifier;
    private final FailurePolicy failurePolicy;
    private final ResultCache resultCache;
    private final ToolMetrics metrics;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration defaultTimeout;

    ToolDispatcher(ToolCatalog catalog, ToolInstanceCache instances, HealthTracker health,
                   ParameterValidator validator, ExecutionFailureClassifier classifier, FailurePolicy failurePolicy,
                   ResultCache resultCache, ToolMetrics metrics, ObjectMapper mapper, Clock clock, Duration defaultTimeout) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.instances = Objects.requireNonNull(instances, "instances");
        this.health = Objects.requireNonNull(health, "health");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.resultCache = Objects.requireNonNull(resultCache, "resultCache");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTimeout = defaultTimeout;
    }

    public CallResult call(String name, Map<String, ?> arguments) {
        return call(CallRequest.of(name, arguments));
    }

    public CallResult call(CallRequest request) {
        Objects.requireNonNull(request, "request");
        return call(request, newContext(request));
    }

    /** Calls each request in order on the calling thread; one failure does not affect the others. */
    public List<CallResult> callBatch(List<CallRequest> requests) {
        List<CallResult> results = new ArrayList<>(requests.size());
        for (CallRequest request : requests) {
            results.add(call(request));
        }
        return results;
    }

    ExecutionFailureClassifier classifier() {
        return classifier;
    }

    /** Context carrying the request's timeout, or the default timeout when it has none. */
    ExecutionContext newContext(CallRequest request) {
        Duration timeout = request.getTimeout().orElse(defaultTimeout);
        return ExecutionContext.withTimeout(String.valueOf(request.getName()), timeout, clock);
    }

    CallResult call(CallRequest request, ExecutionContext context) {
        long start = System.nanoTime();
        String name = request.getName();
        Map<String, Object> args = request.getArguments();

        ToolSpec spec = catalog.lookup(name).orElse(null);
        if (spec == null) {
            return fail(ToolMetrics.UNKNOWN_TOOL, ToolError.notFound(name), start);
        }
        ValidationResult validation = validator.validate(spec.getParameterSchema(), args);
        if (!validation.isValid()) {
            return fail(name, ToolError.validation(name, validation.getErrors()), start);
        }
        if (spec.isCacheable()) {
            Object cached = resultCache.get(name, args).orElse(null);
            if (cached != null) {
                metrics.recordSuccess(name, true);
                log.debug("Call {} served from result cache", name);
                return CallResult.success(name, cached, elapsedMs(start), true);
            }
        }
        InstanceOutcome outcome = instances.getOrCreate(name);
        if (!outcome.isSuccess()) {
            return fail(name, outcome.getError().orElseThrow(), start);
        }
        if (context.isExpired()) {
            return fail(name, classifier.deadlineExceeded(name), start);
        }
        if (context.isCancelled()) {
            return fail(name, classifier.cancelled(name), start);
        }
        return execute(spec, outcome.getInstance().orElseThrow(), args, context, start);
    }

    private CallResult execute(ToolSpec spec, Tool tool, Map<String, Object> args, ExecutionContext context, long start) {
        String name = spec.getName();
        long execStart = System.nanoTime();
        Object raw;
        context.attach(Thread.currentThread());
        try {
            raw = tool.execute(args, context);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            ToolError error;
            if (context.isCancelled()) {
                error = context.isExpired() ? classifier.deadlineExceeded(name) : classifier.cancelled(name);
            } else {
                error = classifier.classify(name, e);
                if (e instanceof InterruptedException) {
                    // Not delivered by this call's context; restore it for the caller.
                    Thread.currentThread().interrupt();
                }
            }
            metrics.recordExecution(name, System.nanoTime() - execStart, false);
            return executionFailed(name, error, e, start);
        } finally {
            context.detach();
            if (context.isCancelled()) {
                // Clear an interrupt delivered by cancel().
                Thread.interrupted();
            }
        }
        metrics.recordExecution(name, System.nanoTime() - execStart, true);

        Object payload;
        try {
            payload = mapper.convertValue(raw, Object.class);
        } catch (IllegalArgumentException e) {
            ToolError error = ToolError.execution(name, ExecutionFailure.PERMANENT,
                    "Result of " + name + " is not JSON-serializable: " + e.getMessage(), false,
                    List.of("Return maps, lists, strings, numbers or booleans from the tool"),
                    Map.of("resultType", raw.getClass().getName()));
            return executionFailed(name, error, e, start);
        }
        if (spec.isCacheable()) {
            resultCache.put(name, args, payload);
        }
        metrics.recordSuccess(name, false);
        log.debug("Call {} succeeded in {}ms", name, elapsedMs(start));
        return CallResult.success(name, payload, elapsedMs(start), false);
    }

    private CallResult executionFailed(String name, ToolError error, Throwable cause, long start) {
        if (failurePolicy.isFatal(error)) {
            log.warn("Tool {} failed permanently, marking unavailable: {}", name, error.getMessage(), cause);
            health.recordFailure(name, error);
            instances.evict(name);
        } else {
            log.debug("Tool {} failed ({}): {}", name, error.getFailure(), error.getMessage());
        }
        return fail(name, error, start);
    }

    private CallResult fail(String metricsName, ToolError error, long start) {
        metrics.recordFailure(metricsName, error);
        if (error.getKind() != ErrorKind.EXECUTION) {
            log.debug("Call {} rejected: {}", error.getToolName(), error);
        }
        return CallResult.failure(error.getToolName(), error, elapsedMs(start));
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
