package com.toolhub.tools.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base exception tools throw to report a classified failure. The engine turns it into a
 * {@link ToolError} keeping the failure class, retriable flag, next steps and details.
 * Subclasses carry sensible defaults for each failure family.
 */
public class ToolException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ExecutionFailure failure;
    private final boolean retriable;
    private final List<String> nextSteps;
    private final Map<String, Object> details;

    public ToolException(String message, ExecutionFailure failure, boolean retriable,
                         List<String> nextSteps, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.retriable = retriable;
        this.nextSteps = nextSteps != null ? List.copyOf(nextSteps) : List.of();
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public ToolException(String message, ExecutionFailure failure, boolean retriable) {
        this(message, failure, retriable, null, null, null);
    }

    public ExecutionFailure getFailure() {
        return failure;
    }

    public boolean isRetriable() {
        return retriable;
    }

    public List<String> getNextSteps() {
        return nextSteps;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    static List<String> orDefault(List<String> nextSteps, List<String> defaults) {
        return nextSteps != null && !nextSteps.isEmpty() ? nextSteps : defaults;
    }
}
