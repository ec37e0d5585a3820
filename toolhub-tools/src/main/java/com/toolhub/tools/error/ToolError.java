package com.toolhub.tools.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured error returned for a failed tool call: kind, optional execution sub-kind, message,
 * retriable flag, actionable next steps and details. Immutable and serializable with Jackson.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ToolError {

    private final String toolName;
    private final ErrorKind kind;
    private final ExecutionFailure failure;
    private final String message;
    private final boolean retriable;
    private final List<String> nextSteps;
    private final Map<String, Object> details;

    public ToolError(String toolName, ErrorKind kind, ExecutionFailure failure, String message,
                     boolean retriable, List<String> nextSteps, Map<String, Object> details) {
        this.toolName = toolName;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.failure = kind == ErrorKind.EXECUTION ? Objects.requireNonNull(failure, "failure") : null;
        this.message = message != null ? message : kind.name();
        this.retriable = retriable;
        this.nextSteps = nextSteps != null ? List.copyOf(nextSteps) : List.of();
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static ToolError notFound(String toolName) {
        return new ToolError(toolName, ErrorKind.NOT_FOUND, null,
                "Tool not found: " + toolName, false,
                List.of("Check tool name spelling", "List available tools to find the correct name"), null);
    }

    /** Validation error carrying every violation found. */
    public static ToolError validation(String toolName, List<String> violations) {
        List<String> v = violations != null ? violations : List.of();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("violations", new ArrayList<>(v));
        return new ToolError(toolName, ErrorKind.VALIDATION, null,
                "Invalid arguments for " + toolName + ": " + String.join("; ", v), false,
                List.of("Check parameter types and values", "Verify required parameters are provided"), details);
    }

    public static ToolError dependency(String toolName, String message, List<String> nextSteps, Map<String, Object> details) {
        return new ToolError(toolName, ErrorKind.DEPENDENCY, null, message, false,
                nextSteps != null && !nextSteps.isEmpty() ? nextSteps : ToolDependencyException.DEFAULT_NEXT_STEPS, details);
    }

    public static ToolError construction(String toolName, String message, List<String> nextSteps, Map<String, Object> details) {
        return new ToolError(toolName, ErrorKind.CONSTRUCTION, null, message, false,
                nextSteps != null && !nextSteps.isEmpty() ? nextSteps : ToolConfigException.DEFAULT_NEXT_STEPS, details);
    }

    public static ToolError execution(String toolName, ExecutionFailure failure, String message, boolean retriable,
                                      List<String> nextSteps, Map<String, Object> details) {
        return new ToolError(toolName, ErrorKind.EXECUTION, failure, message, retriable, nextSteps, details);
    }

    /** Same error attributed to another tool name (e.g. a cached type-resolution failure). */
    public ToolError forTool(String otherToolName) {
        if (Objects.equals(toolName, otherToolName)) return this;
        return new ToolError(otherToolName, kind, failure, message, retriable, nextSteps, details);
    }

    @JsonProperty("tool")
    public String getToolName() {
        return toolName;
    }

    @JsonProperty("kind")
    public ErrorKind getKind() {
        return kind;
    }

    /** Execution sub-kind; null unless {@link #getKind()} is {@link ErrorKind#EXECUTION}. */
    @JsonProperty("failure")
    public ExecutionFailure getFailure() {
        return failure;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("retriable")
    public boolean isRetriable() {
        return retriable;
    }

    @JsonProperty("nextSteps")
    public List<String> getNextSteps() {
        return nextSteps;
    }

    @JsonProperty("details")
    public Map<String, Object> getDetails() {
        return details;
    }

    /** Violations of a {@link ErrorKind#VALIDATION} error; empty for other kinds. */
    @SuppressWarnings("unchecked")
    public List<String> getViolations() {
        Object v = details.get("violations");
        return v instanceof List ? Collections.unmodifiableList((List<String>) v) : List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolError that = (ToolError) o;
        return retriable == that.retriable && Objects.equals(toolName, that.toolName) && kind == that.kind
                && failure == that.failure && message.equals(that.message)
                && nextSteps.equals(that.nextSteps) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(toolName, kind, failure, message, retriable, nextSteps, details);
    }

    @Override
    public String toString() {
        return kind + (failure != null ? "/" + failure : "") + " [" + toolName + "]: " + message;
    }
}
