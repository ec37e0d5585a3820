package com.toolhub.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolhub.tools.error.ToolError;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one call: the normalized payload on success, or a {@link ToolError}. The payload is
 * already JSON-compatible (maps, lists, strings, numbers, booleans, null).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CallResult {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String toolName;
    private final boolean success;
    private final Object payload;
    private final ToolError error;
    private final long durationMs;
    private final boolean cached;

    private CallResult(String toolName, boolean success, Object payload, ToolError error, long durationMs, boolean cached) {
        this.toolName = toolName;
        this.success = success;
        this.payload = payload;
        this.error = error;
        this.durationMs = durationMs;
        this.cached = cached;
    }

    public static CallResult success(String toolName, Object payload, long durationMs, boolean cached) {
        return new CallResult(toolName, true, payload, null, durationMs, cached);
    }

    public static CallResult failure(String toolName, ToolError error, long durationMs) {
        return new CallResult(toolName, false, null, Objects.requireNonNull(error, "error"), durationMs, false);
    }

    @JsonProperty("tool")
    public String getToolName() {
        return toolName;
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    /** Normalized result; null on failure or when the tool returned null. */
    @JsonProperty("result")
    public Object getPayload() {
        return payload;
    }

    @JsonIgnore
    public Optional<ToolError> getError() {
        return Optional.ofNullable(error);
    }

    @JsonProperty("error")
    ToolError errorOrNull() {
        return error;
    }

    @JsonProperty("durationMs")
    public long getDurationMs() {
        return durationMs;
    }

    /** Whether the payload came from the result cache. */
    @JsonProperty("cached")
    public boolean isCached() {
        return cached;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result of " + toolName, e);
        }
    }

    @Override
    public String toString() {
        return success ? "CallResult{" + toolName + " ok, " + durationMs + "ms" + (cached ? ", cached" : "") + "}"
                : "CallResult{" + toolName + " failed: " + error + "}";
    }
}
