package com.toolhub.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One tool invocation: tool name, arguments and optional timeout. In JSON the timeout is
 * {@code timeoutMs}; absent means the engine default.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CallRequest {

    private final String name;
    private final Map<String, Object> arguments;
    private final Duration timeout;

    private CallRequest(String name, Map<String, Object> arguments, Duration timeout) {
        this.name = name;
        this.arguments = arguments != null ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments)) : Map.of();
        this.timeout = timeout;
    }

    public static CallRequest of(String name, Map<String, ?> arguments) {
        return of(name, arguments, null);
    }

    /** @param timeout null or non-positive = engine default */
    public static CallRequest of(String name, Map<String, ?> arguments, Duration timeout) {
        Duration t = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : null;
        @SuppressWarnings("unchecked")
        Map<String, Object> args = (Map<String, Object>) arguments;
        return new CallRequest(name, args, t);
    }

    @JsonCreator
    static CallRequest fromJson(@JsonProperty("name") String name,
                                @JsonProperty("arguments") Map<String, Object> arguments,
                                @JsonProperty("timeoutMs") Long timeoutMs) {
        return of(name, arguments, timeoutMs != null ? Duration.ofMillis(timeoutMs) : null);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("arguments")
    public Map<String, Object> getArguments() {
        return arguments;
    }

    @JsonIgnore
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    @JsonProperty("timeoutMs")
    Long timeoutMillis() {
        return timeout != null ? timeout.toMillis() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallRequest that = (CallRequest) o;
        return Objects.equals(name, that.name) && arguments.equals(that.arguments) && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments, timeout);
    }

    @Override
    public String toString() {
        return "CallRequest{" + name + ", args=" + arguments.keySet() + (timeout != null ? ", timeout=" + timeout : "") + "}";
    }
}
