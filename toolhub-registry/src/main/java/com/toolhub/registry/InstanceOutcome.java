package com.toolhub.registry;

import com.toolhub.tools.Tool;
import com.toolhub.tools.error.ToolError;

import java.util.Objects;
import java.util.Optional;

/** Result of {@link ToolInstanceCache#getOrCreate}: a live instance or the error that prevented one. */
public final class InstanceOutcome {

    private final Tool instance;
    private final ToolError error;

    private InstanceOutcome(Tool instance, ToolError error) {
        this.instance = instance;
        this.error = error;
    }

    public static InstanceOutcome of(Tool instance) {
        return new InstanceOutcome(Objects.requireNonNull(instance, "instance"), null);
    }

    public static InstanceOutcome failed(ToolError error) {
        return new InstanceOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return instance != null;
    }

    public Optional<Tool> getInstance() {
        return Optional.ofNullable(instance);
    }

    public Optional<ToolError> getError() {
        return Optional.ofNullable(error);
    }
}
