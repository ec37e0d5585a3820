package com.toolhub.registry;

import com.toolhub.tools.ToolFactory;
import com.toolhub.tools.error.ToolError;

import java.util.Objects;
import java.util.Optional;

/** Outcome of resolving a tool type: a factory, or the dependency error explaining why there is none. */
public final class TypeResolution {

    private final String type;
    private final ToolFactory factory;
    private final ToolError error;

    private TypeResolution(String type, ToolFactory factory, ToolError error) {
        this.type = type;
        this.factory = factory;
        this.error = error;
    }

    static TypeResolution resolved(String type, ToolFactory factory) {
        return new TypeResolution(type, Objects.requireNonNull(factory, "factory"), null);
    }

    static TypeResolution failed(String type, ToolError error) {
        return new TypeResolution(type, null, Objects.requireNonNull(error, "error"));
    }

    public String getType() {
        return type;
    }

    public boolean isResolved() {
        return factory != null;
    }

    public Optional<ToolFactory> getFactory() {
        return Optional.ofNullable(factory);
    }

    /** The dependency error; empty when resolved. Its tool name is null until bound with {@link ToolError#forTool}. */
    public Optional<ToolError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isResolved() ? "TypeResolution{" + type + " resolved}" : "TypeResolution{" + type + " failed: " + error + "}";
    }
}
