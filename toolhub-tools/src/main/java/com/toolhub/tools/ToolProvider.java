package com.toolhub.tools;

import java.util.List;

/**
 * SPI for tool implementations. Each provider supplies the factory for one tool type. Built-in
 * providers are registered explicitly at startup; additional providers on the classpath are
 * discovered via {@link java.util.ServiceLoader} ({@code META-INF/services/com.toolhub.tools.ToolProvider}).
 * <p>
 * Providers are registered <b>lazily</b>: {@link #createFactory()} is not called until a tool of
 * this type is first needed, so types nobody calls never load their implementation classes or
 * optional libraries.
 */
public interface ToolProvider {

    /** Type identifier matched against {@code ToolSpec.type} (e.g. "EchoTool", "RESTTool"). */
    String getTypeId();

    /**
     * Creates the factory for this type. Called at most once per type (until the type's resolution
     * is invalidated). Throwing here is recorded as a dependency error for every tool of this type.
     */
    ToolFactory createFactory() throws Exception;

    /** Human-readable description of the tool family. */
    default String getDescription() {
        return "";
    }

    /** Implementation version for diagnostics (e.g. "1.0"). */
    default String getVersion() {
        return "1.0";
    }

    /**
     * Fully qualified class names that must be loadable before the factory is created. Used for
     * optional third-party libraries: when one is absent, every tool of this type reports a
     * dependency error naming the missing class instead of failing with a linkage error at call time.
     */
    default List<String> getRequiredClasses() {
        return List.of();
    }

    /** Whether this provider should be registered. Override to skip when its environment is unset. */
    default boolean isEnabled() {
        return true;
    }
}
