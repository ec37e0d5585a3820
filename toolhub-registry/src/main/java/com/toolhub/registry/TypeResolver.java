package com.toolhub.registry;

import com.toolhub.tools.ToolFactory;

/**
 * Deferred source of a {@link ToolFactory}. Invoked at most once per registration (until
 * {@link TypeRegistry#invalidate(String)}), the first time a tool of the type is needed.
 */
@FunctionalInterface
public interface TypeResolver {

    ToolFactory resolve() throws Exception;
}
