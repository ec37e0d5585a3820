/**
 * Tool type registry and the per-name instance cache.
 * <p>
 * {@link com.toolhub.registry.TypeRegistry} maps a catalog {@code type} to a factory, resolving
 * lazily registered providers on first use. {@link com.toolhub.registry.ToolInstanceCache} builds
 * and holds one instance per tool name with single-flight construction.
 */
package com.toolhub.registry;
