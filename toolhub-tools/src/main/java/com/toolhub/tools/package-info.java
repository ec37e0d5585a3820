/**
 * Tool contract for Toolhub: a tool type supplies a {@link com.toolhub.tools.ToolFactory} (usually
 * through a {@link com.toolhub.tools.ToolProvider}); the factory turns a catalog
 * {@link com.toolhub.tools.spec.ToolSpec} into a {@link com.toolhub.tools.Tool} the engine executes.
 * Tools signal classified failures with the {@link com.toolhub.tools.error.ToolException} hierarchy.
 */
package com.toolhub.tools;
