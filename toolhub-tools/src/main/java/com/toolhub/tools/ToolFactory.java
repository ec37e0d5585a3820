package com.toolhub.tools;

import com.toolhub.tools.spec.ToolSpec;

/**
 * Builds a {@link Tool} from its static specification. One factory serves every catalog entry of
 * its type; the spec's settings (endpoint, defaults, credentials env names) parameterize the instance.
 * <p>
 * A factory that cannot build an instance (bad settings, missing credential) throws. Throw
 * {@link com.toolhub.tools.error.ToolConfigException} with next steps so operators know what to fix,
 * or {@link com.toolhub.tools.error.ToolDependencyException} when a required library or external
 * capability is missing on this machine.
 */
@FunctionalInterface
public interface ToolFactory {

    /**
     * @param spec tool specification from the catalog; never null
     * @return new tool instance; must not be null
     * @throws Exception if the instance cannot be built
     */
    Tool create(ToolSpec spec) throws Exception;
}
