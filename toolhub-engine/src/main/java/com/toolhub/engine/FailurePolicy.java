package com.toolhub.engine;

import com.toolhub.tools.error.ToolError;

/**
 * Decides which execution failures take a tool out of service. A fatal failure marks the tool
 * unavailable in the health tracker and evicts its instance, so the next call reconstructs it.
 */
@FunctionalInterface
public interface FailurePolicy {

    boolean isFatal(ToolError executionError);
}
