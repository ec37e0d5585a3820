package com.toolhub.tools;

import java.util.Map;

/**
 * Live, constructed tool: the single contract the engine invokes. Instances are produced by a
 * {@link ToolFactory} from a {@link com.toolhub.tools.spec.ToolSpec} and are owned exclusively by
 * the instance cache, which constructs, holds and discards them.
 * <p>
 * <b>Threading:</b> instances are assumed safe for concurrent {@link #execute} calls. A tool that
 * keeps unsynchronized mutable state returns {@code false} from {@link #supportsConcurrentExecute()}
 * and the engine serializes calls to it.
 * <p>
 * <b>Deadlines and cancellation:</b> implementations that block (network I/O) must honor
 * {@link ExecutionContext#remaining()} and return promptly once the context is expired or cancelled,
 * by throwing {@link com.toolhub.tools.error.ToolTimeoutException} or letting an
 * {@link InterruptedException} propagate.
 */
public interface Tool {

    /**
     * Executes the tool.
     *
     * @param arguments validated call arguments; never null, unmodifiable
     * @param context   deadline and cancellation state of this call; never null
     * @return result payload (map, list, string, number, boolean, or any value Jackson can convert); may be null
     * @throws Exception on failure; throw a {@link com.toolhub.tools.error.ToolException} subtype to classify it
     */
    Object execute(Map<String, Object> arguments, ExecutionContext context) throws Exception;

    /** Whether {@link #execute} may be called concurrently on this instance. Default true. */
    default boolean supportsConcurrentExecute() {
        return true;
    }
}
