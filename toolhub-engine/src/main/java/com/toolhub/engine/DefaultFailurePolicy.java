package com.toolhub.engine;

import com.toolhub.tools.error.ErrorKind;
import com.toolhub.tools.error.ExecutionFailure;
import com.toolhub.tools.error.ToolError;

/** Only {@link ExecutionFailure#PERMANENT} execution failures are fatal. */
public final class DefaultFailurePolicy implements FailurePolicy {

    @Override
    public boolean isFatal(ToolError executionError) {
        return executionError != null
                && executionError.getKind() == ErrorKind.EXECUTION
                && executionError.getFailure() == ExecutionFailure.PERMANENT;
    }
}
