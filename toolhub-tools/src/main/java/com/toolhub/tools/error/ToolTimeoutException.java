package com.toolhub.tools.error;

import java.util.List;

/** The call's deadline passed. Retriable. */
public class ToolTimeoutException extends ToolException {

    private static final long serialVersionUID = 1L;

    public ToolTimeoutException(String message) {
        this(message, null);
    }

    public ToolTimeoutException(String message, Throwable cause) {
        super(message, ExecutionFailure.TIMEOUT, true,
                List.of("Retry with a longer timeout", "Check service status"), null, cause);
    }
}
