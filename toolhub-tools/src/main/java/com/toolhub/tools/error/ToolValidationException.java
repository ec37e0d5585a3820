package com.toolhub.tools.error;

import java.util.List;
import java.util.Map;

/**
 * Arguments rejected by the tool itself (checks the schema cannot express). Reported as a
 * {@link ErrorKind#VALIDATION} error and never recorded in health.
 */
public class ToolValidationException extends ToolException {

    private static final long serialVersionUID = 1L;

    public ToolValidationException(String message) {
        this(message, null);
    }

    public ToolValidationException(String message, Map<String, Object> details) {
        super(message, ExecutionFailure.TRANSIENT, false,
                List.of("Check parameter types and values", "Review tool documentation"), details, null);
    }
}
