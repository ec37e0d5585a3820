package com.toolhub.tools.error;

import java.util.List;
import java.util.Map;

/** Rate limit or quota exceeded. Transient and retriable. */
public class ToolRateLimitException extends ToolException {

    private static final long serialVersionUID = 1L;

    static final List<String> DEFAULT_NEXT_STEPS = List.of(
            "Wait and retry with exponential backoff",
            "Check API quota limits",
            "Use alternative API key if available");

    public ToolRateLimitException(String message) {
        this(message, null, null, null);
    }

    public ToolRateLimitException(String message, List<String> nextSteps, Map<String, Object> details, Throwable cause) {
        super(message, ExecutionFailure.TRANSIENT, true, orDefault(nextSteps, DEFAULT_NEXT_STEPS), details, cause);
    }
}
