package com.toolhub.tools.error;

import java.util.List;
import java.util.Map;

/** Authentication or authorization failure (missing/invalid API key, permissions). Permanent. */
public class ToolAuthException extends ToolException {

    private static final long serialVersionUID = 1L;

    static final List<String> DEFAULT_NEXT_STEPS = List.of(
            "Check API key configuration",
            "Verify environment variables",
            "Review authentication documentation");

    public ToolAuthException(String message) {
        this(message, null, null, null);
    }

    public ToolAuthException(String message, List<String> nextSteps, Map<String, Object> details, Throwable cause) {
        super(message, ExecutionFailure.PERMANENT, false, orDefault(nextSteps, DEFAULT_NEXT_STEPS), details, cause);
    }
}
