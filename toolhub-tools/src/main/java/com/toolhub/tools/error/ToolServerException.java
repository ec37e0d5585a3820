package com.toolhub.tools.error;

import java.util.List;
import java.util.Map;

/** Upstream server-side failure (5xx, unreachable service). Transient and retriable. */
public class ToolServerException extends ToolException {

    private static final long serialVersionUID = 1L;

    static final List<String> DEFAULT_NEXT_STEPS = List.of(
            "Retry the request",
            "Check service status",
            "Report issue if persistent");

    public ToolServerException(String message) {
        this(message, null, null, null);
    }

    public ToolServerException(String message, List<String> nextSteps, Map<String, Object> details, Throwable cause) {
        super(message, ExecutionFailure.TRANSIENT, true, orDefault(nextSteps, DEFAULT_NEXT_STEPS), details, cause);
    }
}
