package com.toolhub.tools.error;

import java.util.List;
import java.util.Map;

/**
 * Tool configuration error (invalid settings, missing credential) raised by a factory while
 * building an instance. Reported as {@link ErrorKind#CONSTRUCTION}.
 */
public class ToolConfigException extends ToolException {

    private static final long serialVersionUID = 1L;

    static final List<String> DEFAULT_NEXT_STEPS = List.of(
            "Review tool configuration",
            "Check environment variables",
            "Verify required dependencies are installed");

    public ToolConfigException(String message) {
        this(message, null, null, null);
    }

    public ToolConfigException(String message, List<String> nextSteps, Map<String, Object> details, Throwable cause) {
        super(message, ExecutionFailure.PERMANENT, false, orDefault(nextSteps, DEFAULT_NEXT_STEPS), details, cause);
    }

    /** Missing environment variable, with the variable named in the next steps. */
    public static ToolConfigException missingEnv(String toolName, String envName) {
        return new ToolConfigException(
                "Tool " + toolName + " requires environment variable " + envName,
                List.of("Set environment variable " + envName, "Restart or reset the tool after setting it"),
                Map.of("missingEnv", envName), null);
    }
}
