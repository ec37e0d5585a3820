package com.toolhub.tools.error;

import java.util.List;
import java.util.Map;

/**
 * Missing or incompatible dependency (library not on the classpath, external capability not
 * installed). Reported as {@link ErrorKind#DEPENDENCY}.
 */
public class ToolDependencyException extends ToolException {

    private static final long serialVersionUID = 1L;

    static final List<String> DEFAULT_NEXT_STEPS = List.of(
            "Install missing dependencies",
            "Check dependency versions",
            "Review installation documentation");

    public ToolDependencyException(String message) {
        this(message, null, null, null);
    }

    public ToolDependencyException(String message, List<String> nextSteps, Map<String, Object> details, Throwable cause) {
        super(message, ExecutionFailure.PERMANENT, false, orDefault(nextSteps, DEFAULT_NEXT_STEPS), details, cause);
    }

    /** A required class could not be loaded. */
    public static ToolDependencyException missingClass(String typeId, String className, Throwable cause) {
        return new ToolDependencyException(
                "Type " + typeId + " requires class " + className + " which is not on the classpath",
                List.of("Add the library providing " + className + " to the classpath", "Check dependency versions"),
                Map.of("missingClass", className, "type", typeId), cause);
    }
}
