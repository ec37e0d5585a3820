package com.toolhub.engine;

import com.toolhub.tools.error.ExecutionFailure;
import com.toolhub.tools.error.ToolError;
import com.toolhub.tools.error.ToolException;
import com.toolhub.tools.error.ToolValidationException;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps an exception thrown by {@link com.toolhub.tools.Tool#execute} to a {@link ToolError}.
 * <p>
 * {@link ToolException} subtypes keep their own classification. Otherwise timeouts map to
 * {@link ExecutionFailure#TIMEOUT}, other I/O failures to {@link ExecutionFailure#TRANSIENT},
 * interruption and cancellation to {@link ExecutionFailure#CANCELLED}, and anything else to
 * {@link ExecutionFailure#PERMANENT}. Wrapper exceptions are unwrapped first.
 */
public class ExecutionFailureClassifier {

    public ToolError classify(String toolName, Throwable thrown) {
        Throwable t = unwrap(thrown);
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();

        if (t instanceof ToolValidationException) {
            return ToolError.validation(toolName, List.of(message));
        }
        if (t instanceof ToolException) {
            ToolException te = (ToolException) t;
            return ToolError.execution(toolName, te.getFailure(), message, te.isRetriable(),
                    te.getNextSteps(), te.getDetails());
        }
        if (t instanceof TimeoutException || t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
            return ToolError.execution(toolName, ExecutionFailure.TIMEOUT, "Timed out: " + message, true,
                    List.of("Retry the call", "Increase the call timeout"), causeDetails(t));
        }
        if (t instanceof InterruptedException || t instanceof CancellationException) {
            return cancelled(toolName);
        }
        if (t instanceof IOException) {
            return ToolError.execution(toolName, ExecutionFailure.TRANSIENT, message, true,
                    List.of("Retry the call", "Check network connectivity"), causeDetails(t));
        }
        return ToolError.execution(toolName, ExecutionFailure.PERMANENT, message, false,
                List.of("Check the tool's logs", "Reset the tool after fixing its configuration"), causeDetails(t));
    }

    /** Error for a call cancelled by its caller. */
    public ToolError cancelled(String toolName) {
        return ToolError.execution(toolName, ExecutionFailure.CANCELLED, "Call to " + toolName + " was cancelled",
                false, null, null);
    }

    /** Error for a call whose deadline passed before or during execution. */
    public ToolError deadlineExceeded(String toolName) {
        return ToolError.execution(toolName, ExecutionFailure.TIMEOUT, "Deadline exceeded for " + toolName, true,
                List.of("Retry the call", "Increase the call timeout"), null);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException
                || current instanceof InvocationTargetException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Map<String, Object> causeDetails(Throwable t) {
        return Map.of("exception", t.getClass().getName());
    }
}
