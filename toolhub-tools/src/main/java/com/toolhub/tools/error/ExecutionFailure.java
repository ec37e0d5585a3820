package com.toolhub.tools.error;

/**
 * Sub-kind of an {@link ErrorKind#EXECUTION} error. Drives the health policy: only
 * {@link #PERMANENT} marks a tool unavailable.
 */
public enum ExecutionFailure {

    /** The call's deadline passed before the operation completed. */
    TIMEOUT,

    /** One-off condition (network blip, rate limit, upstream 5xx); the tool itself is fine. */
    TRANSIENT,

    /** The tool is structurally broken (e.g. rejected credentials, malformed upstream contract). */
    PERMANENT,

    /** The caller cancelled the call. */
    CANCELLED
}
