package com.toolhub.tools.error;

/**
 * Kind of a failed tool call. Only {@link #DEPENDENCY}, {@link #CONSTRUCTION} and permanent
 * {@link #EXECUTION} failures are recorded in tool health; the others are caller bugs.
 */
public enum ErrorKind {

    /** Tool name is not in the catalog. */
    NOT_FOUND,

    /** Arguments fail the tool's parameter schema. */
    VALIDATION,

    /** The tool's type cannot be resolved on this machine (missing library, capability or implementation). */
    DEPENDENCY,

    /** The factory ran but could not build an instance (e.g. bad static settings). */
    CONSTRUCTION,

    /** The instance ran but the operation failed; see {@link ExecutionFailure}. */
    EXECUTION
}
