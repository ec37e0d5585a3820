package com.toolhub.catalog;

/**
 * Thrown at load time when a tool name is defined twice with different types. This is a
 * configuration error: the catalog is left unchanged.
 */
public final class DuplicateToolNameException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final String existingType;
    private final String conflictingType;

    public DuplicateToolNameException(String toolName, String existingType, String conflictingType) {
        super("Tool " + toolName + " is already defined with type " + existingType
                + "; cannot redefine it with type " + conflictingType);
        this.toolName = toolName;
        this.existingType = existingType;
        this.conflictingType = conflictingType;
    }

    public String getToolName() {
        return toolName;
    }

    public String getExistingType() {
        return existingType;
    }

    public String getConflictingType() {
        return conflictingType;
    }
}
