package com.toolhub.catalog;

/** How {@link ToolCatalog#load} combines new specs with the current catalog content. */
public enum LoadMode {

    /**
     * Add to the current content. Redefining a name with the same type replaces its description
     * and settings; redefining it with a different type is a configuration error.
     */
    MERGE,

    /** Discard the current content and keep only the given specs. */
    REPLACE
}
