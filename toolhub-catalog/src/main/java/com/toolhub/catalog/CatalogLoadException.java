package com.toolhub.catalog;

/** A catalog source could not be read or contains an invalid tool definition. */
public final class CatalogLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
