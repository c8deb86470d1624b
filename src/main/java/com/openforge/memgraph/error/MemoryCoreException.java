package com.openforge.memgraph.error;

/**
 * Root of the typed error taxonomy. Unchecked, like the HTTP client exceptions,
 * so that collaborator calls can be wrapped in plain suppliers.
 */
public abstract class MemoryCoreException extends RuntimeException {

    protected MemoryCoreException(String message) {
        super(message);
    }

    protected MemoryCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
