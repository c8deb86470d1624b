package com.openforge.memgraph.error;

/**
 * The requested write would break a graph invariant. Fatal to the single
 * write or edge that triggered it; existing state is left untouched.
 */
public class InvariantViolationException extends MemoryCoreException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
