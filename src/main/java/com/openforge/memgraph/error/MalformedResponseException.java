package com.openforge.memgraph.error;

/** Language-model output failed schema validation after the bounded retry. */
public class MalformedResponseException extends MemoryCoreException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
