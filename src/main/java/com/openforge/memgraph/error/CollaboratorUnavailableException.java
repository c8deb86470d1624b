package com.openforge.memgraph.error;

import lombok.Getter;

/**
 * A store, embedder, language model or NLI service was unreachable or timed out.
 * Carries enough context (collaborator, namespace, operation) for alerting.
 */
@Getter
public class CollaboratorUnavailableException extends MemoryCoreException {

    private final String collaborator;
    private final String namespace;
    private final String operation;

    public CollaboratorUnavailableException(String collaborator, String namespace,
                                            String operation, Throwable cause) {
        super("%s unavailable during %s (namespace=%s): %s"
                .formatted(collaborator, operation, namespace,
                        cause == null ? "no cause" : cause.getMessage()), cause);
        this.collaborator = collaborator;
        this.namespace    = namespace;
        this.operation    = operation;
    }
}
