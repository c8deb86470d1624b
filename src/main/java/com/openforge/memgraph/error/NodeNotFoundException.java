package com.openforge.memgraph.error;

import lombok.Getter;

@Getter
public class NodeNotFoundException extends MemoryCoreException {

    private final String nodeId;
    private final String namespace;

    public NodeNotFoundException(String nodeId, String namespace) {
        super("Node %s not found in namespace %s".formatted(nodeId, namespace));
        this.nodeId    = nodeId;
        this.namespace = namespace;
    }
}
