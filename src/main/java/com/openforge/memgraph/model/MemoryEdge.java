package com.openforge.memgraph.model;

/**
 * Directed, typed edge between two existing nodes.
 *
 * @param sourceId     origin node id
 * @param targetId     destination node id
 * @param relationType edge type
 * @param confidence   0.0 – 1.0
 */
public record MemoryEdge(
        String       sourceId,
        String       targetId,
        RelationType relationType,
        double       confidence
) {

    public static MemoryEdge of(String sourceId, String targetId, RelationType type) {
        return new MemoryEdge(sourceId, targetId, type, 1.0);
    }
}
