package com.openforge.memgraph.retrieve;

import com.openforge.memgraph.model.MemoryNode;

/**
 * @param node   the retrieved node
 * @param score  fused score used for ranking
 * @param origin which stage surfaced the node
 */
public record ScoredNode(MemoryNode node, double score, Origin origin) {

    public enum Origin { VECTOR, KEYWORD, HYBRID, GRAPH }
}
