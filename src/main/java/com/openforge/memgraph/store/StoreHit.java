package com.openforge.memgraph.store;

import com.openforge.memgraph.model.MemoryNode;

/**
 * A vector search hit.
 *
 * @param node  the matched node
 * @param score similarity in [-1, 1]; 1 = identical direction
 */
public record StoreHit(MemoryNode node, double score) {}
