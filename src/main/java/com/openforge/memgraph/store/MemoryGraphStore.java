package com.openforge.memgraph.store;

import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.MemoryType;
import com.openforge.memgraph.model.RelationType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Narrow view of the physical graph/vector storage engine. Every operation is
 * scoped to one tenant namespace; implementations must be safe for concurrent use.
 *
 * Writes enforce {@link MemoryInvariants} and throw
 * {@link com.openforge.memgraph.error.InvariantViolationException} before touching state.
 */
public interface MemoryGraphStore {

    void addNode(MemoryNode node, String namespace);

    /** Replaces an existing node (status transitions, provenance merges). */
    void updateNode(MemoryNode node, String namespace);

    Optional<MemoryNode> getNode(String id, String namespace);

    /** Removes the node and every edge touching it. */
    void deleteNode(String id, String namespace);

    void addEdge(MemoryEdge edge, String namespace);

    /** Edges leaving {@code nodeId} whose type is in {@code relationTypes}. */
    List<MemoryEdge> outgoingEdges(String nodeId, Set<RelationType> relationTypes, String namespace);

    /** Nearest nodes of type {@code scope}, best first, with cosine-like scores. */
    List<StoreHit> vectorSearch(List<Float> embedding, String namespace, MemoryType scope, int k);

    /** Nodes of type {@code scope} whose key, tags or text contain any of {@code terms} (case-insensitive). */
    List<MemoryNode> keywordSearch(Collection<String> terms, String namespace, MemoryType scope);

    /**
     * Nodes reachable from {@code nodeId} within {@code depth} hops over edges of the given
     * types, followed in either direction. The start node is not included.
     */
    List<MemoryNode> traverse(String nodeId, Set<RelationType> relationTypes, int depth, String namespace);
}
