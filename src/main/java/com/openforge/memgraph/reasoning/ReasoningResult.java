package com.openforge.memgraph.reasoning;

import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;

import java.util.List;

/**
 * Everything one ProcessNode run wrote to the store.
 *
 * @param relations      CAUSES / RELATED_TO edges between the anchor and its neighbours
 * @param inferredNodes  nodes synthesized from causal chains
 * @param sequenceLinks  FOLLOWS edges, always earlier → later
 * @param aggregateNodes cluster summaries, each listing at least two member sources
 * @param failures       pairs, chains, clusters or writes that were dropped
 */
public record ReasoningResult(
        List<MemoryEdge> relations,
        List<MemoryNode> inferredNodes,
        List<MemoryEdge> sequenceLinks,
        List<MemoryNode> aggregateNodes,
        int              failures
) {

    public ReasoningResult {
        relations      = List.copyOf(relations);
        inferredNodes  = List.copyOf(inferredNodes);
        sequenceLinks  = List.copyOf(sequenceLinks);
        aggregateNodes = List.copyOf(aggregateNodes);
    }

    public static ReasoningResult empty() {
        return new ReasoningResult(List.of(), List.of(), List.of(), List.of(), 0);
    }
}
