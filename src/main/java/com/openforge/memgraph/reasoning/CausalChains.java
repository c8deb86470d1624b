package com.openforge.memgraph.reasoning;

import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.RelationType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds simple paths of 2 or 3 CAUSES edges.
 */
final class CausalChains {

    static final int MIN_EDGES = 2;
    static final int MAX_EDGES = 3;

    private CausalChains() {}

    /**
     * @param nodeIds node ids in order along the chain
     * @param edges   the chain's edges, same order
     */
    record Chain(List<String> nodeIds, List<MemoryEdge> edges) {

        double confidence() {
            return edges.stream().mapToDouble(MemoryEdge::confidence).min().orElse(0.0);
        }

        boolean uses(Set<MemoryEdge> any) {
            return edges.stream().anyMatch(any::contains);
        }
    }

    /** Longest chains first; ties keep discovery order. */
    static List<Chain> find(Iterable<MemoryEdge> edges) {
        Map<String, List<MemoryEdge>> outgoing = new LinkedHashMap<>();
        for (MemoryEdge e : edges) {
            if (e.relationType() != RelationType.CAUSES) continue;
            outgoing.computeIfAbsent(e.sourceId(), k -> new ArrayList<>()).add(e);
        }
        List<Chain> chains = new ArrayList<>();
        for (String start : outgoing.keySet()) {
            LinkedHashSet<String> path = new LinkedHashSet<>();
            path.add(start);
            walk(start, path, new ArrayList<>(), outgoing, chains);
        }
        chains.sort(Comparator.comparingInt((Chain c) -> c.edges().size()).reversed());
        return chains;
    }

    private static void walk(String current, LinkedHashSet<String> path, List<MemoryEdge> used,
                             Map<String, List<MemoryEdge>> outgoing, List<Chain> out) {
        if (used.size() >= MIN_EDGES) {
            out.add(new Chain(List.copyOf(path), List.copyOf(used)));
        }
        if (used.size() == MAX_EDGES) return;
        for (MemoryEdge e : outgoing.getOrDefault(current, List.of())) {
            if (!path.add(e.targetId())) continue;
            used.add(e);
            walk(e.targetId(), path, used, outgoing, out);
            used.remove(used.size() - 1);
            path.remove(e.targetId());
        }
    }
}
