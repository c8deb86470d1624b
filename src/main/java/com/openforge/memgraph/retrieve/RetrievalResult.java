package com.openforge.memgraph.retrieve;

import com.openforge.memgraph.model.MemoryNode;

import java.util.List;

/**
 * Ranked retrieval output plus enough status for callers to tell
 * "nothing matched" apart from "the store could not be read".
 *
 * @param hits         ranked best first
 * @param status       outcome classification
 * @param failedStages names of stages that failed ("vector", "keyword", "graph", "hint-embedding")
 */
public record RetrievalResult(
        List<ScoredNode> hits,
        RetrievalStatus  status,
        List<String>     failedStages
) {

    public RetrievalResult {
        hits         = List.copyOf(hits);
        failedStages = List.copyOf(failedStages);
    }

    public static RetrievalResult unavailable(List<String> failedStages) {
        return new RetrievalResult(List.of(), RetrievalStatus.UNAVAILABLE, failedStages);
    }

    public List<MemoryNode> nodes() {
        return hits.stream().map(ScoredNode::node).toList();
    }

    public boolean isDegraded() {
        return status == RetrievalStatus.DEGRADED || status == RetrievalStatus.UNAVAILABLE;
    }
}
