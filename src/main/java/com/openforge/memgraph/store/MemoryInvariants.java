package com.openforge.memgraph.store;

import com.openforge.memgraph.error.InvariantViolationException;
import com.openforge.memgraph.model.MemoryEdge;
import com.openforge.memgraph.model.MemoryNode;
import com.openforge.memgraph.model.NodeStatus;
import com.openforge.memgraph.model.SourceRef;

/**
 * Write-time checks shared by every store backend. All methods throw
 * {@link InvariantViolationException} and never mutate anything.
 */
public final class MemoryInvariants {

    /** Longest node text, in chars, that every backend stores without cutting it. */
    public static final int MAX_TEXT_LENGTH = 4000;

    private MemoryInvariants() {}

    public static void checkNode(MemoryNode node, int dimension) {
        if (node.id() == null || node.id().isBlank()) {
            throw new InvariantViolationException("Node id must not be blank");
        }
        if (node.text() == null || node.text().isBlank()) {
            throw new InvariantViolationException("Node %s has blank text".formatted(node.id()));
        }
        if (node.text().length() > MAX_TEXT_LENGTH) {
            throw new InvariantViolationException("Node %s text has %d chars, limit is %d"
                    .formatted(node.id(), node.text().length(), MAX_TEXT_LENGTH));
        }
        if (node.embedding() == null || node.embedding().size() != dimension) {
            throw new InvariantViolationException("Node %s embedding length %s != namespace dimension %d"
                    .formatted(node.id(), node.embedding() == null ? "null" : node.embedding().size(), dimension));
        }
        if (node.confidence() < 0 || node.confidence() > 1) {
            throw new InvariantViolationException("Node %s confidence %.3f outside [0, 1]"
                    .formatted(node.id(), node.confidence()));
        }
        if (node.status() == NodeStatus.MERGED && node.successorId().isEmpty()) {
            throw new InvariantViolationException("MERGED node %s has no successor source".formatted(node.id()));
        }
    }

    /**
     * @param source resolved source endpoint, null when absent
     * @param target resolved target endpoint, null when absent
     */
    public static void checkEdge(MemoryEdge edge, MemoryNode source, MemoryNode target) {
        if (source == null || target == null) {
            throw new InvariantViolationException("Edge %s -%s-> %s references a missing endpoint"
                    .formatted(edge.sourceId(), edge.relationType(), edge.targetId()));
        }
        if (edge.sourceId().equals(edge.targetId())) {
            throw new InvariantViolationException("Self-loop on node %s".formatted(edge.sourceId()));
        }
        switch (edge.relationType()) {
            case FOLLOWS -> {
                if (source.updatedAt() == null || target.updatedAt() == null
                        || !source.updatedAt().isBefore(target.updatedAt())) {
                    throw new InvariantViolationException("FOLLOWS edge %s -> %s is not strictly time-ordered"
                            .formatted(edge.sourceId(), edge.targetId()));
                }
            }
            case AGGREGATES -> {
                long members = source.sources().stream()
                        .filter(s -> s.kind() == SourceRef.Kind.NODE)
                        .count();
                boolean listed = source.sources().stream()
                        .anyMatch(s -> s.kind() == SourceRef.Kind.NODE && edge.targetId().equals(s.nodeId()));
                if (members < 2 || !listed) {
                    throw new InvariantViolationException("AGGREGATES edge %s -> %s: aggregate must list >= 2 sources including the target"
                            .formatted(edge.sourceId(), edge.targetId()));
                }
            }
            default -> { }
        }
    }
}
