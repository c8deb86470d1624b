package com.openforge.memgraph.model;

/**
 * Typed edge between two memory nodes.
 *
 * CAUSES       — source is a cause of target.
 * FOLLOWS      — target happened after source (source.updatedAt &lt; target.updatedAt).
 * RELATED_TO   — topical association without direction semantics.
 * AGGREGATES   — source is an aggregate node summarising target.
 * CONTRADICTS  — source was written while conflicting with target.
 */
public enum RelationType {
    CAUSES,
    FOLLOWS,
    RELATED_TO,
    AGGREGATES,
    CONTRADICTS
}
