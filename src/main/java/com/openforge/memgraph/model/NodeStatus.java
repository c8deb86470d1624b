package com.openforge.memgraph.model;

/**
 * Nodes are never deleted by the core. Superseded facts move to MERGED
 * (with a successor source reference) or ARCHIVED.
 */
public enum NodeStatus {
    ACTIVATED,
    ARCHIVED,
    MERGED
}
