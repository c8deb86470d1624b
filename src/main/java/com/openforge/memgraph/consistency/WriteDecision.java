package com.openforge.memgraph.consistency;

public enum WriteDecision {
    /** Written as a new node. */
    COMMITTED,
    /** Not written; an existing node already states the same fact. */
    SKIPPED_DUPLICATE,
    /** Written, and linked by a CONTRADICTS edge to the node it conflicts with. */
    FLAGGED,
    /** Not written; the check could not run and the policy is fail-closed. */
    REJECTED
}
