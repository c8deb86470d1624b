package com.openforge.memgraph.retrieve;

/**
 * OK           — every attempted stage succeeded and something matched.
 * NO_MATCHES   — every attempted stage succeeded and nothing matched.
 * DEGRADED     — at least one stage failed; results come from the rest and may be incomplete.
 * UNAVAILABLE  — every attempted stage failed; results are empty because the store could not be read.
 */
public enum RetrievalStatus {
    OK,
    NO_MATCHES,
    DEGRADED,
    UNAVAILABLE
}
