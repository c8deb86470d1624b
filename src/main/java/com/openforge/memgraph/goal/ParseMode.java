package com.openforge.memgraph.goal;

/**
 * FAST — one short prompt, terse output accepted (memories may be omitted).
 * FINE — longer constrained prompt; memories are required and a rephrased query may be returned.
 */
public enum ParseMode {
    FAST,
    FINE
}
