package com.risk.fta.engine;

/** How the union of cut set probabilities is computed. */
public enum Approximation {
    /** Inclusion-exclusion, exact unless truncated by the term budget. */
    NONE,
    /** Sum of cut set probabilities; ignores all overlaps. */
    RARE_EVENT,
    /** Min cut upper bound: {@code 1 - prod(1 - P(cs))}. */
    MCUB
}
