package com.risk.fta.api;

/**
 * Tag identifying the variant of an {@link Event}.
 *
 * Events are dispatched on this tag instead of runtime type inspection.
 */
public enum EventKind {
    /** Logical combinator over child events. */
    GATE,
    /** Leaf failure event with a probability expression. */
    BASIC,
    /** Leaf event fixed to a known boolean state. */
    HOUSE
}
