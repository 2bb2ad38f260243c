package com.risk.fta.engine;

import java.util.BitSet;

/**
 * Mutable accumulator for one AND-branch under construction during cut set
 * generation: the basic events collected so far plus the folded state of the
 * house events met on the branch.
 *
 * A superset with no events and not nulled is the unity set: the branch is
 * always true. A nulled superset can never occur (it met a house event fixed
 * to false under AND) and is dropped by the generator.
 */
public final class Superset {
    private final BitSet events;
    private boolean nulled;

    public Superset() {
        this.events = new BitSet();
    }

    private Superset(BitSet events, boolean nulled) {
        this.events = events;
        this.nulled = nulled;
    }

    /** A superset holding one basic event. */
    public static Superset of(int basicEvent) {
        Superset set = new Superset();
        set.insert(basicEvent);
        return set;
    }

    public Superset copy() {
        return new Superset((BitSet) events.clone(), nulled);
    }

    public void insert(int basicEvent) {
        events.set(basicEvent);
    }

    /** AND-joins another branch into this one. */
    public void unite(Superset other) {
        events.or(other.events);
        nulled |= other.nulled;
    }

    /** Folds a house event met under AND. */
    public void foldHouse(boolean state) {
        if (!state)
            nulled = true;
    }

    public boolean isNull() {
        return nulled;
    }

    public int order() {
        return events.cardinality();
    }

    /** Returns true if every event of this set is also in the other set. */
    public boolean isSubsetOf(Superset other) {
        BitSet rest = (BitSet) events.clone();
        rest.andNot(other.events);
        return rest.isEmpty();
    }

    /** Member basic event indices in increasing order. */
    public int[] toArray() {
        return events.stream().toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Superset other))
            return false;
        return nulled == other.nulled && events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return events.hashCode() * 31 + (nulled ? 1 : 0);
    }

    @Override
    public String toString() {
        return (nulled ? "null" : "") + events;
    }
}
