package com.risk.fta.engine;

import java.util.List;

/**
 * Minimal cut sets of a fault tree up to a limit order.
 *
 * @param cutSets    Minimal cut sets sorted by order, then by event ids.
 * @param limitOrder The order limit the generation ran with.
 * @param maxOrder   The largest order among the returned sets.
 * @param truncated  True if at least one candidate set was discarded for
 *                   exceeding the limit order, i.e. the collection is
 *                   "minimal cut sets up to order {@code limitOrder}" and may
 *                   be incomplete.
 */
public record CutSetResult(List<CutSet> cutSets, int limitOrder, int maxOrder, boolean truncated) {

    public CutSetResult {
        cutSets = List.copyOf(cutSets);
    }

    /** The top event always occurs: the only minimal cut set is empty. */
    public boolean isUnity() {
        return cutSets.size() == 1 && cutSets.get(0).order() == 0;
    }

    /** The top event can never occur. */
    public boolean isNull() {
        return cutSets.isEmpty();
    }

    public int size() {
        return cutSets.size();
    }
}
