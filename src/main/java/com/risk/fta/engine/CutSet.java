package com.risk.fta.engine;

import java.util.List;

/**
 * An immutable minimal cut set: basic event ids in ascending id order,
 * together with their indices in the {@link TreeTopology}.
 */
public final class CutSet {
    private final List<String> events;
    private final int[] indices;

    CutSet(List<String> events, int[] indices) {
        this.events = List.copyOf(events);
        this.indices = indices.clone();
    }

    /** Basic event ids, sorted. */
    public List<String> events() {
        return events;
    }

    /** Basic event indices in the topology, in increasing order. */
    public int[] indices() {
        return indices.clone();
    }

    int[] indicesView() {
        return indices;
    }

    public int order() {
        return events.size();
    }

    public boolean contains(String eventId) {
        return events.contains(eventId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        return o instanceof CutSet other && events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return events.hashCode();
    }

    @Override
    public String toString() {
        return "{" + String.join(", ", events) + "}";
    }
}
