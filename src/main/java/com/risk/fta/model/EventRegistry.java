package com.risk.fta.model;

import com.risk.fta.api.DuplicateDefinitionException;
import com.risk.fta.api.Event;
import com.risk.fta.api.EventKind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Arena of all declared events addressed by id.
 *
 * The registry owns nothing but the id to event mapping. Gates keep forward
 * child lists; the parent index is derived on demand by one pass over those
 * lists and dropped whenever a new event is declared.
 */
public final class EventRegistry {
    private final Map<String, Event> events = new LinkedHashMap<>();
    private Map<String, Set<String>> parentIndex;

    /**
     * Declares an event.
     *
     * @throws DuplicateDefinitionException if the id is already taken.
     */
    public EventRegistry add(Event event) {
        if (events.containsKey(event.id()))
            throw new DuplicateDefinitionException(event.id(),
                    "Trying to doubly define '" + event.name() + "'");
        events.put(event.id(), event);
        parentIndex = null;
        return this;
    }

    public boolean contains(String id) {
        return events.containsKey(AbstractEvent.toId(id));
    }

    /** Returns the event with the id, or null. */
    public Event get(String id) {
        return events.get(AbstractEvent.toId(id));
    }

    /** Returns the gate with the id, or null if absent or not a gate. */
    public Gate gate(String id) {
        Event e = get(id);
        return e != null && e.kind() == EventKind.GATE ? (Gate) e : null;
    }

    /** Returns the basic event with the id, or null if absent or not basic. */
    public BasicEvent basicEvent(String id) {
        Event e = get(id);
        return e != null && e.kind() == EventKind.BASIC ? (BasicEvent) e : null;
    }

    /** Returns the house event with the id, or null if absent or not a house event. */
    public HouseEvent houseEvent(String id) {
        Event e = get(id);
        return e != null && e.kind() == EventKind.HOUSE ? (HouseEvent) e : null;
    }

    public Collection<Event> events() {
        return Collections.unmodifiableCollection(events.values());
    }

    public int size() {
        return events.size();
    }

    /**
     * Returns the ids of all declared gates listing the id as a child, in
     * declaration order.
     */
    public Set<String> parentsOf(String id) {
        if (parentIndex == null)
            parentIndex = buildParentIndex();
        return parentIndex.getOrDefault(AbstractEvent.toId(id), Set.of());
    }

    private Map<String, Set<String>> buildParentIndex() {
        Map<String, Set<String>> index = new LinkedHashMap<>();
        for (Event e : events.values()) {
            if (e.kind() != EventKind.GATE)
                continue;
            for (String child : ((Gate) e).children())
                index.computeIfAbsent(child, k -> new LinkedHashSet<>()).add(e.id());
        }
        return index;
    }
}
