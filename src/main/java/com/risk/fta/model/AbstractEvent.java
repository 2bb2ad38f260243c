package com.risk.fta.model;

import com.risk.fta.api.Event;

import java.util.Locale;
import java.util.Objects;

/**
 * Base class holding the identity shared by all events.
 */
public abstract class AbstractEvent implements Event {
    private final String id;
    private final String name;

    protected AbstractEvent(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank())
            throw new IllegalArgumentException("Event name cannot be blank");
        this.name = name;
        this.id = toId(name);
    }

    /** Normalizes a declared name into an id. */
    public static String toId(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public String toString() {
        return kind() + "(" + name + ")";
    }
}
