package com.risk.fta.model;

import com.risk.fta.api.EventKind;

/**
 * A leaf event fixed to a known state. House events switch parts of the tree
 * on or off and are folded into the logic during cut set generation.
 */
public final class HouseEvent extends AbstractEvent {
    private final boolean state;

    public HouseEvent(String name, boolean state) {
        super(name);
        this.state = state;
    }

    @Override
    public EventKind kind() {
        return EventKind.HOUSE;
    }

    public boolean state() {
        return state;
    }
}
