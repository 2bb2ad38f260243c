package com.risk.fta.api;

/** Thrown when a gate references a child that was never declared. */
public class UndefinedNodeException extends ValidationException {
    private final String eventId;

    public UndefinedNodeException(String eventId, String message) {
        super(message);
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }
}
