package com.risk.fta.api;

/** Thrown when an id is defined twice. */
public class DuplicateDefinitionException extends ValidationException {
    private final String eventId;

    public DuplicateDefinitionException(String eventId, String message) {
        super(message);
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }
}
