package com.risk.fta.api;

/**
 * Thrown when a gate is added to a tree before any of its parents is known to
 * that tree.
 */
public class DanglingGateException extends ValidationException {
    private final String gateId;

    public DanglingGateException(String gateId, String message) {
        super(message);
        this.gateId = gateId;
    }

    public String gateId() {
        return gateId;
    }
}
