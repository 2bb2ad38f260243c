package com.risk.fta.api;

/**
 * Base class for structural errors detected while building or validating a
 * fault tree. A tree that failed validation must not be analyzed.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
