package com.risk.fta.api;

/**
 * Thrown when an expression parameter is outside its legal domain, e.g. a
 * negative failure rate or mission time.
 *
 * Raised lazily at evaluation time because parameters may themselves be
 * expressions.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
