package com.risk.fta.io;

import java.util.Locale;

/**
 * Expression kinds accepted in declarations, with their argument counts.
 */
public enum ExpressionType {
    CONSTANT(0),
    PARAMETER(0),
    /** lambda, time */
    EXPONENTIAL(2),
    /** gamma, lambda, mu, time */
    GLM(4),
    /** alpha, beta, t0, time */
    WEIBULL(4),
    /** lambda, tau, theta, time; or lambda, mu, tau, theta, time */
    PERIODIC_TEST(4),
    /** min, max */
    UNIFORM(2),
    /** mean, sigma */
    NORMAL(2),
    /** mean, error factor */
    LOGNORMAL(2);

    private final int arity;

    ExpressionType(int arity) {
        this.arity = arity;
    }

    /** Minimum number of arguments. */
    public int arity() {
        return arity;
    }

    /** Case-insensitive lookup; dashes are accepted for underscores. */
    public static ExpressionType fromString(String text) {
        if (text != null) {
            String normalized = text.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (ExpressionType t : values()) {
                if (t.name().equals(normalized))
                    return t;
            }
        }
        throw new IllegalArgumentException("Unknown expression type: " + text);
    }
}
