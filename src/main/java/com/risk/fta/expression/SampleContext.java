package com.risk.fta.expression;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Per-trial sampling state.
 *
 * Holds the random source and a memo of values already drawn in the current
 * trial, so that an expression shared by several parents yields one consistent
 * value per trial. A context is confined to one thread; parallel simulations
 * create one context per worker and call {@link #reset()} between trials.
 */
public final class SampleContext {
    private final Random random;
    private final Map<Expression, Double> drawn = new IdentityHashMap<>();

    public SampleContext(Random random) {
        this.random = random;
    }

    public Random random() {
        return random;
    }

    /** Forgets all values drawn so far. Call before each new trial. */
    public void reset() {
        drawn.clear();
    }

    double sample(Expression expression) {
        Double value = drawn.get(expression);
        if (value == null) {
            value = expression.doSample(this);
            drawn.put(expression, value);
        }
        return value;
    }
}
