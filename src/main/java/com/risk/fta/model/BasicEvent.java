package com.risk.fta.model;

import com.risk.fta.api.EventKind;
import com.risk.fta.expression.Expression;

/**
 * A leaf failure event. Its probability is supplied by an expression owned by
 * the analysis model; the event only references it. An event declared
 * without an expression can take part in cut set generation, but not in
 * probability analysis.
 */
public final class BasicEvent extends AbstractEvent {
    private final Expression expression;

    public BasicEvent(String name) {
        this(name, null);
    }

    public BasicEvent(String name, Expression expression) {
        super(name);
        this.expression = expression;
    }

    @Override
    public EventKind kind() {
        return EventKind.BASIC;
    }

    public boolean hasExpression() {
        return expression != null;
    }

    public Expression expression() {
        if (expression == null)
            throw new IllegalStateException("Basic event '" + name() + "' has no probability");
        return expression;
    }

    /** Best-estimate probability. */
    public double probability() {
        return expression().mean();
    }
}
