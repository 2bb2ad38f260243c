package com.risk.fta.expression;

/**
 * A named expression that can be shared between several basic events, e.g. a
 * common mission time or a failure rate with a single uncertainty
 * distribution. Sampling a shared parameter yields one value per trial for all
 * of its users.
 */
public final class Parameter extends Expression {
    private final String name;
    private final Expression expression;

    public Parameter(String name, Expression expression) {
        super(expression);
        this.name = name;
        this.expression = expression;
    }

    public String name() {
        return name;
    }

    @Override
    public double mean() {
        return expression.mean();
    }

    @Override
    public double min() {
        return expression.min();
    }

    @Override
    public double max() {
        return expression.max();
    }

    @Override
    double doSample(SampleContext context) {
        return expression.sample(context);
    }

    @Override
    public String toString() {
        return name;
    }
}
