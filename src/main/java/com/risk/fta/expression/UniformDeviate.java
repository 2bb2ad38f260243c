package com.risk.fta.expression;

import com.risk.fta.api.InvalidArgumentException;

/** Uniform distribution over {@code [min, max)}. */
public final class UniformDeviate extends Expression {
    private final Expression lower;
    private final Expression upper;

    public UniformDeviate(Expression lower, Expression upper) {
        super(lower, upper);
        this.lower = lower;
        this.upper = upper;
    }

    @Override
    void check() {
        if (lower.mean() >= upper.mean())
            throw new InvalidArgumentException("Min value " + lower.mean()
                    + " must be less than max value " + upper.mean() + " for uniform distribution");
    }

    @Override
    public double mean() {
        return (lower.mean() + upper.mean()) / 2;
    }

    @Override
    public double min() {
        return lower.min();
    }

    @Override
    public double max() {
        return upper.max();
    }

    @Override
    public boolean isDeviate() {
        return true;
    }

    @Override
    double doSample(SampleContext context) {
        double a = lower.sample(context);
        double b = upper.sample(context);
        return a + (b - a) * context.random().nextDouble();
    }
}
