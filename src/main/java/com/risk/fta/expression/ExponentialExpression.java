package com.risk.fta.expression;

/**
 * Negative exponential failure model with an hourly failure rate and a mission
 * time.
 * <p>
 * Formula: {@code p = 1 - exp(-lambda * t)}
 * <p>
 * The value grows with both arguments, so the lower bound uses both lower
 * bounds and the upper bound both upper bounds.
 */
public final class ExponentialExpression extends Expression {
    private final Expression lambda;
    private final Expression time;

    /**
     * @param lambda Hourly rate of failure.
     * @param time   Mission time in hours.
     */
    public ExponentialExpression(Expression lambda, Expression time) {
        super(lambda, time);
        this.lambda = lambda;
        this.time = time;
    }

    @Override
    void check() {
        ensureNonNegative(lambda, "rate of failure");
        ensureNonNegative(time, "mission time");
    }

    @Override
    public double mean() {
        return compute(lambda.mean(), time.mean());
    }

    @Override
    public double min() {
        return compute(lambda.min(), time.min());
    }

    @Override
    public double max() {
        return compute(lambda.max(), time.max());
    }

    @Override
    double doSample(SampleContext context) {
        return compute(lambda.sample(context), time.sample(context));
    }

    private static double compute(double lambda, double time) {
        return 1 - Math.exp(-(lambda * time));
    }
}
