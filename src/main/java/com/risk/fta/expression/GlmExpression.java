package com.risk.fta.expression;

/**
 * Exponential model extended with a probability of failure on demand and a
 * repair rate (GLM).
 * <p>
 * Formula:
 * {@code p = (lambda - (lambda - gamma * (lambda + mu)) * exp(-(lambda + mu) * t)) / (lambda + mu)}
 * <p>
 * The formula is not monotonic in all arguments, so the bounds are the full
 * probability range.
 */
public final class GlmExpression extends Expression {
    private final Expression gamma;
    private final Expression lambda;
    private final Expression mu;
    private final Expression time;

    /**
     * @param gamma  Probability of failure on demand.
     * @param lambda Hourly rate of failure.
     * @param mu     Hourly rate of repair.
     * @param time   Mission time in hours.
     */
    public GlmExpression(Expression gamma, Expression lambda, Expression mu, Expression time) {
        super(gamma, lambda, mu, time);
        this.gamma = gamma;
        this.lambda = lambda;
        this.mu = mu;
        this.time = time;
    }

    @Override
    void check() {
        ensureProbability(gamma, "probability of failure on demand");
        ensurePositive(lambda, "rate of failure");
        ensureNonNegative(mu, "rate of repair");
        ensureNonNegative(time, "mission time");
    }

    @Override
    public double mean() {
        return compute(gamma.mean(), lambda.mean(), mu.mean(), time.mean());
    }

    @Override
    public double min() {
        return 0;
    }

    @Override
    public double max() {
        return 1;
    }

    @Override
    double doSample(SampleContext context) {
        return compute(gamma.sample(context), lambda.sample(context), mu.sample(context), time.sample(context));
    }

    private static double compute(double gamma, double lambda, double mu, double time) {
        double r = lambda + mu;
        return (lambda - (lambda - gamma * r) * Math.exp(-r * time)) / r;
    }
}
