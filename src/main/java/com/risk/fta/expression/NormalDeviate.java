package com.risk.fta.expression;

/**
 * Normal distribution with a mean and a standard deviation.
 * Bounds are six standard deviations around the mean.
 */
public final class NormalDeviate extends Expression {
    private static final double SIGMAS = 6;

    private final Expression mean;
    private final Expression sigma;

    public NormalDeviate(Expression mean, Expression sigma) {
        super(mean, sigma);
        this.mean = mean;
        this.sigma = sigma;
    }

    @Override
    void check() {
        ensurePositive(sigma, "standard deviation");
    }

    @Override
    public double mean() {
        return mean.mean();
    }

    @Override
    public double min() {
        return mean.min() - SIGMAS * sigma.max();
    }

    @Override
    public double max() {
        return mean.max() + SIGMAS * sigma.max();
    }

    @Override
    public boolean isDeviate() {
        return true;
    }

    @Override
    double doSample(SampleContext context) {
        return mean.sample(context) + sigma.sample(context) * context.random().nextGaussian();
    }
}
