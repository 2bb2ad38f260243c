package com.risk.fta.expression;

import com.risk.fta.api.InvalidArgumentException;

/**
 * Log-normal distribution described by its mean and its error factor at the
 * 95% confidence level, the usual way failure rate uncertainty is quoted.
 * <p>
 * {@code sigma = ln(ef) / z95}, {@code mu = ln(mean) - sigma^2 / 2}.
 * <p>
 * The upper bound is the 99.95th percentile.
 */
public final class LogNormalDeviate extends Expression {
    private static final double Z_95 = 1.6448536269514722;
    private static final double Z_9995 = 3.2905267314919255;

    private final Expression mean;
    private final Expression errorFactor;

    public LogNormalDeviate(Expression mean, Expression errorFactor) {
        super(mean, errorFactor);
        this.mean = mean;
        this.errorFactor = errorFactor;
    }

    @Override
    void check() {
        ensurePositive(mean, "mean of log-normal distribution");
        if (errorFactor.mean() <= 1)
            throw new InvalidArgumentException(
                    "The error factor of log-normal distribution must be greater than 1, got "
                            + errorFactor.mean());
    }

    @Override
    public double mean() {
        return mean.mean();
    }

    @Override
    public double min() {
        return 0;
    }

    @Override
    public double max() {
        double sigma = sigma(errorFactor.max());
        return Math.exp(mu(mean.max(), sigma) + Z_9995 * sigma);
    }

    @Override
    public boolean isDeviate() {
        return true;
    }

    @Override
    double doSample(SampleContext context) {
        double sigma = sigma(errorFactor.sample(context));
        return Math.exp(mu(mean.sample(context), sigma) + sigma * context.random().nextGaussian());
    }

    private static double sigma(double errorFactor) {
        return Math.log(errorFactor) / Z_95;
    }

    private static double mu(double mean, double sigma) {
        return Math.log(mean) - sigma * sigma / 2;
    }
}
