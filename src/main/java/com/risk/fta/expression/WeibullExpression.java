package com.risk.fta.expression;

/**
 * Weibull failure model with scale, shape and time shift.
 * <p>
 * Formula: {@code p = 1 - exp(-((t - t0) / alpha) ^ beta)} for {@code t > t0},
 * and {@code 0} before the shift.
 * <p>
 * The value shrinks with the scale and the time shift and grows with the
 * shape and the mission time; bounds pick the opposite extremum for the
 * decreasing arguments.
 */
public final class WeibullExpression extends Expression {
    private final Expression alpha;
    private final Expression beta;
    private final Expression t0;
    private final Expression time;

    /**
     * @param alpha Scale parameter.
     * @param beta  Shape parameter.
     * @param t0    Time shift in hours.
     * @param time  Mission time in hours.
     */
    public WeibullExpression(Expression alpha, Expression beta, Expression t0, Expression time) {
        super(alpha, beta, t0, time);
        this.alpha = alpha;
        this.beta = beta;
        this.t0 = t0;
        this.time = time;
    }

    @Override
    void check() {
        ensurePositive(alpha, "scale parameter for Weibull distribution");
        ensurePositive(beta, "shape parameter for Weibull distribution");
        ensureNonNegative(t0, "time shift");
        ensureNonNegative(time, "mission time");
    }

    @Override
    public double mean() {
        return compute(alpha.mean(), beta.mean(), t0.mean(), time.mean());
    }

    @Override
    public double min() {
        return compute(alpha.max(), beta.min(), t0.max(), time.min());
    }

    @Override
    public double max() {
        return compute(alpha.min(), beta.max(), t0.min(), time.max());
    }

    @Override
    double doSample(SampleContext context) {
        return compute(alpha.sample(context), beta.sample(context), t0.sample(context), time.sample(context));
    }

    private static double compute(double alpha, double beta, double t0, double time) {
        if (time <= t0)
            return 0;
        return 1 - Math.exp(-Math.pow((time - t0) / alpha, beta));
    }
}
