package com.risk.fta.expression;

/**
 * Periodically tested component with three phases: deployment until the first
 * test, then alternating test intervals of fixed length, with the component
 * functioning in between.
 *
 * Tests are instantaneous and always successful. A failure stays undetected
 * until the next test. Two repair models are supported; the model is fixed by
 * the constructor used and never changes afterwards:
 * <ul>
 * <li>{@link RepairModel#INSTANT}: a failed component found by a test is
 * restored immediately.</li>
 * <li>{@link RepairModel#FINITE}: a failed component found by a test is repaired
 * with an hourly repair rate and can fail again once repaired.</li>
 * </ul>
 *
 * Finite repair math:
 * With {@code q} the unavailability right at a test and {@code s} the time
 * since that test, availability is
 * {@code W(q, s) = (1 - q) * exp(-lambda * s) + q * g(s)} where
 * {@code g(s) = mu / (lambda - mu) * (exp(-mu * s) - exp(-lambda * s))}
 * ({@code mu * s * exp(-lambda * s)} when the rates are equal).
 * The unavailability at consecutive tests follows the linear recurrence
 * {@code q' = a + b * q} with {@code a = 1 - exp(-lambda * tau)} and
 * {@code b = exp(-lambda * tau) - g(tau)}, solved in closed form.
 *
 * Bounds are the full probability range.
 */
public final class PeriodicTestExpression extends Expression {

    /** How repairs after a detected failure are modeled. */
    public enum RepairModel {
        INSTANT,
        FINITE
    }

    private final RepairModel repairModel;
    private final Expression lambda;
    private final Expression mu;
    private final Expression tau;
    private final Expression theta;
    private final Expression time;

    /**
     * Periodic test with instantaneous repairs.
     *
     * @param lambda Hourly failure rate while functioning.
     * @param tau    Hours between tests.
     * @param theta  Hours before the first test.
     * @param time   Mission time in hours.
     */
    public PeriodicTestExpression(Expression lambda, Expression tau, Expression theta, Expression time) {
        super(lambda, tau, theta, time);
        this.repairModel = RepairModel.INSTANT;
        this.lambda = lambda;
        this.mu = null;
        this.tau = tau;
        this.theta = theta;
        this.time = time;
    }

    /**
     * Periodic test with a finite repair rate.
     *
     * @param lambda Hourly failure rate while functioning.
     * @param mu     Hourly repair rate.
     * @param tau    Hours between tests.
     * @param theta  Hours before the first test.
     * @param time   Mission time in hours.
     */
    public PeriodicTestExpression(Expression lambda, Expression mu, Expression tau, Expression theta,
            Expression time) {
        super(lambda, mu, tau, theta, time);
        this.repairModel = RepairModel.FINITE;
        this.lambda = lambda;
        this.mu = mu;
        this.tau = tau;
        this.theta = theta;
        this.time = time;
    }

    public RepairModel repairModel() {
        return repairModel;
    }

    @Override
    void check() {
        ensurePositive(lambda, "rate of failure");
        ensurePositive(tau, "time between tests");
        ensureNonNegative(theta, "time before the first test");
        ensureNonNegative(time, "mission time");
        if (repairModel == RepairModel.FINITE)
            ensureNonNegative(mu, "rate of repair");
    }

    @Override
    public double mean() {
        return switch (repairModel) {
            case INSTANT -> instantRepair(lambda.mean(), tau.mean(), theta.mean(), time.mean());
            case FINITE -> finiteRepair(lambda.mean(), mu.mean(), tau.mean(), theta.mean(), time.mean());
        };
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
        return switch (repairModel) {
            case INSTANT -> instantRepair(lambda.sample(context), tau.sample(context), theta.sample(context),
                    time.sample(context));
            case FINITE -> finiteRepair(lambda.sample(context), mu.sample(context), tau.sample(context),
                    theta.sample(context), time.sample(context));
        };
    }

    static double instantRepair(double lambda, double tau, double theta, double time) {
        if (time <= theta)
            return 1 - Math.exp(-lambda * time);
        double delta = time - theta;
        double sinceTest = delta - Math.floor(delta / tau) * tau;
        return 1 - Math.exp(-lambda * sinceTest);
    }

    static double finiteRepair(double lambda, double mu, double tau, double theta, double time) {
        if (time <= theta)
            return 1 - Math.exp(-lambda * time);
        double delta = time - theta;
        double intervals = Math.floor(delta / tau);
        double sinceTest = delta - intervals * tau;

        double first = 1 - Math.exp(-lambda * theta);
        double a = 1 - Math.exp(-lambda * tau);
        double b = Math.exp(-lambda * tau) - repaired(lambda, mu, tau);
        double fixedPoint = a / (1 - b);
        double atLastTest = fixedPoint + Math.pow(b, intervals) * (first - fixedPoint);

        double available = (1 - atLastTest) * Math.exp(-lambda * sinceTest)
                + atLastTest * repaired(lambda, mu, sinceTest);
        return 1 - available;
    }

    /** Probability that a component under repair at s = 0 is repaired and still working at s. */
    private static double repaired(double lambda, double mu, double s) {
        if (mu == 0)
            return 0;
        if (lambda == mu)
            return mu * s * Math.exp(-lambda * s);
        return mu / (lambda - mu) * (Math.exp(-mu * s) - Math.exp(-lambda * s));
    }
}
