package com.risk.fta.expression;

/**
 * Static factories for the common expression shapes.
 */
public final class Expressions {

    private Expressions() {
        // Utility class
    }

    public static Expression constant(double value) {
        if (value == 0)
            return ConstantExpression.ZERO;
        if (value == 1)
            return ConstantExpression.ONE;
        return new ConstantExpression(value);
    }

    /** {@code 1 - exp(-lambda * time)} with literal arguments. */
    public static Expression exponential(double lambda, double time) {
        return new ExponentialExpression(constant(lambda), constant(time));
    }

    /** Weibull with literal arguments. */
    public static Expression weibull(double alpha, double beta, double t0, double time) {
        return new WeibullExpression(constant(alpha), constant(beta), constant(t0), constant(time));
    }

    /** GLM with literal arguments. */
    public static Expression glm(double gamma, double lambda, double mu, double time) {
        return new GlmExpression(constant(gamma), constant(lambda), constant(mu), constant(time));
    }

    public static Expression uniform(double min, double max) {
        return new UniformDeviate(constant(min), constant(max));
    }

    public static Expression normal(double mean, double sigma) {
        return new NormalDeviate(constant(mean), constant(sigma));
    }

    public static Expression logNormal(double mean, double errorFactor) {
        return new LogNormalDeviate(constant(mean), constant(errorFactor));
    }
}
