package com.risk.fta.expression;

import com.risk.fta.api.InvalidArgumentException;

import java.util.List;

/**
 * A node of an expression tree supplying a numeric value to the analysis.
 *
 * Every expression can be evaluated four ways:
 * <ul>
 * <li>{@link #mean()}: the best (point) estimate.</li>
 * <li>{@link #min()} and {@link #max()}: interval bounds. A node derives its
 * bounds from its arguments' bounds according to whether its formula grows or
 * shrinks in each argument, not by taking every argument at the same
 * extremum.</li>
 * <li>{@link #sample(SampleContext)}: one stochastic draw.</li>
 * </ul>
 *
 * The set of expression variants is closed: the constructor is package-private,
 * so all implementations live in this package.
 *
 * Validation is deferred: arguments may themselves be expressions whose values
 * are only known once the whole model is assembled, so {@link #validate()} is
 * called by the analysis right before evaluation.
 */
public abstract class Expression {
    private final List<Expression> args;

    Expression(Expression... args) {
        this.args = List.of(args);
    }

    /** The argument expressions of this node, in declaration order. */
    public final List<Expression> args() {
        return args;
    }

    /**
     * Returns the best estimate of the value.
     */
    public abstract double mean();

    /**
     * Returns the lower bound of the value.
     */
    public double min() {
        return mean();
    }

    /**
     * Returns the upper bound of the value.
     */
    public double max() {
        return mean();
    }

    /**
     * Draws one value. Within a single context, an expression shared by
     * several parents is sampled once and the same value is returned to all of
     * them.
     *
     * @param context The per-trial sampling context.
     * @return The sampled value.
     */
    public final double sample(SampleContext context) {
        return context.sample(this);
    }

    /** Computes a fresh sample. Called by {@link SampleContext} at most once per trial. */
    abstract double doSample(SampleContext context);

    /**
     * Validates this expression and all of its arguments.
     *
     * @throws InvalidArgumentException if a parameter is outside its domain.
     */
    public final void validate() {
        for (Expression arg : args)
            arg.validate();
        check();
    }

    /** Checks the domain of this node's own parameters. */
    void check() {
    }

    /** Returns true if this node draws random values when sampled. */
    public boolean isDeviate() {
        return false;
    }

    /** Returns true if this node or any of its arguments is a deviate. */
    public final boolean hasDeviates() {
        if (isDeviate())
            return true;
        for (Expression arg : args) {
            if (arg.hasDeviates())
                return true;
        }
        return false;
    }

    static void ensurePositive(Expression arg, String description) {
        if (arg.mean() <= 0)
            throw new InvalidArgumentException("The " + description + " must be positive, got " + arg.mean());
    }

    static void ensureNonNegative(Expression arg, String description) {
        if (arg.mean() < 0)
            throw new InvalidArgumentException("The " + description + " cannot be negative, got " + arg.mean());
    }

    static void ensureProbability(Expression arg, String description) {
        double p = arg.mean();
        if (p < 0 || p > 1)
            throw new InvalidArgumentException("The " + description + " must be a probability in [0, 1], got " + p);
    }
}
