package com.risk.fta.expression;

/** A literal value. */
public final class ConstantExpression extends Expression {
    public static final ConstantExpression ZERO = new ConstantExpression(0);
    public static final ConstantExpression ONE = new ConstantExpression(1);

    private final double value;

    public ConstantExpression(double value) {
        this.value = value;
    }

    @Override
    public double mean() {
        return value;
    }

    @Override
    double doSample(SampleContext context) {
        return value;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
