package com.risk.fta.expression;

import com.risk.fta.api.InvalidArgumentException;
import org.junit.Test;

import java.util.Random;

import static com.risk.fta.expression.Expressions.constant;
import static org.junit.Assert.*;

public class ExpressionTest {

    private static final double EPS = 1e-12;

    @Test
    public void testExponential() {
        Expression e = Expressions.exponential(1e-3, 1000);
        e.validate();
        assertEquals(1 - Math.exp(-1), e.mean(), EPS);
        assertEquals(0, Expressions.exponential(0, 1000).mean(), EPS);
        assertEquals(0, Expressions.exponential(1e-3, 0).mean(), EPS);
    }

    @Test
    public void testExponentialBoundsFollowArguments() {
        Expression e = new ExponentialExpression(new UniformDeviate(constant(1e-4), constant(1e-3)), constant(100));
        assertEquals(1 - Math.exp(-1e-2), e.min(), EPS);
        assertEquals(1 - Math.exp(-1e-1), e.max(), EPS);
        assertTrue(e.hasDeviates());
        assertFalse(e.isDeviate());
    }

    @Test
    public void testExponentialRejectsNegativeArguments() {
        assertInvalid(Expressions.exponential(-1, 10));
        assertInvalid(Expressions.exponential(1, -10));
    }

    @Test
    public void testWeibull() {
        assertEquals(1 - Math.exp(-1), Expressions.weibull(100, 2, 0, 100).mean(), EPS);
        assertEquals(1 - Math.exp(-0.25), Expressions.weibull(100, 2, 50, 100).mean(), EPS);
        assertEquals(0, Expressions.weibull(100, 2, 100, 80).mean(), EPS);

        assertInvalid(Expressions.weibull(0, 2, 0, 10));
        assertInvalid(Expressions.weibull(1, 0, 0, 10));
        assertInvalid(Expressions.weibull(1, 1, -1, 10));
    }

    @Test
    public void testWeibullBoundsUseOpposingExtremes() {
        Expression alpha = new UniformDeviate(constant(50), constant(200));
        Expression e = new WeibullExpression(alpha, constant(1), constant(0), constant(100));
        assertEquals(1 - Math.exp(-0.5), e.min(), EPS);
        assertEquals(1 - Math.exp(-2), e.max(), EPS);
    }

    @Test
    public void testGlm() {
        double gamma = 0.1, lambda = 1e-3, mu = 1e-2, t = 100;
        double r = lambda + mu;
        double expected = (lambda - (lambda - gamma * r) * Math.exp(-r * t)) / r;
        Expression e = Expressions.glm(gamma, lambda, mu, t);
        e.validate();
        assertEquals(expected, e.mean(), EPS);
        assertEquals(gamma, Expressions.glm(gamma, lambda, mu, 0).mean(), EPS);
        assertEquals(0, e.min(), EPS);
        assertEquals(1, e.max(), EPS);

        assertInvalid(Expressions.glm(1.5, lambda, mu, t));
        assertInvalid(Expressions.glm(gamma, 0, mu, t));
        assertInvalid(Expressions.glm(gamma, lambda, -1, t));
    }

    @Test
    public void testPeriodicTestWithInstantRepair() {
        Expression e = new PeriodicTestExpression(constant(1e-3), constant(100), constant(50), constant(275));
        e.validate();
        assertEquals(PeriodicTestExpression.RepairModel.INSTANT, ((PeriodicTestExpression) e).repairModel());
        assertEquals(1 - Math.exp(-0.025), e.mean(), EPS);

        Expression beforeFirstTest = new PeriodicTestExpression(constant(1e-3), constant(100), constant(50),
                constant(30));
        assertEquals(1 - Math.exp(-0.03), beforeFirstTest.mean(), EPS);
    }

    @Test
    public void testPeriodicTestWithoutRepairNeverRecovers() {
        Expression e = new PeriodicTestExpression(constant(1e-3), constant(0), constant(100), constant(50),
                constant(275));
        e.validate();
        assertEquals(PeriodicTestExpression.RepairModel.FINITE, ((PeriodicTestExpression) e).repairModel());
        assertEquals(1 - Math.exp(-0.275), e.mean(), 1e-9);
    }

    @Test
    public void testPeriodicTestFastRepairApproachesInstantRepair() {
        double instant = PeriodicTestExpression.instantRepair(1e-3, 100, 50, 275);
        double finite = PeriodicTestExpression.finiteRepair(1e-3, 1e4, 100, 50, 275);
        assertEquals(instant, finite, 1e-4);
    }

    @Test
    public void testPeriodicTestValidation() {
        assertInvalid(new PeriodicTestExpression(constant(0), constant(100), constant(50), constant(10)));
        assertInvalid(new PeriodicTestExpression(constant(1e-3), constant(0), constant(50), constant(10)));
        assertInvalid(new PeriodicTestExpression(constant(1e-3), constant(-1), constant(100), constant(50),
                constant(10)));
    }

    @Test
    public void testDeviates() {
        Expression uniform = Expressions.uniform(0.1, 0.3);
        uniform.validate();
        assertEquals(0.2, uniform.mean(), EPS);
        assertEquals(0.1, uniform.min(), EPS);
        assertEquals(0.3, uniform.max(), EPS);
        assertInvalid(Expressions.uniform(0.3, 0.3));

        Expression normal = Expressions.normal(1, 0.1);
        assertEquals(0.4, normal.min(), EPS);
        assertEquals(1.6, normal.max(), EPS);
        assertInvalid(Expressions.normal(1, 0));

        Expression logNormal = Expressions.logNormal(1e-3, 3);
        logNormal.validate();
        assertEquals(1e-3, logNormal.mean(), EPS);
        assertEquals(0, logNormal.min(), EPS);
        assertTrue(logNormal.max() > 1e-3);
        assertInvalid(Expressions.logNormal(1e-3, 1));
        assertInvalid(Expressions.logNormal(0, 3));
    }

    @Test
    public void testSamplesStayWithinBounds() {
        SampleContext context = new SampleContext(new Random(42));
        Expression uniform = Expressions.uniform(0.1, 0.3);
        Expression exponential = new ExponentialExpression(Expressions.uniform(1e-4, 1e-3), constant(100));
        for (int i = 0; i < 1000; i++) {
            context.reset();
            double u = uniform.sample(context);
            double e = exponential.sample(context);
            assertTrue(u >= 0.1 && u < 0.3);
            assertTrue(e >= exponential.min() && e <= exponential.max());
        }
    }

    @Test
    public void testLogNormalSampleMeanMatches() {
        SampleContext context = new SampleContext(new Random(7));
        Expression logNormal = Expressions.logNormal(0.01, 3);
        int n = 200_000;
        double sum = 0;
        for (int i = 0; i < n; i++) {
            context.reset();
            sum += logNormal.sample(context);
        }
        assertEquals(0.01, sum / n, 5e-4);
    }

    @Test
    public void testSharedExpressionIsSampledOncePerTrial() {
        Parameter rate = new Parameter("rate", Expressions.uniform(0, 1));
        Expression a = new ExponentialExpression(rate, constant(1));
        Expression b = new ExponentialExpression(rate, constant(1));
        SampleContext context = new SampleContext(new Random(1));

        double first = a.sample(context);
        assertEquals(first, b.sample(context), 0);

        boolean changed = false;
        for (int i = 0; i < 10 && !changed; i++) {
            context.reset();
            changed = a.sample(context) != first;
        }
        assertTrue("A new trial must draw a new value", changed);
    }

    @Test
    public void testParameterDelegates() {
        Parameter p = new Parameter("MissionTime", constant(8760));
        assertEquals("MissionTime", p.name());
        assertEquals(8760, p.mean(), EPS);
        assertEquals("MissionTime", p.toString());
        assertFalse(p.hasDeviates());
    }

    @Test
    public void testConstantFactoriesReuseUnitValues() {
        assertSame(ConstantExpression.ZERO, constant(0));
        assertSame(ConstantExpression.ONE, constant(1));
        assertEquals(0.5, constant(0.5).mean(), EPS);
    }

    private static void assertInvalid(Expression expression) {
        try {
            expression.validate();
            fail("Expected InvalidArgumentException for " + expression);
        } catch (InvalidArgumentException expected) {
            assertNotNull(expected.getMessage());
        }
    }
}
