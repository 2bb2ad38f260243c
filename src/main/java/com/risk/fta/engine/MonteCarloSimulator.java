package com.risk.fta.engine;

import com.risk.fta.expression.Expression;
import com.risk.fta.expression.SampleContext;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.DoubleAdder;

import lombok.extern.log4j.Log4j2;

/**
 * Uncertainty analysis of the top event probability by Monte Carlo sampling.
 *
 * The inclusion-exclusion equation is built once. Each trial then draws one
 * value from every basic event's expression (the stochastic draw, not the
 * best estimate), evaluates the signed terms with those values and clamps the
 * sum to [0, 1].
 *
 * Parallelism:
 * Trials are independent. With more than one thread the trial range is split
 * into disjoint slices, one per worker. Each worker owns its random source and
 * its {@link SampleContext}; the only shared state is the sample array, written
 * at disjoint indices, and a thread-safe running sum. The tree, the equation
 * and the expressions are read-only during sampling.
 *
 * Reproducibility:
 * A non-zero seed makes results repeatable for a given thread count.
 */
@Log4j2
public final class MonteCarloSimulator {
    private static final long SEED_STRIDE = 0x9E3779B97F4A7C15L;

    private final int numTrials;
    private final int numThreads;
    private final long seed;

    /**
     * @param numTrials  Number of samples to draw.
     * @param numThreads Worker threads; 1 runs on the calling thread.
     * @param seed       Random seed; 0 for a nondeterministic run.
     */
    public MonteCarloSimulator(int numTrials, int numThreads, long seed) {
        if (numTrials < 1)
            throw new IllegalArgumentException("Number of trials must be positive: " + numTrials);
        if (numThreads < 1)
            throw new IllegalArgumentException("Number of threads must be positive: " + numThreads);
        this.numTrials = numTrials;
        this.numThreads = numThreads;
        this.seed = seed;
    }

    /**
     * Runs the simulation.
     *
     * @param equation    Precomputed signed-term equation over basic event indices.
     * @param expressions Expression per basic event index.
     * @return The sample statistics.
     */
    public SimulationSummary simulate(InclusionExclusion.Equation equation, Expression[] expressions) {
        double[] samples = new double[numTrials];
        DoubleAdder sum = new DoubleAdder();
        int workers = Math.min(numThreads, numTrials);

        if (workers == 1) {
            sampleRange(equation, expressions, samples, sum, 0, numTrials, random(0));
        } else {
            runParallel(equation, expressions, samples, sum, workers);
        }

        SimulationSummary summary = SimulationSummary.of(samples, sum.sum() / numTrials);
        log.info("Simulated {} trials on {} thread(s): mean {}, std dev {}", numTrials, workers, summary.mean(),
                summary.stdDev());
        return summary;
    }

    private void runParallel(InclusionExclusion.Equation equation, Expression[] expressions, double[] samples,
            DoubleAdder sum, int workers) {
        ExecutorService pool = Executors.newFixedThreadPool(workers, DaemonThreadFactory.INSTANCE);
        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            int slice = numTrials / workers;
            for (int w = 0; w < workers; w++) {
                int from = w * slice;
                int to = (w == workers - 1) ? numTrials : from + slice;
                Random random = random(w);
                futures.add(pool.submit(() -> sampleRange(equation, expressions, samples, sum, from, to, random)));
            }
            for (Future<?> f : futures)
                f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            throw new IllegalStateException("Simulation failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static void sampleRange(InclusionExclusion.Equation equation, Expression[] expressions,
            double[] samples, DoubleAdder sum, int from, int to, Random random) {
        SampleContext context = new SampleContext(random);
        double[] probabilities = new double[expressions.length];
        for (int t = from; t < to; t++) {
            context.reset();
            for (int i = 0; i < expressions.length; i++)
                probabilities[i] = clamp(expressions[i].sample(context));
            double value = clamp(equation.evaluate(probabilities));
            samples[t] = value;
            sum.add(value);
        }
    }

    private Random random(int worker) {
        return seed == 0 ? new Random() : new Random(seed + worker * SEED_STRIDE);
    }

    private static double clamp(double p) {
        return Math.max(0, Math.min(1, p));
    }
}
