package com.risk.fta.engine;

import java.util.Arrays;

/**
 * Statistics of the sampled top event probability.
 *
 * @param trials       Number of samples.
 * @param mean         Sample mean, the uncertainty analysis estimate.
 * @param stdDev       Sample standard deviation.
 * @param min          Smallest sample.
 * @param max          Largest sample.
 * @param percentile5  5th percentile.
 * @param percentile95 95th percentile.
 */
public record SimulationSummary(int trials, double mean, double stdDev, double min, double max,
        double percentile5, double percentile95) {

    /**
     * Summarizes samples around a precomputed mean. Variance uses the
     * two-pass sum of squared deviations.
     */
    static SimulationSummary of(double[] samples, double mean) {
        int n = samples.length;
        double sumSq = 0;
        for (double x : samples) {
            double d = x - mean;
            sumSq += d * d;
        }
        double stdDev = n > 1 ? Math.sqrt(sumSq / (n - 1)) : 0;
        double[] sorted = samples.clone();
        Arrays.sort(sorted);
        return new SimulationSummary(n, mean, stdDev, sorted[0], sorted[n - 1], percentile(sorted, 0.05),
                percentile(sorted, 0.95));
    }

    /** Nearest-rank percentile of sorted data. */
    private static double percentile(double[] sorted, double q) {
        int rank = (int) Math.ceil(q * sorted.length);
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
    }
}
