package com.risk.fta.engine;

/**
 * Probability of a union of cut sets.
 *
 * @param value     The probability, clamped to [0, 1].
 * @param terms     Number of terms summed (cut sets for the approximations).
 * @param truncated True if the inclusion-exclusion series was cut short by the
 *                  term budget; the value is then an estimate.
 * @param clamped   True if the raw sum fell outside [0, 1] and was clamped.
 */
public record ProbabilityResult(double value, long terms, boolean truncated, boolean clamped) {

    static ProbabilityResult of(double raw, long terms, boolean truncated) {
        double value = Math.max(0, Math.min(1, raw));
        return new ProbabilityResult(value, terms, truncated, value != raw);
    }
}
