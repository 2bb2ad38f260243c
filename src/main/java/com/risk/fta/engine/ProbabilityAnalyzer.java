package com.risk.fta.engine;

import java.util.BitSet;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Computes the probability of the top event from its minimal cut sets, assuming
 * independent basic events.
 *
 * - {@link #probAnd}: one cut set, the product of its members' probabilities.
 * Exact.
 * - {@link #probOr}: the union, by inclusion-exclusion truncated after
 * {@code numSums} terms.
 * - Rare-event approximation: the plain sum of cut set probabilities. Cheap,
 * and an upper bound; only valid when probabilities are small and overlaps
 * negligible.
 * - MCUB: {@code 1 - prod(1 - P(cs))}, an upper bound for coherent trees that
 * stays within [0, 1].
 */
@Log4j2
public final class ProbabilityAnalyzer {
    private final Approximation approximation;
    private final long numSums;

    /**
     * @param approximation Union computation method.
     * @param numSums       Term budget for inclusion-exclusion.
     */
    public ProbabilityAnalyzer(Approximation approximation, long numSums) {
        if (numSums < 1)
            throw new IllegalArgumentException("Number of sums must be positive: " + numSums);
        this.approximation = approximation;
        this.numSums = numSums;
    }

    public Approximation approximation() {
        return approximation;
    }

    public long numSums() {
        return numSums;
    }

    /** Probability of all events of the set occurring together. */
    public static double probAnd(BitSet events, double[] probabilities) {
        double p = 1;
        for (int i = events.nextSetBit(0); i >= 0; i = events.nextSetBit(i + 1))
            p *= probabilities[i];
        return p;
    }

    /** Probability of all events of the cut set occurring together. */
    public static double probAnd(CutSet cutSet, double[] probabilities) {
        double p = 1;
        for (int i : cutSet.indicesView())
            p *= probabilities[i];
        return p;
    }

    /**
     * Union probability by truncated inclusion-exclusion.
     */
    public ProbabilityResult probOr(List<BitSet> cutSets, double[] probabilities) {
        double[] sum = new double[1];
        long terms = InclusionExclusion.forEachTerm(cutSets, numSums,
                (events, sign) -> sum[0] += sign * probAnd(events, probabilities));
        boolean truncated = InclusionExclusion.isTruncated(cutSets.size(), numSums);
        return ProbabilityResult.of(sum[0], terms, truncated);
    }

    /** Sum of cut set probabilities, not clamped. */
    public static double rareEvent(List<BitSet> cutSets, double[] probabilities) {
        double sum = 0;
        for (BitSet cs : cutSets)
            sum += probAnd(cs, probabilities);
        return sum;
    }

    /** Min cut upper bound. */
    public static double mcub(List<BitSet> cutSets, double[] probabilities) {
        double none = 1;
        for (BitSet cs : cutSets)
            none *= 1 - probAnd(cs, probabilities);
        return 1 - none;
    }

    /**
     * Union probability with the configured method.
     *
     * @param cutSets       Cut sets as basic event index sets.
     * @param probabilities Probability per basic event index.
     */
    public ProbabilityResult compute(List<BitSet> cutSets, double[] probabilities) {
        return switch (approximation) {
            case NONE -> probOr(cutSets, probabilities);
            case RARE_EVENT -> ProbabilityResult.of(rareEvent(cutSets, probabilities), cutSets.size(), false);
            case MCUB -> ProbabilityResult.of(mcub(cutSets, probabilities), cutSets.size(), false);
        };
    }

    /** Convenience overload for generated cut sets. */
    public ProbabilityResult computeCutSets(List<CutSet> cutSets, double[] probabilities) {
        ProbabilityResult result = compute(InclusionExclusion.toBitSets(cutSets), probabilities);
        if (result.truncated())
            log.debug("Inclusion-exclusion truncated after {} terms for {} cut sets", result.terms(),
                    cutSets.size());
        return result;
    }
}
