package com.risk.fta.engine;

import com.risk.fta.util.Combinations;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Term generator for the inclusion-exclusion expansion of a union of cut sets.
 *
 * {@code P(C1 | ... | Cn) = sum over non-empty subsets S of (-1)^(|S|+1) * P(AND of the union of S)}
 *
 * The full expansion has {@code 2^n - 1} terms. Terms are generated in
 * increasing subset size (all singles, then all pairs, then all triples...)
 * and generation stops once the term budget is spent. Higher-order terms are
 * expected to be smaller, so a truncated sum converges toward the exact value.
 */
public final class InclusionExclusion {

    /** Receives one term: the union of basic events and its sign (+1 or -1). */
    @FunctionalInterface
    public interface TermVisitor {
        void visit(BitSet events, int sign);
    }

    /**
     * Precomputed signed terms, ready to be evaluated many times with
     * different basic event probabilities.
     */
    public static final class Equation {
        private final int[][] positiveTerms;
        private final int[][] negativeTerms;
        private final boolean truncated;

        Equation(int[][] positiveTerms, int[][] negativeTerms, boolean truncated) {
            this.positiveTerms = positiveTerms;
            this.negativeTerms = negativeTerms;
            this.truncated = truncated;
        }

        public int positiveTermCount() {
            return positiveTerms.length;
        }

        public int negativeTermCount() {
            return negativeTerms.length;
        }

        public boolean truncated() {
            return truncated;
        }

        /**
         * Evaluates the equation.
         *
         * @param probabilities Probability per basic event index.
         * @return The sum of signed terms; not clamped.
         */
        public double evaluate(double[] probabilities) {
            double sum = 0;
            for (int[] term : positiveTerms)
                sum += product(term, probabilities);
            for (int[] term : negativeTerms)
                sum -= product(term, probabilities);
            return sum;
        }

        private static double product(int[] term, double[] probabilities) {
            double p = 1;
            for (int event : term)
                p *= probabilities[event];
            return p;
        }
    }

    private InclusionExclusion() {
        // Utility class
    }

    /**
     * Visits terms in increasing combination size until the budget is spent.
     *
     * @param cutSets Cut sets as basic event index sets.
     * @param budget  Maximum number of terms to generate.
     * @param visitor Receives each term.
     * @return The number of terms visited.
     */
    public static long forEachTerm(List<BitSet> cutSets, long budget, TermVisitor visitor) {
        int n = cutSets.size();
        long terms = 0;
        for (int k = 1; k <= n && terms < budget; k++) {
            int sign = (k % 2 == 1) ? 1 : -1;
            for (int[] combination : new Combinations(n, k)) {
                if (terms >= budget)
                    break;
                BitSet union = new BitSet();
                for (int i : combination)
                    union.or(cutSets.get(i));
                visitor.visit(union, sign);
                terms++;
            }
        }
        return terms;
    }

    /** Total number of terms of the full expansion, saturating at {@link Long#MAX_VALUE}. */
    public static long totalTerms(int cutSetCount) {
        return cutSetCount >= 63 ? Long.MAX_VALUE : (1L << cutSetCount) - 1;
    }

    /** Returns true if {@code budget} is too small for the full expansion. */
    public static boolean isTruncated(int cutSetCount, long budget) {
        return totalTerms(cutSetCount) > budget;
    }

    /**
     * Builds the signed-term equation once, for repeated evaluation.
     */
    public static Equation equation(List<BitSet> cutSets, long budget) {
        List<int[]> positive = new ArrayList<>();
        List<int[]> negative = new ArrayList<>();
        forEachTerm(cutSets, budget, (events, sign) -> (sign > 0 ? positive : negative)
                .add(events.stream().toArray()));
        return new Equation(positive.toArray(new int[0][]), negative.toArray(new int[0][]),
                isTruncated(cutSets.size(), budget));
    }

    /** Converts cut sets into bit sets of basic event indices. */
    public static List<BitSet> toBitSets(List<CutSet> cutSets) {
        List<BitSet> bits = new ArrayList<>(cutSets.size());
        for (CutSet cs : cutSets) {
            BitSet set = new BitSet();
            for (int i : cs.indicesView())
                set.set(i);
            bits.add(set);
        }
        return bits;
    }
}
