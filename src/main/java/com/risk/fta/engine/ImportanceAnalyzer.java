package com.risk.fta.engine;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks basic events by their contribution to the top event.
 *
 * Conditional probabilities {@code P(top | e)} and {@code P(top | not e)} use
 * the same method as the top event probability. Inclusion-exclusion and the
 * rare-event sum are multilinear in every basic event probability:
 * {@code P = D + p * B}, where {@code B} is the sum of the signed terms
 * containing the event with the event factored out and {@code D} the sum of
 * the remaining terms. One pass over the terms therefore yields
 * {@code P(top | not e) = D} and {@code P(top | e) = D + B} for every event,
 * and the inclusion-exclusion budget is spent once per analysis.
 *
 * MCUB is not multilinear; its conditionals are recomputed per event from the
 * cut sets, which costs {@code O(events * cut sets)} and does not depend on
 * the term budget.
 */
public final class ImportanceAnalyzer {
    private final ProbabilityAnalyzer probabilityAnalyzer;

    public ImportanceAnalyzer(ProbabilityAnalyzer probabilityAnalyzer) {
        this.probabilityAnalyzer = probabilityAnalyzer;
    }

    /**
     * Computes importance factors for every basic event appearing in a cut set.
     *
     * @param topology      Topology the cut set indices refer to.
     * @param cutSets       Minimal cut sets.
     * @param probabilities Probability per basic event index.
     * @param total         Top event probability computed with the same inputs.
     * @return Factors ranked by contribution, highest first.
     */
    public List<Importance> analyze(TreeTopology topology, List<CutSet> cutSets, double[] probabilities,
            double total) {
        List<BitSet> bits = InclusionExclusion.toBitSets(cutSets);
        double[] contribution = new double[probabilities.length];
        BitSet present = new BitSet();
        for (CutSet cs : cutSets) {
            double p = ProbabilityAnalyzer.probAnd(cs, probabilities);
            for (int i : cs.indicesView()) {
                contribution[i] += p;
                present.set(i);
            }
        }

        double[] up = new double[probabilities.length];
        double[] down = new double[probabilities.length];
        conditionals(bits, probabilities, present, up, down);

        List<Importance> ranked = new ArrayList<>(present.cardinality());
        for (int i = present.nextSetBit(0); i >= 0; i = present.nextSetBit(i + 1)) {
            double birnbaum = up[i] - down[i];
            double fv = total > 0 ? contribution[i] / total : 0;
            double criticality = total > 0 ? birnbaum * probabilities[i] / total : 0;
            double raw = total > 0 ? up[i] / total : 0;
            double rrw = down[i] > 0 ? total / down[i] : Double.POSITIVE_INFINITY;
            ranked.add(new Importance(topology.basicEvent(i).id(), probabilities[i], contribution[i], fv, birnbaum,
                    criticality, raw, rrw));
        }
        ranked.sort(Comparator.comparingDouble(Importance::contribution).reversed()
                .thenComparing(Importance::eventId));
        return ranked;
    }

    /** Fills {@code up[i] = P(top | e_i)} and {@code down[i] = P(top | not e_i)}, both clamped. */
    private void conditionals(List<BitSet> cutSets, double[] probabilities, BitSet present, double[] up,
            double[] down) {
        switch (probabilityAnalyzer.approximation()) {
            case NONE -> {
                TermAccumulator acc = new TermAccumulator(probabilities);
                InclusionExclusion.forEachTerm(cutSets, probabilityAnalyzer.numSums(), acc);
                acc.finish(present, up, down);
            }
            case RARE_EVENT -> {
                TermAccumulator acc = new TermAccumulator(probabilities);
                for (BitSet cs : cutSets)
                    acc.visit(cs, 1);
                acc.finish(present, up, down);
            }
            case MCUB -> {
                double[] pinned = probabilities.clone();
                for (int i = present.nextSetBit(0); i >= 0; i = present.nextSetBit(i + 1)) {
                    pinned[i] = 1;
                    up[i] = clamp(ProbabilityAnalyzer.mcub(cutSets, pinned));
                    pinned[i] = 0;
                    down[i] = clamp(ProbabilityAnalyzer.mcub(cutSets, pinned));
                    pinned[i] = probabilities[i];
                }
            }
        }
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }

    /**
     * Sums signed terms and, per event, the terms containing it: once with the
     * event factored out ({@code B}) and once as is.
     */
    static final class TermAccumulator implements InclusionExclusion.TermVisitor {
        private final double[] probabilities;
        private final double[] factored;
        private final double[] containing;
        private double sum;
        private long terms;

        TermAccumulator(double[] probabilities) {
            this.probabilities = probabilities;
            this.factored = new double[probabilities.length];
            this.containing = new double[probabilities.length];
        }

        @Override
        public void visit(BitSet events, int sign) {
            int[] members = events.stream().toArray();
            // suffix[j] = product of members[j..]
            double[] suffix = new double[members.length + 1];
            suffix[members.length] = 1;
            for (int j = members.length - 1; j >= 0; j--)
                suffix[j] = suffix[j + 1] * probabilities[members[j]];

            double term = sign * suffix[0];
            sum += term;
            double prefix = sign;
            for (int j = 0; j < members.length; j++) {
                int event = members[j];
                factored[event] += prefix * suffix[j + 1];
                containing[event] += term;
                prefix *= probabilities[event];
            }
            terms++;
        }

        long terms() {
            return terms;
        }

        double sum() {
            return sum;
        }

        void finish(BitSet present, double[] up, double[] down) {
            for (int i = present.nextSetBit(0); i >= 0; i = present.nextSetBit(i + 1)) {
                double without = sum - containing[i];
                down[i] = clamp(without);
                up[i] = clamp(without + factored[i]);
            }
        }
    }
}
