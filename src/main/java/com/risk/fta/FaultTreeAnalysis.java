package com.risk.fta;

import com.risk.fta.api.AnalysisListener;
import com.risk.fta.api.AnalysisPhase;
import com.risk.fta.api.InvalidArgumentException;
import com.risk.fta.engine.Approximation;
import com.risk.fta.engine.CutSet;
import com.risk.fta.engine.CutSetGenerator;
import com.risk.fta.engine.CutSetResult;
import com.risk.fta.engine.FaultTree;
import com.risk.fta.engine.ImportanceAnalyzer;
import com.risk.fta.engine.InclusionExclusion;
import com.risk.fta.engine.MonteCarloSimulator;
import com.risk.fta.engine.ProbabilityAnalyzer;
import com.risk.fta.engine.ProbabilityResult;
import com.risk.fta.engine.SimulationSummary;
import com.risk.fta.engine.TreeTopology;
import com.risk.fta.expression.Expression;
import com.risk.fta.io.AnalysisSettings;
import com.risk.fta.io.FaultTreeCompiler;
import com.risk.fta.io.FaultTreeDefinition;
import com.risk.fta.model.BasicEvent;
import com.risk.fta.util.CompositeAnalysisListener;
import com.risk.fta.util.PhaseTimingListener;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point running the whole analysis of one fault tree.
 *
 * <p>
 * Phases, in order:
 * <ul>
 * <li>Validation, unless the tree is already validated.</li>
 * <li>Minimal cut set generation up to {@code limitOrder}.</li>
 * <li>Probability: top event probability with bounds, and per cut set
 * probabilities.</li>
 * <li>Importance factors of the basic events.</li>
 * <li>Uncertainty: Monte Carlo simulation of the top event probability.</li>
 * </ul>
 * Importance and uncertainty analysis run only together with probability
 * analysis.
 *
 * <p>
 * Listeners registered with {@link #addListener(AnalysisListener)} see phase
 * timings and warnings. A failing phase is reported to the listeners and the
 * exception is rethrown unchanged.
 */
public class FaultTreeAnalysis {
    private static final Logger log = LogManager.getLogger(FaultTreeAnalysis.class);

    /** Cut set probability above which the rare-event approximation is flagged. */
    static final double RARE_EVENT_THRESHOLD = 0.1;

    private final FaultTree tree;
    private final AnalysisSettings settings;
    private final CompositeAnalysisListener compositeListener = new CompositeAnalysisListener();

    public FaultTreeAnalysis(FaultTree tree, AnalysisSettings settings) {
        this.tree = tree;
        this.settings = settings.validate();
    }

    /**
     * Compiles declarations into a fresh tree.
     *
     * @param definition Already-parsed declarations.
     * @param settings   Analysis settings.
     */
    public FaultTreeAnalysis(FaultTreeDefinition definition, AnalysisSettings settings) {
        this(new FaultTreeCompiler().compile(definition), settings);
    }

    /**
     * Registers a listener. Listeners are added to, never replaced.
     */
    public void addListener(AnalysisListener listener) {
        compositeListener.register(listener);
    }

    /**
     * Enables per-phase timing. Use the returned listener to read or dump the
     * timings.
     */
    public PhaseTimingListener enablePhaseTiming() {
        PhaseTimingListener timing = new PhaseTimingListener();
        compositeListener.register(timing);
        return timing;
    }

    public FaultTree getTree() {
        return tree;
    }

    public AnalysisSettings getSettings() {
        return settings;
    }

    /**
     * Runs all enabled phases.
     *
     * @return The analysis result.
     * @throws com.risk.fta.api.ValidationException if the tree is malformed.
     * @throws InvalidArgumentException             if an expression is out of
     *                                              its domain.
     * @throws IllegalStateException                if a basic event has no
     *                                              probability.
     */
    public AnalysisResult analyze() {
        compositeListener.onAnalysisStart(tree.name());

        if (!tree.isValidated())
            runPhase(AnalysisPhase.VALIDATION, () -> {
                tree.validate();
                return null;
            });

        CutSetResult cutSets = runPhase(AnalysisPhase.CUT_SETS,
                () -> new CutSetGenerator(settings.getLimitOrder()).generate(tree));
        AnalysisResult result = new AnalysisResult(tree.name(), cutSets);
        if (cutSets.truncated())
            warn(result, AnalysisPhase.CUT_SETS, "Cut sets above order " + cutSets.limitOrder()
                    + " were discarded; the collection may be incomplete");
        if (cutSets.isUnity())
            warn(result, AnalysisPhase.CUT_SETS, "The top event is certain: the only cut set is empty");
        else if (cutSets.isNull())
            warn(result, AnalysisPhase.CUT_SETS, "The top event can never occur: no cut sets");

        if (settings.isProbabilityAnalysis()) {
            TreeTopology topology = tree.topology();
            ProbabilityAnalyzer analyzer = new ProbabilityAnalyzer(settings.getApproximation(),
                    settings.getNumSums());
            Inputs inputs = runPhase(AnalysisPhase.PROBABILITY, () -> {
                Inputs in = Inputs.of(topology);
                computeProbability(result, analyzer, in);
                return in;
            });

            if (settings.isImportanceAnalysis())
                runPhase(AnalysisPhase.IMPORTANCE, () -> {
                    result.setImportance(new ImportanceAnalyzer(analyzer).analyze(topology,
                            cutSets.cutSets(), inputs.mean, result.getProbability().value()));
                    return null;
                });

            if (settings.isUncertaintyAnalysis())
                runPhase(AnalysisPhase.UNCERTAINTY, () -> {
                    result.setSimulation(simulate(result, inputs));
                    return null;
                });
        }

        log.info("Analysis of '{}' complete: {} cut sets, P(top) = {}", tree.name(), cutSets.size(),
                result.getProbability() == null ? "n/a" : result.getProbability().value());
        compositeListener.onAnalysisEnd(tree.name());
        return result;
    }

    private void computeProbability(AnalysisResult result, ProbabilityAnalyzer analyzer, Inputs inputs) {
        List<CutSet> cutSets = result.getCutSets().cutSets();
        List<BitSet> bits = InclusionExclusion.toBitSets(cutSets);

        ProbabilityResult point = analyzer.compute(bits, inputs.mean);
        double low = analyzer.compute(bits, inputs.min).value();
        double high = analyzer.compute(bits, inputs.max).value();
        result.setProbability(point, low, high);

        List<AnalysisResult.CutSetProbability> ranked = new ArrayList<>(cutSets.size());
        double largest = 0;
        for (CutSet cs : cutSets) {
            double p = ProbabilityAnalyzer.probAnd(cs, inputs.mean);
            largest = Math.max(largest, p);
            ranked.add(new AnalysisResult.CutSetProbability(cs, p));
        }
        ranked.sort(Comparator.comparingDouble(AnalysisResult.CutSetProbability::probability).reversed());
        result.setRankedCutSets(ranked);

        if (point.truncated())
            warn(result, AnalysisPhase.PROBABILITY, "Inclusion-exclusion truncated after " + point.terms()
                    + " terms; the probability is approximate");
        if (point.clamped())
            warn(result, AnalysisPhase.PROBABILITY, "Top event probability was clamped to [0, 1]");
        if (analyzer.approximation() == Approximation.RARE_EVENT && largest > RARE_EVENT_THRESHOLD)
            warn(result, AnalysisPhase.PROBABILITY, "Rare-event approximation may be inaccurate: a cut set"
                    + " probability of " + largest + " exceeds " + RARE_EVENT_THRESHOLD);
    }

    private SimulationSummary simulate(AnalysisResult result, Inputs inputs) {
        boolean anyDeviate = false;
        for (Expression expression : inputs.expressions)
            anyDeviate |= expression.hasDeviates();
        if (!anyDeviate)
            warn(result, AnalysisPhase.UNCERTAINTY,
                    "No basic event has an uncertainty distribution; every trial yields the point estimate");

        InclusionExclusion.Equation equation = InclusionExclusion.equation(
                InclusionExclusion.toBitSets(result.getCutSets().cutSets()), settings.getNumSums());
        if (equation.truncated())
            warn(result, AnalysisPhase.UNCERTAINTY, "Simulation equation truncated to "
                    + (equation.positiveTermCount() + equation.negativeTermCount()) + " terms");
        return new MonteCarloSimulator(settings.getNumTrials(), settings.getNumThreads(), settings.getSeed())
                .simulate(equation, inputs.expressions);
    }

    private void warn(AnalysisResult result, AnalysisPhase phase, String message) {
        log.warn("[{}] {}", tree.name(), message);
        result.addWarning(message);
        compositeListener.onWarning(phase, message);
    }

    private <T> T runPhase(AnalysisPhase phase, Supplier<T> body) {
        long start = System.nanoTime();
        T value;
        try {
            value = body.get();
        } catch (RuntimeException e) {
            log.error("Analysis of '{}' failed in phase {}", tree.name(), phase, e);
            compositeListener.onAnalysisError(phase, e);
            throw e;
        }
        compositeListener.onPhaseComplete(phase, System.nanoTime() - start);
        return value;
    }

    /** Validated expressions and their point and bound values per basic event index. */
    private static final class Inputs {
        final Expression[] expressions;
        final double[] mean, min, max;

        private Inputs(int n) {
            expressions = new Expression[n];
            mean = new double[n];
            min = new double[n];
            max = new double[n];
        }

        static Inputs of(TreeTopology topology) {
            Inputs in = new Inputs(topology.basicEventCount());
            for (int i = 0; i < in.expressions.length; i++) {
                BasicEvent event = topology.basicEvent(i);
                if (!event.hasExpression())
                    throw new IllegalStateException("Basic event '" + event.name() + "' has no probability");
                Expression expression = event.expression();
                expression.validate();
                double p = expression.mean();
                if (p < 0 || p > 1)
                    throw new InvalidArgumentException("Probability of basic event '" + event.name()
                            + "' must be in [0, 1], got " + p);
                in.expressions[i] = expression;
                in.mean[i] = p;
                in.min[i] = Math.max(0, expression.min());
                in.max[i] = Math.min(1, expression.max());
            }
            return in;
        }
    }
}
