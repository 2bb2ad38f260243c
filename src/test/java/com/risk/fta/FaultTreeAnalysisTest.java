package com.risk.fta;

import com.risk.fta.api.AnalysisListener;
import com.risk.fta.api.AnalysisPhase;
import com.risk.fta.api.CycleDetectedException;
import com.risk.fta.api.InvalidArgumentException;
import com.risk.fta.engine.Approximation;
import com.risk.fta.engine.FaultTree;
import com.risk.fta.engine.Importance;
import com.risk.fta.expression.Expression;
import com.risk.fta.expression.Expressions;
import com.risk.fta.expression.Parameter;
import com.risk.fta.io.AnalysisSettings;
import com.risk.fta.model.BasicEvent;
import com.risk.fta.model.EventRegistry;
import com.risk.fta.model.Gate;
import com.risk.fta.model.GateType;
import com.risk.fta.model.HouseEvent;
import com.risk.fta.util.PhaseTimingListener;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class FaultTreeAnalysisTest {

    private static final double EPS = 1e-12;

    private static FaultTree orTree(Expression a, Expression b) {
        EventRegistry registry = new EventRegistry()
                .add(new BasicEvent("b1", a))
                .add(new BasicEvent("b2", b));
        FaultTree tree = new FaultTree("or-tree", registry);
        tree.addGate(new Gate("Top", GateType.OR, List.of("b1", "b2")));
        return tree;
    }

    @Test
    public void testFullAnalysisOfOrTree() {
        FaultTreeAnalysis analysis = new FaultTreeAnalysis(
                orTree(Expressions.constant(0.1), Expressions.constant(0.2)), AnalysisSettings.defaults());
        PhaseTimingListener timing = analysis.enablePhaseTiming();
        AnalysisResult result = analysis.analyze();

        assertEquals("or-tree", result.getTreeName());
        assertEquals(2, result.getCutSets().size());
        assertEquals(0.28, result.getProbability().value(), EPS);
        assertEquals(0.28, result.getLowerBound(), EPS);
        assertEquals(0.28, result.getUpperBound(), EPS);
        assertTrue(result.getWarnings().isEmpty());

        List<AnalysisResult.CutSetProbability> ranked = result.getRankedCutSets();
        assertEquals("{b2}", ranked.get(0).cutSet().toString());
        assertEquals(0.2, ranked.get(0).probability(), EPS);
        assertEquals(0.1, ranked.get(1).probability(), EPS);

        List<Importance> importance = result.getImportance();
        assertEquals(2, importance.size());
        assertEquals("b2", importance.get(0).eventId());
        assertNull(result.getSimulation());

        assertTrue(timing.ran(AnalysisPhase.VALIDATION));
        assertTrue(timing.ran(AnalysisPhase.CUT_SETS));
        assertTrue(timing.ran(AnalysisPhase.PROBABILITY));
        assertTrue(timing.ran(AnalysisPhase.IMPORTANCE));
        assertFalse(timing.ran(AnalysisPhase.UNCERTAINTY));
        assertEquals(1, timing.completedRuns());
    }

    @Test
    public void testBoundsFollowExpressionBounds() {
        FaultTreeAnalysis analysis = new FaultTreeAnalysis(
                orTree(Expressions.uniform(0, 0.2), Expressions.uniform(0.1, 0.3)), AnalysisSettings.defaults());
        AnalysisResult result = analysis.analyze();
        assertEquals(0.28, result.getProbability().value(), EPS);
        assertEquals(0.1, result.getLowerBound(), EPS);
        assertEquals(1 - 0.8 * 0.7, result.getUpperBound(), EPS);
    }

    @Test
    public void testApproximations() {
        AnalysisSettings settings = new AnalysisSettings();
        settings.setApproximation(Approximation.RARE_EVENT);
        AnalysisResult rare = new FaultTreeAnalysis(
                orTree(Expressions.constant(0.1), Expressions.constant(0.2)), settings).analyze();
        assertEquals(0.3, rare.getProbability().value(), EPS);
        assertTrue(rare.getWarnings().stream().anyMatch(w -> w.contains("Rare-event")));

        settings.setApproximation(Approximation.MCUB);
        AnalysisResult mcub = new FaultTreeAnalysis(
                orTree(Expressions.constant(0.1), Expressions.constant(0.2)), settings).analyze();
        assertEquals(0.28, mcub.getProbability().value(), EPS);
        assertTrue(mcub.getWarnings().isEmpty());
    }

    @Test
    public void testUncertaintyAnalysis() {
        AnalysisSettings settings = new AnalysisSettings();
        settings.setUncertaintyAnalysis(true);
        settings.setNumTrials(100_000);
        settings.setSeed(17);
        AnalysisResult result = new FaultTreeAnalysis(
                orTree(Expressions.uniform(0, 0.2), Expressions.uniform(0.1, 0.3)), settings).analyze();

        assertNotNull(result.getSimulation());
        assertEquals(100_000, result.getSimulation().trials());
        assertEquals(0.28, result.getSimulation().mean(), 0.01);
    }

    @Test
    public void testUncertaintyWithoutDeviatesWarns() {
        AnalysisSettings settings = new AnalysisSettings();
        settings.setUncertaintyAnalysis(true);
        settings.setNumTrials(10);
        AnalysisResult result = new FaultTreeAnalysis(
                orTree(Expressions.constant(0.1), Expressions.constant(0.2)), settings).analyze();
        assertEquals(0.28, result.getSimulation().mean(), EPS);
        assertEquals(1, result.getWarnings().size());
    }

    @Test
    public void testCutSetTruncationIsReported() {
        EventRegistry registry = new EventRegistry();
        for (String name : List.of("a", "b", "c", "d"))
            registry.add(new BasicEvent(name, Expressions.constant(0.1)));
        FaultTree tree = new FaultTree("deep", registry);
        tree.addGate(new Gate("Top", GateType.OR, List.of("a", "G1")));
        tree.addGate(new Gate("G1", GateType.AND, List.of("b", "c", "d")));

        AnalysisSettings settings = new AnalysisSettings();
        settings.setLimitOrder(2);
        settings.setImportanceAnalysis(false);
        List<String> warnings = new ArrayList<>();
        FaultTreeAnalysis analysis = new FaultTreeAnalysis(tree, settings);
        analysis.addListener(new WarningCollector(warnings));
        AnalysisResult result = analysis.analyze();

        assertTrue(result.getCutSets().truncated());
        assertEquals(0.1, result.getProbability().value(), EPS);
        assertEquals(result.getWarnings(), warnings);
        assertTrue(warnings.get(0).contains("order 2"));
        assertTrue(result.getImportance().isEmpty());
    }

    @Test
    public void testSeriesTruncationIsReported() {
        AnalysisSettings settings = new AnalysisSettings();
        settings.setNumSums(2);
        AnalysisResult result = new FaultTreeAnalysis(
                orTree(Expressions.constant(0.1), Expressions.constant(0.2)), settings).analyze();
        assertTrue(result.getProbability().truncated());
        assertEquals(0.3, result.getProbability().value(), EPS);
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.contains("truncated")));
    }

    @Test
    public void testCertainTopEvent() {
        EventRegistry registry = new EventRegistry()
                .add(new BasicEvent("a", Expressions.constant(0.1)))
                .add(new HouseEvent("Bypass", true));
        FaultTree tree = new FaultTree("certain", registry);
        tree.addGate(new Gate("Top", GateType.OR, List.of("a", "Bypass")));

        AnalysisResult result = new FaultTreeAnalysis(tree, AnalysisSettings.defaults()).analyze();
        assertTrue(result.getCutSets().isUnity());
        assertEquals(1, result.getProbability().value(), EPS);
        assertTrue(result.getImportance().isEmpty());
    }

    @Test
    public void testProbabilityAnalysisCanBeDisabled() {
        AnalysisSettings settings = new AnalysisSettings();
        settings.setProbabilityAnalysis(false);
        settings.setUncertaintyAnalysis(true);
        EventRegistry registry = new EventRegistry().add(new BasicEvent("a")).add(new BasicEvent("b"));
        FaultTree tree = new FaultTree("structure-only", registry);
        tree.addGate(new Gate("Top", GateType.AND, List.of("a", "b")));

        AnalysisResult result = new FaultTreeAnalysis(tree, settings).analyze();
        assertEquals(1, result.getCutSets().size());
        assertNull(result.getProbability());
        assertTrue(Double.isNaN(result.getLowerBound()));
        assertNull(result.getSimulation());
    }

    @Test
    public void testMissingProbabilityFails() {
        EventRegistry registry = new EventRegistry()
                .add(new BasicEvent("a", Expressions.constant(0.1)))
                .add(new BasicEvent("b"));
        FaultTree tree = new FaultTree("t", registry);
        tree.addGate(new Gate("Top", GateType.OR, List.of("a", "b")));
        List<AnalysisPhase> failed = new ArrayList<>();
        FaultTreeAnalysis analysis = new FaultTreeAnalysis(tree, AnalysisSettings.defaults());
        analysis.addListener(new ErrorCollector(failed));
        try {
            analysis.analyze();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("'b'"));
        }
        assertEquals(List.of(AnalysisPhase.PROBABILITY), failed);
    }

    @Test(expected = InvalidArgumentException.class)
    public void testInvalidExpressionFails() {
        new FaultTreeAnalysis(orTree(Expressions.exponential(-1, 10), Expressions.constant(0.2)),
                AnalysisSettings.defaults()).analyze();
    }

    @Test(expected = InvalidArgumentException.class)
    public void testProbabilityOutOfRangeFails() {
        new FaultTreeAnalysis(orTree(Expressions.constant(1.5), Expressions.constant(0.2)),
                AnalysisSettings.defaults()).analyze();
    }

    @Test
    public void testValidationErrorIsReportedAndRethrown() {
        EventRegistry registry = new EventRegistry().add(new BasicEvent("x", Expressions.constant(0.1)));
        FaultTree tree = new FaultTree("loop", registry);
        tree.addGate(new Gate("Top", GateType.OR, List.of("A", "x")));
        tree.addGate(new Gate("A", GateType.NULL, List.of("Top")));

        List<AnalysisPhase> failed = new ArrayList<>();
        FaultTreeAnalysis analysis = new FaultTreeAnalysis(tree, AnalysisSettings.defaults());
        analysis.addListener(new ErrorCollector(failed));
        try {
            analysis.analyze();
            fail("Expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(List.of("Top", "A", "Top"), e.path());
        }
        assertEquals(List.of(AnalysisPhase.VALIDATION), failed);
    }

    @Test
    public void testSharedParameterAcrossEvents() {
        // Both pumps share one uncertain failure rate: the AND of the two is
        // driven by the square of a single draw.
        Parameter rate = new Parameter("rate", Expressions.uniform(0.1, 0.5));
        EventRegistry registry = new EventRegistry()
                .add(new BasicEvent("PumpA", rate))
                .add(new BasicEvent("PumpB", rate));
        FaultTree tree = new FaultTree("ccf", registry);
        tree.addGate(new Gate("Top", GateType.AND, List.of("PumpA", "PumpB")));

        AnalysisSettings settings = new AnalysisSettings();
        settings.setUncertaintyAnalysis(true);
        settings.setNumTrials(50_000);
        settings.setSeed(5);
        AnalysisResult result = new FaultTreeAnalysis(tree, settings).analyze();

        // E[U^2] for U ~ Uniform(0.1, 0.5) = Var + mean^2 = 0.4^2 / 12 + 0.09
        assertEquals(0.09, result.getProbability().value(), EPS);
        assertEquals(0.16 / 12 + 0.09, result.getSimulation().mean(), 0.005);
    }

    private static final class WarningCollector implements AnalysisListener {
        private final List<String> warnings;

        WarningCollector(List<String> warnings) {
            this.warnings = warnings;
        }

        @Override
        public void onAnalysisStart(String treeName) {
        }

        @Override
        public void onPhaseComplete(AnalysisPhase phase, long durationNanos) {
        }

        @Override
        public void onWarning(AnalysisPhase phase, String message) {
            warnings.add(message);
        }

        @Override
        public void onAnalysisError(AnalysisPhase phase, Throwable error) {
        }

        @Override
        public void onAnalysisEnd(String treeName) {
        }
    }

    private static final class ErrorCollector implements AnalysisListener {
        private final List<AnalysisPhase> phases;

        ErrorCollector(List<AnalysisPhase> phases) {
            this.phases = phases;
        }

        @Override
        public void onAnalysisStart(String treeName) {
        }

        @Override
        public void onPhaseComplete(AnalysisPhase phase, long durationNanos) {
        }

        @Override
        public void onWarning(AnalysisPhase phase, String message) {
        }

        @Override
        public void onAnalysisError(AnalysisPhase phase, Throwable error) {
            phases.add(phase);
        }

        @Override
        public void onAnalysisEnd(String treeName) {
        }
    }
}
