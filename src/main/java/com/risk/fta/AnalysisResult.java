package com.risk.fta;

import com.risk.fta.engine.CutSet;
import com.risk.fta.engine.CutSetResult;
import com.risk.fta.engine.Importance;
import com.risk.fta.engine.ProbabilityResult;
import com.risk.fta.engine.SimulationSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Outcome of one {@link FaultTreeAnalysis#analyze()} run.
 *
 * Sections for phases that were disabled in the settings are {@code null}
 * (probability, simulation) or empty (cut set probabilities, importance).
 */
@Getter
public final class AnalysisResult {
    private final String treeName;
    private final CutSetResult cutSets;

    /** Point estimate of the top event probability. */
    private ProbabilityResult probability;
    /** Top event probability from the basic events' lower bounds. */
    private double lowerBound = Double.NaN;
    /** Top event probability from the basic events' upper bounds. */
    private double upperBound = Double.NaN;

    /** Cut sets with their probabilities, most probable first. */
    private List<CutSetProbability> rankedCutSets = List.of();
    private List<Importance> importance = List.of();
    private SimulationSummary simulation;

    @Getter(AccessLevel.NONE)
    private final List<String> warnings = new ArrayList<>();

    AnalysisResult(String treeName, CutSetResult cutSets) {
        this.treeName = treeName;
        this.cutSets = cutSets;
    }

    /** Truncation and approximation warnings, in the order they were raised. */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** A cut set and the probability of all its events occurring together. */
    public record CutSetProbability(CutSet cutSet, double probability) {
    }

    void setProbability(ProbabilityResult probability, double lowerBound, double upperBound) {
        this.probability = probability;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    void setRankedCutSets(List<CutSetProbability> rankedCutSets) {
        this.rankedCutSets = List.copyOf(rankedCutSets);
    }

    void setImportance(List<Importance> importance) {
        this.importance = List.copyOf(importance);
    }

    void setSimulation(SimulationSummary simulation) {
        this.simulation = simulation;
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }
}
