package com.risk.fta.util;

import com.risk.fta.api.AnalysisListener;
import com.risk.fta.api.AnalysisPhase;

import java.util.EnumMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that records how long each analysis phase took and how many
 * warnings it produced.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Time spent per phase in the last run (in nanoseconds).</li>
 * <li><b>Total:</b> Sum over all phases of the last run.</li>
 * <li><b>Warnings:</b> Number of warnings per phase.</li>
 * </ul>
 */
public final class PhaseTimingListener implements AnalysisListener {
    private static final Logger log = LogManager.getLogger(PhaseTimingListener.class);

    private final Map<AnalysisPhase, Long> phaseNanos = new EnumMap<>(AnalysisPhase.class);
    private final Map<AnalysisPhase, Integer> warnings = new EnumMap<>(AnalysisPhase.class);
    private long analysisStartNanos, lastAnalysisNanos;
    private int completedRuns;

    @Override
    public void onAnalysisStart(String treeName) {
        phaseNanos.clear();
        warnings.clear();
        analysisStartNanos = System.nanoTime();
    }

    @Override
    public void onPhaseComplete(AnalysisPhase phase, long durationNanos) {
        phaseNanos.put(phase, durationNanos);
    }

    @Override
    public void onWarning(AnalysisPhase phase, String message) {
        warnings.merge(phase, 1, Integer::sum);
    }

    @Override
    public void onAnalysisError(AnalysisPhase phase, Throwable error) {
        log.error("Analysis failed in phase {}: {}", phase, error.getMessage());
    }

    @Override
    public void onAnalysisEnd(String treeName) {
        lastAnalysisNanos = System.nanoTime() - analysisStartNanos;
        completedRuns++;
        if (log.isDebugEnabled())
            log.debug("Analysis of '{}' finished:\n{}", treeName, dump());
    }

    /** Returns the duration of the phase in the last run, or 0 if it did not run. */
    public long phaseNanos(AnalysisPhase phase) {
        return phaseNanos.getOrDefault(phase, 0L);
    }

    public double phaseMillis(AnalysisPhase phase) {
        return phaseNanos(phase) / 1_000_000.0;
    }

    public boolean ran(AnalysisPhase phase) {
        return phaseNanos.containsKey(phase);
    }

    public int warningCount(AnalysisPhase phase) {
        return warnings.getOrDefault(phase, 0);
    }

    public long lastAnalysisNanos() {
        return lastAnalysisNanos;
    }

    public int completedRuns() {
        return completedRuns;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %12s | %8s\n", "Phase", "Time (ms)", "Warnings"));
        sb.append("----------------------------------------\n");
        for (AnalysisPhase phase : AnalysisPhase.values()) {
            if (!ran(phase))
                continue;
            sb.append(String.format("%-12s | %12.3f | %8d\n", phase, phaseMillis(phase), warningCount(phase)));
        }
        sb.append(String.format("%-12s | %12.3f |\n", "TOTAL", lastAnalysisNanos / 1_000_000.0));
        return sb.toString();
    }
}
