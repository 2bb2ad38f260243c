package com.risk.fta.util;

import com.risk.fta.api.AnalysisListener;
import com.risk.fta.api.AnalysisPhase;

import java.util.Arrays;

/**
 * The single listener an analysis talks to, forwarding every phase callback
 * to the listeners registered with it.
 *
 * Listeners are called in registration order on the analysing thread.
 * Registration replaces the backing array, so listeners should be registered
 * before {@link com.risk.fta.FaultTreeAnalysis#analyze()} runs; a callback in
 * progress keeps iterating the array it started with. An exception thrown by
 * a listener is not caught here; it skips the remaining listeners and
 * propagates out of the analysis.
 */
public class CompositeAnalysisListener implements AnalysisListener {
    private AnalysisListener[] listeners = new AnalysisListener[0];

    /** Adds a listener after the ones already registered. */
    public void register(AnalysisListener listener) {
        AnalysisListener[] old = listeners;
        AnalysisListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onAnalysisStart(String treeName) {
        for (AnalysisListener l : listeners)
            l.onAnalysisStart(treeName);
    }

    @Override
    public void onPhaseComplete(AnalysisPhase phase, long durationNanos) {
        for (AnalysisListener l : listeners)
            l.onPhaseComplete(phase, durationNanos);
    }

    @Override
    public void onWarning(AnalysisPhase phase, String message) {
        for (AnalysisListener l : listeners)
            l.onWarning(phase, message);
    }

    @Override
    public void onAnalysisError(AnalysisPhase phase, Throwable error) {
        for (AnalysisListener l : listeners)
            l.onAnalysisError(phase, error);
    }

    @Override
    public void onAnalysisEnd(String treeName) {
        for (AnalysisListener l : listeners)
            l.onAnalysisEnd(treeName);
    }
}
