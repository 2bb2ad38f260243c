package com.risk.fta.api;

/**
 * Observability interface for monitoring a fault tree analysis run.
 *
 * Implementations can be registered with the analysis to receive callbacks
 * as the run moves through its phases. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long each phase takes.
 * - Diagnostics: Surfacing truncation and approximation warnings to callers
 * that would otherwise only see them in the final result.
 *
 * Callbacks are invoked on the analysis thread. Implementations should not
 * block.
 */
public interface AnalysisListener {

    /**
     * Called before the first phase starts.
     *
     * @param treeName The name of the analyzed fault tree.
     */
    void onAnalysisStart(String treeName);

    /**
     * Called after a phase has finished successfully.
     *
     * @param phase         The completed phase.
     * @param durationNanos Wall-clock time spent in the phase.
     */
    void onPhaseComplete(AnalysisPhase phase, long durationNanos);

    /**
     * Called for every warning about truncation, approximations or settings.
     *
     * @param phase   The phase that produced the warning.
     * @param message Human-readable warning.
     */
    void onWarning(AnalysisPhase phase, String message);

    /**
     * Called when a phase fails. The error is rethrown to the caller after all
     * listeners have been notified.
     *
     * @param phase The failing phase.
     * @param error The exception that occurred.
     */
    void onAnalysisError(AnalysisPhase phase, Throwable error);

    /**
     * Called when the run has completed.
     *
     * @param treeName The name of the analyzed fault tree.
     */
    void onAnalysisEnd(String treeName);
}
