package com.risk.fta.api;

/** The stages of a fault tree analysis run, in execution order. */
public enum AnalysisPhase {
    VALIDATION,
    CUT_SETS,
    PROBABILITY,
    IMPORTANCE,
    UNCERTAINTY
}
