package app.cadence.core.personalization.optimization;

public enum OptimizationPhase {
    BASELINE,
    PHASE1,
    PHASE2,
    OPTIMIZED
}
