package app.cadence.core.personalization.optimization;

/**
 * @param progress      0..100
 * @param nextMilestone history size that triggers the next phase
 */
public record OptimizationProgress(
        OptimizationPhase phase,
        double progress,
        int nextMilestone,
        int totalReviews
) {
}
