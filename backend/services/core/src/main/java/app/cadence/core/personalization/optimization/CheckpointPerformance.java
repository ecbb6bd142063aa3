package app.cadence.core.personalization.optimization;

import java.time.Instant;

/**
 * @param avgResponseMs mean captured answer time, null when no review carried one
 */
public record CheckpointPerformance(
        double predictionAccuracy,
        double retentionRate,
        Double avgResponseMs,
        int reviewCount,
        Instant measuredAt
) {
    public double stabilityScore() {
        return predictionAccuracy * 0.7 + retentionRate * 0.3;
    }
}
