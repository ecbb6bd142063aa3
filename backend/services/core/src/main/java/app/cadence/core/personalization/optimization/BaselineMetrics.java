package app.cadence.core.personalization.optimization;

import java.time.Instant;

/**
 * Snapshot of how well the default model fits a history before any optimization.
 */
public record BaselineMetrics(
        double accuracy,
        double avgInterval,
        double retentionRate,
        Instant collectedAt
) {
}
