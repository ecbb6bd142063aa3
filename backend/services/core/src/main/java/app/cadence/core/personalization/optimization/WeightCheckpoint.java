package app.cadence.core.personalization.optimization;

import java.time.Instant;
import java.util.List;

public record WeightCheckpoint(
        List<Double> weights,
        CheckpointPerformance performance,
        Instant createdAt,
        int reviewCount
) {
    public WeightCheckpoint {
        weights = List.copyOf(weights);
    }
}
