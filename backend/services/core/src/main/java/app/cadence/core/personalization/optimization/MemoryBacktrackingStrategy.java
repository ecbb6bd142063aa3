package app.cadence.core.personalization.optimization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keeps the last few weight checkpoints and decides when the optimizer has drifted far enough
 * to fall back to an earlier set of weights.
 */
@Component
public class MemoryBacktrackingStrategy {
    private static final Logger log = LoggerFactory.getLogger(MemoryBacktrackingStrategy.class);

    static final int MAX_CHECKPOINTS = 5;
    static final double PERFORMANCE_THRESHOLD = 0.1;

    private final Clock clock;
    private final TreeMap<Integer, WeightCheckpoint> checkpoints = new TreeMap<>();

    public MemoryBacktrackingStrategy(Clock clock) {
        this.clock = clock;
    }

    public WeightCheckpoint createCheckpoint(int reviewCount, List<Double> weights, CheckpointPerformance performance) {
        WeightCheckpoint checkpoint = new WeightCheckpoint(weights, performance, clock.instant(), reviewCount);
        checkpoints.put(reviewCount, checkpoint);
        log.info("Checkpoint created reviewCount={} accuracy={} retention={}",
                reviewCount, performance.predictionAccuracy(), performance.retentionRate());

        while (checkpoints.size() > MAX_CHECKPOINTS) {
            Map.Entry<Integer, WeightCheckpoint> oldest = checkpoints.pollFirstEntry();
            log.debug("Checkpoint evicted reviewCount={}", oldest.getKey());
        }
        return checkpoint;
    }

    /**
     * Weights to roll back to, if any.
     * <p>
     * Rolls back to the previous checkpoint when prediction accuracy fell by more than 0.1 against it,
     * otherwise to the best-scoring checkpoint when it beats the current score by more than 0.1.
     * Needs at least two checkpoints.
     */
    public Optional<List<Double>> detectAndBacktrack(CheckpointPerformance current) {
        if (checkpoints.size() < 2) {
            log.debug("Not enough checkpoints for backtracking count={}", checkpoints.size());
            return Optional.empty();
        }

        WeightCheckpoint previous = checkpoints.lowerEntry(checkpoints.lastKey()).getValue();
        double drop = previous.performance().predictionAccuracy() - current.predictionAccuracy();
        if (drop > PERFORMANCE_THRESHOLD) {
            log.warn("Prediction accuracy dropped by {}, rolling back to checkpoint reviewCount={}",
                    drop, previous.reviewCount());
            return Optional.of(previous.weights());
        }

        return mostStableCheckpoint(current)
                .filter(best -> best != previous)
                .map(best -> {
                    log.info("Rolling back to more stable checkpoint reviewCount={}", best.reviewCount());
                    return best.weights();
                });
    }

    private Optional<WeightCheckpoint> mostStableCheckpoint(CheckpointPerformance current) {
        return checkpoints.values().stream()
                .max(Comparator.comparingDouble(c -> c.performance().stabilityScore()))
                .filter(best -> best.performance().stabilityScore() > current.stabilityScore() + PERFORMANCE_THRESHOLD);
    }

    /**
     * {@code old * decay + current * (1 - decay)} per weight.
     */
    public List<Double> applyDecay(List<Double> oldWeights, List<Double> currentWeights, double decayFactor) {
        List<Double> out = new ArrayList<>(oldWeights.size());
        for (int i = 0; i < oldWeights.size(); i++) {
            out.add(oldWeights.get(i) * decayFactor + currentWeights.get(i) * (1 - decayFactor));
        }
        return List.copyOf(out);
    }

    /**
     * The larger the drop in stability score, the more the old weights dominate the blend.
     */
    public double adaptiveDecayFactor(CheckpointPerformance old, CheckpointPerformance current) {
        double drop = old.stabilityScore() - current.stabilityScore();
        if (drop > 0.2) return 0.9;
        if (drop > 0.15) return 0.8;
        if (drop > 0.1) return 0.7;
        return 0.5;
    }

    /**
     * Oldest first.
     */
    public List<WeightCheckpoint> history() {
        return List.copyOf(checkpoints.values());
    }

    public void clear() {
        checkpoints.clear();
        log.info("Checkpoints cleared");
    }

    public BacktrackingStatistics statistics() {
        if (checkpoints.isEmpty()) {
            return BacktrackingStatistics.EMPTY;
        }
        return new BacktrackingStatistics(
                checkpoints.size(),
                checkpoints.firstKey(),
                checkpoints.lastKey(),
                checkpoints.values().stream().mapToDouble(c -> c.performance().predictionAccuracy()).average().orElse(0),
                checkpoints.values().stream().mapToDouble(c -> c.performance().retentionRate()).average().orElse(0)
        );
    }
}
