package app.cadence.core.personalization.optimization;

import app.cadence.core.review.algorithm.Fsrs6Defaults;
import app.cadence.core.review.domain.ReviewLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Walks a learner through progressive optimization as their history grows:
 * baseline at 50 reviews, phase 1 at 100, phase 2 at 200, then optimized.
 * Checkpoints are taken every 50 reviews and the applied weights are rolled back when the fit degrades.
 * <p>
 * Callers read {@link #optimizedWeights()} and hand them to the scheduler. Not thread-safe.
 */
@Service
public class PersonalizationManager {
    private static final Logger log = LoggerFactory.getLogger(PersonalizationManager.class);

    static final int BASELINE_MILESTONE = 50;
    static final int PHASE1_MILESTONE = 100;
    static final int PHASE2_MILESTONE = 200;
    static final int CHECKPOINT_INTERVAL = 50;
    static final int PERFORMANCE_WINDOW = 50;
    private static final double FALLBACK_DECAY = 0.8;

    private final GradientWeightOptimizer optimizer;
    private final MemoryBacktrackingStrategy backtracking;
    private final Clock clock;

    private OptimizationPhase phase = OptimizationPhase.BASELINE;
    private BaselineMetrics baseline;
    private List<Double> phase1Weights;
    private List<Double> appliedWeights;
    private int totalReviews;
    private int lastCheckpointReviewCount;

    public PersonalizationManager(GradientWeightOptimizer optimizer,
                                  MemoryBacktrackingStrategy backtracking,
                                  Clock clock) {
        this.optimizer = optimizer;
        this.backtracking = backtracking;
        this.clock = clock;
    }

    /**
     * Feeds the full history after a review. A single call may advance through several phases
     * when the history already passes their milestones.
     */
    public OptimizationProgress updateAfterReview(List<ReviewLogEntry> allHistory) {
        List<ReviewLogEntry> history = (allHistory == null) ? List.of() : allHistory;
        int count = history.size();
        totalReviews = count;

        if (phase == OptimizationPhase.BASELINE && count >= BASELINE_MILESTONE) {
            baseline = optimizer.collectBaseline(history);
            moveTo(OptimizationPhase.PHASE1);
        }
        if (phase == OptimizationPhase.PHASE1 && count >= PHASE1_MILESTONE) {
            phase1Weights = optimizer.optimizePhase1(history);
            appliedWeights = phase1Weights;
            moveTo(OptimizationPhase.PHASE2);
        }
        if (phase == OptimizationPhase.PHASE2 && count >= PHASE2_MILESTONE) {
            List<Double> start = (phase1Weights != null) ? phase1Weights : currentWeights();
            appliedWeights = optimizer.optimizePhase2(history, start);
            moveTo(OptimizationPhase.OPTIMIZED);
        }

        if (count - lastCheckpointReviewCount >= CHECKPOINT_INTERVAL) {
            backtracking.createCheckpoint(count, currentWeights(), measurePerformance(history));
            lastCheckpointReviewCount = count;
        }

        CheckpointPerformance current = measurePerformance(history);
        backtracking.detectAndBacktrack(current).ifPresent(weights -> rollBack(weights, current));

        return progress();
    }

    public OptimizationPhase phase() {
        return phase;
    }

    public Optional<BaselineMetrics> baseline() {
        return Optional.ofNullable(baseline);
    }

    /**
     * Weights produced by the optimizer, empty while still collecting the baseline.
     */
    public Optional<List<Double>> optimizedWeights() {
        return Optional.ofNullable(appliedWeights);
    }

    public OptimizationProgress progress() {
        double progress;
        int nextMilestone;
        switch (phase) {
            case BASELINE -> {
                progress = fraction(totalReviews, BASELINE_MILESTONE) * 25;
                nextMilestone = BASELINE_MILESTONE;
            }
            case PHASE1 -> {
                progress = 25 + fraction(totalReviews - BASELINE_MILESTONE, PHASE1_MILESTONE - BASELINE_MILESTONE) * 25;
                nextMilestone = PHASE1_MILESTONE;
            }
            case PHASE2 -> {
                progress = 50 + fraction(totalReviews - PHASE1_MILESTONE, PHASE2_MILESTONE - PHASE1_MILESTONE) * 25;
                nextMilestone = PHASE2_MILESTONE;
            }
            default -> {
                progress = 100;
                nextMilestone = PHASE2_MILESTONE;
            }
        }
        return new OptimizationProgress(phase, progress, nextMilestone, totalReviews);
    }

    public BacktrackingStatistics backtrackingStatistics() {
        return backtracking.statistics();
    }

    public void reset() {
        phase = OptimizationPhase.BASELINE;
        baseline = null;
        phase1Weights = null;
        appliedWeights = null;
        totalReviews = 0;
        lastCheckpointReviewCount = 0;
        backtracking.clear();
        log.info("Personalization reset");
    }

    CheckpointPerformance measurePerformance(List<ReviewLogEntry> history) {
        List<ReviewLogEntry> recent = history.subList(Math.max(0, history.size() - PERFORMANCE_WINDOW), history.size());
        if (recent.isEmpty()) {
            return new CheckpointPerformance(0, 0, null, history.size(), clock.instant());
        }

        long correct = 0;
        long recalled = 0;
        for (ReviewLogEntry r : recent) {
            double stability = (r.stability() > 0) ? r.stability() : 1;
            double predicted = Math.exp(-r.elapsedDays() / stability);
            boolean actual = r.rating().isRecalled();
            if ((predicted > 0.5 && actual) || (predicted <= 0.5 && !actual)) correct++;
            if (actual) recalled++;
        }

        OptionalDouble avgResponse = recent.stream()
                .map(ReviewLogEntry::responseMs)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average();

        return new CheckpointPerformance(
                (double) correct / recent.size(),
                (double) recalled / recent.size(),
                avgResponse.isPresent() ? avgResponse.getAsDouble() : null,
                history.size(),
                clock.instant()
        );
    }

    private void rollBack(List<Double> checkpointWeights, CheckpointPerformance current) {
        List<WeightCheckpoint> checkpoints = backtracking.history();
        double decay = checkpoints.isEmpty()
                ? FALLBACK_DECAY
                : backtracking.adaptiveDecayFactor(checkpoints.get(checkpoints.size() - 1).performance(), current);

        appliedWeights = backtracking.applyDecay(checkpointWeights, currentWeights(), decay);
        log.warn("Optimized weights rolled back decayFactor={}", decay);
    }

    private List<Double> currentWeights() {
        return (appliedWeights != null) ? appliedWeights : Fsrs6Defaults.WEIGHTS;
    }

    private void moveTo(OptimizationPhase next) {
        log.info("Personalization phase {} -> {} totalReviews={}", phase, next, totalReviews);
        phase = next;
    }

    private static double fraction(int part, int whole) {
        return Math.max(0, Math.min((double) part / whole, 1));
    }
}
