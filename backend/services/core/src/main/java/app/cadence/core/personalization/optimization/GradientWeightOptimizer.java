package app.cadence.core.personalization.optimization;

import app.cadence.core.review.algorithm.Fsrs6Defaults;
import app.cadence.core.review.algorithm.ParameterRanges;
import app.cadence.core.review.domain.ReviewLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Small-step numerical gradient descent over the weight vector, scored by the squared error
 * between predicted retention and actual recall.
 * <p>
 * The retention prediction reads only {@code w17}, so every other gradient is zero. Both phases
 * therefore move {@code w17} alone and return the other weights unchanged, apart from clamping.
 */
@Component
public class GradientWeightOptimizer {
    private static final Logger log = LoggerFactory.getLogger(GradientWeightOptimizer.class);

    static final int MIN_DATA_POINTS = 50;
    static final double LEARNING_RATE = 0.05;
    static final double PHASE2_LEARNING_RATE = LEARNING_RATE * 0.8;
    static final int PHASE2_MAX_ITERATIONS = 10;
    static final int EARLY_STOPPING_PATIENCE = 3;
    static final double MIN_PHASE1_IMPROVEMENT = 0.05;
    static final List<Integer> CRITICAL_INDICES = List.of(0, 1, 2, 3, 17, 18, 19, 20);

    private static final double EPSILON = 0.01;

    private final Clock clock;

    public GradientWeightOptimizer(Clock clock) {
        this.clock = clock;
    }

    public BaselineMetrics collectBaseline(List<ReviewLogEntry> history) {
        if (history == null || history.size() < MIN_DATA_POINTS) {
            throw new IllegalArgumentException("At least " + MIN_DATA_POINTS + " reviews are required to establish a baseline");
        }

        BaselineMetrics baseline = new BaselineMetrics(
                predictionAccuracy(history),
                avgInterval(history),
                retentionRate(history),
                clock.instant()
        );
        log.info("Optimizer baseline collected accuracy={} avgInterval={} retention={}",
                baseline.accuracy(), baseline.avgInterval(), baseline.retentionRate());
        return baseline;
    }

    /**
     * Adjusts only the initial-stability and short/long-term weights, starting from the defaults.
     * The result is kept only when it lowers the loss by more than 5%; otherwise the defaults come back.
     */
    public List<Double> optimizePhase1(List<ReviewLogEntry> history) {
        List<Double> defaults = Fsrs6Defaults.WEIGHTS;
        double[] w = toArray(defaults);

        for (int idx : CRITICAL_INDICES) {
            double gradient = gradient(history, w, idx);
            w[idx] = ParameterRanges.clamp(idx, w[idx] + LEARNING_RATE * gradient);
        }

        double improvement = improvement(history, toArray(defaults), w);
        if (improvement > MIN_PHASE1_IMPROVEMENT) {
            log.info("Phase 1 optimization kept improvement={}", improvement);
            return toList(w);
        }
        log.info("Phase 1 optimization discarded improvement={}, keeping default weights", improvement);
        return defaults;
    }

    /**
     * Descent over all indices from {@code start}, at most 10 iterations with early stopping after
     * 3 iterations without a lower loss. Returns the best weights seen. Only {@code w17} can change.
     */
    public List<Double> optimizePhase2(List<ReviewLogEntry> history, List<Double> start) {
        double[] w = toArray(start);
        double[] best = w.clone();
        double bestLoss = loss(history, w);
        int noImprovement = 0;

        for (int iteration = 0; iteration < PHASE2_MAX_ITERATIONS; iteration++) {
            double[] gradients = new double[w.length];
            for (int i = 0; i < w.length; i++) {
                gradients[i] = gradient(history, w, i);
            }
            for (int i = 0; i < w.length; i++) {
                w[i] = ParameterRanges.clamp(i, w[i] + PHASE2_LEARNING_RATE * gradients[i]);
            }

            double current = loss(history, w);
            if (current < bestLoss) {
                bestLoss = current;
                best = w.clone();
                noImprovement = 0;
                log.debug("Phase 2 iteration={} loss={}", iteration + 1, current);
            } else {
                noImprovement++;
            }
            if (noImprovement >= EARLY_STOPPING_PATIENCE) {
                log.debug("Phase 2 early stop at iteration={}", iteration + 1);
                break;
            }
        }

        log.info("Phase 2 optimization finished loss={}", bestLoss);
        return toList(best);
    }

    /**
     * Mean squared error between predicted retention and recall (rating Good or Easy).
     */
    public double loss(List<ReviewLogEntry> history, List<Double> weights) {
        return loss(history, toArray(weights));
    }

    static double predictRetention(ReviewLogEntry review, double w17) {
        double stability = (review.stability() > 0) ? review.stability() : 1;
        double retention = Math.exp(-review.elapsedDays() / stability);
        double adjustment = 1 + w17 * 0.1;
        return Math.max(0, Math.min(1, retention * adjustment));
    }

    private double loss(List<ReviewLogEntry> history, double[] w) {
        if (history.isEmpty()) return 0;

        double total = 0;
        for (ReviewLogEntry review : history) {
            double predicted = predictRetention(review, w[17]);
            double actual = review.rating().isRecalled() ? 1 : 0;
            total += Math.pow(predicted - actual, 2);
        }
        return total / history.size();
    }

    // Central difference, sign flipped so that adding it descends the loss.
    private double gradient(List<ReviewLogEntry> history, double[] w, int index) {
        double[] plus = w.clone();
        plus[index] += EPSILON;
        double[] minus = w.clone();
        minus[index] -= EPSILON;
        return -(loss(history, plus) - loss(history, minus)) / (2 * EPSILON);
    }

    private double improvement(List<ReviewLogEntry> history, double[] before, double[] after) {
        double oldLoss = loss(history, before);
        if (oldLoss <= 0) return 0;
        return (oldLoss - loss(history, after)) / oldLoss;
    }

    private static double predictionAccuracy(List<ReviewLogEntry> history) {
        double w17 = Fsrs6Defaults.WEIGHTS.get(17);
        long correct = history.stream()
                .filter(r -> Math.round(predictRetention(r, w17)) == (r.rating().isRecalled() ? 1 : 0))
                .count();
        return (double) correct / history.size();
    }

    private static double avgInterval(List<ReviewLogEntry> history) {
        return history.stream()
                .mapToInt(ReviewLogEntry::scheduledDays)
                .filter(d -> d > 0)
                .average()
                .orElse(0);
    }

    private static double retentionRate(List<ReviewLogEntry> history) {
        long recalled = history.stream().filter(r -> r.rating().isRecalled()).count();
        return (double) recalled / history.size();
    }

    private static double[] toArray(List<Double> weights) {
        double[] out = new double[weights.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = weights.get(i);
        }
        return out;
    }

    private static List<Double> toList(double[] weights) {
        List<Double> out = new ArrayList<>(weights.length);
        for (double w : weights) {
            out.add(w);
        }
        return List.copyOf(out);
    }
}
