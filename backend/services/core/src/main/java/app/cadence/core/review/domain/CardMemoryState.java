package app.cadence.core.review.domain;

import java.time.Instant;

/**
 * Scheduling state of one learning item under the FSRS v6 model.
 * <p>
 * Instances are immutable; a review produces a new state through the {@code with*} copies.
 * The two memory factors are {@code null} when the matching model extension is disabled.
 */
public record CardMemoryState(
        String version,
        Instant due,
        double stability,
        double difficulty,
        int elapsedDays,
        int scheduledDays,
        int reps,
        int lapses,
        CardState state,
        Instant lastReview,
        double retrievability,
        Double shortTermMemoryFactor,
        Double longTermStabilityFactor
) {
    public static final String CURRENT_VERSION = "6.1.1";

    public CardMemoryState withSchedule(double stability,
                                        double difficulty,
                                        int scheduledDays,
                                        int lapses,
                                        CardState state) {
        return new CardMemoryState(version, due, stability, difficulty, elapsedDays, scheduledDays, reps, lapses,
                state, lastReview, retrievability, shortTermMemoryFactor, longTermStabilityFactor);
    }

    public CardMemoryState withReviewStart(Instant reviewTime, int elapsedDays) {
        return new CardMemoryState(version, due, stability, difficulty, elapsedDays, scheduledDays, reps + 1, lapses,
                state, reviewTime, retrievability, shortTermMemoryFactor, longTermStabilityFactor);
    }

    public CardMemoryState withDue(Instant due) {
        return new CardMemoryState(version, due, stability, difficulty, elapsedDays, scheduledDays, reps, lapses,
                state, lastReview, retrievability, shortTermMemoryFactor, longTermStabilityFactor);
    }

    public CardMemoryState withMemory(double retrievability,
                                      Double shortTermMemoryFactor,
                                      Double longTermStabilityFactor) {
        return new CardMemoryState(version, due, stability, difficulty, elapsedDays, scheduledDays, reps, lapses,
                state, lastReview, retrievability, shortTermMemoryFactor, longTermStabilityFactor);
    }
}
