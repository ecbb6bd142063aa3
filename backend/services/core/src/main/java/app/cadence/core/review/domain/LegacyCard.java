package app.cadence.core.review.domain;

import java.time.Instant;

/**
 * Card shape of the pre-v6 scheduler API: no version tag and no memory factors.
 */
public record LegacyCard(
        Instant due,
        double stability,
        double difficulty,
        int elapsedDays,
        int scheduledDays,
        int reps,
        int lapses,
        CardState state,
        Instant lastReview,
        double retrievability
) {
}
