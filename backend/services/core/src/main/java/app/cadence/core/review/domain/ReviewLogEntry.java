package app.cadence.core.review.domain;

import java.time.Instant;

/**
 * One review as seen before it was applied: the rating plus the card's pre-review values.
 * {@code elapsedDays} is the gap since the previous review, {@code lastElapsedDays} the gap the
 * card carried into this review. {@code responseMs} is null unless the caller captured it.
 */
public record ReviewLogEntry(
        Rating rating,
        CardState state,
        Instant due,
        double stability,
        double difficulty,
        int elapsedDays,
        int lastElapsedDays,
        int scheduledDays,
        Instant review,
        Integer responseMs
) {
}
