package app.cadence.core.review.exception;

import app.cadence.core.review.domain.CardMemoryState;
import app.cadence.core.review.domain.Rating;

import java.time.Instant;

/**
 * Unexpected failure inside a scheduling operation, carrying the inputs that triggered it.
 */
public class ComputationException extends FsrsException {

    private final String operation;
    private final transient CardMemoryState card;
    private final Rating rating;
    private final Instant reviewTime;

    public ComputationException(String operation,
                                CardMemoryState card,
                                Rating rating,
                                Instant reviewTime,
                                Throwable cause) {
        super("Failed to " + operation + ": " + cause.getMessage(), "COMPUTATION_ERROR", cause);
        this.operation = operation;
        this.card = card;
        this.rating = rating;
        this.reviewTime = reviewTime;
    }

    public String getOperation() {
        return operation;
    }

    public CardMemoryState getCard() {
        return card;
    }

    public Rating getRating() {
        return rating;
    }

    public Instant getReviewTime() {
        return reviewTime;
    }
}
