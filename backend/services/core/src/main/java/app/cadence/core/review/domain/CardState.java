package app.cadence.core.review.domain;

public enum CardState {
    NEW, LEARNING, REVIEW, RELEARNING
}
