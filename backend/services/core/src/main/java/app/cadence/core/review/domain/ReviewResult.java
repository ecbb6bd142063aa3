package app.cadence.core.review.domain;

public record ReviewResult(
        CardMemoryState card,
        ReviewLogEntry log
) {
}
