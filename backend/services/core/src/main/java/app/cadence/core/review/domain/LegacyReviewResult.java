package app.cadence.core.review.domain;

public record LegacyReviewResult(
        LegacyCard card,
        ReviewLogEntry log
) {
}
