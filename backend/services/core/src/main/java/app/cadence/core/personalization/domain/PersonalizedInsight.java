package app.cadence.core.personalization.domain;

public record PersonalizedInsight(
        InsightType type,
        InsightPriority priority,
        String title,
        String description,
        boolean actionable,
        String expectedImprovement,
        double confidence
) {
}
