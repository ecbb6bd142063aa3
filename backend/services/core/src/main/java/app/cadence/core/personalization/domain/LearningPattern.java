package app.cadence.core.personalization.domain;

/**
 * @param optimalStudyTime     most frequent review hour, formatted {@code HH:00}
 * @param averageSessionLength minutes
 * @param preferredDifficulty  mean rating code of the history
 * @param consistencyScore     0..1, higher when reviews happen at similar hours
 */
public record LearningPattern(
        String optimalStudyTime,
        double averageSessionLength,
        double preferredDifficulty,
        RetentionTrend retentionTrend,
        double consistencyScore
) {
}
