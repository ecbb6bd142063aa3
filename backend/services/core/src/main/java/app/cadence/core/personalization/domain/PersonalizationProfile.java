package app.cadence.core.personalization.domain;

public record PersonalizationProfile(
        int historySize,
        double recentAccuracy,
        IntervalPreference intervalPreference,
        double shortTermPerformance,
        double longTermStability,
        double consistencyScore,
        String optimalStudyTime,
        double preferredDifficulty,
        RetentionTrend retentionTrend
) {
}
