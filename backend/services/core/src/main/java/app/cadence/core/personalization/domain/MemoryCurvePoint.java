package app.cadence.core.personalization.domain;

/**
 * Predicted retention, in percent, {@code day} days from now.
 */
public record MemoryCurvePoint(
        int day,
        double fsrsPredicted,
        double actualPredicted,
        double retentionGap,
        ConfidenceInterval confidenceInterval
) {
    public record ConfidenceInterval(double lower, double upper) {
    }
}
