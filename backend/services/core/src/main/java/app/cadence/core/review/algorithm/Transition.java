package app.cadence.core.review.algorithm;

import app.cadence.core.review.domain.CardState;

/**
 * One cell of the scheduling table: how stability is derived, which state follows, and the factor
 * applied to stability before the interval is computed.
 */
public record Transition(
        StabilityRule rule,
        CardState target,
        double intervalMultiplier
) {
    public enum StabilityRule {
        FORGET,
        INITIAL,
        RECALL
    }

    public boolean isLapse() {
        return rule == StabilityRule.FORGET;
    }
}
