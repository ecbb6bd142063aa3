package app.cadence.core.personalization.domain;

public enum RetentionTrend {
    IMPROVING,
    STABLE,
    DECLINING
}
