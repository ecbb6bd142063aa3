package app.cadence.core.personalization.domain;

public enum InsightType {
    PERFORMANCE,
    SCHEDULE,
    DIFFICULTY,
    METHOD
}
