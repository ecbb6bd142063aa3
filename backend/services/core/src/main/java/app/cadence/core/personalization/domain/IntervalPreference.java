package app.cadence.core.personalization.domain;

public enum IntervalPreference {
    SHORTER,
    NORMAL,
    LONGER
}
