package app.cadence.core.personalization.domain;

public enum InsightPriority {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    InsightPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
