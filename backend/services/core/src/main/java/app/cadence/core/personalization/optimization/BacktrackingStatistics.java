package app.cadence.core.personalization.optimization;

public record BacktrackingStatistics(
        int totalCheckpoints,
        int oldestCheckpoint,
        int newestCheckpoint,
        double avgAccuracy,
        double avgRetention
) {
    public static final BacktrackingStatistics EMPTY = new BacktrackingStatistics(0, 0, 0, 0, 0);
}
