package app.cadence.core.personalization;

import app.cadence.core.personalization.domain.InsightPriority;
import app.cadence.core.personalization.domain.InsightType;
import app.cadence.core.personalization.domain.IntervalPreference;
import app.cadence.core.personalization.domain.LearningPattern;
import app.cadence.core.personalization.domain.MemoryCurvePoint;
import app.cadence.core.personalization.domain.PersonalizationProfile;
import app.cadence.core.personalization.domain.PersonalizedInsight;
import app.cadence.core.personalization.domain.RetentionTrend;
import app.cadence.core.review.algorithm.Fsrs6Defaults;
import app.cadence.core.review.algorithm.ParameterStore;
import app.cadence.core.review.domain.CardMemoryState;
import app.cadence.core.review.domain.ReviewLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Adapts the generic model to one learner's review history: personalized weights, predicted
 * retention curves, learning-pattern analytics and insights.
 * <p>
 * Every derived value is recomputed when the history is replaced. Not thread-safe.
 */
@Service
public class PersonalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(PersonalizationEngine.class);

    static final int MIN_HISTORY_FOR_WEIGHTS = 50;
    private static final int RECENT_WINDOW = 100;
    private static final int MIN_HISTORY_FOR_PERSONAL_FACTOR = 20;
    private static final int MIN_HISTORY_FOR_TREND = 20;
    private static final int MIN_HISTORY_FOR_CONSISTENCY = 10;

    private static final long SESSION_GAP_MILLIS = Duration.ofMinutes(30).toMillis();
    private static final double DEFAULT_SESSION_MINUTES = 20;
    private static final double DEFAULT_SESSION_ACCURACY = 80;
    private static final long SLOW_RESPONSE_MS = 15_000;

    private final ParameterStore parameterStore;
    private final ZoneId zone;

    private List<ReviewLogEntry> history = List.of();
    private List<Double> personalizedWeights;
    private PersonalizationProfile profile;

    public PersonalizationEngine(ParameterStore parameterStore, ZoneId zone) {
        this.parameterStore = parameterStore;
        this.zone = zone;
        this.profile = buildProfile();
    }

    public void setHistory(List<ReviewLogEntry> history) {
        this.history = (history == null) ? List.of() : List.copyOf(history);
        this.personalizedWeights = computePersonalizedWeights();
        this.profile = buildProfile();
    }

    public List<ReviewLogEntry> history() {
        return history;
    }

    /**
     * Empty until the history holds at least 50 reviews.
     */
    public Optional<List<Double>> personalizedWeights() {
        return Optional.ofNullable(personalizedWeights);
    }

    public PersonalizationProfile profile() {
        return profile;
    }

    // --- weights ---

    private List<Double> computePersonalizedWeights() {
        if (history.size() < MIN_HISTORY_FOR_WEIGHTS) {
            return null;
        }

        List<Double> base = parameterStore.configured().weights();
        double[] adj = weightAdjustments();

        List<Double> out = new ArrayList<>(base.size());
        for (int i = 0; i < base.size(); i++) {
            double a = (i < adj.length) ? adj[i] : 0.0;
            out.add(base.get(i) * (1 + a));
        }
        log.debug("Personalized weights computed historySize={} adjustments={}", history.size(), Arrays.toString(adj));
        return List.copyOf(out);
    }

    private double[] weightAdjustments() {
        double[] adj = new double[Fsrs6Defaults.PARAMETER_COUNT];

        double recent = recentAccuracy();
        if (recent > 0.9) {
            adj[6] = 0.1;
        } else if (recent < 0.7) {
            adj[6] = -0.1;
        }

        switch (intervalPreference()) {
            case SHORTER -> {
                adj[0] = -0.05;
                adj[1] = -0.03;
            }
            case LONGER -> {
                adj[0] = 0.05;
                adj[1] = 0.03;
            }
            case NORMAL -> {
            }
        }

        if (shortTermPerformance() > 0.85) {
            adj[17] = 0.02;
            adj[18] = 0.01;
        }
        if (longTermStability() > 0.8) {
            adj[19] = 0.015;
            adj[20] = 0.01;
        }
        return adj;
    }

    double recentAccuracy() {
        List<ReviewLogEntry> recent = history.subList(Math.max(0, history.size() - RECENT_WINDOW), history.size());
        return recalledShare(recent, 0.8);
    }

    IntervalPreference intervalPreference() {
        if (history.isEmpty()) return IntervalPreference.NORMAL;

        double avg = history.stream().mapToInt(ReviewLogEntry::elapsedDays).average().orElse(0);
        if (avg < 5) return IntervalPreference.SHORTER;
        if (avg > 15) return IntervalPreference.LONGER;
        return IntervalPreference.NORMAL;
    }

    double shortTermPerformance() {
        List<ReviewLogEntry> shortTerm = history.stream().filter(r -> r.elapsedDays() <= 3).toList();
        return recalledShare(shortTerm, 0.8);
    }

    double longTermStability() {
        List<ReviewLogEntry> longTerm = history.stream().filter(r -> r.elapsedDays() >= 30).toList();
        return recalledShare(longTerm, 0.75);
    }

    // --- memory curve ---

    /**
     * Predicted retention for days 1..{@code days}. Only cards that were reviewed at least once count;
     * without any, a fixed reference curve is returned.
     *
     * @param sessionAccuracy accuracy of the current session in percent; 0 means unknown
     */
    public List<MemoryCurvePoint> generateMemoryCurve(List<CardMemoryState> cards, int days, double sessionAccuracy) {
        List<CardMemoryState> reviewed = (cards == null) ? List.of() : cards.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.reps() > 0)
                .toList();
        if (reviewed.isEmpty()) {
            return defaultCurve(days);
        }

        double avgStability = reviewed.stream().mapToDouble(c -> orDefault(c.stability(), 1)).average().orElse(1);
        double avgDifficulty = reviewed.stream().mapToDouble(c -> orDefault(c.difficulty(), 5)).average().orElse(5);

        double performance = Math.max(orDefault(sessionAccuracy, DEFAULT_SESSION_ACCURACY) / 100, 0.4);
        double difficultyFactor = Math.max(10 - avgDifficulty, 1) / 10;
        double adjustedStability = avgStability * performance * (0.8 + difficultyFactor * 0.2) * personalFactor();

        List<MemoryCurvePoint> out = new ArrayList<>(Math.max(days, 0));
        for (int day = 1; day <= days; day++) {
            double fsrs = Math.exp(-day / avgStability) * 100;
            double actual = Math.exp(-day / adjustedStability) * 100;
            double uncertainty = Math.min(20, 5 + day * 0.5);

            out.add(new MemoryCurvePoint(
                    day,
                    clamp(fsrs, 5, 100),
                    clamp(actual, 8, 100),
                    actual - fsrs,
                    new MemoryCurvePoint.ConfidenceInterval(
                            Math.max(0, actual - uncertainty),
                            Math.min(100, actual + uncertainty))
            ));
        }
        return out;
    }

    private static List<MemoryCurvePoint> defaultCurve(int days) {
        List<MemoryCurvePoint> out = new ArrayList<>(Math.max(days, 0));
        for (int day = 1; day <= days; day++) {
            double fsrs = 85 * Math.exp(-day / 12.0);
            double actual = 88 * Math.exp(-day / 14.0);
            out.add(new MemoryCurvePoint(
                    day,
                    Math.max(5, fsrs),
                    Math.max(8, actual),
                    actual - fsrs,
                    new MemoryCurvePoint.ConfidenceInterval(
                            Math.max(0, actual - 10),
                            Math.min(100, actual + 10))
            ));
        }
        return out;
    }

    double personalFactor() {
        if (history.size() < MIN_HISTORY_FOR_PERSONAL_FACTOR) return 1.0;
        return 0.8 + recentAccuracy() * 0.3 + consistencyScore() * 0.2;
    }

    // --- learning pattern ---

    public LearningPattern analyzeLearningPattern() {
        if (history.isEmpty()) {
            return new LearningPattern("19:00", DEFAULT_SESSION_MINUTES, 5, RetentionTrend.STABLE, 0.5);
        }

        int[] hourCounts = new int[24];
        for (ReviewLogEntry r : history) {
            hourCounts[hourOf(r)]++;
        }
        int optimalHour = 0;
        for (int h = 1; h < hourCounts.length; h++) {
            if (hourCounts[h] > hourCounts[optimalHour]) optimalHour = h;
        }

        double avgSession = sessionLengths().stream().mapToDouble(Double::doubleValue).average().orElse(0);
        if (avgSession == 0) avgSession = DEFAULT_SESSION_MINUTES;

        double preferredDifficulty = history.stream().mapToInt(r -> r.rating().code()).average().orElse(3);

        return new LearningPattern(
                String.format(Locale.ROOT, "%02d:00", optimalHour),
                avgSession,
                preferredDifficulty,
                retentionTrend(),
                consistencyScore()
        );
    }

    // Minutes between first and last review of each run of reviews no more than 30 minutes apart.
    private List<Double> sessionLengths() {
        List<Double> sessions = new ArrayList<>();
        Instant start = null;
        Instant end = null;

        for (ReviewLogEntry r : history) {
            Instant at = r.review();
            if (start == null || at.toEpochMilli() - end.toEpochMilli() > SESSION_GAP_MILLIS) {
                if (start != null) {
                    sessions.add(minutesBetween(start, end));
                }
                start = at;
            }
            end = at;
        }
        if (start != null) {
            sessions.add(minutesBetween(start, end));
        }
        return sessions.isEmpty() ? List.of(DEFAULT_SESSION_MINUTES) : sessions;
    }

    RetentionTrend retentionTrend() {
        if (history.size() < MIN_HISTORY_FOR_TREND) return RetentionTrend.STABLE;

        int half = history.size() / 2;
        double recent = recalledShare(history.subList(history.size() - half, history.size()), 0);
        double earlier = recalledShare(history.subList(0, half), 0);

        double difference = recent - earlier;
        if (difference > 0.05) return RetentionTrend.IMPROVING;
        if (difference < -0.05) return RetentionTrend.DECLINING;
        return RetentionTrend.STABLE;
    }

    double consistencyScore() {
        if (history.size() < MIN_HISTORY_FOR_CONSISTENCY) return 0.5;

        double mean = history.stream().mapToInt(this::hourOf).average().orElse(0);
        double variance = history.stream()
                .mapToDouble(r -> Math.pow(hourOf(r) - mean, 2))
                .average()
                .orElse(0);
        return Math.max(0, 1 - variance / 24);
    }

    // --- insights ---

    /**
     * Insights ordered from high to low priority. An empty history yields two generic habit insights.
     */
    public List<PersonalizedInsight> generatePersonalizedInsights(List<CardMemoryState> cards, double sessionAccuracy) {
        if (history.isEmpty()) {
            return defaultInsights();
        }

        List<PersonalizedInsight> insights = new ArrayList<>();
        performanceInsight().ifPresent(insights::add);
        scheduleInsight().ifPresent(insights::add);
        difficultyInsight(cards).ifPresent(insights::add);
        responseTimeInsight().ifPresent(insights::add);

        insights.sort(Comparator.comparingInt((PersonalizedInsight i) -> i.priority().weight()).reversed());
        return insights;
    }

    private Optional<PersonalizedInsight> performanceInsight() {
        double recent = recentAccuracy();
        if (recent < 0.7) {
            return Optional.of(new PersonalizedInsight(
                    InsightType.PERFORMANCE,
                    InsightPriority.HIGH,
                    "Retention needs attention",
                    String.format(Locale.ROOT, "Recent accuracy is %.1f%%, consider adjusting your study strategy", recent * 100),
                    true,
                    "15-20% better retention",
                    0.85
            ));
        }
        if (recent > 0.9) {
            return Optional.of(new PersonalizedInsight(
                    InsightType.PERFORMANCE,
                    InsightPriority.MEDIUM,
                    "Strong performance",
                    String.format(Locale.ROOT, "Accuracy reached %.1f%%, you can take on harder material", recent * 100),
                    true,
                    "20% more efficient study",
                    0.9
            ));
        }
        return Optional.empty();
    }

    private Optional<PersonalizedInsight> scheduleInsight() {
        LearningPattern pattern = analyzeLearningPattern();
        if (pattern.consistencyScore() >= 0.6) {
            return Optional.empty();
        }
        return Optional.of(new PersonalizedInsight(
                InsightType.SCHEDULE,
                InsightPriority.MEDIUM,
                "Build a regular study time",
                "Review times vary a lot, try studying around " + pattern.optimalStudyTime() + " every day",
                true,
                "25% better memory effect",
                0.75
        ));
    }

    private static Optional<PersonalizedInsight> difficultyInsight(List<CardMemoryState> cards) {
        if (cards == null || cards.isEmpty()) {
            return Optional.empty();
        }
        double avgDifficulty = cards.stream()
                .filter(Objects::nonNull)
                .mapToDouble(c -> orDefault(c.difficulty(), 5))
                .average()
                .orElse(5);
        if (avgDifficulty <= 7) {
            return Optional.empty();
        }
        return Optional.of(new PersonalizedInsight(
                InsightType.DIFFICULTY,
                InsightPriority.MEDIUM,
                "Material is difficult",
                "The average card difficulty is high, consider lowering the daily workload",
                true,
                "Less pressure and better continuity",
                0.8
        ));
    }

    private Optional<PersonalizedInsight> responseTimeInsight() {
        IntSummaryStatistics captured = history.stream()
                .map(ReviewLogEntry::responseMs)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .summaryStatistics();
        if (captured.getCount() == 0 || captured.getAverage() <= SLOW_RESPONSE_MS) {
            return Optional.empty();
        }
        return Optional.of(new PersonalizedInsight(
                InsightType.METHOD,
                InsightPriority.LOW,
                "Speed up recall",
                String.format(Locale.ROOT, "Average answer time is %.1f s, practice quick recall drills", captured.getAverage() / 1000),
                true,
                "30% faster responses",
                0.7
        ));
    }

    private static List<PersonalizedInsight> defaultInsights() {
        return List.of(
                new PersonalizedInsight(
                        InsightType.SCHEDULE,
                        InsightPriority.MEDIUM,
                        "Build a study habit",
                        "Review at a fixed time every day",
                        true,
                        "20% better retention",
                        0.8
                ),
                new PersonalizedInsight(
                        InsightType.METHOD,
                        InsightPriority.LOW,
                        "Try active recall",
                        "Try to recall the answer before revealing it",
                        true,
                        "15% more efficient study",
                        0.7
                )
        );
    }

    // --- helpers ---

    private PersonalizationProfile buildProfile() {
        LearningPattern pattern = analyzeLearningPattern();
        return new PersonalizationProfile(
                history.size(),
                recentAccuracy(),
                intervalPreference(),
                shortTermPerformance(),
                longTermStability(),
                pattern.consistencyScore(),
                pattern.optimalStudyTime(),
                pattern.preferredDifficulty(),
                pattern.retentionTrend()
        );
    }

    private int hourOf(ReviewLogEntry r) {
        return r.review().atZone(zone).getHour();
    }

    private static double recalledShare(List<ReviewLogEntry> reviews, double whenEmpty) {
        if (reviews.isEmpty()) return whenEmpty;
        long recalled = reviews.stream().filter(r -> r.rating().isRecalled()).count();
        return (double) recalled / reviews.size();
    }

    private static double minutesBetween(Instant from, Instant to) {
        return (to.toEpochMilli() - from.toEpochMilli()) / 60_000.0;
    }

    // zero and NaN stand for "unknown"
    private static double orDefault(double value, double fallback) {
        return (value == 0 || Double.isNaN(value)) ? fallback : value;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
