package app.cadence.core.review.algorithm;

import app.cadence.core.review.domain.Rating;

/**
 * FSRS v6.1.1 update rules. Every method is a pure function of its arguments.
 * <p>
 * Stability is measured in days, difficulty lives in {@code [1, 10]}, and retrievability follows the
 * exponential forgetting curve {@code R = exp(-t / S)}.
 */
public final class MemoryModel {

    public static final double MIN_STABILITY = 0.01;
    public static final double MIN_INITIAL_STABILITY = 0.1;
    public static final double MIN_FACTOR = 0.5;
    public static final double MAX_FACTOR = 2.0;

    static final int SHORT_TERM_WINDOW_DAYS = 3;
    static final int LONG_TERM_THRESHOLD_DAYS = 30;
    static final double FUZZ_MIN_DAYS = 2.5;

    private MemoryModel() {
    }

    /**
     * {@code clamp(w4 - 3 * w5, 1, 10)}.
     */
    public static double initialDifficulty(ModelParameters p) {
        return clamp(p.w(4) - 3 * p.w(5), 1.0, 10.0);
    }

    /**
     * Moves difficulty against the rating ({@code -w6 * (G - 3)}) and reverts it towards the initial
     * difficulty with weight {@code w4}.
     */
    public static double nextDifficulty(double difficulty, Rating rating, ModelParameters p) {
        double delta = -p.w(6) * (rating.code() - 3);
        double meanReversion = p.w(4) * (initialDifficulty(p) - difficulty);
        return clamp(difficulty + delta + meanReversion, 1.0, 10.0);
    }

    public static double initialStability(Rating rating, ModelParameters p) {
        return Math.max(p.w(rating.code() - 1), MIN_INITIAL_STABILITY);
    }

    /**
     * Stability after a lapse; only used for {@link Rating#AGAIN}.
     */
    public static double forgetStability(double stability, double difficulty, int elapsedDays, ModelParameters p) {
        double dr = Math.exp(p.w(11) * (difficulty - p.w(4)));
        double dsf = Math.pow(stability, p.w(12)) * Math.pow(Math.max(elapsedDays, 1), p.w(13));
        return Math.max(p.w(10) * dsf * dr, MIN_STABILITY);
    }

    /**
     * Stability after a successful recall, including the short-term boost for reviews within three days
     * and the long-term boost for reviews after thirty days when those extensions are enabled.
     */
    public static double recallStability(double stability, int elapsedDays, Rating rating, ModelParameters p) {
        double hardPenalty = rating == Rating.HARD ? p.w(15) : 1.0;
        double easyBonus = rating == Rating.EASY ? p.w(16) : 1.0;

        double r = retrievability(elapsedDays, stability);
        double successRecall = Math.exp(p.w(8) * (rating.code() - 3 + p.w(9) * (1 - r)));

        double next = stability * successRecall * hardPenalty * easyBonus;

        if (p.shortTermMemoryEnabled() && elapsedDays <= SHORT_TERM_WINDOW_DAYS) {
            next *= 1 + p.w(17) * Math.exp(-p.w(18) * elapsedDays);
        }
        if (p.longTermStabilityEnabled() && elapsedDays >= LONG_TERM_THRESHOLD_DAYS) {
            next *= 1 + p.w(19) * Math.log(1 + p.w(20) * elapsedDays / 30.0);
        }

        return Math.max(next, MIN_STABILITY);
    }

    /**
     * {@code exp(-elapsedDays / stability)}, or 1 when nothing has elapsed or stability is not positive.
     */
    public static double retrievability(double elapsedDays, double stability) {
        if (elapsedDays <= 0 || stability <= 0) return 1.0;
        return Math.exp(-elapsedDays / stability);
    }

    /**
     * Days until the next review, in {@code [1, maximumInterval]}.
     */
    public static int nextIntervalDays(double stability, double requestRetention, double maximumInterval) {
        long base = Math.max(1, Math.round(stability));
        double request = clamp(requestRetention, Fsrs6Defaults.MIN_REQUEST_RETENTION, Fsrs6Defaults.MAX_REQUEST_RETENTION);

        double scaling = Math.log(request) / Math.log(0.9);
        long interval = Math.max(1, Math.round(base * Math.abs(scaling)));

        return (int) Math.max(1, Math.min(interval, (long) Math.floor(maximumInterval)));
    }

    public static int nextIntervalDays(double stability, ModelParameters p) {
        return nextIntervalDays(stability, p.requestRetention(), p.maximumInterval());
    }

    /**
     * Random day offset added to a due date: zero below 2.5 scheduled days, otherwise
     * {@code round(u * min(0.05 * scheduledDays, 1))} with {@code u} drawn from the fuzz source.
     */
    public static long fuzzDays(int scheduledDays, FuzzSource source) {
        if (scheduledDays < FUZZ_MIN_DAYS) return 0;
        double range = Math.min(0.05 * scheduledDays, 1.0);
        return Math.round(source.nextSigned() * range);
    }

    /**
     * Nudges the short-term factor by {@code +/-w17} for reviews within three days.
     */
    public static double shortTermFactor(Double current, int elapsedDays, Rating rating, ModelParameters p) {
        double base = baseFactor(current);
        if (elapsedDays > SHORT_TERM_WINDOW_DAYS) return base;
        double improvement = rating.isRecalled() ? p.w(17) : -p.w(17);
        return clamp(base + improvement, MIN_FACTOR, MAX_FACTOR);
    }

    /**
     * Nudges the long-term factor by {@code +/-w19} for reviews after thirty days or more.
     */
    public static double longTermFactor(Double current, int elapsedDays, Rating rating, ModelParameters p) {
        double base = baseFactor(current);
        if (elapsedDays < LONG_TERM_THRESHOLD_DAYS) return base;
        double improvement = rating.isRecalled() ? p.w(19) : -p.w(19);
        return clamp(base + improvement, MIN_FACTOR, MAX_FACTOR);
    }

    private static double baseFactor(Double current) {
        return (current == null || current == 0.0 || current.isNaN()) ? 1.0 : current;
    }

    static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
