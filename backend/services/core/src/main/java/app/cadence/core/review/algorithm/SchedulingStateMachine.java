package app.cadence.core.review.algorithm;

import app.cadence.core.review.domain.CardMemoryState;
import app.cadence.core.review.domain.CardState;
import app.cadence.core.review.domain.Rating;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps (state, rating) to the next scheduling state through an explicit transition table.
 */
public final class SchedulingStateMachine {

    static final double HARD_INTERVAL_FACTOR = 0.85;
    static final double EASY_INTERVAL_FACTOR = 1.15;

    private static final Map<CardState, Map<Rating, Transition>> TABLE = buildTable();

    private SchedulingStateMachine() {
    }

    public static Transition transition(CardState state, Rating rating) {
        return TABLE.get(state).get(rating);
    }

    public static Map<CardState, Map<Rating, Transition>> table() {
        return TABLE;
    }

    /**
     * Applies one review to a card whose {@code elapsedDays}, {@code reps} and {@code lastReview} already
     * reflect this review. Stability and difficulty are read from the pre-review card; the due date is
     * left to the caller.
     */
    public static CardMemoryState apply(CardMemoryState card, Rating rating, ModelParameters p) {
        Transition t = transition(card.state(), rating);

        double difficulty = MemoryModel.nextDifficulty(card.difficulty(), rating, p);
        double stability = switch (t.rule()) {
            case FORGET -> MemoryModel.forgetStability(card.stability(), card.difficulty(), card.elapsedDays(), p);
            case INITIAL -> MemoryModel.initialStability(rating, p);
            case RECALL -> MemoryModel.recallStability(card.stability(), card.elapsedDays(), rating, p);
        };
        int scheduledDays = t.isLapse()
                ? 0
                : MemoryModel.nextIntervalDays(stability * t.intervalMultiplier(), p);
        int lapses = t.isLapse() ? card.lapses() + 1 : card.lapses();

        CardMemoryState next = card.withSchedule(stability, difficulty, scheduledDays, lapses, t.target());

        double retrievability = MemoryModel.retrievability(next.elapsedDays(), next.stability());
        Double shortTerm = p.shortTermMemoryEnabled()
                ? MemoryModel.shortTermFactor(card.shortTermMemoryFactor(), card.elapsedDays(), rating, p)
                : card.shortTermMemoryFactor();
        Double longTerm = p.longTermStabilityEnabled()
                ? MemoryModel.longTermFactor(card.longTermStabilityFactor(), card.elapsedDays(), rating, p)
                : card.longTermStabilityFactor();

        return next.withMemory(retrievability, shortTerm, longTerm);
    }

    private static Map<CardState, Map<Rating, Transition>> buildTable() {
        Map<CardState, Map<Rating, Transition>> table = new EnumMap<>(CardState.class);

        Map<Rating, Transition> fromNew = new EnumMap<>(Rating.class);
        fromNew.put(Rating.AGAIN, new Transition(Transition.StabilityRule.FORGET, CardState.LEARNING, 0));
        fromNew.put(Rating.HARD, new Transition(Transition.StabilityRule.INITIAL, CardState.LEARNING, 1.0));
        fromNew.put(Rating.GOOD, new Transition(Transition.StabilityRule.INITIAL, CardState.REVIEW, 1.0));
        fromNew.put(Rating.EASY, new Transition(Transition.StabilityRule.INITIAL, CardState.REVIEW, 1.0));
        table.put(CardState.NEW, Collections.unmodifiableMap(fromNew));

        for (CardState state : new CardState[]{CardState.LEARNING, CardState.REVIEW, CardState.RELEARNING}) {
            Map<Rating, Transition> row = new EnumMap<>(Rating.class);
            row.put(Rating.AGAIN, new Transition(Transition.StabilityRule.FORGET, CardState.RELEARNING, 0));
            row.put(Rating.HARD, new Transition(Transition.StabilityRule.RECALL, CardState.REVIEW, HARD_INTERVAL_FACTOR));
            row.put(Rating.GOOD, new Transition(Transition.StabilityRule.RECALL, CardState.REVIEW, 1.0));
            row.put(Rating.EASY, new Transition(Transition.StabilityRule.RECALL, CardState.REVIEW, EASY_INTERVAL_FACTOR));
            table.put(state, Collections.unmodifiableMap(row));
        }

        return Collections.unmodifiableMap(table);
    }
}
