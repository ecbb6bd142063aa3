package app.cadence.core.review.service;

import app.cadence.core.review.algorithm.ModelParameters;
import app.cadence.core.review.algorithm.ParameterOverrides;
import app.cadence.core.review.algorithm.ParameterValidation;
import app.cadence.core.review.domain.CardMemoryState;
import app.cadence.core.review.domain.CardState;
import app.cadence.core.review.domain.LegacyCard;
import app.cadence.core.review.domain.LegacyReviewResult;
import app.cadence.core.review.domain.Rating;
import app.cadence.core.review.domain.ReviewResult;
import app.cadence.core.review.exception.InvalidCardException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Pre-v6 API over {@link CoreScheduler}. Cards cross this boundary without the version tag and
 * memory factors; inbound cards get both factors reset to 1.0.
 */
@Service
public class LegacyScheduler {

    private static final int SECONDS_PER_CARD = 30;

    private final CoreScheduler core;

    public LegacyScheduler(CoreScheduler core) {
        this.core = core;
    }

    public LegacyCard createCard() {
        return toLegacy(core.createCard());
    }

    public LegacyReviewResult review(LegacyCard card, Rating rating) {
        return review(card, rating, null);
    }

    public LegacyReviewResult review(LegacyCard card, Rating rating, Instant reviewTime) {
        ReviewResult result = core.review(toCore(card), rating, reviewTime);
        return new LegacyReviewResult(toLegacy(result.card()), result.log());
    }

    public LegacyReviewResult review(LegacyCard card, int ratingCode, Instant reviewTime) {
        return review(card, Rating.fromCode(ratingCode), reviewTime);
    }

    public LegacyParameters getParameters() {
        ModelParameters p = core.getParameters();
        return new LegacyParameters(p.weights(), p.requestRetention(), p.maximumInterval(), p.enableFuzz());
    }

    public ParameterValidation updateParameters(ParameterOverrides overrides) {
        return core.updateParameters(overrides);
    }

    public ParameterValidation updateParameters(JsonNode partial) {
        return core.updateParameters(partial);
    }

    public CoreScheduler.VersionInfo getVersionInfo() {
        return core.getVersionInfo();
    }

    public CoreScheduler.PerformanceMetrics getPerformanceMetrics() {
        return core.getPerformanceMetrics();
    }

    /**
     * Retrievability the card will have {@code futureDays} from its last recorded elapsed gap.
     */
    public double predictMemoryState(LegacyCard card, int futureDays) {
        if (card.stability() <= 0) return 0;
        double futureElapsed = card.elapsedDays() + futureDays;
        return Math.exp(-futureElapsed / card.stability());
    }

    public double calculateProgress(LegacyCard card) {
        if (card.state() == CardState.NEW) return 0;
        if (card.state() == CardState.REVIEW && card.stability() > 100) return 1;

        double stabilityProgress = Math.min(card.stability() / 100, 1);
        double repsProgress = Math.min(card.reps() / 10.0, 1);
        return (stabilityProgress + repsProgress) / 2;
    }

    /**
     * Estimated study time in minutes, at 30 seconds per card.
     */
    public int getRecommendedStudyTime(int totalCards, int targetCards) {
        int effectiveCards = Math.max(0, Math.min(totalCards, targetCards));
        return (int) Math.ceil(effectiveCards * SECONDS_PER_CARD / 60.0);
    }

    private static CardMemoryState toCore(LegacyCard card) {
        if (card == null) {
            throw new InvalidCardException("Invalid card data");
        }
        return new CardMemoryState(
                CardMemoryState.CURRENT_VERSION,
                card.due(),
                card.stability(),
                card.difficulty(),
                card.elapsedDays(),
                card.scheduledDays(),
                card.reps(),
                card.lapses(),
                card.state(),
                card.lastReview(),
                card.retrievability(),
                1.0,
                1.0
        );
    }

    private static LegacyCard toLegacy(CardMemoryState card) {
        return new LegacyCard(
                card.due(),
                card.stability(),
                card.difficulty(),
                card.elapsedDays(),
                card.scheduledDays(),
                card.reps(),
                card.lapses(),
                card.state(),
                card.lastReview(),
                card.retrievability()
        );
    }

    public record LegacyParameters(
            List<Double> w,
            double requestRetention,
            double maximumInterval,
            boolean enableFuzz
    ) {
    }
}
