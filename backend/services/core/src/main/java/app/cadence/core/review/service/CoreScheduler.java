package app.cadence.core.review.service;

import app.cadence.core.review.algorithm.Fsrs6Defaults;
import app.cadence.core.review.algorithm.FuzzSource;
import app.cadence.core.review.algorithm.MemoryModel;
import app.cadence.core.review.algorithm.ModelParameters;
import app.cadence.core.review.algorithm.ParameterOverrides;
import app.cadence.core.review.algorithm.ParameterStore;
import app.cadence.core.review.algorithm.ParameterValidation;
import app.cadence.core.review.algorithm.ReviewContext;
import app.cadence.core.review.algorithm.SchedulingStateMachine;
import app.cadence.core.review.domain.CardMemoryState;
import app.cadence.core.review.domain.CardState;
import app.cadence.core.review.domain.Rating;
import app.cadence.core.review.domain.ReviewLogEntry;
import app.cadence.core.review.domain.ReviewResult;
import app.cadence.core.review.exception.ComputationException;
import app.cadence.core.review.exception.FsrsException;
import app.cadence.core.review.exception.InvalidCardException;
import app.cadence.core.review.exception.ParameterException;
import app.cadence.core.review.exception.VersionMismatchException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the scheduling core: creates cards, applies reviews and owns the parameter store.
 * <p>
 * The accuracy and timing counters are for observability only and never influence scheduling.
 * Instances are not thread-safe.
 */
@Service
public class CoreScheduler {
    private static final Logger log = LoggerFactory.getLogger(CoreScheduler.class);

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ParameterStore parameterStore;
    private final Clock clock;
    private final FuzzSource fuzzSource;
    private final Instant implementationDate;

    private long totalReviews;
    private long createdCards;
    private double averageAccuracy;
    private double executionTimeMs;

    public CoreScheduler(ParameterStore parameterStore, Clock clock, FuzzSource fuzzSource) {
        this.parameterStore = parameterStore;
        this.clock = clock;
        this.fuzzSource = fuzzSource;
        this.implementationDate = clock.instant();
    }

    public VersionInfo getVersionInfo() {
        return new VersionInfo(
                Fsrs6Defaults.VERSION,
                Fsrs6Defaults.ALGORITHM_NAME,
                Fsrs6Defaults.PARAMETER_COUNT,
                implementationDate,
                "standard"
        );
    }

    public CardMemoryState createCard() {
        long start = System.nanoTime();
        ModelParameters p = parameterStore.current();
        Instant now = clock.instant();

        CardMemoryState card = new CardMemoryState(
                CardMemoryState.CURRENT_VERSION,
                now,
                0.0,
                MemoryModel.initialDifficulty(p),
                0,
                0,
                0,
                0,
                CardState.NEW,
                null,
                1.0,
                p.shortTermMemoryEnabled() ? 1.0 : null,
                p.longTermStabilityEnabled() ? 1.0 : null
        );

        createdCards++;
        recordExecution(start);
        return card;
    }

    public ReviewResult review(CardMemoryState card, Rating rating) {
        return review(card, rating, null, ReviewContext.EMPTY);
    }

    public ReviewResult review(CardMemoryState card, Rating rating, Instant reviewTime) {
        return review(card, rating, reviewTime, ReviewContext.EMPTY);
    }

    public ReviewResult review(CardMemoryState card, Rating rating, Instant reviewTime, ReviewContext context) {
        long start = System.nanoTime();
        validateCard(card);
        validateRating(rating);

        Instant now = (reviewTime == null) ? clock.instant() : reviewTime;
        ReviewContext ctx = (context == null) ? ReviewContext.EMPTY : context;

        ReviewResult result;
        try {
            result = compute(card, rating, now, ctx, true);
        } catch (FsrsException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ComputationException("review card", card, rating, now, ex);
        }

        recordReview(rating);
        recordExecution(start);
        return result;
    }

    /**
     * Due date each rating would produce at {@code now}, without fuzz and without touching the counters.
     */
    public Map<Rating, Instant> previewNextDue(CardMemoryState card, Instant now) {
        validateCard(card);
        Instant at = (now == null) ? clock.instant() : now;
        Map<Rating, Instant> out = new EnumMap<>(Rating.class);
        for (Rating r : Rating.values()) {
            try {
                out.put(r, compute(card, r, at, ReviewContext.EMPTY, false).card().due());
            } catch (FsrsException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new ComputationException("preview next due", card, r, at, ex);
            }
        }
        return out;
    }

    public ModelParameters getParameters() {
        return parameterStore.current();
    }

    public ParameterValidation updateParameters(ParameterOverrides overrides) {
        return parameterStore.update(overrides);
    }

    public ParameterValidation updateParameters(JsonNode partial) {
        return parameterStore.update(partial);
    }

    /**
     * Schedules with personalized weights until the next explicit weight update. A later call
     * replaces the previous personalized weights.
     */
    public ParameterValidation applyPersonalizedWeights(List<Double> weights) {
        return parameterStore.personalize(weights);
    }

    public SchedulerState getState() {
        return new SchedulerState(
                true,
                true,
                parameterStore.personalized(),
                totalReviews,
                averageAccuracy,
                parameterStore.current().weights()
        );
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return new PerformanceMetrics(
                Fsrs6Defaults.VERSION,
                executionTimeMs,
                averageAccuracy,
                totalReviews,
                createdCards
        );
    }

    private ReviewResult compute(CardMemoryState card,
                                 Rating rating,
                                 Instant now,
                                 ReviewContext context,
                                 boolean fuzz) {
        ModelParameters p = parameterStore.current();

        int elapsedDays = (card.lastReview() == null) ? 0 : elapsedDays(card.lastReview(), now);
        CardMemoryState started = card.withReviewStart(now, elapsedDays);
        CardMemoryState scheduled = SchedulingStateMachine.apply(started, rating, p);

        Instant due = now.plus(Duration.ofDays(scheduled.scheduledDays()));
        if (fuzz && p.enableFuzz()) {
            due = due.plus(Duration.ofDays(MemoryModel.fuzzDays(scheduled.scheduledDays(), fuzzSource)));
        }
        CardMemoryState updated = scheduled.withDue(due);

        ReviewLogEntry entry = new ReviewLogEntry(
                rating,
                card.state(),
                card.due(),
                card.stability(),
                card.difficulty(),
                elapsedDays,
                card.elapsedDays(),
                updated.scheduledDays(),
                now,
                context.responseMs()
        );
        return new ReviewResult(updated, entry);
    }

    // Whole 24h periods between the two instants; a review time before the last review is folded with abs().
    private static int elapsedDays(Instant lastReview, Instant now) {
        Duration between = Duration.between(lastReview, now);
        if (between.isNegative()) {
            log.warn("Review time precedes last review, using absolute gap lastReview={} reviewTime={}", lastReview, now);
        }
        return (int) (between.abs().toMillis() / MILLIS_PER_DAY);
    }

    private static void validateCard(CardMemoryState card) {
        if (card == null) {
            throw new InvalidCardException("Invalid card data");
        }
        if (!CardMemoryState.CURRENT_VERSION.equals(card.version())) {
            throw new VersionMismatchException(CardMemoryState.CURRENT_VERSION, card.version());
        }
        if (card.state() == null) {
            throw new InvalidCardException("Card state is required");
        }
    }

    private static void validateRating(Rating rating) {
        if (rating == null) {
            throw new ParameterException("Rating must be 1, 2, 3, or 4", "rating", null);
        }
    }

    private void recordReview(Rating rating) {
        totalReviews++;
        double correct = rating.isRecalled() ? 1.0 : 0.0;
        averageAccuracy = (averageAccuracy * (totalReviews - 1) + correct) / totalReviews;
    }

    private void recordExecution(long startNanos) {
        double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        executionTimeMs = (executionTimeMs + elapsedMs) / 2;
    }

    public record VersionInfo(
            String version,
            String algorithmName,
            int parameterCount,
            Instant implementationDate,
            String compatibilityLevel
    ) {
    }

    public record SchedulerState(
            boolean initialized,
            boolean parametersLoaded,
            boolean personalizationEnabled,
            long totalReviews,
            double averageAccuracy,
            List<Double> currentWeights
    ) {
    }

    public record PerformanceMetrics(
            String algorithmVersion,
            double executionTimeMs,
            double averageAccuracy,
            long reviewsProcessed,
            long cardsCreated
    ) {
    }
}
