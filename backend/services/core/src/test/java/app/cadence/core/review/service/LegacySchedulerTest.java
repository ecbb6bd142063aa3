package app.cadence.core.review.service;

import app.cadence.core.review.algorithm.ParameterStore;
import app.cadence.core.review.domain.CardMemoryState;
import app.cadence.core.review.domain.CardState;
import app.cadence.core.review.domain.LegacyCard;
import app.cadence.core.review.domain.LegacyReviewResult;
import app.cadence.core.review.domain.Rating;
import app.cadence.core.review.domain.ReviewLogEntry;
import app.cadence.core.review.domain.ReviewResult;
import app.cadence.core.review.exception.ParameterException;
import app.cadence.core.review.util.JsonConfigMerger;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LegacySchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    CoreScheduler mockedCore;

    LegacyScheduler scheduler;

    @BeforeEach
    void setup() {
        ParameterStore store = new ParameterStore(new ObjectMapper(), new JsonConfigMerger());
        scheduler = new LegacyScheduler(new CoreScheduler(store, Clock.fixed(NOW, ZoneOffset.UTC), () -> 0.0));
    }

    @Test
    void createCard_stripsVersionAndFactors() {
        LegacyCard card = scheduler.createCard();

        assertThat(card.state()).isEqualTo(CardState.NEW);
        assertThat(card.due()).isEqualTo(NOW);
        assertThat(card.difficulty()).isCloseTo(3.9131, within(1e-9));
    }

    @Test
    void review_goodMovesToReview() {
        LegacyReviewResult result = scheduler.review(scheduler.createCard(), Rating.GOOD, NOW);

        assertThat(result.card().state()).isEqualTo(CardState.REVIEW);
        assertThat(result.card().stability()).isEqualTo(2.3065);
        assertThat(result.card().scheduledDays()).isEqualTo(2);
        assertThat(result.log().rating()).isEqualTo(Rating.GOOD);
    }

    @Test
    void review_rejectsUnknownRatingCode() {
        LegacyCard card = scheduler.createCard();

        assertThatThrownBy(() -> scheduler.review(card, 5, NOW))
                .isInstanceOf(ParameterException.class)
                .hasMessage("Rating must be 1, 2, 3, or 4");
    }

    @Test
    void review_convertsInboundCardWithUnitFactors() {
        LegacyScheduler facade = new LegacyScheduler(mockedCore);
        LegacyCard card = new LegacyCard(NOW, 4.0, 5.0, 1, 3, 2, 0, CardState.REVIEW, NOW.minus(Duration.ofDays(3)), 0.8);
        CardMemoryState reviewed = new CardMemoryState(CardMemoryState.CURRENT_VERSION, NOW.plus(Duration.ofDays(5)),
                6.0, 4.5, 3, 5, 3, 0, CardState.REVIEW, NOW, 1.0, 1.2, 1.0);
        ReviewLogEntry log = new ReviewLogEntry(Rating.GOOD, CardState.REVIEW, NOW, 4.0, 5.0, 3, 1, 5, NOW, null);
        when(mockedCore.review(any(CardMemoryState.class), eq(Rating.GOOD), eq(NOW))).thenReturn(new ReviewResult(reviewed, log));

        LegacyReviewResult result = facade.review(card, Rating.GOOD, NOW);

        ArgumentCaptor<CardMemoryState> captor = ArgumentCaptor.forClass(CardMemoryState.class);
        verify(mockedCore).review(captor.capture(), eq(Rating.GOOD), eq(NOW));
        assertThat(captor.getValue().version()).isEqualTo("6.1.1");
        assertThat(captor.getValue().shortTermMemoryFactor()).isEqualTo(1.0);
        assertThat(captor.getValue().longTermStabilityFactor()).isEqualTo(1.0);
        assertThat(captor.getValue().stability()).isEqualTo(4.0);
        assertThat(result.card().stability()).isEqualTo(6.0);
        assertThat(result.card().due()).isEqualTo(NOW.plus(Duration.ofDays(5)));
    }

    @Test
    void getParameters_usesLegacyShape() {
        LegacyScheduler.LegacyParameters p = scheduler.getParameters();

        assertThat(p.w()).hasSize(21);
        assertThat(p.requestRetention()).isEqualTo(0.9);
        assertThat(p.maximumInterval()).isEqualTo(365);
        assertThat(p.enableFuzz()).isTrue();
    }

    @Test
    void predictMemoryState_decaysWithFutureDays() {
        LegacyCard card = new LegacyCard(NOW, 10.0, 5.0, 2, 5, 3, 0, CardState.REVIEW, NOW, 0.9);

        assertThat(scheduler.predictMemoryState(card, 3)).isCloseTo(Math.exp(-0.5), within(1e-12));
        double previous = 1.0;
        for (int days = 0; days <= 60; days += 5) {
            double r = scheduler.predictMemoryState(card, days);
            assertThat(r).isLessThan(previous);
            previous = r;
        }
    }

    @Test
    void predictMemoryState_isZeroWithoutStability() {
        LegacyCard card = new LegacyCard(NOW, 0.0, 5.0, 0, 0, 0, 0, CardState.NEW, null, 1.0);

        assertThat(scheduler.predictMemoryState(card, 10)).isZero();
    }

    @Test
    void calculateProgress_followsStateAndStability() {
        assertThat(scheduler.calculateProgress(
                new LegacyCard(NOW, 0.0, 5.0, 0, 0, 0, 0, CardState.NEW, null, 1.0))).isZero();
        assertThat(scheduler.calculateProgress(
                new LegacyCard(NOW, 150.0, 5.0, 0, 0, 12, 0, CardState.REVIEW, NOW, 1.0))).isEqualTo(1.0);
        assertThat(scheduler.calculateProgress(
                new LegacyCard(NOW, 50.0, 5.0, 0, 0, 5, 0, CardState.LEARNING, NOW, 1.0))).isEqualTo(0.5);
    }

    @Test
    void getRecommendedStudyTime_usesThirtySecondsPerCard() {
        assertThat(scheduler.getRecommendedStudyTime(100, 25)).isEqualTo(13);
        assertThat(scheduler.getRecommendedStudyTime(3, 10)).isEqualTo(2);
        assertThat(scheduler.getRecommendedStudyTime(0, 10)).isZero();
    }

    @Test
    void versionInfo_isDelegated() {
        assertThat(scheduler.getVersionInfo().version()).isEqualTo("6.1.1");
        assertThat(scheduler.getPerformanceMetrics().algorithmVersion()).isEqualTo("6.1.1");
    }
}
