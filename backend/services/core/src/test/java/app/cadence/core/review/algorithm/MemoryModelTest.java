package app.cadence.core.review.algorithm;

import app.cadence.core.review.domain.Rating;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MemoryModelTest {

    private static final ModelParameters DEFAULTS = ModelParameters.defaults();

    @Test
    void initialDifficulty_matchesDefaultWeights() {
        assertThat(MemoryModel.initialDifficulty(DEFAULTS)).isCloseTo(3.9131, within(1e-9));
    }

    @Test
    void nextDifficulty_staysWithinBounds() {
        for (Rating rating : Rating.values()) {
            for (double d = 1.0; d <= 10.0; d += 0.5) {
                assertThat(MemoryModel.nextDifficulty(d, rating, DEFAULTS)).isBetween(1.0, 10.0);
            }
        }
    }

    @Test
    void initialStability_usesWeightForRatingWithFloor() {
        assertThat(MemoryModel.initialStability(Rating.GOOD, DEFAULTS)).isEqualTo(2.3065);
        assertThat(MemoryModel.initialStability(Rating.AGAIN, DEFAULTS)).isEqualTo(0.212);

        List<Double> w = new ArrayList<>(Fsrs6Defaults.WEIGHTS);
        w.set(0, 0.05);
        assertThat(MemoryModel.initialStability(Rating.AGAIN, DEFAULTS.withWeights(w))).isEqualTo(0.1);
    }

    @Test
    void forgetStability_dropsBelowPreviousStability() {
        double s = MemoryModel.forgetStability(10, 5, 10, DEFAULTS);

        assertThat(s).isLessThan(10).isGreaterThanOrEqualTo(MemoryModel.MIN_STABILITY);
        assertThat(MemoryModel.forgetStability(0, 5, 0, DEFAULTS)).isEqualTo(MemoryModel.MIN_STABILITY);
    }

    @Test
    void recallStability_ordersHardGoodEasy() {
        double hard = MemoryModel.recallStability(10, 10, Rating.HARD, DEFAULTS);
        double good = MemoryModel.recallStability(10, 10, Rating.GOOD, DEFAULTS);
        double easy = MemoryModel.recallStability(10, 10, Rating.EASY, DEFAULTS);

        assertThat(hard).isLessThan(good);
        assertThat(good).isLessThan(easy);
        assertThat(good).isGreaterThan(10);
    }

    @Test
    void recallStability_appliesShortTermBoostOnlyWhenEnabled() {
        ModelParameters disabled = new ModelParameters(Fsrs6Defaults.WEIGHTS, 0.9, 365, true, false, true);

        double boosted = MemoryModel.recallStability(5, 2, Rating.GOOD, DEFAULTS);
        double plain = MemoryModel.recallStability(5, 2, Rating.GOOD, disabled);

        double factor = 1 + 0.5425 * Math.exp(-0.0912 * 2);
        assertThat(boosted).isCloseTo(plain * factor, within(1e-9));
    }

    @Test
    void forgetStability_matchesFormula() {
        double expected = 0.796 * Math.pow(10, 0.0614) * Math.pow(10, 0.2629) * Math.exp(1.4835 * (5 - 6.4133));

        assertThat(MemoryModel.forgetStability(10, 5, 10, DEFAULTS)).isCloseTo(expected, within(1e-12));
    }

    @Test
    void recallStability_appliesLongTermBoostOnlyWhenEnabled() {
        ModelParameters disabled = new ModelParameters(Fsrs6Defaults.WEIGHTS, 0.9, 365, true, true, false);

        double boosted = MemoryModel.recallStability(20, 45, Rating.GOOD, DEFAULTS);
        double plain = MemoryModel.recallStability(20, 45, Rating.GOOD, disabled);

        double r = Math.exp(-45 / 20.0);
        assertThat(plain).isCloseTo(20 * Math.exp(1.8722 * 0.1666 * (1 - r)), within(1e-9));
        assertThat(boosted).isCloseTo(plain * (1 + 0.0658 * Math.log(1 + 0.1542 * 45 / 30.0)), within(1e-9));
    }

    @Test
    void recallStability_skipsLongTermBoostBeforeThirtyDays() {
        ModelParameters disabled = new ModelParameters(Fsrs6Defaults.WEIGHTS, 0.9, 365, true, true, false);

        assertThat(MemoryModel.recallStability(20, 29, Rating.GOOD, DEFAULTS))
                .isEqualTo(MemoryModel.recallStability(20, 29, Rating.GOOD, disabled));
    }

    @Test
    void retrievability_isOneWithoutElapsedTime() {
        assertThat(MemoryModel.retrievability(0, 5)).isEqualTo(1.0);
        assertThat(MemoryModel.retrievability(3, 0)).isEqualTo(1.0);
        assertThat(MemoryModel.retrievability(5, 5)).isCloseTo(Math.exp(-1), within(1e-12));
    }

    @Test
    void nextIntervalDays_roundsAndCaps() {
        assertThat(MemoryModel.nextIntervalDays(2.3065, DEFAULTS)).isEqualTo(2);
        assertThat(MemoryModel.nextIntervalDays(0.2, DEFAULTS)).isEqualTo(1);
        assertThat(MemoryModel.nextIntervalDays(10_000, DEFAULTS)).isEqualTo(365);
        assertThat(MemoryModel.nextIntervalDays(10_000, 0.9, 100.7)).isEqualTo(100);
    }

    @Test
    void nextIntervalDays_clampsRequestRetention() {
        assertThat(MemoryModel.nextIntervalDays(10, 0.8, 365)).isEqualTo(21);
        assertThat(MemoryModel.nextIntervalDays(10, 0.3, 365))
                .isEqualTo(MemoryModel.nextIntervalDays(10, 0.5, 365))
                .isEqualTo(66);
    }

    @Test
    void nextIntervalDays_alwaysWithinOneAndMaximum() {
        for (double s = 0.01; s < 5000; s *= 1.7) {
            assertThat(MemoryModel.nextIntervalDays(s, DEFAULTS)).isBetween(1, 365);
        }
    }

    @Test
    void fuzzDays_skipsShortIntervals() {
        assertThat(MemoryModel.fuzzDays(2, () -> 0.99)).isZero();
    }

    @Test
    void fuzzDays_scalesWithInterval() {
        assertThat(MemoryModel.fuzzDays(30, () -> 0.6)).isEqualTo(1);
        assertThat(MemoryModel.fuzzDays(30, () -> -0.6)).isEqualTo(-1);
        assertThat(MemoryModel.fuzzDays(30, () -> 0.4)).isZero();
        assertThat(MemoryModel.fuzzDays(3, () -> 0.99)).isZero();
    }

    @Test
    void shortTermFactor_nudgesWithinWindow() {
        assertThat(MemoryModel.shortTermFactor(null, 2, Rating.GOOD, DEFAULTS)).isCloseTo(1.5425, within(1e-12));
        assertThat(MemoryModel.shortTermFactor(1.9, 1, Rating.GOOD, DEFAULTS)).isEqualTo(MemoryModel.MAX_FACTOR);
        assertThat(MemoryModel.shortTermFactor(0.6, 1, Rating.AGAIN, DEFAULTS)).isEqualTo(MemoryModel.MIN_FACTOR);
        assertThat(MemoryModel.shortTermFactor(null, 10, Rating.GOOD, DEFAULTS)).isEqualTo(1.0);
    }

    @Test
    void longTermFactor_nudgesAfterThirtyDays() {
        assertThat(MemoryModel.longTermFactor(null, 45, Rating.AGAIN, DEFAULTS)).isCloseTo(0.9342, within(1e-12));
        assertThat(MemoryModel.longTermFactor(1.2, 10, Rating.AGAIN, DEFAULTS)).isEqualTo(1.2);
    }
}
