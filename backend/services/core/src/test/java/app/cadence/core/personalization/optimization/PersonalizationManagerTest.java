package app.cadence.core.personalization.optimization;

import app.cadence.core.review.algorithm.Fsrs6Defaults;
import app.cadence.core.review.algorithm.ParameterRanges;
import app.cadence.core.review.domain.Rating;
import app.cadence.core.review.domain.ReviewLogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static app.cadence.core.personalization.optimization.GradientWeightOptimizerTest.reviews;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PersonalizationManagerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    GradientWeightOptimizer optimizer;

    MemoryBacktrackingStrategy backtracking;
    PersonalizationManager manager;

    @BeforeEach
    void setup() {
        backtracking = new MemoryBacktrackingStrategy(CLOCK);
        manager = new PersonalizationManager(optimizer, backtracking, CLOCK);
    }

    @Test
    void updateAfterReview_waitsForBaseline() {
        OptimizationProgress progress = manager.updateAfterReview(reviews(Rating.GOOD, 0, 3, 49));

        assertThat(progress.phase()).isEqualTo(OptimizationPhase.BASELINE);
        assertThat(progress.progress()).isCloseTo(24.5, within(1e-9));
        assertThat(progress.nextMilestone()).isEqualTo(50);
        assertThat(manager.optimizedWeights()).isEmpty();
        verifyNoInteractions(optimizer);
    }

    @Test
    void updateAfterReview_advancesPhaseByPhase() {
        BaselineMetrics baseline = new BaselineMetrics(0.8, 4, 0.9, NOW);
        List<Double> phase1 = withW17(0.6);
        when(optimizer.collectBaseline(anyList())).thenReturn(baseline);
        when(optimizer.optimizePhase1(anyList())).thenReturn(phase1);

        OptimizationProgress atBaseline = manager.updateAfterReview(reviews(Rating.GOOD, 0, 3, 50));
        assertThat(atBaseline.phase()).isEqualTo(OptimizationPhase.PHASE1);
        assertThat(atBaseline.progress()).isEqualTo(25);
        assertThat(manager.baseline()).contains(baseline);

        OptimizationProgress atPhase1 = manager.updateAfterReview(reviews(Rating.GOOD, 0, 3, 100));
        assertThat(atPhase1.phase()).isEqualTo(OptimizationPhase.PHASE2);
        assertThat(atPhase1.progress()).isEqualTo(50);
        assertThat(atPhase1.nextMilestone()).isEqualTo(200);
        assertThat(manager.optimizedWeights()).contains(phase1);
    }

    @Test
    void updateAfterReview_catchesUpInOneCall() {
        List<Double> phase1 = withW17(0.6);
        List<Double> phase2 = withW17(0.7);
        when(optimizer.collectBaseline(anyList())).thenReturn(new BaselineMetrics(0.8, 4, 0.9, NOW));
        when(optimizer.optimizePhase1(anyList())).thenReturn(phase1);
        when(optimizer.optimizePhase2(anyList(), eq(phase1))).thenReturn(phase2);

        OptimizationProgress progress = manager.updateAfterReview(reviews(Rating.GOOD, 0, 3, 200));

        assertThat(progress.phase()).isEqualTo(OptimizationPhase.OPTIMIZED);
        assertThat(progress.progress()).isEqualTo(100);
        assertThat(manager.optimizedWeights()).contains(phase2);
        assertThat(manager.backtrackingStatistics().totalCheckpoints()).isEqualTo(1);
        verify(optimizer).optimizePhase2(anyList(), eq(phase1));
    }

    @Test
    void updateAfterReview_rollsBackWhenFitDegrades() {
        List<Double> phase1 = withW17(0.6);
        when(optimizer.collectBaseline(anyList())).thenReturn(new BaselineMetrics(1.0, 3, 1.0, NOW));
        when(optimizer.optimizePhase1(anyList())).thenReturn(phase1);

        List<ReviewLogEntry> history = new ArrayList<>(reviews(Rating.GOOD, 0, 3, 50));
        manager.updateAfterReview(history);
        history.addAll(reviews(Rating.GOOD, 50, 3, 50));
        manager.updateAfterReview(history);

        List<Double> applied = manager.optimizedWeights().orElseThrow();
        assertThat(applied.get(17)).isCloseTo((0.5425 + 0.6) / 2, within(1e-12));
        assertThat(applied.get(2)).isEqualTo(Fsrs6Defaults.WEIGHTS.get(2));
        assertThat(manager.backtrackingStatistics().totalCheckpoints()).isEqualTo(2);
    }

    @Test
    void measurePerformance_usesRecentWindow() {
        List<ReviewLogEntry> history = new ArrayList<>(reviews(Rating.AGAIN, 50, 3, 30));
        history.addAll(reviews(Rating.GOOD, 0, 3, 50));

        CheckpointPerformance performance = manager.measurePerformance(history);

        assertThat(performance.predictionAccuracy()).isEqualTo(1.0);
        assertThat(performance.retentionRate()).isEqualTo(1.0);
        assertThat(performance.reviewCount()).isEqualTo(80);
        assertThat(performance.avgResponseMs()).isNull();
    }

    @Test
    void reset_returnsToBaseline() {
        when(optimizer.collectBaseline(anyList())).thenReturn(new BaselineMetrics(0.8, 4, 0.9, NOW));
        manager.updateAfterReview(reviews(Rating.GOOD, 0, 3, 60));

        manager.reset();

        assertThat(manager.phase()).isEqualTo(OptimizationPhase.BASELINE);
        assertThat(manager.baseline()).isEmpty();
        assertThat(manager.optimizedWeights()).isEmpty();
        assertThat(manager.progress().progress()).isZero();
        assertThat(manager.backtrackingStatistics()).isEqualTo(BacktrackingStatistics.EMPTY);
    }

    @Test
    void realOptimizer_producesWeightsWithinRanges() {
        PersonalizationManager real = new PersonalizationManager(
                new GradientWeightOptimizer(CLOCK), new MemoryBacktrackingStrategy(CLOCK), CLOCK);

        real.updateAfterReview(reviews(Rating.GOOD, 5, 3, 200));

        List<Double> weights = real.optimizedWeights().orElseThrow();
        assertThat(real.phase()).isEqualTo(OptimizationPhase.OPTIMIZED);
        assertThat(weights).hasSize(21);
        for (int i = 0; i < weights.size(); i++) {
            assertThat(ParameterRanges.contains(i, weights.get(i))).as("w%d", i).isTrue();
        }
    }

    private static List<Double> withW17(double value) {
        List<Double> w = new ArrayList<>(Fsrs6Defaults.WEIGHTS);
        w.set(17, value);
        return List.copyOf(w);
    }
}
