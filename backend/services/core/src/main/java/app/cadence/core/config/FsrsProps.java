package app.cadence.core.config;

import app.cadence.core.review.algorithm.Fsrs6Defaults;
import app.cadence.core.review.algorithm.ModelParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "app.fsrs")
public record FsrsProps(
        List<Double> weights,
        Double requestRetention,
        Double maximumInterval,
        Boolean enableFuzz,
        Boolean shortTermMemoryEnabled,
        Boolean longTermStabilityEnabled,
        String personalizationZone,
        Long fuzzSeed
) {
    public ModelParameters baseline() {
        return new ModelParameters(
                (weights == null || weights.isEmpty()) ? Fsrs6Defaults.WEIGHTS : weights,
                requestRetention == null ? Fsrs6Defaults.REQUEST_RETENTION : requestRetention,
                maximumInterval == null ? Fsrs6Defaults.MAXIMUM_INTERVAL : maximumInterval,
                enableFuzz == null ? Fsrs6Defaults.ENABLE_FUZZ : enableFuzz,
                shortTermMemoryEnabled == null ? Fsrs6Defaults.SHORT_TERM_MEMORY_ENABLED : shortTermMemoryEnabled,
                longTermStabilityEnabled == null ? Fsrs6Defaults.LONG_TERM_STABILITY_ENABLED : longTermStabilityEnabled
        );
    }
}
