package app.cadence.core.review.algorithm;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Partial parameter update; null fields keep their current value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterOverrides(
        List<Double> w,
        Double requestRetention,
        Double maximumInterval,
        Boolean enableFuzz,
        Boolean shortTermMemoryEnabled,
        Boolean longTermStabilityEnabled
) {
    public static final ParameterOverrides NONE = new ParameterOverrides(null, null, null, null, null, null);

    public static ParameterOverrides weights(List<Double> w) {
        return new ParameterOverrides(w, null, null, null, null, null);
    }
}
