package app.cadence.core.review.algorithm;

import java.util.List;

/**
 * Outcome of validating a parameter set: the usable parameters plus one message per repaired field.
 */
public record ParameterValidation(
        ModelParameters parameters,
        List<String> repairs
) {
    public ParameterValidation {
        repairs = List.copyOf(repairs);
    }

    public boolean repaired() {
        return !repairs.isEmpty();
    }
}
