package app.cadence.core.review.algorithm;

import app.cadence.core.review.util.JsonConfigMerger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds the active model parameters. Invalid values never fail an operation: they are replaced by
 * their defaults, logged, and listed in the returned {@link ParameterValidation}.
 * <p>
 * Personalized weights are kept as an overlay on the configured parameters, so {@link #configured()}
 * never contains them. An update that sets {@code w} drops the overlay.
 * <p>
 * Not thread-safe; one writer per instance.
 */
public class ParameterStore {
    private static final Logger log = LoggerFactory.getLogger(ParameterStore.class);

    private final ObjectMapper om;
    private final JsonConfigMerger merger;
    private final ModelParameters baseline;

    private ModelParameters configured;
    private List<Double> personalizedWeights;
    private ModelParameters current;
    private ParameterValidation lastValidation;

    public ParameterStore(ObjectMapper om, JsonConfigMerger merger) {
        this(om, merger, ModelParameters.defaults());
    }

    public ParameterStore(ObjectMapper om, JsonConfigMerger merger, ModelParameters baseline) {
        this.om = om;
        this.merger = merger;
        this.baseline = baseline;
        initialize((JsonNode) null);
    }

    public ParameterValidation initialize(ParameterOverrides overrides) {
        return initialize(toJson(overrides));
    }

    public ParameterValidation initialize(JsonNode overrides) {
        JsonNode merged = merger.merge(baseline.toJson(om), overrides);
        personalizedWeights = null;
        return configure(ModelParameters.from(merged));
    }

    public ParameterValidation update(ParameterOverrides overrides) {
        return update(toJson(overrides));
    }

    public ParameterValidation update(JsonNode partial) {
        JsonNode merged = merger.merge(configured.toJson(om), partial);
        if (partial != null && partial.has("w")) {
            personalizedWeights = null;
        }
        return configure(ModelParameters.from(merged));
    }

    /**
     * Overlays personalized weights on the configured parameters. Calling it again replaces the
     * previous overlay instead of stacking on it.
     */
    public ParameterValidation personalize(List<Double> weights) {
        ParameterValidation validation = accept(configured.withWeights(weights));
        personalizedWeights = validation.parameters().weights();
        return validation;
    }

    public boolean personalized() {
        return personalizedWeights != null;
    }

    public ModelParameters current() {
        return current;
    }

    /**
     * Parameters from configuration and updates, without any personalized weights.
     */
    public ModelParameters configured() {
        return configured;
    }

    public ParameterValidation lastValidation() {
        return lastValidation;
    }

    public ParameterValidation validate() {
        return accept(current);
    }

    private ParameterValidation configure(ModelParameters candidate) {
        ParameterValidation validation = validate(candidate);
        logRepairs(validation);
        this.configured = validation.parameters();
        this.current = (personalizedWeights == null) ? configured : configured.withWeights(personalizedWeights);
        this.lastValidation = validation;
        return validation;
    }

    public ParameterValidation validate(ModelParameters candidate) {
        List<String> repairs = new ArrayList<>();

        List<Double> weights = candidate.weights();
        if (weights.size() != Fsrs6Defaults.PARAMETER_COUNT) {
            repairs.add("weight count " + weights.size() + " != " + Fsrs6Defaults.PARAMETER_COUNT + ", using defaults");
            weights = Fsrs6Defaults.WEIGHTS;
        } else {
            List<Double> fixed = new ArrayList<>(weights);
            for (int i = 0; i < fixed.size(); i++) {
                double w = fixed.get(i);
                if (!ParameterRanges.contains(i, w)) {
                    double fallback = Fsrs6Defaults.WEIGHTS.get(i);
                    repairs.add("w" + i + "=" + w + " outside [" + ParameterRanges.min(i) + ", "
                            + ParameterRanges.max(i) + "], using " + fallback);
                    fixed.set(i, fallback);
                }
            }
            weights = fixed;
        }

        double rr = candidate.requestRetention();
        if (Double.isNaN(rr) || rr < Fsrs6Defaults.MIN_REQUEST_RETENTION || rr > Fsrs6Defaults.MAX_REQUEST_RETENTION) {
            repairs.add("requestRetention=" + rr + " invalid, using " + Fsrs6Defaults.REQUEST_RETENTION);
            rr = Fsrs6Defaults.REQUEST_RETENTION;
        }

        double maxInterval = candidate.maximumInterval();
        if (Double.isNaN(maxInterval) || maxInterval < 1 || maxInterval > Fsrs6Defaults.MAX_MAXIMUM_INTERVAL) {
            repairs.add("maximumInterval=" + maxInterval + " invalid, using " + Fsrs6Defaults.MAXIMUM_INTERVAL);
            maxInterval = Fsrs6Defaults.MAXIMUM_INTERVAL;
        }

        ModelParameters repaired = candidate.withWeights(weights)
                .withRequestRetention(rr)
                .withMaximumInterval(maxInterval);
        return new ParameterValidation(repaired, repairs);
    }

    private ParameterValidation accept(ModelParameters candidate) {
        ParameterValidation validation = validate(candidate);
        logRepairs(validation);
        this.current = validation.parameters();
        this.lastValidation = validation;
        return validation;
    }

    private void logRepairs(ParameterValidation validation) {
        for (String repair : validation.repairs()) {
            log.warn("FSRS parameter repaired: {}", repair);
        }
    }

    private JsonNode toJson(ParameterOverrides overrides) {
        return overrides == null ? null : om.valueToTree(overrides);
    }
}
