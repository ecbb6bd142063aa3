package app.cadence.core.review.algorithm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

public record ModelParameters(
        List<Double> weights,
        double requestRetention,
        double maximumInterval,
        boolean enableFuzz,
        boolean shortTermMemoryEnabled,
        boolean longTermStabilityEnabled
) {
    public ModelParameters {
        weights = (weights == null) ? Fsrs6Defaults.WEIGHTS : List.copyOf(weights);
    }

    public static ModelParameters defaults() {
        return new ModelParameters(
                Fsrs6Defaults.WEIGHTS,
                Fsrs6Defaults.REQUEST_RETENTION,
                Fsrs6Defaults.MAXIMUM_INTERVAL,
                Fsrs6Defaults.ENABLE_FUZZ,
                Fsrs6Defaults.SHORT_TERM_MEMORY_ENABLED,
                Fsrs6Defaults.LONG_TERM_STABILITY_ENABLED
        );
    }

    public double w(int index) {
        return weights.get(index);
    }

    public ModelParameters withWeights(List<Double> weights) {
        return new ModelParameters(weights, requestRetention, maximumInterval, enableFuzz,
                shortTermMemoryEnabled, longTermStabilityEnabled);
    }

    public ModelParameters withRequestRetention(double requestRetention) {
        return new ModelParameters(weights, requestRetention, maximumInterval, enableFuzz,
                shortTermMemoryEnabled, longTermStabilityEnabled);
    }

    public ModelParameters withMaximumInterval(double maximumInterval) {
        return new ModelParameters(weights, requestRetention, maximumInterval, enableFuzz,
                shortTermMemoryEnabled, longTermStabilityEnabled);
    }

    /**
     * Reads parameters from a config node, falling back to the defaults for absent fields.
     * Non-numeric values become NaN so that validation replaces them.
     */
    public static ModelParameters from(JsonNode cfg) {
        if (cfg == null || cfg.isNull()) cfg = JsonNodeFactory.instance.objectNode();

        List<Double> w = Fsrs6Defaults.WEIGHTS;
        JsonNode wj = cfg.path("w");
        if (wj.isArray()) {
            w = new ArrayList<>(wj.size());
            for (JsonNode x : wj) {
                w.add(x.isNumber() ? x.asDouble() : Double.NaN);
            }
        }

        return new ModelParameters(
                w,
                number(cfg.path("requestRetention"), Fsrs6Defaults.REQUEST_RETENTION),
                number(cfg.path("maximumInterval"), Fsrs6Defaults.MAXIMUM_INTERVAL),
                cfg.path("enableFuzz").asBoolean(Fsrs6Defaults.ENABLE_FUZZ),
                cfg.path("shortTermMemoryEnabled").asBoolean(Fsrs6Defaults.SHORT_TERM_MEMORY_ENABLED),
                cfg.path("longTermStabilityEnabled").asBoolean(Fsrs6Defaults.LONG_TERM_STABILITY_ENABLED)
        );
    }

    public ObjectNode toJson(ObjectMapper om) {
        ObjectNode o = om.createObjectNode();
        ArrayNode w = o.putArray("w");
        for (Double v : weights) {
            w.add(v);
        }
        o.put("requestRetention", requestRetention);
        o.put("maximumInterval", maximumInterval);
        o.put("enableFuzz", enableFuzz);
        o.put("shortTermMemoryEnabled", shortTermMemoryEnabled);
        o.put("longTermStabilityEnabled", longTermStabilityEnabled);
        return o;
    }

    private static double number(JsonNode n, double fallback) {
        if (n.isMissingNode() || n.isNull()) return fallback;
        return n.isNumber() ? n.asDouble() : Double.NaN;
    }
}
