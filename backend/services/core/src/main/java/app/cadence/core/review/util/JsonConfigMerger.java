package app.cadence.core.review.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Deep-merges a partial config over a base config.
 * Objects merge key by key, arrays and scalars replace the base value, and null or missing
 * overrides keep the base value. Neither input is modified.
 * <p>
 * Differences from a plain recursive merge:
 * <ul>
 *     <li>An explicit JSON {@code null} inside an override object is skipped, so
 *     {@code {"w": null}} leaves the weight vector alone instead of clearing it.</li>
 *     <li>A missing or null override returns a copy of the base, or an empty object without a base.</li>
 *     <li>Every result is a deep copy, so later edits to the merged parameters never reach
 *     the stored baseline.</li>
 * </ul>
 */
@Component
public class JsonConfigMerger {

    public JsonNode merge(JsonNode base, JsonNode override) {
        if (override == null || override.isNull() || override.isMissingNode()) {
            return (base == null) ? JsonNodeFactory.instance.objectNode() : base.deepCopy();
        }
        if (base == null || base.isNull() || !base.isObject() || !override.isObject()) {
            return override.deepCopy();
        }

        ObjectNode out = base.deepCopy();
        override.properties().forEach(e -> {
            JsonNode overrideChild = e.getValue();
            if (overrideChild == null || overrideChild.isNull()) {
                return;
            }
            out.set(e.getKey(), merge(out.get(e.getKey()), overrideChild));
        });
        return out;
    }
}
