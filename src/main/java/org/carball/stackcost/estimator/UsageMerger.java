package org.carball.stackcost.estimator;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.model.usage.ServiceUsage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges usage layers key by key. Precedence, lowest to highest:
 * <ol>
 *   <li>built-in defaults for the service family</li>
 *   <li>values derived from the template's resources</li>
 *   <li>caller overrides</li>
 * </ol>
 * A key absent from a higher layer keeps its value from the layer below, as does a key whose value is
 * not a finite number (NaN or infinity, numeric or textual).
 */
@Slf4j
public final class UsageMerger {

    private UsageMerger() {
    }

    public static ServiceUsage merge(Map<String, ?> defaults, Map<String, ?> derived, Map<String, ?> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        overlay(merged, defaults);
        overlay(merged, derived);
        overlay(merged, overrides);
        return ServiceUsage.of(merged);
    }

    /**
     * Defaults with overrides applied, used as the input for derived values.
     */
    public static ServiceUsage base(Map<String, ?> defaults, Map<String, ?> overrides) {
        return merge(defaults, Map.of(), overrides);
    }

    private static void overlay(Map<String, Object> target, Map<String, ?> layer) {
        if (layer == null) {
            return;
        }
        layer.forEach((key, value) -> {
            if (isNonFinite(value)) {
                log.warn("Ignoring non-finite usage value for {}: {}", key, value);
            } else {
                target.put(key, value);
            }
        });
    }

    static boolean isNonFinite(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return !Double.isFinite(((Number) value).doubleValue());
        }
        if (value instanceof String text) {
            try {
                return !Double.isFinite(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }
}
