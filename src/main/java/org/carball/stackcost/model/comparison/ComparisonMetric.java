package org.carball.stackcost.model.comparison;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A derived figure computed for every compared architecture.
 *
 * @param values metric value by architecture name, in comparison order
 */
public record ComparisonMetric(String name, String description, Map<String, Double> values) {

    public ComparisonMetric {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
