package org.carball.stackcost.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Caller options for a single-template analysis.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisOptions {

    /** Display name that replaces the one found in the template. */
    String name;

    /** Usage overrides keyed by service name, then by usage key. */
    @Singular("usageAssumption")
    Map<String, Map<String, Object>> usageAssumptions;

    /** Attach the raw template document to the analysis. */
    boolean includeTemplate;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }

    public Map<String, Object> overridesFor(String serviceName) {
        Map<String, Object> overrides = usageAssumptions.get(serviceName);
        return overrides == null ? Map.of() : overrides;
    }
}
