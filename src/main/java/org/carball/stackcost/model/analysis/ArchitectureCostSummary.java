package org.carball.stackcost.model.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The cost view of an architecture that comparisons work on.
 *
 * @param costBreakdown monthly cost per service, in service order
 */
public record ArchitectureCostSummary(
    String name,
    double totalMonthlyCost,
    Map<String, Double> costBreakdown
) {

    public ArchitectureCostSummary {
        costBreakdown = costBreakdown == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(costBreakdown));
    }

    public ArchitectureCostSummary withName(String newName) {
        return new ArchitectureCostSummary(newName, totalMonthlyCost, costBreakdown);
    }
}
