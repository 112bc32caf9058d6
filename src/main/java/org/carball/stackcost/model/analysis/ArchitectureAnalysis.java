package org.carball.stackcost.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.carball.stackcost.model.cost.CostEstimate;
import org.carball.stackcost.model.recommendation.CostRecommendation;
import org.carball.stackcost.model.usage.UsageProfile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete cost analysis of one template. {@code template} is only set when the caller asked for it.
 */
public record ArchitectureAnalysis(
    String name,
    Map<String, Integer> resourceCounts,
    List<String> services,
    UsageProfile usageProfile,
    CostEstimate costEstimate,
    List<CostRecommendation> recommendations,
    @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode template
) {

    public ArchitectureAnalysis {
        resourceCounts = Collections.unmodifiableMap(new LinkedHashMap<>(resourceCounts));
        services = List.copyOf(services);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public int totalResourceCount() {
        return resourceCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public ArchitectureCostSummary toCostSummary() {
        return new ArchitectureCostSummary(name, costEstimate.totalMonthlyCost(), costEstimate.costBreakdown());
    }
}
