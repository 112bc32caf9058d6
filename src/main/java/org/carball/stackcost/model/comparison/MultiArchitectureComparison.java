package org.carball.stackcost.model.comparison;

import org.carball.stackcost.model.analysis.ArchitectureCostSummary;
import org.carball.stackcost.model.recommendation.CostRecommendation;

import java.util.List;

public record MultiArchitectureComparison(
    List<ArchitectureCostSummary> architectures,
    List<ComparisonMetric> metrics,
    String lowestCostArchitecture,
    String conclusion,
    List<CostRecommendation> recommendations
) {

    public MultiArchitectureComparison {
        architectures = List.copyOf(architectures);
        metrics = List.copyOf(metrics);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
