package org.carball.stackcost.model.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.carball.stackcost.model.analysis.ArchitectureCostSummary;

import java.util.List;

/**
 * Cost comparison of two architectures. Both expensive-architecture fields are null when the totals tie.
 *
 * @param costDifference       absolute difference of the monthly totals
 * @param percentageDifference difference relative to the smaller total, rounded to two decimals
 */
public record ComparisonResult(
    ArchitectureCostSummary architecture1,
    ArchitectureCostSummary architecture2,
    double costDifference,
    double percentageDifference,
    String moreExpensiveArchitecture,
    String lessExpensiveArchitecture,
    List<CostFactor> biggestCostFactors
) {

    public ComparisonResult {
        biggestCostFactors = List.copyOf(biggestCostFactors);
    }

    @JsonIgnore
    public boolean isTie() {
        return moreExpensiveArchitecture == null;
    }
}
