package org.carball.stackcost.model.comparison;

public record CostDelta(
    double costDifference,
    double percentageDifference,
    String moreExpensiveArchitecture,
    String lessExpensiveArchitecture
) {

    public static CostDelta tie() {
        return new CostDelta(0.0, 0.0, null, null);
    }
}
