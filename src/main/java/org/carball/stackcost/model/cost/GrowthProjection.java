package org.carball.stackcost.model.cost;

/**
 * Projected cost for one year of a growth scenario. Year 1 is the current cost.
 */
public record GrowthProjection(
    int year,
    double monthlyCost,
    double annualCost
) {}
