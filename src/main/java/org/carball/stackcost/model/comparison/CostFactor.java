package org.carball.stackcost.model.comparison;

public record CostFactor(String service, double cost, String architecture) {}
