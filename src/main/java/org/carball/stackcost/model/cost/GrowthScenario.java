package org.carball.stackcost.model.cost;

import java.util.Locale;

public enum GrowthScenario {
    CONSERVATIVE(0.05),
    MODERATE(0.15),
    AGGRESSIVE(0.30);

    private final double annualGrowthRate;

    GrowthScenario(double annualGrowthRate) {
        this.annualGrowthRate = annualGrowthRate;
    }

    public double getAnnualGrowthRate() {
        return annualGrowthRate;
    }

    /**
     * Lower case name used as the report key.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }
}
