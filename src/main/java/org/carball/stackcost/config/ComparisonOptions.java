package org.carball.stackcost.config;

import lombok.Builder;
import lombok.Value;

/**
 * Caller options for comparing two architectures. Null names fall back to the analysis names.
 */
@Value
@Builder(toBuilder = true)
public class ComparisonOptions {

    public static final int DEFAULT_COST_FACTORS_LIMIT = 5;

    String architecture1Name;

    String architecture2Name;

    /** Maximum number of ranked cost factors; null means {@link #DEFAULT_COST_FACTORS_LIMIT}. */
    Integer costFactorsLimit;

    public static ComparisonOptions defaults() {
        return ComparisonOptions.builder().build();
    }

    public int effectiveCostFactorsLimit() {
        return costFactorsLimit == null ? DEFAULT_COST_FACTORS_LIMIT : costFactorsLimit;
    }
}
