package org.carball.stackcost.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.model.cost.GrowthProjection;
import org.carball.stackcost.model.cost.GrowthScenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compounds a monthly cost by an annual growth rate.
 */
@Slf4j
public class GrowthProjector {

    public static final int DEFAULT_YEARS = 3;

    public List<GrowthProjection> project(double monthlyCost, double annualGrowthRate) {
        return project(monthlyCost, annualGrowthRate, DEFAULT_YEARS);
    }

    public List<GrowthProjection> project(double monthlyCost, double annualGrowthRate, int years) {
        List<GrowthProjection> projections = new ArrayList<>();
        double current = monthlyCost;
        for (int year = 1; year <= years; year++) {
            projections.add(new GrowthProjection(year, current, current * 12));
            current *= 1 + annualGrowthRate;
        }
        return projections;
    }

    /**
     * Projections for every {@link GrowthScenario}, keyed by {@link GrowthScenario#key()}. Empty unless
     * the monthly cost is positive and finite.
     */
    public Map<String, List<GrowthProjection>> projectScenarios(double monthlyCost) {
        if (!(monthlyCost > 0) || !Double.isFinite(monthlyCost)) {
            return Collections.emptyMap();
        }

        Map<String, List<GrowthProjection>> scenarios = new LinkedHashMap<>();
        for (GrowthScenario scenario : GrowthScenario.values()) {
            scenarios.put(scenario.key(), project(monthlyCost, scenario.getAnnualGrowthRate()));
        }
        log.debug("Projected {} growth scenarios from {} per month", scenarios.size(), monthlyCost);
        return scenarios;
    }
}
