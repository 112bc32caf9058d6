package org.carball.stackcost.model.cost;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record CostEstimate(
    List<ServiceCost> serviceCosts,
    double totalMonthlyCost,
    double totalYearlyCost
) {

    public CostEstimate {
        serviceCosts = serviceCosts == null ? List.of() : List.copyOf(serviceCosts);
    }

    public static CostEstimate of(List<ServiceCost> serviceCosts) {
        double total = 0.0;
        for (ServiceCost serviceCost : serviceCosts) {
            total = ServiceCost.saturate(total + serviceCost.monthlyCost());
        }
        return new CostEstimate(serviceCosts, total, ServiceCost.saturate(total * ServiceCost.MONTHS_PER_YEAR));
    }

    public static CostEstimate empty() {
        return new CostEstimate(List.of(), 0.0, 0.0);
    }

    /**
     * Monthly cost per service, in service order.
     */
    public Map<String, Double> costBreakdown() {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        serviceCosts.forEach(cost -> breakdown.put(cost.service(), cost.monthlyCost()));
        return breakdown;
    }

    public Optional<ServiceCost> find(String service) {
        return serviceCosts.stream()
                .filter(cost -> cost.service().equals(service))
                .findFirst();
    }

    public double monthlyCostOf(String service) {
        return find(service).map(ServiceCost::monthlyCost).orElse(0.0);
    }
}
