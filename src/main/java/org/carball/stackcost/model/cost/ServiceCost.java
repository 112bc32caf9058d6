package org.carball.stackcost.model.cost;

import java.util.List;

/**
 * Monthly and yearly cost of one service. {@code priced} is false when the pricing table has no entry
 * for the service, in which case both costs are zero.
 */
public record ServiceCost(
    String service,
    double monthlyCost,
    double yearlyCost,
    boolean priced,
    List<CostComponent> components
) {

    public static final int MONTHS_PER_YEAR = 12;

    public ServiceCost {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public static ServiceCost of(String service, List<CostComponent> components) {
        double monthly = 0.0;
        for (CostComponent component : components) {
            monthly = saturate(monthly + component.cost());
        }
        return new ServiceCost(service, monthly, saturate(monthly * MONTHS_PER_YEAR), true, components);
    }

    /**
     * Caps an overflowing sum at {@link Double#MAX_VALUE}.
     */
    static double saturate(double value) {
        return value == Double.POSITIVE_INFINITY ? Double.MAX_VALUE : value;
    }

    public static ServiceCost unpriced(String service) {
        return new ServiceCost(service, 0.0, 0.0, false, List.of());
    }
}
