package org.carball.stackcost.model.cost;

/**
 * One billable dimension of a service cost.
 *
 * @param quantity         estimated monthly quantity
 * @param billableQuantity quantity left after any free-tier allowance
 * @param unitPrice        price per unit, 0 when the pricing entry does not price this dimension
 * @param cost             {@code billableQuantity * unitPrice}
 */
public record CostComponent(
    String dimension,
    double quantity,
    double billableQuantity,
    double unitPrice,
    double cost
) {}
