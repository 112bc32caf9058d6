package org.carball.stackcost.model.recommendation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A cost optimization suggestion for one architecture.
 *
 * @param service                 the service the suggestion applies to, or {@code Architecture}
 * @param estimatedMonthlySavings null when the rule has no savings model
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CostRecommendation(
    String title,
    String description,
    Impact impact,
    String service,
    Double estimatedMonthlySavings,
    String action
) {}
