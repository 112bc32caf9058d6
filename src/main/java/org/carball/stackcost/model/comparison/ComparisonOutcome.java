package org.carball.stackcost.model.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.carball.stackcost.model.analysis.ArchitectureAnalysis;

/**
 * Result of comparing two templates loaded from a source that may fail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComparisonOutcome(
    boolean success,
    String message,
    ArchitectureAnalysis architecture1,
    ArchitectureAnalysis architecture2,
    ComparisonResult comparison
) {

    public static ComparisonOutcome success(ArchitectureAnalysis architecture1,
                                            ArchitectureAnalysis architecture2,
                                            ComparisonResult comparison) {
        return new ComparisonOutcome(true, null, architecture1, architecture2, comparison);
    }

    public static ComparisonOutcome failure(String message) {
        return new ComparisonOutcome(false, message, null, null, null);
    }
}
