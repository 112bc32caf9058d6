package org.carball.stackcost.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of analyzing a template from a source that may fail. Failures carry a message and no analysis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisOutcome(boolean success, String message, ArchitectureAnalysis analysis) {

    public static AnalysisOutcome success(ArchitectureAnalysis analysis) {
        return new AnalysisOutcome(true, null, analysis);
    }

    public static AnalysisOutcome failure(String message) {
        return new AnalysisOutcome(false, message, null);
    }
}
