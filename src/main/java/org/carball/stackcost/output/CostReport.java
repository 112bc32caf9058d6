package org.carball.stackcost.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.calculator.GrowthProjector;
import org.carball.stackcost.model.analysis.ArchitectureAnalysis;
import org.carball.stackcost.model.comparison.ComparisonResult;
import org.carball.stackcost.model.comparison.CostFactor;
import org.carball.stackcost.model.cost.GrowthProjection;
import org.carball.stackcost.model.cost.GrowthScenario;
import org.carball.stackcost.model.cost.ServiceCost;
import org.carball.stackcost.model.recommendation.CostRecommendation;
import org.carball.stackcost.model.usage.ServiceUsage;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class CostReport {

    private static final String ANALYZER_VERSION = "1.0.0";

    private final ArchitectureAnalysis analysis;
    private final ArchitectureAnalysis secondAnalysis;
    private final ComparisonResult comparison;
    private final Map<String, List<GrowthProjection>> growthProjections;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    private CostReport(ArchitectureAnalysis analysis, ArchitectureAnalysis secondAnalysis,
                       ComparisonResult comparison) {
        this.analysis = analysis;
        this.secondAnalysis = secondAnalysis;
        this.comparison = comparison;
        // Only single analyses are projected
        this.growthProjections = comparison == null
                ? new GrowthProjector().projectScenarios(analysis.costEstimate().totalMonthlyCost())
                : Map.of();
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static CostReport forAnalysis(ArchitectureAnalysis analysis) {
        return new CostReport(analysis, null, null);
    }

    public static CostReport forComparison(ArchitectureAnalysis first, ArchitectureAnalysis second,
                                           ComparisonResult comparison) {
        return new CostReport(first, second, comparison);
    }

    public boolean isComparison() {
        return comparison != null;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        if (isComparison()) {
            md.append("# Architecture Cost Comparison\n\n");
        } else {
            md.append("# Stack Cost Analysis: ").append(analysis.name()).append("\n\n");
        }
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Analyzer Version:** ").append(ANALYZER_VERSION).append("  \n\n");

        if (isComparison()) {
            appendComparison(md);
            md.append("## ").append(comparison.architecture1().name()).append("\n\n");
            appendAnalysisBody(md, analysis, "###");
            md.append("## ").append(comparison.architecture2().name()).append("\n\n");
            appendAnalysisBody(md, secondAnalysis, "###");
        } else {
            appendAnalysisBody(md, analysis, "##");
            appendGrowthProjections(md);
        }

        return md.toString();
    }

    private void appendComparison(StringBuilder md) {
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| ").append(comparison.architecture1().name()).append(" (monthly) | ")
                .append(money(comparison.architecture1().totalMonthlyCost())).append(" |\n");
        md.append("| ").append(comparison.architecture2().name()).append(" (monthly) | ")
                .append(money(comparison.architecture2().totalMonthlyCost())).append(" |\n");
        md.append("| Cost Difference | ").append(money(comparison.costDifference())).append(" |\n");
        md.append("| Percentage Difference | ")
                .append(String.format(Locale.US, "%.2f%%", comparison.percentageDifference())).append(" |\n\n");

        if (comparison.isTie()) {
            md.append("Both architectures have the same estimated monthly cost.\n\n");
        } else {
            md.append("**").append(comparison.lessExpensiveArchitecture()).append("** is less expensive than **")
                    .append(comparison.moreExpensiveArchitecture()).append("**.\n\n");
        }

        md.append("### Biggest Cost Factors\n\n");
        if (comparison.biggestCostFactors().isEmpty()) {
            md.append("No service costs to rank.\n\n");
            return;
        }
        md.append("| # | Service | Architecture | Monthly Cost |\n");
        md.append("|---|---------|--------------|--------------|\n");
        int rank = 1;
        for (CostFactor factor : comparison.biggestCostFactors()) {
            md.append("| ").append(rank++).append(" | ").append(factor.service())
                    .append(" | ").append(factor.architecture())
                    .append(" | ").append(money(factor.cost())).append(" |\n");
        }
        md.append("\n");
    }

    private void appendAnalysisBody(StringBuilder md, ArchitectureAnalysis target, String heading) {
        md.append(heading).append(" Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Resources | ").append(target.totalResourceCount()).append(" |\n");
        md.append("| Services | ").append(target.services().size()).append(" |\n");
        md.append("| Monthly Cost | ").append(money(target.costEstimate().totalMonthlyCost())).append(" |\n");
        md.append("| Yearly Cost | ").append(money(target.costEstimate().totalYearlyCost())).append(" |\n\n");

        md.append(heading).append(" Cost Breakdown\n\n");
        md.append("| Service | Monthly | Yearly |\n");
        md.append("|---------|---------|--------|\n");
        for (ServiceCost cost : target.costEstimate().serviceCosts()) {
            md.append("| ").append(cost.service()).append(cost.priced() ? "" : " (no pricing)")
                    .append(" | ").append(money(cost.monthlyCost()))
                    .append(" | ").append(money(cost.yearlyCost())).append(" |\n");
        }
        md.append("\n");

        md.append(heading).append(" Resources\n\n");
        md.append("| Type | Count |\n");
        md.append("|------|-------|\n");
        target.resourceCounts().forEach((type, count) ->
                md.append("| ").append(type).append(" | ").append(count).append(" |\n"));
        md.append("\n");

        md.append(heading).append(" Usage Assumptions\n\n");
        for (Map.Entry<String, ServiceUsage> entry : target.usageProfile().asMap().entrySet()) {
            md.append("- **").append(entry.getKey()).append(":** ");
            StringBuilder values = new StringBuilder();
            entry.getValue().asMap().forEach((key, value) -> {
                if (values.length() > 0) {
                    values.append(", ");
                }
                values.append(key).append("=").append(value);
            });
            md.append(values).append("\n");
        }
        md.append("\n");

        List<CostRecommendation> recommendations = target.recommendations();
        if (!recommendations.isEmpty()) {
            md.append(heading).append(" Recommendations\n\n");
            int number = 1;
            for (CostRecommendation rec : recommendations) {
                md.append(number++).append(". **").append(rec.title()).append("** (")
                        .append(rec.impact()).append(", ").append(rec.service()).append(")\n");
                md.append("   ").append(rec.description()).append("\n");
                if (rec.estimatedMonthlySavings() != null) {
                    md.append("   Estimated savings: ").append(money(rec.estimatedMonthlySavings()))
                            .append(" per month\n");
                }
                md.append("   Action: ").append(rec.action()).append("\n");
            }
            md.append("\n");
        }
    }

    private void appendGrowthProjections(StringBuilder md) {
        if (growthProjections.isEmpty()) {
            return;
        }
        md.append("## Growth Projections\n\n");
        for (GrowthScenario scenario : GrowthScenario.values()) {
            List<GrowthProjection> projections = growthProjections.get(scenario.key());
            md.append("### ").append(scenario.displayName()).append(" Growth (")
                    .append(Math.round(scenario.getAnnualGrowthRate() * 100)).append("% Annually)\n\n");
            md.append("| Year | Monthly Cost | Annual Cost |\n");
            md.append("|------|--------------|-------------|\n");
            for (GrowthProjection projection : projections) {
                md.append("| Year ").append(projection.year())
                        .append(" | ").append(money(projection.monthlyCost()))
                        .append(" | ").append(money(projection.annualCost())).append(" |\n");
            }
            md.append("\n");
        }
    }

    private static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setReportMetadata(new ReportMetadata(timestamp, ANALYZER_VERSION,
                isComparison() ? "comparison" : "analysis"));
        if (isComparison()) {
            report.setArchitecture1(analysis);
            report.setArchitecture2(secondAnalysis);
            report.setComparison(comparison);
        } else {
            report.setAnalysis(analysis);
            report.setGrowthProjections(growthProjections.isEmpty() ? null : growthProjections);
        }
        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata reportMetadata;
        private ArchitectureAnalysis analysis;
        private ArchitectureAnalysis architecture1;
        private ArchitectureAnalysis architecture2;
        private ComparisonResult comparison;
        private Map<String, List<GrowthProjection>> growthProjections;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private String analyzerVersion;
        private String reportType;
    }
}
