package org.carball.stackcost.comparison;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.config.ComparisonOptions;
import org.carball.stackcost.model.analysis.ArchitectureAnalysis;
import org.carball.stackcost.model.analysis.ArchitectureCostSummary;
import org.carball.stackcost.model.comparison.ComparisonMetric;
import org.carball.stackcost.model.comparison.ComparisonResult;
import org.carball.stackcost.model.comparison.CostDelta;
import org.carball.stackcost.model.comparison.CostFactor;
import org.carball.stackcost.model.comparison.MultiArchitectureComparison;
import org.carball.stackcost.model.recommendation.CostRecommendation;
import org.carball.stackcost.recommendation.CostOptimizationAdvisor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Compares the costs of analyzed architectures.
 */
@Slf4j
public class ArchitectureComparator {

    public static final String DEFAULT_ARCHITECTURE_1_NAME = "Architecture 1";
    public static final String DEFAULT_ARCHITECTURE_2_NAME = "Architecture 2";

    private static final double SETUP_COST_MULTIPLIER = 1.2;
    private static final int OPERATIONAL_MONTHS = 36;
    private static final List<String> REQUEST_SERVING_SERVICES = List.of("API Gateway", "Lambda", "ELB", "EC2");
    private static final double REQUEST_BASELINE_MILLIONS = 100.0;
    private static final double DEFAULT_SCALING_FACTOR = 8.5;
    private static final Map<String, Double> SCALING_FACTORS = Map.of(
            "Serverless", 7.5,
            "Containers", 8.5,
            "EC2", 9.5);

    private final CostOptimizationAdvisor advisor;

    public ArchitectureComparator() {
        this(new CostOptimizationAdvisor());
    }

    public ArchitectureComparator(CostOptimizationAdvisor advisor) {
        this.advisor = advisor;
    }

    public ComparisonResult compare(ArchitectureAnalysis first, ArchitectureAnalysis second,
                                    ComparisonOptions options) {
        return compare(first.toCostSummary(), second.toCostSummary(), options);
    }

    public ComparisonResult compare(ArchitectureCostSummary first, ArchitectureCostSummary second,
                                    ComparisonOptions options) {
        ArchitectureCostSummary named1 = first.withName(
                resolveName(options.getArchitecture1Name(), first.name(), DEFAULT_ARCHITECTURE_1_NAME));
        ArchitectureCostSummary named2 = second.withName(
                resolveName(options.getArchitecture2Name(), second.name(), DEFAULT_ARCHITECTURE_2_NAME));

        CostDelta delta = calculateCostDelta(named1, named2);
        List<CostFactor> factors = findBiggestCostFactors(named1, named2, options.effectiveCostFactorsLimit());

        log.debug("Compared {} ({}) with {} ({}): difference {}",
                named1.name(), named1.totalMonthlyCost(), named2.name(), named2.totalMonthlyCost(),
                delta.costDifference());

        return new ComparisonResult(
                named1,
                named2,
                delta.costDifference(),
                delta.percentageDifference(),
                delta.moreExpensiveArchitecture(),
                delta.lessExpensiveArchitecture(),
                factors
        );
    }

    /**
     * Absolute and relative difference between two monthly totals. The percentage is taken against the
     * smaller total, so it does not depend on argument order. Equal totals are a tie with no winner.
     */
    public CostDelta calculateCostDelta(ArchitectureCostSummary first, ArchitectureCostSummary second) {
        double total1 = finiteTotal(first);
        double total2 = finiteTotal(second);

        if (Double.compare(total1, total2) == 0) {
            return CostDelta.tie();
        }

        double difference = Math.abs(total1 - total2);
        double smaller = Math.min(total1, total2);
        double ratio = difference / smaller * 100;
        double percentage;
        if (smaller <= 0) {
            percentage = 100.0;
        } else if (Double.isFinite(ratio)) {
            percentage = roundToCents(ratio);
        } else {
            percentage = Double.MAX_VALUE;
        }

        return total1 > total2
                ? new CostDelta(difference, percentage, first.name(), second.name())
                : new CostDelta(difference, percentage, second.name(), first.name());
    }

    /**
     * All service costs of both architectures, most expensive first. Equal costs keep the first
     * architecture's services ahead of the second's, each in breakdown order.
     *
     * @param limit maximum number of factors; null or negative means no limit
     */
    public List<CostFactor> findBiggestCostFactors(ArchitectureCostSummary first, ArchitectureCostSummary second,
                                                   Integer limit) {
        List<CostFactor> factors = new ArrayList<>();
        addFactors(factors, first);
        addFactors(factors, second);

        // List.sort is stable
        factors.sort(Comparator.comparingDouble(CostFactor::cost).reversed());

        if (limit != null && limit >= 0 && limit < factors.size()) {
            return new ArrayList<>(factors.subList(0, limit));
        }
        return factors;
    }

    /**
     * Side by side metrics and comparison recommendations for two or more architectures.
     *
     * @param names display names by position; missing or blank entries fall back to the analysis name
     */
    public MultiArchitectureComparison compareAll(List<ArchitectureAnalysis> analyses, List<String> names) {
        if (analyses == null || analyses.size() < 2) {
            throw new IllegalArgumentException("At least two architectures are required for a comparison");
        }

        List<ArchitectureCostSummary> summaries = new ArrayList<>();
        Map<String, ArchitectureAnalysis> byName = new LinkedHashMap<>();
        for (int i = 0; i < analyses.size(); i++) {
            ArchitectureAnalysis analysis = analyses.get(i);
            String override = names != null && i < names.size() ? names.get(i) : null;
            String name = uniqueName(resolveName(override, analysis.name(), "Architecture " + (i + 1)), byName);
            summaries.add(analysis.toCostSummary().withName(name));
            byName.put(name, analysis);
        }

        List<ComparisonMetric> metrics = List.of(
                metric("Initial Setup Cost",
                        "Estimated cost for the first month of operation",
                        byName, analysis -> monthly(analysis) * SETUP_COST_MULTIPLIER),
                metric("Operational Cost (3 Years)",
                        "Estimated operational cost over a 3-year period",
                        byName, analysis -> monthly(analysis) * OPERATIONAL_MONTHS),
                metric("Cost Per Million Requests",
                        "Estimated cost per million API requests",
                        byName, ArchitectureComparator::costPerMillionRequests),
                metric("Cost Efficiency Score",
                        "Relative score (1-10) based on features vs. cost",
                        byName, analysis -> Math.round(
                                analysis.resourceCounts().size() / Math.max(monthly(analysis), 1.0) * 5)),
                scalingMetric(byName)
        );

        String lowest = summaries.get(0).name();
        double lowestCost = summaries.get(0).totalMonthlyCost();
        for (ArchitectureCostSummary summary : summaries) {
            if (summary.totalMonthlyCost() < lowestCost) {
                lowest = summary.name();
                lowestCost = summary.totalMonthlyCost();
            }
        }

        List<CostRecommendation> recommendations = advisor.adviseOnComparison(byName);

        log.info("Compared {} architectures, lowest monthly cost: {}", summaries.size(), lowest);
        return new MultiArchitectureComparison(summaries, metrics, lowest, conclusion(lowest, byName),
                recommendations);
    }

    private ComparisonMetric scalingMetric(Map<String, ArchitectureAnalysis> byName) {
        Map<String, Double> values = new LinkedHashMap<>();
        byName.forEach((name, analysis) -> values.put(name, monthly(analysis) * scalingFactor(name)));
        return new ComparisonMetric("Scaling Cost Factor", "Estimated cost when scaling to 10x load", values);
    }

    /**
     * Cost multiplier at ten times the load. Only the exact names Serverless, Containers and EC2 are
     * recognized.
     */
    static double scalingFactor(String architectureName) {
        return SCALING_FACTORS.getOrDefault(architectureName, DEFAULT_SCALING_FACTOR);
    }

    /**
     * Cost of the request serving services spread over a baseline of 100 million requests a month.
     */
    static double costPerMillionRequests(ArchitectureAnalysis analysis) {
        double requestServingCost = 0.0;
        for (Map.Entry<String, Double> entry : analysis.costEstimate().costBreakdown().entrySet()) {
            String service = entry.getKey();
            if (REQUEST_SERVING_SERVICES.stream().anyMatch(service::contains)) {
                requestServingCost += entry.getValue();
            }
        }
        return requestServingCost / REQUEST_BASELINE_MILLIONS;
    }

    private String conclusion(String lowest, Map<String, ArchitectureAnalysis> byName) {
        String mostResources = lowest;
        int highestCount = byName.get(lowest).totalResourceCount();
        for (Map.Entry<String, ArchitectureAnalysis> entry : byName.entrySet()) {
            if (entry.getValue().totalResourceCount() > highestCount) {
                mostResources = entry.getKey();
                highestCount = entry.getValue().totalResourceCount();
            }
        }

        StringBuilder conclusion = new StringBuilder();
        conclusion.append(String.format(Locale.US,
                "The %s architecture has the lowest estimated monthly cost at $%.2f.",
                lowest, monthly(byName.get(lowest))));
        if (!mostResources.equals(lowest)) {
            conclusion.append(String.format(Locale.US, " The %s architecture declares the most resources (%d).",
                    mostResources, highestCount));
        }
        conclusion.append(" Scaling behaviour and operational effort should be weighed before choosing.");
        return conclusion.toString();
    }

    private static ComparisonMetric metric(String name, String description,
                                           Map<String, ArchitectureAnalysis> byName,
                                           ToDoubleFunction<ArchitectureAnalysis> calculation) {
        Map<String, Double> values = new LinkedHashMap<>();
        byName.forEach((architecture, analysis) -> values.put(architecture, calculation.applyAsDouble(analysis)));
        return new ComparisonMetric(name, description, values);
    }

    private static double monthly(ArchitectureAnalysis analysis) {
        return analysis.costEstimate().totalMonthlyCost();
    }

    private static void addFactors(List<CostFactor> factors, ArchitectureCostSummary summary) {
        summary.costBreakdown().forEach((service, cost) -> factors.add(new CostFactor(service, cost, summary.name())));
    }

    private static String resolveName(String override, String analysisName, String fallback) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        if (analysisName != null && !analysisName.isBlank()) {
            return analysisName;
        }
        return fallback;
    }

    private static String uniqueName(String name, Map<String, ?> taken) {
        String candidate = name;
        int suffix = 2;
        while (taken.containsKey(candidate)) {
            candidate = name + " (" + suffix++ + ")";
        }
        return candidate;
    }

    private static double finiteTotal(ArchitectureCostSummary summary) {
        double total = summary.totalMonthlyCost();
        if (!Double.isFinite(total)) {
            log.warn("Monthly cost of {} is not finite ({}), comparing it as zero", summary.name(), total);
            return 0.0;
        }
        return total;
    }

    private static double roundToCents(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
