package org.carball.stackcost.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.calculator.CostCalculator;
import org.carball.stackcost.comparison.ArchitectureComparator;
import org.carball.stackcost.config.AnalysisOptions;
import org.carball.stackcost.config.ComparisonOptions;
import org.carball.stackcost.estimator.UsageDefaults;
import org.carball.stackcost.estimator.UsageEstimator;
import org.carball.stackcost.model.analysis.AnalysisOutcome;
import org.carball.stackcost.model.analysis.ArchitectureAnalysis;
import org.carball.stackcost.model.comparison.ComparisonOutcome;
import org.carball.stackcost.model.comparison.ComparisonResult;
import org.carball.stackcost.model.cost.CostEstimate;
import org.carball.stackcost.model.recommendation.CostRecommendation;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.usage.UsageProfile;
import org.carball.stackcost.parser.FileTemplateSource;
import org.carball.stackcost.parser.ServiceClassifier;
import org.carball.stackcost.parser.TemplateException;
import org.carball.stackcost.parser.TemplateParser;
import org.carball.stackcost.parser.TemplateSource;
import org.carball.stackcost.pricing.PricingTable;
import org.carball.stackcost.recommendation.CostOptimizationAdvisor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs the full pipeline for one template: resource extraction, service classification, usage
 * estimation and costing. Holds no per-analysis state, so one instance can serve concurrent callers.
 */
@Slf4j
public class StackCostAnalyzer {

    private final TemplateSource templateSource;
    private final TemplateParser parser;
    private final ServiceClassifier classifier;
    private final UsageEstimator estimator;
    private final CostCalculator calculator;
    private final CostOptimizationAdvisor advisor;
    private final ArchitectureComparator comparator;

    public StackCostAnalyzer(PricingTable pricingTable) {
        this(pricingTable, UsageDefaults.standard());
    }

    public StackCostAnalyzer(PricingTable pricingTable, UsageDefaults usageDefaults) {
        this(new FileTemplateSource(), pricingTable, usageDefaults);
    }

    public StackCostAnalyzer(TemplateSource templateSource, PricingTable pricingTable, UsageDefaults usageDefaults) {
        this.templateSource = templateSource;
        this.parser = new TemplateParser();
        this.classifier = new ServiceClassifier();
        this.estimator = new UsageEstimator(classifier, usageDefaults);
        this.calculator = new CostCalculator(pricingTable);
        this.advisor = new CostOptimizationAdvisor();
        this.comparator = new ArchitectureComparator();

        log.debug("Initialized StackCostAnalyzer with pricing for {} services in {}",
                pricingTable.getEntries().size(), pricingTable.getRegion());
    }

    public ArchitectureAnalysis analyze(CloudTemplate template, AnalysisOptions options) {
        String name = parser.resolveStackName(template, options.getName());
        log.info("Analyzing stack '{}'", name);

        // Step 1: Extract resources
        Map<String, Integer> resourceCounts = parser.countResourcesByType(template);

        // Step 2: Classify services
        List<String> services = classifier.extractServices(resourceCounts.keySet());
        log.info("Found {} resource types across {} services", resourceCounts.size(), services.size());

        // Step 3: Estimate usage
        UsageProfile usageProfile = estimator.estimateAll(services, template, options);

        // Step 4: Price it
        CostEstimate costEstimate = calculator.calculate(usageProfile);
        List<CostRecommendation> recommendations = advisor.advise(template, usageProfile, costEstimate);

        log.info("Estimated monthly cost for '{}': {}", name, costEstimate.totalMonthlyCost());

        return new ArchitectureAnalysis(
                name,
                resourceCounts,
                services,
                usageProfile,
                costEstimate,
                recommendations,
                options.isIncludeTemplate() ? template.raw() : null
        );
    }

    /**
     * Loads and analyzes a template. A missing or unreadable template is reported as a failed outcome.
     */
    public AnalysisOutcome analyzeFile(Path templatePath, AnalysisOptions options) {
        try {
            CloudTemplate template = templateSource.load(templatePath);
            return AnalysisOutcome.success(analyze(template, options));
        } catch (TemplateException e) {
            log.error("Failed to analyze {}: {}", templatePath, e.getMessage());
            return AnalysisOutcome.failure(e.getMessage());
        }
    }

    public ComparisonResult compare(ArchitectureAnalysis first, ArchitectureAnalysis second,
                                    ComparisonOptions options) {
        return comparator.compare(first, second, options);
    }

    /**
     * Analyzes two templates with the same analysis options and compares them.
     */
    public ComparisonOutcome compareFiles(Path firstTemplate, Path secondTemplate,
                                          AnalysisOptions analysisOptions, ComparisonOptions comparisonOptions) {
        // Display names come from the comparison options, never from a single-template name override
        AnalysisOutcome first = analyzeFile(firstTemplate, analysisOptions.toBuilder().name(null).build());
        if (!first.success()) {
            return ComparisonOutcome.failure(first.message());
        }
        AnalysisOutcome second = analyzeFile(secondTemplate, analysisOptions.toBuilder().name(null).build());
        if (!second.success()) {
            return ComparisonOutcome.failure(second.message());
        }

        ComparisonResult comparison = comparator.compare(first.analysis(), second.analysis(), comparisonOptions);
        return ComparisonOutcome.success(first.analysis(), second.analysis(), comparison);
    }

    public ArchitectureComparator getComparator() {
        return comparator;
    }
}
