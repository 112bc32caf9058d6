package org.carball.stackcost.recommendation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.model.analysis.ArchitectureAnalysis;
import org.carball.stackcost.model.cost.CostEstimate;
import org.carball.stackcost.model.recommendation.CostRecommendation;
import org.carball.stackcost.model.recommendation.Impact;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.template.ResourceDeclaration;
import org.carball.stackcost.model.usage.UsageProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.carball.stackcost.estimator.UsageKeys.AVG_CPU_UTILIZATION;

/**
 * Rule based cost optimization suggestions. Single architecture rules look at declared resources, usage
 * assumptions and the estimated cost; comparison rules look at several analyses side by side. Nothing
 * is measured.
 */
@Slf4j
public class CostOptimizationAdvisor {

    private static final int HIGH_MEMORY_MB = 1024;
    private static final int DEFAULT_MEMORY_MB = 128;
    private static final int HIGH_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_TIMEOUT_SECONDS = 3;

    private static final double MEMORY_TUNING_SAVINGS = 0.20;
    private static final double LIFECYCLE_SAVINGS = 0.30;
    private static final double RESERVED_INSTANCE_SAVINGS = 0.40;
    private static final double RIGHTSIZING_SAVINGS = 0.30;
    private static final double LOW_CPU_UTILIZATION = 40.0;
    private static final double MULTI_AZ_SAVINGS = 0.50;
    private static final double MULTI_AZ_REVIEW_THRESHOLD = 200.0;

    private static final double SIGNIFICANT_TOTAL_DIFFERENCE = 100.0;
    private static final double SERVICE_COST_RATIO = 0.5;
    private static final double SIGNIFICANT_SERVICE_DIFFERENCE = 20.0;
    private static final double RESOURCE_EFFICIENCY_RATIO = 1.5;

    public List<CostRecommendation> advise(CloudTemplate template, CostEstimate costEstimate) {
        return advise(template, new UsageProfile(Map.of()), costEstimate);
    }

    public List<CostRecommendation> advise(CloudTemplate template, UsageProfile usageProfile,
                                           CostEstimate costEstimate) {
        List<ResourceDeclaration> resources = template.typedResources();
        List<CostRecommendation> recommendations = new ArrayList<>();

        adviseOnEc2(resources, usageProfile, costEstimate, recommendations);
        adviseOnLambda(resources, costEstimate, recommendations);
        adviseOnS3(resources, costEstimate, recommendations);
        adviseOnDynamoDb(resources, recommendations);
        adviseOnRds(resources, costEstimate, recommendations);
        adviseOnArchitecture(resources, recommendations);

        log.debug("Generated {} cost recommendations", recommendations.size());
        return recommendations;
    }

    /**
     * Suggestions drawn from comparing two or more analyzed architectures, keyed by display name in
     * comparison order. Fewer than two architectures yield no suggestions.
     */
    public List<CostRecommendation> adviseOnComparison(Map<String, ArchitectureAnalysis> architectures) {
        List<CostRecommendation> recommendations = new ArrayList<>();
        if (architectures == null || architectures.size() < 2) {
            return recommendations;
        }

        List<Map.Entry<String, ArchitectureAnalysis>> entries = new ArrayList<>(architectures.entrySet());
        compareTotalCosts(entries, recommendations);
        compareServiceCosts(entries, recommendations);
        compareResourceEfficiency(entries, recommendations);
        compareArchitectureStyles(entries, recommendations);

        log.debug("Generated {} comparison recommendations for {} architectures",
                recommendations.size(), entries.size());
        return recommendations;
    }

    private void adviseOnLambda(List<ResourceDeclaration> resources, CostEstimate costEstimate,
                                List<CostRecommendation> recommendations) {
        List<ResourceDeclaration> functions = ofType(resources, "AWS::Lambda::Function");
        if (functions.isEmpty()) {
            return;
        }

        long highMemory = functions.stream()
                .filter(function -> intProperty(function, "MemorySize", DEFAULT_MEMORY_MB) > HIGH_MEMORY_MB)
                .count();
        if (highMemory > 0) {
            recommendations.add(new CostRecommendation(
                    "Optimize Lambda function memory allocation",
                    highMemory + " Lambda function(s) allocate more than " + HIGH_MEMORY_MB
                            + " MB. Tune memory to observed usage.",
                    Impact.MEDIUM,
                    "Lambda",
                    costEstimate.monthlyCostOf("Lambda") * MEMORY_TUNING_SAVINGS,
                    "Review CloudWatch metrics for each function and adjust memory settings"));
        }

        boolean highTimeout = functions.stream()
                .anyMatch(function -> intProperty(function, "Timeout", DEFAULT_TIMEOUT_SECONDS) > HIGH_TIMEOUT_SECONDS);
        if (highTimeout) {
            recommendations.add(new CostRecommendation(
                    "Review Lambda function timeout settings",
                    "Some Lambda functions allow more than " + HIGH_TIMEOUT_SECONDS
                            + " seconds per invocation, which may hide inefficient processing.",
                    Impact.LOW,
                    "Lambda",
                    null,
                    "Profile Lambda execution times and optimize code"));
        }
    }

    private void adviseOnS3(List<ResourceDeclaration> resources, CostEstimate costEstimate,
                            List<CostRecommendation> recommendations) {
        long withoutLifecycle = ofType(resources, "AWS::S3::Bucket").stream()
                .filter(bucket -> !bucket.hasProperty("LifecycleConfiguration"))
                .count();
        if (withoutLifecycle > 0) {
            recommendations.add(new CostRecommendation(
                    "Implement S3 lifecycle policies",
                    withoutLifecycle + " S3 bucket(s) have no lifecycle configuration. Transition infrequently"
                            + " accessed objects to cheaper storage classes.",
                    Impact.MEDIUM,
                    "S3",
                    costEstimate.monthlyCostOf("S3") * LIFECYCLE_SAVINGS,
                    "Configure lifecycle rules that move data to Infrequent Access or Glacier"));
        }
    }

    private void adviseOnDynamoDb(List<ResourceDeclaration> resources, List<CostRecommendation> recommendations) {
        boolean anyProvisioned = ofType(resources, "AWS::DynamoDB::Table").stream()
                .anyMatch(table -> !"PAY_PER_REQUEST".equals(table.property("BillingMode").asText(null)));
        if (anyProvisioned) {
            recommendations.add(new CostRecommendation(
                    "Consider DynamoDB On-Demand capacity mode",
                    "For unpredictable workloads On-Demand capacity can cost less than provisioned capacity.",
                    Impact.MEDIUM,
                    "DynamoDB",
                    null,
                    "Evaluate usage patterns and consider switching tables to On-Demand mode"));
        }
    }

    private void adviseOnEc2(List<ResourceDeclaration> resources, UsageProfile usageProfile,
                             CostEstimate costEstimate, List<CostRecommendation> recommendations) {
        List<ResourceDeclaration> instances = ofType(resources, "AWS::EC2::Instance");
        if (instances.isEmpty()) {
            return;
        }

        // Without a utilization figure the instances are assumed idle
        double cpuUtilization = usageProfile.get("EC2").getDouble(AVG_CPU_UTILIZATION, 0);
        if (cpuUtilization < LOW_CPU_UTILIZATION) {
            recommendations.add(new CostRecommendation(
                    "Consider rightsizing EC2 instances",
                    "EC2 instances appear underutilized based on CPU utilization. Smaller instance types or"
                            + " Auto Scaling may cover the load.",
                    Impact.HIGH,
                    "EC2",
                    costEstimate.monthlyCostOf("EC2") * RIGHTSIZING_SAVINGS,
                    "Review EC2 instance sizes and utilization patterns"));
        }

        if (instances.size() >= 2) {
            recommendations.add(new CostRecommendation(
                    "Consider Reserved Instances for stable workloads",
                    "Multiple EC2 instances could use Reserved Instance pricing for steady workloads.",
                    Impact.MEDIUM,
                    "EC2",
                    costEstimate.monthlyCostOf("EC2") * RESERVED_INSTANCE_SAVINGS,
                    "Evaluate 1 or 3-year Reserved Instance commitments"));
        }
    }

    private void adviseOnRds(List<ResourceDeclaration> resources, CostEstimate costEstimate,
                             List<CostRecommendation> recommendations) {
        boolean anyMultiAz = ofType(resources, "AWS::RDS::DBInstance").stream()
                .anyMatch(instance -> {
                    JsonNode multiAz = instance.property("MultiAZ");
                    return multiAz.isBoolean() ? multiAz.booleanValue() : "true".equalsIgnoreCase(multiAz.asText(""));
                });
        if (anyMultiAz && costEstimate.totalMonthlyCost() < MULTI_AZ_REVIEW_THRESHOLD) {
            recommendations.add(new CostRecommendation(
                    "Evaluate necessity of Multi-AZ RDS deployments",
                    "Single-AZ RDS deployments cost less for non-production environments.",
                    Impact.MEDIUM,
                    "RDS",
                    costEstimate.monthlyCostOf("RDS") * MULTI_AZ_SAVINGS,
                    "Evaluate high availability requirements and consider Single-AZ for non-critical environments"));
        }
    }

    private void adviseOnArchitecture(List<ResourceDeclaration> resources, List<CostRecommendation> recommendations) {
        boolean hasInstances = !ofType(resources, "AWS::EC2::Instance").isEmpty();
        boolean hasFunctions = !ofType(resources, "AWS::Lambda::Function").isEmpty();
        if (hasInstances && !hasFunctions) {
            recommendations.add(new CostRecommendation(
                    "Consider serverless architecture components",
                    "The architecture relies on EC2 instances only. Lambda may suit some of its workloads.",
                    Impact.HIGH,
                    "Architecture",
                    null,
                    "Identify workloads suitable for serverless migration"));
        }

        boolean hasApi = resources.stream().anyMatch(resource -> resource.type().startsWith("AWS::ApiGateway"));
        boolean hasCache = resources.stream().anyMatch(resource ->
                resource.isType("AWS::CloudFront::Distribution") || resource.type().startsWith("AWS::ElastiCache::"));
        if (hasApi && !hasCache) {
            recommendations.add(new CostRecommendation(
                    "Implement caching solutions",
                    "CloudFront or ElastiCache in front of the API would reduce direct API calls.",
                    Impact.MEDIUM,
                    "Architecture",
                    null,
                    "Evaluate CloudFront for API caching or ElastiCache for application-level caching"));
        }
    }

    private void compareTotalCosts(List<Map.Entry<String, ArchitectureAnalysis>> entries,
                                   List<CostRecommendation> recommendations) {
        List<Map.Entry<String, ArchitectureAnalysis>> byCost = new ArrayList<>(entries);
        byCost.sort(Comparator.comparingDouble(entry -> monthly(entry.getValue())));

        Map.Entry<String, ArchitectureAnalysis> cheapest = byCost.get(0);
        Map.Entry<String, ArchitectureAnalysis> mostExpensive = byCost.get(byCost.size() - 1);
        double difference = monthly(mostExpensive.getValue()) - monthly(cheapest.getValue());

        if (difference > SIGNIFICANT_TOTAL_DIFFERENCE) {
            double percentage = difference / monthly(mostExpensive.getValue()) * 100;
            recommendations.add(new CostRecommendation(
                    cheapest.getKey() + " is more cost-effective",
                    String.format(Locale.US, "The %s architecture is %.1f%% cheaper than %s."
                                    + " Consider adopting similar patterns where applicable.",
                            cheapest.getKey(), percentage, mostExpensive.getKey()),
                    Impact.HIGH,
                    "Architecture",
                    difference,
                    "Review key architectural differences and cost drivers"));
        }
    }

    private void compareServiceCosts(List<Map.Entry<String, ArchitectureAnalysis>> entries,
                                     List<CostRecommendation> recommendations) {
        for (int i = 0; i < entries.size(); i++) {
            Map<String, Double> first = entries.get(i).getValue().costEstimate().costBreakdown();
            for (int j = i + 1; j < entries.size(); j++) {
                String otherName = entries.get(j).getKey();
                Map<String, Double> other = entries.get(j).getValue().costEstimate().costBreakdown();

                first.forEach((service, cost) -> {
                    double otherCost = other.getOrDefault(service, 0.0);
                    if (otherCost > 0 && cost > 0
                            && otherCost / cost < SERVICE_COST_RATIO
                            && cost - otherCost > SIGNIFICANT_SERVICE_DIFFERENCE) {
                        recommendations.add(new CostRecommendation(
                                service + " usage is more efficient in " + otherName,
                                service + " costs are significantly lower in the " + otherName
                                        + " architecture. Consider examining its implementation approach.",
                                Impact.MEDIUM,
                                service,
                                null,
                                "Review " + service + " configuration in both architectures"));
                    }
                });
            }
        }
    }

    private void compareResourceEfficiency(List<Map.Entry<String, ArchitectureAnalysis>> entries,
                                           List<CostRecommendation> recommendations) {
        List<Map.Entry<String, ArchitectureAnalysis>> byEfficiency = new ArrayList<>(entries);
        byEfficiency.sort(Comparator.comparingDouble(entry -> costPerResource(entry.getValue())));

        Map.Entry<String, ArchitectureAnalysis> mostEfficient = byEfficiency.get(0);
        Map.Entry<String, ArchitectureAnalysis> leastEfficient = byEfficiency.get(byEfficiency.size() - 1);

        if (costPerResource(leastEfficient.getValue())
                > costPerResource(mostEfficient.getValue()) * RESOURCE_EFFICIENCY_RATIO) {
            recommendations.add(new CostRecommendation(
                    mostEfficient.getKey() + " has better resource efficiency",
                    "The " + mostEfficient.getKey() + " architecture has a better cost-to-resource ratio than "
                            + leastEfficient.getKey() + ".",
                    Impact.MEDIUM,
                    "Architecture",
                    null,
                    "Review resource utilization patterns across architectures"));
        }
    }

    private void compareArchitectureStyles(List<Map.Entry<String, ArchitectureAnalysis>> entries,
                                           List<CostRecommendation> recommendations) {
        boolean hasServerless = entries.stream().anyMatch(entry -> isServerless(entry.getKey(), entry.getValue()));
        boolean hasContainers = entries.stream().anyMatch(entry -> isContainerBased(entry.getKey(), entry.getValue()));
        boolean hasEc2 = entries.stream().anyMatch(entry -> isEc2Based(entry.getKey(), entry.getValue()));

        int styles = (hasServerless ? 1 : 0) + (hasContainers ? 1 : 0) + (hasEc2 ? 1 : 0);
        if (styles < 2) {
            return;
        }

        Map.Entry<String, ArchitectureAnalysis> lowest = entries.get(0);
        for (Map.Entry<String, ArchitectureAnalysis> entry : entries) {
            if (monthly(entry.getValue()) < monthly(lowest.getValue())) {
                lowest = entry;
            }
        }

        String style;
        if (isServerless(lowest.getKey(), lowest.getValue())) {
            style = "serverless";
        } else if (isContainerBased(lowest.getKey(), lowest.getValue())) {
            style = "container-based";
        } else {
            style = "EC2-based";
        }

        recommendations.add(new CostRecommendation(
                "Consider hybrid or complete " + style + " architecture",
                "The " + style + " architecture (" + lowest.getKey() + ") has the lowest overall cost."
                        + " Consider which workloads would benefit from this approach.",
                Impact.HIGH,
                "Architecture",
                null,
                "Evaluate workloads for potential migration to a " + style + " approach"));
    }

    private static boolean isServerless(String name, ArchitectureAnalysis analysis) {
        return name.toLowerCase(Locale.ROOT).contains("serverless")
                || analysis.resourceCounts().containsKey("AWS::Lambda::Function");
    }

    private static boolean isContainerBased(String name, ArchitectureAnalysis analysis) {
        return name.toLowerCase(Locale.ROOT).contains("container")
                || analysis.resourceCounts().keySet().stream()
                        .anyMatch(type -> type.startsWith("AWS::ECS::") || type.startsWith("AWS::EKS::"));
    }

    private static boolean isEc2Based(String name, ArchitectureAnalysis analysis) {
        return name.toLowerCase(Locale.ROOT).contains("ec2")
                || analysis.resourceCounts().containsKey("AWS::EC2::Instance");
    }

    private static double monthly(ArchitectureAnalysis analysis) {
        return analysis.costEstimate().totalMonthlyCost();
    }

    private static double costPerResource(ArchitectureAnalysis analysis) {
        int resources = analysis.totalResourceCount();
        return resources > 0 ? monthly(analysis) / resources : 0.0;
    }

    private static List<ResourceDeclaration> ofType(List<ResourceDeclaration> resources, String type) {
        return resources.stream()
                .filter(resource -> resource.isType(type))
                .toList();
    }

    private static int intProperty(ResourceDeclaration resource, String name, int defaultValue) {
        JsonNode value = resource.property(name);
        if (value.isNumber()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            return value.asInt(defaultValue);
        }
        return defaultValue;
    }
}
