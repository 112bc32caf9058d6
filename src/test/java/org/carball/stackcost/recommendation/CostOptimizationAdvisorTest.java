package org.carball.stackcost.recommendation;

import org.carball.stackcost.model.analysis.ArchitectureAnalysis;
import org.carball.stackcost.model.cost.CostComponent;
import org.carball.stackcost.model.cost.CostEstimate;
import org.carball.stackcost.model.cost.ServiceCost;
import org.carball.stackcost.model.recommendation.CostRecommendation;
import org.carball.stackcost.model.recommendation.Impact;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.usage.ServiceUsage;
import org.carball.stackcost.model.usage.UsageProfile;
import org.carball.stackcost.parser.TemplateParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class CostOptimizationAdvisorTest {

    private CostOptimizationAdvisor advisor;
    private TemplateParser parser;

    @BeforeEach
    void setUp() {
        advisor = new CostOptimizationAdvisor();
        parser = new TemplateParser();
    }

    @Test
    void shouldFlagOversizedLambdaMemoryWithSavings() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Big": { "Type": "AWS::Lambda::Function", "Properties": { "MemorySize": 2048 } },
                "Small": { "Type": "AWS::Lambda::Function", "Properties": { "MemorySize": 128 } }
              }
            }
            """);

        // When
        List<CostRecommendation> recommendations = advisor.advise(template, estimate("Lambda", 50.0));

        // Then
        assertThat(recommendations).hasSize(1);
        CostRecommendation memory = recommendations.get(0);
        assertThat(memory.title()).isEqualTo("Optimize Lambda function memory allocation");
        assertThat(memory.impact()).isEqualTo(Impact.MEDIUM);
        assertThat(memory.service()).isEqualTo("Lambda");
        assertThat(memory.description()).startsWith("1 Lambda function(s)");
        assertThat(memory.estimatedMonthlySavings()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void shouldFlagLongLambdaTimeoutsWithoutSavingsEstimate() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Worker": { "Type": "AWS::Lambda::Function", "Properties": { "Timeout": 300 } }
              }
            }
            """);

        // When
        List<CostRecommendation> recommendations = advisor.advise(template, CostEstimate.empty());

        // Then
        assertThat(recommendations)
                .extracting(CostRecommendation::title)
                .containsExactly("Review Lambda function timeout settings");
        assertThat(recommendations.get(0).impact()).isEqualTo(Impact.LOW);
        assertThat(recommendations.get(0).estimatedMonthlySavings()).isNull();
    }

    @Test
    void shouldSuggestLifecyclePoliciesOnlyForBucketsWithout() throws Exception {
        // Given
        CloudTemplate withPolicy = parser.parse("""
            {
              "Resources": {
                "Archive": {
                  "Type": "AWS::S3::Bucket",
                  "Properties": { "LifecycleConfiguration": { "Rules": [] } }
                }
              }
            }
            """);
        CloudTemplate withoutPolicy = parser.parse("""
            { "Resources": { "Assets": { "Type": "AWS::S3::Bucket" } } }
            """);

        // When
        List<CostRecommendation> none = advisor.advise(withPolicy, estimate("S3", 20.0));
        List<CostRecommendation> some = advisor.advise(withoutPolicy, estimate("S3", 20.0));

        // Then
        assertThat(none).isEmpty();
        assertThat(some).hasSize(1);
        assertThat(some.get(0).title()).isEqualTo("Implement S3 lifecycle policies");
        assertThat(some.get(0).estimatedMonthlySavings()).isCloseTo(6.0, within(1e-9));
    }

    @Test
    void shouldSuggestOnDemandForProvisionedTables() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "OnDemand": { "Type": "AWS::DynamoDB::Table", "Properties": { "BillingMode": "PAY_PER_REQUEST" } },
                "Provisioned": { "Type": "AWS::DynamoDB::Table", "Properties": { "BillingMode": "PROVISIONED" } }
              }
            }
            """);

        // When
        List<CostRecommendation> recommendations = advisor.advise(template, CostEstimate.empty());

        // Then
        assertThat(recommendations)
                .extracting(CostRecommendation::title)
                .containsExactly("Consider DynamoDB On-Demand capacity mode");
    }

    @Test
    void shouldSuggestRightsizingReservedInstancesAndServerlessForEc2OnlyArchitectures() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "WebA": { "Type": "AWS::EC2::Instance" },
                "WebB": { "Type": "AWS::EC2::Instance" }
              }
            }
            """);

        // When
        List<CostRecommendation> recommendations = advisor.advise(template, estimate("EC2", 100.0));

        // Then
        assertThat(recommendations)
                .extracting(CostRecommendation::title)
                .containsExactly("Consider rightsizing EC2 instances",
                        "Consider Reserved Instances for stable workloads",
                        "Consider serverless architecture components");
        assertThat(recommendations.get(0).impact()).isEqualTo(Impact.HIGH);
        assertThat(recommendations.get(0).estimatedMonthlySavings()).isCloseTo(30.0, within(1e-9));
        assertThat(recommendations.get(1).estimatedMonthlySavings()).isCloseTo(40.0, within(1e-9));
        assertThat(recommendations.get(2).impact()).isEqualTo(Impact.HIGH);
        assertThat(recommendations.get(2).service()).isEqualTo("Architecture");
    }

    @Test
    void shouldSkipRightsizingForWellUtilizedInstances() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            { "Resources": { "Web": { "Type": "AWS::EC2::Instance" } } }
            """);
        UsageProfile busy = new UsageProfile(Map.of("EC2", ServiceUsage.of(Map.of("avg_cpu_utilization", 65))));
        UsageProfile idle = new UsageProfile(Map.of("EC2", ServiceUsage.of(Map.of("avg_cpu_utilization", "39.9"))));

        // When/Then
        assertThat(advisor.advise(template, busy, estimate("EC2", 20.0)))
                .extracting(CostRecommendation::title)
                .containsExactly("Consider serverless architecture components");
        assertThat(advisor.advise(template, idle, estimate("EC2", 20.0)))
                .extracting(CostRecommendation::title)
                .first()
                .isEqualTo("Consider rightsizing EC2 instances");
    }

    @Test
    void shouldQuestionMultiAzDatabasesOnSmallBudgets() throws Exception {
        // Given
        CloudTemplate multiAz = parser.parse("""
            {
              "Resources": {
                "Primary": { "Type": "AWS::RDS::DBInstance", "Properties": { "MultiAZ": true } },
                "Replica": { "Type": "AWS::RDS::DBInstance", "Properties": { "MultiAZ": "false" } }
              }
            }
            """);
        CloudTemplate quoted = parser.parse("""
            { "Resources": { "Db": { "Type": "AWS::RDS::DBInstance", "Properties": { "MultiAZ": "true" } } } }
            """);
        CloudTemplate singleAz = parser.parse("""
            { "Resources": { "Db": { "Type": "AWS::RDS::DBInstance" } } }
            """);

        // When
        List<CostRecommendation> recommendations = advisor.advise(multiAz, estimate("RDS", 120.0));

        // Then
        assertThat(recommendations).singleElement().satisfies(recommendation -> {
            assertThat(recommendation.title()).isEqualTo("Evaluate necessity of Multi-AZ RDS deployments");
            assertThat(recommendation.impact()).isEqualTo(Impact.MEDIUM);
            assertThat(recommendation.service()).isEqualTo("RDS");
            assertThat(recommendation.estimatedMonthlySavings()).isCloseTo(60.0, within(1e-9));
        });
        assertThat(advisor.advise(quoted, estimate("RDS", 50.0))).hasSize(1);
        assertThat(advisor.advise(multiAz, estimate("RDS", 200.0))).isEmpty();
        assertThat(advisor.advise(singleAz, estimate("RDS", 50.0))).isEmpty();
    }

    @Test
    void shouldRecommendTheCheaperArchitectureWhenTotalsDifferWidely() {
        // Given
        Map<String, ArchitectureAnalysis> architectures = new LinkedHashMap<>();
        architectures.put("Containers", analysis(Map.of("AWS::ECS::Service", 4), "ECS", 400.0));
        architectures.put("Lean", analysis(Map.of("AWS::ECS::Service", 4), "ECS", 150.0));

        // When
        List<CostRecommendation> recommendations = advisor.adviseOnComparison(architectures);

        // Then
        assertThat(recommendations).extracting(CostRecommendation::title).containsExactly(
                "Lean is more cost-effective",
                "ECS usage is more efficient in Lean",
                "Lean has better resource efficiency");
        CostRecommendation cheaper = recommendations.get(0);
        assertThat(cheaper.impact()).isEqualTo(Impact.HIGH);
        assertThat(cheaper.description()).contains("62.5% cheaper than Containers");
        assertThat(cheaper.estimatedMonthlySavings()).isCloseTo(250.0, within(1e-9));
        assertThat(recommendations.get(1).impact()).isEqualTo(Impact.MEDIUM);
        assertThat(recommendations.get(1).service()).isEqualTo("ECS");
    }

    @Test
    void shouldPointToTheCheapestArchitectureStyleWhenStylesAreMixed() {
        // Given
        Map<String, ArchitectureAnalysis> architectures = new LinkedHashMap<>();
        architectures.put("Web Tier", analysis(Map.of("AWS::EC2::Instance", 2), "EC2", 60.0));
        architectures.put("Functions", analysis(Map.of("AWS::Lambda::Function", 2), "Lambda", 20.0));

        // When
        List<CostRecommendation> recommendations = advisor.adviseOnComparison(architectures);

        // Then
        assertThat(recommendations).extracting(CostRecommendation::title).containsExactly(
                "Functions has better resource efficiency",
                "Consider hybrid or complete serverless architecture");
        assertThat(recommendations.get(1).description()).contains("(Functions)");
    }

    @Test
    void shouldNotAdviseOnComparisonOfFewerThanTwoArchitectures() {
        assertThat(advisor.adviseOnComparison(Map.of())).isEmpty();
        assertThat(advisor.adviseOnComparison(Map.of("Only", analysis(Map.of(), "S3", 500.0)))).isEmpty();
        assertThat(advisor.adviseOnComparison(null)).isEmpty();
    }

    @Test
    void shouldSuggestCachingForUncachedApis() throws Exception {
        // Given
        CloudTemplate uncached = parser.parse("""
            { "Resources": { "Api": { "Type": "AWS::ApiGateway::RestApi" } } }
            """);
        CloudTemplate cached = parser.parse("""
            {
              "Resources": {
                "Api": { "Type": "AWS::ApiGateway::RestApi" },
                "Cdn": { "Type": "AWS::CloudFront::Distribution" }
              }
            }
            """);

        // When/Then
        assertThat(advisor.advise(uncached, CostEstimate.empty()))
                .extracting(CostRecommendation::title)
                .containsExactly("Implement caching solutions");
        assertThat(advisor.advise(cached, CostEstimate.empty())).isEmpty();
    }

    @Test
    void shouldStayQuietForEmptyTemplate() throws Exception {
        // Given
        CloudTemplate template = parser.parse("{}");

        // When/Then
        assertThat(advisor.advise(template, CostEstimate.empty())).isEmpty();
    }

    private static ArchitectureAnalysis analysis(Map<String, Integer> resourceCounts, String service,
                                                 double monthlyCost) {
        return new ArchitectureAnalysis("ignored", resourceCounts, List.of(service), new UsageProfile(Map.of()),
                estimate(service, monthlyCost), List.of(), null);
    }

    private static CostEstimate estimate(String service, double monthlyCost) {
        return CostEstimate.of(List.of(ServiceCost.of(service,
                List.of(new CostComponent("usage", 1.0, 1.0, monthlyCost, monthlyCost)))));
    }
}
