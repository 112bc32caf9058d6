package org.carball.stackcost.estimator;

import org.carball.stackcost.config.AnalysisOptions;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.usage.ServiceUsage;
import org.carball.stackcost.model.usage.UsageProfile;
import org.carball.stackcost.parser.ServiceClassifier;
import org.carball.stackcost.parser.TemplateParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.carball.stackcost.estimator.UsageKeys.*;

public class UsageEstimatorTest {

    private UsageEstimator estimator;
    private ServiceClassifier classifier;
    private TemplateParser parser;

    @BeforeEach
    void setUp() {
        classifier = new ServiceClassifier();
        parser = new TemplateParser();
        estimator = new UsageEstimator(classifier, UsageDefaults.standard());
    }

    @Test
    void shouldAverageDeclaredLambdaMemory() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "A": { "Type": "AWS::Lambda::Function", "Properties": { "MemorySize": 256 } },
                "B": { "Type": "AWS::Lambda::Function", "Properties": { "MemorySize": 512 } },
                "Live": { "Type": "AWS::Lambda::Alias" }
              }
            }
            """);

        // When
        ServiceUsage usage = estimate("Lambda", template, AnalysisOptions.defaults());

        // Then
        assertThat(usage.getDouble(AVG_MEMORY_SIZE, 0)).isEqualTo(384.0);
        assertThat(usage.getDouble(FUNCTION_COUNT, 0)).isEqualTo(2.0);
        assertThat(usage.getDouble(AVG_RESOURCE_COUNT, 0)).isEqualTo(3.0);
        assertThat(usage.getDouble(AVG_DURATION_MS, 0)).isEqualTo(500.0);
        assertThat(usage.getDouble(AVG_MONTHLY_REQUESTS, 0)).isEqualTo(100_000.0);
    }

    @Test
    void shouldUseDefaultMemoryForFunctionsWithoutDeclaration() throws Exception {
        // Given
        CloudTemplate mixed = parser.parse("""
            {
              "Resources": {
                "Small": { "Type": "AWS::Lambda::Function" },
                "Large": { "Type": "AWS::Lambda::Function", "Properties": { "MemorySize": "1024" } }
              }
            }
            """);
        CloudTemplate undeclared = parser.parse("""
            { "Resources": { "Fn": { "Type": "AWS::Lambda::Function", "Properties": {} } } }
            """);

        // When/Then
        assertThat(estimate("Lambda", mixed, AnalysisOptions.defaults()).getDouble(AVG_MEMORY_SIZE, 0))
                .isEqualTo(576.0);
        assertThat(estimate("Lambda", undeclared, AnalysisOptions.defaults()).getDouble(AVG_MEMORY_SIZE, 0))
                .isEqualTo(128.0);
    }

    @Test
    void shouldApplyOverridesPerKeyOnly() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            { "Resources": { "Fn": { "Type": "AWS::Lambda::Function", "Properties": { "MemorySize": 512 } } } }
            """);
        AnalysisOptions options = AnalysisOptions.builder()
                .usageAssumption("Lambda", Map.of(AVG_MEMORY_SIZE, 2048, AVG_MONTHLY_REQUESTS, 5_000_000))
                .build();

        // When
        ServiceUsage usage = estimate("Lambda", template, options);

        // Then
        assertThat(usage.get(AVG_MEMORY_SIZE)).isEqualTo(2048);
        assertThat(usage.get(AVG_MONTHLY_REQUESTS)).isEqualTo(5_000_000);
        assertThat(usage.getDouble(AVG_DURATION_MS, 0)).isEqualTo(500.0);
        assertThat(usage.getDouble(FUNCTION_COUNT, 0)).isEqualTo(1.0);
    }

    @Test
    void shouldDeriveS3StorageAndRequestSplit() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Assets": { "Type": "AWS::S3::Bucket" },
                "Logs": { "Type": "AWS::S3::Bucket" },
                "Policy": { "Type": "AWS::S3::BucketPolicy" }
              }
            }
            """);
        AnalysisOptions options = AnalysisOptions.builder()
                .usageAssumption("S3", Map.of(AVG_MONTHLY_REQUESTS, 1000))
                .build();

        // When
        ServiceUsage defaults = estimate("S3", template, AnalysisOptions.defaults());
        ServiceUsage overridden = estimate("S3", template, options);

        // Then
        assertThat(defaults.getDouble(BUCKET_COUNT, 0)).isEqualTo(2.0);
        assertThat(defaults.getDouble(STORAGE_GB, 0)).isEqualTo(40.0);
        assertThat(defaults.getDouble(MONTHLY_GET_REQUESTS, 0)).isCloseTo(80_000.0, within(1e-6));
        assertThat(defaults.getDouble(MONTHLY_PUT_REQUESTS, 0)).isCloseTo(20_000.0, within(1e-6));

        // request split follows the overridden request volume
        assertThat(overridden.getDouble(MONTHLY_GET_REQUESTS, 0)).isCloseTo(800.0, within(1e-6));
        assertThat(overridden.getDouble(MONTHLY_PUT_REQUESTS, 0)).isCloseTo(200.0, within(1e-6));
    }

    @Test
    void shouldReadDynamoDbProvisionedThroughput() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Orders": {
                  "Type": "AWS::DynamoDB::Table",
                  "Properties": { "ProvisionedThroughput": { "ReadCapacityUnits": 10, "WriteCapacityUnits": 4 } }
                },
                "Events": {
                  "Type": "AWS::DynamoDB::Table",
                  "Properties": { "ProvisionedThroughput": { "ReadCapacityUnits": 5 } }
                }
              }
            }
            """);

        // When
        ServiceUsage usage = estimate("DynamoDB", template, AnalysisOptions.defaults());

        // Then - the missing write capacity falls back to the default of 5
        assertThat(usage.getBoolean(PROVISIONED_MODE, false)).isTrue();
        assertThat(usage.getDouble(READ_CAPACITY_UNITS, 0)).isEqualTo(15.0);
        assertThat(usage.getDouble(WRITE_CAPACITY_UNITS, 0)).isEqualTo(9.0);
        assertThat(usage.getDouble(TABLE_COUNT, 0)).isEqualTo(2.0);
        assertThat(usage.getDouble(STORAGE_GB, 0)).isEqualTo(2.0);
    }

    @Test
    void shouldTreatTablesWithoutThroughputAsOnDemand() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            { "Resources": { "T": { "Type": "AWS::DynamoDB::Table", "Properties": { "BillingMode": "PAY_PER_REQUEST" } } } }
            """);

        // When
        ServiceUsage usage = estimate("DynamoDB", template, AnalysisOptions.defaults());

        // Then
        assertThat(usage.getBoolean(PROVISIONED_MODE, true)).isFalse();
        assertThat(usage.getDouble(MONTHLY_READ_REQUEST_UNITS, 0)).isCloseTo(80_000.0, within(1e-6));
        assertThat(usage.getDouble(MONTHLY_WRITE_REQUEST_UNITS, 0)).isCloseTo(20_000.0, within(1e-6));
    }

    @Test
    void shouldCountApisAndCarryRequestVolume() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Api": { "Type": "AWS::ApiGateway::RestApi" },
                "Deployment": { "Type": "AWS::ApiGateway::Deployment" },
                "HttpApi": { "Type": "AWS::ApiGatewayV2::Api" }
              }
            }
            """);

        // When
        ServiceUsage usage = estimate("API Gateway", template, AnalysisOptions.defaults());

        // Then
        assertThat(usage.getDouble(API_COUNT, 0)).isEqualTo(2.0);
        assertThat(usage.getDouble(MONTHLY_REQUESTS, 0)).isEqualTo(100_000.0);
    }

    @Test
    void shouldDeriveEc2InstancesFromInstancesAndAutoScalingGroups() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Web1": { "Type": "AWS::EC2::Instance", "Properties": { "InstanceType": "m5.large" } },
                "Web2": { "Type": "AWS::EC2::Instance", "Properties": { "InstanceType": "t3.medium" } },
                "Web3": { "Type": "AWS::EC2::Instance", "Properties": { "InstanceType": "t3.medium" } },
                "Workers": { "Type": "AWS::AutoScaling::AutoScalingGroup", "Properties": { "MinSize": "2" } },
                "Sg": { "Type": "AWS::EC2::SecurityGroup" }
              }
            }
            """);

        // When
        ServiceUsage usage = estimate("EC2", template, AnalysisOptions.defaults());

        // Then
        assertThat(usage.getDouble(INSTANCE_COUNT, 0)).isEqualTo(5.0);
        assertThat(usage.getString(INSTANCE_TYPE, null)).isEqualTo("t3.medium");
        assertThat(usage.getDouble(USAGE_HOURS, 0)).isEqualTo(730.0);
        assertThat(usage.getDouble(EBS_STORAGE_GB, 0)).isEqualTo(150.0);
    }

    @Test
    void shouldBreakInstanceTypeTiesByFirstSeen() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "A": { "Type": "AWS::EC2::Instance", "Properties": { "InstanceType": "c5.large" } },
                "B": { "Type": "AWS::EC2::Instance", "Properties": { "InstanceType": "t3.small" } }
              }
            }
            """);

        // When/Then
        assertThat(estimate("EC2", template, AnalysisOptions.defaults()).getString(INSTANCE_TYPE, null))
                .isEqualTo("c5.large");
    }

    @Test
    void shouldReportNoInstancesWhenOnlyNetworkingIsDeclared() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            { "Resources": { "Vpc": { "Type": "AWS::EC2::VPC" }, "Sg": { "Type": "AWS::EC2::SecurityGroup" } } }
            """);

        // When
        ServiceUsage usage = estimate("EC2", template, AnalysisOptions.defaults());

        // Then
        assertThat(usage.getDouble(INSTANCE_COUNT, -1)).isEqualTo(0.0);
        assertThat(usage.getString(INSTANCE_TYPE, null)).isEqualTo("t3.micro");
        assertThat(usage.getDouble(EBS_STORAGE_GB, -1)).isEqualTo(0.0);
    }

    @Test
    void shouldFallBackToGenericProfileForUnknownServices() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Q1": { "Type": "AWS::SQS::Queue" },
                "Q2": { "Type": "AWS::SQS::Queue" },
                "Q3": { "Type": "AWS::SQS::Queue" }
              }
            }
            """);

        // When
        ServiceUsage usage = estimate("SQS", template, AnalysisOptions.defaults());

        // Then
        assertThat(usage.getDouble(AVG_RESOURCE_COUNT, 0)).isEqualTo(3.0);
        assertThat(usage.getDouble(AVG_MONTHLY_REQUESTS, 0)).isEqualTo(100_000.0);
        assertThat(usage.getDouble(STORAGE_GB, 0)).isEqualTo(20.0);
        assertThat(usage.getDouble(DATA_TRANSFER_GB, 0)).isEqualTo(50.0);
        assertThat(usage.getBoolean(APPLY_FREE_TIER, true)).isFalse();
    }

    @Test
    void shouldEstimateEveryServiceInOrder() throws Exception {
        // Given
        CloudTemplate template = parser.parse("""
            {
              "Resources": {
                "Fn": { "Type": "AWS::Lambda::Function" },
                "Topic": { "Type": "AWS::SNS::Topic" },
                "Bucket": { "Type": "AWS::S3::Bucket" }
              }
            }
            """);

        // When
        UsageProfile profile = estimator.estimateAll(List.of("Lambda", "SNS", "S3"), template,
                AnalysisOptions.defaults());

        // Then
        assertThat(profile.serviceNames()).containsExactly("Lambda", "SNS", "S3");
        assertThat(profile.get("Unknown").size()).isZero();
    }

    private ServiceUsage estimate(String service, CloudTemplate template, AnalysisOptions options) {
        return estimator.estimate(service, classifier.getResourcesForService(service, template), options);
    }
}
