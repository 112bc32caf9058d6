package org.carball.stackcost.estimator;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.config.AnalysisOptions;
import org.carball.stackcost.model.service.ServiceFamily;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.template.ResourceDeclaration;
import org.carball.stackcost.model.usage.ServiceUsage;
import org.carball.stackcost.model.usage.UsageProfile;
import org.carball.stackcost.parser.ServiceClassifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.carball.stackcost.estimator.UsageKeys.*;

/**
 * Derives monthly usage assumptions for each service from its resources, the built-in defaults and
 * the caller's overrides. See {@link UsageMerger} for the precedence rules.
 */
@Slf4j
public class UsageEstimator {

    static final String LAMBDA_FUNCTION = "AWS::Lambda::Function";
    static final String S3_BUCKET = "AWS::S3::Bucket";
    static final String DYNAMODB_TABLE = "AWS::DynamoDB::Table";
    static final String EC2_INSTANCE = "AWS::EC2::Instance";
    static final String AUTO_SCALING_GROUP = "AWS::AutoScaling::AutoScalingGroup";

    private static final Set<String> API_TYPES = Set.of(
            "AWS::ApiGateway::RestApi",
            "AWS::ApiGateway::Stage",
            "AWS::ApiGatewayV2::Api"
    );

    private static final double READ_SHARE = 0.8;
    private static final double WRITE_SHARE = 0.2;

    private final ServiceClassifier classifier;
    private final UsageDefaults defaults;

    public UsageEstimator(ServiceClassifier classifier, UsageDefaults defaults) {
        this.classifier = classifier;
        this.defaults = defaults;
    }

    public UsageEstimator() {
        this(new ServiceClassifier(), UsageDefaults.standard());
    }

    public UsageProfile estimateAll(List<String> services, CloudTemplate template, AnalysisOptions options) {
        Map<String, ServiceUsage> profile = new LinkedHashMap<>();
        for (String service : services) {
            List<ResourceDeclaration> resources = classifier.getResourcesForService(service, template);
            profile.put(service, estimate(service, resources, options));
        }
        return new UsageProfile(profile);
    }

    public ServiceUsage estimate(String serviceName, List<ResourceDeclaration> resources, AnalysisOptions options) {
        ServiceFamily family = classifier.familyOf(serviceName);
        Map<String, Object> familyDefaults = defaults.forFamily(family);
        Map<String, Object> overrides = options.overridesFor(serviceName);

        ServiceUsage base = UsageMerger.base(familyDefaults, overrides);
        Map<String, Object> derived = derive(family, resources, base);

        if (!overrides.isEmpty()) {
            log.debug("Applying {} usage override(s) to {}", overrides.size(), serviceName);
        }
        return UsageMerger.merge(familyDefaults, derived, overrides);
    }

    private Map<String, Object> derive(ServiceFamily family, List<ResourceDeclaration> resources, ServiceUsage base) {
        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put(AVG_RESOURCE_COUNT, Math.max(resources.size(), 1));

        switch (family) {
            case LAMBDA -> deriveLambdaUsage(resources, base, derived);
            case S3 -> deriveS3Usage(resources, base, derived);
            case DYNAMODB -> deriveDynamoDbUsage(resources, base, derived);
            case API_GATEWAY -> deriveApiGatewayUsage(resources, base, derived);
            case EC2 -> deriveEc2Usage(resources, base, derived);
            case GENERIC -> log.debug("No usage rules for {} resource(s), using generic defaults", resources.size());
        }
        return derived;
    }

    private void deriveLambdaUsage(List<ResourceDeclaration> resources, ServiceUsage base,
                                   Map<String, Object> derived) {
        List<ResourceDeclaration> functions = ofType(resources, LAMBDA_FUNCTION);
        derived.put(FUNCTION_COUNT, Math.max(functions.size(), 1));

        boolean anyDeclared = functions.stream().anyMatch(function -> function.hasProperty("MemorySize"));
        if (!anyDeclared) {
            return;
        }

        int defaultMemory = (int) base.getDouble(AVG_MEMORY_SIZE, 128);
        long totalMemory = 0;
        for (ResourceDeclaration function : functions) {
            totalMemory += readPositiveInt(function, "MemorySize", defaultMemory);
        }
        derived.put(AVG_MEMORY_SIZE, Math.round((double) totalMemory / functions.size()));
    }

    private void deriveS3Usage(List<ResourceDeclaration> resources, ServiceUsage base,
                               Map<String, Object> derived) {
        int bucketCount = Math.max(ofType(resources, S3_BUCKET).size(), 1);
        double requests = base.getDouble(AVG_MONTHLY_REQUESTS, 0);

        derived.put(BUCKET_COUNT, bucketCount);
        derived.put(STORAGE_GB, bucketCount * base.getDouble(STORAGE_GB_PER_BUCKET, 0));
        derived.put(MONTHLY_GET_REQUESTS, requests * READ_SHARE);
        derived.put(MONTHLY_PUT_REQUESTS, requests * WRITE_SHARE);
    }

    private void deriveDynamoDbUsage(List<ResourceDeclaration> resources, ServiceUsage base,
                                     Map<String, Object> derived) {
        List<ResourceDeclaration> tables = ofType(resources, DYNAMODB_TABLE);
        int tableCount = Math.max(tables.size(), 1);
        int defaultReadUnits = (int) base.getDouble(READ_CAPACITY_UNITS, 5);
        int defaultWriteUnits = (int) base.getDouble(WRITE_CAPACITY_UNITS, 5);

        int readUnits = 0;
        int writeUnits = 0;
        for (ResourceDeclaration table : tables) {
            JsonNode throughput = table.property("ProvisionedThroughput");
            if (throughput.isObject()) {
                readUnits += readPositiveInt(throughput.path("ReadCapacityUnits"), defaultReadUnits, table.logicalId());
                writeUnits += readPositiveInt(throughput.path("WriteCapacityUnits"), defaultWriteUnits, table.logicalId());
            }
        }

        derived.put(TABLE_COUNT, tableCount);
        if (readUnits > 0 || writeUnits > 0) {
            derived.put(PROVISIONED_MODE, true);
            derived.put(READ_CAPACITY_UNITS, Math.max(readUnits, 1));
            derived.put(WRITE_CAPACITY_UNITS, Math.max(writeUnits, 1));
        } else {
            double requests = base.getDouble(AVG_MONTHLY_REQUESTS, 0);
            derived.put(PROVISIONED_MODE, false);
            derived.put(MONTHLY_READ_REQUEST_UNITS, requests * READ_SHARE);
            derived.put(MONTHLY_WRITE_REQUEST_UNITS, requests * WRITE_SHARE);
        }
        derived.put(STORAGE_GB, tableCount * base.getDouble(STORAGE_GB_PER_TABLE, 0));
    }

    private void deriveApiGatewayUsage(List<ResourceDeclaration> resources, ServiceUsage base,
                                       Map<String, Object> derived) {
        long apiCount = resources.stream()
                .filter(resource -> API_TYPES.contains(resource.type()))
                .count();

        derived.put(API_COUNT, Math.max((int) apiCount, 1));
        derived.put(MONTHLY_REQUESTS, base.getDouble(AVG_MONTHLY_REQUESTS, 0));
    }

    private void deriveEc2Usage(List<ResourceDeclaration> resources, ServiceUsage base,
                                Map<String, Object> derived) {
        List<ResourceDeclaration> instances = ofType(resources, EC2_INSTANCE);
        int instanceCount = instances.size();
        for (ResourceDeclaration group : ofType(resources, AUTO_SCALING_GROUP)) {
            instanceCount += readPositiveInt(group, "MinSize", 1);
        }

        derived.put(INSTANCE_COUNT, instanceCount);
        String instanceType = mostCommonInstanceType(instances);
        if (instanceType != null) {
            derived.put(INSTANCE_TYPE, instanceType);
        }
        derived.put(EBS_STORAGE_GB, instanceCount * base.getDouble(EBS_STORAGE_GB_PER_INSTANCE, 0));
    }

    private String mostCommonInstanceType(List<ResourceDeclaration> instances) {
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (ResourceDeclaration instance : instances) {
            JsonNode type = instance.property("InstanceType");
            if (type.isTextual() && !type.asText().isBlank()) {
                typeCounts.merge(type.asText(), 1, Integer::sum);
            }
        }

        String mostCommon = null;
        int highest = 0;
        for (Map.Entry<String, Integer> entry : typeCounts.entrySet()) {
            if (entry.getValue() > highest) {
                mostCommon = entry.getKey();
                highest = entry.getValue();
            }
        }
        return mostCommon;
    }

    private static List<ResourceDeclaration> ofType(List<ResourceDeclaration> resources, String type) {
        return resources.stream()
                .filter(resource -> resource.isType(type))
                .toList();
    }

    private static int readPositiveInt(ResourceDeclaration resource, String property, int fallback) {
        return readPositiveInt(resource.property(property), fallback, resource.logicalId());
    }

    private static int readPositiveInt(JsonNode node, int fallback, String logicalId) {
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }

        int value = 0;
        if (node.isNumber()) {
            value = node.asInt();
        } else if (node.isTextual()) {
            try {
                value = Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                value = 0;
            }
        }

        if (value <= 0) {
            log.debug("Resource {} has an unusable numeric property ({}), using {}", logicalId, node, fallback);
            return fallback;
        }
        return value;
    }
}
