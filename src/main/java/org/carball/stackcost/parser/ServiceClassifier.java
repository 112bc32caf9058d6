package org.carball.stackcost.parser;

import org.carball.stackcost.model.service.ServiceFamily;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.template.ResourceDeclaration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps resource types to canonical service names. Segments missing from the table are used verbatim,
 * so every typed resource belongs to exactly one service.
 */
public class ServiceClassifier {

    private static final Map<String, String> SERVICE_NAMES = Map.ofEntries(
            Map.entry("Lambda", "Lambda"),
            Map.entry("ApiGateway", "API Gateway"),
            Map.entry("ApiGatewayV2", "API Gateway"),
            Map.entry("S3", "S3"),
            Map.entry("DynamoDB", "DynamoDB"),
            Map.entry("EC2", "EC2"),
            Map.entry("AutoScaling", "EC2"),
            Map.entry("IAM", "IAM"),
            Map.entry("CloudFront", "CloudFront"),
            Map.entry("SNS", "SNS"),
            Map.entry("SQS", "SQS"),
            Map.entry("RDS", "RDS"),
            Map.entry("ECS", "ECS"),
            Map.entry("ElasticLoadBalancing", "ELB"),
            Map.entry("ElasticLoadBalancingV2", "ELB")
    );

    public String classify(String resourceType) {
        String segment = ResourceDeclaration.serviceSegmentOf(resourceType);
        if (segment == null) {
            return null;
        }
        return SERVICE_NAMES.getOrDefault(segment, segment);
    }

    /**
     * Distinct service names for the given types, in first-seen order.
     */
    public List<String> extractServices(Collection<String> resourceTypes) {
        Set<String> services = new LinkedHashSet<>();
        for (String type : resourceTypes) {
            String service = classify(type);
            if (service != null) {
                services.add(service);
            }
        }
        return new ArrayList<>(services);
    }

    /**
     * All typed resources whose type classifies to {@code serviceName}, in declaration order.
     */
    public List<ResourceDeclaration> getResourcesForService(String serviceName, CloudTemplate template) {
        List<ResourceDeclaration> matches = new ArrayList<>();
        for (ResourceDeclaration resource : template.typedResources()) {
            if (serviceName.equals(classify(resource.type()))) {
                matches.add(resource);
            }
        }
        return matches;
    }

    public ServiceFamily familyOf(String serviceName) {
        return ServiceFamily.fromServiceName(serviceName);
    }
}
