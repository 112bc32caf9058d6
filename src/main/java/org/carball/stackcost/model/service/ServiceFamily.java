package org.carball.stackcost.model.service;

/**
 * Service families that have their own usage and pricing rules. Every other service is {@link #GENERIC}.
 */
public enum ServiceFamily {
    LAMBDA("Lambda"),
    S3("S3"),
    DYNAMODB("DynamoDB"),
    API_GATEWAY("API Gateway"),
    EC2("EC2"),
    GENERIC(null);

    private final String serviceName;

    ServiceFamily(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }

    public static ServiceFamily fromServiceName(String serviceName) {
        for (ServiceFamily family : values()) {
            if (family.serviceName != null && family.serviceName.equals(serviceName)) {
                return family;
            }
        }
        return GENERIC;
    }
}
