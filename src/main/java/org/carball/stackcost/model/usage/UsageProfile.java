package org.carball.stackcost.model.usage;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Usage assumptions for every service of one architecture, in service discovery order.
 */
@EqualsAndHashCode
@ToString
public final class UsageProfile {

    private final Map<String, ServiceUsage> services;

    public UsageProfile(Map<String, ServiceUsage> services) {
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    @JsonValue
    public Map<String, ServiceUsage> asMap() {
        return services;
    }

    public ServiceUsage get(String service) {
        return services.getOrDefault(service, ServiceUsage.empty());
    }

    public Set<String> serviceNames() {
        return services.keySet();
    }

    public boolean isEmpty() {
        return services.isEmpty();
    }
}
