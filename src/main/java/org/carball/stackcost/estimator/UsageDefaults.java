package org.carball.stackcost.estimator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.stackcost.model.service.ServiceFamily;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.carball.stackcost.estimator.UsageKeys.*;

/**
 * Built-in usage assumptions. Generic defaults apply to every service; family defaults add to or
 * replace them for one family.
 */
@Value
public class UsageDefaults {

    Map<String, Object> genericDefaults;

    Map<ServiceFamily, Map<String, Object>> familyDefaults;

    @Builder(toBuilder = true)
    public UsageDefaults(@Singular("genericDefault") Map<String, Object> genericDefaults,
                         @Singular("familyDefault") Map<ServiceFamily, Map<String, Object>> familyDefaults) {
        this.genericDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(genericDefaults));

        Map<ServiceFamily, Map<String, Object>> families = new EnumMap<>(ServiceFamily.class);
        familyDefaults.forEach((family, values) ->
                families.put(family, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.familyDefaults = Collections.unmodifiableMap(families);
    }

    public static UsageDefaults standard() {
        return UsageDefaults.builder()
                .genericDefault(AVG_MONTHLY_REQUESTS, 100_000)
                .genericDefault(DATA_TRANSFER_GB, 50)
                .genericDefault(STORAGE_GB, 20)
                .genericDefault(USAGE_HOURS, 730)
                .genericDefault(APPLY_FREE_TIER, false)
                .familyDefault(ServiceFamily.LAMBDA, ordered(
                        AVG_MEMORY_SIZE, 128,
                        AVG_DURATION_MS, 500))
                .familyDefault(ServiceFamily.S3, ordered(
                        STORAGE_GB_PER_BUCKET, 20))
                .familyDefault(ServiceFamily.DYNAMODB, ordered(
                        PROVISIONED_MODE, false,
                        READ_CAPACITY_UNITS, 5,
                        WRITE_CAPACITY_UNITS, 5,
                        STORAGE_GB_PER_TABLE, 1))
                .familyDefault(ServiceFamily.EC2, ordered(
                        INSTANCE_TYPE, "t3.micro",
                        EBS_STORAGE_GB_PER_INSTANCE, 30))
                .build();
    }

    private static Map<String, Object> ordered(Object... keysAndValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            values.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return values;
    }

    /**
     * Generic defaults overlaid with the family's own defaults.
     */
    public Map<String, Object> forFamily(ServiceFamily family) {
        Map<String, Object> defaults = new LinkedHashMap<>(genericDefaults);
        Map<String, Object> familySpecific = familyDefaults.get(family);
        if (familySpecific != null) {
            defaults.putAll(familySpecific);
        }
        return defaults;
    }
}
