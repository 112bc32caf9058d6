package org.carball.stackcost.pricing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit prices for one service, in currency units per billable unit of each dimension. Immutable; a
 * price section left empty in the pricing file reads as no prices.
 */
@Value
public class PricingEntry {

    String description;

    @JsonProperty("unit_prices")
    Map<String, Double> unitPrices;

    // EC2 style per-hour prices keyed by instance type
    @JsonProperty("instance_hour_prices")
    Map<String, Double> instanceHourPrices;

    @JsonProperty("default_instance_type")
    String defaultInstanceType;

    // Monthly allowances, only used when free tier is requested
    @JsonProperty("free_tier")
    Map<String, Double> freeTier;

    @Builder
    @JsonCreator
    public PricingEntry(@JsonProperty("description") String description,
                        @JsonProperty("unit_prices") @Singular("unitPrice") Map<String, Double> unitPrices,
                        @JsonProperty("instance_hour_prices") @Singular("instanceHourPrice")
                        Map<String, Double> instanceHourPrices,
                        @JsonProperty("default_instance_type") String defaultInstanceType,
                        @JsonProperty("free_tier") @Singular("freeAllowance") Map<String, Double> freeTier) {
        this.description = description;
        this.unitPrices = pricesOf(unitPrices);
        this.instanceHourPrices = pricesOf(instanceHourPrices);
        this.defaultInstanceType = defaultInstanceType;
        this.freeTier = pricesOf(freeTier);
    }

    public static PricingEntry empty() {
        return PricingEntry.builder().build();
    }

    /**
     * Unit price of a dimension, 0 when none is listed.
     */
    public double priceOf(String dimension) {
        return unitPrices.getOrDefault(dimension, 0.0);
    }

    /**
     * Hourly price of an instance type. Unknown types fall back to the default instance type, then to
     * the {@code instance_hours} unit price.
     */
    public double instanceHourPriceOf(String instanceType) {
        if (instanceType != null && instanceHourPrices.containsKey(instanceType)) {
            return instanceHourPrices.get(instanceType);
        }
        if (defaultInstanceType != null && instanceHourPrices.containsKey(defaultInstanceType)) {
            return instanceHourPrices.get(defaultInstanceType);
        }
        return priceOf("instance_hours");
    }

    public double freeAllowanceOf(String dimension) {
        return freeTier.getOrDefault(dimension, 0.0);
    }

    // Null sections and null prices are dropped
    private static Map<String, Double> pricesOf(Map<String, Double> prices) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (prices != null) {
            prices.forEach((key, price) -> {
                if (key != null && price != null) {
                    copy.put(key, price);
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }
}
