package org.carball.stackcost.calculator;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.model.cost.CostComponent;
import org.carball.stackcost.model.cost.CostEstimate;
import org.carball.stackcost.model.cost.ServiceCost;
import org.carball.stackcost.model.service.ServiceFamily;
import org.carball.stackcost.model.usage.ServiceUsage;
import org.carball.stackcost.model.usage.UsageProfile;
import org.carball.stackcost.pricing.PricingEntry;
import org.carball.stackcost.pricing.PricingTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.carball.stackcost.estimator.UsageKeys.*;

/**
 * Prices a usage profile against a {@link PricingTable}. Each service is broken down into billable
 * dimensions; its monthly cost is the sum of the dimension costs.
 */
@Slf4j
public class CostCalculator {

    static final String REQUESTS = "requests";
    static final String COMPUTE_GB_SECONDS = "compute_gb_seconds";
    static final String GET_REQUESTS = "get_requests";
    static final String PUT_REQUESTS = "put_requests";
    static final String READ_REQUEST_UNITS = "read_request_units";
    static final String WRITE_REQUEST_UNITS = "write_request_units";
    static final String INSTANCE_HOURS = "instance_hours";
    static final String RESOURCE_HOURS = "resource_hours";

    private final PricingTable pricingTable;

    public CostCalculator(PricingTable pricingTable) {
        this.pricingTable = pricingTable;
    }

    public CostEstimate calculate(UsageProfile usageProfile) {
        List<ServiceCost> serviceCosts = new ArrayList<>();
        for (Map.Entry<String, ServiceUsage> entry : usageProfile.asMap().entrySet()) {
            serviceCosts.add(calculateService(entry.getKey(), entry.getValue()));
        }

        CostEstimate estimate = CostEstimate.of(serviceCosts);
        log.debug("Estimated {} services at {} per month", serviceCosts.size(), estimate.totalMonthlyCost());
        return estimate;
    }

    public ServiceCost calculateService(String service, ServiceUsage usage) {
        Optional<PricingEntry> pricing = pricingTable.find(service);
        if (pricing.isEmpty()) {
            log.debug("No pricing entry for {}, costing it at zero", service);
            return ServiceCost.unpriced(service);
        }

        PricingEntry entry = pricing.get();
        boolean freeTier = usage.getBoolean(APPLY_FREE_TIER, false);
        Map<String, Double> quantities = billableQuantities(ServiceFamily.fromServiceName(service), usage);

        List<CostComponent> components = new ArrayList<>();
        quantities.forEach((dimension, quantity) -> {
            double unitPrice = INSTANCE_HOURS.equals(dimension)
                    ? entry.instanceHourPriceOf(usage.getString(INSTANCE_TYPE, null))
                    : entry.priceOf(dimension);
            double billable = freeTier
                    ? Math.max(0.0, quantity - entry.freeAllowanceOf(dimension))
                    : quantity;
            double cost = billable * unitPrice;
            if (!Double.isFinite(quantity) || !Double.isFinite(cost)) {
                log.warn("Non-finite {} cost for {} (quantity {}), recording it as zero", dimension, service, quantity);
                components.add(new CostComponent(dimension, 0.0, 0.0, unitPrice, 0.0));
            } else {
                components.add(new CostComponent(dimension, quantity, billable, unitPrice, cost));
            }
        });

        return ServiceCost.of(service, components);
    }

    /**
     * Monthly quantity of each billable dimension, in the order the dimensions are reported.
     */
    Map<String, Double> billableQuantities(ServiceFamily family, ServiceUsage usage) {
        Map<String, Double> quantities = new LinkedHashMap<>();
        double requests = usage.getDouble(AVG_MONTHLY_REQUESTS, 0);

        switch (family) {
            case LAMBDA -> {
                double invocations = requests * usage.getDouble(FUNCTION_COUNT, 1);
                double memoryGb = usage.getDouble(AVG_MEMORY_SIZE, 128) / 1024.0;
                double durationSeconds = usage.getDouble(AVG_DURATION_MS, 0) / 1000.0;
                quantities.put(REQUESTS, invocations);
                quantities.put(COMPUTE_GB_SECONDS, invocations * memoryGb * durationSeconds);
            }
            case S3 -> {
                quantities.put(STORAGE_GB, usage.getDouble(STORAGE_GB, 0));
                quantities.put(GET_REQUESTS, usage.getDouble(MONTHLY_GET_REQUESTS, 0));
                quantities.put(PUT_REQUESTS, usage.getDouble(MONTHLY_PUT_REQUESTS, 0));
            }
            case DYNAMODB -> {
                if (usage.getBoolean(PROVISIONED_MODE, false)) {
                    quantities.put(READ_CAPACITY_UNITS, usage.getDouble(READ_CAPACITY_UNITS, 0));
                    quantities.put(WRITE_CAPACITY_UNITS, usage.getDouble(WRITE_CAPACITY_UNITS, 0));
                } else {
                    quantities.put(READ_REQUEST_UNITS, usage.getDouble(MONTHLY_READ_REQUEST_UNITS, 0));
                    quantities.put(WRITE_REQUEST_UNITS, usage.getDouble(MONTHLY_WRITE_REQUEST_UNITS, 0));
                }
                quantities.put(STORAGE_GB, usage.getDouble(STORAGE_GB, 0));
            }
            case API_GATEWAY -> {
                quantities.put(REQUESTS, usage.getDouble(MONTHLY_REQUESTS, requests));
                quantities.put(DATA_TRANSFER_GB, usage.getDouble(DATA_TRANSFER_GB, 0));
            }
            case EC2 -> {
                quantities.put(INSTANCE_HOURS,
                        usage.getDouble(INSTANCE_COUNT, 0) * usage.getDouble(USAGE_HOURS, 0));
                quantities.put(EBS_STORAGE_GB, usage.getDouble(EBS_STORAGE_GB, 0));
            }
            case GENERIC -> {
                quantities.put(REQUESTS, requests);
                quantities.put(STORAGE_GB, usage.getDouble(STORAGE_GB, 0));
                quantities.put(DATA_TRANSFER_GB, usage.getDouble(DATA_TRANSFER_GB, 0));
                quantities.put(RESOURCE_HOURS,
                        usage.getDouble(AVG_RESOURCE_COUNT, 1) * usage.getDouble(USAGE_HOURS, 0));
            }
        }
        return quantities;
    }
}
