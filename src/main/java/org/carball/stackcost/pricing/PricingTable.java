package org.carball.stackcost.pricing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unit prices for one region keyed by canonical service name. Immutable, so one table can be shared by
 * every analyzer.
 */
@Value
public class PricingTable {

    public static final String DEFAULT_REGION = "us-east-1";
    public static final String DEFAULT_CURRENCY = "USD";

    String region;

    String currency;

    @JsonProperty("services")
    Map<String, PricingEntry> entries;

    @Builder
    @JsonCreator
    public PricingTable(@JsonProperty("region") String region,
                        @JsonProperty("currency") String currency,
                        @JsonProperty("services") @Singular("entry") Map<String, PricingEntry> entries) {
        this.region = region == null ? DEFAULT_REGION : region;
        this.currency = currency == null ? DEFAULT_CURRENCY : currency;

        Map<String, PricingEntry> copy = new LinkedHashMap<>();
        if (entries != null) {
            // A service listed without any prices is priced at zero rather than left uncovered
            entries.forEach((service, entry) -> copy.put(service, entry == null ? PricingEntry.empty() : entry));
        }
        this.entries = Collections.unmodifiableMap(copy);
    }

    public static PricingTable empty() {
        return PricingTable.builder().build();
    }

    public Optional<PricingEntry> find(String service) {
        return Optional.ofNullable(entries.get(service));
    }

    public boolean covers(String service) {
        return entries.containsKey(service);
    }
}
