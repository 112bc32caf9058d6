package org.carball.stackcost.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PricingTable}s from YAML, either the bundled us-east-1 table or a user supplied file.
 */
@Slf4j
public class PricingTableLoader {

    public static final String BUNDLED_PRICING_RESOURCE = "pricing/aws-us-east-1.yml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public PricingTable loadBundled() {
        try (InputStream input = PricingTableLoader.class.getClassLoader()
                .getResourceAsStream(BUNDLED_PRICING_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Bundled pricing table not found on classpath: "
                        + BUNDLED_PRICING_RESOURCE);
            }
            PricingTable table = yamlMapper.readValue(input, PricingTable.class);
            log.debug("Loaded bundled pricing for {} with {} services", table.getRegion(), table.getEntries().size());
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled pricing table", e);
        }
    }

    public PricingTable load(Path pricingFile) throws IOException {
        if (!Files.isRegularFile(pricingFile)) {
            throw new IllegalArgumentException("Pricing file not found: " + pricingFile);
        }
        PricingTable table = yamlMapper.readValue(pricingFile.toFile(), PricingTable.class);
        log.info("Loaded pricing from {} ({} services, region {})",
                pricingFile, table.getEntries().size(), table.getRegion());
        return table;
    }

    /**
     * Loads {@code pricingFile} when given, otherwise the bundled table.
     */
    public PricingTable loadOrDefault(Path pricingFile) throws IOException {
        return pricingFile == null ? loadBundled() : load(pricingFile);
    }
}
