package org.carball.stackcost.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads per-service usage overrides from a YAML or JSON file shaped as
 * {@code service name -> usage key -> value}.
 */
@Slf4j
public class UsageAssumptionsLoader {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, Object>>> ASSUMPTIONS_TYPE =
            new TypeReference<>() {};

    // YAML is a superset of JSON, so one mapper reads both
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public Map<String, Map<String, Object>> load(Path assumptionsFile) throws IOException {
        if (!Files.isRegularFile(assumptionsFile)) {
            throw new IllegalArgumentException("Usage assumptions file not found: " + assumptionsFile);
        }

        Map<String, LinkedHashMap<String, Object>> raw = mapper.readValue(assumptionsFile.toFile(), ASSUMPTIONS_TYPE);
        Map<String, Map<String, Object>> assumptions = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((service, overrides) -> {
                if (overrides == null) {
                    log.warn("Ignoring empty usage assumptions for {}", service);
                } else {
                    assumptions.put(service, overrides);
                }
            });
        }

        log.info("Loaded usage assumptions for {} services from {}", assumptions.size(), assumptionsFile);
        return assumptions;
    }

    public AnalysisOptions applyTo(AnalysisOptions options, Path assumptionsFile) throws IOException {
        return options.toBuilder()
                .usageAssumptions(load(assumptionsFile))
                .build();
    }
}
