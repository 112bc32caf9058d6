package org.carball.stackcost.config;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    public static final String PRICING_FILE_ENV = "STACKCOST_PRICING_FILE";
    public static final String COST_FACTORS_LIMIT_ENV = "STACKCOST_COST_FACTORS_LIMIT";
    public static final String APPLY_FREE_TIER_ENV = "STACKCOST_APPLY_FREE_TIER";

    /**
     * Loads settings using the hierarchy: CLI args > env vars > defaults
     */
    public AnalyzerSettings loadConfiguration(String[] args) {
        return loadConfiguration(args, System.getenv());
    }

    public AnalyzerSettings loadConfiguration(String[] args, Map<String, String> env) {
        log.debug("Loading configuration");

        // Start with defaults
        AnalyzerSettings.AnalyzerSettingsBuilder builder = AnalyzerSettings.defaults().toBuilder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder, env);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        AnalyzerSettings settings = builder.build();
        log.info("Configuration loaded: {}", settings.getSettingsSummary());
        return settings;
    }

    private void applyEnvironmentVariables(AnalyzerSettings.AnalyzerSettingsBuilder builder, Map<String, String> env) {
        if (env.containsKey(PRICING_FILE_ENV) && !env.get(PRICING_FILE_ENV).isBlank()) {
            builder.pricingFile(Paths.get(env.get(PRICING_FILE_ENV)));
        }
        if (env.containsKey(COST_FACTORS_LIMIT_ENV)) {
            try {
                builder.costFactorsLimit(Integer.parseInt(env.get(COST_FACTORS_LIMIT_ENV).trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", COST_FACTORS_LIMIT_ENV, env.get(COST_FACTORS_LIMIT_ENV));
            }
        }
        if (env.containsKey(APPLY_FREE_TIER_ENV)) {
            builder.applyFreeTier(Boolean.parseBoolean(env.get(APPLY_FREE_TIER_ENV).trim()));
        }
    }

    private void applyCLIArguments(AnalyzerSettings.AnalyzerSettingsBuilder builder, String[] args) {
        if (Arrays.asList(args).contains("--free-tier")) {
            builder.applyFreeTier(true);
        }

        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--pricing":
                        builder.pricingFile(Paths.get(value));
                        break;
                    case "--limit":
                        builder.costFactorsLimit(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for the tool-wide settings.
     */
    public static String getSettingsHelp() {
        return """
            Settings:

            CLI Arguments:
              --pricing <file>      YAML pricing table (default: bundled us-east-1 prices)
              --limit <num>         Number of ranked cost factors in comparisons (default: 5)
              --free-tier           Subtract free-tier allowances before pricing

            Environment Variables:
              STACKCOST_PRICING_FILE          Same as --pricing
              STACKCOST_COST_FACTORS_LIMIT    Same as --limit
              STACKCOST_APPLY_FREE_TIER       Same as --free-tier (true|false)

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
