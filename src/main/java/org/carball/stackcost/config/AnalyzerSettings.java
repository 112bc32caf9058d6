package org.carball.stackcost.config;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Tool-wide settings resolved from CLI arguments, environment variables and defaults.
 */
@Data
@Builder(toBuilder = true)
public class AnalyzerSettings {

    // Null means the bundled us-east-1 table
    private Path pricingFile;

    @Builder.Default
    private int costFactorsLimit = ComparisonOptions.DEFAULT_COST_FACTORS_LIMIT;

    @Builder.Default
    private boolean applyFreeTier = false;

    public static AnalyzerSettings defaults() {
        return AnalyzerSettings.builder().build();
    }

    public String getSettingsSummary() {
        return String.format(Locale.ROOT, "Pricing: %s | Cost factors limit: %d | Free tier: %s",
                pricingFile == null ? "bundled" : pricingFile, costFactorsLimit, applyFreeTier ? "on" : "off");
    }
}
