package org.carball.stackcost.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigurationLoaderTest {

    private ConfigurationLoader loader;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader();

        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        AnalyzerSettings settings = loader.loadConfiguration(new String[0], Map.of());

        // Then
        assertThat(settings.getPricingFile()).isNull();
        assertThat(settings.getCostFactorsLimit()).isEqualTo(5);
        assertThat(settings.isApplyFreeTier()).isFalse();
        assertThat(settings.getSettingsSummary()).contains("Pricing: bundled");
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        Map<String, String> env = Map.of(
                ConfigurationLoader.PRICING_FILE_ENV, "/etc/stackcost/pricing.yml",
                ConfigurationLoader.COST_FACTORS_LIMIT_ENV, " 3 ",
                ConfigurationLoader.APPLY_FREE_TIER_ENV, "true");

        // When
        AnalyzerSettings settings = loader.loadConfiguration(new String[0], env);

        // Then
        assertThat(settings.getPricingFile()).isEqualTo(Paths.get("/etc/stackcost/pricing.yml"));
        assertThat(settings.getCostFactorsLimit()).isEqualTo(3);
        assertThat(settings.isApplyFreeTier()).isTrue();
    }

    @Test
    void shouldPreferCliArgumentsOverEnvironment() {
        // Given
        Map<String, String> env = Map.of(
                ConfigurationLoader.PRICING_FILE_ENV, "env-pricing.yml",
                ConfigurationLoader.COST_FACTORS_LIMIT_ENV, "3");
        String[] args = {"compare", "a.json", "b.json", "--pricing", "cli-pricing.yml", "--limit", "8", "--free-tier"};

        // When
        AnalyzerSettings settings = loader.loadConfiguration(args, env);

        // Then - CLI > env vars > defaults
        assertThat(settings.getPricingFile()).isEqualTo(Paths.get("cli-pricing.yml"));
        assertThat(settings.getCostFactorsLimit()).isEqualTo(8);
        assertThat(settings.isApplyFreeTier()).isTrue();
    }

    @Test
    void shouldWarnAndKeepPreviousValueForInvalidLimit() {
        // Given
        String[] args = {"--limit", "many"};

        // When
        AnalyzerSettings settings = loader.loadConfiguration(args, Map.of(ConfigurationLoader.COST_FACTORS_LIMIT_ENV, "4"));

        // Then
        assertThat(settings.getCostFactorsLimit()).isEqualTo(4);
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().equals("Invalid numeric value for --limit: many"));
    }

    @Test
    void shouldIgnoreInvalidEnvironmentLimit() {
        // When
        AnalyzerSettings settings = loader.loadConfiguration(new String[0],
                Map.of(ConfigurationLoader.COST_FACTORS_LIMIT_ENV, "five"));

        // Then
        assertThat(settings.getCostFactorsLimit()).isEqualTo(5);
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains(ConfigurationLoader.COST_FACTORS_LIMIT_ENV));
    }

    @Test
    void shouldLogLoadedConfiguration() {
        // When
        loader.loadConfiguration(new String[]{"--limit", "2"}, Map.of());

        // Then
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anyMatch(message -> message.startsWith("Configuration loaded:") && message.contains("Cost factors limit: 2"));
    }

    @Test
    void shouldDescribeSettingsInHelp() {
        // When
        String help = ConfigurationLoader.getSettingsHelp();

        // Then
        assertThat(help).contains("--pricing", "--limit", "--free-tier", ConfigurationLoader.PRICING_FILE_ENV);
    }
}
