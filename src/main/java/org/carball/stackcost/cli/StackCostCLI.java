package org.carball.stackcost.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.analyzer.StackCostAnalyzer;
import org.carball.stackcost.config.AnalysisOptions;
import org.carball.stackcost.config.AnalyzerConfig;
import org.carball.stackcost.config.AnalyzerSettings;
import org.carball.stackcost.config.ComparisonOptions;
import org.carball.stackcost.config.ConfigurationLoader;
import org.carball.stackcost.config.OutputFormat;
import org.carball.stackcost.config.UsageAssumptionsLoader;
import org.carball.stackcost.estimator.UsageDefaults;
import org.carball.stackcost.estimator.UsageKeys;
import org.carball.stackcost.model.analysis.AnalysisOutcome;
import org.carball.stackcost.model.analysis.ArchitectureAnalysis;
import org.carball.stackcost.model.comparison.ComparisonOutcome;
import org.carball.stackcost.model.comparison.ComparisonResult;
import org.carball.stackcost.model.comparison.CostFactor;
import org.carball.stackcost.model.cost.ServiceCost;
import org.carball.stackcost.output.CostReport;
import org.carball.stackcost.pricing.PricingTable;
import org.carball.stackcost.pricing.PricingTableLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
public class StackCostCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║           CloudFormation / CDK Stack Cost Analyzer v%s         ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    static final String ANALYZE = "analyze";
    static final String COMPARE = "compare";

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 2 && !isHelpRequested(args) ? 1 : 0);
        }

        try {
            AnalyzerSettings settings = new ConfigurationLoader().loadConfiguration(args);
            AnalyzerConfig config = parseArgs(args, settings);

            System.out.println("\n🔍 Starting " + config.getCommand() + "...");
            config.getTemplateFiles().forEach(template -> System.out.println("   Template: " + template));
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            if (config.isVerbose()) {
                System.out.println("   " + settings.getSettingsSummary());
            }
            System.out.println();

            StackCostAnalyzer analyzer = createAnalyzer(settings);
            AnalysisOptions options = buildAnalysisOptions(config);

            CostReport report;
            if (COMPARE.equals(config.getCommand())) {
                System.out.print("⚖️  Comparing architectures... ");
                ComparisonOutcome outcome = analyzer.compareFiles(
                        config.getTemplateFiles().get(0),
                        config.getTemplateFiles().get(1),
                        options,
                        buildComparisonOptions(config, settings));
                if (!outcome.success()) {
                    System.out.println("✗");
                    failAndExit(outcome.message());
                    return;
                }
                System.out.println("✓");
                report = CostReport.forComparison(outcome.architecture1(), outcome.architecture2(),
                        outcome.comparison());
                printComparisonSummary(outcome.comparison());
            } else {
                System.out.print("📊 Analyzing template... ");
                AnalysisOutcome outcome = analyzer.analyzeFile(config.getTemplateFiles().get(0), options);
                if (!outcome.success()) {
                    System.out.println("✗");
                    failAndExit(outcome.message());
                    return;
                }
                System.out.println("✓");
                report = CostReport.forAnalysis(outcome.analysis());
                printAnalysisSummary(outcome.analysis(), config.isVerbose());
            }

            System.out.print("\n📝 Writing results... ");
            outputResults(report, config);
            System.out.println("✓");

            System.out.println("\n✅ " + capitalize(config.getCommand()) + " complete!");

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar stack-cost-analyzer.jar analyze <template> [options]");
        System.out.println("       java -jar stack-cost-analyzer.jar compare <template1> <template2> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  template            CloudFormation or CDK synthesized template (.json, .yaml, .yml)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: cost-analysis.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --name              Display name for the analyzed stack (analyze only)");
        System.out.println("  --names <a,b>       Display names for the compared architectures (compare only)");
        System.out.println("  --assumptions       YAML or JSON file with per-service usage overrides");
        System.out.println("  --include-template  Attach the raw template to the analysis output");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Examples:");
        System.out.println("  # Estimate a synthesized CDK stack");
        System.out.println("  java -jar stack-cost-analyzer.jar analyze cdk.out/MyStack.template.json");
        System.out.println();
        System.out.println("  # Compare two designs with custom usage and a Markdown report");
        System.out.println("  java -jar stack-cost-analyzer.jar compare serverless.json containers.json \\");
        System.out.println("      --names Serverless,Containers --assumptions usage.yml --format markdown");
    }

    static AnalyzerConfig parseArgs(String[] args, AnalyzerSettings settings) {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setSettings(settings);

        String command = args[0].toLowerCase(Locale.ROOT);
        if (!ANALYZE.equals(command) && !COMPARE.equals(command)) {
            throw new IllegalArgumentException("Unknown command: " + args[0] + ". Use analyze or compare");
        }
        config.setCommand(command);

        // Set defaults
        config.setOutputFile(COMPARE.equals(command) ? "cost-comparison.json" : "cost-analysis.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        // Parse positional templates and options
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(args[++i].toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--name":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Stack name not specified");
                    }
                    config.setName(args[++i]);
                    break;

                case "--names":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Architecture names not specified");
                    }
                    config.setArchitectureNames(Arrays.stream(args[++i].split(","))
                            .map(String::trim)
                            .collect(Collectors.toList()));
                    break;

                case "--assumptions":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Usage assumptions file not specified");
                    }
                    config.setAssumptionsFile(Paths.get(args[++i]));
                    break;

                case "--include-template":
                    config.setIncludeTemplate(true);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                case "--pricing":
                case "--limit":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Value not specified for " + args[i]);
                    }
                    // Just skip the value here, it will be handled by ConfigurationLoader
                    i++;
                    break;

                case "--free-tier":
                    // Boolean flag, handled by ConfigurationLoader
                    break;

                default:
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    config.getTemplateFiles().add(Paths.get(args[i]));
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        config.setOutputFile(baseFileName + (config.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        validateConfig(config);
        return config;
    }

    private static void validateConfig(AnalyzerConfig config) {
        int expected = COMPARE.equals(config.getCommand()) ? 2 : 1;
        if (config.getTemplateFiles().size() != expected) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "%s expects %d template file(s), got %d",
                    config.getCommand(), expected, config.getTemplateFiles().size()));
        }

        if (config.getAssumptionsFile() != null && !Files.exists(config.getAssumptionsFile())) {
            throw new IllegalArgumentException("Usage assumptions file not found: " + config.getAssumptionsFile());
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static StackCostAnalyzer createAnalyzer(AnalyzerSettings settings) throws IOException {
        PricingTable pricing = new PricingTableLoader().loadOrDefault(settings.getPricingFile());

        UsageDefaults defaults = UsageDefaults.standard();
        if (settings.isApplyFreeTier()) {
            defaults = defaults.toBuilder()
                    .genericDefault(UsageKeys.APPLY_FREE_TIER, true)
                    .build();
        }
        return new StackCostAnalyzer(pricing, defaults);
    }

    private static AnalysisOptions buildAnalysisOptions(AnalyzerConfig config) throws IOException {
        AnalysisOptions options = AnalysisOptions.builder()
                .name(config.getName())
                .includeTemplate(config.isIncludeTemplate())
                .build();

        if (config.getAssumptionsFile() != null) {
            options = new UsageAssumptionsLoader().applyTo(options, config.getAssumptionsFile());
        }
        return options;
    }

    private static ComparisonOptions buildComparisonOptions(AnalyzerConfig config, AnalyzerSettings settings) {
        List<String> names = config.getArchitectureNames();
        return ComparisonOptions.builder()
                .architecture1Name(names.size() > 0 ? names.get(0) : null)
                .architecture2Name(names.size() > 1 ? names.get(1) : null)
                .costFactorsLimit(settings.getCostFactorsLimit())
                .build();
    }

    private static void outputResults(CostReport report, AnalyzerConfig config) throws IOException {
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".json" : config.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".md" : config.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printAnalysisSummary(ArchitectureAnalysis analysis, boolean verbose) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 COST SUMMARY: " + analysis.name());
        System.out.println("=".repeat(60));

        System.out.println("\nResources: " + analysis.totalResourceCount());
        System.out.println("Services: " + String.join(", ", analysis.services()));

        System.out.println("\n💰 Estimated cost by service:");
        System.out.println("-".repeat(60));
        for (ServiceCost cost : analysis.costEstimate().serviceCosts()) {
            System.out.printf(Locale.US, "%-25s %12s%s%n",
                    cost.service(), money(cost.monthlyCost()), cost.priced() ? "" : "  (no pricing)");
        }
        System.out.println("-".repeat(60));
        System.out.printf(Locale.US, "%-25s %12s%n", "Monthly total", money(analysis.costEstimate().totalMonthlyCost()));
        System.out.printf(Locale.US, "%-25s %12s%n", "Yearly total", money(analysis.costEstimate().totalYearlyCost()));

        if (!analysis.recommendations().isEmpty()) {
            System.out.println("\n🎯 Optimization opportunities: " + analysis.recommendations().size());
            if (verbose) {
                analysis.recommendations().forEach(rec ->
                        System.out.println("  └─ [" + rec.impact() + "] " + rec.title()));
            }
        }
    }

    private static void printComparisonSummary(ComparisonResult comparison) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("⚖️  COMPARISON SUMMARY");
        System.out.println("=".repeat(60));

        System.out.printf(Locale.US, "%n%-25s %12s%n", comparison.architecture1().name(),
                money(comparison.architecture1().totalMonthlyCost()));
        System.out.printf(Locale.US, "%-25s %12s%n", comparison.architecture2().name(),
                money(comparison.architecture2().totalMonthlyCost()));

        if (comparison.isTie()) {
            System.out.println("\nBoth architectures cost the same per month.");
        } else {
            System.out.printf(Locale.US, "%n%s costs %s (%.2f%%) more per month than %s%n",
                    comparison.moreExpensiveArchitecture(), money(comparison.costDifference()),
                    comparison.percentageDifference(), comparison.lessExpensiveArchitecture());
        }

        if (!comparison.biggestCostFactors().isEmpty()) {
            System.out.println("\n🎯 Biggest cost factors:");
            System.out.println("-".repeat(60));
            for (CostFactor factor : comparison.biggestCostFactors()) {
                System.out.printf(Locale.US, "%-20s %-25s %12s%n",
                        factor.service(), factor.architecture(), money(factor.cost()));
            }
        }
    }

    private static void failAndExit(String message) {
        System.err.println("\n❌ Analysis failed: " + message);
        System.exit(1);
    }

    private static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    private static String capitalize(String value) {
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            // Check if this is a path with directories
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }
}
