package org.carball.sascan.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.sascan.analyzer.SasAnalyzer;
import org.carball.sascan.config.AnalysisProfile;
import org.carball.sascan.config.ConfigurationLoader;
import org.carball.sascan.config.OutputFormat;
import org.carball.sascan.config.SasAnalyzerConfig;
import org.carball.sascan.config.ThresholdConfig;
import org.carball.sascan.model.analysis.AnalysisResult;
import org.carball.sascan.model.analysis.MetricsRecord;
import org.carball.sascan.model.analysis.MigrationRisk;
import org.carball.sascan.output.ComplexityReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;

@Slf4j
public class SasAnalyzerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            SAS Complexity & Migration Risk Analyzer v%s     ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            SasAnalyzerConfig config = parseArgs(args, new ConfigurationLoader());

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Source: " + config.getSourcePath());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            SasAnalyzer analyzer = new SasAnalyzer(config);

            System.out.print("📊 Measuring SAS programs... ");
            AnalysisResult result = analyzer.analyze();
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            outputResults(result, config);
            System.out.println("✓");

            printSummary(result);

            System.out.println("\n✅ Analysis complete!");

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

    static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar sas-complexity-analyzer.jar <source-path> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  source-path         A SAS program, or a directory searched recursively for them");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: complexity-report.md)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: markdown)");
        System.out.println("  --extension         Source file extension (default: .sas)");
        System.out.println("  --profile           Threshold profile: " + AnalysisProfile.getAvailableProfiles());
        System.out.println("  --thresholds        YAML file with custom analysis thresholds (optional)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getThresholdHelp());
        System.out.println(AnalysisProfile.getProfileHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar sas-complexity-analyzer.jar ./programs/");
        System.out.println("  java -jar sas-complexity-analyzer.jar etl_load.sas --format both -o reports/etl");
        System.out.println("  java -jar sas-complexity-analyzer.jar ./programs/ --profile strict");
    }

    static SasAnalyzerConfig parseArgs(String[] args, ConfigurationLoader loader) {
        SasAnalyzerConfig config = new SasAnalyzerConfig();
        config.setSourcePath(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("complexity-report.md");
        config.setOutputFormat(OutputFormat.MARKDOWN);
        config.setVerbose(false);

        String profileName = null;
        Path thresholdFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--profile":
                    profileName = requireValue(args, ++i, "Profile name not specified");
                    break;

                case "--thresholds":
                case "--threshold-config":
                    thresholdFile = Paths.get(requireValue(args, ++i, "Threshold config file not specified"));
                    break;

                case "--extension":
                case "--thresholds.max-macro-parameters":
                case "--thresholds.high-complexity":
                    // Value is applied by ConfigurationLoader
                    requireValue(args, ++i, "Value not specified for " + args[i - 1]);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        ThresholdConfig thresholds = loader.loadConfiguration(profileName, thresholdFile, args);
        config.setThresholdConfig(thresholds);

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.JSON) {
            config.setOutputFile(baseFileName + ".json");
        } else {
            config.setOutputFile(baseFileName + ".md");
        }

        validateConfig(config);

        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(SasAnalyzerConfig config) {
        if (!Files.exists(config.getSourcePath())) {
            throw new IllegalArgumentException("Source path not found: " + config.getSourcePath());
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    static void outputResults(AnalysisResult result, SasAnalyzerConfig config) throws IOException {
        ComplexityReport report = new ComplexityReport(result);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    private static void printSummary(AnalysisResult result) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nFiles analyzed: " + result.units().size());
        System.out.println("Files above complexity threshold: " + result.unitsAboveThreshold());
        System.out.println("Issues raised: " + result.totalIssues());

        System.out.println("\nMigration risk breakdown:");
        for (MigrationRisk risk : MigrationRisk.values()) {
            System.out.println("  " + risk.getMarker() + " " + risk + ": " + result.countByRisk(risk));
        }

        System.out.println("\n🎯 Most Complex Files:");
        System.out.println("-".repeat(60));
        result.units().stream()
                .sorted(Comparator.comparingInt(MetricsRecord::getCyclomaticComplexity).reversed())
                .limit(5)
                .forEach(unit -> System.out.printf("%-45s %5d  (depth %d)%n",
                        abbreviate(unit.getUnitName(), 45),
                        unit.getCyclomaticComplexity(),
                        unit.getMaxNestingDepth()));

        if (result.units().isEmpty()) {
            System.out.println("\n💡 No source files found. Check the path and --extension.");
        }
    }

    private static String abbreviate(String name, int width) {
        return name.length() <= width ? name : "..." + name.substring(name.length() - width + 3);
    }
}
