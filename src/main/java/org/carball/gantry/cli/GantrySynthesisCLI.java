package org.carball.gantry.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.PipelineException;
import org.carball.gantry.ai.OpenAiTextGenerationOracle;
import org.carball.gantry.config.ConfigurationLoader;
import org.carball.gantry.config.GantrySynthesisConfig;
import org.carball.gantry.config.OutputFormat;
import org.carball.gantry.config.SynthesisProfile;
import org.carball.gantry.config.SynthesisSettings;
import org.carball.gantry.loader.JsonReferencePoolLoader;
import org.carball.gantry.model.evaluation.EvaluationResult;
import org.carball.gantry.model.output.GenerationBundle;
import org.carball.gantry.model.schema.FieldGroupSchema;
import org.carball.gantry.model.stats.TargetDistribution;
import org.carball.gantry.output.GenerationReport;
import org.carball.gantry.pipeline.GantrySynthesisPipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;

@Slf4j
public class GantrySynthesisCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Highway Gantry Transaction Synthesizer v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final TypeReference<Map<String, Map<String, Double>>> TARGET_TYPE = new TypeReference<>() {};

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            GantrySynthesisConfig config = parseArgs(args);
            TargetDistribution target = loadTargetDistribution(config.getTargetDistributionFile());

            System.out.println("\n🔍 Starting synthesis...");
            System.out.println("   Training pool: " + config.getTrainingFile());
            System.out.println("   Benchmark pool: " + (config.getBenchmarkFile() != null ? config.getBenchmarkFile() : "(training pool)"));
            System.out.println("   Records requested: " + config.getCount());
            System.out.println("   Settings: " + config.getSettings().getConfigurationSummary());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            FieldGroupSchema schema = FieldGroupSchema.gantryDefault();
            Path benchmarkFile = config.getBenchmarkFile() != null ? config.getBenchmarkFile() : config.getTrainingFile();
            SynthesisSettings settings = config.getSettings();
            OpenAiTextGenerationOracle oracle = OpenAiTextGenerationOracle.createIfEnabled(
                    config.getOpenAiApiKey(), settings.getModel(), settings.getTemperature(),
                    settings.getMaxTokens());

            try (GantrySynthesisPipeline pipeline = new GantrySynthesisPipeline(settings,
                    new JsonReferencePoolLoader(config.getTrainingFile(), schema),
                    new JsonReferencePoolLoader(benchmarkFile, schema),
                    oracle)) {

                System.out.print("📚 Loading reference pools and learning statistics... ");
                pipeline.initialize(config.getTrainingLimit(), config.getBenchmarkLimit(), config.isAuxiliary());
                System.out.println("✓");

                System.out.print("🤖 Generating and curating records... ");
                GenerationBundle bundle = pipeline.generate(config.getCount(), target);
                System.out.println("✓");

                System.out.print("📝 Writing results... ");
                outputResults(bundle, config);
                System.out.println("✓");

                printSummary(bundle);
                if (config.isVerbose()) {
                    printDetails(bundle);
                }
            }

            System.out.println("\n✅ Synthesis complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }

        } catch (PipelineException e) {
            System.err.println("\n❌ " + describe(e) + ": " + e.getMessage());
            log.debug("Pipeline error details", e);
            System.exit(2);
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

    private static String describe(PipelineException e) {
        return switch (e.getKind()) {
            case CONFIGURATION -> "Configuration error";
            case NOT_INITIALIZED -> "Pipeline not initialized";
            case GENERATION -> "Generation failed";
        };
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar gantry-synth.jar --training-file <file> [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --training-file, -t   JSON file of real gantry records used for demonstrations and statistics");
        System.out.println("  --benchmark-file, -b  JSON file of real records to compare against (default: training file)");
        System.out.println("  --count, -n           Number of records to generate (default: 100)");
        System.out.println("  --training-limit      Maximum records read from the training file (default: all)");
        System.out.println("  --benchmark-limit     Maximum records read from the benchmark file (default: all)");
        System.out.println("  --output, -o          Output file (default: synthetic-gantry.json)");
        System.out.println("  --format, -f          Output format: json|markdown|both (default: json)");
        System.out.println("  --profile             Settings profile: " + SynthesisProfile.getAvailableProfiles());
        System.out.println("  --target-distribution YAML file with target shares, e.g. vehicle: {truck: 0.7, passenger: 0.3}");
        System.out.println("  --auxiliary           Run the rule-based auxiliary verifier over curated records");
        System.out.println("  --api-key             OpenAI API key (or set OPENAI_API_KEY env var)");
        System.out.println("  --verbose, -v         Enable verbose output");
        System.out.println("  --help, -h            Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSynthesisHelp());
        System.out.println(SynthesisProfile.getProfileHelp());
        System.out.println("Examples:");
        System.out.println("  # Rule-based generation without an oracle");
        System.out.println("  java -Dskip.ai=true -jar gantry-synth.jar -t real.json -n 500");
        System.out.println();
        System.out.println("  # Truck-heavy dataset with a markdown summary");
        System.out.println("  java -jar gantry-synth.jar -t real.json -n 1000 --target-distribution trucks.yml -f both");
    }

    static GantrySynthesisConfig parseArgs(String[] args) {
        GantrySynthesisConfig config = new GantrySynthesisConfig();
        config.setCount(100);
        config.setOutputFile("synthetic-gantry.json");
        config.setOutputFormat(OutputFormat.JSON);

        String profile = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--training-file":
                case "-t":
                    config.setTrainingFile(Paths.get(requireValue(args, i++, "Training file not specified")));
                    break;

                case "--benchmark-file":
                case "-b":
                    config.setBenchmarkFile(Paths.get(requireValue(args, i++, "Benchmark file not specified")));
                    break;

                case "--count":
                case "-n":
                    config.setCount(parseInt(requireValue(args, i++, "Count not specified"), "count"));
                    break;

                case "--training-limit":
                    config.setTrainingLimit(parseInt(requireValue(args, i++, "Training limit not specified"), "training limit"));
                    break;

                case "--benchmark-limit":
                    config.setBenchmarkLimit(parseInt(requireValue(args, i++, "Benchmark limit not specified"), "benchmark limit"));
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--profile":
                    profile = requireValue(args, i++, "Profile not specified");
                    break;

                case "--target-distribution":
                    config.setTargetDistributionFile(Paths.get(requireValue(args, i++, "Target distribution file not specified")));
                    break;

                case "--api-key":
                    config.setOpenAiApiKey(requireValue(args, i++, "API key not specified"));
                    break;

                case "--auxiliary":
                    config.setAuxiliary(true);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--synthesis.")) {
                        // Value handled by ConfigurationLoader
                        String option = args[i];
                        requireValue(args, i++, "Value not specified for " + option);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        ConfigurationLoader loader = new ConfigurationLoader();
        SynthesisSettings settings = profile != null
                ? loader.loadConfigurationWithProfile(profile, args)
                : loader.loadConfiguration(args);
        if (config.getOpenAiApiKey() == null) {
            config.setOpenAiApiKey(settings.getApiKey());
        }
        config.setSettings(settings);

        String baseFileName = removeFileExtension(config.getOutputFile());
        config.setOutputFile(baseFileName + (config.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
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

    private static void validateConfig(GantrySynthesisConfig config) {
        if (config.getTrainingFile() == null) {
            throw new IllegalArgumentException("Training file is required (--training-file)");
        }
        if (!Files.exists(config.getTrainingFile())) {
            throw new IllegalArgumentException("Training file not found: " + config.getTrainingFile());
        }
        if (config.getBenchmarkFile() != null && !Files.exists(config.getBenchmarkFile())) {
            throw new IllegalArgumentException("Benchmark file not found: " + config.getBenchmarkFile());
        }
        if (config.getTargetDistributionFile() != null && !Files.exists(config.getTargetDistributionFile())) {
            throw new IllegalArgumentException("Target distribution file not found: " + config.getTargetDistributionFile());
        }
        if (config.getCount() <= 0) {
            throw new IllegalArgumentException("Count must be positive, got " + config.getCount());
        }

        boolean skipAi = "true".equals(System.getProperty("skip.ai"));
        if (!skipAi && config.getOpenAiApiKey() == null) {
            log.warn("No OpenAI API key; all field groups will be generated by rules. Use --api-key, " +
                    "set OPENAI_API_KEY, or pass -Dskip.ai=true to silence this warning");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    static TargetDistribution loadTargetDistribution(Path file) throws IOException {
        if (file == null) {
            return TargetDistribution.defaults();
        }
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        Map<String, Map<String, Double>> raw = yaml.readValue(file.toFile(), TARGET_TYPE);
        return TargetDistribution.fromWire(raw);
    }

    private static void outputResults(GenerationBundle bundle, GantrySynthesisConfig config) throws IOException {
        GenerationReport report = new GenerationReport(bundle);
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

    private static void printDetails(GenerationBundle bundle) {
        System.out.println("\nRule-based fallbacks per field group: " + bundle.statistics().getFallbackCounts());
        System.out.println("Top rejection issues:");
        bundle.statistics().getTopRejectionIssues().forEach((issue, n) ->
                System.out.printf("  - %s (%d)%n", issue, n));
        System.out.println("Elapsed: " + bundle.statistics().getElapsedMillis() + " ms");
    }

    private static void printSummary(GenerationBundle bundle) {
        EvaluationResult evaluation = bundle.evaluation();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 SYNTHESIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nRequested: " + bundle.statistics().getRequested());
        System.out.println("Accepted: " + bundle.statistics().getAccepted()
                + " (recovered " + bundle.statistics().getRecovered() + ")");
        System.out.println("Rejected: " + bundle.statistics().getRejected());
        System.out.println("Attempts: " + bundle.statistics().getAttempts());

        System.out.println("\nQuality tiers:");
        System.out.println("  🟢 High: " + bundle.qualityTiers().high().size());
        System.out.println("  🟡 Medium: " + bundle.qualityTiers().medium().size());
        System.out.println("  🔴 Low: " + bundle.qualityTiers().low().size());

        System.out.println("\nEvaluation:");
        System.out.printf("  Faithfulness: %.1f%%%n", evaluation.direct().faithfulness() * 100);
        System.out.printf("  Diversity:    %.1f%%%n", evaluation.direct().diversity() * 100);
        System.out.printf("  Direct:       %.1f%%%n", evaluation.direct().overall() * 100);
        System.out.printf("  Indirect:     %.1f%%%n", evaluation.indirect().overall() * 100);

        if (bundle.size() < bundle.statistics().getRequested()) {
            System.out.println("\n💡 Fewer records than requested; see top rejection issues in the report.");
        }
    }
}
